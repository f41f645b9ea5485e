package com.typerace.partyservice.config;

import com.typerace.partyservice.games.typing.domain.enums.StartPolicy;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * 打字竞速房间相关配置（前缀 typing）。
 *
 * 支持通过 application.yml 或环境变量覆盖，例如：
 *   TYPING_ROUND_DURATION_MS=45000
 *   TYPING_ROUND_START_POLICY=require-ready
 */
@Data
@ConfigurationProperties(prefix = "typing")
public class TypingProperties {

    private Round round = new Round();

    private Challenge challenge = new Challenge();

    private Ws ws = new Ws();

    @Data
    public static class Round {
        /**
         * 单回合时长（毫秒），到期后由服务端权威结束回合
         */
        private long durationMs = 30_000L;

        /**
         * 开始指令的放行策略：permissive（任意状态均可开局）/ require-ready（仅 ready 状态可开局）
         */
        private StartPolicy startPolicy = StartPolicy.PERMISSIVE;
    }

    @Data
    public static class Challenge {
        /**
         * 每回合挑战文本的单词数
         */
        private int wordCount = 12;

        /**
         * 词库资源路径（classpath）
         */
        private String wordsLocation = "challenge/words.txt";
    }

    @Data
    public static class Ws {
        /**
         * 允许的跨域来源（开发时用 *，生产建议限制域名）
         */
        private List<String> allowedOriginPatterns = new ArrayList<>(List.of("*"));
    }
}
