package com.typerace.partyservice.games.typing.domain.challenge;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 挑战文本生成器：从词库中均匀随机抽取若干单词，以空格拼接。
 *
 * <p>词库资源缺失或为空时退回内置词表，保证任何环境下都能开局。</p>
 */
@Slf4j
public class ChallengeTextGenerator {

    static final List<String> FALLBACK_WORDS = List.of(
            "keyboard", "river", "window", "silver", "garden", "planet", "rocket", "coffee",
            "shadow", "market", "bridge", "forest", "signal", "thunder", "pencil", "harbor");

    private final List<String> words;
    private final int wordCount;
    private final Random random;

    public ChallengeTextGenerator(List<String> words, int wordCount, Random random) {
        if (wordCount <= 0) {
            throw new IllegalArgumentException("wordCount must be positive: " + wordCount);
        }
        this.words = (words == null || words.isEmpty()) ? FALLBACK_WORDS : List.copyOf(words);
        this.wordCount = wordCount;
        this.random = random;
    }

    /**
     * 从 classpath 词库构建生成器。
     * @param location  词库路径（每行一个单词，# 开头为注释）
     * @param wordCount 每次生成的单词数
     */
    public static ChallengeTextGenerator fromClasspath(String location, int wordCount) {
        return new ChallengeTextGenerator(loadWords(new ClassPathResource(location)), wordCount, new SecureRandom());
    }

    public String next() {
        List<String> picked = new ArrayList<>(wordCount);
        for (int i = 0; i < wordCount; i++) {
            picked.add(words.get(random.nextInt(words.size())));
        }
        return String.join(" ", picked);
    }

    static List<String> loadWords(Resource resource) {
        if (!resource.exists()) {
            log.warn("挑战词库不存在，使用内置词表: {}", resource.getDescription());
            return List.of();
        }
        List<String> out = new ArrayList<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String w = StringUtils.trimToEmpty(line);
                if (StringUtils.isBlank(w) || w.startsWith("#")) continue;
                out.add(w);
            }
        } catch (IOException e) {
            log.warn("读取挑战词库失败，使用内置词表: {}", resource.getDescription(), e);
            return List.of();
        }
        log.info("挑战词库加载完成: {} 个单词", out.size());
        return out;
    }
}
