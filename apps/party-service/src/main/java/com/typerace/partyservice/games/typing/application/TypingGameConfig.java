package com.typerace.partyservice.games.typing.application;

import com.typerace.partyservice.config.TypingProperties;
import com.typerace.partyservice.games.typing.domain.challenge.ChallengeTextGenerator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 打字房间领域组件的装配（领域对象保持无 Spring 注解，便于单测直接 new）。
 */
@Configuration
public class TypingGameConfig {

    @Bean
    public ChallengeTextGenerator challengeTextGenerator(TypingProperties properties) {
        TypingProperties.Challenge c = properties.getChallenge();
        return ChallengeTextGenerator.fromClasspath(c.getWordsLocation(), c.getWordCount());
    }
}
