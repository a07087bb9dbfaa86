package com.quill.config;

import com.quill.ai.EmbeddingClient;
import com.quill.resolver.HybridMatchingStrategy;
import com.quill.resolver.LexicalMatchingStrategy;
import com.quill.resolver.MatchingStrategy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Chooses the column matching mode once, at startup.
 */
@Slf4j
@Configuration
public class MatchingConfiguration {

    @Bean
    public MatchingStrategy matchingStrategy(EmbeddingClient embeddingClient) {
        if (embeddingClient.isAvailable()) {
            log.info("Hybrid matching enabled (lexical + semantic)");
            return new HybridMatchingStrategy(embeddingClient);
        }
        log.info("Using lexical matching only (no embedding model configured)");
        return new LexicalMatchingStrategy();
    }
}
