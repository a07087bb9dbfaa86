package com.quill.ai;

import java.util.List;

/**
 * Sentence-embedding capability used for semantic column matching.
 */
public interface EmbeddingClient {

    /**
     * @return true if the client is configured; decided once at startup
     */
    boolean isAvailable();

    /**
     * Embed texts.
     *
     * @param inputs texts to embed
     * @return one vector per input, in input order
     * @throws GenerationException if the call fails
     */
    List<float[]> embed(List<String> inputs);
}
