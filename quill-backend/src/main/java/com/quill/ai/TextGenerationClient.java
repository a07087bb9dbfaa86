package com.quill.ai;

import java.util.List;
import java.util.function.Consumer;

/**
 * Opaque text-generation capability.
 */
public interface TextGenerationClient {

    /**
     * Single-shot completion.
     *
     * @param messages prompt
     * @param options sampling settings
     * @return best-effort completion text
     * @throws GenerationException if the capability is unavailable or fails
     */
    String generate(List<ChatMessage> messages, GenerationOptions options);

    /**
     * Incremental completion. Chunks are delivered in order on the calling thread.
     *
     * @param messages prompt
     * @param options sampling settings
     * @param onChunk receives each non-empty text chunk
     * @throws GenerationException if the capability is unavailable or fails
     */
    void generateStream(List<ChatMessage> messages, GenerationOptions options, Consumer<String> onChunk);
}
