package com.quill.ai;

/**
 * Sampling settings for one generation call.
 */
public record GenerationOptions(double temperature, int maxTokens) {

    /** Low temperature for SQL generation and correction. */
    public static final GenerationOptions SQL = new GenerationOptions(0.1, 1000);

    /** Short, livelier prose for result summaries. */
    public static final GenerationOptions SUMMARY = new GenerationOptions(0.7, 200);
}
