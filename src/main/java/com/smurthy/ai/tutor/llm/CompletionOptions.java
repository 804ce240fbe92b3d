package com.smurthy.ai.tutor.llm;

/**
 * Per-call generation options.
 *
 * @param taskType label used in logs and usage statistics (e.g. "grading")
 */
public record CompletionOptions(String taskType, double temperature, int maxTokens) {

    public static final CompletionOptions CONTENT_GENERATION = new CompletionOptions("content_generation", 0.7, 2048);
    public static final CompletionOptions SOLVING = new CompletionOptions("solving", 0.3, 1024);
    public static final CompletionOptions GRADING = new CompletionOptions("grading", 0.2, 512);
    public static final CompletionOptions QUIZ_GENERATION = new CompletionOptions("quiz_generation", 0.6, 1024);
    public static final CompletionOptions ANALYTICS = new CompletionOptions("analytics", 0.4, 1024);
}
