package com.smurthy.ai.tutor.retrieval;

import java.util.List;

/**
 * Ordered grounding passages, best first. An empty context is valid and
 * means no grounding was found (or retrieval degraded).
 */
public record RetrievedContext(List<RetrievedPassage> passages) {

    private static final RetrievedContext EMPTY = new RetrievedContext(List.of());

    public RetrievedContext {
        passages = passages == null ? List.of() : List.copyOf(passages);
    }

    public static RetrievedContext empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return passages.isEmpty();
    }

    public int size() {
        return passages.size();
    }

    public List<String> sourceIds() {
        return passages.stream().map(RetrievedPassage::sourceId).toList();
    }

    /**
     * Passages limited to the first {@code limit}, for prompt injection.
     */
    public RetrievedContext top(int limit) {
        if (passages.size() <= limit) {
            return this;
        }
        return new RetrievedContext(passages.subList(0, limit));
    }
}
