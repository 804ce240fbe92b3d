package com.smurthy.ai.tutor.model;

/**
 * Classified purpose of a query. Drives specialist routing and whether
 * the query is grounded with retrieved passages.
 */
public enum Intent {
    EXPLAIN(true),
    SOLVE(true),
    GRADE(true),
    ANALYZE(false);

    private final boolean requiresGrounding;

    Intent(boolean requiresGrounding) {
        this.requiresGrounding = requiresGrounding;
    }

    public boolean requiresGrounding() {
        return requiresGrounding;
    }

    public String label() {
        return name().toLowerCase();
    }
}
