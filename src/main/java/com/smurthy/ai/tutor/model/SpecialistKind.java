package com.smurthy.ai.tutor.model;

/**
 * The closed set of specialists. Declaration order is the fixed priority used
 * to break ties when configuration makes more than one specialist eligible.
 */
public enum SpecialistKind {
    CONTENT("content"),
    SOLVER("solver"),
    GRADER("grader"),
    ANALYST("analyst");

    private final String id;

    SpecialistKind(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }
}
