package com.smurthy.ai.tutor.model;

/**
 * A single prior message in the student's conversation with the tutor.
 */
public record ConversationTurn(String role, String text) {
}
