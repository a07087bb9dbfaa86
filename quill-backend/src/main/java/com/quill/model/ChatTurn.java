package com.quill.model;

/**
 * A previous question of the same conversation and the SQL that answered it.
 */
public record ChatTurn(String question, String sql) {
}
