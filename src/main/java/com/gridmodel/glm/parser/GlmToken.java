package com.gridmodel.glm.parser;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * Represents a token from the GLM tokenizer.
 */
@Data
@AllArgsConstructor
public class GlmToken {
    private TokenType type;
    private String value;
    private int line;

    public enum TokenType {
        OPEN_BRACE,
        CLOSE_BRACE,
        SEMICOLON,
        /** Line breaks are kept: schedule and shape bodies end at them, not at ';'. */
        NEWLINE,
        TEXT,
        EOF
    }

    /**
     * True for tokens that end a statement.
     */
    public boolean isTerminator() {
        return type == TokenType.OPEN_BRACE || type == TokenType.CLOSE_BRACE
                || type == TokenType.SEMICOLON || type == TokenType.NEWLINE;
    }

    public boolean isText(String text) {
        return type == TokenType.TEXT && value.equals(text);
    }
}
