package com.gridmodel.glm.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gridmodel.glm.parser.GlmToken.TokenType;

/**
 * Tokenizer for GLM model text.
 *
 * Splits on braces, semicolons and whitespace. Line breaks survive as
 * {@link TokenType#NEWLINE} tokens; all other whitespace only separates.
 */
public class GlmTokenizer {
    private static final Logger log = LoggerFactory.getLogger(GlmTokenizer.class);

    // Stylesheet URLs would otherwise be read as the start of a comment.
    private static final Pattern HTTP_PREFIX = Pattern.compile("http://");
    private static final Pattern LINE_COMMENT = Pattern.compile("//[^\n]*");

    private final String source;
    private int pos = 0;
    private int line = 1;

    public GlmTokenizer(String source) {
        this.source = preprocessSource(source);
    }

    private String preprocessSource(String src) {
        String cleaned = HTTP_PREFIX.matcher(src).replaceAll("");
        cleaned = LINE_COMMENT.matcher(cleaned).replaceAll("");
        return cleaned.replace("\r", "").replace('\t', ' ');
    }

    /**
     * Tokenize the entire source, ending with an EOF token.
     */
    public List<GlmToken> tokenize() {
        List<GlmToken> tokens = new ArrayList<>();

        while (pos < source.length()) {
            char c = source.charAt(pos);

            if (c == '\n') {
                tokens.add(new GlmToken(TokenType.NEWLINE, "\n", line));
                line++;
                pos++;
            } else if (Character.isWhitespace(c)) {
                pos++;
            } else if (c == '{') {
                tokens.add(new GlmToken(TokenType.OPEN_BRACE, "{", line));
                pos++;
            } else if (c == '}') {
                tokens.add(new GlmToken(TokenType.CLOSE_BRACE, "}", line));
                pos++;
            } else if (c == ';') {
                tokens.add(new GlmToken(TokenType.SEMICOLON, ";", line));
                pos++;
            } else {
                tokens.add(readText());
            }
        }

        tokens.add(new GlmToken(TokenType.EOF, "", line));
        log.debug("Tokenized {} tokens over {} lines", tokens.size(), line);
        return tokens;
    }

    private GlmToken readText() {
        int start = pos;
        while (pos < source.length()) {
            char c = source.charAt(pos);
            if (Character.isWhitespace(c) || c == '{' || c == '}' || c == ';') {
                break;
            }
            pos++;
        }
        return new GlmToken(TokenType.TEXT, source.substring(start, pos), line);
    }
}
