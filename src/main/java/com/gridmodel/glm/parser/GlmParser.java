package com.gridmodel.glm.parser;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.gridmodel.glm.config.GlmModelConfig;
import com.gridmodel.glm.diagnostics.ToolDiagnostics;
import com.gridmodel.glm.model.ClassDefItem;
import com.gridmodel.glm.model.ClockItem;
import com.gridmodel.glm.model.DirectiveItem;
import com.gridmodel.glm.model.EmbeddedConfigItem;
import com.gridmodel.glm.model.FieldedItem;
import com.gridmodel.glm.model.GlmItem;
import com.gridmodel.glm.model.ModelTree;
import com.gridmodel.glm.model.ModuleItem;
import com.gridmodel.glm.model.ObjectItem;
import com.gridmodel.glm.model.ScheduleItem;
import com.gridmodel.glm.parser.GlmToken.TokenType;

/**
 * Parser for GLM token streams.
 * Converts tokens into a {@link ModelTree} keyed in statement order.
 *
 * Tokens are gathered into a statement until a terminator ({, }, ;, a line
 * break, or a leading {@code shape}) and the statement is dispatched on its
 * first word and its terminator. Legacy syntax is normalized once the whole
 * tree is built.
 *
 * Malformed input never aborts parsing: stray closing braces and unclosed
 * blocks are reported to {@link ToolDiagnostics} and skipped.
 */
public class GlmParser {
    private static final Logger log = LoggerFactory.getLogger(GlmParser.class);

    private static final String SHAPE = "shape";
    private static final String SCHEDULE = "schedule";

    private final List<GlmToken> tokens;
    private final GlmModelConfig config;
    private int pos = 0;
    private int nextKey = 0;

    private final Deque<Integer> openKeys = new ArrayDeque<>();
    private final ModelTree tree = new ModelTree();

    public GlmParser(List<GlmToken> tokens, GlmModelConfig config) {
        this.tokens = tokens;
        this.config = config;
    }

    /**
     * Tokenize, parse and normalize model text in one step.
     */
    public static ModelTree parseText(String source, GlmModelConfig config, ToolDiagnostics diagnostics) {
        List<GlmToken> tokens = new GlmTokenizer(source).tokenize();
        return new GlmParser(tokens, config).parse(diagnostics);
    }

    public ModelTree parse(ToolDiagnostics diagnostics) {
        while (!isAtEnd()) {
            Statement statement = readStatement();
            dispatch(statement, diagnostics);
        }

        if (!openKeys.isEmpty()) {
            diagnostics.getWarnings().add(openKeys.size() + " block(s) not closed at end of model, starting with "
                    + tree.get(openKeys.peekLast()).describe());
        }

        new LegacySyntaxNormalizer(config).normalize(tree, diagnostics);

        log.debug("Parsed {} items", tree.size());
        return tree;
    }

    private void dispatch(Statement statement, ToolDiagnostics diagnostics) {
        List<String> words = statement.words;
        TokenType terminator = statement.terminator;
        String first = words.isEmpty() ? null : words.get(0);

        if (DirectiveItem.SET.equals(first) || DirectiveItem.INCLUDE.equals(first)) {
            DirectiveItem directive = DirectiveItem.builder()
                    .keyword(first)
                    .argument(joinFrom(words, 1))
                    .terminated(terminator == TokenType.SEMICOLON)
                    .sourceLine(statement.line)
                    .build();
            tree.put(nextKey++, directive);
            log.debug("Parsed directive: {} at line {}", directive.describe(), statement.line);
            if (terminator == TokenType.CLOSE_BRACE) {
                closeBlock(statement, diagnostics);
            }
            return;
        }

        if (SHAPE.equals(first) && words.size() == 1 && terminator == null && !isAtEnd()) {
            parseShape(statement, diagnostics);
            return;
        }

        if (terminator == TokenType.NEWLINE || terminator == TokenType.SEMICOLON || terminator == null) {
            if (openKeys.isEmpty()) {
                if (!words.isEmpty()) {
                    DirectiveItem directive = DirectiveItem.builder()
                            .keyword(first)
                            .argument(joinFrom(words, 1))
                            .terminated(true)
                            .sourceLine(statement.line)
                            .build();
                    tree.put(nextKey++, directive);
                    log.debug("Parsed statement: {} at line {}", directive.describe(), statement.line);
                }
            } else if (!words.isEmpty()) {
                addField(words, statement.line, diagnostics);
            }
            return;
        }

        if (terminator == TokenType.CLOSE_BRACE) {
            if (!words.isEmpty()) {
                addField(words, statement.line, diagnostics);
            }
            closeBlock(statement, diagnostics);
            return;
        }

        if (SCHEDULE.equals(first)) {
            parseSchedule(statement);
            return;
        }

        openBlock(statement);
    }

    private void openBlock(Statement statement) {
        List<String> words = statement.words;
        GlmItem item = createShell(words);
        item.setSourceLine(statement.line);

        int key = nextKey++;
        attach(key, item);
        openKeys.push(key);

        log.debug("Opened {} at line {}", item.describe(), statement.line);
    }

    private GlmItem createShell(List<String> words) {
        if (words.isEmpty() || words.size() > 2) {
            return EmbeddedConfigItem.builder().header(String.join(" ", words)).build();
        }

        String value = words.get(words.size() - 1);
        switch (words.get(0)) {
            case "object":
                return ObjectItem.builder().type(value).build();
            case "clock":
                return ClockItem.builder().build();
            case "module":
                return ModuleItem.builder().name(value).build();
            case "class":
                return ClassDefItem.builder().name(value).build();
            default:
                return EmbeddedConfigItem.builder().header(String.join(" ", words)).build();
        }
    }

    private void attach(int key, GlmItem item) {
        if (!openKeys.isEmpty()) {
            int parentKey = openKeys.peek();
            item.setParentKey(parentKey);
            ((FieldedItem) tree.get(parentKey)).addChild(key);
        }
        tree.put(key, item);
    }

    private void closeBlock(Statement statement, ToolDiagnostics diagnostics) {
        if (openKeys.isEmpty()) {
            diagnostics.getWarnings().add("Unbalanced '}' ignored at line " + statement.line);
            log.warn("Unbalanced '}' ignored at line {}", statement.line);
            return;
        }
        openKeys.pop();
    }

    private void addField(List<String> words, int line, ToolDiagnostics diagnostics) {
        FieldedItem target = (FieldedItem) tree.get(openKeys.peek());
        String key = words.get(0);
        String value = joinFrom(words, 1);

        if (target instanceof ClassDefItem classDef) {
            classDef.addDeclaration(key, value);
            return;
        }

        if (target.hasField(key)) {
            diagnostics.getWarnings().add("Field '" + key + "' of " + target.describe()
                    + " set more than once, last value kept (line " + line + ")");
        }
        target.putField(key, value);
    }

    /**
     * Shape values are free text that runs to the end of the line.
     */
    private void parseShape(Statement statement, ToolDiagnostics diagnostics) {
        List<GlmToken> body = new ArrayList<>();
        while (!isAtEnd() && peek().getType() != TokenType.NEWLINE) {
            body.add(advance());
        }
        if (!body.isEmpty() && body.get(body.size() - 1).getType() == TokenType.SEMICOLON) {
            body.remove(body.size() - 1);
        }

        if (openKeys.isEmpty()) {
            diagnostics.getWarnings().add("shape outside of any block ignored at line " + statement.line);
            return;
        }
        FieldedItem target = (FieldedItem) tree.get(openKeys.peek());
        target.putField(SHAPE, joinRaw(body));
    }

    /**
     * Consumes a schedule block through its matching closing brace. The
     * interior is kept line by line without further interpretation.
     */
    private void parseSchedule(Statement statement) {
        List<String> lines = new ArrayList<>();
        List<GlmToken> current = new ArrayList<>();
        int depth = 1;

        while (!isAtEnd()) {
            GlmToken token = advance();
            if (token.getType() == TokenType.OPEN_BRACE) {
                depth++;
            } else if (token.getType() == TokenType.CLOSE_BRACE) {
                depth--;
                if (depth == 0) {
                    break;
                }
            }
            if (token.getType() == TokenType.NEWLINE) {
                addLine(lines, current);
                current = new ArrayList<>();
            } else {
                current.add(token);
            }
        }
        addLine(lines, current);

        String name = statement.words.size() > 1 ? statement.words.get(1) : "";
        ScheduleItem schedule = ScheduleItem.builder()
                .name(name)
                .body(String.join("\n", lines))
                .sourceLine(statement.line)
                .build();
        attach(nextKey++, schedule);
        log.debug("Parsed schedule {} with {} line(s)", name, lines.size());
    }

    private static void addLine(List<String> lines, List<GlmToken> lineTokens) {
        String text = joinRaw(lineTokens);
        if (!text.isBlank()) {
            lines.add(text);
        }
    }

    private Statement readStatement() {
        Statement statement = new Statement();
        statement.line = peek().getLine();

        while (!isAtEnd()) {
            GlmToken token = advance();
            if (token.isTerminator()) {
                statement.terminator = token.getType();
                return statement;
            }
            statement.words.add(token.getValue());
            if (statement.words.size() == 1 && token.isText(SHAPE)) {
                return statement;
            }
        }
        return statement;
    }

    private static String joinFrom(List<String> words, int from) {
        if (words.size() <= from) {
            return "";
        }
        return String.join(" ", words.subList(from, words.size()));
    }

    /**
     * Joins token text with single spaces, keeping semicolons against the
     * word before them.
     */
    private static String joinRaw(List<GlmToken> raw) {
        StringBuilder sb = new StringBuilder();
        for (GlmToken token : raw) {
            if (sb.length() > 0 && token.getType() != TokenType.SEMICOLON) {
                sb.append(' ');
            }
            sb.append(token.getValue());
        }
        return sb.toString();
    }

    private boolean isAtEnd() {
        return peek().getType() == TokenType.EOF;
    }

    private GlmToken peek() {
        return tokens.get(pos);
    }

    private GlmToken advance() {
        GlmToken token = tokens.get(pos);
        if (!isAtEnd()) pos++;
        return token;
    }

    private static final class Statement {
        private final List<String> words = new ArrayList<>();
        private TokenType terminator;
        private int line;
    }
}
