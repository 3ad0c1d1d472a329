package com.gridmodel.glm.model;

import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

/**
 * A single-line statement at model level: {@code #set}, {@code #include},
 * {@code #define}, or any other zero-attribute statement such as
 * {@code module mysql;}.
 *
 * Terminated directives render as {@code <keyword> <argument>;}. Bare
 * directives ({@code #set x=1} without a semicolon) render without one.
 */
@Data
@EqualsAndHashCode(callSuper = true)
@NoArgsConstructor
public class DirectiveItem extends GlmItem {
    public static final String SET = "#set";
    public static final String INCLUDE = "#include";
    public static final String DEFINE = "#define";
    public static final String MODULE = "module";

    private String keyword;
    private String argument;
    private boolean terminated;

    @Builder
    public DirectiveItem(String keyword, String argument, boolean terminated, int sourceLine) {
        this.keyword = keyword;
        this.argument = argument != null ? argument : "";
        this.terminated = terminated;
        this.sourceLine = sourceLine;
    }

    public static DirectiveItem bare(String keyword, String argument) {
        return DirectiveItem.builder().keyword(keyword).argument(argument).build();
    }

    /**
     * True for {@code module <name>;}, which declares a module with no settings.
     */
    public boolean isModuleDeclaration() {
        return MODULE.equals(keyword);
    }

    /**
     * For {@code #set name=value} and {@code #define NAME=value}, the part
     * before the equals sign; otherwise null.
     */
    public String getVariableName() {
        int eq = argument.indexOf('=');
        return eq > 0 ? argument.substring(0, eq).trim() : null;
    }

    @Override
    public void accept(GlmItemVisitor visitor) {
        visitor.visit(this);
    }

    @Override
    public String describe() {
        return keyword + " " + argument;
    }
}
