package com.cronhooks.template;

/**
 * One span of a tokenized template: literal text or a {@code {{name}}} reference.
 */
public final class TemplateToken {

    public enum Kind { LITERAL, PLACEHOLDER }

    private final Kind kind;
    private final String text;
    private final String name;

    private TemplateToken(Kind kind, String text, String name) {
        this.kind = kind;
        this.text = text;
        this.name = name;
    }

    public static TemplateToken literal(String text) {
        return new TemplateToken(Kind.LITERAL, text, null);
    }

    public static TemplateToken placeholder(String name) {
        return new TemplateToken(Kind.PLACEHOLDER, "{{" + name + "}}", name);
    }

    public Kind getKind() { return kind; }

    /**
     * The exact source text of this token.
     */
    public String getText() { return text; }

    /**
     * The variable name, or null for literals.
     */
    public String getName() { return name; }

    public boolean isPlaceholder() {
        return kind == Kind.PLACEHOLDER;
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")";
    }
}
