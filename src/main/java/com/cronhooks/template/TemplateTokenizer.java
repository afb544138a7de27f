package com.cronhooks.template;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits a template into literal spans and {@code {{name}}} placeholders.
 * A name may not be empty or contain braces or line breaks; anything else between
 * double braces stays literal text.
 */
public final class TemplateTokenizer {
    private static final String OPEN = "{{";
    private static final String CLOSE = "}}";

    private TemplateTokenizer() {}

    public static List<TemplateToken> tokenize(String template) {
        List<TemplateToken> tokens = new ArrayList<>();
        if (template == null || template.isEmpty()) {
            return tokens;
        }

        StringBuilder literal = new StringBuilder();
        int pos = 0;
        while (pos < template.length()) {
            int open = template.indexOf(OPEN, pos);
            if (open < 0) {
                literal.append(template, pos, template.length());
                break;
            }

            int close = template.indexOf(CLOSE, open + OPEN.length());
            if (close < 0) {
                literal.append(template, pos, template.length());
                break;
            }

            String name = template.substring(open + OPEN.length(), close);
            if (!isValidName(name)) {
                // Keep the first brace and rescan, "{{{{x}}" still finds "{{x}}"
                literal.append(template, pos, open + 1);
                pos = open + 1;
                continue;
            }

            literal.append(template, pos, open);
            if (literal.length() > 0) {
                tokens.add(TemplateToken.literal(literal.toString()));
                literal.setLength(0);
            }
            tokens.add(TemplateToken.placeholder(name));
            pos = close + CLOSE.length();
        }

        if (literal.length() > 0) {
            tokens.add(TemplateToken.literal(literal.toString()));
        }
        return tokens;
    }

    static boolean isValidName(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == '{' || c == '}' || c == '\n' || c == '\r') {
                return false;
            }
        }
        return true;
    }
}
