package com.cronhooks.template;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateTokenizerTest {

    @Test
    void splitsLiteralsAndPlaceholders() {
        List<TemplateToken> tokens = TemplateTokenizer.tokenize("Hello {{name}}, bye");

        assertThat(tokens).extracting(TemplateToken::getKind).containsExactly(
                TemplateToken.Kind.LITERAL, TemplateToken.Kind.PLACEHOLDER, TemplateToken.Kind.LITERAL);
        assertThat(tokens.get(1).getName()).isEqualTo("name");
        assertThat(tokens.get(1).getText()).isEqualTo("{{name}}");
    }

    @Test
    void unterminatedPlaceholderIsLiteral() {
        List<TemplateToken> tokens = TemplateTokenizer.tokenize("value {{open");

        assertThat(tokens).hasSize(1);
        assertThat(tokens.get(0).getText()).isEqualTo("value {{open");
    }

    @Test
    void emptyNameIsLiteral() {
        List<TemplateToken> tokens = TemplateTokenizer.tokenize("{{}}");

        assertThat(tokens).noneMatch(TemplateToken::isPlaceholder);
        assertThat(join(tokens)).isEqualTo("{{}}");
    }

    @Test
    void extraOpeningBracesStayLiteral() {
        List<TemplateToken> tokens = TemplateTokenizer.tokenize("{{{{x}}");

        assertThat(join(tokens)).isEqualTo("{{{{x}}");
        assertThat(tokens).filteredOn(TemplateToken::isPlaceholder)
                .extracting(TemplateToken::getName)
                .containsExactly("x");
    }

    @Test
    void namesCannotSpanLines() {
        List<TemplateToken> tokens = TemplateTokenizer.tokenize("{{a\nb}}");

        assertThat(tokens).noneMatch(TemplateToken::isPlaceholder);
    }

    @Test
    void jsonBracesAreNotPlaceholders() {
        String template = "{\"a\":{\"b\":\"{{v}}\"}}";
        List<TemplateToken> tokens = TemplateTokenizer.tokenize(template);

        assertThat(join(tokens)).isEqualTo(template);
        assertThat(tokens).filteredOn(TemplateToken::isPlaceholder)
                .extracting(TemplateToken::getName)
                .containsExactly("v");
    }

    private static String join(List<TemplateToken> tokens) {
        return tokens.stream().map(TemplateToken::getText).collect(Collectors.joining());
    }
}
