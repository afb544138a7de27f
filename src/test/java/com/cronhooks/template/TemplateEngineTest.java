package com.cronhooks.template;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.BooleanNode;
import com.fasterxml.jackson.databind.node.IntNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TemplateEngineTest {

    private final TemplateEngine engine = new TemplateEngine();
    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void escapesStringValuesForJsonStringContext() {
        String rendered = engine.render("{{x}}\n", Collections.singletonMap("x", TextNode.valueOf("a\"b")));

        assertThat(rendered).isEqualTo("a\\\"b\n");
    }

    @Test
    void escapesLineBreaksAndTabs() {
        String rendered = engine.render("{\"text\":\"{{msg}}\"}",
                Collections.singletonMap("msg", TextNode.valueOf("line1\nline2\r\tend")));

        assertThat(rendered).isEqualTo("{\"text\":\"line1\\nline2\\r\\tend\"}");
    }

    @Test
    void leavesBackslashesAlone() {
        assertThat(TemplateEngine.escape("C:\\tmp")).isEqualTo("C:\\tmp");
    }

    @Test
    void writesNonStringValuesAsJson() throws Exception {
        Map<String, JsonNode> vars = new LinkedHashMap<>();
        vars.put("n", IntNode.valueOf(42));
        vars.put("b", BooleanNode.TRUE);
        vars.put("z", NullNode.getInstance());
        vars.put("obj", mapper.readTree("{\"k\":[1,2]}"));

        String rendered = engine.render("{{n}} {{b}} {{z}} {{obj}}", vars);

        assertThat(rendered).isEqualTo("42 true null {\"k\":[1,2]}");
    }

    @Test
    void missingReminderRendersEmpty() {
        assertThat(engine.render("{{REMINDER}}", Collections.emptyMap())).isEmpty();
        assertThat(engine.render("Note: {{REMINDER}}!", null)).isEqualTo("Note: !");
    }

    @Test
    void unknownPlaceholderStaysVerbatim() {
        String rendered = engine.render("{{known}} {{unknown}}", Collections.singletonMap("known", TextNode.valueOf("yes")));

        assertThat(rendered).isEqualTo("yes {{unknown}}");
    }

    @Test
    void substitutedValuesAreNotRescanned() {
        Map<String, JsonNode> vars = new LinkedHashMap<>();
        vars.put("a", TextNode.valueOf("{{b}}"));
        vars.put("b", TextNode.valueOf("boom"));

        assertThat(engine.render("{{a}}", vars)).isEqualTo("{{b}}");
    }

    @Test
    void sameNameIsReplacedEverywhere() {
        String rendered = engine.render("{{x}}-{{x}}", Collections.singletonMap("x", IntNode.valueOf(7)));

        assertThat(rendered).isEqualTo("7-7");
    }

    @Test
    void renderReminderInjectsText() {
        String rendered = engine.renderReminder("{\"text\":\"Reminder: {{REMINDER}}\"}", "Call \"Bob\"");

        assertThat(rendered).isEqualTo("{\"text\":\"Reminder: Call \\\"Bob\\\"\"}");
    }

    @Test
    void emptyAndNullTemplatesPassThrough() {
        assertThat(engine.render("", Collections.emptyMap())).isEmpty();
        assertThat(engine.render(null, Collections.emptyMap())).isNull();
    }
}
