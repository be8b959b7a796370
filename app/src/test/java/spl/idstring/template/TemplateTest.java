package spl.idstring.template;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class TemplateTest {

    @Test
    void sortsAndJoinsListValues() {
        Template template = Template.parse("{{ x|sort|join:\",\" }}");

        assertThat(template.render(Map.of("x", List.of("b", "a", "c")), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("a,b,c");
    }

    @Test
    void sortsAndJoinsWithQuotedSemicolon() {
        Template template = Template.parse("{{ x|sort|join:\";\" }}");

        assertThat(template.render(Map.of("x", List.of("b", "a", "c")), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("a;b;c");
    }

    @Test
    void templateWithoutVariablesRendersUnchanged() {
        assertThat(Template.parse("plain text").render(Map.of(), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("plain text");
    }

    @Test
    void unresolvedVariablesAllRenderAsPlaceholders() {
        Template template = Template.parse("{{ a }}{{ b|sort|join:\";\" }}");

        assertThat(template.render(Map.of(), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("{{ a }}{{ b }}");
    }

    @Test
    void joinsListsWithSemicolonByDefault() {
        Template template = Template.parse("[{{ x }}]");

        assertThat(template.render(Map.of("x", List.of("b", "a")), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("[b;a]");
    }

    @Test
    void keepsPlaceholderForUnknownVariable() {
        Template template = Template.parse("/a={{ missing|sort }}/b={{ known }}");

        assertThat(template.render(Map.of("known", "k"), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("/a={{ missing }}/b=k");
    }

    @Test
    void strictRenderingFailsOnUnknownVariable() {
        Template template = Template.parse("{{ missing }}");

        assertThatThrownBy(() -> template.render(Map.of(), UnresolvedVariablePolicy.FAIL))
                .isInstanceOf(TemplateRenderException.class)
                .hasMessage("Unresolved template variable: missing");
    }

    @Test
    void rendersNullAsEmptyAndNumbersAsText() {
        Map<String, Object> context = new HashMap<>();
        context.put("n", null);
        context.put("i", 42);

        assertThat(Template.parse("{{ n }}|{{ i }}").render(context, UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("|42");
    }

    @Test
    void transformsPassScalarValuesThrough() {
        assertThat(Template.parse("{{ x|sort|join:\"-\" }}").render(Map.of("x", "scalar"), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("scalar");
    }

    @Test
    void sortsIntegersNumerically() {
        assertThat(Template.parse("{{ x|sort }}").render(Map.of("x", List.of(10, 9, 2)), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("2;9;10");
    }

    @Test
    void sortsMixedValuesByRenderedText() {
        assertThat(Template.parse("{{ x|sort }}").render(Map.of("x", List.of("b", 10, "a")), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("10;a;b");
    }

    @Test
    void sortsRenderablesByTheirText() {
        Renderable b = () -> "b";
        Renderable a = () -> "a";

        assertThat(Template.parse("{{ x|sort|join:\",\" }}").render(Map.of("x", List.of(b, a)), UnresolvedVariablePolicy.PLACEHOLDER)).isEqualTo("a,b");
    }

    @Test
    void validationRejectsUnknownTransform() {
        Template template = Template.parse("{{ x|reverse }}");

        assertThatThrownBy(template::validate)
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessage("Unknown transform: reverse");
    }

    @Test
    void validationRejectsWrongParameterCount() {
        assertThatThrownBy(() -> Template.parse("{{ x|join }}").validate())
                .isInstanceOf(TemplateSyntaxException.class)
                .hasMessageContaining("'join' expects 1 parameter(s)");
    }

    @Test
    void keepsSourceText() {
        Template template = Template.parse("{{ name }}:{{ value|sort }}:{{ name }}");

        assertThat(template.source()).isEqualTo("{{ name }}:{{ value|sort }}:{{ name }}");
        assertThat(template).hasToString("{{ name }}:{{ value|sort }}:{{ name }}");
    }
}
