package io.github.hotbrkm.campaignengine.agent.email.content;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("SpintaxExpander test")
class SpintaxExpanderTest {

    private final SpintaxExpander expander = new SpintaxExpander();

    @Test
    @DisplayName("Text without braces is returned unchanged")
    void expand_returnsPlainTextUnchanged() {
        String text = "Hello there, nothing to spin here.";

        assertThat(expander.expand(text, new Random(1))).isEqualTo(text);
    }

    @Test
    @DisplayName("Nested blocks resolve fully and leave no braces behind")
    void expand_resolvesNestedBlocks() {
        String text = "{Hi|Hello|{Hey|Howdy} there}, {reader|{dear|valued} {customer|friend}}!";
        Random random = new Random(7);

        for (int i = 0; i < 200; i++) {
            String expanded = expander.expand(text, random);
            assertThat(expanded).doesNotContain("{").doesNotContain("}").endsWith("!");
        }
    }

    @Test
    @DisplayName("Every option of a block is eventually drawn")
    void expand_drawsEveryOption() {
        Random random = new Random(3);
        java.util.Set<String> seen = new java.util.HashSet<>();

        for (int i = 0; i < 200; i++) {
            seen.add(expander.expand("{a|b|c}", random));
        }

        assertThat(seen).containsExactlyInAnyOrder("a", "b", "c");
    }

    @Test
    @DisplayName("Same seed gives the same expansion")
    void expand_isReproducibleWithSeed() {
        String text = "{Big|Huge|Massive} {sale|discount} on {shoes|{red|blue} shirts}";

        assertThat(expander.expand(text, new Random(42))).isEqualTo(expander.expand(text, new Random(42)));
    }

    @Test
    @DisplayName("Personalization placeholders are not treated as blocks")
    void expand_keepsPlaceholders() {
        String expanded = expander.expand("{Hi|Hello} {{first_name}}, see {{ company }}", new Random(5));

        assertThat(expanded).matches("(Hi|Hello) \\{\\{first_name}}, see \\{\\{ company }}");
    }

    @Test
    @DisplayName("countVariations multiplies option counts of independent blocks")
    void countVariations_multipliesBlocks() {
        assertThat(expander.countVariations("{a|b}{c|d|e}")).isEqualTo(6);
        assertThat(expander.countVariations("no blocks")).isEqualTo(1);
        assertThat(expander.countVariations("{a|{b|c}} and {x|y}")).isEqualTo(6);
        assertThat(expander.countVariations("{{first_name}} {a|b}")).isEqualTo(2);
    }

    @Test
    @DisplayName("Empty options are reported and rejected")
    void validate_reportsEmptyOptions() {
        assertThat(expander.validate("{a|}")).anyMatch(error -> error.contains("Empty"));
        assertThat(expander.validate("{|a}")).isNotEmpty();
        assertThat(expander.validate("{a||b}")).isNotEmpty();

        assertThatThrownBy(() -> expander.expand("{a|}"))
                .isInstanceOf(SpintaxSyntaxException.class);
    }

    @Test
    @DisplayName("Unbalanced braces are reported")
    void validate_reportsUnbalancedBraces() {
        List<String> errors = expander.validate("{a|b");

        assertThat(errors).anyMatch(error -> error.startsWith("Mismatched braces"));
        assertThat(expander.validate("a}b{")).isNotEmpty();
    }

    @Test
    @DisplayName("Nesting up to the max depth expands, one level more fails")
    void expand_enforcesMaxDepth() {
        assertThat(expander.expand(nested(10), new Random(1))).doesNotContain("{");

        assertThat(expander.validate(nested(11))).anyMatch(error -> error.contains("too deep"));
        assertThatThrownBy(() -> expander.expand(nested(11), new Random(1)))
                .isInstanceOf(SpintaxSyntaxException.class);
    }

    @Test
    @DisplayName("Weighted expansion never picks a zero-weight option")
    void expandWeighted_skipsZeroWeight() {
        Random random = new Random(11);

        for (int i = 0; i < 100; i++) {
            assertThat(expander.expandWeighted("{never:0|always:5}", random)).isEqualTo("always");
        }
    }

    @Test
    @DisplayName("Weighted expansion follows weights and defaults missing weights to 1")
    void expandWeighted_followsWeights() {
        Random random = new Random(99);
        int heavy = 0;
        for (int i = 0; i < 2000; i++) {
            if (expander.expandWeighted("{heavy:9|light}", random).equals("heavy")) {
                heavy++;
            }
        }

        assertThat(heavy).isBetween(1700, 1900);
    }

    @Test
    @DisplayName("A block where every weight is zero is a validation error")
    void validate_rejectsAllZeroWeights() {
        assertThat(expander.validate("{a:0|b:0}")).anyMatch(error -> error.contains("zero weight"));
    }

    @Test
    @DisplayName("An outer block whose weights are all zero is rejected before expansion")
    void validate_rejectsZeroWeightsOnOuterBlock() {
        assertThat(expander.validate("{{a|b}:0|c:0}")).anyMatch(error -> error.contains("zero weight"));

        assertThatThrownBy(() -> expander.expandWeighted("{{a|b}:0|c:0}", new Random(1)))
                .isInstanceOf(SpintaxSyntaxException.class);
    }

    @Test
    @DisplayName("Weights summing past the long range still expand")
    void expandWeighted_saturatesHugeWeights() {
        Random random = new Random(4);

        for (int i = 0; i < 20; i++) {
            assertThat(expander.expandWeighted("{a:9223372036854775807|b:1}", random)).isIn("a", "b");
            assertThat(expander.expandWeighted("{a:99999999999999999999|b:1}", random)).isIn("a", "b");
        }
    }

    @Test
    @DisplayName("Braces without a pipe stay as literal text, so CSS survives")
    void expand_keepsPipelessBracesLiteral() {
        String html = "<style>p { color: red; } @media (max-width: 600px) { td { width: 100%; } }</style>{Hi|Hello}";

        String expanded = expander.expand(html, new Random(8));

        assertThat(expanded).isIn(
                "<style>p { color: red; } @media (max-width: 600px) { td { width: 100%; } }</style>Hi",
                "<style>p { color: red; } @media (max-width: 600px) { td { width: 100%; } }</style>Hello");
        assertThat(expander.validate("<style>.empty {}</style>")).isEmpty();
        assertThat(expander.countVariations("p { color: red; } {a|b}")).isEqualTo(2);
    }

    @Test
    @DisplayName("A literal brace pair may sit inside an option")
    void expand_literalBracesInsideOption() {
        Random random = new Random(6);

        for (int i = 0; i < 50; i++) {
            assertThat(expander.expand("{use {x} here|plain}", random)).isIn("use {x} here", "plain");
        }
    }

    @Test
    @DisplayName("generateVariations returns distinct expansions only")
    void generateVariations_deduplicates() {
        List<String> variations = expander.generateVariations("{a|b}", 50, new Random(2));

        assertThat(variations).doesNotHaveDuplicates().hasSizeLessThanOrEqualTo(2);
    }

    private static String nested(int depth) {
        return "{a|".repeat(depth) + "b" + "}".repeat(depth);
    }
}
