/**
 *
 */
package org.theseed.cobra.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

class GeneRuleTest {

    @Test
    void testParse() {
        GeneRule rule = GeneRule.parse("b0001 and b0002 or b0003");
        assertThat(rule.getType(), equalTo(GeneRule.Type.OR));
        assertThat(rule.getChildren().size(), equalTo(2));
        assertThat(rule.getChildren().get(0).getType(), equalTo(GeneRule.Type.AND));
        assertThat(rule.getChildren().get(1).getGene(), equalTo("b0003"));
        assertThat(rule.toString(), equalTo("(b0001 and b0002) or b0003"));
        assertThat(rule.getGenes(), contains("b0001", "b0002", "b0003"));
        // Alternate operators and case.
        GeneRule rule2 = GeneRule.parse("(b0001 & b0002) || b0003");
        assertThat(rule2, equalTo(rule));
        GeneRule rule3 = GeneRule.parse("b0001 AND (b0002 | b0003)");
        assertThat(rule3.toString(), equalTo("b0001 and (b0002 or b0003)"));
        // Nested operators of the same type are flattened.
        GeneRule rule4 = GeneRule.parse("((a or b) or c)");
        assertThat(rule4.getType(), equalTo(GeneRule.Type.OR));
        assertThat(rule4.getChildren().size(), equalTo(3));
        assertThat(rule4.toString(), equalTo("a or b or c"));
        GeneRule single = GeneRule.parse(" (b0004) ");
        assertThat(single.getType(), equalTo(GeneRule.Type.GENE));
        assertThat(single.toString(), equalTo("b0004"));
    }

    @Test
    void testEmpty() {
        assertThat(GeneRule.parse(null).isEmpty(), equalTo(true));
        assertThat(GeneRule.parse("  ").isEmpty(), equalTo(true));
        assertThat(GeneRule.EMPTY.toString(), equalTo(""));
        assertThat(GeneRule.EMPTY.getGenes(), empty());
        assertThat(GeneRule.and(List.of(GeneRule.EMPTY, GeneRule.gene("x"))), equalTo(GeneRule.gene("x")));
        assertThat(GeneRule.or(List.of()), sameInstance(GeneRule.EMPTY));
    }

    @Test
    void testErrors() {
        assertThrows(IllegalArgumentException.class, () -> GeneRule.parse("a and"));
        assertThrows(IllegalArgumentException.class, () -> GeneRule.parse("(a or b"));
        assertThrows(IllegalArgumentException.class, () -> GeneRule.parse("a or b)"));
        assertThrows(IllegalArgumentException.class, () -> GeneRule.parse("and a"));
    }

    @Test
    void testRename() {
        GeneRule rule = GeneRule.parse("G_a and (G_b or G_c)");
        GeneRule renamed = rule.rename(x -> x.substring(2));
        assertThat(renamed.toString(), equalTo("a and (b or c)"));
        assertThat(rule.toString(), equalTo("G_a and (G_b or G_c)"));
    }

}
