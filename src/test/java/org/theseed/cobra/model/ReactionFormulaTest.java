/**
 *
 */
package org.theseed.cobra.model;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ReactionFormulaTest {

    @Test
    void testParse() {
        ReactionFormula formula = new ReactionFormula("2 h2o[c] + atp[c] -> adp[c] + pi[c]");
        assertThat(formula.isReversible(), equalTo(false));
        Map<String, Double> stoich = formula.getStoichiometry();
        assertThat(stoich.size(), equalTo(4));
        assertThat(stoich.get("h2o[c]"), equalTo(-2.0));
        assertThat(stoich.get("atp[c]"), equalTo(-1.0));
        assertThat(stoich.get("adp[c]"), equalTo(1.0));
        assertThat(stoich.get("pi[c]"), equalTo(1.0));
        formula = new ReactionFormula("(0.5) o2[c] + h2[c] <=> h2o[c]");
        assertThat(formula.isReversible(), equalTo(true));
        assertThat(formula.getStoichiometry().get("o2[c]"), equalTo(-0.5));
        // An exchange reaction has an empty side.
        formula = new ReactionFormula("glc__D[e] <=>");
        assertThat(formula.isReversible(), equalTo(true));
        assertThat(formula.getStoichiometry().get("glc__D[e]"), equalTo(-1.0));
        assertThat(formula.getStoichiometry().size(), equalTo(1));
        // A metabolite on both sides is combined.
        formula = new ReactionFormula("2 h[c] + a[c] --> h[c] + b[c]");
        assertThat(formula.getStoichiometry().get("h[c]"), equalTo(-1.0));
        assertThrows(IllegalArgumentException.class, () -> new ReactionFormula("a[c] + b[c]"));
    }

    @Test
    void testFormat() {
        Map<String, Double> stoich = new LinkedHashMap<String, Double>();
        stoich.put("h2o[c]", -2.0);
        stoich.put("atp[c]", -1.0);
        stoich.put("adp[c]", 1.0);
        stoich.put("pi[c]", 1.5);
        assertThat(ReactionFormula.format(stoich, false), equalTo("2 h2o[c] + atp[c] -> adp[c] + 1.5 pi[c]"));
        assertThat(ReactionFormula.format(stoich, true), equalTo("2 h2o[c] + atp[c] <=> adp[c] + 1.5 pi[c]"));
        assertThat(ReactionFormula.format(Map.of("glc__D[e]", -1.0), true), equalTo("glc__D[e] <=>"));
        ReactionFormula parsed = new ReactionFormula(ReactionFormula.format(stoich, false));
        assertThat(parsed.getStoichiometry(), equalTo(stoich));
        assertThat(ReactionFormula.formatNumber(3.0), equalTo("3"));
        assertThat(ReactionFormula.formatNumber(0.25), equalTo("0.25"));
    }

}
