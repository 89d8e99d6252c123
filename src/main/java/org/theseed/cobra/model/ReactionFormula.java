/**
 *
 */
package org.theseed.cobra.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;

/**
 * This object represents a parsed reaction formula, such as "2 h2o[c] + atp[c] -&gt; adp[c] + pi[c]".
 * Reactants are on the left and products on the right.  The arrow is "&lt;=&gt;" for a reversible
 * reaction and "-&gt;" for an irreversible one; "&lt;-&gt;", "--&gt;" and "=&gt;" are accepted on input.
 */
public class ReactionFormula {

    // FIELDS
    /** map of metabolite IDs to signed coefficients */
    private Map<String, Double> stoichiometry;
    /** TRUE if the formula used a reversible arrow */
    private boolean reversible;
    /** pattern for a formula arrow */
    private static final Pattern ARROW = Pattern.compile("\\s*(<=>|<->|<==>|-->|->|=>)\\s*");
    /** pattern for a term with a coefficient */
    private static final Pattern TERM = Pattern.compile("\\(?([0-9]*\\.?[0-9]+(?:[eE][-+]?[0-9]+)?)\\)?\\s+(\\S+)");
    /** pattern for separating terms */
    private static final Pattern PLUS = Pattern.compile("\\s+\\+\\s+");

    /**
     * Parse a reaction formula.
     *
     * @param formula	formula string to parse
     *
     * @throws IllegalArgumentException if the formula is not well-formed
     */
    public ReactionFormula(String formula) {
        Matcher m = ARROW.matcher(formula);
        if (! m.find())
            throw new IllegalArgumentException("No reaction arrow found in formula \"" + formula + "\".");
        String arrow = m.group(1);
        this.reversible = arrow.startsWith("<");
        this.stoichiometry = new LinkedHashMap<String, Double>();
        this.parseSide(formula.substring(0, m.start()), -1.0, formula);
        this.parseSide(formula.substring(m.end()), 1.0, formula);
    }

    /**
     * Parse one side of a formula.
     *
     * @param side		text of the side to parse
     * @param sign		-1 for reactants, 1 for products
     * @param formula	full formula, for error messages
     */
    private void parseSide(String side, double sign, String formula) {
        String text = side.trim();
        if (! text.isEmpty()) {
            // A lone "+" on either end is tolerated for formulas with an empty side.
            text = StringUtils.removeEnd(StringUtils.removeStart(text, "+ "), " +").trim();
            for (String term : PLUS.split(text)) {
                term = term.trim();
                if (term.isEmpty() || term.equals("+"))
                    throw new IllegalArgumentException("Empty term in formula \"" + formula + "\".");
                double coeff = 1.0;
                String metabolite = term;
                Matcher m = TERM.matcher(term);
                if (m.matches()) {
                    coeff = Double.parseDouble(m.group(1));
                    metabolite = m.group(2);
                }
                if (coeff == 0.0)
                    throw new IllegalArgumentException("Zero coefficient for " + metabolite + " in formula \"" + formula + "\".");
                double newCoeff = this.stoichiometry.getOrDefault(metabolite, 0.0) + sign * coeff;
                if (newCoeff == 0.0)
                    this.stoichiometry.remove(metabolite);
                else
                    this.stoichiometry.put(metabolite, newCoeff);
            }
        }
    }

    /**
     * @return the stoichiometry map (metabolite IDs to signed coefficients)
     */
    public Map<String, Double> getStoichiometry() {
        return Collections.unmodifiableMap(this.stoichiometry);
    }

    /**
     * @return TRUE if the formula used a reversible arrow
     */
    public boolean isReversible() {
        return this.reversible;
    }

    /**
     * Format a stoichiometry map as a reaction formula.
     *
     * @param stoichiometry		map of metabolite IDs to signed coefficients
     * @param reversible		TRUE if the reaction is reversible
     *
     * @return the formula string
     */
    public static String format(Map<String, Double> stoichiometry, boolean reversible) {
        List<String> reactants = new ArrayList<String>();
        List<String> products = new ArrayList<String>();
        for (Map.Entry<String, Double> entry : stoichiometry.entrySet()) {
            double coeff = entry.getValue();
            String term = formatTerm(Math.abs(coeff), entry.getKey());
            if (coeff < 0)
                reactants.add(term);
            else
                products.add(term);
        }
        String arrow = (reversible ? " <=> " : " -> ");
        return (StringUtils.join(reactants, " + ") + arrow + StringUtils.join(products, " + ")).trim();
    }

    /**
     * @return a single formula term
     *
     * @param coeff			absolute coefficient
     * @param metabolite	metabolite ID
     */
    private static String formatTerm(double coeff, String metabolite) {
        String retVal;
        if (coeff == 1.0)
            retVal = metabolite;
        else
            retVal = formatNumber(coeff) + " " + metabolite;
        return retVal;
    }

    /**
     * @return a number formatted without a trailing ".0" if it is integral
     *
     * @param value		number to format
     */
    public static String formatNumber(double value) {
        String retVal;
        if (value == Math.rint(value) && Math.abs(value) < 1e15)
            retVal = String.valueOf((long) value);
        else
            retVal = String.valueOf(value);
        return retVal;
    }

}
