/**
 *
 */
package org.theseed.cobra.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * This object represents a reaction present in a metabolic model.  The reaction contains the
 * stoichiometry of the metabolites involved (negative for reactants, positive for products),
 * the flux bounds, the objective coefficient, and the rule for the genes that trigger it.
 *
 * The reaction is reversible if its lower bound is negative.
 */
public class Reaction {

    // FIELDS
    /** unique reaction ID */
    private final String id;
    /** descriptive name */
    private String name;
    /** map of metabolite IDs to stoichiometric coefficients */
    private Map<String, Double> stoichiometry;
    /** lower flux bound */
    private double lowerBound;
    /** upper flux bound */
    private double upperBound;
    /** objective coefficient */
    private double objective;
    /** gene-reaction rule */
    private GeneRule rule;
    /** database annotations */
    private Annotations annotations;
    /** default absolute flux bound for reactions whose source has none */
    private static double DEFAULT_BOUND = 1000.0;

    /**
     * Construct an empty, irreversible reaction with default bounds.
     *
     * @param id	ID of the new reaction
     */
    public Reaction(String id) {
        this.id = id;
        this.name = "";
        this.stoichiometry = new LinkedHashMap<String, Double>();
        this.lowerBound = 0.0;
        this.upperBound = DEFAULT_BOUND;
        this.objective = 0.0;
        this.rule = GeneRule.EMPTY;
        this.annotations = new Annotations();
    }

    /**
     * Add a metabolite to the stoichiometry.  If the metabolite is already present, the
     * coefficients are combined, and if they cancel out the metabolite is removed.
     *
     * @param metabolite	ID of the metabolite
     * @param coeff			coefficient (negative for a reactant, positive for a product)
     */
    public Reaction addStoich(String metabolite, double coeff) {
        double newCoeff = this.stoichiometry.getOrDefault(metabolite, 0.0) + coeff;
        if (newCoeff == 0.0)
            this.stoichiometry.remove(metabolite);
        else
            this.stoichiometry.put(metabolite, newCoeff);
        return this;
    }

    /**
     * Set the bounds to the defaults for a reaction of the specified reversibility.
     *
     * @param reversible	TRUE if the reaction is reversible
     */
    public Reaction setDefaultBounds(boolean reversible) {
        this.lowerBound = (reversible ? -DEFAULT_BOUND : 0.0);
        this.upperBound = DEFAULT_BOUND;
        return this;
    }

    /**
     * @return the reaction ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the reaction name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @param name 	the name to set
     */
    public Reaction setName(String name) {
        this.name = Objects.toString(name, "");
        return this;
    }

    /**
     * @return the stoichiometry map (metabolite ID to coefficient)
     */
    public Map<String, Double> getStoichiometry() {
        return Collections.unmodifiableMap(this.stoichiometry);
    }

    /**
     * @return the lower flux bound
     */
    public double getLowerBound() {
        return this.lowerBound;
    }

    /**
     * @param lowerBound 	the lower bound to set
     */
    public Reaction setLowerBound(double lowerBound) {
        this.lowerBound = lowerBound;
        return this;
    }

    /**
     * @return the upper flux bound
     */
    public double getUpperBound() {
        return this.upperBound;
    }

    /**
     * @param upperBound 	the upper bound to set
     */
    public Reaction setUpperBound(double upperBound) {
        this.upperBound = upperBound;
        return this;
    }

    /**
     * @return the objective coefficient
     */
    public double getObjective() {
        return this.objective;
    }

    /**
     * @param objective 	the objective coefficient to set
     */
    public Reaction setObjective(double objective) {
        this.objective = objective;
        return this;
    }

    /**
     * @return the gene-reaction rule (never NULL)
     */
    public GeneRule getRule() {
        return this.rule;
    }

    /**
     * @param rule 	the gene-reaction rule to set (NULL means no rule)
     */
    public Reaction setRule(GeneRule rule) {
        this.rule = (rule == null ? GeneRule.EMPTY : rule);
        return this;
    }

    /**
     * @return the annotations
     */
    public Annotations getAnnotations() {
        return this.annotations;
    }

    /**
     * @return TRUE if this reaction can run backward
     */
    public boolean isReversible() {
        return this.lowerBound < 0.0;
    }

    /**
     * @return a human-readable formula for this reaction
     */
    public String getFormula() {
        return ReactionFormula.format(this.stoichiometry, this.isReversible());
    }

    /**
     * @return the default absolute flux bound
     */
    public static double getDefaultBound() {
        return DEFAULT_BOUND;
    }

    /**
     * Specify a new default absolute flux bound.
     *
     * @param bound		the bound used for reactions whose source specifies none
     */
    public static void setDefaultBound(double bound) {
        DEFAULT_BOUND = bound;
    }

    @Override
    public String toString() {
        return "Reaction " + this.id + " (" + this.name + ")";
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.name, this.stoichiometry, this.lowerBound, this.upperBound,
                this.objective, this.rule, this.annotations);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Reaction other = (Reaction) obj;
        return this.id.equals(other.id) && this.name.equals(other.name)
                && this.stoichiometry.equals(other.stoichiometry)
                && Double.compare(this.lowerBound, other.lowerBound) == 0
                && Double.compare(this.upperBound, other.upperBound) == 0
                && Double.compare(this.objective, other.objective) == 0
                && this.rule.equals(other.rule) && this.annotations.equals(other.annotations);
    }

}
