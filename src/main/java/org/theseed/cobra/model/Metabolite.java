/**
 *
 */
package org.theseed.cobra.model;

import java.util.Objects;

/**
 * This object represents a metabolite (chemical species in a compartment) in a metabolic model.
 * The ID is fixed at construction; the descriptive fields may be filled in afterward.
 */
public class Metabolite {

    // FIELDS
    /** unique ID of the metabolite */
    private final String id;
    /** descriptive name */
    private String name;
    /** ID of the containing compartment (empty if unknown) */
    private String compartment;
    /** electrical charge, or NULL if unknown */
    private Integer charge;
    /** chemical formula (empty if unknown) */
    private String formula;
    /** TRUE if this is a boundary (exchange) species */
    private boolean boundary;
    /** database annotations */
    private Annotations annotations;

    /**
     * Construct a blank metabolite.
     *
     * @param id		ID of the new metabolite
     */
    public Metabolite(String id) {
        this.id = id;
        this.name = "";
        this.compartment = "";
        this.charge = null;
        this.formula = "";
        this.boundary = false;
        this.annotations = new Annotations();
    }

    /**
     * @return the metabolite ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the metabolite name
     */
    public String getName() {
        return this.name;
    }

    /**
     * Specify the metabolite name.
     *
     * @param name 	the name to set (NULL is stored as an empty string)
     */
    public Metabolite setName(String name) {
        this.name = Objects.toString(name, "");
        return this;
    }

    /**
     * @return the compartment ID
     */
    public String getCompartment() {
        return this.compartment;
    }

    /**
     * Specify the compartment.
     *
     * @param compartment 	the compartment ID to set
     */
    public Metabolite setCompartment(String compartment) {
        this.compartment = Objects.toString(compartment, "");
        return this;
    }

    /**
     * @return the charge, or NULL if it is unknown
     */
    public Integer getCharge() {
        return this.charge;
    }

    /**
     * Specify the charge.
     *
     * @param charge 	the charge to set, or NULL if it is unknown
     */
    public Metabolite setCharge(Integer charge) {
        this.charge = charge;
        return this;
    }

    /**
     * @return the chemical formula
     */
    public String getFormula() {
        return this.formula;
    }

    /**
     * Specify the chemical formula.
     *
     * @param formula 	the formula to set
     */
    public Metabolite setFormula(String formula) {
        this.formula = Objects.toString(formula, "");
        return this;
    }

    /**
     * @return TRUE if this is a boundary species
     */
    public boolean isBoundary() {
        return this.boundary;
    }

    /**
     * Specify whether or not this is a boundary species.
     *
     * @param boundary 	TRUE for a boundary species
     */
    public Metabolite setBoundary(boolean boundary) {
        this.boundary = boundary;
        return this;
    }

    /**
     * @return the annotations
     */
    public Annotations getAnnotations() {
        return this.annotations;
    }

    @Override
    public String toString() {
        return "Metabolite " + this.id + " (" + this.name + ")";
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.name, this.compartment, this.charge, this.formula,
                this.boundary, this.annotations);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Metabolite other = (Metabolite) obj;
        return this.id.equals(other.id) && this.name.equals(other.name)
                && this.compartment.equals(other.compartment) && Objects.equals(this.charge, other.charge)
                && this.formula.equals(other.formula) && this.boundary == other.boundary
                && this.annotations.equals(other.annotations);
    }

}
