/**
 *
 */
package org.theseed.cobra.model;

import java.util.Objects;

/**
 * This object represents a gene referenced by the reaction rules of a metabolic model.
 */
public class Gene {

    // FIELDS
    /** unique gene ID */
    private final String id;
    /** gene name (empty if unknown) */
    private String name;
    /** database annotations */
    private Annotations annotations;

    /**
     * Construct a gene with no name.
     *
     * @param id	ID of the new gene
     */
    public Gene(String id) {
        this.id = id;
        this.name = "";
        this.annotations = new Annotations();
    }

    /**
     * @return the gene ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the gene name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @param name 	the name to set
     */
    public Gene setName(String name) {
        this.name = Objects.toString(name, "");
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
        return "Gene " + this.id;
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.name, this.annotations);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        Gene other = (Gene) obj;
        return this.id.equals(other.id) && this.name.equals(other.name)
                && this.annotations.equals(other.annotations);
    }

}
