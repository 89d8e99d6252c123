/**
 *
 */
package org.theseed.cobra.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;

/**
 * This object represents a constraint-based metabolic model in canonical form.  It is the common
 * representation produced by every model reader and consumed by every model writer.
 *
 * The model consists of an ordered list of metabolites, an ordered list of reactions, an ordered
 * list of genes, and a map of compartment IDs to compartment names.  Fields that a file format
 * carries but the canonical schema does not describe are kept as opaque extension values.
 *
 * A model is assembled by a {@link Builder}, which verifies the cross-reference invariants
 * before releasing it.
 */
public class CobraModel {

    // FIELDS
    /** model ID */
    private final String id;
    /** model name */
    private String name;
    /** list of metabolites */
    private final List<Metabolite> metabolites;
    /** list of reactions */
    private final List<Reaction> reactions;
    /** list of genes */
    private final List<Gene> genes;
    /** map of compartment IDs to names */
    private final Map<String, String> compartments;
    /** map of extension field names to opaque values */
    private final Map<String, Object> extensions;
    /** map of metabolite IDs to metabolites */
    private final Map<String, Metabolite> metaboliteMap;
    /** map of reaction IDs to reactions */
    private final Map<String, Reaction> reactionMap;
    /** map of gene IDs to genes */
    private final Map<String, Gene> geneMap;
    /** standard compartment names */
    private static final Map<String, String> COMPARTMENT_NAMES = Map.ofEntries(
            Map.entry("c", "cytosol"), Map.entry("e", "extracellular space"),
            Map.entry("p", "periplasm"), Map.entry("m", "mitochondria"),
            Map.entry("n", "nucleus"), Map.entry("x", "peroxisome"),
            Map.entry("r", "endoplasmic reticulum"), Map.entry("g", "golgi apparatus"),
            Map.entry("l", "lysosome"), Map.entry("v", "vacuole"),
            Map.entry("b", "boundary"), Map.entry("u", "thylakoid"),
            Map.entry("h", "chloroplast"), Map.entry("i", "inner mitochondrial compartment"));

    /**
     * This class is used to assemble a model.  Entities are added in order; the build step
     * checks the model invariants and produces the finished model.
     */
    public static class Builder {

        /** model ID */
        private String id;
        /** model name */
        private String name;
        /** metabolites, keyed by ID */
        private LinkedHashMap<String, Metabolite> metabolites;
        /** reactions, keyed by ID */
        private LinkedHashMap<String, Reaction> reactions;
        /** genes, keyed by ID */
        private LinkedHashMap<String, Gene> genes;
        /** compartment names, keyed by ID */
        private LinkedHashMap<String, String> compartments;
        /** extension fields */
        private LinkedHashMap<String, Object> extensions;
        /** list of problems found while adding entities */
        private List<String> problems;

        /**
         * Construct a builder for a new model.
         *
         * @param id	ID of the model
         */
        public Builder(String id) {
            this.id = Objects.toString(id, "");
            this.name = "";
            this.metabolites = new LinkedHashMap<String, Metabolite>();
            this.reactions = new LinkedHashMap<String, Reaction>();
            this.genes = new LinkedHashMap<String, Gene>();
            this.compartments = new LinkedHashMap<String, String>();
            this.extensions = new LinkedHashMap<String, Object>();
            this.problems = new ArrayList<String>();
        }

        /**
         * @param name	the model name to set
         */
        public Builder setName(String name) {
            this.name = Objects.toString(name, "");
            return this;
        }

        /**
         * Add a metabolite.  A duplicate ID is recorded as a problem.
         *
         * @param metabolite	metabolite to add
         */
        public Builder addMetabolite(Metabolite metabolite) {
            if (this.metabolites.containsKey(metabolite.getId()))
                this.problems.add("Duplicate metabolite ID \"" + metabolite.getId() + "\".");
            else
                this.metabolites.put(metabolite.getId(), metabolite);
            return this;
        }

        /**
         * Add a reaction.  A duplicate ID is recorded as a problem.
         *
         * @param reaction	reaction to add
         */
        public Builder addReaction(Reaction reaction) {
            if (this.reactions.containsKey(reaction.getId()))
                this.problems.add("Duplicate reaction ID \"" + reaction.getId() + "\".");
            else
                this.reactions.put(reaction.getId(), reaction);
            return this;
        }

        /**
         * Add a gene.  A duplicate ID is recorded as a problem.
         *
         * @param gene	gene to add
         */
        public Builder addGene(Gene gene) {
            if (this.genes.containsKey(gene.getId()))
                this.problems.add("Duplicate gene ID \"" + gene.getId() + "\".");
            else
                this.genes.put(gene.getId(), gene);
            return this;
        }

        /**
         * Add a compartment.  A duplicate ID is recorded as a problem.
         *
         * @param compartmentId		ID of the compartment
         * @param compartmentName	display name of the compartment (if blank, a standard
         * 							name is used)
         */
        public Builder addCompartment(String compartmentId, String compartmentName) {
            if (this.compartments.containsKey(compartmentId))
                this.problems.add("Duplicate compartment ID \"" + compartmentId + "\".");
            else {
                String realName = compartmentName;
                if (StringUtils.isBlank(realName))
                    realName = defaultCompartmentName(compartmentId);
                this.compartments.put(compartmentId, realName);
            }
            return this;
        }

        /**
         * Insure a compartment exists, adding it with its standard name if it does not.
         *
         * @param compartmentId		ID of the compartment
         */
        public Builder ensureCompartment(String compartmentId) {
            if (! StringUtils.isEmpty(compartmentId) && ! this.compartments.containsKey(compartmentId))
                this.compartments.put(compartmentId, defaultCompartmentName(compartmentId));
            return this;
        }

        /**
         * Insure all the genes referenced by the reaction rules exist, creating unnamed ones
         * as needed.
         */
        public Builder ensureRuleGenes() {
            for (Reaction reaction : this.reactions.values()) {
                for (String geneId : reaction.getRule().getGenes())
                    this.genes.computeIfAbsent(geneId, x -> new Gene(x));
            }
            return this;
        }

        /**
         * Store an extension field.
         *
         * @param fieldName		name of the field
         * @param value			opaque value of the field
         */
        public Builder setExtension(String fieldName, Object value) {
            this.extensions.put(fieldName, value);
            return this;
        }

        /**
         * @return the metabolite with the specified ID, or NULL if none has been added
         *
         * @param metId		ID of the desired metabolite
         */
        public Metabolite getMetabolite(String metId) {
            return this.metabolites.get(metId);
        }

        /**
         * @return the reaction with the specified ID, or NULL if none has been added
         *
         * @param rxnId		ID of the desired reaction
         */
        public Reaction getReaction(String rxnId) {
            return this.reactions.get(rxnId);
        }

        /**
         * @return TRUE if a gene with the specified ID has been added
         *
         * @param geneId	ID of the gene to check
         */
        public boolean hasGene(String geneId) {
            return this.genes.containsKey(geneId);
        }

        /**
         * Check the model invariants.
         *
         * @return a list of problems found (empty if the model is valid)
         */
        public List<String> validate() {
            List<String> retVal = new ArrayList<String>(this.problems);
            for (Metabolite met : this.metabolites.values()) {
                String comp = met.getCompartment();
                if (! comp.isEmpty() && ! this.compartments.containsKey(comp))
                    retVal.add("Metabolite " + met.getId() + " is in unknown compartment \"" + comp + "\".");
            }
            for (Reaction reaction : this.reactions.values()) {
                for (Map.Entry<String, Double> stoich : reaction.getStoichiometry().entrySet()) {
                    String metId = stoich.getKey();
                    double coeff = stoich.getValue();
                    if (! this.metabolites.containsKey(metId))
                        retVal.add("Reaction " + reaction.getId() + " references unknown metabolite \"" + metId + "\".");
                    if (coeff == 0.0 || ! Double.isFinite(coeff))
                        retVal.add("Reaction " + reaction.getId() + " has invalid coefficient " + coeff
                                + " for metabolite \"" + metId + "\".");
                }
                for (String geneId : reaction.getRule().getGenes()) {
                    if (! this.genes.containsKey(geneId))
                        retVal.add("Reaction " + reaction.getId() + " references unknown gene \"" + geneId + "\".");
                }
            }
            return retVal;
        }

        /**
         * Verify the model and build it.
         *
         * @return the finished model
         *
         * @throws IllegalStateException if the model is not valid
         */
        public CobraModel build() {
            List<String> errors = this.validate();
            if (! errors.isEmpty())
                throw new IllegalStateException("Invalid model " + this.id + ": " + StringUtils.join(errors, "  "));
            return new CobraModel(this);
        }

    }

    /**
     * Construct a model from a builder.
     *
     * @param builder	source builder
     */
    private CobraModel(Builder builder) {
        this.id = builder.id;
        this.name = builder.name;
        this.metabolites = Collections.unmodifiableList(new ArrayList<Metabolite>(builder.metabolites.values()));
        this.reactions = Collections.unmodifiableList(new ArrayList<Reaction>(builder.reactions.values()));
        this.genes = Collections.unmodifiableList(new ArrayList<Gene>(builder.genes.values()));
        this.compartments = Collections.unmodifiableMap(new LinkedHashMap<String, String>(builder.compartments));
        this.extensions = Collections.unmodifiableMap(new LinkedHashMap<String, Object>(builder.extensions));
        this.metaboliteMap = new HashMap<String, Metabolite>(builder.metabolites);
        this.reactionMap = new HashMap<String, Reaction>(builder.reactions);
        this.geneMap = new HashMap<String, Gene>(builder.genes);
    }

    /**
     * @return the standard name of a compartment, or the ID itself if the compartment is not
     * 		   a standard one
     *
     * @param compartmentId		ID of the compartment
     */
    public static String defaultCompartmentName(String compartmentId) {
        return COMPARTMENT_NAMES.getOrDefault(compartmentId, compartmentId);
    }

    /**
     * @return the model ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the model name
     */
    public String getName() {
        return this.name;
    }

    /**
     * @param name	the model name to set
     */
    public void setName(String name) {
        this.name = Objects.toString(name, "");
    }

    /**
     * @return the list of metabolites
     */
    public List<Metabolite> getMetabolites() {
        return this.metabolites;
    }

    /**
     * @return the list of reactions
     */
    public List<Reaction> getReactions() {
        return this.reactions;
    }

    /**
     * @return the list of genes
     */
    public List<Gene> getGenes() {
        return this.genes;
    }

    /**
     * @return the map of compartment IDs to names
     */
    public Map<String, String> getCompartments() {
        return this.compartments;
    }

    /**
     * @return the map of extension field names to values
     */
    public Map<String, Object> getExtensions() {
        return this.extensions;
    }

    /**
     * @return the metabolite with the specified ID, or NULL if there is none
     *
     * @param metId		ID of the desired metabolite
     */
    public Metabolite getMetabolite(String metId) {
        return this.metaboliteMap.get(metId);
    }

    /**
     * @return the reaction with the specified ID, or NULL if there is none
     *
     * @param rxnId		ID of the desired reaction
     */
    public Reaction getReaction(String rxnId) {
        return this.reactionMap.get(rxnId);
    }

    /**
     * @return the gene with the specified ID, or NULL if there is none
     *
     * @param geneId	ID of the desired gene
     */
    public Gene getGene(String geneId) {
        return this.geneMap.get(geneId);
    }

    /**
     * @return the set of annotation keys used by the metabolites, in order of first use
     */
    public Set<String> getMetaboliteAnnotationKeys() {
        Set<String> retVal = new LinkedHashSet<String>();
        for (Metabolite met : this.metabolites)
            retVal.addAll(met.getAnnotations().getKeys());
        return retVal;
    }

    /**
     * @return the set of annotation keys used by the reactions, in order of first use
     */
    public Set<String> getReactionAnnotationKeys() {
        Set<String> retVal = new LinkedHashSet<String>();
        for (Reaction reaction : this.reactions)
            retVal.addAll(reaction.getAnnotations().getKeys());
        return retVal;
    }

    /**
     * @return the number of boundary metabolites
     */
    public int getBoundaryCount() {
        return (int) this.metabolites.stream().filter(x -> x.isBoundary()).count();
    }

    @Override
    public String toString() {
        return "Model " + this.id + " (" + this.reactions.size() + " reactions, "
                + this.metabolites.size() + " metabolites, " + this.genes.size() + " genes)";
    }

    @Override
    public int hashCode() {
        return Objects.hash(this.id, this.name, this.metabolites, this.reactions, this.genes,
                this.compartments, this.extensions);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (obj == null)
            return false;
        if (getClass() != obj.getClass())
            return false;
        CobraModel other = (CobraModel) obj;
        return this.id.equals(other.id) && this.name.equals(other.name)
                && this.metabolites.equals(other.metabolites) && this.reactions.equals(other.reactions)
                && this.genes.equals(other.genes) && this.compartments.equals(other.compartments)
                && this.extensions.equals(other.extensions);
    }

}
