/**
 *
 */
package org.theseed.cobra.io.sbml;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import javax.xml.stream.XMLStreamException;

import org.apache.commons.lang3.StringUtils;
import org.sbml.jsbml.CVTerm;
import org.sbml.jsbml.Compartment;
import org.sbml.jsbml.KineticLaw;
import org.sbml.jsbml.LocalParameter;
import org.sbml.jsbml.Model;
import org.sbml.jsbml.NamedSBase;
import org.sbml.jsbml.Parameter;
import org.sbml.jsbml.SBMLDocument;
import org.sbml.jsbml.SBMLReader;
import org.sbml.jsbml.SBMLWriter;
import org.sbml.jsbml.SBase;
import org.sbml.jsbml.Species;
import org.sbml.jsbml.SpeciesReference;
import org.sbml.jsbml.ext.fbc.And;
import org.sbml.jsbml.ext.fbc.Association;
import org.sbml.jsbml.ext.fbc.FBCConstants;
import org.sbml.jsbml.ext.fbc.FBCModelPlugin;
import org.sbml.jsbml.ext.fbc.FBCReactionPlugin;
import org.sbml.jsbml.ext.fbc.FBCSpeciesPlugin;
import org.sbml.jsbml.ext.fbc.FluxBound;
import org.sbml.jsbml.ext.fbc.FluxObjective;
import org.sbml.jsbml.ext.fbc.GeneProduct;
import org.sbml.jsbml.ext.fbc.GeneProductAssociation;
import org.sbml.jsbml.ext.fbc.GeneProductRef;
import org.sbml.jsbml.ext.fbc.LogicalOperator;
import org.sbml.jsbml.ext.fbc.Objective;
import org.sbml.jsbml.ext.fbc.Or;
import org.sbml.jsbml.xml.XMLNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.cobra.io.MalformedInputException;
import org.theseed.cobra.io.ModelIOException;
import org.theseed.cobra.io.ModelReader;
import org.theseed.cobra.io.ModelWriter;
import org.theseed.cobra.io.UnsupportedSbmlVersionException;
import org.theseed.cobra.io.sbml.IdentifierNormalizer.Type;
import org.theseed.cobra.model.Annotations;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.Gene;
import org.theseed.cobra.model.GeneRule;
import org.theseed.cobra.model.Metabolite;
import org.theseed.cobra.model.Reaction;

/**
 * This codec reads and writes SBML documents.
 *
 * On input, Level 1 and Level 2 documents, Level 3 Version 1 documents with no fbc package or fbc
 * version 1 or 2, and Level 3 Version 2 documents with no fbc package or fbc version 2 are
 * accepted.  The identifiers are normalized for the whole model, and then the metadata is merged.
 * The fbc fields and MIRIAM annotations take precedence over the legacy notes, except that the
 * notes charge overrides the species charge attribute in a Level 1 or Level 2 document.
 *
 * On output, the document is always Level 3 Version 1 with strict fbc version 2.  Bounds are
 * stored as shared parameters and the objective is a single maximization objective.  Notes are
 * never written, and annotation keys that cannot form an identifiers.org URI are dropped.
 */
public class SbmlModelCodec implements ModelReader, ModelWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SbmlModelCodec.class);
    /** identifier translator */
    private IdentifierNormalizer normalizer;
    /** pattern for an fbc namespace */
    private static final Pattern FBC_NAMESPACE = Pattern.compile("http://www\\.sbml\\.org/sbml/level3/version\\d+/fbc/version(\\d+)");
    /** pattern for an identifiers.org URI */
    private static final Pattern IDENTIFIERS_URI = Pattern.compile("https?://identifiers\\.org/(.+)");
    /** pattern for a MIRIAM URN */
    private static final Pattern MIRIAM_URN = Pattern.compile("urn:miriam:([^:]+):(.+)");
    /** pattern for a valid identifiers.org prefix */
    private static final Pattern VALID_KEY = Pattern.compile("[a-z0-9]+(?:[._-][a-z0-9]+)*");
    /** annotation key for URIs that are not identifiers.org references */
    public static final String URI_KEY = "uri";
    /** annotation key for EC numbers */
    public static final String EC_KEY = "ec-code";
    /** annotation key for subsystems */
    public static final String SUBSYSTEM_KEY = "subsystem";
    /** SBO term for a flux bound parameter */
    private static final int FLUX_BOUND_SBO = 625;
    /** ID of the output objective */
    private static final String OBJECTIVE_ID = "obj";

    /**
     * This object describes the header of an SBML document.
     */
    protected static class Header {

        /** SBML level */
        private int level;
        /** SBML version */
        private int version;
        /** fbc package version, or 0 if the package is not used */
        private int fbcVersion;

        /**
         * Describe the header of a parsed document.
         *
         * @param doc	SBML document to examine
         */
        protected Header(SBMLDocument doc) {
            this.level = doc.getLevel();
            this.version = doc.getVersion();
            this.fbcVersion = 0;
            for (String uri : doc.getDeclaredNamespaces().values()) {
                Matcher m = FBC_NAMESPACE.matcher(uri);
                if (m.matches())
                    this.fbcVersion = Integer.parseInt(m.group(1));
            }
            if (this.fbcVersion == 0) {
                if (doc.isPackageEnabled(FBCConstants.namespaceURI_L3V1V2))
                    this.fbcVersion = 2;
                else if (doc.isPackageEnabled(FBCConstants.namespaceURI_L3V1V1))
                    this.fbcVersion = 1;
            }
        }

        /**
         * @return TRUE if this combination is supported
         */
        public boolean isSupported() {
            boolean retVal;
            if (this.level == 1 || this.level == 2)
                retVal = (this.fbcVersion == 0);
            else if (this.level == 3 && this.version == 1)
                retVal = (this.fbcVersion <= 2);
            else if (this.level == 3 && this.version == 2)
                retVal = (this.fbcVersion == 0 || this.fbcVersion == 2);
            else
                retVal = false;
            return retVal;
        }

        /**
         * @return the SBML level
         */
        public int getLevel() {
            return this.level;
        }

        /**
         * @return the SBML version
         */
        public int getVersion() {
            return this.version;
        }

        /**
         * @return the fbc package version (0 if none)
         */
        public int getFbcVersion() {
            return this.fbcVersion;
        }

        /**
         * @return TRUE if this is a pre-Level 3 document
         */
        public boolean isLegacy() {
            return (this.level < 3);
        }

    }

    /**
     * Construct a new SBML codec.
     */
    public SbmlModelCodec() {
        this.normalizer = new IdentifierNormalizer();
    }

    @Override
    public String getCodecName() {
        return "sbml";
    }

    @Override
    public CobraModel read(File source) throws IOException {
        SBMLDocument doc;
        try {
            doc = new SBMLReader().readSBML(source);
        } catch (XMLStreamException e) {
            throw new MalformedInputException(this.getCodecName(), e.getMessage(), e);
        } catch (IOException e) {
            throw this.readFailure(source, e);
        }
        if (doc == null || doc.getLevel() <= 0)
            throw new MalformedInputException(this.getCodecName(), "File " + source + " is not an SBML document.");
        Header header = new Header(doc);
        if (! header.isSupported())
            throw new UnsupportedSbmlVersionException(header.getLevel(), header.getVersion(), header.getFbcVersion());
        log.debug("{} is SBML level {} version {} with fbc version {}.", source, header.getLevel(),
                header.getVersion(), header.getFbcVersion());
        if (! doc.isSetModel())
            throw new MalformedInputException(this.getCodecName(), "Document " + source + " contains no model.");
        return this.convert(doc.getModel(), header);
    }

    /**
     * @return the identifier of an SBML element (Level 1 elements are identified by name)
     *
     * @param element	element whose identifier is desired
     */
    private static String sbmlId(NamedSBase element) {
        String retVal = element.getId();
        if (StringUtils.isEmpty(retVal) && element.getLevel() == 1)
            retVal = element.getName();
        return StringUtils.defaultString(retVal);
    }

    /**
     * Convert an SBML model to a canonical model.
     *
     * @param sbmlModel		SBML model to convert
     * @param header		document header
     *
     * @return the canonical model
     *
     * @throws ModelIOException
     */
    protected CobraModel convert(Model sbmlModel, Header header) throws ModelIOException {
        final boolean legacy = header.isLegacy();
        FBCModelPlugin fbcModel = null;
        if (header.getFbcVersion() > 0)
            fbcModel = (FBCModelPlugin) sbmlModel.getExtension(FBCConstants.shortLabel);
        // Normalize the compartment IDs.
        List<String> compIds = new ArrayList<String>();
        for (Compartment comp : sbmlModel.getListOfCompartments())
            compIds.add(sbmlId(comp));
        Map<String, String> compMap = this.normalizer.stripPrefixes(Type.COMPARTMENT, compIds);
        // Normalize the species IDs.  The prefixes come off first, then the compartment suffixes,
        // and the escapes are restored last.
        List<String> speciesIds = new ArrayList<String>();
        for (Species species : sbmlModel.getListOfSpecies())
            speciesIds.add(sbmlId(species));
        Map<String, String> speciesStripped = this.normalizer.removePrefixes(Type.METABOLITE, speciesIds);
        Map<String, String> speciesComps = new LinkedHashMap<String, String>();
        Set<String> boundary = new HashSet<String>();
        for (Species species : sbmlModel.getListOfSpecies()) {
            String id = speciesStripped.get(sbmlId(species));
            String comp = compMap.getOrDefault(species.getCompartment(), StringUtils.defaultString(species.getCompartment()));
            speciesComps.put(id, comp);
            if (species.getBoundaryCondition())
                boundary.add(id);
        }
        Map<String, String> speciesSplit = this.normalizer.splitCompartments(speciesComps, boundary);
        Map<String, String> speciesMap = new HashMap<String, String>();
        for (String sbmlId : speciesIds)
            speciesMap.put(sbmlId, IdentifierNormalizer.unescape(speciesSplit.get(speciesStripped.get(sbmlId))));
        // Normalize the reaction and gene IDs.
        List<String> rxnIds = new ArrayList<String>();
        for (org.sbml.jsbml.Reaction rxn : sbmlModel.getListOfReactions())
            rxnIds.add(sbmlId(rxn));
        Map<String, String> rxnMap = this.normalizer.stripPrefixes(Type.REACTION, rxnIds);
        List<String> geneIds = new ArrayList<String>();
        if (fbcModel != null) {
            for (GeneProduct product : fbcModel.getListOfGeneProducts())
                geneIds.add(product.getId());
        }
        Map<String, String> geneMap = this.normalizer.stripPrefixes(Type.GENE, geneIds);
        // Now we can build the model.
        CobraModel.Builder builder = new CobraModel.Builder(IdentifierNormalizer.unescape(sbmlId(sbmlModel)));
        builder.setName(sbmlModel.getName());
        for (Compartment comp : sbmlModel.getListOfCompartments())
            builder.addCompartment(compMap.get(sbmlId(comp)), comp.getName());
        for (Species species : sbmlModel.getListOfSpecies()) {
            String sbmlId = sbmlId(species);
            builder.addMetabolite(this.convertSpecies(species, speciesMap.get(sbmlId),
                    speciesComps.get(speciesStripped.get(sbmlId)), legacy));
        }
        if (fbcModel != null) {
            for (GeneProduct product : fbcModel.getListOfGeneProducts()) {
                Gene gene = new Gene(geneMap.get(product.getId()));
                gene.setName(product.isSetName() ? product.getName() : product.getLabel());
                readCvTerms(product, gene.getAnnotations());
                builder.addGene(gene);
            }
        }
        for (org.sbml.jsbml.Reaction rxn : sbmlModel.getListOfReactions())
            builder.addReaction(this.convertReaction(rxn, sbmlModel, speciesMap, geneMap, rxnMap, header));
        if (fbcModel != null)
            this.applyFbcModelData(fbcModel, builder, rxnMap, header);
        // Genes that only appear in legacy notes need gene records.
        builder.ensureRuleGenes();
        return this.finishModel(builder);
    }

    /**
     * Convert an SBML species to a canonical metabolite.
     *
     * @param species		species to convert
     * @param id			canonical ID of the species
     * @param comp			canonical ID of the species compartment
     * @param legacy		TRUE for a Level 2 document
     *
     * @return the canonical metabolite
     */
    private Metabolite convertSpecies(Species species, String id, String comp, boolean legacy) {
        Metabolite retVal = new Metabolite(id);
        retVal.setName(species.getName());
        retVal.setBoundary(species.getBoundaryCondition());
        Integer charge = null;
        String formula = "";
        // Get the structured values.
        FBCSpeciesPlugin fbcSpecies = (FBCSpeciesPlugin) species.getExtension(FBCConstants.shortLabel);
        if (fbcSpecies != null) {
            if (fbcSpecies.isSetCharge())
                charge = fbcSpecies.getCharge();
            if (fbcSpecies.isSetChemicalFormula())
                formula = fbcSpecies.getChemicalFormula();
        }
        if (charge == null && legacy && species.isSetCharge())
            charge = species.getCharge();
        // Merge in the notes.
        Map<String, String> notes = parseNotes(species);
        String noteCharge = notes.get("CHARGE");
        if (noteCharge != null && noteCharge.trim().matches("[-+]?\\d+")) {
            int value = Integer.parseInt(noteCharge.trim().replace("+", ""));
            if (charge == null || legacy)
                charge = value;
            else if (charge != value)
                log.debug("Notes charge {} for {} superseded by structured charge {}.", value, id, charge);
        }
        String noteFormula = notes.get("FORMULA");
        if (StringUtils.isEmpty(formula) && ! StringUtils.isBlank(noteFormula))
            formula = noteFormula.trim();
        retVal.setCharge(charge);
        retVal.setFormula(formula);
        retVal.setCompartment(comp);
        readCvTerms(species, retVal.getAnnotations());
        return retVal;
    }

    /**
     * Convert an SBML reaction to a canonical reaction.
     *
     * @param rxn			reaction to convert
     * @param sbmlModel		parent SBML model
     * @param speciesMap	map of species IDs to canonical IDs
     * @param geneMap		map of gene product IDs to canonical IDs
     * @param rxnMap		map of reaction IDs to canonical IDs
     * @param header		document header
     *
     * @return the canonical reaction
     */
    private Reaction convertReaction(org.sbml.jsbml.Reaction rxn, Model sbmlModel, Map<String, String> speciesMap,
            Map<String, String> geneMap, Map<String, String> rxnMap, Header header) {
        Reaction retVal = new Reaction(rxnMap.get(sbmlId(rxn)));
        retVal.setName(rxn.getName());
        for (SpeciesReference ref : rxn.getListOfReactants())
            retVal.addStoich(speciesMap.getOrDefault(ref.getSpecies(), ref.getSpecies()), -stoichOf(ref));
        for (SpeciesReference ref : rxn.getListOfProducts())
            retVal.addStoich(speciesMap.getOrDefault(ref.getSpecies(), ref.getSpecies()), stoichOf(ref));
        retVal.setDefaultBounds(rxn.getReversible());
        FBCReactionPlugin fbcRxn = null;
        if (header.getFbcVersion() > 0)
            fbcRxn = (FBCReactionPlugin) rxn.getExtension(FBCConstants.shortLabel);
        // Version 2 bounds are parameter references.
        if (fbcRxn != null && header.getFbcVersion() >= 2) {
            if (fbcRxn.isSetLowerFluxBound()) {
                Parameter parm = sbmlModel.getParameter(fbcRxn.getLowerFluxBound());
                if (parm != null)
                    retVal.setLowerBound(parm.getValue());
            }
            if (fbcRxn.isSetUpperFluxBound()) {
                Parameter parm = sbmlModel.getParameter(fbcRxn.getUpperFluxBound());
                if (parm != null)
                    retVal.setUpperBound(parm.getValue());
            }
        }
        if (header.getFbcVersion() == 0 && rxn.isSetKineticLaw())
            this.readKineticLaw(rxn.getKineticLaw(), retVal);
        // The structured gene rule takes precedence over the notes.
        Map<String, String> notes = parseNotes(rxn);
        GeneRule rule = GeneRule.EMPTY;
        if (fbcRxn != null && fbcRxn.isSetGeneProductAssociation()) {
            Association assoc = fbcRxn.getGeneProductAssociation().getAssociation();
            if (assoc != null)
                rule = convertAssociation(assoc, geneMap);
        }
        String noteRule = notes.getOrDefault("GENE_ASSOCIATION", notes.get("GENE ASSOCIATION"));
        if (rule.isEmpty() && ! StringUtils.isBlank(noteRule))
            rule = GeneRule.parse(noteRule);
        else if (! StringUtils.isBlank(noteRule))
            log.debug("Notes gene association for {} superseded by gene-product association.", retVal.getId());
        retVal.setRule(rule);
        Annotations annotations = retVal.getAnnotations();
        readCvTerms(rxn, annotations);
        String ec = notes.get("EC NUMBER");
        if (! StringUtils.isBlank(ec) && ! annotations.contains(EC_KEY)) {
            for (String number : StringUtils.split(ec, " ,;"))
                annotations.add(EC_KEY, number);
        }
        String subsystem = notes.get("SUBSYSTEM");
        if (! StringUtils.isBlank(subsystem) && ! annotations.contains(SUBSYSTEM_KEY))
            annotations.add(SUBSYSTEM_KEY, subsystem.trim());
        return retVal;
    }

    /**
     * @return the stoichiometric coefficient of a species reference (1 if it is unspecified)
     *
     * @param ref	species reference to examine
     */
    private static double stoichOf(SpeciesReference ref) {
        double retVal = ref.getStoichiometry();
        if (Double.isNaN(retVal))
            retVal = 1.0;
        return retVal;
    }

    /**
     * Apply the legacy kinetic-law flux parameters to a reaction.
     *
     * @param law		kinetic law to examine
     * @param reaction	reaction to update
     */
    private void readKineticLaw(KineticLaw law, Reaction reaction) {
        for (LocalParameter parm : law.getListOfLocalParameters()) {
            switch (sbmlId(parm)) {
            case "LOWER_BOUND" :
                reaction.setLowerBound(parm.getValue());
                break;
            case "UPPER_BOUND" :
                reaction.setUpperBound(parm.getValue());
                break;
            case "OBJECTIVE_COEFFICIENT" :
                reaction.setObjective(parm.getValue());
                break;
            default :
                log.debug("Kinetic-law parameter {} in reaction {} ignored.", sbmlId(parm), reaction.getId());
            }
        }
    }

    /**
     * Recursively convert a gene-product association into a gene rule.
     *
     * @param assoc		association tree to convert
     * @param geneMap	map of gene product IDs to canonical IDs
     *
     * @return the corresponding gene rule
     */
    private static GeneRule convertAssociation(Association assoc, Map<String, String> geneMap) {
        GeneRule retVal;
        if (assoc instanceof GeneProductRef) {
            String id = ((GeneProductRef) assoc).getGeneProduct();
            retVal = GeneRule.gene(geneMap.getOrDefault(id, IdentifierNormalizer.unescape(id)));
        } else {
            LogicalOperator op = (LogicalOperator) assoc;
            List<GeneRule> parts = new ArrayList<GeneRule>();
            for (Association child : op.getListOfAssociations())
                parts.add(convertAssociation(child, geneMap));
            retVal = (op instanceof Or ? GeneRule.or(parts) : GeneRule.and(parts));
        }
        return retVal;
    }

    /**
     * Apply the model-level fbc data:  version 1 flux bounds and the objective.
     *
     * @param fbcModel		fbc model plugin
     * @param builder		model builder containing the reactions
     * @param rxnMap		map of reaction IDs to canonical IDs
     * @param header		document header
     */
    private void applyFbcModelData(FBCModelPlugin fbcModel, CobraModel.Builder builder, Map<String, String> rxnMap,
            Header header) {
        if (header.getFbcVersion() == 1) {
            for (FluxBound bound : fbcModel.getListOfFluxBounds()) {
                Reaction reaction = builder.getReaction(rxnMap.get(bound.getReaction()));
                if (reaction == null)
                    log.debug("Flux bound {} references unknown reaction {}.", bound.getId(), bound.getReaction());
                else {
                    double value = bound.getValue();
                    switch (bound.getOperation()) {
                    case LESS_EQUAL :
                        reaction.setUpperBound(value);
                        break;
                    case GREATER_EQUAL :
                        reaction.setLowerBound(value);
                        break;
                    case EQUAL :
                        reaction.setLowerBound(value);
                        reaction.setUpperBound(value);
                        break;
                    default :
                        log.debug("Unsupported flux bound operation {} for {}.", bound.getOperation(), reaction.getId());
                    }
                }
            }
        }
        Objective objective = null;
        if (fbcModel.isSetActiveObjective())
            objective = fbcModel.getListOfObjectives().get(fbcModel.getActiveObjective());
        if (objective == null && fbcModel.getObjectiveCount() > 0)
            objective = fbcModel.getObjective(0);
        if (objective != null) {
            for (FluxObjective flux : objective.getListOfFluxObjectives()) {
                Reaction reaction = builder.getReaction(rxnMap.get(flux.getReaction()));
                if (reaction != null)
                    reaction.setObjective(flux.getCoefficient());
            }
        }
    }

    /**
     * Extract the key-value pairs from an element's notes.  Each paragraph of the form
     * "KEY: value" produces an entry; the keys are converted to upper case.
     *
     * @param element	element whose notes are desired
     *
     * @return a map of note keys to values
     */
    protected static Map<String, String> parseNotes(SBase element) {
        Map<String, String> retVal = new HashMap<String, String>();
        if (element.isSetNotes())
            collectNotes(element.getNotes(), retVal);
        return retVal;
    }

    /**
     * Recursively search a notes tree for paragraphs.
     *
     * @param node		node to search
     * @param notes		map of notes to update
     */
    private static void collectNotes(XMLNode node, Map<String, String> notes) {
        if (node.isElement() && "p".equals(node.getName())) {
            String text = StringUtils.normalizeSpace(nodeText(node));
            int colon = text.indexOf(':');
            if (colon > 0)
                notes.put(text.substring(0, colon).trim().toUpperCase(), text.substring(colon + 1).trim());
        } else {
            for (int i = 0; i < node.getChildCount(); i++)
                collectNotes(node.getChildAt(i), notes);
        }
    }

    /**
     * @return all the text contained in a notes node
     *
     * @param node	node whose text is desired
     */
    private static String nodeText(XMLNode node) {
        StringBuilder retVal = new StringBuilder();
        if (node.isText())
            retVal.append(node.getCharacters());
        for (int i = 0; i < node.getChildCount(); i++)
            retVal.append(nodeText(node.getChildAt(i)));
        return retVal.toString();
    }

    /**
     * Copy the controlled-vocabulary terms of an element into an annotation map.
     *
     * @param element		element containing the terms
     * @param annotations	annotation map to update
     */
    protected static void readCvTerms(SBase element, Annotations annotations) {
        for (CVTerm term : element.getCVTerms()) {
            for (String resource : term.getResources()) {
                Matcher m = IDENTIFIERS_URI.matcher(resource);
                Matcher m2 = MIRIAM_URN.matcher(resource);
                if (m.matches()) {
                    String ref = m.group(1);
                    int slash = ref.indexOf('/');
                    int colon = ref.indexOf(':');
                    if (slash > 0)
                        annotations.add(ref.substring(0, slash), ref.substring(slash + 1));
                    else if (colon > 0)
                        annotations.add(ref.substring(0, colon).toLowerCase(), ref.substring(colon + 1));
                    else
                        annotations.add(URI_KEY, resource);
                } else if (m2.matches())
                    annotations.add(m2.group(1), m2.group(2).replace("%3A", ":"));
                else
                    annotations.add(URI_KEY, resource);
            }
        }
    }

    @Override
    public void write(CobraModel model, File destination) throws IOException {
        SBMLDocument doc = this.createDocument(model);
        log.debug("Saving SBML document to {}.", destination);
        try {
            new SBMLWriter().write(doc, destination);
        } catch (Exception e) {
            if (e instanceof IOException)
                throw (IOException) e;
            throw new ModelIOException("Error writing SBML file " + destination + ": " + e.getMessage(), e);
        }
    }

    /**
     * Build an SBML document for a canonical model.
     *
     * @param model		model to convert
     *
     * @return a Level 3 Version 1 document using fbc version 2
     */
    protected SBMLDocument createDocument(CobraModel model) {
        SBMLDocument retVal = new SBMLDocument(3, 1);
        retVal.enablePackage(FBCConstants.namespaceURI_L3V1V2);
        String modelId = (model.getId().isEmpty() ? "model" : IdentifierNormalizer.escape(model.getId()));
        if (! Character.isLetter(modelId.charAt(0)))
            modelId = "_" + modelId;
        Model sbmlModel = retVal.createModel(modelId);
        if (! model.getName().isEmpty())
            sbmlModel.setName(model.getName());
        FBCModelPlugin fbcModel = (FBCModelPlugin) sbmlModel.getPlugin(FBCConstants.shortLabel);
        fbcModel.setStrict(true);
        // Compartments.
        for (Map.Entry<String, String> comp : model.getCompartments().entrySet()) {
            Compartment sbmlComp = sbmlModel.createCompartment(this.normalizer.toSbmlId(Type.COMPARTMENT, comp.getKey()));
            sbmlComp.setName(comp.getValue());
            sbmlComp.setConstant(true);
        }
        // Species.
        Map<String, String> metComps = new LinkedHashMap<String, String>();
        Set<String> boundary = new HashSet<String>();
        for (Metabolite met : model.getMetabolites()) {
            metComps.put(met.getId(), met.getCompartment());
            if (met.isBoundary())
                boundary.add(met.getId());
        }
        Map<String, String> metIds = this.normalizer.toSbmlMetaboliteIds(metComps, boundary);
        for (Metabolite met : model.getMetabolites()) {
            Species species = sbmlModel.createSpecies(metIds.get(met.getId()));
            if (! met.getName().isEmpty())
                species.setName(met.getName());
            if (! met.getCompartment().isEmpty())
                species.setCompartment(this.normalizer.toSbmlId(Type.COMPARTMENT, met.getCompartment()));
            species.setBoundaryCondition(met.isBoundary());
            species.setHasOnlySubstanceUnits(false);
            species.setConstant(false);
            FBCSpeciesPlugin fbcSpecies = (FBCSpeciesPlugin) species.getPlugin(FBCConstants.shortLabel);
            if (met.getCharge() != null)
                fbcSpecies.setCharge(met.getCharge());
            if (! met.getFormula().isEmpty()) {
                try {
                    fbcSpecies.setChemicalFormula(met.getFormula());
                } catch (IllegalArgumentException e) {
                    log.debug("Formula \"{}\" of {} is not valid in SBML and was dropped.", met.getFormula(), met.getId());
                }
            }
            this.writeCvTerms(species, met.getAnnotations());
        }
        // Gene products.
        for (Gene gene : model.getGenes()) {
            GeneProduct product = fbcModel.createGeneProduct(this.normalizer.toSbmlId(Type.GENE, gene.getId()));
            product.setLabel(gene.getId());
            if (! gene.getName().isEmpty())
                product.setName(gene.getName());
            this.writeCvTerms(product, gene.getAnnotations());
        }
        // Reactions, with the bounds as shared parameters.
        Map<Double, String> sharedBounds = new HashMap<Double, String>();
        Objective objective = fbcModel.createObjective(OBJECTIVE_ID);
        objective.setType(Objective.Type.MAXIMIZE);
        fbcModel.setActiveObjective(OBJECTIVE_ID);
        for (Reaction reaction : model.getReactions()) {
            String rxnId = this.normalizer.toSbmlId(Type.REACTION, reaction.getId());
            org.sbml.jsbml.Reaction rxn = sbmlModel.createReaction(rxnId);
            if (! reaction.getName().isEmpty())
                rxn.setName(reaction.getName());
            rxn.setReversible(reaction.isReversible());
            rxn.setFast(false);
            for (Map.Entry<String, Double> stoich : reaction.getStoichiometry().entrySet()) {
                SpeciesReference ref = new SpeciesReference(3, 1);
                ref.setSpecies(metIds.get(stoich.getKey()));
                ref.setStoichiometry(Math.abs(stoich.getValue()));
                ref.setConstant(true);
                if (stoich.getValue() < 0)
                    rxn.addReactant(ref);
                else
                    rxn.addProduct(ref);
            }
            FBCReactionPlugin fbcRxn = (FBCReactionPlugin) rxn.getPlugin(FBCConstants.shortLabel);
            fbcRxn.setLowerFluxBound(boundParameter(sbmlModel, sharedBounds, reaction.getLowerBound()));
            fbcRxn.setUpperFluxBound(boundParameter(sbmlModel, sharedBounds, reaction.getUpperBound()));
            if (! reaction.getRule().isEmpty()) {
                GeneProductAssociation gpa = new GeneProductAssociation(3, 1);
                gpa.setAssociation(this.createAssociation(reaction.getRule()));
                fbcRxn.setGeneProductAssociation(gpa);
            }
            if (reaction.getObjective() != 0.0) {
                FluxObjective flux = new FluxObjective(3, 1);
                flux.setReaction(rxnId);
                flux.setCoefficient(reaction.getObjective());
                objective.addFluxObjective(flux);
            }
            this.writeCvTerms(rxn, reaction.getAnnotations());
        }
        return retVal;
    }

    /**
     * Find or create the shared parameter for a flux bound value.
     *
     * @param sbmlModel		SBML model being built
     * @param sharedBounds	map of bound values to parameter IDs
     * @param value			bound value
     *
     * @return the ID of the parameter holding the value
     */
    private static String boundParameter(Model sbmlModel, Map<Double, String> sharedBounds, double value) {
        String retVal = sharedBounds.get(value);
        if (retVal == null) {
            if (value == -Reaction.getDefaultBound())
                retVal = "cobra_default_lb";
            else if (value == Reaction.getDefaultBound())
                retVal = "cobra_default_ub";
            else if (value == 0.0)
                retVal = "cobra_0_bound";
            else
                retVal = "cobra_bound_" + (sharedBounds.size() + 1);
            Parameter parm = sbmlModel.createParameter(retVal);
            parm.setValue(value);
            parm.setConstant(true);
            parm.setSBOTerm(FLUX_BOUND_SBO);
            sharedBounds.put(value, retVal);
        }
        return retVal;
    }

    /**
     * Recursively convert a gene rule into a gene-product association tree.
     *
     * @param rule		gene rule to convert
     *
     * @return the corresponding association
     */
    private Association createAssociation(GeneRule rule) {
        Association retVal;
        if (rule.getType() == GeneRule.Type.GENE) {
            GeneProductRef ref = new GeneProductRef(3, 1);
            ref.setGeneProduct(this.normalizer.toSbmlId(Type.GENE, rule.getGene()));
            retVal = ref;
        } else {
            LogicalOperator op = (rule.getType() == GeneRule.Type.AND ? new And(3, 1) : new Or(3, 1));
            for (GeneRule child : rule.getChildren())
                op.addAssociation(this.createAssociation(child));
            retVal = op;
        }
        return retVal;
    }

    /**
     * Store an annotation map as controlled-vocabulary terms.
     *
     * @param element		element to annotate
     * @param annotations	annotations to store
     */
    private void writeCvTerms(NamedSBase element, Annotations annotations) {
        if (! annotations.isEmpty()) {
            CVTerm term = new CVTerm(CVTerm.Qualifier.BQB_IS);
            for (String key : annotations.getKeys()) {
                if (key.equals(URI_KEY)) {
                    for (String value : annotations.get(key))
                        term.addResource(value);
                } else if (VALID_KEY.matcher(key).matches()) {
                    for (String value : annotations.get(key))
                        term.addResource("https://identifiers.org/" + key + "/" + value);
                } else
                    log.debug("Annotation key \"{}\" is not an identifiers.org prefix and was dropped.", key);
            }
            if (term.getResourceCount() > 0) {
                element.setMetaId("meta_" + element.getId());
                element.addCVTerm(term);
            }
        }
    }

}
