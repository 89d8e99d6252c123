/**
 *
 */
package org.theseed.cobra.io.mat;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.cobra.io.MalformedInputException;
import org.theseed.cobra.io.ModelReader;
import org.theseed.cobra.io.ModelWriter;
import org.theseed.cobra.model.Annotations;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.Gene;
import org.theseed.cobra.model.GeneRule;
import org.theseed.cobra.model.Metabolite;
import org.theseed.cobra.model.Reaction;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

import us.hebi.matlab.mat.format.Mat5;
import us.hebi.matlab.mat.format.Mat5File;
import us.hebi.matlab.mat.types.Array;
import us.hebi.matlab.mat.types.Cell;
import us.hebi.matlab.mat.types.Char;
import us.hebi.matlab.mat.types.MatFile;
import us.hebi.matlab.mat.types.MatlabType;
import us.hebi.matlab.mat.types.Matrix;
import us.hebi.matlab.mat.types.Struct;

/**
 * This codec reads and writes MATLAB save files containing a model struct.  This is the lossless
 * format:  every canonical field has a struct field, and any other struct fields are kept as
 * extension fields and written back unchanged.
 *
 * Extension values are held in memory as tagged JSON objects, so that the rest of the system can
 * treat them as opaque.  Character arrays, numeric and logical matrices (real or complex, of any
 * number of dimensions), cell arrays, and structs are supported.  A file with any other kind of
 * extension value is rejected.
 */
public class MatModelCodec implements ModelReader, ModelWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(MatModelCodec.class);
    /** name of this codec */
    public static final String CODEC_NAME = "matlab-struct";
    /** name of the model variable */
    public static final String VARIABLE_NAME = "model";
    /** names of the fields that hold canonical data */
    public static final Set<String> CANONICAL_FIELDS = Set.of("id", "description", "mets", "metNames", "metFormulas",
            "metCharges", "metComps", "metIsBoundary", "metAnnotations", "rxns", "rxnNames", "S", "lb", "ub", "c",
            "grRules", "rxnAnnotations", "genes", "geneNames", "geneAnnotations", "comps", "compNames");
    /** pattern for a metabolite ID with a compartment suffix */
    private static final Pattern COMPARTMENT_SUFFIX = Pattern.compile(".+\\[([^\\[\\]]+)\\]");

    @Override
    public String getCodecName() {
        return CODEC_NAME;
    }

    @Override
    public CobraModel read(File source) throws IOException {
        CobraModel retVal;
        try (Mat5File mat = Mat5.readFromFile(source)) {
            Struct struct = null;
            for (MatFile.Entry entry : mat.getEntries()) {
                Array value = entry.getValue();
                if (value instanceof Struct) {
                    if (entry.getName().equals(VARIABLE_NAME) || struct == null)
                        struct = (Struct) value;
                }
            }
            if (struct == null)
                throw new MalformedInputException(this.getCodecName(), "No model struct found in " + source + ".");
            retVal = this.convert(struct);
        } catch (IOException e) {
            throw this.readFailure(source, e);
        }
        return retVal;
    }

    /**
     * Convert a model struct to a canonical model.
     *
     * @param struct	model struct to convert
     *
     * @return the canonical model
     *
     * @throws MalformedInputException
     */
    protected CobraModel convert(Struct struct) throws MalformedInputException {
        List<String> fields = struct.getFieldNames();
        CobraModel.Builder builder = new CobraModel.Builder(this.getString(struct, "id"));
        builder.setName(this.getString(struct, "description"));
        // The compartments come first, so they take precedence over derived ones.
        List<String> comps = this.getStrings(struct, "comps");
        List<String> compNames = this.getStrings(struct, "compNames");
        for (int i = 0; i < comps.size(); i++)
            builder.addCompartment(comps.get(i), item(compNames, i));
        // Now the metabolites.
        List<String> mets = this.getStrings(struct, "mets");
        final int nMets = mets.size();
        List<String> metNames = this.getStrings(struct, "metNames");
        List<String> metFormulas = this.getStrings(struct, "metFormulas");
        List<String> metComps = this.getStrings(struct, "metComps");
        List<String> metAnnotations = this.getStrings(struct, "metAnnotations");
        double[] metCharges = this.getDoubles(struct, "metCharges", nMets, Double.NaN);
        double[] metIsBoundary = this.getDoubles(struct, "metIsBoundary", nMets, 0.0);
        for (int i = 0; i < nMets; i++) {
            String metId = mets.get(i);
            Metabolite met = new Metabolite(metId);
            met.setName(item(metNames, i));
            met.setFormula(item(metFormulas, i));
            if (! Double.isNaN(metCharges[i]))
                met.setCharge((int) Math.round(metCharges[i]));
            met.setBoundary(metIsBoundary[i] != 0.0);
            String comp = item(metComps, i);
            if (comp.isEmpty()) {
                Matcher m = COMPARTMENT_SUFFIX.matcher(metId);
                if (m.matches())
                    comp = m.group(1);
            }
            met.setCompartment(comp);
            builder.ensureCompartment(comp);
            this.readAnnotations(item(metAnnotations, i), met.getAnnotations());
            builder.addMetabolite(met);
        }
        // The genes.
        List<String> genes = this.getStrings(struct, "genes");
        List<String> geneNames = this.getStrings(struct, "geneNames");
        List<String> geneAnnotations = this.getStrings(struct, "geneAnnotations");
        for (int i = 0; i < genes.size(); i++) {
            Gene gene = new Gene(genes.get(i));
            gene.setName(item(geneNames, i));
            this.readAnnotations(item(geneAnnotations, i), gene.getAnnotations());
            builder.addGene(gene);
        }
        // The reactions.
        List<String> rxns = this.getStrings(struct, "rxns");
        final int nRxns = rxns.size();
        List<String> rxnNames = this.getStrings(struct, "rxnNames");
        List<String> grRules = this.getStrings(struct, "grRules");
        List<String> rxnAnnotations = this.getStrings(struct, "rxnAnnotations");
        double[] lb = this.getDoubles(struct, "lb", nRxns, Double.NaN);
        double[] ub = this.getDoubles(struct, "ub", nRxns, Double.NaN);
        double[] c = this.getDoubles(struct, "c", nRxns, 0.0);
        double[] rev = this.getDoubles(struct, "rev", nRxns, 0.0);
        Matrix sMatrix = null;
        if (fields.contains("S")) {
            sMatrix = struct.get("S");
            if (sMatrix.getNumRows() != nMets || sMatrix.getNumCols() != nRxns)
                throw new MalformedInputException(this.getCodecName(), "S matrix is " + sMatrix.getNumRows() + " x "
                        + sMatrix.getNumCols() + " but model has " + nMets + " metabolites and " + nRxns + " reactions.");
        }
        for (int j = 0; j < nRxns; j++) {
            Reaction reaction = new Reaction(rxns.get(j));
            reaction.setName(item(rxnNames, j));
            reaction.setDefaultBounds(rev[j] != 0.0);
            if (! Double.isNaN(lb[j]))
                reaction.setLowerBound(lb[j]);
            if (! Double.isNaN(ub[j]))
                reaction.setUpperBound(ub[j]);
            reaction.setObjective(c[j]);
            if (sMatrix != null) {
                for (int i = 0; i < nMets; i++) {
                    double coeff = sMatrix.getDouble(i, j);
                    if (coeff != 0.0)
                        reaction.addStoich(mets.get(i), coeff);
                }
            }
            reaction.setRule(GeneRule.parse(item(grRules, j)));
            this.readAnnotations(item(rxnAnnotations, j), reaction.getAnnotations());
            builder.addReaction(reaction);
        }
        builder.ensureRuleGenes();
        // Everything else is an extension.
        for (String field : fields) {
            if (! CANONICAL_FIELDS.contains(field))
                builder.setExtension(field, toJson(struct.get(field)));
        }
        return this.finishModel(builder);
    }

    /**
     * @return the specified list item, or an empty string if the list is too short
     *
     * @param list		list of strings
     * @param i			index of the desired item
     */
    private static String item(List<String> list, int i) {
        return (i < list.size() ? list.get(i) : "");
    }

    /**
     * @return the string value of a character field, or an empty string if it is absent
     *
     * @param struct	source struct
     * @param field		name of the field
     */
    private String getString(Struct struct, String field) {
        String retVal = "";
        if (struct.getFieldNames().contains(field)) {
            Array value = struct.get(field);
            if (value instanceof Char)
                retVal = ((Char) value).getString();
        }
        return retVal;
    }

    /**
     * @return the strings in a cell array field (empty if the field is absent)
     *
     * @param struct	source struct
     * @param field		name of the field
     *
     * @throws MalformedInputException if the field is not a cell array of strings
     */
    private List<String> getStrings(Struct struct, String field) throws MalformedInputException {
        List<String> retVal;
        if (! struct.getFieldNames().contains(field))
            retVal = Collections.emptyList();
        else {
            Array value = struct.get(field);
            if (value instanceof Char)
                retVal = List.of(((Char) value).getString());
            else if (value instanceof Cell) {
                Cell cell = (Cell) value;
                final int n = cell.getNumElements();
                retVal = new ArrayList<String>(n);
                for (int i = 0; i < n; i++) {
                    Array item = cell.get(i);
                    if (item instanceof Char)
                        retVal.add(((Char) item).getString());
                    else if (item instanceof Matrix && item.getNumElements() == 0)
                        retVal.add("");
                    else
                        throw new MalformedInputException(this.getCodecName(), "Field " + field + " element " + (i + 1)
                                + " is not a string.");
                }
            } else
                throw new MalformedInputException(this.getCodecName(), "Field " + field + " is not a cell array.");
        }
        return retVal;
    }

    /**
     * @return the values in a numeric field, padded with a default value to the specified length
     *
     * @param struct	source struct
     * @param field		name of the field
     * @param n			required number of values
     * @param missing	value to use for missing entries
     *
     * @throws MalformedInputException if the field is not numeric
     */
    private double[] getDoubles(Struct struct, String field, int n, double missing) throws MalformedInputException {
        double[] retVal = new double[n];
        int found = 0;
        if (struct.getFieldNames().contains(field)) {
            Array value = struct.get(field);
            if (! (value instanceof Matrix))
                throw new MalformedInputException(this.getCodecName(), "Field " + field + " is not numeric.");
            Matrix matrix = (Matrix) value;
            found = Math.min(n, matrix.getNumElements());
            for (int i = 0; i < found; i++)
                retVal[i] = matrix.getDouble(i);
        }
        for (int i = found; i < n; i++)
            retVal[i] = missing;
        return retVal;
    }

    /**
     * Parse a JSON annotation string into an annotation map.
     *
     * @param jsonString	JSON text (may be empty)
     * @param annotations	annotation map to update
     *
     * @throws MalformedInputException
     */
    private void readAnnotations(String jsonString, Annotations annotations) throws MalformedInputException {
        if (! StringUtils.isBlank(jsonString)) {
            try {
                Object parsed = Jsoner.deserialize(jsonString);
                if (! (parsed instanceof JsonObject))
                    throw new MalformedInputException(this.getCodecName(), "Annotation string \"" + jsonString
                            + "\" is not a JSON object.");
                Annotations parsedMap = new Annotations((JsonObject) parsed);
                for (String key : parsedMap.getKeys())
                    annotations.addAll(key, parsedMap.get(key));
            } catch (JsonException e) {
                throw new MalformedInputException(this.getCodecName(), "Invalid annotation string \"" + jsonString + "\".", e);
            }
        }
    }

    /**
     * Convert a MATLAB array to a tagged JSON object.  The object records the array dimensions
     * and enough type information to rebuild the array exactly.
     *
     * @param value		array to convert
     *
     * @return the JSON representation
     *
     * @throws MalformedInputException if the array type cannot be represented
     */
    protected static JsonObject toJson(Array value) throws MalformedInputException {
        JsonObject retVal = new JsonObject();
        JsonArray dims = new JsonArray();
        for (int dim : value.getDimensions())
            dims.add(dim);
        retVal.put("dims", dims);
        MatlabType type = value.getType();
        if (type == MatlabType.Character) {
            Char chars = (Char) value;
            retVal.put("type", "char");
            StringBuilder buffer = new StringBuilder(chars.getNumElements());
            for (int i = 0; i < chars.getNumElements(); i++)
                buffer.append(chars.getChar(i));
            retVal.put("value", buffer.toString());
        } else if (type == MatlabType.Cell) {
            Cell cell = (Cell) value;
            retVal.put("type", "cell");
            JsonArray values = new JsonArray();
            for (int i = 0; i < cell.getNumElements(); i++)
                values.add(toJson(cell.get(i)));
            retVal.put("values", values);
        } else if (type == MatlabType.Structure) {
            Struct struct = (Struct) value;
            retVal.put("type", "struct");
            JsonArray names = new JsonArray();
            names.addAll(struct.getFieldNames());
            retVal.put("fields", names);
            JsonArray values = new JsonArray();
            for (int i = 0; i < struct.getNumElements(); i++) {
                JsonObject element = new JsonObject();
                for (String field : struct.getFieldNames())
                    element.put(field, toJson(struct.get(field, i)));
                values.add(element);
            }
            retVal.put("values", values);
        } else if (value instanceof Matrix && type != MatlabType.Sparse) {
            Matrix matrix = (Matrix) value;
            retVal.put("type", "matrix");
            retVal.put("logical", matrix.isLogical());
            retVal.put("class", type.name());
            boolean wide = (type == MatlabType.Int64 || type == MatlabType.UInt64);
            JsonArray values = new JsonArray();
            for (int i = 0; i < matrix.getNumElements(); i++) {
                if (wide)
                    values.add(matrix.getLong(i));
                else
                    values.add(matrix.getDouble(i));
            }
            retVal.put("values", values);
            if (matrix.isComplex()) {
                JsonArray imaginary = new JsonArray();
                for (int i = 0; i < matrix.getNumElements(); i++) {
                    if (wide)
                        imaginary.add(matrix.getImaginaryLong(i));
                    else
                        imaginary.add(matrix.getImaginaryDouble(i));
                }
                retVal.put("imaginary", imaginary);
            }
        } else
            throw new MalformedInputException(CODEC_NAME, "MATLAB arrays of type " + type.name() + " are not supported.");
        return retVal;
    }

    /**
     * Convert a tagged JSON object back to a MATLAB array.
     *
     * @param json		JSON object to convert
     *
     * @return the corresponding array
     *
     * @throws IllegalArgumentException if the object is not a tagged array
     */
    protected static Array fromJson(JsonObject json) {
        Array retVal;
        String type = (String) json.get("type");
        JsonArray dimList = (JsonArray) json.get("dims");
        int[] dims = new int[dimList.size()];
        for (int i = 0; i < dims.length; i++)
            dims[i] = ((Number) dimList.get(i)).intValue();
        if ("char".equals(type)) {
            String value = (String) json.get("value");
            if (dims.length == 2 && dims[0] == 1)
                retVal = Mat5.newString(value);
            else {
                Char chars = Mat5.newChar(dims);
                for (int i = 0; i < value.length(); i++)
                    chars.setChar(i, value.charAt(i));
                retVal = chars;
            }
        } else if ("matrix".equals(type)) {
            JsonArray values = (JsonArray) json.get("values");
            JsonArray imaginary = (JsonArray) json.get("imaginary");
            boolean logical = Boolean.TRUE.equals(json.get("logical"));
            MatlabType matType = MatlabType.valueOf((String) json.get("class"));
            boolean wide = (matType == MatlabType.Int64 || matType == MatlabType.UInt64);
            Matrix matrix;
            if (logical) {
                matrix = Mat5.newLogical(dims);
                for (int i = 0; i < values.size(); i++)
                    matrix.setBoolean(i, ((Number) values.get(i)).doubleValue() != 0.0);
            } else {
                matrix = (imaginary == null ? Mat5.newMatrix(dims, matType) : Mat5.newComplex(dims, matType));
                for (int i = 0; i < values.size(); i++) {
                    Number number = (Number) values.get(i);
                    if (wide)
                        matrix.setLong(i, number.longValue());
                    else
                        matrix.setDouble(i, number.doubleValue());
                }
                if (imaginary != null) {
                    for (int i = 0; i < imaginary.size(); i++) {
                        Number number = (Number) imaginary.get(i);
                        if (wide)
                            matrix.setImaginaryLong(i, number.longValue());
                        else
                            matrix.setImaginaryDouble(i, number.doubleValue());
                    }
                }
            }
            retVal = matrix;
        } else if ("cell".equals(type)) {
            JsonArray values = (JsonArray) json.get("values");
            Cell cell = Mat5.newCell(dims);
            for (int i = 0; i < values.size(); i++)
                cell.set(i, fromJson((JsonObject) values.get(i)));
            retVal = cell;
        } else if ("struct".equals(type)) {
            JsonArray names = (JsonArray) json.get("fields");
            JsonArray values = (JsonArray) json.get("values");
            Struct struct = Mat5.newStruct(dims);
            for (int i = 0; i < values.size(); i++) {
                JsonObject element = (JsonObject) values.get(i);
                // The field order comes from the name list.
                for (Object name : names)
                    struct.set((String) name, i, fromJson((JsonObject) element.get(name)));
            }
            retVal = struct;
        } else
            throw new IllegalArgumentException("Invalid extension value type \"" + type + "\".");
        return retVal;
    }

    @Override
    public void write(CobraModel model, File destination) throws IOException {
        Struct struct = this.createStruct(model);
        Mat5File mat = Mat5.newMatFile();
        mat.addArray(VARIABLE_NAME, struct);
        try {
            Mat5.writeToFile(mat, destination);
        } finally {
            mat.close();
        }
    }

    /**
     * Build the model struct for a canonical model.
     *
     * @param model		model to convert
     *
     * @return a struct containing all the model data
     */
    protected Struct createStruct(CobraModel model) {
        Struct retVal = Mat5.newStruct();
        retVal.set("id", Mat5.newString(model.getId()));
        retVal.set("description", Mat5.newString(model.getName()));
        // Metabolites.
        List<Metabolite> mets = model.getMetabolites();
        final int nMets = mets.size();
        Cell metIds = Mat5.newCell(nMets, 1);
        Cell metNames = Mat5.newCell(nMets, 1);
        Cell metFormulas = Mat5.newCell(nMets, 1);
        Cell metComps = Mat5.newCell(nMets, 1);
        Cell metAnnotations = Mat5.newCell(nMets, 1);
        Matrix metCharges = Mat5.newMatrix(nMets, 1);
        Matrix metIsBoundary = Mat5.newLogical(nMets, 1);
        for (int i = 0; i < nMets; i++) {
            Metabolite met = mets.get(i);
            metIds.set(i, Mat5.newString(met.getId()));
            metNames.set(i, Mat5.newString(met.getName()));
            metFormulas.set(i, Mat5.newString(met.getFormula()));
            metComps.set(i, Mat5.newString(met.getCompartment()));
            metAnnotations.set(i, Mat5.newString(annotationString(met.getAnnotations())));
            metCharges.setDouble(i, (met.getCharge() == null ? Double.NaN : met.getCharge()));
            metIsBoundary.setBoolean(i, met.isBoundary());
        }
        retVal.set("mets", metIds);
        retVal.set("metNames", metNames);
        retVal.set("metFormulas", metFormulas);
        retVal.set("metCharges", metCharges);
        retVal.set("metComps", metComps);
        retVal.set("metIsBoundary", metIsBoundary);
        retVal.set("metAnnotations", metAnnotations);
        // Reactions.
        List<Reaction> rxns = model.getReactions();
        final int nRxns = rxns.size();
        Cell rxnIds = Mat5.newCell(nRxns, 1);
        Cell rxnNames = Mat5.newCell(nRxns, 1);
        Cell grRules = Mat5.newCell(nRxns, 1);
        Cell rxnAnnotations = Mat5.newCell(nRxns, 1);
        Matrix sMatrix = Mat5.newMatrix(nMets, nRxns);
        Matrix lb = Mat5.newMatrix(nRxns, 1);
        Matrix ub = Mat5.newMatrix(nRxns, 1);
        Matrix c = Mat5.newMatrix(nRxns, 1);
        Map<String, Integer> metIndex = new HashMap<String, Integer>(nMets * 4 / 3 + 1);
        for (int i = 0; i < nMets; i++)
            metIndex.put(mets.get(i).getId(), i);
        for (int j = 0; j < nRxns; j++) {
            Reaction reaction = rxns.get(j);
            rxnIds.set(j, Mat5.newString(reaction.getId()));
            rxnNames.set(j, Mat5.newString(reaction.getName()));
            grRules.set(j, Mat5.newString(reaction.getRule().toString()));
            rxnAnnotations.set(j, Mat5.newString(annotationString(reaction.getAnnotations())));
            lb.setDouble(j, reaction.getLowerBound());
            ub.setDouble(j, reaction.getUpperBound());
            c.setDouble(j, reaction.getObjective());
            for (Map.Entry<String, Double> stoich : reaction.getStoichiometry().entrySet())
                sMatrix.setDouble(metIndex.get(stoich.getKey()), j, stoich.getValue());
        }
        retVal.set("rxns", rxnIds);
        retVal.set("rxnNames", rxnNames);
        retVal.set("S", sMatrix);
        retVal.set("lb", lb);
        retVal.set("ub", ub);
        retVal.set("c", c);
        retVal.set("grRules", grRules);
        retVal.set("rxnAnnotations", rxnAnnotations);
        // Genes.
        List<Gene> genes = model.getGenes();
        Cell geneIds = Mat5.newCell(genes.size(), 1);
        Cell geneNames = Mat5.newCell(genes.size(), 1);
        Cell geneAnnotations = Mat5.newCell(genes.size(), 1);
        for (int i = 0; i < genes.size(); i++) {
            Gene gene = genes.get(i);
            geneIds.set(i, Mat5.newString(gene.getId()));
            geneNames.set(i, Mat5.newString(gene.getName()));
            geneAnnotations.set(i, Mat5.newString(annotationString(gene.getAnnotations())));
        }
        retVal.set("genes", geneIds);
        retVal.set("geneNames", geneNames);
        retVal.set("geneAnnotations", geneAnnotations);
        // Compartments.
        Set<String> compIds = new LinkedHashSet<String>(model.getCompartments().keySet());
        Cell comps = Mat5.newCell(compIds.size(), 1);
        Cell compNames = Mat5.newCell(compIds.size(), 1);
        int i = 0;
        for (String compId : compIds) {
            comps.set(i, Mat5.newString(compId));
            compNames.set(i, Mat5.newString(model.getCompartments().get(compId)));
            i++;
        }
        retVal.set("comps", comps);
        retVal.set("compNames", compNames);
        // Extensions go back unchanged.
        for (Map.Entry<String, Object> extension : model.getExtensions().entrySet()) {
            Object value = extension.getValue();
            if (value instanceof JsonObject && ! CANONICAL_FIELDS.contains(extension.getKey()))
                retVal.set(extension.getKey(), fromJson((JsonObject) value));
            else
                log.debug("Extension field {} cannot be stored in a MATLAB struct and was dropped.", extension.getKey());
        }
        return retVal;
    }

    /**
     * @return the JSON string for an annotation map (empty if there are no annotations)
     *
     * @param annotations	annotation map to convert
     */
    private static String annotationString(Annotations annotations) {
        String retVal = "";
        if (! annotations.isEmpty())
            retVal = Jsoner.serialize(annotations.toJson());
        return retVal;
    }

}
