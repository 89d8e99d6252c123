/**
 *
 */
package org.theseed.cobra.io.simpheny;

import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.cobra.io.IncompleteBundleException;
import org.theseed.cobra.io.MalformedInputException;
import org.theseed.cobra.io.ModelReader;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.GeneRule;
import org.theseed.cobra.model.Metabolite;
import org.theseed.cobra.model.Reaction;
import org.theseed.cobra.utils.TabbedLineReader;

/**
 * This object reads a SimPheny model bundle.  The bundle consists of a compound file (".cmpd"),
 * a reaction file (".rxn"), and a stoichiometric matrix file (".sto"), all with the same base
 * name, plus an optional gene rule file ("_gpr.txt").  All four are tab-delimited with headers.
 *
 * IDs are used exactly as they appear in the files.  Compartments are created with standard
 * names as the metabolites reference them.
 */
public class SimPhenyModelReader implements ModelReader {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SimPhenyModelReader.class);

    @Override
    public String getCodecName() {
        return "simpheny";
    }

    /**
     * @return the bundle base name for a source file
     *
     * @param source	source file, with or without the ".sto" extension
     */
    private static String baseName(File source) {
        String retVal = source.getPath();
        if (FilenameUtils.getExtension(retVal).equalsIgnoreCase("sto"))
            retVal = FilenameUtils.removeExtension(retVal);
        return retVal;
    }

    @Override
    public boolean canRead(File source) {
        String base = baseName(source);
        return (source.canRead() || new File(base + ".cmpd").canRead() || new File(base + ".rxn").canRead());
    }

    @Override
    public CobraModel read(File source) throws IOException {
        String base = baseName(source);
        File cmpdFile = requiredFile(base + ".cmpd");
        File rxnFile = requiredFile(base + ".rxn");
        File stoFile = requiredFile(base + ".sto");
        File gprFile = new File(base + "_gpr.txt");
        CobraModel.Builder builder = new CobraModel.Builder(FilenameUtils.getName(base));
        try {
            this.readCompounds(cmpdFile, builder);
            this.readReactions(rxnFile, builder);
            this.readMatrix(stoFile, builder);
            if (gprFile.canRead())
                this.readRules(gprFile, builder);
            else
                log.debug("No gene rule file found for {}.", base);
        } catch (UncheckedIOException e) {
            throw this.readFailure(source, e.getCause());
        } catch (IOException e) {
            throw this.readFailure(source, e);
        }
        builder.ensureRuleGenes();
        return this.finishModel(builder);
    }

    /**
     * @return the specified bundle file
     *
     * @param name	name of the required file
     *
     * @throws IncompleteBundleException if the file is not readable
     */
    private File requiredFile(String name) throws IncompleteBundleException {
        File retVal = new File(name);
        if (! retVal.canRead())
            throw new IncompleteBundleException(this.getCodecName(), retVal);
        return retVal;
    }

    /**
     * @return the index of a required column
     *
     * @param reader	tabbed input file
     * @param inFile	name of the input file
     * @param name		name of the column
     *
     * @throws MalformedInputException if the column is not present
     */
    private int requiredColumn(TabbedLineReader reader, File inFile, String name) throws MalformedInputException {
        int retVal = reader.findColumn(name);
        if (retVal < 0)
            throw new MalformedInputException(this.getCodecName(), "Column \"" + name + "\" not found in " + inFile + ".");
        return retVal;
    }

    /**
     * @return a numeric value from an input line, or NULL if the field is blank
     *
     * @param line		input line
     * @param idx		column index
     * @param inFile	input file, for error messages
     * @param lineNum	line number, for error messages
     *
     * @throws MalformedInputException if the value is not numeric
     */
    private Double number(TabbedLineReader.Line line, int idx, File inFile, int lineNum) throws MalformedInputException {
        try {
            return line.getDouble(idx);
        } catch (NumberFormatException e) {
            throw new MalformedInputException(this.getCodecName(), "Invalid number \"" + line.get(idx) + "\" in data line "
                    + lineNum + " of " + inFile + ".", e);
        }
    }

    /**
     * Read the metabolites from the compound file.
     *
     * @param inFile	compound file
     * @param builder	model builder
     *
     * @throws IOException
     */
    private void readCompounds(File inFile, CobraModel.Builder builder) throws IOException {
        try (TabbedLineReader reader = new TabbedLineReader(inFile)) {
            int idCol = this.requiredColumn(reader, inFile, "abbreviation");
            int nameCol = reader.findColumn("name");
            int formulaCol = reader.findColumn("formula");
            int chargeCol = reader.findColumn("charge");
            int compCol = this.requiredColumn(reader, inFile, "compartment");
            for (TabbedLineReader.Line line : reader) {
                Metabolite met = new Metabolite(line.get(idCol));
                met.setName(line.get(nameCol));
                met.setFormula(line.get(formulaCol));
                Double charge = this.number(line, chargeCol, inFile, reader.getLineCount());
                if (charge != null)
                    met.setCharge((int) Math.round(charge));
                String comp = line.get(compCol);
                met.setCompartment(comp);
                builder.ensureCompartment(comp);
                builder.addMetabolite(met);
            }
            log.debug("{} compounds read from {}.", reader.getLineCount(), inFile);
        }
    }

    /**
     * Read the reactions and their bounds from the reaction file.
     *
     * @param inFile	reaction file
     * @param builder	model builder
     *
     * @throws IOException
     */
    private void readReactions(File inFile, CobraModel.Builder builder) throws IOException {
        try (TabbedLineReader reader = new TabbedLineReader(inFile)) {
            int idCol = this.requiredColumn(reader, inFile, "abbreviation");
            int nameCol = reader.findColumn("name");
            int lowerCol = reader.findColumn("lower_bound");
            int upperCol = reader.findColumn("upper_bound");
            for (TabbedLineReader.Line line : reader) {
                Reaction reaction = new Reaction(line.get(idCol));
                reaction.setName(line.get(nameCol));
                Double lower = this.number(line, lowerCol, inFile, reader.getLineCount());
                Double upper = this.number(line, upperCol, inFile, reader.getLineCount());
                // A missing bound gets the irreversible default.
                reaction.setDefaultBounds(false);
                if (lower != null)
                    reaction.setLowerBound(lower);
                if (upper != null)
                    reaction.setUpperBound(upper);
                builder.addReaction(reaction);
            }
            log.debug("{} reactions read from {}.", reader.getLineCount(), inFile);
        }
    }

    /**
     * Read the stoichiometric matrix and store it in the reactions.
     *
     * @param inFile	matrix file
     * @param builder	model builder
     *
     * @throws IOException
     */
    private void readMatrix(File inFile, CobraModel.Builder builder) throws IOException {
        try (TabbedLineReader reader = new TabbedLineReader(inFile)) {
            int idCol = this.requiredColumn(reader, inFile, "compound");
            String[] headers = reader.getHeaders();
            Reaction[] reactions = new Reaction[headers.length];
            for (int i = 0; i < headers.length; i++) {
                if (i != idCol) {
                    reactions[i] = builder.getReaction(headers[i]);
                    if (reactions[i] == null)
                        throw new MalformedInputException(this.getCodecName(), "Matrix column \"" + headers[i]
                                + "\" in " + inFile + " is not a known reaction.");
                }
            }
            for (TabbedLineReader.Line line : reader) {
                String compound = line.get(idCol);
                for (int i = 0; i < headers.length; i++) {
                    if (i != idCol) {
                        Double coeff = this.number(line, i, inFile, reader.getLineCount());
                        if (coeff != null && coeff != 0.0)
                            reactions[i].addStoich(compound, coeff);
                    }
                }
            }
        }
    }

    /**
     * Read the gene rules from the rule file.
     *
     * @param inFile	rule file
     * @param builder	model builder
     *
     * @throws IOException
     */
    private void readRules(File inFile, CobraModel.Builder builder) throws IOException {
        try (TabbedLineReader reader = new TabbedLineReader(inFile)) {
            int idCol = this.requiredColumn(reader, inFile, "abbreviation");
            int gprCol = this.requiredColumn(reader, inFile, "gpr");
            for (TabbedLineReader.Line line : reader) {
                String rxnId = line.get(idCol);
                Reaction reaction = builder.getReaction(rxnId);
                String gpr = line.get(gprCol);
                if (reaction == null)
                    log.debug("Gene rule for unknown reaction {} skipped.", rxnId);
                else if (! StringUtils.isBlank(gpr)) {
                    try {
                        reaction.setRule(GeneRule.parse(gpr));
                    } catch (IllegalArgumentException e) {
                        throw new MalformedInputException(this.getCodecName(), "Invalid gene rule for " + rxnId
                                + ": " + e.getMessage(), e);
                    }
                }
            }
        }
    }

}
