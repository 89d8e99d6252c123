/**
 *
 */
package org.theseed.cobra.app;

import java.io.File;
import java.io.IOException;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.cobra.io.ModelIO;
import org.theseed.cobra.io.UnknownFormatException;
import org.theseed.cobra.io.sbml.IdentifierNormalizer;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.Reaction;
import org.theseed.cobra.utils.BaseProcessor;
import org.theseed.cobra.utils.ParseFailureException;

/**
 * This is a base class for commands against metabolic models.  The model is loaded during
 * parameter validation.
 *
 * The positional parameter is the name of the model file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --from		format of the model file (default is to use the file extension)
 * --bound		absolute flux bound for reactions with no bounds in the input (default 1000)
 * --threshold	fraction of SBML identifiers that must follow a naming convention for it to be
 * 				removed (default 1.0)
 */
public abstract class BaseModelProcessor extends BaseProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(BaseModelProcessor.class);
    /** metabolic model */
    private CobraModel model;
    /** model reader/writer */
    private ModelIO modelIO;

    // COMMAND-LINE OPTIONS

    /** input model format */
    @Option(name = "--from", metaVar = "sbml", usage = "format of the input model file (default: from file extension)")
    private String inFormat;

    /** default flux bound */
    @Option(name = "--bound", metaVar = "1000", usage = "absolute flux bound for reactions with no bounds in the input")
    private double defaultBound;

    /** identifier normalization threshold */
    @Option(name = "--threshold", metaVar = "0.9", usage = "fraction of SBML identifiers that must follow a naming convention for it to be applied")
    private double threshold;

    /** input model file */
    @Argument(index = 0, metaVar = "model.mat", usage = "input model file", required = true)
    private File inFile;

    @Override
    protected final void setDefaults() {
        this.inFormat = null;
        this.defaultBound = 1000.0;
        this.threshold = 1.0;
        this.setModelDefaults();
    }

    /**
     * Set the default options for the subclass.
     */
    protected abstract void setModelDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        if (this.defaultBound <= 0.0 || ! Double.isFinite(this.defaultBound))
            throw new ParseFailureException("Default flux bound must be a positive number.");
        if (this.threshold <= 0.0 || this.threshold > 1.0)
            throw new ParseFailureException("Normalization threshold must be greater than 0 and no more than 1.");
        Reaction.setDefaultBound(this.defaultBound);
        IdentifierNormalizer.setThreshold(this.threshold);
        this.modelIO = new ModelIO();
        // Validate the subclass options before the load, since the load can be slow.
        this.validateModelParms();
        log.info("Loading model from {}.", this.inFile);
        try {
            this.model = this.modelIO.read(this.inFile, this.inFormat);
        } catch (UnknownFormatException e) {
            throw new ParseFailureException(e.getMessage(), e);
        }
        log.info("Model {} loaded:  {} reactions, {} metabolites, {} genes.", this.model.getId(),
                this.model.getReactions().size(), this.model.getMetabolites().size(), this.model.getGenes().size());
        return true;
    }

    /**
     * Validate and process the subclass parameters and options.
     *
     * @throws ParseFailureException
     * @throws IOException
     */
    protected abstract void validateModelParms() throws IOException, ParseFailureException;

    /**
     * @return the model
     */
    protected CobraModel getModel() {
        return this.model;
    }

    /**
     * @return the model reader/writer
     */
    protected ModelIO getModelIO() {
        return this.modelIO;
    }

    /**
     * @return the input model file
     */
    protected File getInFile() {
        return this.inFile;
    }

}
