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
import org.theseed.cobra.io.ModelFormat;
import org.theseed.cobra.io.UnknownFormatException;
import org.theseed.cobra.utils.ParseFailureException;

/**
 * This command reads a model in one format and writes it in another.
 *
 * The positional parameters are the name of the input model file and the name of the output
 * model file.  If the output file has no extension and no output format is given, the output is
 * a MATLAB save file and the extension ".mat" is added.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 *
 * --from		format of the input file (default is to use the file extension)
 * --to			format of the output file (default is to use the file extension)
 * --bound		absolute flux bound for reactions with no bounds in the input
 * --threshold	fraction of SBML identifiers that must follow a naming convention for it to be removed
 */
public class ConvertProcessor extends BaseModelProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ConvertProcessor.class);
    /** output format, or NULL to infer it */
    private ModelFormat format;

    // COMMAND-LINE OPTIONS

    /** output format name */
    @Option(name = "--to", metaVar = "excel", usage = "format of the output file (default: from file extension)")
    private String outFormat;

    /** output model file */
    @Argument(index = 1, metaVar = "outFile", usage = "output model file", required = true)
    private File outFile;

    @Override
    protected void setModelDefaults() {
        this.outFormat = null;
    }

    @Override
    protected void validateModelParms() throws IOException, ParseFailureException {
        if (this.outFormat == null)
            this.format = null;
        else {
            try {
                this.format = ModelFormat.fromToken(this.outFormat);
            } catch (UnknownFormatException e) {
                throw new ParseFailureException(e.getMessage(), e);
            }
            if (! this.format.canWrite())
                throw new ParseFailureException("Format " + this.format.getToken() + " cannot be written.");
        }
    }

    @Override
    protected void runCommand() throws Exception {
        log.info("Converting {} to {}.", this.getInFile(), this.outFile);
        this.getModelIO().write(this.getModel(), this.format, this.outFile);
    }

}
