/**
 *
 */
package org.theseed.cobra.app;

import java.io.File;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Map;
import java.util.TreeMap;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.Metabolite;
import org.theseed.cobra.utils.ParseFailureException;

import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This command summarizes the contents of a model:  the number of reactions, metabolites,
 * genes, compartments, boundary metabolites, and extension fields, and the number of
 * metabolites in each compartment.
 *
 * The positional parameter is the name of the model file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --from		format of the model file (default is to use the file extension)
 * --bound		absolute flux bound for reactions with no bounds in the input
 * --threshold	fraction of SBML identifiers that must follow a naming convention for it to be removed
 * --json		write the summary as a JSON object instead of a tab-delimited report
 */
public class SummaryProcessor extends BaseModelProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SummaryProcessor.class);

    // COMMAND-LINE OPTIONS

    /** TRUE for JSON output */
    @Option(name = "--json", usage = "if specified, the output will be a JSON object")
    private boolean jsonMode;

    /** summary output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "summary.tbl", usage = "output file for the summary (if not STDOUT)")
    private File outFile;

    @Override
    protected void setModelDefaults() {
        this.jsonMode = false;
        this.outFile = null;
    }

    @Override
    protected void validateModelParms() throws IOException, ParseFailureException {
        if (this.outFile != null) {
            File parent = this.outFile.getAbsoluteFile().getParentFile();
            if (parent != null && ! parent.isDirectory())
                throw new IOException("Output directory " + parent + " does not exist.");
            log.info("Summary will be written to {}.", this.outFile);
        }
    }

    @Override
    protected void runCommand() throws Exception {
        CobraModel model = this.getModel();
        log.info("Summarizing model {} with {} reactions.", model.getId(), model.getReactions().size());
        if (this.outFile == null) {
            // STDOUT stays open for the caller.
            PrintWriter writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
            this.writeSummary(model, writer);
            writer.flush();
        } else try (PrintWriter writer = new PrintWriter(Files.newBufferedWriter(this.outFile.toPath()))) {
            this.writeSummary(model, writer);
        }
    }

    /**
     * @return a JSON object describing a model
     *
     * @param model		model to summarize
     */
    public static JsonObject summarize(CobraModel model) {
        JsonObject retVal = new JsonObject();
        retVal.put("id", model.getId());
        retVal.put("name", model.getName());
        retVal.put("reactions", model.getReactions().size());
        retVal.put("metabolites", model.getMetabolites().size());
        retVal.put("genes", model.getGenes().size());
        retVal.put("compartments", model.getCompartments().size());
        retVal.put("boundary", model.getBoundaryCount());
        retVal.put("extensions", model.getExtensions().size());
        Map<String, Integer> compCounts = new TreeMap<String, Integer>();
        for (Metabolite met : model.getMetabolites())
            compCounts.merge(met.getCompartment(), 1, Integer::sum);
        JsonObject compJson = new JsonObject();
        compJson.putAll(compCounts);
        retVal.put("by_compartment", compJson);
        return retVal;
    }

    /**
     * Write the summary of a model in the selected output format.
     *
     * @param model		model to summarize
     * @param writer	output writer
     */
    private void writeSummary(CobraModel model, PrintWriter writer) {
        JsonObject summary = summarize(model);
        if (this.jsonMode)
            writer.println(Jsoner.prettyPrint(summary.toJson()));
        else {
            writer.println("statistic\tvalue");
            for (String key : new String[] { "id", "name", "reactions", "metabolites", "genes", "compartments",
                    "boundary", "extensions" })
                writer.println(key + "\t" + summary.get(key));
            JsonObject compJson = (JsonObject) summary.get("by_compartment");
            for (Map.Entry<String, Object> entry : new TreeMap<String, Object>(compJson).entrySet())
                writer.println("compartment." + entry.getKey() + "\t" + entry.getValue());
        }
    }

}
