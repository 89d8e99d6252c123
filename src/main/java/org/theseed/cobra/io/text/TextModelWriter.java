/**
 *
 */
package org.theseed.cobra.io.text;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.cobra.io.ModelWriter;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.Reaction;

/**
 * This object writes a tab-delimited reaction list.  Each line contains a reaction ID, its
 * formula, and its gene rule.  This format cannot be read back.
 */
public class TextModelWriter implements ModelWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TextModelWriter.class);
    /** header line */
    public static final String HEADER = "Reaction\tFormula\tGPR";

    @Override
    public String getCodecName() {
        return "text";
    }

    @Override
    public void write(CobraModel model, File destination) throws IOException {
        try (PrintWriter writer = new PrintWriter(destination, StandardCharsets.UTF_8)) {
            writer.println(HEADER);
            for (Reaction reaction : model.getReactions())
                writer.println(reaction.getId() + "\t" + reaction.getFormula() + "\t" + reaction.getRule());
        }
        log.debug("{} reactions listed in {}.", model.getReactions().size(), destination);
    }

}
