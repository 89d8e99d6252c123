/**
 *
 */
package org.theseed.cobra.io;

import java.io.File;
import java.io.IOException;

import org.theseed.cobra.model.CobraModel;

/**
 * This interface must be supported by every codec that can save a model.
 */
public interface ModelWriter {

    /**
     * @return the name of this codec, for error messages
     */
    public String getCodecName();

    /**
     * Save a model to a file.
     *
     * @param model			model to save
     * @param destination	output file
     *
     * @throws IOException
     */
    public void write(CobraModel model, File destination) throws IOException;

}
