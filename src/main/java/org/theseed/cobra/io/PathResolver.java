/**
 *
 */
package org.theseed.cobra.io;

import java.io.File;

/**
 * This interface represents an interactive helper (such as a file-selection dialog) that can
 * supply a file name when the caller did not provide one.  Either method may return NULL to
 * indicate the user declined to choose a file.
 */
public interface PathResolver {

    /**
     * @return the model file to read, or NULL if none was chosen
     *
     * @param format	requested format, or NULL if any format is acceptable
     */
    public File resolveSource(ModelFormat format);

    /**
     * @return the file to which the model should be written, or NULL if none was chosen
     *
     * @param format	format in which the model will be written
     */
    public File resolveDestination(ModelFormat format);

}
