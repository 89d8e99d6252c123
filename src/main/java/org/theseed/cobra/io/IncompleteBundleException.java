/**
 *
 */
package org.theseed.cobra.io;

import java.io.File;

/**
 * This exception is thrown when a multi-file model bundle is missing one of its required files.
 */
public class IncompleteBundleException extends MalformedInputException {

    /** serialization ID */
    private static final long serialVersionUID = -8790035410962521346L;
    /** the missing file */
    private final File missingFile;

    /**
     * Construct an incomplete-bundle exception.
     *
     * @param codec			name of the codec that failed
     * @param missingFile	required file that was not found
     */
    public IncompleteBundleException(String codec, File missingFile) {
        super(codec, "Required bundle file " + missingFile + " is not found or unreadable.");
        this.missingFile = missingFile;
    }

    /**
     * @return the required file that was not found
     */
    public File getMissingFile() {
        return this.missingFile;
    }

}
