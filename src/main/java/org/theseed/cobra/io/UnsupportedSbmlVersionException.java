/**
 *
 */
package org.theseed.cobra.io;

/**
 * This exception is thrown when an SBML document has a level, version, or FBC package version
 * that is not in the supported set.
 */
public class UnsupportedSbmlVersionException extends MalformedInputException {

    /** serialization ID */
    private static final long serialVersionUID = 4403551530879386016L;

    /**
     * Construct an exception for an unsupported SBML document.
     *
     * @param level			SBML level
     * @param version		SBML version
     * @param fbcVersion	FBC package version (0 if the package is not used)
     */
    public UnsupportedSbmlVersionException(int level, int version, int fbcVersion) {
        super("sbml", "Level " + level + " Version " + version
                + (fbcVersion == 0 ? " without FBC" : " with FBC version " + fbcVersion)
                + " is not supported.");
    }

}
