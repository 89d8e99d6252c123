/**
 *
 */
package org.theseed.cobra.io;

/**
 * This exception is thrown when the format of a model file cannot be determined, either because
 * no format was specified and the file name has no recognizable extension, or because the format
 * name itself is not known.
 */
public class UnknownFormatException extends ModelIOException {

    /** serialization ID */
    private static final long serialVersionUID = 2436716309419722105L;

    public UnknownFormatException(String message) {
        super(message);
    }

}
