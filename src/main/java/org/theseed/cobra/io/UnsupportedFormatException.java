/**
 *
 */
package org.theseed.cobra.io;

/**
 * This exception is thrown when a format is known but does not support the requested
 * direction, e.g. writing a SimPheny bundle or reading a text export.
 */
public class UnsupportedFormatException extends ModelIOException {

    /** serialization ID */
    private static final long serialVersionUID = -5263066829458716624L;
    /** format that was requested */
    private final ModelFormat format;

    /**
     * Construct an unsupported-format exception.
     *
     * @param format	format that was requested
     * @param action	"read" or "write"
     */
    public UnsupportedFormatException(ModelFormat format, String action) {
        super("Format " + format.getToken() + " does not support " + action + " operations.");
        this.format = format;
    }

    /**
     * @return the format that was requested
     */
    public ModelFormat getFormat() {
        return this.format;
    }

}
