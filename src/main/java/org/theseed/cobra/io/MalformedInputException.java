/**
 *
 */
package org.theseed.cobra.io;

/**
 * This exception is thrown when a model reader cannot make sense of its input.  It carries the
 * name of the codec that failed and a description of the problem.  The more specific input
 * errors are subclasses.
 */
public class MalformedInputException extends ModelIOException {

    /** serialization ID */
    private static final long serialVersionUID = 6020364741021498812L;
    /** name of the codec that failed */
    private final String codec;
    /** description of the problem */
    private final String detail;

    /**
     * Construct a malformed-input exception.
     *
     * @param codec		name of the codec that failed
     * @param detail	description of the problem
     */
    public MalformedInputException(String codec, String detail) {
        super(codec + " input error: " + detail);
        this.codec = codec;
        this.detail = detail;
    }

    /**
     * Construct a malformed-input exception caused by a lower-level error.
     *
     * @param codec		name of the codec that failed
     * @param detail	description of the problem
     * @param cause		underlying exception
     */
    public MalformedInputException(String codec, String detail, Throwable cause) {
        super(codec + " input error: " + detail, cause);
        this.codec = codec;
        this.detail = detail;
    }

    /**
     * @return the name of the codec that failed
     */
    public String getCodec() {
        return this.codec;
    }

    /**
     * @return the description of the problem
     */
    public String getDetail() {
        return this.detail;
    }

}
