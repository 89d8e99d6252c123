/**
 *
 */
package org.theseed.cobra.utils;

/**
 * This exception is thrown when a command's parameters are invalid.
 */
public class ParseFailureException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = 4783127569401255203L;

    public ParseFailureException(String message) {
        super(message);
    }

    public ParseFailureException(String message, Throwable cause) {
        super(message, cause);
    }

}
