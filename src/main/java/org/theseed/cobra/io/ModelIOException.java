/**
 *
 */
package org.theseed.cobra.io;

import java.io.IOException;

/**
 * This is the base class for all errors reported by the model reading and writing layer.
 */
public class ModelIOException extends IOException {

    /** serialization ID */
    private static final long serialVersionUID = -3120574187664129833L;

    public ModelIOException(String message) {
        super(message);
    }

    public ModelIOException(String message, Throwable cause) {
        super(message, cause);
    }

}
