/**
 *
 */
package org.theseed.cobra.io;

/**
 * This exception is thrown when a model write has no destination file and no path resolver is
 * available to ask for one.
 */
public class DestinationRequiredException extends ModelIOException {

    /** serialization ID */
    private static final long serialVersionUID = 8841950627740351147L;

    public DestinationRequiredException(String message) {
        super(message);
    }

}
