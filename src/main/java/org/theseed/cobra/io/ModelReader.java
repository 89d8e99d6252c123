/**
 *
 */
package org.theseed.cobra.io;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.List;

import org.theseed.cobra.model.CobraModel;

/**
 * This interface must be supported by every codec that can load a model.  Loading is
 * all-or-nothing:  a reader either returns a complete, verified model or throws.
 */
public interface ModelReader {

    /**
     * @return the name of this codec, for error messages
     */
    public String getCodecName();

    /**
     * Load a model from a file.
     *
     * @param source	file (or, for multi-file formats, the primary file) to read
     *
     * @return the model loaded
     *
     * @throws IOException
     */
    public CobraModel read(File source) throws IOException;

    /**
     * @return TRUE if there is something readable at the specified location, so that a missing
     * 		   file should be reported by the reader itself
     *
     * @param source	file to check
     */
    public default boolean canRead(File source) {
        return source.canRead();
    }

    /**
     * Convert a low-level read error into a model input error.  Missing files and errors that
     * are already model errors are returned unchanged.
     *
     * @param source	file being read
     * @param e			error that occurred
     *
     * @return the exception to throw
     */
    public default IOException readFailure(File source, IOException e) {
        IOException retVal = e;
        if (! (e instanceof ModelIOException) && ! (e instanceof FileNotFoundException))
            retVal = new MalformedInputException(this.getCodecName(), "Cannot read " + source + ": " + e.getMessage(), e);
        return retVal;
    }

    /**
     * Verify an assembled model and build it.
     *
     * @param builder	builder containing the model entities
     *
     * @return the finished model
     *
     * @throws SchemaViolationException if the model breaks one of the structural invariants
     */
    public default CobraModel finishModel(CobraModel.Builder builder) throws SchemaViolationException {
        List<String> problems = builder.validate();
        if (! problems.isEmpty())
            throw new SchemaViolationException(this.getCodecName(), problems);
        return builder.build();
    }

}
