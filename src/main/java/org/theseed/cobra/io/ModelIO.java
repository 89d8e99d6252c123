/**
 *
 */
package org.theseed.cobra.io;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.cobra.model.CobraModel;

/**
 * This object is the entry point for reading and writing metabolic models.  It determines the
 * file format (from an explicit format or the file extension), creates the appropriate codec,
 * and invokes it.
 *
 * The dispatcher is configured at construction time with the format to use when a destination
 * file has no extension and no format is given, and with an optional path resolver that is asked
 * for a file name when the caller does not supply one.  Without a path resolver, a missing file
 * name is an error.
 *
 * Each call is a single synchronous attempt; there are no retries.
 */
public class ModelIO {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ModelIO.class);
    /** format for output files with no extension */
    private final ModelFormat defaultFormat;
    /** interactive path resolver, or NULL if none */
    private final PathResolver resolver;

    /**
     * Construct a non-interactive dispatcher that defaults to MATLAB save files.
     */
    public ModelIO() {
        this(ModelFormat.MATLAB, null);
    }

    /**
     * Construct a dispatcher.
     *
     * @param defaultFormat		format for output files with no extension
     * @param resolver			path resolver for missing file names, or NULL if none
     */
    public ModelIO(ModelFormat defaultFormat, PathResolver resolver) {
        if (! defaultFormat.canWrite())
            throw new IllegalArgumentException("Default format " + defaultFormat.getToken() + " cannot be written.");
        this.defaultFormat = defaultFormat;
        this.resolver = resolver;
    }

    /**
     * Read a model, inferring the format from the file extension.
     *
     * @param source	model file to read, or NULL to ask the path resolver
     *
     * @return the model read
     *
     * @throws IOException
     */
    public CobraModel read(File source) throws IOException {
        return this.read(source, (ModelFormat) null);
    }

    /**
     * Read a model in a named format.
     *
     * @param source		model file to read, or NULL to ask the path resolver
     * @param formatName	name of the format, or NULL to infer it from the file extension
     *
     * @return the model read
     *
     * @throws IOException
     */
    public CobraModel read(File source, String formatName) throws IOException {
        ModelFormat format = (formatName == null ? null : ModelFormat.fromToken(formatName));
        return this.read(source, format);
    }

    /**
     * Read a model in the specified format.
     *
     * @param source		model file to read, or NULL to ask the path resolver
     * @param format		format of the file, or NULL to infer it from the file extension
     *
     * @return the model read
     *
     * @throws IOException
     */
    public CobraModel read(File source, ModelFormat format) throws IOException {
        if (format != null && ! format.canRead())
            throw new UnsupportedFormatException(format, "read");
        File realSource = source;
        if (realSource == null) {
            if (this.resolver == null)
                throw new UnknownFormatException("No model file specified and no interactive selection available.");
            realSource = this.resolver.resolveSource(format);
            if (realSource == null)
                throw new UnknownFormatException("No model file selected.");
        }
        ModelFormat realFormat = format;
        String ext = FilenameUtils.getExtension(realSource.getName());
        if (ext.isEmpty() && ! realSource.exists()) {
            // The caller is allowed to leave off the extension.  Look for a file that has one.
            File found = this.findWithExtension(realSource, realFormat);
            if (found != null) {
                log.debug("Using {} for model file {}.", found, realSource);
                realSource = found;
                ext = FilenameUtils.getExtension(found.getName());
            }
        }
        if (realFormat == null) {
            if (ext.isEmpty())
                throw new UnknownFormatException("Cannot determine the format of " + realSource + ".");
            realFormat = ModelFormat.fromExtension(ext);
            if (realFormat == null)
                throw new UnknownFormatException("File extension \"" + ext + "\" of " + realSource
                        + " does not identify a known model format.");
            if (! realFormat.canRead())
                throw new UnsupportedFormatException(realFormat, "read");
        }
        ModelReader reader = realFormat.createReader();
        if (! reader.canRead(realSource))
            throw new FileNotFoundException("Model file " + realSource + " is not found or unreadable.");
        log.info("Reading {} model from {}.", realFormat.getToken(), realSource);
        CobraModel retVal;
        try {
            retVal = reader.read(realSource);
        } catch (RuntimeException e) {
            throw new MalformedInputException(reader.getCodecName(), e.toString(), e);
        }
        log.info("{} loaded from {}.", retVal, realSource);
        return retVal;
    }

    /**
     * Search for a model file with the specified base name and a known extension.
     *
     * @param base		base file name (no extension)
     * @param format	required format, or NULL to accept any readable format
     *
     * @return the first file found, or NULL if there is none
     */
    private File findWithExtension(File base, ModelFormat format) {
        File retVal = null;
        for (ModelFormat type : ModelFormat.values()) {
            if (retVal == null && type.canRead() && (format == null || format == type)) {
                for (String ext : type.getExtensions()) {
                    File candidate = new File(base.getPath() + "." + ext);
                    if (retVal == null && candidate.canRead())
                        retVal = candidate;
                }
            }
        }
        return retVal;
    }

    /**
     * Write a model, inferring the format from the destination file extension.
     *
     * @param model			model to write
     * @param destination	output file, or NULL to ask the path resolver
     *
     * @throws IOException
     */
    public void write(CobraModel model, File destination) throws IOException {
        this.write(model, (ModelFormat) null, destination);
    }

    /**
     * Write a model in a named format.
     *
     * @param model			model to write
     * @param formatName	name of the format, or NULL to infer it from the destination
     * @param destination	output file, or NULL to ask the path resolver
     *
     * @throws IOException
     */
    public void write(CobraModel model, String formatName, File destination) throws IOException {
        ModelFormat format = (formatName == null ? null : ModelFormat.fromToken(formatName));
        this.write(model, format, destination);
    }

    /**
     * Write a model in the specified format.  If the format is not specified, it is inferred
     * from the destination file's extension; if the destination has no extension, the default
     * format is used and its extension is added.
     *
     * @param model			model to write
     * @param format		output format, or NULL to infer it from the destination
     * @param destination	output file, or NULL to ask the path resolver
     *
     * @throws IOException
     */
    public void write(CobraModel model, ModelFormat format, File destination) throws IOException {
        if (format != null && ! format.canWrite())
            throw new UnsupportedFormatException(format, "write");
        File realDest = destination;
        if (realDest == null) {
            if (this.resolver == null)
                throw new DestinationRequiredException("No output file specified and no interactive selection available.");
            realDest = this.resolver.resolveDestination(format == null ? this.defaultFormat : format);
            if (realDest == null)
                throw new DestinationRequiredException("No output file selected.");
        }
        String ext = FilenameUtils.getExtension(realDest.getName());
        ModelFormat realFormat = format;
        if (realFormat == null) {
            if (ext.isEmpty())
                realFormat = this.defaultFormat;
            else {
                realFormat = ModelFormat.fromExtension(ext);
                if (realFormat == null)
                    throw new UnknownFormatException("File extension \"" + ext + "\" of " + realDest
                            + " does not identify a known model format.");
                if (! realFormat.canWrite())
                    throw new UnsupportedFormatException(realFormat, "write");
            }
        }
        if (ext.isEmpty())
            realDest = new File(realDest.getPath() + "." + realFormat.getDefaultExtension());
        ModelWriter writer = realFormat.createWriter();
        log.info("Writing {} to {} in {} format.", model, realDest, realFormat.getToken());
        writer.write(model, realDest);
    }

    /**
     * @return the format used for output files with no extension
     */
    public ModelFormat getDefaultFormat() {
        return this.defaultFormat;
    }

}
