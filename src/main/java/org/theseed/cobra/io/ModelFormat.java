/**
 *
 */
package org.theseed.cobra.io;

import java.util.List;

import org.theseed.cobra.io.excel.ExcelModelCodec;
import org.theseed.cobra.io.mat.MatModelCodec;
import org.theseed.cobra.io.sbml.SbmlModelCodec;
import org.theseed.cobra.io.simpheny.SimPhenyModelReader;
import org.theseed.cobra.io.text.TextModelWriter;

/**
 * This enumeration lists the supported model file formats.  Each format knows its token, the
 * file extensions that identify it, and how to create its reader and writer.  A format that
 * cannot be read or written says so through {@link #canRead()} and {@link #canWrite()}; asking
 * it for the missing codec throws {@link UnsupportedFormatException}.
 */
public enum ModelFormat {
    /** MATLAB save file containing a model struct; lossless */
    MATLAB("matlab-struct", "mat", List.of("mat"), true, true) {
        @Override
        public ModelReader createReader() {
            return new MatModelCodec();
        }

        @Override
        public ModelWriter createWriter() {
            return new MatModelCodec();
        }
    },
    /** SBML document, written as Level 3 Version 1 with FBC version 2 */
    SBML("sbml", "xml", List.of("xml", "sbml"), true, true) {
        @Override
        public ModelReader createReader() {
            return new SbmlModelCodec();
        }

        @Override
        public ModelWriter createWriter() {
            return new SbmlModelCodec();
        }
    },
    /** SimPheny file bundle; read only */
    SIMPHENY("simpheny", "sto", List.of("sto"), true, false) {
        @Override
        public ModelReader createReader() {
            return new SimPhenyModelReader();
        }
    },
    /** two-sheet Excel workbook */
    EXCEL("excel", "xlsx", List.of("xls", "xlsx"), true, true) {
        @Override
        public ModelReader createReader() {
            return new ExcelModelCodec();
        }

        @Override
        public ModelWriter createWriter() {
            return new ExcelModelCodec();
        }
    },
    /** tab-delimited reaction list; write only */
    TEXT("text", "txt", List.of(), false, true) {
        @Override
        public ModelWriter createWriter() {
            return new TextModelWriter();
        }
    };

    // FIELDS
    /** format token */
    private final String token;
    /** default file extension */
    private final String defaultExtension;
    /** extensions from which the format can be inferred */
    private final List<String> extensions;
    /** TRUE if models can be read in this format */
    private final boolean readable;
    /** TRUE if models can be written in this format */
    private final boolean writable;

    private ModelFormat(String token, String defaultExtension, List<String> extensions,
            boolean readable, boolean writable) {
        this.token = token;
        this.defaultExtension = defaultExtension;
        this.extensions = extensions;
        this.readable = readable;
        this.writable = writable;
    }

    /**
     * @return a reader for this format
     *
     * @throws UnsupportedFormatException if this format cannot be read
     */
    public ModelReader createReader() throws UnsupportedFormatException {
        throw new UnsupportedFormatException(this, "read");
    }

    /**
     * @return a writer for this format
     *
     * @throws UnsupportedFormatException if this format cannot be written
     */
    public ModelWriter createWriter() throws UnsupportedFormatException {
        throw new UnsupportedFormatException(this, "write");
    }

    /**
     * @return the format token
     */
    public String getToken() {
        return this.token;
    }

    /**
     * @return the extension used for files written in this format
     */
    public String getDefaultExtension() {
        return this.defaultExtension;
    }

    /**
     * @return the extensions from which this format is inferred
     */
    public List<String> getExtensions() {
        return this.extensions;
    }

    /**
     * @return TRUE if models can be read in this format
     */
    public boolean canRead() {
        return this.readable;
    }

    /**
     * @return TRUE if models can be written in this format
     */
    public boolean canWrite() {
        return this.writable;
    }

    /**
     * Find the format for a file extension.  The match is case-insensitive.
     *
     * @param extension		file extension (without the period)
     *
     * @return the format identified by the extension, or NULL if there is none
     */
    public static ModelFormat fromExtension(String extension) {
        ModelFormat retVal = null;
        for (ModelFormat format : ModelFormat.values()) {
            for (String ext : format.extensions) {
                if (ext.equalsIgnoreCase(extension))
                    retVal = format;
            }
        }
        return retVal;
    }

    /**
     * Find the format for a format name.  The match is case-insensitive, and the enum constant
     * name, the token, the default extension, and the inference extensions are all accepted.
     *
     * @param name		format name
     *
     * @return the format with the specified name
     *
     * @throws UnknownFormatException if the name does not identify a format
     */
    public static ModelFormat fromToken(String name) throws UnknownFormatException {
        ModelFormat retVal = null;
        for (ModelFormat format : ModelFormat.values()) {
            if (format.token.equalsIgnoreCase(name) || format.name().equalsIgnoreCase(name)
                    || format.defaultExtension.equalsIgnoreCase(name))
                retVal = format;
        }
        if (retVal == null)
            retVal = fromExtension(name);
        if (retVal == null)
            throw new UnknownFormatException("Unknown model format \"" + name + "\".");
        return retVal;
    }

}
