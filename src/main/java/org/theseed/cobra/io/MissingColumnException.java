/**
 *
 */
package org.theseed.cobra.io;

/**
 * This exception is thrown when a sheet in a spreadsheet model lacks one of its required columns.
 */
public class MissingColumnException extends MalformedInputException {

    /** serialization ID */
    private static final long serialVersionUID = -2247990658302557129L;

    public MissingColumnException(String codec, String sheetName, String columnName) {
        super(codec, "Required column \"" + columnName + "\" not found in sheet \"" + sheetName + "\".");
    }

}
