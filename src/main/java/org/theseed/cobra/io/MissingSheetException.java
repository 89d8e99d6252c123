/**
 *
 */
package org.theseed.cobra.io;

/**
 * This exception is thrown when a spreadsheet model lacks one of its required sheets.
 */
public class MissingSheetException extends MalformedInputException {

    /** serialization ID */
    private static final long serialVersionUID = 1318305563707128475L;

    public MissingSheetException(String codec, String sheetName) {
        super(codec, "Required sheet \"" + sheetName + "\" not found.");
    }

}
