/**
 *
 */
package org.theseed.cobra.io.excel;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.poi.hssf.usermodel.HSSFWorkbook;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellStyle;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Font;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.cobra.io.MalformedInputException;
import org.theseed.cobra.io.MissingColumnException;
import org.theseed.cobra.io.MissingSheetException;
import org.theseed.cobra.io.ModelReader;
import org.theseed.cobra.io.ModelWriter;
import org.theseed.cobra.model.Annotations;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.GeneRule;
import org.theseed.cobra.model.Metabolite;
import org.theseed.cobra.model.Reaction;
import org.theseed.cobra.model.ReactionFormula;

/**
 * This codec reads and writes a model as an Excel workbook with a "Reaction List" sheet and a
 * "Metabolite List" sheet.  Each sheet has a fixed set of required columns; any additional
 * columns hold annotations, with the column header as the annotation key and multiple values
 * separated by semicolons.
 *
 * The workbook does not record boundary flags, extension fields, or gene names and annotations.
 * The genes are taken from the reaction rules.
 */
public class ExcelModelCodec implements ModelReader, ModelWriter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ExcelModelCodec.class);
    /** name of the reaction sheet */
    public static final String REACTION_SHEET = "Reaction List";
    /** name of the metabolite sheet */
    public static final String METABOLITE_SHEET = "Metabolite List";
    /** required reaction columns */
    public static final List<String> REACTION_COLUMNS = List.of("Abbreviation", "Description", "Reaction", "GPR",
            "Lower bound", "Upper bound", "Objective");
    /** required metabolite columns */
    public static final List<String> METABOLITE_COLUMNS = List.of("Abbreviation", "Description", "Charged formula",
            "Charge", "Compartment");
    /** delimiter for multiple annotation values */
    private static final String VALUE_DELIM = "; ";
    /** formatter for cell values */
    private DataFormatter formatter;

    /**
     * This object reads a sheet by column name.
     */
    private class SheetReader {

        /** sheet being read */
        private Sheet sheet;
        /** map of column names to indices */
        private Map<String, Integer> columns;
        /** column names in order */
        private List<String> headers;

        /**
         * Prepare to read a sheet.
         *
         * @param workbook		source workbook
         * @param sheetName		name of the sheet to read
         * @param required		names of the required columns
         *
         * @throws MalformedInputException if the sheet or a required column is missing
         */
        protected SheetReader(Workbook workbook, String sheetName, List<String> required) throws MalformedInputException {
            this.sheet = workbook.getSheet(sheetName);
            if (this.sheet == null)
                throw new MissingSheetException(ExcelModelCodec.this.getCodecName(), sheetName);
            this.columns = new HashMap<String, Integer>();
            this.headers = new ArrayList<String>();
            Row headerRow = this.sheet.getRow(this.sheet.getFirstRowNum());
            if (headerRow != null) {
                for (int i = 0; i < headerRow.getLastCellNum(); i++) {
                    String header = ExcelModelCodec.this.cellString(headerRow, i);
                    this.headers.add(header);
                    if (! header.isEmpty() && ! this.columns.containsKey(header))
                        this.columns.put(header, i);
                }
            }
            for (String column : required) {
                if (! this.columns.containsKey(column))
                    throw new MissingColumnException(ExcelModelCodec.this.getCodecName(), sheetName, column);
            }
        }

        /**
         * @return the data rows of the sheet (blank rows are skipped)
         */
        protected List<Row> getRows() {
            List<Row> retVal = new ArrayList<Row>();
            for (int r = this.sheet.getFirstRowNum() + 1; r <= this.sheet.getLastRowNum(); r++) {
                Row row = this.sheet.getRow(r);
                if (row != null && ! this.isBlank(row))
                    retVal.add(row);
            }
            return retVal;
        }

        /**
         * @return TRUE if the row has no data
         *
         * @param row	row to check
         */
        private boolean isBlank(Row row) {
            boolean retVal = true;
            for (int i = 0; retVal && i < this.headers.size(); i++)
                retVal = ExcelModelCodec.this.cellString(row, i).isEmpty();
            return retVal;
        }

        /**
         * @return the string value in the named column
         *
         * @param row		source row
         * @param column	name of the column
         */
        protected String get(Row row, String column) {
            return ExcelModelCodec.this.cellString(row, this.columns.get(column));
        }

        /**
         * @return the numeric value in the named column, or NULL if it is blank
         *
         * @param row		source row
         * @param column	name of the column
         *
         * @throws MalformedInputException if the value is not numeric
         */
        protected Double getNumber(Row row, String column) throws MalformedInputException {
            Double retVal = null;
            Cell cell = row.getCell(this.columns.get(column));
            if (cell != null && cell.getCellType() == CellType.NUMERIC)
                retVal = cell.getNumericCellValue();
            else {
                String value = this.get(row, column);
                if (! value.isEmpty()) {
                    try {
                        retVal = Double.valueOf(value);
                    } catch (NumberFormatException e) {
                        throw new MalformedInputException(ExcelModelCodec.this.getCodecName(), "Invalid number \""
                                + value + "\" in column \"" + column + "\" of row " + (row.getRowNum() + 1) + ".", e);
                    }
                }
            }
            return retVal;
        }

        /**
         * Store the values in the annotation columns of a row.
         *
         * @param row			source row
         * @param required		names of the required columns
         * @param annotations	annotation map to update
         */
        protected void readAnnotations(Row row, List<String> required, Annotations annotations) {
            for (Map.Entry<String, Integer> column : this.columns.entrySet()) {
                if (! required.contains(column.getKey())) {
                    String value = ExcelModelCodec.this.cellString(row, column.getValue());
                    for (String item : StringUtils.splitByWholeSeparator(value, VALUE_DELIM)) {
                        if (! item.isBlank())
                            annotations.add(column.getKey(), item.trim());
                    }
                }
            }
        }

    }

    /**
     * This object builds a sheet one cell at a time.
     */
    private static class SheetBuilder {

        /** sheet being built */
        private Sheet sheet;
        /** current row */
        private Row row;
        /** index of the next cell */
        private int colIdx;

        /**
         * Create a new sheet with a frozen header row.
         *
         * @param workbook		target workbook
         * @param name			name of the sheet
         * @param headers		column headers
         * @param headerStyle	style for the header cells
         */
        protected SheetBuilder(Workbook workbook, String name, List<String> headers, CellStyle headerStyle) {
            this.sheet = workbook.createSheet(name);
            this.addRow();
            for (String header : headers) {
                Cell cell = this.row.createCell(this.colIdx++);
                cell.setCellValue(header);
                cell.setCellStyle(headerStyle);
            }
            this.sheet.createFreezePane(0, 1);
        }

        /**
         * Start a new row.
         */
        protected void addRow() {
            this.row = this.sheet.createRow(this.sheet.getPhysicalNumberOfRows());
            this.colIdx = 0;
        }

        /**
         * Store a string cell.  Empty strings produce blank cells.
         *
         * @param value		value to store
         */
        protected void storeCell(String value) {
            Cell cell = this.row.createCell(this.colIdx++);
            if (! value.isEmpty())
                cell.setCellValue(value);
        }

        /**
         * Store a numeric cell.
         *
         * @param value		value to store
         */
        protected void storeCell(double value) {
            this.row.createCell(this.colIdx++).setCellValue(value);
        }

        /**
         * Store a blank cell.
         */
        protected void storeBlankCell() {
            this.row.createCell(this.colIdx++);
        }

    }

    /**
     * Construct a new Excel codec.
     */
    public ExcelModelCodec() {
        this.formatter = new DataFormatter();
    }

    @Override
    public String getCodecName() {
        return "excel";
    }

    /**
     * @return the formatted string value of a cell, or an empty string if the cell is missing
     *
     * @param row	source row
     * @param idx	column index of the cell
     */
    private String cellString(Row row, int idx) {
        String retVal = "";
        Cell cell = row.getCell(idx);
        if (cell != null)
            retVal = this.formatter.formatCellValue(cell).trim();
        return retVal;
    }

    @Override
    public CobraModel read(File source) throws IOException {
        CobraModel.Builder builder = new CobraModel.Builder(FilenameUtils.getBaseName(source.getName()));
        try (Workbook workbook = WorkbookFactory.create(source, null, true)) {
            SheetReader metSheet = new SheetReader(workbook, METABOLITE_SHEET, METABOLITE_COLUMNS);
            SheetReader rxnSheet = new SheetReader(workbook, REACTION_SHEET, REACTION_COLUMNS);
            for (Row row : metSheet.getRows()) {
                Metabolite met = new Metabolite(metSheet.get(row, "Abbreviation"));
                met.setName(metSheet.get(row, "Description"));
                met.setFormula(metSheet.get(row, "Charged formula"));
                Double charge = metSheet.getNumber(row, "Charge");
                if (charge != null)
                    met.setCharge((int) Math.round(charge));
                String comp = metSheet.get(row, "Compartment");
                met.setCompartment(comp);
                builder.ensureCompartment(comp);
                metSheet.readAnnotations(row, METABOLITE_COLUMNS, met.getAnnotations());
                builder.addMetabolite(met);
            }
            for (Row row : rxnSheet.getRows()) {
                Reaction reaction = new Reaction(rxnSheet.get(row, "Abbreviation"));
                reaction.setName(rxnSheet.get(row, "Description"));
                try {
                    ReactionFormula formula = new ReactionFormula(rxnSheet.get(row, "Reaction"));
                    for (Map.Entry<String, Double> stoich : formula.getStoichiometry().entrySet())
                        reaction.addStoich(stoich.getKey(), stoich.getValue());
                    reaction.setDefaultBounds(formula.isReversible());
                    reaction.setRule(GeneRule.parse(rxnSheet.get(row, "GPR")));
                } catch (IllegalArgumentException e) {
                    throw new MalformedInputException(this.getCodecName(), "Error in reaction " + reaction.getId()
                            + ": " + e.getMessage(), e);
                }
                Double lower = rxnSheet.getNumber(row, "Lower bound");
                if (lower != null)
                    reaction.setLowerBound(lower);
                Double upper = rxnSheet.getNumber(row, "Upper bound");
                if (upper != null)
                    reaction.setUpperBound(upper);
                Double objective = rxnSheet.getNumber(row, "Objective");
                if (objective != null)
                    reaction.setObjective(objective);
                rxnSheet.readAnnotations(row, REACTION_COLUMNS, reaction.getAnnotations());
                builder.addReaction(reaction);
            }
        } catch (IOException e) {
            throw this.readFailure(source, e);
        }
        builder.ensureRuleGenes();
        return this.finishModel(builder);
    }

    @Override
    public void write(CobraModel model, File destination) throws IOException {
        boolean legacy = FilenameUtils.getExtension(destination.getName()).equalsIgnoreCase("xls");
        try (Workbook workbook = (legacy ? new HSSFWorkbook() : new XSSFWorkbook())) {
            CellStyle headerStyle = workbook.createCellStyle();
            Font boldFont = workbook.createFont();
            boldFont.setBold(true);
            headerStyle.setFont(boldFont);
            // Build the reaction sheet.
            Set<String> rxnKeys = model.getReactionAnnotationKeys();
            List<String> headers = new ArrayList<String>(REACTION_COLUMNS);
            headers.addAll(rxnKeys);
            SheetBuilder rxnSheet = new SheetBuilder(workbook, REACTION_SHEET, headers, headerStyle);
            for (Reaction reaction : model.getReactions()) {
                rxnSheet.addRow();
                rxnSheet.storeCell(reaction.getId());
                rxnSheet.storeCell(reaction.getName());
                rxnSheet.storeCell(reaction.getFormula());
                rxnSheet.storeCell(reaction.getRule().toString());
                rxnSheet.storeCell(reaction.getLowerBound());
                rxnSheet.storeCell(reaction.getUpperBound());
                rxnSheet.storeCell(reaction.getObjective());
                for (String key : rxnKeys)
                    rxnSheet.storeCell(StringUtils.join(reaction.getAnnotations().get(key), VALUE_DELIM));
            }
            // Build the metabolite sheet.
            Set<String> metKeys = model.getMetaboliteAnnotationKeys();
            headers = new ArrayList<String>(METABOLITE_COLUMNS);
            headers.addAll(metKeys);
            SheetBuilder metSheet = new SheetBuilder(workbook, METABOLITE_SHEET, headers, headerStyle);
            for (Metabolite met : model.getMetabolites()) {
                metSheet.addRow();
                metSheet.storeCell(met.getId());
                metSheet.storeCell(met.getName());
                metSheet.storeCell(met.getFormula());
                if (met.getCharge() == null)
                    metSheet.storeBlankCell();
                else
                    metSheet.storeCell(met.getCharge());
                metSheet.storeCell(met.getCompartment());
                for (String key : metKeys)
                    metSheet.storeCell(StringUtils.join(met.getAnnotations().get(key), VALUE_DELIM));
            }
            try (OutputStream outStream = new FileOutputStream(destination)) {
                workbook.write(outStream);
            }
        }
        log.debug("{} reactions and {} metabolites written to {}.", model.getReactions().size(),
                model.getMetabolites().size(), destination);
    }

}
