/**
 *
 */
package org.theseed.cobra.io.excel;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.cobra.io.MalformedInputException;
import org.theseed.cobra.io.MissingColumnException;
import org.theseed.cobra.io.MissingSheetException;
import org.theseed.cobra.io.ModelIO;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.Metabolite;
import org.theseed.cobra.model.Reaction;
import org.theseed.cobra.model.SampleModels;

class ExcelModelCodecTest {

    /**
     * Verify that a model read back from a spreadsheet matches the original in the fields
     * the spreadsheet keeps.
     *
     * @param model		original model
     * @param model2	model read back
     */
    private static void checkModel(CobraModel model, CobraModel model2) {
        assertThat(model2.getCompartments(), equalTo(model.getCompartments()));
        assertThat(model2.getMetabolites().size(), equalTo(model.getMetabolites().size()));
        for (Metabolite met : model.getMetabolites()) {
            Metabolite met2 = model2.getMetabolite(met.getId());
            assertThat(met.getId(), met2, not(nullValue()));
            assertThat(met.getId(), met2.getName(), equalTo(met.getName()));
            assertThat(met.getId(), met2.getFormula(), equalTo(met.getFormula()));
            assertThat(met.getId(), met2.getCharge(), equalTo(met.getCharge()));
            assertThat(met.getId(), met2.getCompartment(), equalTo(met.getCompartment()));
            assertThat(met.getId(), met2.getAnnotations(), equalTo(met.getAnnotations()));
            assertThat(met.getId(), met2.isBoundary(), equalTo(false));
        }
        for (Reaction reaction : model.getReactions())
            assertThat(reaction.getId(), model2.getReaction(reaction.getId()), equalTo(reaction));
        assertThat(model2.getGenes().size(), equalTo(model.getGenes().size()));
        assertThat(model2.getGene("b2388").getName(), equalTo(""));
    }

    @Test
    void testXlsx(@TempDir File tempDir) throws IOException {
        CobraModel model = SampleModels.glycolysis();
        ExcelModelCodec codec = new ExcelModelCodec();
        File outFile = new File(tempDir, "toy.xlsx");
        codec.write(model, outFile);
        CobraModel model2 = codec.read(outFile);
        assertThat(model2.getId(), equalTo("toy"));
        checkModel(model, model2);
    }

    @Test
    void testXls(@TempDir File tempDir) throws IOException {
        CobraModel model = SampleModels.glycolysis();
        ExcelModelCodec codec = new ExcelModelCodec();
        File outFile = new File(tempDir, "legacy.xls");
        codec.write(model, outFile);
        CobraModel model2 = codec.read(outFile);
        assertThat(model2.getId(), equalTo("legacy"));
        checkModel(model, model2);
    }

    /**
     * Create a sheet with a header row.
     *
     * @param workbook	target workbook
     * @param name		sheet name
     * @param headers	column headers
     */
    private static void createSheet(Workbook workbook, String name, List<String> headers) {
        Sheet sheet = workbook.createSheet(name);
        Row row = sheet.createRow(0);
        for (int i = 0; i < headers.size(); i++)
            row.createCell(i).setCellValue(headers.get(i));
    }

    @Test
    void testMissingParts(@TempDir File tempDir) throws IOException {
        ExcelModelCodec codec = new ExcelModelCodec();
        File noSheetFile = new File(tempDir, "nosheet.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream outStream = new FileOutputStream(noSheetFile)) {
            createSheet(workbook, ExcelModelCodec.REACTION_SHEET, ExcelModelCodec.REACTION_COLUMNS);
            workbook.write(outStream);
        }
        MissingSheetException e = assertThrows(MissingSheetException.class, () -> codec.read(noSheetFile));
        assertThat(e.getDetail(), containsString(ExcelModelCodec.METABOLITE_SHEET));
        File noColumnFile = new File(tempDir, "nocolumn.xlsx");
        try (Workbook workbook = new XSSFWorkbook(); OutputStream outStream = new FileOutputStream(noColumnFile)) {
            createSheet(workbook, ExcelModelCodec.REACTION_SHEET, ExcelModelCodec.REACTION_COLUMNS);
            createSheet(workbook, ExcelModelCodec.METABOLITE_SHEET, List.of("Abbreviation", "Description",
                    "Charged formula", "Compartment"));
            workbook.write(outStream);
        }
        MissingColumnException e2 = assertThrows(MissingColumnException.class, () -> codec.read(noColumnFile));
        assertThat(e2.getDetail(), containsString("\"Charge\""));
    }

    @Test
    void testGarbage(@TempDir File tempDir) throws IOException {
        File junk = new File(tempDir, "junk.xlsx");
        Files.writeString(junk.toPath(), "This is not a workbook.\n", StandardCharsets.UTF_8);
        MalformedInputException e = assertThrows(MalformedInputException.class, () -> new ModelIO().read(junk));
        assertThat(e.getCodec(), equalTo("excel"));
    }

}
