/**
 *
 */
package org.theseed.cobra.io.mat;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.lang.reflect.Proxy;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.cobra.io.MalformedInputException;
import org.theseed.cobra.io.ModelIO;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.Reaction;
import org.theseed.cobra.model.SampleModels;

import com.github.cliftonlabs.json_simple.JsonObject;

import us.hebi.matlab.mat.format.Mat5;
import us.hebi.matlab.mat.format.Mat5File;
import us.hebi.matlab.mat.types.Array;
import us.hebi.matlab.mat.types.Cell;
import us.hebi.matlab.mat.types.MatlabType;
import us.hebi.matlab.mat.types.Matrix;
import us.hebi.matlab.mat.types.Struct;

class MatModelCodecTest {

    /**
     * Save a struct as the model variable of a MATLAB file.
     *
     * @param struct	struct to save
     * @param outFile	output file
     *
     * @throws IOException
     */
    private static void saveStruct(Struct struct, File outFile) throws IOException {
        Mat5File mat = Mat5.newMatFile();
        mat.addArray(MatModelCodec.VARIABLE_NAME, struct);
        try {
            Mat5.writeToFile(mat, outFile);
        } finally {
            mat.close();
        }
    }

    /**
     * @return the tagged JSON form of a field in the model struct of a MATLAB file
     *
     * @param inFile	file to read
     * @param field		name of the desired field
     *
     * @throws IOException
     */
    private static JsonObject readField(File inFile, String field) throws IOException {
        try (Mat5File mat = Mat5.readFromFile(inFile)) {
            Struct struct = mat.getStruct(MatModelCodec.VARIABLE_NAME);
            return MatModelCodec.toJson(struct.get(field));
        }
    }

    @Test
    void testRoundTrip(@TempDir File tempDir) throws IOException {
        CobraModel model = SampleModels.glycolysis();
        MatModelCodec codec = new MatModelCodec();
        File outFile = new File(tempDir, "toy.mat");
        codec.write(model, outFile);
        CobraModel model2 = codec.read(outFile);
        assertThat(model2.getMetabolite("glc__D[b]").getCharge(), nullValue());
        assertThat(model2.getMetabolite("glc__D[b]").isBoundary(), equalTo(true));
        assertThat(model2.getReaction("HEX1").getAnnotations().get("ec-code"), contains("2.7.1.1"));
        assertThat(model2.getGene("b1817").getName(), equalTo("manX"));
        assertThat(model2.getExtensions().size(), equalTo(0));
        assertThat(model2, equalTo(model));
    }

    @Test
    void testExtensions(@TempDir File tempDir) throws IOException {
        MatModelCodec codec = new MatModelCodec();
        Struct struct = codec.createStruct(SampleModels.glycolysis());
        Matrix rev = Mat5.newMatrix(4, 1);
        rev.setDouble(0, 1.0);
        struct.set("rev", rev);
        Cell subSystems = Mat5.newCell(4, 1);
        for (int i = 0; i < 4; i++)
            subSystems.set(i, Mat5.newString(i < 2 ? "Transport" : "Glycolysis"));
        struct.set("subSystems", subSystems);
        struct.set("notes", Mat5.newString("built by hand"));
        Struct version = Mat5.newStruct();
        version.set("number", Mat5.newScalar(3.0));
        version.set("author", Mat5.newString("lab"));
        struct.set("modelVersion", version);
        File inFile = new File(tempDir, "ext.mat");
        saveStruct(struct, inFile);
        CobraModel model = codec.read(inFile);
        assertThat(model.getExtensions().keySet(), contains("rev", "subSystems", "notes", "modelVersion"));
        JsonObject notes = (JsonObject) model.getExtensions().get("notes");
        assertThat(notes.get("value"), equalTo("built by hand"));
        // The extensions survive a second save unchanged.
        File outFile = new File(tempDir, "ext2.mat");
        codec.write(model, outFile);
        for (String field : new String[] { "rev", "subSystems", "notes", "modelVersion" })
            assertThat(field, readField(outFile, field), equalTo(readField(inFile, field)));
        CobraModel model2 = codec.read(outFile);
        assertThat(model2, equalTo(model));
    }

    @Test
    void testMinimalStruct(@TempDir File tempDir) throws IOException {
        Struct struct = Mat5.newStruct();
        Cell mets = Mat5.newCell(2, 1);
        mets.set(0, Mat5.newString("a[c]"));
        mets.set(1, Mat5.newString("b[e]"));
        struct.set("mets", mets);
        Cell rxns = Mat5.newCell(1, 1);
        rxns.set(0, Mat5.newString("AB"));
        struct.set("rxns", rxns);
        Matrix sMatrix = Mat5.newMatrix(2, 1);
        sMatrix.setDouble(0, 0, -1.0);
        sMatrix.setDouble(1, 0, 1.0);
        struct.set("S", sMatrix);
        Matrix rev = Mat5.newMatrix(1, 1);
        rev.setDouble(0, 1.0);
        struct.set("rev", rev);
        File inFile = new File(tempDir, "min.mat");
        saveStruct(struct, inFile);
        MatModelCodec codec = new MatModelCodec();
        CobraModel model = codec.read(inFile);
        assertThat(model.getCompartments().keySet(), contains("c", "e"));
        assertThat(model.getMetabolite("b[e]").getCompartment(), equalTo("e"));
        assertThat(model.getMetabolite("a[c]").getCharge(), nullValue());
        Reaction reaction = model.getReaction("AB");
        assertThat(reaction.getFormula(), equalTo("a[c] <=> b[e]"));
        assertThat(reaction.getLowerBound(), equalTo(-Reaction.getDefaultBound()));
        // A matrix of the wrong shape is rejected.
        struct.set("S", Mat5.newMatrix(3, 1));
        File badFile = new File(tempDir, "bad.mat");
        saveStruct(struct, badFile);
        MalformedInputException e = assertThrows(MalformedInputException.class, () -> codec.read(badFile));
        assertThat(e.getDetail(), containsString("S matrix"));
    }

    @Test
    void testComplexAndCube(@TempDir File tempDir) throws IOException {
        MatModelCodec codec = new MatModelCodec();
        Struct struct = codec.createStruct(SampleModels.glycolysis());
        Matrix cplx = Mat5.newComplex(1, 1);
        cplx.setDouble(0, 1.0);
        cplx.setImaginaryDouble(0, 2.0);
        struct.set("cplx", cplx);
        Matrix cube = Mat5.newMatrix(new int[] { 2, 2, 2 });
        for (int i = 0; i < 8; i++)
            cube.setDouble(i, i + 0.5);
        struct.set("cube", cube);
        File inFile = new File(tempDir, "cplx.mat");
        saveStruct(struct, inFile);
        CobraModel model = codec.read(inFile);
        File outFile = new File(tempDir, "cplx2.mat");
        codec.write(model, outFile);
        try (Mat5File mat = Mat5.readFromFile(outFile)) {
            Struct struct2 = mat.getStruct(MatModelCodec.VARIABLE_NAME);
            Matrix cplx2 = struct2.getMatrix("cplx");
            assertThat(cplx2.isComplex(), equalTo(true));
            assertThat(cplx2.getDouble(0), equalTo(1.0));
            assertThat(cplx2.getImaginaryDouble(0), equalTo(2.0));
            Matrix cube2 = struct2.getMatrix("cube");
            assertThat(cube2.getDimensions(), equalTo(new int[] { 2, 2, 2 }));
            for (int i = 0; i < 8; i++)
                assertThat(cube2.getDouble(i), equalTo(i + 0.5));
        }
        assertThat(readField(outFile, "cplx"), equalTo(readField(inFile, "cplx")));
        assertThat(readField(outFile, "cube"), equalTo(readField(inFile, "cube")));
    }

    @Test
    void testUnsupportedArray() {
        Array sparse = (Array) Proxy.newProxyInstance(Array.class.getClassLoader(), new Class<?>[] { Array.class },
                (proxy, method, args) -> {
                    Object retVal = null;
                    if (method.getName().equals("getDimensions"))
                        retVal = new int[] { 3, 3 };
                    else if (method.getName().equals("getType"))
                        retVal = MatlabType.Sparse;
                    return retVal;
                });
        MalformedInputException e = assertThrows(MalformedInputException.class, () -> MatModelCodec.toJson(sparse));
        assertThat(e.getCodec(), equalTo("matlab-struct"));
        assertThat(e.getDetail(), containsString("Sparse"));
    }

    @Test
    void testGarbage(@TempDir File tempDir) throws IOException {
        File junk = new File(tempDir, "junk.mat");
        Files.writeString(junk.toPath(), "This is not a MATLAB file.  ".repeat(20), StandardCharsets.UTF_8);
        MalformedInputException e = assertThrows(MalformedInputException.class, () -> new ModelIO().read(junk));
        assertThat(e.getCodec(), equalTo("matlab-struct"));
    }

}
