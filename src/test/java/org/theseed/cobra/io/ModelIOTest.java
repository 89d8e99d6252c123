/**
 *
 */
package org.theseed.cobra.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.SampleModels;

class ModelIOTest {

    /**
     * Path resolver that always returns a fixed file.
     */
    private static class FixedResolver implements PathResolver {

        private File file;

        private FixedResolver(File file) {
            this.file = file;
        }

        @Override
        public File resolveSource(ModelFormat format) {
            return this.file;
        }

        @Override
        public File resolveDestination(ModelFormat format) {
            return this.file;
        }

    }

    @Test
    void testFormats() throws IOException {
        assertThat(ModelFormat.fromExtension("XML"), equalTo(ModelFormat.SBML));
        assertThat(ModelFormat.fromExtension("sbml"), equalTo(ModelFormat.SBML));
        assertThat(ModelFormat.fromExtension("xls"), equalTo(ModelFormat.EXCEL));
        assertThat(ModelFormat.fromExtension("sto"), equalTo(ModelFormat.SIMPHENY));
        assertThat(ModelFormat.fromExtension("txt"), nullValue());
        assertThat(ModelFormat.fromToken("matlab-struct"), equalTo(ModelFormat.MATLAB));
        assertThat(ModelFormat.fromToken("text"), equalTo(ModelFormat.TEXT));
        assertThat(ModelFormat.SIMPHENY.canWrite(), equalTo(false));
        assertThat(ModelFormat.TEXT.canRead(), equalTo(false));
        assertThrows(UnknownFormatException.class, () -> ModelFormat.fromToken("cobol"));
        assertThrows(UnsupportedFormatException.class, () -> ModelFormat.TEXT.createReader());
    }

    @Test
    void testReadDispatch() throws IOException {
        ModelIO modelIO = new ModelIO();
        CobraModel model = modelIO.read(new File("data/dispatch", "model.XML"));
        assertThat(model.getId(), equalTo("precedence"));
        // A missing extension is resolved by looking for a known one.
        model = modelIO.read(new File("data/simpheny", "toy"));
        assertThat(model.getId(), equalTo("toy"));
        model = modelIO.read(new File("data/simpheny", "nogpr.sto"), "simpheny");
        assertThat(model.getReactions().size(), equalTo(1));
        assertThrows(UnknownFormatException.class, () -> modelIO.read(new File("data/simpheny", "toy_gpr.txt")));
        assertThrows(FileNotFoundException.class, () -> modelIO.read(new File("data/sbml", "missing.xml")));
        assertThrows(UnknownFormatException.class, () -> modelIO.read(null));
        assertThrows(UnsupportedFormatException.class, () -> modelIO.read(new File("data/sbml", "l3_fbc2.xml"), "text"));
    }

    @Test
    void testWriteDispatch(@TempDir File tempDir) throws IOException {
        ModelIO modelIO = new ModelIO();
        CobraModel model = SampleModels.glycolysis();
        assertThrows(UnsupportedFormatException.class, () -> modelIO.write(model, "simpheny", new File(tempDir, "x.sto")));
        assertThrows(UnsupportedFormatException.class, () -> modelIO.write(model, new File(tempDir, "x.sto")));
        assertThrows(UnknownFormatException.class, () -> modelIO.write(model, new File(tempDir, "x.doc")));
        assertThrows(DestinationRequiredException.class, () -> modelIO.write(model, null));
        // No extension means the default format.
        modelIO.write(model, new File(tempDir, "plain"));
        File matFile = new File(tempDir, "plain.mat");
        assertThat(matFile.exists(), equalTo(true));
        assertThat(modelIO.read(matFile), equalTo(model));
        // Text output needs an explicit format.
        File textFile = new File(tempDir, "rxns.txt");
        assertThrows(UnknownFormatException.class, () -> modelIO.write(model, textFile));
        modelIO.write(model, "text", textFile);
        assertThat(textFile.exists(), equalTo(true));
    }

    @Test
    void testResolver(@TempDir File tempDir) throws IOException {
        File target = new File(tempDir, "chosen.xml");
        ModelIO modelIO = new ModelIO(ModelFormat.SBML, new FixedResolver(target));
        CobraModel model = SampleModels.glycolysis();
        modelIO.write(model, null);
        assertThat(target.exists(), equalTo(true));
        CobraModel model2 = modelIO.read(null);
        assertThat(model2.getReactions().size(), equalTo(4));
        ModelIO cancelled = new ModelIO(ModelFormat.SBML, new FixedResolver(null));
        assertThrows(DestinationRequiredException.class, () -> cancelled.write(model, null));
        assertThrows(IllegalArgumentException.class, () -> new ModelIO(ModelFormat.SIMPHENY, null));
    }

}
