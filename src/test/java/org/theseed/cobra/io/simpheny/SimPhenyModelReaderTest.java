/**
 *
 */
package org.theseed.cobra.io.simpheny;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.cobra.io.IncompleteBundleException;
import org.theseed.cobra.io.MalformedInputException;
import org.theseed.cobra.io.ModelIO;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.Reaction;

class SimPhenyModelReaderTest {

    @Test
    void testFullBundle() throws IOException {
        SimPhenyModelReader reader = new SimPhenyModelReader();
        CobraModel model = reader.read(new File("data/simpheny", "toy.sto"));
        assertThat(model.getId(), equalTo("toy"));
        assertThat(model.getMetabolites().size(), equalTo(6));
        assertThat(model.getCompartments().keySet(), contains("e", "c"));
        assertThat(model.getCompartments().get("e"), equalTo("extracellular space"));
        assertThat(model.getMetabolite("atp[c]").getCharge(), equalTo(-4));
        assertThat(model.getMetabolite("g6p[c]").getName(), equalTo("D-Glucose 6-phosphate"));
        assertThat(model.getMetabolite("h[c]").getFormula(), equalTo("H"));
        assertThat(model.getReactions().size(), equalTo(3));
        Reaction exchange = model.getReaction("EX_glc__D_e");
        assertThat(exchange.getLowerBound(), equalTo(-10.0));
        assertThat(exchange.getStoichiometry().keySet(), contains("glc__D[e]"));
        Reaction transport = model.getReaction("GLCt");
        assertThat(transport.getUpperBound(), equalTo(500.0));
        assertThat(transport.getFormula(), equalTo("glc__D[e] -> glc__D[c]"));
        assertThat(transport.getRule().toString(), equalTo("b2415"));
        Reaction hex = model.getReaction("HEX1");
        assertThat(hex.getLowerBound(), equalTo(0.0));
        assertThat(hex.getUpperBound(), equalTo(Reaction.getDefaultBound()));
        assertThat(hex.getStoichiometry().size(), equalTo(5));
        assertThat(hex.getStoichiometry().get("glc__D[c]"), equalTo(-1.0));
        assertThat(hex.getRule().toString(), equalTo("b2388 or (b1817 and b1818)"));
        assertThat(model.getGenes().size(), equalTo(4));
        assertThat(model.getGene("b1818").getName(), equalTo(""));
    }

    @Test
    void testNoRules() throws IOException {
        SimPhenyModelReader reader = new SimPhenyModelReader();
        // The base name works as well as the matrix file name.
        CobraModel model = reader.read(new File("data/simpheny", "nogpr"));
        assertThat(model.getId(), equalTo("nogpr"));
        assertThat(model.getGenes(), empty());
        Reaction reaction = model.getReaction("AB");
        assertThat(reaction.getName(), equalTo("a to b"));
        assertThat(reaction.getFormula(), equalTo("a[c] -> 2 b[p]"));
        assertThat(reaction.getRule().isEmpty(), equalTo(true));
        assertThat(model.getCompartments().get("p"), equalTo("periplasm"));
        assertThat(model.getMetabolite("a[c]").getCharge(), nullValue());
    }

    @Test
    void testBadBundles() {
        SimPhenyModelReader reader = new SimPhenyModelReader();
        IncompleteBundleException e = assertThrows(IncompleteBundleException.class,
                () -> reader.read(new File("data/simpheny", "partial.sto")));
        assertThat(e.getMissingFile().getName(), equalTo("partial.rxn"));
        MalformedInputException e2 = assertThrows(MalformedInputException.class,
                () -> reader.read(new File("data/simpheny", "badcol.sto")));
        assertThat(e2.getDetail(), containsString("XY"));
        assertThat(e2.getCodec(), equalTo("simpheny"));
    }

    @Test
    void testMissingMatrix(@TempDir File tempDir) throws IOException {
        Files.writeString(new File(tempDir, "B.cmpd").toPath(), "abbreviation\tname\tcompartment\na[c]\ta\tc\n");
        Files.writeString(new File(tempDir, "B.rxn").toPath(), "abbreviation\tname\nEX\tExchange\n");
        ModelIO modelIO = new ModelIO();
        IncompleteBundleException e = assertThrows(IncompleteBundleException.class,
                () -> modelIO.read(new File(tempDir, "B.sto")));
        assertThat(e.getMissingFile().getName(), equalTo("B.sto"));
        // With no bundle files at all, the model file is simply missing.
        assertThrows(FileNotFoundException.class, () -> modelIO.read(new File(tempDir, "C.sto")));
    }

    @Test
    void testBadEncoding(@TempDir File tempDir) throws IOException {
        // The compound file is Latin-1, not UTF-8.
        Files.write(new File(tempDir, "latin.cmpd").toPath(),
                "abbreviation\tname\tcompartment\ncaf[c]\tcaf\u00e9\tc\n".getBytes(StandardCharsets.ISO_8859_1));
        Files.writeString(new File(tempDir, "latin.rxn").toPath(), "abbreviation\tname\nEX\tExchange\n");
        Files.writeString(new File(tempDir, "latin.sto").toPath(), "compound\tEX\ncaf[c]\t-1\n");
        SimPhenyModelReader reader = new SimPhenyModelReader();
        MalformedInputException e = assertThrows(MalformedInputException.class,
                () -> reader.read(new File(tempDir, "latin.sto")));
        assertThat(e.getCodec(), equalTo("simpheny"));
        assertThat(e.getDetail(), containsString("latin.sto"));
    }

}
