/**
 *
 */
package org.theseed.cobra.io.sbml;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.cobra.io.SchemaViolationException;
import org.theseed.cobra.io.UnsupportedSbmlVersionException;
import org.theseed.cobra.model.CobraModel;
import org.theseed.cobra.model.Metabolite;
import org.theseed.cobra.model.Reaction;
import org.theseed.cobra.model.SampleModels;

class SbmlModelCodecTest {

    @Test
    void testFbc2() throws IOException {
        SbmlModelCodec codec = new SbmlModelCodec();
        CobraModel model = codec.read(new File("data/sbml", "l3_fbc2.xml"));
        assertThat(model.getId(), equalTo("toy_l3"));
        assertThat(model.getName(), equalTo("Toy L3 model"));
        assertThat(model.getCompartments().keySet(), contains("c", "e", "b"));
        assertThat(model.getMetabolites().size(), equalTo(8));
        Metabolite glc = model.getMetabolite("glc__D[e]");
        assertThat(glc.getCompartment(), equalTo("e"));
        assertThat(glc.getCharge(), equalTo(0));
        assertThat(glc.getFormula(), equalTo("C6H12O6"));
        assertThat(glc.getAnnotations().get("kegg.compound"), contains("C00031"));
        assertThat(glc.getAnnotations().get("bigg.metabolite"), contains("glc__D"));
        Metabolite sink = model.getMetabolite("glc__D[b]");
        assertThat(sink.isBoundary(), equalTo(true));
        assertThat(sink.getCharge(), nullValue());
        Reaction exchange = model.getReaction("EX_glc__D_e");
        assertThat(exchange.getLowerBound(), equalTo(-10.0));
        assertThat(exchange.getUpperBound(), equalTo(1000.0));
        Reaction hex = model.getReaction("HEX1");
        assertThat(hex.getFormula(), equalTo("atp[c] + glc__D[c] -> adp[c] + g6p[c] + h[c]"));
        // The gene-product association wins over the notes.
        assertThat(hex.getRule().toString(), equalTo("b2388 or (b1817 and b1818)"));
        assertThat(hex.getAnnotations().get(SbmlModelCodec.EC_KEY), contains("2.7.1.1"));
        assertThat(hex.getAnnotations().get(SbmlModelCodec.SUBSYSTEM_KEY), contains("Glycolysis"));
        Reaction atpm = model.getReaction("ATPM");
        assertThat(atpm.getLowerBound(), equalTo(3.15));
        assertThat(atpm.getObjective(), equalTo(1.0));
        assertThat(atpm.getStoichiometry().get("atp[c]"), equalTo(-2.0));
        assertThat(hex.getObjective(), equalTo(0.0));
        assertThat(model.getGenes().size(), equalTo(3));
        assertThat(model.getGene("b2388").getName(), equalTo("glk"));
        assertThat(model.getGene("b1818").getName(), equalTo("b1818"));
        assertThat(model.getGene("b9999"), nullValue());
    }

    @Test
    void testLevel3Precedence() throws IOException {
        CobraModel model = new SbmlModelCodec().read(new File("data/sbml", "l3_precedence.xml"));
        Metabolite a = model.getMetabolite("a[c]");
        assertThat(a.getCharge(), equalTo(2));
        assertThat(a.getFormula(), equalTo("C2H4"));
        Metabolite b = model.getMetabolite("b[c]");
        assertThat(b.getCharge(), equalTo(3));
        assertThat(b.getFormula(), equalTo("CO2"));
        Reaction reaction = model.getReaction("AB");
        assertThat(reaction.getRule().toString(), equalTo("g1"));
        assertThat(reaction.isReversible(), equalTo(true));
        assertThat(reaction.getLowerBound(), equalTo(-Reaction.getDefaultBound()));
        assertThat(model.getGenes().size(), equalTo(1));
    }

    @Test
    void testLevel2Precedence() throws IOException {
        CobraModel model = new SbmlModelCodec().read(new File("data/sbml", "l2_precedence.xml"));
        assertThat(model.getId(), equalTo("legacy"));
        Metabolite a = model.getMetabolite("a[c]");
        assertThat(a.getCharge(), equalTo(-1));
        assertThat(a.getFormula(), equalTo("C2H4"));
        assertThat(model.getMetabolite("b[e]").getCharge(), equalTo(1));
        // The boundary metabolite's suffix does not match its compartment.
        assertThat(model.getMetabolite("b_b").isBoundary(), equalTo(true));
        Reaction reaction = model.getReaction("AB");
        assertThat(reaction.getLowerBound(), equalTo(-5.0));
        assertThat(reaction.getUpperBound(), equalTo(50.0));
        assertThat(reaction.getObjective(), equalTo(1.0));
        assertThat(reaction.getStoichiometry().get("a[c]"), equalTo(-2.0));
        assertThat(reaction.getStoichiometry().get("b[e]"), equalTo(1.0));
        assertThat(reaction.getRule().toString(), equalTo("(g1 and g2) or g3"));
        assertThat(reaction.getAnnotations().get(SbmlModelCodec.EC_KEY), contains("1.1.1.1"));
        assertThat(reaction.getAnnotations().get(SbmlModelCodec.SUBSYSTEM_KEY), contains("Transport"));
        assertThat(model.getGenes().size(), equalTo(3));
        Reaction exchange = model.getReaction("EX_b");
        assertThat(exchange.getLowerBound(), equalTo(-Reaction.getDefaultBound()));
        assertThat(exchange.getRule().isEmpty(), equalTo(true));
    }

    @Test
    void testFbc1() throws IOException {
        CobraModel model = new SbmlModelCodec().read(new File("data/sbml", "l3_fbc1.xml"));
        assertThat(model.getMetabolite("a[c]").getCharge(), equalTo(-1));
        Reaction r1 = model.getReaction("R1");
        assertThat(r1.getLowerBound(), equalTo(-20.0));
        assertThat(r1.getUpperBound(), equalTo(30.0));
        assertThat(r1.getObjective(), equalTo(0.0));
        Reaction r2 = model.getReaction("R2");
        assertThat(r2.getLowerBound(), equalTo(4.0));
        assertThat(r2.getUpperBound(), equalTo(4.0));
        assertThat(r2.getObjective(), equalTo(2.0));
    }

    @Test
    void testLevel1() throws IOException {
        CobraModel model = new SbmlModelCodec().read(new File("data/sbml", "l1.xml"));
        assertThat(model.getId(), equalTo("ancient"));
        assertThat(model.getCompartments().keySet(), contains("c"));
        assertThat(model.getMetabolite("a[c]").getCharge(), equalTo(-1));
        assertThat(model.getMetabolite("b[c]").getCharge(), nullValue());
        Reaction reaction = model.getReaction("AB");
        assertThat(reaction.getStoichiometry().get("a[c]"), equalTo(-2.0));
        assertThat(reaction.getStoichiometry().get("b[c]"), equalTo(1.0));
        assertThat(reaction.getLowerBound(), equalTo(0.0));
        assertThat(reaction.getUpperBound(), equalTo(25.0));
    }

    @Test
    void testRejections() {
        SbmlModelCodec codec = new SbmlModelCodec();
        UnsupportedSbmlVersionException e = assertThrows(UnsupportedSbmlVersionException.class,
                () -> codec.read(new File("data/sbml", "l3v2_fbc1.xml")));
        assertThat(e.getMessage(), containsString("FBC version 1"));
        SchemaViolationException e2 = assertThrows(SchemaViolationException.class,
                () -> codec.read(new File("data/sbml", "dangling.xml")));
        assertThat(e2.getProblems(), hasItem(containsString("M_zz_c")));
    }

    @Test
    void testRoundTrip(@TempDir File tempDir) throws IOException {
        CobraModel model = SampleModels.glycolysis();
        SbmlModelCodec codec = new SbmlModelCodec();
        File outFile = new File(tempDir, "toy.xml");
        codec.write(model, outFile);
        String text = Files.readString(outFile.toPath(), StandardCharsets.UTF_8);
        assertThat(text, containsString("level=\"3\""));
        assertThat(text, containsString("fbc/version2"));
        assertThat(text, containsString("M_glc__D_e"));
        assertThat(text, containsString("https://identifiers.org/kegg.compound/C00031"));
        CobraModel model2 = codec.read(outFile);
        assertThat(model2.getId(), equalTo(model.getId()));
        assertThat(model2.getCompartments(), equalTo(model.getCompartments()));
        for (Metabolite met : model.getMetabolites())
            assertThat(met.getId(), model2.getMetabolite(met.getId()), equalTo(met));
        for (Reaction reaction : model.getReactions())
            assertThat(reaction.getId(), model2.getReaction(reaction.getId()), equalTo(reaction));
        assertThat(model2.getGenes(), equalTo(model.getGenes()));
        assertThat(model2, equalTo(model));
    }

    @Test
    void testVerbatimIdRoundTrip(@TempDir File tempDir) throws IOException {
        // These IDs already end in their compartment suffix and must not gain brackets.
        CobraModel.Builder builder = new CobraModel.Builder("verbatim");
        builder.addCompartment("c", "cytosol");
        builder.addCompartment("e", "extracellular space");
        for (String id : new String[] { "a_c", "b_c" }) {
            Metabolite met = new Metabolite(id);
            met.setCompartment("c");
            builder.addMetabolite(met);
        }
        Metabolite ext = new Metabolite("x-1[e]");
        ext.setCompartment("e");
        builder.addMetabolite(ext);
        Reaction reaction = new Reaction("AB");
        reaction.addStoich("a_c", -1.0).addStoich("b_c", 1.0).addStoich("x-1[e]", 1.0);
        builder.addReaction(reaction);
        CobraModel model = builder.build();
        SbmlModelCodec codec = new SbmlModelCodec();
        File outFile = new File(tempDir, "verbatim.xml");
        codec.write(model, outFile);
        CobraModel model2 = codec.read(outFile);
        assertThat(model2.getMetabolite("a_c"), equalTo(model.getMetabolite("a_c")));
        assertThat(model2.getMetabolite("b_c"), equalTo(model.getMetabolite("b_c")));
        assertThat(model2.getMetabolite("x-1[e]"), equalTo(ext));
        assertThat(model2.getMetabolite("a[c]"), nullValue());
        assertThat(model2.getReaction("AB"), equalTo(reaction));
    }

}
