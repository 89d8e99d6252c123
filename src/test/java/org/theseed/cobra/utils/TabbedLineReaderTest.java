/**
 *
 */
package org.theseed.cobra.utils;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class TabbedLineReaderTest {

    @Test
    void testReader(@TempDir File tempDir) throws IOException {
        File inFile = new File(tempDir, "test.tbl");
        Files.writeString(inFile.toPath(), "\uFEFFid\tName \tvalue\na\tfirst\t1.5\n\nb\tsecond\n", StandardCharsets.UTF_8);
        try (TabbedLineReader reader = new TabbedLineReader(inFile)) {
            assertThat(reader.getHeaders(), arrayContaining("id", "Name", "value"));
            assertThat(reader.findColumn("name"), equalTo(1));
            assertThat(reader.findColumn("missing"), equalTo(-1));
            int valueCol = reader.findColumn("value");
            List<String> ids = new ArrayList<String>();
            List<Double> values = new ArrayList<Double>();
            for (TabbedLineReader.Line line : reader) {
                ids.add(line.get(0));
                values.add(line.getDouble(valueCol));
            }
            assertThat(ids, contains("a", "b"));
            assertThat(values, contains(1.5, null));
            assertThat(reader.getLineCount(), equalTo(2));
        }
        Files.writeString(inFile.toPath(), "id\tvalue\nx\tbad\n", StandardCharsets.UTF_8);
        try (TabbedLineReader reader = new TabbedLineReader(inFile)) {
            TabbedLineReader.Line line = reader.iterator().next();
            assertThat(line.get(5), equalTo(""));
            assertThrows(NumberFormatException.class, () -> line.getDouble(1));
        }
    }

}
