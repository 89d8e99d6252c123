/**
 *
 */
package org.theseed.cobra.utils;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.apache.commons.lang3.StringUtils;

/**
 * This object reads a tab-delimited file with a header line.  The header is used to locate
 * columns by name, and the data lines are returned through an iterator.  Blank lines are skipped.
 */
public class TabbedLineReader implements Closeable, Iterable<TabbedLineReader.Line> {

    // FIELDS
    /** underlying reader */
    private BufferedReader reader;
    /** column headers */
    private String[] headers;
    /** next data line, or NULL at end of file */
    private String nextLine;
    /** number of data lines read */
    private int lineCount;

    /**
     * This object represents a single data line.
     */
    public class Line {

        /** fields in the line */
        private String[] fields;

        private Line(String text) {
            this.fields = StringUtils.splitPreserveAllTokens(text, '\t');
        }

        /**
         * @return the value in the specified column (empty if the line is short)
         *
         * @param idx	index of the column
         */
        public String get(int idx) {
            String retVal = "";
            if (idx >= 0 && idx < this.fields.length)
                retVal = this.fields[idx].trim();
            return retVal;
        }

        /**
         * @return the numeric value in the specified column, or NULL if it is blank
         *
         * @param idx	index of the column
         *
         * @throws NumberFormatException if the column is not numeric
         */
        public Double getDouble(int idx) {
            String value = this.get(idx);
            Double retVal = null;
            if (! value.isEmpty())
                retVal = Double.valueOf(value);
            return retVal;
        }

        /**
         * @return the number of fields in the line
         */
        public int size() {
            return this.fields.length;
        }

    }

    /**
     * Open a tab-delimited file and read its header.
     *
     * @param inFile	file to open
     *
     * @throws IOException
     */
    public TabbedLineReader(File inFile) throws IOException {
        this.reader = Files.newBufferedReader(inFile.toPath(), StandardCharsets.UTF_8);
        String header = this.reader.readLine();
        if (header == null)
            this.headers = new String[0];
        else {
            this.headers = StringUtils.splitPreserveAllTokens(StringUtils.removeStart(header, "\uFEFF"), '\t');
            for (int i = 0; i < this.headers.length; i++)
                this.headers[i] = this.headers[i].trim();
        }
        this.lineCount = 0;
        this.readAhead();
    }

    /**
     * Read the next non-blank line.
     *
     * @throws IOException
     */
    private void readAhead() throws IOException {
        String line = this.reader.readLine();
        while (line != null && line.isBlank())
            line = this.reader.readLine();
        this.nextLine = line;
    }

    /**
     * @return the index of the named column (case-insensitive), or -1 if there is none
     *
     * @param name	column name to find
     */
    public int findColumn(String name) {
        int retVal = -1;
        for (int i = 0; retVal < 0 && i < this.headers.length; i++) {
            if (this.headers[i].equalsIgnoreCase(name))
                retVal = i;
        }
        return retVal;
    }

    /**
     * @return the column headers
     */
    public String[] getHeaders() {
        return this.headers;
    }

    /**
     * @return the number of data lines read so far
     */
    public int getLineCount() {
        return this.lineCount;
    }

    @Override
    public Iterator<Line> iterator() {
        return new Iterator<Line>() {

            @Override
            public boolean hasNext() {
                return (TabbedLineReader.this.nextLine != null);
            }

            @Override
            public Line next() {
                if (TabbedLineReader.this.nextLine == null)
                    throw new NoSuchElementException("Attempt to read past end of file.");
                Line retVal = new Line(TabbedLineReader.this.nextLine);
                TabbedLineReader.this.lineCount++;
                try {
                    TabbedLineReader.this.readAhead();
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
                return retVal;
            }

        };
    }

    @Override
    public void close() throws IOException {
        this.reader.close();
    }

}
