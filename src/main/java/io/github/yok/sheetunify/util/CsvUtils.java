package io.github.yok.sheetunify.util;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.QuoteMode;

/**
 * Utility class for writing CSV files.
 *
 * <p>
 * Files are written in UTF-8 using Apache Commons CSV with a comma delimiter and minimal quoting.
 * Records are separated using the platform's default line separator. A byte-order mark can be
 * prepended so that spreadsheet tools detect the encoding.
 * </p>
 */
public final class CsvUtils {

    /** UTF-8 byte-order mark. */
    public static final char BOM = '\uFEFF';

    private CsvUtils() {
        // Utility class; do not instantiate.
    }

    /**
     * Returns the CSV format used for every file this tool writes.
     *
     * @param headers header row
     * @return comma-delimited format with minimal quoting
     */
    public static CSVFormat csvFormat(String... headers) {
        return CSVFormat.DEFAULT.builder().setHeader(headers).setQuoteMode(QuoteMode.MINIMAL)
                .setRecordSeparator(System.lineSeparator()).get();
    }

    /**
     * Writes the given header and row data to a CSV file encoded in UTF-8.
     *
     * <p>
     * {@code null} cells are written as empty fields.
     * </p>
     *
     * @param csvFile the destination CSV file (will be created or overwritten)
     * @param headers the header columns to write as the first record
     * @param rows the data rows; each inner list represents one CSV record
     * @param withBom {@code true} to start the file with a UTF-8 byte-order mark
     * @throws IOException if an I/O error occurs while writing the file
     */
    public static void writeCsvUtf8(File csvFile, String[] headers, List<List<String>> rows,
            boolean withBom) throws IOException {
        try (Writer w =
                new OutputStreamWriter(new FileOutputStream(csvFile), StandardCharsets.UTF_8)) {
            if (withBom) {
                w.write(BOM);
            }
            try (CSVPrinter printer = new CSVPrinter(w, csvFormat(headers))) {
                for (List<String> row : rows) {
                    printer.printRecord(row);
                }
            }
        }
    }
}
