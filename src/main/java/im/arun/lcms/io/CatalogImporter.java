package im.arun.lcms.io;

import com.fasterxml.jackson.databind.MappingIterator;
import im.arun.lcms.csv.CsvCodec;
import im.arun.lcms.model.Book;
import im.arun.lcms.model.ImportReport;
import im.arun.lcms.tree.CategoryTree;
import im.arun.lcms.util.CategoryPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.OptionalInt;

/**
 * Loads books from a CSV file into the category tree.
 * Malformed rows and books already present anywhere in the library are skipped.
 */
public class CatalogImporter {
    private static final Logger logger = LoggerFactory.getLogger(CatalogImporter.class);

    private final CategoryTree tree;

    public CatalogImporter(CategoryTree tree) {
        this.tree = tree;
    }

    public ImportReport importFrom(Path path) {
        ImportReport report = new ImportReport();

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> rows = CsvCodec.readRows(reader)) {
            boolean firstRow = true;

            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                if (firstRow) {
                    firstRow = false;
                    if (CsvCodec.isHeader(row)) {
                        continue;
                    }
                }
                importRow(row, rows.getCurrentLocation().getLineNr(), report);
            }
        } catch (IOException e) {
            throw new CatalogIoException("Failed to read catalog", path, e);
        }

        logger.info("Imported {} books from {} ({} duplicates, {} malformed, {} uncategorized)",
            report.getImported(), path, report.getDuplicates(), report.getMalformed(),
            report.getUncategorized());
        return report;
    }

    private void importRow(String[] fields, int lineNumber, ImportReport report) {
        if (fields.length != CsvCodec.FIELD_COUNT) {
            logger.debug("Line {}: expected {} fields, got {}", lineNumber, CsvCodec.FIELD_COUNT, fields.length);
            report.setMalformed(report.getMalformed() + 1);
            return;
        }

        OptionalInt year = CsvCodec.parseYear(fields[3]);
        if (year.isEmpty()) {
            logger.debug("Line {}: invalid year '{}'", lineNumber, fields[3]);
            report.setMalformed(report.getMalformed() + 1);
            return;
        }

        String category = CategoryPaths.normalize(fields[4]);
        if (category.isEmpty()) {
            logger.debug("Line {}: no category for '{}'", lineNumber, fields[0]);
            report.setUncategorized(report.getUncategorized() + 1);
            return;
        }

        Book book = new Book(fields[0], fields[1], fields[2], year.getAsInt());
        if (tree.containsBook(book) || !tree.addBookAt(category, book)) {
            report.setDuplicates(report.getDuplicates() + 1);
            return;
        }
        report.setImported(report.getImported() + 1);
    }
}
