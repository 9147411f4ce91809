package im.arun.lcms.io;

import com.fasterxml.jackson.databind.SequenceWriter;
import im.arun.lcms.csv.CsvCodec;
import im.arun.lcms.model.Book;
import im.arun.lcms.model.CatalogRow;
import im.arun.lcms.tree.CategoryNode;
import im.arun.lcms.tree.CategoryTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes the catalog as CSV: a header row, then one row per book in pre-order with the
 * owning category's path (root excluded) in the last column.
 */
public class CatalogExporter {
    private static final Logger logger = LoggerFactory.getLogger(CatalogExporter.class);

    private final CategoryTree tree;

    public CatalogExporter(CategoryTree tree) {
        this.tree = tree;
    }

    /**
     * @return number of book rows written
     */
    public int exportTo(Path path) {
        int rows = 0;
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             SequenceWriter out = CsvCodec.rowWriter().writeValues(writer)) {
            for (CategoryNode node : tree.preOrder()) {
                String category = node.getPath();
                for (Book book : node.getBooks()) {
                    out.write(CatalogRow.of(book, category));
                    rows++;
                }
            }
        } catch (IOException e) {
            throw new CatalogIoException("Failed to write catalog", path, e);
        }

        int atRoot = tree.getRoot().getBooks().size();
        if (atRoot > 0) {
            logger.warn("{} books filed directly under '{}' were exported without a category "
                + "and will be skipped on import", atRoot, tree.getRoot().getName());
        }
        logger.info("Exported {} books to {}", rows, path);
        return rows;
    }
}
