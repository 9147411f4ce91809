package im.arun.lcms.io;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import im.arun.lcms.model.Book;
import im.arun.lcms.model.CategorySnapshot;
import im.arun.lcms.tree.CategoryNode;
import im.arun.lcms.tree.CategoryTree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Writes the whole category tree, books included, as indented JSON.
 */
public class CatalogJsonExporter {
    private static final Logger logger = LoggerFactory.getLogger(CatalogJsonExporter.class);

    private final CategoryTree tree;
    private final ObjectMapper mapper;

    public CatalogJsonExporter(CategoryTree tree) {
        this.tree = tree;
        this.mapper = new ObjectMapper();
        this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void exportTo(Path path) {
        try {
            mapper.writeValue(path.toFile(), snapshot());
        } catch (IOException e) {
            throw new CatalogIoException("Failed to write JSON catalog", path, e);
        }
        logger.info("Exported category tree to {}", path);
    }

    /**
     * Copy the tree into snapshot objects. Built bottom-up from a pre-order listing so deep
     * trees do not recurse.
     */
    public CategorySnapshot snapshot() {
        List<CategoryNode> nodes = tree.preOrder();
        Map<CategoryNode, CategorySnapshot> copies = new IdentityHashMap<>();

        for (int i = nodes.size() - 1; i >= 0; i--) {
            CategoryNode node = nodes.get(i);
            List<CategorySnapshot> children = new ArrayList<>();
            for (CategoryNode child : node.getChildren()) {
                children.add(copies.get(child));
            }
            copies.put(node, new CategorySnapshot(
                node.getName(),
                node.getBookCount(),
                copyBooks(node.getBooks()),
                children));
        }
        return copies.get(tree.getRoot());
    }

    private static List<Book> copyBooks(List<Book> books) {
        List<Book> copies = new ArrayList<>(books.size());
        for (Book book : books) {
            copies.add(book.copy());
        }
        return copies;
    }
}
