package im.arun.lcms.service;

import im.arun.lcms.config.LcmsConfig;
import im.arun.lcms.csv.CsvCodec;
import im.arun.lcms.io.CatalogExporter;
import im.arun.lcms.io.CatalogImporter;
import im.arun.lcms.io.CatalogJsonExporter;
import im.arun.lcms.model.Book;
import im.arun.lcms.model.BookEdit;
import im.arun.lcms.model.CatalogStatus;
import im.arun.lcms.model.CategoryRemoval;
import im.arun.lcms.model.ImportReport;
import im.arun.lcms.model.KeywordMatches;
import im.arun.lcms.tree.CategoryNode;
import im.arun.lcms.tree.CategoryTree;
import im.arun.lcms.util.CategoryPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Catalog operations behind the command shell. User input is normalized here (trimmed
 * fields, cleaned category paths, parsed years) before it reaches the category tree.
 * Nothing in this class prints; every outcome is returned to the caller.
 */
public class LibraryCatalogService {
    private static final Logger logger = LoggerFactory.getLogger(LibraryCatalogService.class);

    private final CategoryTree tree;
    private final boolean keywordCaseSensitive;

    public LibraryCatalogService(LcmsConfig config) {
        this(new CategoryTree(config.getRootName()), config.isKeywordCaseSensitive());
    }

    public LibraryCatalogService(String rootName) {
        this(new CategoryTree(rootName), false);
    }

    public LibraryCatalogService(CategoryTree tree, boolean keywordCaseSensitive) {
        this.tree = tree;
        this.keywordCaseSensitive = keywordCaseSensitive;
    }

    public CategoryTree getTree() {
        return tree;
    }

    public ImportReport importCsv(Path path) {
        return new CatalogImporter(tree).importFrom(path);
    }

    public int exportCsv(Path path) {
        return new CatalogExporter(tree).exportTo(path);
    }

    public void exportJson(Path path) {
        new CatalogJsonExporter(tree).exportTo(path);
    }

    /**
     * Categories whose name, and books whose title or author, contain the keyword.
     * A blank keyword matches nothing.
     */
    public KeywordMatches find(String keyword) {
        List<CategoryNode> categories = new ArrayList<>();
        List<Book> books = new ArrayList<>();
        String needle = CategoryPaths.trim(keyword);
        if (needle.isEmpty()) {
            return new KeywordMatches(categories, books);
        }

        for (CategoryNode node : tree.preOrder()) {
            if (!node.isRoot() && contains(node.getName(), needle)) {
                categories.add(node);
            }
            for (Book book : node.getBooks()) {
                if (contains(book.getTitle(), needle) || contains(book.getAuthor(), needle)) {
                    books.add(book);
                }
            }
        }
        return new KeywordMatches(categories, books);
    }

    /**
     * Every book under a category; a blank category means the whole library.
     */
    public Optional<List<Book>> findAll(String category) {
        return tree.collectBooks(CategoryPaths.normalize(category));
    }

    public Optional<Book> findBook(String title) {
        return tree.findBook(CategoryPaths.trim(title));
    }

    /**
     * Add a book after validating its fields. Rejected if an equal book exists anywhere in
     * the library.
     */
    public CatalogStatus addBook(String title, String author, String isbn, String yearText, String category) {
        OptionalInt year = CsvCodec.parseYear(yearText);
        if (year.isEmpty()) {
            return CatalogStatus.INVALID_INPUT;
        }
        String path = CategoryPaths.normalize(category);
        if (path.isEmpty()) {
            return CatalogStatus.INVALID_PATH;
        }

        Book candidate = new Book(CategoryPaths.trim(title), CategoryPaths.trim(author),
            CategoryPaths.trim(isbn), year.getAsInt());
        if (tree.containsBook(candidate)) {
            return CatalogStatus.DUPLICATE_REJECTED;
        }
        if (!tree.addBookAt(path, candidate)) {
            return CatalogStatus.DUPLICATE_REJECTED;
        }
        logger.info("Added '{}' to {}", candidate.getTitle(), path);
        return CatalogStatus.OK;
    }

    /**
     * Edit the first book with this title in place. Blank fields keep their value and an
     * unparseable year keeps the old year. If the result would duplicate another book,
     * every field is reverted.
     */
    public CatalogStatus editBook(String title, BookEdit edit) {
        Optional<Book> found = findBook(title);
        if (found.isEmpty()) {
            return CatalogStatus.NOT_FOUND;
        }

        Book book = found.get();
        Book snapshot = book.copy();

        if (isPresent(edit.getTitle())) book.setTitle(CategoryPaths.trim(edit.getTitle()));
        if (isPresent(edit.getAuthor())) book.setAuthor(CategoryPaths.trim(edit.getAuthor()));
        if (isPresent(edit.getIsbn())) book.setIsbn(CategoryPaths.trim(edit.getIsbn()));
        if (isPresent(edit.getPublicationYear())) {
            OptionalInt year = CsvCodec.parseYear(edit.getPublicationYear());
            if (year.isPresent()) {
                book.setPublicationYear(year.getAsInt());
            } else {
                logger.debug("Ignoring invalid year '{}'", edit.getPublicationYear());
            }
        }

        if (tree.containsBookExcept(book, book)) {
            book.restoreFrom(snapshot);
            return CatalogStatus.DUPLICATE_REJECTED;
        }
        logger.info("Edited '{}'", snapshot.getTitle());
        return CatalogStatus.OK;
    }

    /** Path of the category holding this book, empty string for the root. */
    public Optional<String> categoryOf(Book book) {
        return tree.findOwner(book).map(CategoryNode::getPath);
    }

    public CatalogStatus removeBook(String title) {
        if (tree.removeBookByTitle(CategoryPaths.trim(title))) {
            logger.info("Removed book '{}'", title);
            return CatalogStatus.OK;
        }
        return CatalogStatus.NOT_FOUND;
    }

    public Optional<CategoryNode> findCategory(String category) {
        return tree.getNode(CategoryPaths.normalize(category));
    }

    /**
     * Ensure a category path exists.
     */
    public CatalogStatus addCategory(String category) {
        String path = CategoryPaths.normalize(category);
        if (path.isEmpty()) {
            return CatalogStatus.INVALID_PATH;
        }
        tree.createNode(path);
        return CatalogStatus.OK;
    }

    public CatalogStatus renameCategory(String category, String newName) {
        String path = CategoryPaths.normalize(category);
        String name = CategoryPaths.trim(newName);
        if (name.isEmpty() || name.contains(CategoryPaths.DELIMITER)) {
            return CatalogStatus.INVALID_INPUT;
        }

        Optional<CategoryNode> node = tree.getNode(path);
        if (node.isEmpty()) {
            return CatalogStatus.NOT_FOUND;
        }
        if (node.get().isRoot()) {
            return CatalogStatus.ROOT_PROTECTED;
        }
        if (!tree.renameNode(path, name)) {
            return CatalogStatus.DUPLICATE_REJECTED;
        }
        logger.info("Renamed category {} to {}", path, name);
        return CatalogStatus.OK;
    }

    /**
     * Remove a category and its subtree. The books under it are collected before the
     * removal so they can be reported to the user.
     */
    public CategoryRemoval removeCategory(String category) {
        String path = CategoryPaths.normalize(category);
        if (path.isEmpty()) {
            return CategoryRemoval.rejected(CatalogStatus.ROOT_PROTECTED);
        }

        Optional<List<Book>> books = tree.collectBooks(path);
        if (books.isEmpty()) {
            return CategoryRemoval.rejected(CatalogStatus.NOT_FOUND);
        }
        if (!tree.removeNode(path)) {
            return CategoryRemoval.rejected(CatalogStatus.NOT_FOUND);
        }
        logger.info("Removed category {} with {} books", path, books.get().size());
        return new CategoryRemoval(CatalogStatus.OK, books.get());
    }

    private boolean contains(String text, String needle) {
        if (keywordCaseSensitive) {
            return text.contains(needle);
        }
        return text.toLowerCase(Locale.ROOT).contains(needle.toLowerCase(Locale.ROOT));
    }

    private static boolean isPresent(String value) {
        return value != null && !CategoryPaths.trim(value).isEmpty();
    }
}
