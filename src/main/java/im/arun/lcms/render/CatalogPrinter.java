package im.arun.lcms.render;

import im.arun.lcms.model.Book;
import im.arun.lcms.model.KeywordMatches;
import im.arun.lcms.tree.CategoryNode;
import im.arun.lcms.tree.CategoryTree;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Console rendering for categories and books.
 */
public class CatalogPrinter {
    private static final String INDENT = "  ";

    private final PrintStream out;

    public CatalogPrinter(PrintStream out) {
        this.out = out;
    }

    /** Every category with its total count, followed by its own book titles. */
    public void printTree(CategoryTree tree) {
        for (CategoryNode node : tree.preOrder()) {
            printNodeLine(node, node.depth());
        }
    }

    /** One category and its subtree, indented relative to that category. */
    public void printCategory(CategoryNode category) {
        int base = category.depth();
        List<CategoryNode> pending = new ArrayList<>();
        pending.add(category);
        while (!pending.isEmpty()) {
            CategoryNode node = pending.remove(pending.size() - 1);
            printNodeLine(node, node.depth() - base);
            List<CategoryNode> children = node.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.add(children.get(i));
            }
        }
    }

    public void printBook(Book book) {
        out.println("Title: " + book.getTitle());
        out.println("Author(s): " + book.getAuthor());
        out.println("ISBN: " + book.getIsbn());
        out.println("Year: " + book.getPublicationYear());
    }

    public void printBooks(List<Book> books) {
        if (books.isEmpty()) {
            out.println("No books found.");
            return;
        }
        for (int i = 0; i < books.size(); i++) {
            Book book = books.get(i);
            out.printf("%d. %s | %s | %s | %d%n", i + 1,
                book.getTitle(), book.getAuthor(), book.getIsbn(), book.getPublicationYear());
        }
    }

    public void printMatches(KeywordMatches matches) {
        if (matches.isEmpty()) {
            out.println("No matches found.");
            return;
        }
        if (!matches.getCategories().isEmpty()) {
            out.println("Categories:");
            for (CategoryNode node : matches.getCategories()) {
                out.println(INDENT + node.getPath() + " (" + node.getBookCount() + ")");
            }
        }
        if (!matches.getBooks().isEmpty()) {
            out.println("Books:");
            printBooks(matches.getBooks());
        }
    }

    private void printNodeLine(CategoryNode node, int level) {
        String pad = INDENT.repeat(level);
        out.println(pad + node.getName() + " (" + node.getBookCount() + ")");
        for (Book book : node.getBooks()) {
            out.println(pad + INDENT + "- " + book.getTitle());
        }
    }
}
