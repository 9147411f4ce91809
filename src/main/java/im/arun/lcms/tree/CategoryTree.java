package im.arun.lcms.tree;

import im.arun.lcms.model.Book;
import im.arun.lcms.util.CategoryPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * The library's category hierarchy. Wraps the root category and resolves slash-delimited
 * paths into nodes.
 *
 * <p>Whole-tree searches ({@link #findBook}, {@link #removeBookByTitle}, {@link #containsBook})
 * walk the tree depth-first with an explicit stack: children are pushed in insertion order, so
 * the most recently discovered node is visited next.
 */
public class CategoryTree {
    private static final Logger logger = LoggerFactory.getLogger(CategoryTree.class);

    private final CategoryNode root;

    public CategoryTree(String rootName) {
        this.root = new CategoryNode(rootName, null);
    }

    public CategoryNode getRoot() {
        return root;
    }

    /**
     * Resolve a path to an existing node. An empty path resolves to the root.
     */
    public Optional<CategoryNode> getNode(String path) {
        CategoryNode current = root;
        for (String segment : CategoryPaths.split(path)) {
            Optional<CategoryNode> next = current.findChild(segment);
            if (next.isEmpty()) {
                return Optional.empty();
            }
            current = next.get();
        }
        return Optional.of(current);
    }

    /**
     * Ensure every segment of the path exists and return the last one.
     */
    public CategoryNode createNode(String path) {
        CategoryNode current = root;
        for (String segment : CategoryPaths.split(path)) {
            current = current.addChild(segment);
        }
        return current;
    }

    /**
     * Remove the category at the path together with its whole subtree.
     *
     * @return false for the root, or when the path does not resolve
     */
    public boolean removeNode(String path) {
        List<String> segments = CategoryPaths.split(path);
        if (segments.isEmpty()) {
            return false;
        }

        String last = segments.get(segments.size() - 1);
        String parentPath = CategoryPaths.join(segments.subList(0, segments.size() - 1));
        Optional<CategoryNode> parent = getNode(parentPath);
        if (parent.isEmpty()) {
            return false;
        }

        boolean removed = parent.get().removeChild(last);
        if (removed) {
            logger.debug("Removed category {}", CategoryPaths.join(segments));
        }
        return removed;
    }

    /** First book anywhere in the tree whose title matches exactly. */
    public Optional<Book> findBook(String title) {
        Deque<CategoryNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CategoryNode current = stack.pop();
            Optional<Book> found = current.findBook(title);
            if (found.isPresent()) {
                return found;
            }
            pushChildren(stack, current);
        }
        return Optional.empty();
    }

    /**
     * Create the category path if needed and file the book there.
     *
     * @return false if the category already holds an equal book
     */
    public boolean addBookAt(String categoryPath, Book book) {
        CategoryNode node = createNode(categoryPath);
        return node.addBook(book);
    }

    /** Remove the first book anywhere in the tree whose title matches exactly. */
    public boolean removeBookByTitle(String title) {
        Deque<CategoryNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CategoryNode current = stack.pop();
            if (current.removeBook(title)) {
                return true;
            }
            pushChildren(stack, current);
        }
        return false;
    }

    /** Books in the subtree at the path, in pre-order. Empty if the path does not resolve. */
    public Optional<List<Book>> collectBooks(String path) {
        return getNode(path).map(node -> {
            List<Book> books = new ArrayList<>();
            node.collectBooks(books);
            return books;
        });
    }

    /** Library-wide duplicate check. */
    public boolean containsBook(Book candidate) {
        return containsBookExcept(candidate, null);
    }

    /**
     * Library-wide duplicate check that ignores one book instance, used when that book is
     * being edited in place.
     */
    public boolean containsBookExcept(Book candidate, Book skip) {
        Deque<CategoryNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CategoryNode current = stack.pop();
            for (Book book : current.getBooks()) {
                if (book != skip && book.isSameBook(candidate)) {
                    return true;
                }
            }
            pushChildren(stack, current);
        }
        return false;
    }

    /** The category that directly holds this book instance. */
    public Optional<CategoryNode> findOwner(Book book) {
        Deque<CategoryNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CategoryNode current = stack.pop();
            for (Book b : current.getBooks()) {
                if (b == book) {
                    return Optional.of(current);
                }
            }
            pushChildren(stack, current);
        }
        return Optional.empty();
    }

    /**
     * All nodes in pre-order: a node before its children, children in insertion order.
     * The list is a snapshot; mutating the tree does not affect it.
     */
    public List<CategoryNode> preOrder() {
        List<CategoryNode> nodes = new ArrayList<>();
        Deque<CategoryNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            CategoryNode current = stack.pop();
            nodes.add(current);
            List<CategoryNode> children = current.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return nodes;
    }

    /**
     * Rename the category at the path.
     *
     * @return false for the root, a missing path, or a name already used by a sibling
     */
    public boolean renameNode(String path, String newName) {
        Optional<CategoryNode> node = getNode(path);
        if (node.isEmpty() || node.get().isRoot()) {
            return false;
        }
        CategoryNode target = node.get();
        if (target.getName().equals(newName)) {
            return true;
        }
        if (target.getParent().findChild(newName).isPresent()) {
            return false;
        }
        target.rename(newName);
        return true;
    }

    private static void pushChildren(Deque<CategoryNode> stack, CategoryNode node) {
        for (CategoryNode child : node.getChildren()) {
            stack.push(child);
        }
    }
}
