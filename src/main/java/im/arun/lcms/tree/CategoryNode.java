package im.arun.lcms.tree;

import im.arun.lcms.model.Book;
import im.arun.lcms.util.CategoryPaths;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A category in the library tree. Each node owns its subcategories and the books filed
 * directly under it, and tracks the number of books in its whole subtree.
 *
 * <p>Invariant: {@code bookCount == books.size() + sum(child.bookCount)}. Every mutation
 * propagates a signed delta from the mutated node up to the root.
 */
public class CategoryNode {

    private String name;
    private final CategoryNode parent;
    private final List<CategoryNode> children = new ArrayList<>();
    private final List<Book> books = new ArrayList<>();
    private int bookCount;

    CategoryNode(String name, CategoryNode parent) {
        this.name = Objects.requireNonNull(name, "name");
        this.parent = parent;
    }

    public String getName() {
        return name;
    }

    /** Parent category, or null for the root. */
    public CategoryNode getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Books in this category and all of its subcategories. */
    public int getBookCount() {
        return bookCount;
    }

    public List<CategoryNode> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Book> getBooks() {
        return Collections.unmodifiableList(books);
    }

    public Optional<CategoryNode> findChild(String childName) {
        for (CategoryNode child : children) {
            if (child.name.equals(childName)) {
                return Optional.of(child);
            }
        }
        return Optional.empty();
    }

    /**
     * Return the child with the given name, creating it if it does not exist yet.
     */
    public CategoryNode addChild(String childName) {
        Optional<CategoryNode> existing = findChild(childName);
        if (existing.isPresent()) {
            return existing.get();
        }
        CategoryNode child = new CategoryNode(childName, this);
        children.add(child);
        return child;
    }

    /**
     * Remove a direct subcategory and everything below it.
     *
     * @return false if no child has that name
     */
    public boolean removeChild(String childName) {
        for (int i = 0; i < children.size(); i++) {
            CategoryNode child = children.get(i);
            if (child.name.equals(childName)) {
                int delta = child.bookCount;
                children.remove(i);
                child.discard();
                propagate(-delta);
                return true;
            }
        }
        return false;
    }

    /**
     * File a book directly under this category.
     *
     * @return false if an equal book is already filed directly here
     */
    public boolean addBook(Book book) {
        Objects.requireNonNull(book, "book");
        for (Book existing : books) {
            if (existing.isSameBook(book)) {
                return false;
            }
        }
        books.add(book);
        propagate(1);
        return true;
    }

    /**
     * Remove the first book filed directly here with the exact title.
     */
    public boolean removeBook(String title) {
        for (int i = 0; i < books.size(); i++) {
            if (books.get(i).getTitle().equals(title)) {
                books.remove(i);
                propagate(-1);
                return true;
            }
        }
        return false;
    }

    /** First book filed directly here with the exact title. Subcategories are not searched. */
    public Optional<Book> findBook(String title) {
        for (Book book : books) {
            if (book.getTitle().equals(title)) {
                return Optional.of(book);
            }
        }
        return Optional.empty();
    }

    /**
     * Append every book in this subtree to {@code out}, this node's books first, then each
     * child's subtree in order.
     */
    public void collectBooks(List<Book> out) {
        Deque<CategoryNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            CategoryNode current = stack.pop();
            out.addAll(current.books);
            // Push in reverse so the first child is popped first
            for (int i = current.children.size() - 1; i >= 0; i--) {
                stack.push(current.children.get(i));
            }
        }
    }

    /** Sibling-name uniqueness is checked by the caller. */
    void rename(String newName) {
        this.name = Objects.requireNonNull(newName, "newName");
    }

    /** Path from just below the root, e.g. {@code "Science/Physics"}; empty for the root. */
    public String getPath() {
        List<String> segments = new ArrayList<>();
        for (CategoryNode cur = this; cur != null && !cur.isRoot(); cur = cur.parent) {
            segments.add(cur.name);
        }
        Collections.reverse(segments);
        return CategoryPaths.join(segments);
    }

    public int depth() {
        int depth = 0;
        for (CategoryNode cur = parent; cur != null; cur = cur.parent) {
            depth++;
        }
        return depth;
    }

    private void propagate(int delta) {
        for (CategoryNode cur = this; cur != null; cur = cur.parent) {
            cur.bookCount += delta;
        }
    }

    /**
     * Tear down a detached subtree without recursion.
     */
    private void discard() {
        Deque<CategoryNode> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            CategoryNode current = stack.pop();
            for (CategoryNode child : current.children) {
                stack.push(child);
            }
            current.children.clear();
            current.books.clear();
            current.bookCount = 0;
        }
    }

    @Override
    public String toString() {
        return "CategoryNode{name='" + name + "', books=" + books.size() + ", total=" + bookCount + "}";
    }
}
