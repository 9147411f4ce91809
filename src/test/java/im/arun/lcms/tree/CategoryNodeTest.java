package im.arun.lcms.tree;

import im.arun.lcms.model.Book;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class CategoryNodeTest {

    private CategoryNode root;

    @BeforeEach
    void setUp() {
        root = new CategoryTree("Library").getRoot();
    }

    @Test
    void testAddChild_isIdempotent() {
        CategoryNode first = root.addChild("Science");
        CategoryNode second = root.addChild("Science");
        assertSame(first, second);
        assertEquals(1, root.getChildren().size());
        assertSame(root, first.getParent());
        assertEquals(0, first.getBookCount());
    }

    @Test
    void testFindChild_exactCaseSensitiveMatch() {
        root.addChild("Science");
        assertTrue(root.findChild("Science").isPresent());
        assertTrue(root.findChild("science").isEmpty());
    }

    @Test
    void testAddBook_propagatesToAncestors() {
        CategoryNode science = root.addChild("Science");
        CategoryNode physics = science.addChild("Physics");

        assertTrue(physics.addBook(new Book("A", "B", "", 1999)));

        assertEquals(1, physics.getBookCount());
        assertEquals(1, science.getBookCount());
        assertEquals(1, root.getBookCount());
        assertTrue(science.getBooks().isEmpty());
    }

    @Test
    void testAddBook_rejectsLocalDuplicateWithoutSideEffects() {
        CategoryNode physics = root.addChild("Physics");
        physics.addBook(new Book("A", "B", "", 1999));

        assertFalse(physics.addBook(new Book("A", "B", "", 1999)));

        assertEquals(1, physics.getBooks().size());
        assertEquals(1, physics.getBookCount());
        assertEquals(1, root.getBookCount());
    }

    @Test
    void testAddBook_duplicateCheckIsLocalOnly() {
        CategoryNode physics = root.addChild("Physics");
        CategoryNode chemistry = root.addChild("Chemistry");
        physics.addBook(new Book("A", "B", "", 1999));

        assertTrue(chemistry.addBook(new Book("A", "B", "", 1999)));
        assertEquals(2, root.getBookCount());
    }

    @Test
    void testAggregateCount_sumsChildren() {
        CategoryNode science = root.addChild("Science");
        CategoryNode physics = science.addChild("Physics");
        CategoryNode chemistry = science.addChild("Chemistry");
        physics.addBook(new Book("P1", "x", "", 1));
        physics.addBook(new Book("P2", "x", "", 2));
        chemistry.addBook(new Book("C1", "x", "", 3));

        assertEquals(3, science.getBookCount());
        assertEquals(3, root.getBookCount());
    }

    @Test
    void testRemoveBook_firstMatchInInsertionOrder() {
        CategoryNode node = root.addChild("Fiction");
        Book first = new Book("Same", "One", "", 1);
        Book second = new Book("Same", "Two", "", 2);
        node.addBook(first);
        node.addBook(second);

        assertTrue(node.removeBook("Same"));

        assertEquals(List.of(second), node.getBooks());
        assertEquals(1, node.getBookCount());
        assertEquals(1, root.getBookCount());
    }

    @Test
    void testRemoveBook_doesNotSearchDescendants() {
        CategoryNode fiction = root.addChild("Fiction");
        fiction.addChild("Fantasy").addBook(new Book("Hobbit", "Tolkien", "", 1937));

        assertFalse(fiction.removeBook("Hobbit"));
        assertTrue(fiction.findBook("Hobbit").isEmpty());
        assertEquals(1, root.getBookCount());
    }

    @Test
    void testRemoveChild_subtractsSubtreeCount() {
        CategoryNode science = root.addChild("Science");
        CategoryNode physics = science.addChild("Physics");
        physics.addBook(new Book("P1", "x", "", 1));
        physics.addChild("Quantum").addBook(new Book("Q1", "x", "", 1));
        science.addBook(new Book("S1", "x", "", 1));

        assertTrue(science.removeChild("Physics"));

        assertEquals(1, science.getBookCount());
        assertEquals(1, root.getBookCount());
        assertTrue(science.findChild("Physics").isEmpty());
        assertTrue(physics.getChildren().isEmpty());
        assertTrue(physics.getBooks().isEmpty());
    }

    @Test
    void testRemoveChild_missingName() {
        assertFalse(root.removeChild("Nope"));
    }

    @Test
    void testCollectBooks_preOrder() {
        CategoryNode a = root.addChild("A");
        CategoryNode b = root.addChild("B");
        CategoryNode a1 = a.addChild("A1");
        Book rootBook = new Book("r", "", "", 0);
        Book aBook = new Book("a", "", "", 0);
        Book a1Book = new Book("a1", "", "", 0);
        Book bBook = new Book("b", "", "", 0);
        b.addBook(bBook);
        a1.addBook(a1Book);
        a.addBook(aBook);
        root.addBook(rootBook);

        List<Book> out = new ArrayList<>();
        root.collectBooks(out);

        assertEquals(List.of(rootBook, aBook, a1Book, bBook), out);
    }

    @Test
    void testGetPathAndDepth() {
        CategoryNode algorithms = root.addChild("Computer Science").addChild("Algorithms");
        assertEquals("Computer Science/Algorithms", algorithms.getPath());
        assertEquals(2, algorithms.depth());
        assertEquals("", root.getPath());
        assertTrue(root.isRoot());
    }

    @Test
    void testViewsAreReadOnly() {
        assertThrows(UnsupportedOperationException.class, () -> root.getChildren().clear());
        assertThrows(UnsupportedOperationException.class, () -> root.getBooks().add(new Book()));
    }
}
