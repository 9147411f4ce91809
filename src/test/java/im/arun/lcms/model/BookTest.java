package im.arun.lcms.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class BookTest {

    // --- Construction ---

    @Test
    void testDefaultConstructor_emptyFields() {
        Book book = new Book();
        assertEquals("", book.getTitle());
        assertEquals("", book.getAuthor());
        assertEquals("", book.getIsbn());
        assertEquals(0, book.getPublicationYear());
    }

    @Test
    void testNullFields_normalizedToEmpty() {
        Book book = new Book(null, null, null, 1999);
        assertEquals("", book.getTitle());
        book.setAuthor(null);
        assertEquals("", book.getAuthor());
    }

    // --- isSameBook ---

    @Test
    void testIsSameBook_matchingIsbnIgnoresOtherFields() {
        Book a = new Book("Dune", "Frank Herbert", "9780441013593", 1965);
        Book b = new Book("Dune (Deluxe)", "F. Herbert", "9780441013593", 2019);
        assertTrue(a.isSameBook(b));
    }

    @Test
    void testIsSameBook_differentIsbnNeverEqual() {
        Book a = new Book("Dune", "Frank Herbert", "111", 1965);
        Book b = new Book("Dune", "Frank Herbert", "222", 1965);
        assertFalse(a.isSameBook(b));
    }

    @Test
    void testIsSameBook_emptyIsbnFallsBackToTriple() {
        Book a = new Book("A", "B", "", 1999);
        Book b = new Book("A", "B", "123", 1999);
        assertTrue(a.isSameBook(b));
        assertTrue(b.isSameBook(a));
        assertFalse(a.isSameBook(new Book("A", "B", "", 2000)));
        assertFalse(a.isSameBook(new Book("A", "C", "", 1999)));
    }

    @Test
    void testIsSameBook_null() {
        assertFalse(new Book().isSameBook(null));
    }

    @Test
    void testEquals_isIdentity() {
        Book a = new Book("A", "B", "", 1999);
        assertNotEquals(a, new Book("A", "B", "", 1999));
    }

    // --- CSV ---

    @Test
    void testToCsvRow_quotesTextFields() {
        Book book = new Book("Clean Code", "Robert C. Martin", "9780132350884", 2008);
        assertEquals("\"Clean Code\",\"Robert C. Martin\",\"9780132350884\",2008", book.toCsvRow());
    }

    @Test
    void testToCsvRow_doublesEmbeddedQuotesAndKeepsNegativeYear() {
        Book book = new Book("The \"Odyssey\", Book I", "Homer", "", -700);
        assertEquals("\"The \"\"Odyssey\"\", Book I\",\"Homer\",\"\",-700", book.toCsvRow());
    }

    // --- Snapshots ---

    @Test
    void testCopyAndRestore() {
        Book book = new Book("A", "B", "1", 1999);
        Book snapshot = book.copy();
        book.setTitle("Z");
        book.setPublicationYear(5);
        book.restoreFrom(snapshot);
        assertEquals("A", book.getTitle());
        assertEquals(1999, book.getPublicationYear());
        assertNotSame(book, snapshot);
    }
}
