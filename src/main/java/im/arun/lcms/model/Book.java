package im.arun.lcms.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import im.arun.lcms.csv.CsvCodec;
import lombok.Getter;

/**
 * A single catalog entry. Owned by exactly one category node at a time.
 *
 * <p>Equality between books is decided by {@link #isSameBook(Book)}, not {@link #equals(Object)}:
 * the ISBN-or-triple rule is not transitive, so books keep identity equality and the
 * de-duplication rule lives in its own method.
 */
@Getter
public class Book {

    @JsonProperty("title")
    private String title;

    @JsonProperty("author")
    private String author;

    @JsonProperty("isbn")
    private String isbn;

    @JsonProperty("publication_year")
    private int publicationYear;

    public Book() {
        this("", "", "", 0);
    }

    public Book(String title, String author, String isbn, int publicationYear) {
        this.title = nonNull(title);
        this.author = nonNull(author);
        this.isbn = nonNull(isbn);
        this.publicationYear = publicationYear;
    }

    public void setTitle(String title) {
        this.title = nonNull(title);
    }

    public void setAuthor(String author) {
        this.author = nonNull(author);
    }

    public void setIsbn(String isbn) {
        this.isbn = nonNull(isbn);
    }

    public void setPublicationYear(int publicationYear) {
        this.publicationYear = publicationYear;
    }

    /**
     * De-duplication rule used throughout the catalog.
     * Two books with non-empty ISBNs are the same iff the ISBNs match; otherwise
     * title, author and publication year must all match.
     */
    public boolean isSameBook(Book other) {
        if (other == null) {
            return false;
        }
        if (!isbn.isEmpty() && !other.isbn.isEmpty()) {
            return isbn.equals(other.isbn);
        }
        return title.equals(other.title)
            && author.equals(other.author)
            && publicationYear == other.publicationYear;
    }

    /**
     * Serialize as {@code Title,Author,ISBN,Year} with quoted text fields.
     */
    public String toCsvRow() {
        return CsvCodec.formatBook(this);
    }

    public Book copy() {
        return new Book(title, author, isbn, publicationYear);
    }

    /**
     * Overwrite every field with the values of a snapshot taken by {@link #copy()}.
     */
    public void restoreFrom(Book snapshot) {
        this.title = snapshot.title;
        this.author = snapshot.author;
        this.isbn = snapshot.isbn;
        this.publicationYear = snapshot.publicationYear;
    }

    @Override
    public String toString() {
        return "Book{title='" + title + "', author='" + author + "', isbn='" + isbn
            + "', year=" + publicationYear + "}";
    }

    private static String nonNull(String value) {
        return value == null ? "" : value;
    }
}
