package im.arun.lcms.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One exported CSV row: a book plus the path of the category holding it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonPropertyOrder({"Title", "Author", "ISBN", "Publication Year", "Category"})
public class CatalogRow {

    @JsonProperty("Title")
    private String title;

    @JsonProperty("Author")
    private String author;

    @JsonProperty("ISBN")
    private String isbn;

    @JsonProperty("Publication Year")
    private int publicationYear;

    @JsonProperty("Category")
    private String category;

    public static CatalogRow of(Book book, String category) {
        return new CatalogRow(book.getTitle(), book.getAuthor(), book.getIsbn(),
            book.getPublicationYear(), category);
    }
}
