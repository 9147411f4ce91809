package im.arun.lcms.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Result of removing a category: the status and the books that were filed under it.
 */
@Data
@AllArgsConstructor
public class CategoryRemoval {
    private CatalogStatus status;
    private List<Book> removedBooks;

    public static CategoryRemoval rejected(CatalogStatus status) {
        return new CategoryRemoval(status, List.of());
    }
}
