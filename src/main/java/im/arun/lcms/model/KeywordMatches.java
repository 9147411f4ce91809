package im.arun.lcms.model;

import im.arun.lcms.tree.CategoryNode;
import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.List;

/**
 * Categories and books matching a keyword search, both in pre-order.
 */
@Data
@AllArgsConstructor
public class KeywordMatches {
    private List<CategoryNode> categories;
    private List<Book> books;

    public boolean isEmpty() {
        return categories.isEmpty() && books.isEmpty();
    }
}
