package im.arun.lcms.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Serializable copy of one category and its subtree, used for JSON export.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public class CategorySnapshot {

    @JsonProperty("name")
    private String name;

    @JsonProperty("book_count")
    private int bookCount;

    @JsonProperty("books")
    private List<Book> books;

    @JsonProperty("subcategories")
    private List<CategorySnapshot> subcategories;
}
