package im.arun.lcms.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw replacement values for an edit. Blank fields keep the current value.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class BookEdit {
    private String title;
    private String author;
    private String isbn;
    private String publicationYear;
}
