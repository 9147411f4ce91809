package im.arun.lcms.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts from one CSV import. {@code uncategorized} rows had an empty category (books
 * exported from the root category) and were skipped.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ImportReport {
    private int imported;
    private int duplicates;
    private int malformed;
    private int uncategorized;
}
