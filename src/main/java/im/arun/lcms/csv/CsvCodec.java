package im.arun.lcms.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import im.arun.lcms.model.Book;
import im.arun.lcms.util.CategoryPaths;

import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.OptionalInt;

/**
 * CSV layout of the catalog: {@code Title,Author,ISBN,Publication Year,Category}.
 * Text columns are always quoted (embedded quotes doubled); the year is a bare number.
 */
public final class CsvCodec {

    public static final String[] COLUMNS = {"Title", "Author", "ISBN", "Publication Year", "Category"};
    public static final String HEADER = String.join(",", COLUMNS);
    public static final int FIELD_COUNT = COLUMNS.length;

    private static final CsvMapper MAPPER = new CsvMapper();

    /** Export rows, header included. */
    public static final CsvSchema ROW_SCHEMA = CsvSchema.builder()
        .addColumn("Title")
        .addColumn("Author")
        .addColumn("ISBN")
        .addNumberColumn("Publication Year")
        .addColumn("Category")
        .build()
        .withHeader();

    /** A single book without its category, as produced by {@link Book#toCsvRow()}. */
    private static final CsvSchema BOOK_SCHEMA = CsvSchema.builder()
        .addColumn("title")
        .addColumn("author")
        .addColumn("isbn")
        .addNumberColumn("publication_year")
        .build()
        .withoutHeader();

    static {
        MAPPER.enable(CsvGenerator.Feature.ALWAYS_QUOTE_STRINGS);
        MAPPER.enable(CsvGenerator.Feature.ALWAYS_QUOTE_EMPTY_STRINGS);
        MAPPER.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        MAPPER.enable(CsvParser.Feature.TRIM_SPACES);
        MAPPER.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    private CsvCodec() {}

    /**
     * Raw rows of a catalog file, one string array per record. Quoted fields may span lines.
     * Field counts are not checked here.
     */
    public static MappingIterator<String[]> readRows(Reader reader) throws IOException {
        ObjectReader rowReader = MAPPER.readerFor(String[].class);
        return rowReader.readValues(reader);
    }

    public static ObjectWriter rowWriter() {
        return MAPPER.writer(ROW_SCHEMA);
    }

    /**
     * Serialize a book as {@code Title,Author,ISBN,Year} with no trailing line separator.
     */
    public static String formatBook(Book book) {
        try {
            String row = MAPPER.writer(BOOK_SCHEMA).writeValueAsString(book);
            return stripLineSeparator(row);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to format book " + book.getTitle(), e);
        }
    }

    /** The header row, matched column for column. */
    public static boolean isHeader(String[] row) {
        return Arrays.equals(COLUMNS, row);
    }

    /**
     * Parse a year: optional leading '-', then digits only. Surrounding spaces are ignored.
     */
    public static OptionalInt parseYear(String text) {
        String t = CategoryPaths.trim(text);
        if (t.isEmpty()) {
            return OptionalInt.empty();
        }

        int i = 0;
        int sign = 1;
        if (t.charAt(0) == '-') {
            sign = -1;
            i = 1;
        }
        if (i >= t.length()) {
            return OptionalInt.empty();
        }

        long limit = sign < 0 ? Integer.MAX_VALUE + 1L : Integer.MAX_VALUE;
        long value = 0;
        for (; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c < '0' || c > '9') {
                return OptionalInt.empty();
            }
            value = value * 10 + (c - '0');
            if (value > limit) {
                return OptionalInt.empty();
            }
        }
        return OptionalInt.of((int) (sign * value));
    }

    private static String stripLineSeparator(String row) {
        int end = row.length();
        while (end > 0 && (row.charAt(end - 1) == '\n' || row.charAt(end - 1) == '\r')) {
            end--;
        }
        return row.substring(0, end);
    }
}
