package im.arun.lcms.util;

import java.util.ArrayList;
import java.util.List;

/**
 * Helpers for slash-delimited category paths such as {@code "Computer Science/Algorithms"}.
 * Paths are relative to the root category; the root itself is addressed by an empty path.
 */
public final class CategoryPaths {

    public static final String DELIMITER = "/";

    private CategoryPaths() {}

    /**
     * Split a path on '/' and discard empty segments. Segments are not trimmed.
     * An empty or all-slash path yields an empty list, which addresses the root.
     */
    public static List<String> split(String path) {
        List<String> segments = new ArrayList<>();
        if (path == null || path.isEmpty()) {
            return segments;
        }

        StringBuilder current = new StringBuilder();
        for (int i = 0; i < path.length(); i++) {
            char c = path.charAt(i);
            if (c == '/') {
                if (current.length() > 0) {
                    segments.add(current.toString());
                    current.setLength(0);
                }
            } else {
                current.append(c);
            }
        }
        if (current.length() > 0) {
            segments.add(current.toString());
        }
        return segments;
    }

    /**
     * Strip leading and trailing spaces and tabs. Other whitespace is kept.
     */
    public static String trim(String s) {
        if (s == null) {
            return "";
        }
        int start = 0;
        int end = s.length();
        while (start < end && isBlankChar(s.charAt(start))) {
            start++;
        }
        while (end > start && isBlankChar(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(start, end);
    }

    /**
     * Trim every segment, drop the empty ones and re-join.
     * e.g., {@code " Science // Physics "} -> {@code "Science/Physics"}
     */
    public static String normalize(String path) {
        List<String> cleaned = new ArrayList<>();
        for (String segment : split(path)) {
            String t = trim(segment);
            if (!t.isEmpty()) {
                cleaned.add(t);
            }
        }
        return join(cleaned);
    }

    public static String join(List<String> segments) {
        return String.join(DELIMITER, segments);
    }

    private static boolean isBlankChar(char c) {
        return c == ' ' || c == '\t';
    }
}
