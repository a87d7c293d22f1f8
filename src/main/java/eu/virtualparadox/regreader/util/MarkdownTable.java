package eu.virtualparadox.regreader.util;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Line-level helpers for pipe-delimited markdown tables.
 * <p>
 * The header of a table is every row up to and including the {@code |---|---|} separator.
 * A table without a separator has no header rows.
 */
public final class MarkdownTable {

    private static final Pattern SEPARATOR =
            Pattern.compile("^\\|?\\s*:?-{3,}:?\\s*(\\|\\s*:?-{3,}:?\\s*)*\\|?$");

    private MarkdownTable() {
        // prevent instantiation
    }

    /**
     * @return all table rows (lines starting with {@code |}) of the given markdown, stripped
     */
    public static List<String> rows(final String markdown) {
        final List<String> rows = new ArrayList<>();
        if (markdown == null) {
            return rows;
        }
        for (final String line : markdown.split("\n")) {
            final String stripped = line.strip();
            if (stripped.startsWith("|")) {
                rows.add(stripped);
            }
        }
        return rows;
    }

    public static boolean isSeparator(final String row) {
        return SEPARATOR.matcher(row.strip()).matches();
    }

    /**
     * @return number of leading rows that form the header, separator included
     */
    public static int headerRowCount(final List<String> rows) {
        for (int i = 0; i < rows.size(); i++) {
            if (isSeparator(rows.get(i))) {
                return i + 1;
            }
        }
        return 0;
    }

    public static List<String> headerRows(final String markdown) {
        final List<String> rows = rows(markdown);
        return new ArrayList<>(rows.subList(0, headerRowCount(rows)));
    }

    public static List<String> dataRows(final String markdown) {
        final List<String> rows = rows(markdown);
        return new ArrayList<>(rows.subList(headerRowCount(rows), rows.size()));
    }

    /**
     * Splits a row into trimmed cell texts.
     */
    public static List<String> cells(final String row) {
        String s = row.strip();
        if (s.startsWith("|")) {
            s = s.substring(1);
        }
        if (s.endsWith("|")) {
            s = s.substring(0, s.length() - 1);
        }
        final List<String> cells = new ArrayList<>();
        for (final String cell : s.split("\\|", -1)) {
            cells.add(cell.strip());
        }
        return cells;
    }

    /**
     * Concatenates segments of one logical table: the first segment is kept whole, every
     * following segment contributes its data rows only.
     *
     * @param segments markdown of each segment in order
     * @return stitched table markdown
     */
    public static String stitch(final List<String> segments) {
        final List<String> out = new ArrayList<>();
        for (int i = 0; i < segments.size(); i++) {
            out.addAll(i == 0 ? rows(segments.get(i)) : dataRows(segments.get(i)));
        }
        return String.join("\n", out);
    }
}
