package eu.virtualparadox.regreader.util;

import java.util.Map;
import java.util.OptionalInt;

/**
 * Conversions between the numeral spellings found in Chinese regulatory text
 * (一二三, 十/百/千 units, circled ①②③, full-width digits) and plain integers.
 */
public final class ChineseNumerals {

    private static final Map<Character, Integer> DIGITS = Map.ofEntries(
            Map.entry('零', 0), Map.entry('〇', 0),
            Map.entry('一', 1), Map.entry('二', 2), Map.entry('两', 2),
            Map.entry('三', 3), Map.entry('四', 4), Map.entry('五', 5),
            Map.entry('六', 6), Map.entry('七', 7), Map.entry('八', 8),
            Map.entry('九', 9));

    private static final Map<Character, Integer> UNITS = Map.of('十', 10, '百', 100, '千', 1000);

    private static final char CIRCLED_ONE = '①';
    private static final char CIRCLED_TWENTY = '⑳';

    private ChineseNumerals() {
        // prevent instantiation
    }

    /**
     * Parses ASCII digits, full-width digits, a single circled numeral or a Chinese numeral
     * below ten thousand.
     *
     * @param text numeral text, surrounding whitespace ignored
     * @return parsed value, empty if the text is not a numeral
     */
    public static OptionalInt parse(final String text) {
        if (text == null) {
            return OptionalInt.empty();
        }
        final String s = toHalfWidth(text.strip());
        if (s.isEmpty()) {
            return OptionalInt.empty();
        }
        if (s.chars().allMatch(c -> c >= '0' && c <= '9')) {
            if (s.length() > 9) {
                return OptionalInt.empty();
            }
            return OptionalInt.of(Integer.parseInt(s));
        }
        if (s.length() == 1 && isCircled(s.charAt(0))) {
            return OptionalInt.of(s.charAt(0) - CIRCLED_ONE + 1);
        }
        return parseChinese(s);
    }

    /**
     * @return {@code true} if {@code c} is one of ① to ⑳
     */
    public static boolean isCircled(final char c) {
        return c >= CIRCLED_ONE && c <= CIRCLED_TWENTY;
    }

    /**
     * Folds full-width ASCII variants (U+FF01..U+FF5E) and the ideographic space to their
     * half-width forms.
     */
    public static String toHalfWidth(final String text) {
        final StringBuilder sb = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            final char c = text.charAt(i);
            if (c >= '！' && c <= '～') {
                sb.append((char) (c - 0xFEE0));
            } else if (c == '　') {
                sb.append(' ');
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    private static OptionalInt parseChinese(final String s) {
        int total = 0;
        int current = 0;
        boolean seen = false;
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            final Integer digit = DIGITS.get(c);
            if (digit != null) {
                if (current != 0) {
                    // digit sequences without units ("一二", "二〇二四") are not read positionally
                    return OptionalInt.empty();
                }
                current = digit;
                seen = true;
                continue;
            }
            final Integer unit = UNITS.get(c);
            if (unit == null) {
                return OptionalInt.empty();
            }
            // "十二" has an implicit leading one
            total += (current == 0 ? 1 : current) * unit;
            current = 0;
            seen = true;
        }
        return seen ? OptionalInt.of(total + current) : OptionalInt.empty();
    }
}
