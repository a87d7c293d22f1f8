package eu.virtualparadox.regreader.util;

import java.util.Locale;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Maps the many spellings of an annotation marker to one canonical id.
 * <p>
 * "注1", "注①", "注一", "注 1：" and "注０１" all become {@code 注1}; "方案甲", "方案a" and
 * "方案 A" become {@code 方案A}. The mapping is a pure function of the raw text and
 * {@code normalize(normalize(x)).equals(normalize(x))} holds for every input.
 */
public final class AnnotationIdNormalizer {

    public static final String NOTE_PREFIX = "注";
    public static final String PLAN_PREFIX = "方案";

    private static final Map<Character, Character> STEMS = Map.of(
            '甲', 'A', '乙', 'B', '丙', 'C', '丁', 'D',
            '戊', 'E', '己', 'F', '庚', 'G', '辛', 'H');

    private AnnotationIdNormalizer() {
        // prevent instantiation
    }

    /**
     * @param rawId annotation marker as printed in the document
     * @return canonical id
     */
    public static String normalize(final String rawId) {
        if (rawId == null) {
            throw new IllegalArgumentException("rawId must not be null");
        }
        final String cleaned = clean(rawId);
        if (cleaned.startsWith(PLAN_PREFIX)) {
            return PLAN_PREFIX + normalizeSuffix(cleaned.substring(PLAN_PREFIX.length()));
        }
        if (cleaned.startsWith(NOTE_PREFIX)) {
            return NOTE_PREFIX + normalizeSuffix(cleaned.substring(NOTE_PREFIX.length()));
        }
        return normalizeSuffix(cleaned);
    }

    private static String clean(final String rawId) {
        final String halfWidth = ChineseNumerals.toHalfWidth(rawId);
        final StringBuilder sb = new StringBuilder(halfWidth.length());
        for (int i = 0; i < halfWidth.length(); i++) {
            final char c = halfWidth.charAt(i);
            if (!Character.isWhitespace(c)) {
                sb.append(c);
            }
        }
        String s = sb.toString();
        while (!s.isEmpty() && isTrailingPunctuation(s.charAt(s.length() - 1))) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }

    private static boolean isTrailingPunctuation(final char c) {
        return c == ':' || c == '.' || c == '、' || c == '。' || c == ',' || c == '，';
    }

    private static String normalizeSuffix(final String suffix) {
        if (suffix.isEmpty()) {
            return suffix;
        }
        final OptionalInt number = ChineseNumerals.parse(suffix);
        if (number.isPresent()) {
            return Integer.toString(number.getAsInt());
        }
        if (suffix.length() == 1 && STEMS.containsKey(suffix.charAt(0))) {
            return String.valueOf(STEMS.get(suffix.charAt(0)));
        }
        return suffix.toUpperCase(Locale.ROOT);
    }
}
