package eu.virtualparadox.regreader.ingest.structure;

import eu.virtualparadox.regreader.util.ChineseNumerals;
import org.apache.commons.lang3.StringUtils;

import java.util.List;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognizes chapter headings in a block of text.
 * <p>
 * Three numbering styles are understood: dotted numbers ({@code 2.1.4 总则}, {@code 2.1.线路},
 * {@code 1.总则}), CJK chapter markers ({@code 第六章 附则}) and CJK section markers
 * ({@code 第二节 一般规定}). When the text
 * after the numbering is longer than the direct-content threshold it is split into a short
 * title and the body text that follows it.
 */
public final class HeadingParser {

    // components up to three digits keep values like "2024.5" from passing as headings;
    // a bare number before a space ("500 千伏") is a value, so one level needs a trailing dot
    private static final Pattern DOTTED = Pattern.compile(
            "^([1-9]\\d{0,2}(?:\\.\\d{1,3}){1,7})\\.?[ \\t\\u3000]+(\\S[\\s\\S]*)$");
    private static final Pattern DOTTED_GLUED = Pattern.compile(
            "^([1-9]\\d{0,2}(?:\\.\\d{1,3}){1,7})\\.([^\\d\\s][\\s\\S]*)$");
    private static final Pattern DOTTED_SINGLE = Pattern.compile(
            "^([1-9]\\d{0,2})\\.[ \\t\\u3000]*([^\\d\\s][\\s\\S]*)$");
    private static final Pattern CHAPTER = Pattern.compile(
            "^(第([一二三四五六七八九十百千零〇两\\d]+)章)[ \\t\\u3000]*([\\s\\S]*)$");
    private static final Pattern SECTION = Pattern.compile(
            "^(第([一二三四五六七八九十百千零〇两\\d]+)节)[ \\t\\u3000]*([\\s\\S]*)$");

    /** Words that open a sentence of body text rather than a title. */
    private static final List<String> CONTENT_STARTERS = List.of(
            "根据", "按照", "当", "在", "为", "是", "有", "对于",
            "如果", "若", "应", "需", "可", "不", "与", "和", "或",
            "包括", "其中", "主要", "具体", "详见", "参见", "见");

    private static final String TITLE_PUNCTUATION = "，。\n";
    private static final int MIN_TITLE_LENGTH = 2;

    private final int directContentThreshold;
    private final int maxTitleLength;

    public HeadingParser(final int directContentThreshold, final int maxTitleLength) {
        if (directContentThreshold < 1 || maxTitleLength < MIN_TITLE_LENGTH) {
            throw new IllegalArgumentException("Invalid heading thresholds: "
                    + directContentThreshold + "/" + maxTitleLength);
        }
        this.directContentThreshold = directContentThreshold;
        this.maxTitleLength = maxTitleLength;
    }

    /**
     * @param text block content
     * @return the parsed heading, empty if the text does not start with a numbering marker
     */
    public Optional<ParsedHeading> parse(final String text) {
        if (StringUtils.isBlank(text)) {
            return Optional.empty();
        }
        final String stripped = text.strip();

        Matcher m = CHAPTER.matcher(stripped);
        if (m.matches()) {
            return cjk(m, ParsedHeading.NumberingStyle.CHAPTER, 1);
        }
        m = SECTION.matcher(stripped);
        if (m.matches()) {
            return cjk(m, ParsedHeading.NumberingStyle.SECTION, 2);
        }
        for (final Pattern dotted : List.of(DOTTED, DOTTED_GLUED, DOTTED_SINGLE)) {
            m = dotted.matcher(stripped);
            if (m.matches() && startsLikeTitle(m.group(2))) {
                final String marker = m.group(1);
                final int level = StringUtils.countMatches(marker, '.') + 1;
                return Optional.of(split(marker, -1, ParsedHeading.NumberingStyle.DOTTED, level, m.group(2)));
            }
        }
        return Optional.empty();
    }

    private Optional<ParsedHeading> cjk(final Matcher m, final ParsedHeading.NumberingStyle style, final int level) {
        final OptionalInt number = ChineseNumerals.parse(m.group(2));
        if (number.isEmpty() || number.getAsInt() < 1) {
            return Optional.empty();
        }
        return Optional.of(split(m.group(1), number.getAsInt(), style, level, m.group(3)));
    }

    private ParsedHeading split(final String marker,
                                final int number,
                                final ParsedHeading.NumberingStyle style,
                                final int level,
                                final String rest) {
        final String remaining = rest.strip();
        if (remaining.length() <= directContentThreshold && remaining.indexOf('\n') < 0) {
            return new ParsedHeading(marker, number, style, level, StringUtils.normalizeSpace(remaining), "");
        }
        if (CONTENT_STARTERS.stream().anyMatch(remaining::startsWith)) {
            return new ParsedHeading(marker, number, style, level, "", remaining);
        }

        int splitPos = maxTitleLength;
        for (final char c : TITLE_PUNCTUATION.toCharArray()) {
            final int pos = remaining.indexOf(c);
            if (pos > 0 && pos < splitPos) {
                splitPos = pos;
            }
        }
        splitPos = Math.min(splitPos, remaining.length());

        final String title = remaining.substring(0, splitPos).strip();
        if (title.length() < MIN_TITLE_LENGTH || title.length() > maxTitleLength) {
            return new ParsedHeading(marker, number, style, level, "", remaining);
        }
        final String body = StringUtils.stripStart(remaining.substring(splitPos), TITLE_PUNCTUATION).strip();
        return new ParsedHeading(marker, number, style, level, title, body);
    }

    /**
     * Rejects measurements and list values such as {@code 10 kV} or {@code 3 %}.
     */
    private static boolean startsLikeTitle(final String remainder) {
        final char first = remainder.charAt(0);
        if (first >= 'a' && first <= 'z') {
            return false;
        }
        return !Character.isDigit(first) && "%‰℃°×~～-－/".indexOf(first) < 0;
    }
}
