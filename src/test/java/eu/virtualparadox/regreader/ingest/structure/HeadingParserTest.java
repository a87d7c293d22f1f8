package eu.virtualparadox.regreader.ingest.structure;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class HeadingParserTest {

    private final HeadingParser parser = new HeadingParser(50, 30);

    @Test
    @DisplayName("CJK chapter marker is level 1 with an arabic number")
    void testChapter() {
        final ParsedHeading heading = parser.parse("第六章 附则").orElseThrow();

        assertEquals(ParsedHeading.NumberingStyle.CHAPTER, heading.style());
        assertEquals(1, heading.level());
        assertEquals(6, heading.number());
        assertEquals("附则", heading.title());
        assertEquals("第六章 附则", heading.headingText());
        assertFalse(heading.hasDirectContent());
    }

    @Test
    @DisplayName("CJK section marker is level 2")
    void testSection() {
        final ParsedHeading heading = parser.parse("第二节　一般规定").orElseThrow();

        assertEquals(ParsedHeading.NumberingStyle.SECTION, heading.style());
        assertEquals(2, heading.level());
        assertEquals(2, heading.number());
        assertEquals("一般规定", heading.title());
    }

    @Test
    @DisplayName("Dotted numbering depth gives the level")
    void testDotted() {
        final ParsedHeading heading = parser.parse("2.1.4 设备要求").orElseThrow();

        assertEquals(ParsedHeading.NumberingStyle.DOTTED, heading.style());
        assertEquals("2.1.4", heading.marker());
        assertEquals(3, heading.level());
        assertEquals("设备要求", heading.title());
    }

    @Test
    @DisplayName("Trailing dot after a single number is not part of the marker")
    void testTrailingDot() {
        final ParsedHeading heading = parser.parse("3. 总则").orElseThrow();
        assertEquals("3", heading.marker());
        assertEquals(1, heading.level());
    }

    @Test
    @DisplayName("Single number glued to its title with a dot is level 1")
    void testGluedSingle() {
        final ParsedHeading heading = parser.parse("1.总则").orElseThrow();

        assertEquals(ParsedHeading.NumberingStyle.DOTTED, heading.style());
        assertEquals("1", heading.marker());
        assertEquals(1, heading.level());
        assertEquals("总则", heading.title());
    }

    @Test
    @DisplayName("Dotted numbers glued to their title keep their depth")
    void testGluedDotted() {
        final ParsedHeading heading = parser.parse("2.1.线路").orElseThrow();
        assertEquals("2.1", heading.marker());
        assertEquals(2, heading.level());
        assertEquals("线路", heading.title());

        final ParsedHeading deeper = parser.parse("2.2.1.三峡左岸电厂").orElseThrow();
        assertEquals("2.2.1", deeper.marker());
        assertEquals(3, deeper.level());
        assertEquals("三峡左岸电厂", deeper.title());
    }

    @ParameterizedTest
    @ValueSource(strings = {"10 kV 母线", "5 % 以内", "2024.5 年度计划", "普通正文内容", "1.2", "第十条 本规程自发布之日起施行", "",
            "500 千伏及以上变电站的运行维护由省调负责", "220 千伏线路由地调负责", "3 总则", "1.5%"})
    @DisplayName("Values, bare numbers, plain text and articles are not headings")
    void testNotHeadings(final String text) {
        assertTrue(parser.parse(text).isEmpty());
    }

    @Test
    @DisplayName("Long heading line is split at the first punctuation")
    void testSplitAtPunctuation() {
        final String body = "各单位应当严格执行调度指令并及时汇报设备运行情况。".repeat(3);
        final ParsedHeading heading = parser.parse("2.1 运行要求，" + body).orElseThrow();

        assertEquals("运行要求", heading.title());
        assertEquals(body, heading.directContent());
        assertTrue(heading.hasDirectContent());
        assertEquals("2.1 运行要求", heading.headingText());
    }

    @Test
    @DisplayName("Body text opening with a content word has no title")
    void testContentStarter() {
        final String rest = "根据电网运行方式的变化，调度机构应及时调整稳定控制策略并下达执行，确保电网安全稳定运行，各级调度机构应加强协调配合。";
        final ParsedHeading heading = parser.parse("3.2 " + rest).orElseThrow();

        assertEquals("", heading.title());
        assertEquals(rest, heading.directContent());
        assertEquals("3.2", heading.headingText());
    }

    @Test
    @DisplayName("A newline ends the title even for short lines")
    void testNewline() {
        final ParsedHeading heading = parser.parse("4.2 安全措施\n值班人员应检查").orElseThrow();

        assertEquals("安全措施", heading.title());
        assertEquals("值班人员应检查", heading.directContent());
    }

    @Test
    @DisplayName("Invalid thresholds are rejected")
    void testInvalidThresholds() {
        assertThrows(IllegalArgumentException.class, () -> new HeadingParser(0, 30));
        assertThrows(IllegalArgumentException.class, () -> new HeadingParser(50, 1));
    }
}
