package eu.virtualparadox.regreader.query.reference;

import eu.virtualparadox.regreader.core.exception.AnnotationNotFoundException;
import eu.virtualparadox.regreader.core.exception.ChapterNotFoundException;
import eu.virtualparadox.regreader.core.exception.ReferenceResolutionException;
import eu.virtualparadox.regreader.core.exception.TableNotFoundException;
import eu.virtualparadox.regreader.query.annotation.AnnotationLookup;
import eu.virtualparadox.regreader.query.chapter.ChapterContent;
import eu.virtualparadox.regreader.query.chapter.ChapterReader;
import eu.virtualparadox.regreader.storage.PageStore;
import eu.virtualparadox.regreader.storage.model.Annotation;
import eu.virtualparadox.regreader.storage.model.ChapterNode;
import eu.virtualparadox.regreader.storage.model.ContentBlock;
import eu.virtualparadox.regreader.storage.model.DocumentStructure;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.storage.model.TableEntry;
import eu.virtualparadox.regreader.storage.model.TableRegistry;
import eu.virtualparadox.regreader.util.ChineseNumerals;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves cross-references written in regulation text ("见第六章", "参见表6-2", "按注1执行")
 * to the page and chapter of their target.
 * <p>
 * Patterns are tried in a fixed priority order: chapter, table, dotted section, annotation,
 * appendix, article. The first pattern that matches decides the reference type; a matched
 * reference whose target does not exist is an error, the next pattern is not tried. Text that
 * matches no pattern is finally looked up as a chapter title ("见总则", "按照《设备管理》的规定").
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ReferenceResolver {

    static final int PREVIEW_LENGTH = 300;

    private static final String NUMERAL = "[0-9一二三四五六七八九十百千零〇两]+";

    private static final Pattern CHAPTER = Pattern.compile("第\\s*(" + NUMERAL + ")\\s*([章节])");
    private static final Pattern TABLE = Pattern.compile("表\\s*([A-Za-z]?\\d+(?:\\s*[-.]\\s*\\d+)*)");
    private static final Pattern SECTION = Pattern.compile("(?<![\\d.])(\\d{1,3}(?:\\.\\d{1,3})+)(?!\\d)");
    private static final Pattern ANNOTATION = Pattern.compile("(注\\s*[0-9①-⑳一二三四五六七八九十]+|方案\\s*[甲乙丙丁戊己庚辛A-Za-z])");
    private static final Pattern APPENDIX = Pattern.compile("附录\\s*([A-Za-z0-9一二三四五六七八九十]+)");
    private static final Pattern ARTICLE = Pattern.compile("第\\s*(" + NUMERAL + ")\\s*条");
    private static final Pattern ARTICLE_START = Pattern.compile("^第\\s*(" + NUMERAL + ")\\s*条");
    private static final Pattern TITLE_NOISE = Pattern.compile(
            "^(?:参见|详见|依据|按照|根据|见|按)|(?:的规定|规定|执行)+$|[《》「」“”\"'()（）\\s]");
    private static final int MIN_TITLE_LENGTH = 2;

    private final PageStore pageStore;
    private final AnnotationLookup annotationLookup;
    private final ChapterReader chapterReader;

    /**
     * @param regId         collection id
     * @param referenceText reference as written, may contain surrounding words
     * @throws ReferenceResolutionException if no pattern matches or the target does not exist
     */
    public ResolvedReference resolve(final String regId, final String referenceText) {
        if (StringUtils.isBlank(referenceText)) {
            throw new ReferenceResolutionException(String.valueOf(referenceText), "empty reference");
        }
        final String text = ChineseNumerals.toHalfWidth(referenceText.strip());

        Matcher m = CHAPTER.matcher(text);
        if (m.find()) {
            return resolveChapter(regId, referenceText, m);
        }
        m = TABLE.matcher(text);
        if (m.find()) {
            return resolveTable(regId, referenceText, m.group(1).replaceAll("\\s", ""));
        }
        m = SECTION.matcher(text);
        if (m.find()) {
            return resolveSection(regId, referenceText, m.group(1));
        }
        m = ANNOTATION.matcher(text);
        if (m.find()) {
            return resolveAnnotation(regId, referenceText, m.group(1));
        }
        m = APPENDIX.matcher(text);
        if (m.find()) {
            return resolveAppendix(regId, referenceText, m.group(1).toUpperCase(Locale.ROOT));
        }
        m = ARTICLE.matcher(text);
        if (m.find()) {
            return resolveArticle(regId, referenceText, m.group(1));
        }
        return resolveTitle(regId, referenceText, text)
                .orElseThrow(() -> new ReferenceResolutionException(referenceText, "no known reference pattern"));
    }

    private Optional<ResolvedReference> resolveTitle(final String regId, final String referenceText, final String text) {
        final String title = TITLE_NOISE.matcher(text).replaceAll("");
        if (title.length() < MIN_TITLE_LENGTH || !pageStore.exists(regId)) {
            return Optional.empty();
        }
        final Optional<DocumentStructure> structure = pageStore.loadDocumentStructure(regId);
        return structure.flatMap(s -> s.findByTitle(title))
                .map(node -> chapterReference(ReferenceType.CHAPTER, regId, referenceText,
                        StringUtils.defaultIfEmpty(node.sectionNumber(), title), structure.get(), node));
    }

    /**
     * "第六章" resolves to chapter 6, "第六章第二节" to 6.2 and a lone "第二节" to the first
     * section numbered 2 below any chapter.
     */
    private ResolvedReference resolveChapter(final String regId, final String referenceText, final Matcher m) {
        Integer chapter = null;
        Integer section = null;
        do {
            final int number = numeral(referenceText, m.group(1));
            if ("章".equals(m.group(2))) {
                chapter = chapter == null ? number : chapter;
            } else if (section == null) {
                section = number;
            }
        } while (m.find());

        final DocumentStructure structure = structure(regId, referenceText);
        final Optional<ChapterNode> node;
        final String target;
        if (chapter != null && section != null) {
            target = chapter + "." + section;
            node = structure.findBySectionNumber(target);
        } else if (chapter != null) {
            target = Integer.toString(chapter);
            node = structure.findBySectionPrefix(target);
        } else {
            target = Integer.toString(section);
            node = structure.preOrder().stream()
                    .filter(n -> n.level() > 1 && n.sectionNumber() != null && n.sectionNumber().endsWith("." + target))
                    .findFirst();
        }
        return chapterReference(ReferenceType.CHAPTER, regId, referenceText, target, structure,
                node.orElseThrow(() -> notFound(referenceText, "no chapter numbered " + target,
                        new ChapterNotFoundException(regId, target))));
    }

    private ResolvedReference resolveSection(final String regId, final String referenceText, final String number) {
        final DocumentStructure structure = structure(regId, referenceText);
        final ChapterNode node = structure.findBySectionNumber(number)
                .orElseThrow(() -> notFound(referenceText, "no section numbered " + number,
                        new ChapterNotFoundException(regId, number)));
        return chapterReference(ReferenceType.SECTION, regId, referenceText, number, structure, node);
    }

    private ResolvedReference chapterReference(final ReferenceType type,
                                               final String regId,
                                               final String referenceText,
                                               final String target,
                                               final DocumentStructure structure,
                                               final ChapterNode node) {
        final ChapterContent content = chapterReader.read(structure, node, false);
        String preview = content.contentMarkdown();
        if (content.blockCount() <= 1 && !content.children().isEmpty()) {
            // heading only, list what follows instead
            final StringBuilder sb = new StringBuilder(preview);
            content.children().forEach(c -> sb.append('\n').append("- ")
                    .append(StringUtils.normalizeSpace(c.sectionNumber() + " " + c.title())));
            preview = sb.toString();
        }
        log.debug("Reference '{}' resolved to {} {} on P{}", referenceText, type, node.sectionNumber(), node.pageNum());
        return new ResolvedReference(type, referenceText, target, regId, node.pageNum(), content.pageEnd(),
                structure.chapterPath(node.nodeId()), node.nodeId(), preview(preview));
    }

    private ResolvedReference resolveTable(final String regId, final String referenceText, final String number) {
        final String label = "表" + number;
        final TableRegistry registry = pageStore.loadTableRegistry(regId)
                .orElseThrow(() -> notFound(referenceText, "no tables registered for " + regId,
                        new TableNotFoundException(regId, label)));

        final TableEntry entry;
        if (registry.contains(label)) {
            entry = registry.fullTable(label);
        } else if (registry.contains(number)) {
            entry = registry.fullTable(number);
        } else {
            final Pattern caption = Pattern.compile(Pattern.quote(label) + "(?![0-9]|[-.][0-9])");
            entry = registry.tables().values().stream()
                    .filter(t -> caption.matcher(compact(t.caption())).find())
                    .findFirst()
                    .orElseThrow(() -> notFound(referenceText, "no table captioned " + label,
                            new TableNotFoundException(regId, label)));
        }
        log.debug("Reference '{}' resolved to table {} on P{}-P{}", referenceText, entry.tableId(), entry.pageStart(), entry.pageEnd());
        return new ResolvedReference(ReferenceType.TABLE, referenceText, label, regId, entry.pageStart(), entry.pageEnd(),
                entry.chapterPath(), entry.tableId(), preview(entry.mergedMarkdown()));
    }

    private ResolvedReference resolveAnnotation(final String regId, final String referenceText, final String rawId) {
        final Annotation annotation;
        try {
            annotation = annotationLookup.lookup(regId, rawId);
        } catch (final AnnotationNotFoundException e) {
            throw notFound(referenceText, "no annotation " + rawId, e);
        }
        final PageDocument page = pageStore.loadPage(regId, annotation.pageNum());
        return new ResolvedReference(ReferenceType.ANNOTATION, referenceText, annotation.normalizedId(), regId,
                annotation.pageNum(), annotation.pageNum(), page.chapterPath(), annotation.normalizedId(),
                preview(annotation.content()));
    }

    private ResolvedReference resolveAppendix(final String regId, final String referenceText, final String suffix) {
        final String label = "附录" + suffix;
        return findBlock(regId, block -> compact(block.content()).startsWith(label))
                .map(hit -> blockReference(ReferenceType.APPENDIX, regId, referenceText, label, hit))
                .orElseThrow(() -> notFound(referenceText, "no appendix " + label, null));
    }

    private ResolvedReference resolveArticle(final String regId, final String referenceText, final String numeral) {
        final int number = numeral(referenceText, numeral);
        final String label = "第" + number + "条";
        return findBlock(regId, block -> {
                    final Matcher start = ARTICLE_START.matcher(ChineseNumerals.toHalfWidth(block.content().strip()));
                    return start.find() && ChineseNumerals.parse(start.group(1)).orElse(-1) == number;
                })
                .map(hit -> blockReference(ReferenceType.ARTICLE, regId, referenceText, label, hit))
                .orElseThrow(() -> notFound(referenceText, "no article " + label, null));
    }

    private ResolvedReference blockReference(final ReferenceType type,
                                             final String regId,
                                             final String referenceText,
                                             final String label,
                                             final BlockHit hit) {
        // the target block and whatever follows it on the same page
        final List<ContentBlock> blocks = hit.page().contentBlocks();
        final StringBuilder sb = new StringBuilder();
        for (int i = blocks.indexOf(hit.block()); i < blocks.size() && sb.length() < PREVIEW_LENGTH; i++) {
            if (sb.length() > 0) {
                sb.append("\n\n");
            }
            sb.append(blocks.get(i).toMarkdown());
        }
        final List<String> path = hit.block().chapterPath().isEmpty() ? hit.page().chapterPath() : hit.block().chapterPath();
        log.debug("Reference '{}' resolved to block {} on P{}", referenceText, hit.block().blockId(), hit.page().pageNum());
        return new ResolvedReference(type, referenceText, label, regId, hit.page().pageNum(), hit.page().pageNum(),
                path, hit.block().blockId(), preview(sb.toString()));
    }

    private Optional<BlockHit> findBlock(final String regId, final Predicate<ContentBlock> predicate) {
        for (final int pageNum : pageStore.pageNumbers(regId)) {
            final PageDocument page = pageStore.loadPage(regId, pageNum);
            for (final ContentBlock block : page.contentBlocks()) {
                if (predicate.test(block)) {
                    return Optional.of(new BlockHit(page, block));
                }
            }
        }
        return Optional.empty();
    }

    private DocumentStructure structure(final String regId, final String referenceText) {
        return pageStore.loadDocumentStructure(regId)
                .orElseThrow(() -> new ReferenceResolutionException(referenceText, "no chapter structure stored for " + regId));
    }

    private static int numeral(final String referenceText, final String numeral) {
        final OptionalInt value = ChineseNumerals.parse(numeral);
        if (value.isEmpty()) {
            throw new ReferenceResolutionException(referenceText, "unreadable number " + numeral);
        }
        return value.getAsInt();
    }

    private static ReferenceResolutionException notFound(final String referenceText, final String reason, final Throwable cause) {
        return cause == null
                ? new ReferenceResolutionException(referenceText, reason)
                : new ReferenceResolutionException(referenceText, reason, cause);
    }

    private static String compact(final String text) {
        return StringUtils.deleteWhitespace(ChineseNumerals.toHalfWidth(StringUtils.defaultString(text)));
    }

    private static String preview(final String text) {
        return StringUtils.abbreviate(StringUtils.defaultString(text).strip(), PREVIEW_LENGTH);
    }

    private record BlockHit(PageDocument page, ContentBlock block) {
    }
}
