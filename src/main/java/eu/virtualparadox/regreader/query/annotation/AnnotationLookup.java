package eu.virtualparadox.regreader.query.annotation;

import eu.virtualparadox.regreader.core.exception.AnnotationNotFoundException;
import eu.virtualparadox.regreader.core.exception.PageNotFoundException;
import eu.virtualparadox.regreader.storage.PageStore;
import eu.virtualparadox.regreader.storage.model.Annotation;
import eu.virtualparadox.regreader.storage.model.PageDocument;
import eu.virtualparadox.regreader.util.AnnotationIdNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Finds annotations by their printed id.
 * <p>
 * Ids are compared in canonical form, so "注①", "注 1" and "注一" all find the note printed as
 * "注1". The same id is often reused on many pages (every table restarts its notes at 1); the
 * hinted page is checked first and the remaining pages are scanned nearest first.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnnotationLookup {

    private final PageStore pageStore;

    public Annotation lookup(final String regId, final String rawId) {
        return lookup(regId, rawId, null);
    }

    /**
     * @param regId    collection id
     * @param rawId    annotation id in any supported spelling
     * @param pageHint page to check first, may be {@code null}
     * @throws AnnotationNotFoundException if no page carries the annotation
     */
    public Annotation lookup(final String regId, final String rawId, final Integer pageHint) {
        final String canonical = AnnotationIdNormalizer.normalize(rawId);
        if (canonical.isEmpty()) {
            throw new AnnotationNotFoundException(regId, rawId);
        }

        final List<Integer> pages = new ArrayList<>(pageStore.pageNumbers(regId));
        if (pageHint != null) {
            pages.sort(Comparator.<Integer>comparingInt(p -> Math.abs(p - pageHint))
                    .thenComparing(Comparator.naturalOrder()));
        }

        for (final int pageNum : pages) {
            final Optional<Annotation> found = findOnPage(regId, pageNum, canonical);
            if (found.isPresent()) {
                log.debug("Annotation {} ({}) of {} found on P{}", rawId, canonical, regId, pageNum);
                return found.get();
            }
        }
        throw new AnnotationNotFoundException(regId, rawId);
    }

    /**
     * Lists annotations of a collection in page order.
     *
     * @param pattern substring matched against id and content, {@code null} or blank for all
     * @param type    kind filter, {@code null} for all
     */
    public List<Annotation> searchAnnotations(final String regId, final String pattern, final AnnotationType type) {
        final String needle = StringUtils.trimToNull(pattern);
        final List<Annotation> matches = new ArrayList<>();
        for (final int pageNum : pageStore.pageNumbers(regId)) {
            for (final Annotation annotation : pageStore.loadPage(regId, pageNum).annotations()) {
                if (type != null && AnnotationType.of(annotation.normalizedId()) != type) {
                    continue;
                }
                if (needle == null
                        || annotation.content().contains(needle)
                        || annotation.annotationId().contains(needle)
                        || annotation.normalizedId().equals(AnnotationIdNormalizer.normalize(needle))) {
                    matches.add(annotation);
                }
            }
        }
        return matches;
    }

    private Optional<Annotation> findOnPage(final String regId, final int pageNum, final String canonical) {
        final PageDocument page;
        try {
            page = pageStore.loadPage(regId, pageNum);
        } catch (final PageNotFoundException e) {
            log.debug("P{} of {} vanished during lookup", pageNum, regId);
            return Optional.empty();
        }
        return page.annotations().stream()
                .filter(a -> canonical.equals(a.normalizedId()))
                .findFirst();
    }
}
