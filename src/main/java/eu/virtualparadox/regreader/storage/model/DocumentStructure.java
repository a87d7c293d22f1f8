package eu.virtualparadox.regreader.storage.model;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chapter tree of one regulation, stored as an arena of {@link ChapterNode}s addressed by id.
 *
 * @param regId       collection id
 * @param allNodes    node id to node, in document order
 * @param rootNodeIds top-level nodes in document order
 * @param totalPages  number of pages the tree was built from
 */
public record DocumentStructure(String regId,
                                Map<String, ChapterNode> allNodes,
                                List<String> rootNodeIds,
                                int totalPages) {

    private static final Comparator<ChapterNode> DOCUMENT_ORDER =
            Comparator.comparingInt(ChapterNode::pageNum).thenComparingInt(ChapterNode::level);

    public DocumentStructure {
        allNodes = allNodes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(allNodes));
        rootNodeIds = rootNodeIds == null ? List.of() : List.copyOf(rootNodeIds);
    }

    public static DocumentStructure empty(final String regId) {
        return new DocumentStructure(regId, Map.of(), List.of(), 0);
    }

    public Optional<ChapterNode> node(final String nodeId) {
        return nodeId == null ? Optional.empty() : Optional.ofNullable(allNodes.get(nodeId));
    }

    /**
     * @return first node in document order whose section number equals {@code sectionNumber}
     */
    public Optional<ChapterNode> findBySectionNumber(final String sectionNumber) {
        return allNodes.values().stream()
                .filter(n -> sectionNumber.equals(n.sectionNumber()))
                .min(DOCUMENT_ORDER);
    }

    /**
     * Exact match first, otherwise the shallowest node numbered below the prefix
     * ({@code 6} matches {@code 6.1} when no node is numbered {@code 6}).
     */
    public Optional<ChapterNode> findBySectionPrefix(final String prefix) {
        final Optional<ChapterNode> exact = findBySectionNumber(prefix);
        if (exact.isPresent()) {
            return exact;
        }
        return allNodes.values().stream()
                .filter(n -> n.sectionNumber() != null && n.sectionNumber().startsWith(prefix + "."))
                .min(Comparator.comparingInt(ChapterNode::level).thenComparing(DOCUMENT_ORDER));
    }

    /**
     * @return first node in document order whose title contains {@code text}
     */
    public Optional<ChapterNode> findByTitle(final String text) {
        return allNodes.values().stream()
                .filter(n -> !n.title().isEmpty() && n.title().contains(text))
                .min(DOCUMENT_ORDER);
    }

    /**
     * @return display titles from the root down to and including {@code nodeId}
     */
    public List<String> chapterPath(final String nodeId) {
        final Deque<String> path = new ArrayDeque<>();
        ChapterNode current = allNodes.get(nodeId);
        // parent links form a forest, the depth bound guards against corrupted artifacts
        int guard = allNodes.size();
        while (current != null && guard-- >= 0) {
            path.addFirst(current.displayTitle());
            current = current.parentId() == null ? null : allNodes.get(current.parentId());
        }
        return List.copyOf(path);
    }

    /**
     * @return all descendants of {@code nodeId} in pre-order, the node itself excluded
     */
    public List<ChapterNode> descendants(final String nodeId) {
        final List<ChapterNode> out = new ArrayList<>();
        final ChapterNode start = allNodes.get(nodeId);
        if (start != null) {
            collect(start.childrenIds(), out);
        }
        return out;
    }

    /**
     * @return all nodes in pre-order
     */
    public List<ChapterNode> preOrder() {
        final List<ChapterNode> out = new ArrayList<>();
        collect(rootNodeIds, out);
        return out;
    }

    public List<TocItem> toc() {
        final List<ChapterNode> ordered = preOrder();
        final Map<String, Integer> pageEnds = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            final ChapterNode node = ordered.get(i);
            int end = Math.max(totalPages, node.pageNum());
            for (int j = i + 1; j < ordered.size(); j++) {
                final ChapterNode next = ordered.get(j);
                if (next.level() <= node.level()) {
                    end = Math.max(node.pageNum(), next.pageNum());
                    break;
                }
            }
            pageEnds.put(node.nodeId(), end);
        }
        return rootNodeIds.stream()
                .map(allNodes::get)
                .map(n -> tocItem(n, pageEnds))
                .toList();
    }

    private TocItem tocItem(final ChapterNode node, final Map<String, Integer> pageEnds) {
        final List<TocItem> children = node.childrenIds().stream()
                .map(allNodes::get)
                .map(c -> tocItem(c, pageEnds))
                .toList();
        return new TocItem(node.nodeId(), node.sectionNumber(), node.title(), node.level(),
                node.pageNum(), pageEnds.get(node.nodeId()), children);
    }

    private void collect(final List<String> ids, final List<ChapterNode> out) {
        for (final String id : ids) {
            final ChapterNode node = allNodes.get(id);
            if (node != null) {
                out.add(node);
                collect(node.childrenIds(), out);
            }
        }
    }
}
