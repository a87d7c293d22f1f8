package eu.virtualparadox.regreader.query.reference;

import java.util.List;

/**
 * Location of a cross-reference target.
 *
 * @param type          kind of target
 * @param referenceText reference as written, e.g. "见第六章"
 * @param target        parsed target, e.g. {@code 6}, {@code 表6-2}, {@code 注1}
 * @param regId         collection id
 * @param pageNum       page the target starts on
 * @param pageEnd       page the target ends on
 * @param chapterPath   chapter titles leading to the target
 * @param targetId      id of the resolved object: node id, table id, canonical annotation id or block id
 * @param preview       beginning of the target's content
 */
public record ResolvedReference(ReferenceType type,
                                String referenceText,
                                String target,
                                String regId,
                                int pageNum,
                                int pageEnd,
                                List<String> chapterPath,
                                String targetId,
                                String preview) {

    public ResolvedReference {
        chapterPath = chapterPath == null ? List.of() : List.copyOf(chapterPath);
        preview = preview == null ? "" : preview;
    }
}
