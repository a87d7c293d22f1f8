package eu.virtualparadox.regreader.storage.model;

/**
 * Placement of one segment of a logical table.
 *
 * @param segmentId    table id carried by the segment's block
 * @param pageNum      page the segment is printed on
 * @param blockId      block holding the segment
 * @param segmentIndex position within the logical table, {@code 0} for the first
 * @param rowStart     index of the segment's first data row in the stitched table
 * @param rowEnd       index after the segment's last data row in the stitched table
 */
public record TableSegment(String segmentId,
                           int pageNum,
                           String blockId,
                           int segmentIndex,
                           int rowStart,
                           int rowEnd) {
}
