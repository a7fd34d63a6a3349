package edu.uconn.imat.copy;

import java.util.List;

/**
 * Streams rows into a raw table through the store's bulk-load path.
 */
public interface BulkWriter {

    /**
     * Writes all {@code rows} into {@code table} as one unit. Any failure
     * aborts the whole batch with a
     * {@link edu.uconn.imat.common.exception.BulkWriteException}.
     *
     * @param table target relation
     * @param rows rows whose arity matches the table's column list
     * @return number of rows the store reports as written
     */
    long write(RawTable table, List<? extends CopyRow> rows);
}
