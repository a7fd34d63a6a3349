package edu.uconn.imat.copy;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Accumulates rows for one table and hands them to a {@link BulkWriter} in
 * batches of at most {@code batchSize}, bounding memory to one batch.
 *
 * <p>Callers must invoke {@link #finish()} once the source is exhausted; it
 * writes the trailing partial batch. A source that fails part-way is not
 * finished, so its pending rows are discarded rather than written.
 *
 * <p>Not thread-safe.
 */
@Slf4j
public class RowBuffer<R extends CopyRow> {

    public static final int DEFAULT_BATCH_SIZE = 20_000;

    private final BulkWriter writer;

    private final RawTable table;

    private final int batchSize;

    private final long progressInterval;

    private final List<R> pending;

    @Getter
    private long totalWritten;

    @Getter
    private int flushCount;

    public RowBuffer(BulkWriter writer, RawTable table, int batchSize) {
        this(writer, table, batchSize, 0);
    }

    /**
     * @param progressInterval log progress each time this many more rows are
     *     written; 0 disables progress logging
     */
    public RowBuffer(BulkWriter writer, RawTable table, int batchSize, long progressInterval) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        this.writer = writer;
        this.table = table;
        this.batchSize = batchSize;
        this.progressInterval = progressInterval;
        this.pending = new ArrayList<>(Math.min(batchSize, 1024));
    }

    public void add(R row) {
        pending.add(row);
        if (pending.size() >= batchSize) {
            flush();
        }
    }

    public void flush() {
        if (pending.isEmpty()) {
            return;
        }
        long before = totalWritten;
        writer.write(table, pending);
        totalWritten += pending.size();
        flushCount++;
        pending.clear();
        if (progressInterval > 0 && totalWritten / progressInterval > before / progressInterval) {
            log.info("{}: {} rows written", table.qualifiedName(), totalWritten);
        }
    }

    /**
     * Writes any remaining rows and returns the total written through this buffer.
     */
    public long finish() {
        flush();
        return totalWritten;
    }

    public int pendingCount() {
        return pending.size();
    }
}
