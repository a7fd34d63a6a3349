package edu.uconn.imat.copy;

import edu.uconn.imat.common.exception.BulkWriteException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.copy.CopyIn;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * {@link BulkWriter} backed by PostgreSQL {@code COPY ... FROM STDIN} in CSV
 * format. Each call is a single COPY and commits on its own.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PgCopyBulkWriter implements BulkWriter {

    private final DataSource dataSource;

    private final CsvRowEncoder encoder = new CsvRowEncoder();

    @Override
    public long write(RawTable table, List<? extends CopyRow> rows) {
        if (rows.isEmpty()) {
            return 0;
        }
        Connection connection = DataSourceUtils.getConnection(dataSource);
        try {
            return copy(connection, table, rows);
        } catch (SQLException e) {
            throw new BulkWriteException("COPY into " + table.qualifiedName() + " failed", e);
        } finally {
            DataSourceUtils.releaseConnection(connection, dataSource);
        }
    }

    private long copy(Connection connection, RawTable table, List<? extends CopyRow> rows) throws SQLException {
        int arity = table.getColumns().size();
        CopyIn copyIn = connection.unwrap(PGConnection.class).getCopyAPI().copyIn(table.copySql());
        try {
            for (CopyRow row : rows) {
                List<Object> values = row.copyValues();
                if (values.size() != arity) {
                    throw new IllegalArgumentException("Row has " + values.size() + " values but "
                        + table.qualifiedName() + " expects " + table.getColumns());
                }
                byte[] line = encoder.encode(values).getBytes(StandardCharsets.UTF_8);
                copyIn.writeToCopy(line, 0, line.length);
            }
            long written = copyIn.endCopy();
            log.debug("COPY {} rows into {}", written, table.qualifiedName());
            return written;
        } catch (SQLException | RuntimeException e) {
            cancelQuietly(copyIn, e);
            throw e;
        }
    }

    private void cancelQuietly(CopyIn copyIn, Exception failure) {
        if (!copyIn.isActive()) {
            return;
        }
        try {
            copyIn.cancelCopy();
        } catch (SQLException e) {
            failure.addSuppressed(e);
        }
    }
}
