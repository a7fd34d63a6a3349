package edu.uconn.imat.service;

import edu.uconn.imat.common.exception.BulkWriteException;
import edu.uconn.imat.common.exception.MissingFileException;
import edu.uconn.imat.config.LoaderProperties;
import edu.uconn.imat.copy.BulkWriter;
import edu.uconn.imat.copy.LabelMapRow;
import edu.uconn.imat.copy.RawTable;
import edu.uconn.imat.copy.RowBuffer;
import edu.uconn.imat.excel.LabelMapReader;
import edu.uconn.imat.repository.LabelMapRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Replaces the whole label map table with the rows of the spreadsheet.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LabelMapLoader {

    private final LabelMapReader reader;

    private final LabelMapRepository labelMapRepository;

    private final BulkWriter bulkWriter;

    private final LoaderProperties properties;

    /**
     * @return number of label map rows loaded
     */
    public long load(Path workbook) {
        MissingFileException.requireFile(workbook);
        List<LabelMapRow> rows = reader.read(workbook);

        try {
            labelMapRepository.truncate();
        } catch (DataAccessException e) {
            throw new BulkWriteException("TRUNCATE " + RawTable.LABEL_MAP.qualifiedName() + " failed", e);
        }

        RowBuffer<LabelMapRow> buffer = new RowBuffer<>(bulkWriter, RawTable.LABEL_MAP, properties.getBatchSize());
        rows.forEach(buffer::add);
        long loaded = buffer.finish();
        log.info("[OK] label_map loaded: {} rows -> {}", loaded, RawTable.LABEL_MAP.qualifiedName());
        return loaded;
    }
}
