package edu.uconn.imat.service;

import edu.uconn.imat.common.exception.BulkWriteException;
import edu.uconn.imat.copy.RawTable;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Creates the raw schema, its tables and indexes when they are missing.
 * Only {@code IF NOT EXISTS} statements are issued; nothing is dropped or altered.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SchemaInitializer {

    private final JdbcTemplate jdbcTemplate;

    public void initialize() {
        for (String statement : ddl()) {
            try {
                jdbcTemplate.execute(statement);
            } catch (DataAccessException e) {
                throw new BulkWriteException("Schema statement failed [" + statement + "]", e);
            }
        }
        log.info("[OK] schema {} ready", RawTable.SCHEMA);
    }

    List<String> ddl() {
        return List.of(
            "CREATE SCHEMA IF NOT EXISTS " + RawTable.SCHEMA,
            "CREATE TABLE IF NOT EXISTS " + RawTable.LABEL_MAP.qualifiedName() + " ("
                + "label_id INTEGER PRIMARY KEY, "
                + "task_id INTEGER NOT NULL, "
                + "label_name TEXT NOT NULL, "
                + "task_name TEXT NOT NULL)",
            "CREATE TABLE IF NOT EXISTS " + RawTable.INFO.qualifiedName() + " ("
                + "split TEXT PRIMARY KEY, "
                + "info JSONB NOT NULL)",
            "CREATE TABLE IF NOT EXISTS " + RawTable.LICENSE.qualifiedName() + " ("
                + "split TEXT PRIMARY KEY, "
                + "license JSONB NOT NULL)",
            "CREATE TABLE IF NOT EXISTS " + RawTable.IMAGES.qualifiedName() + " ("
                + "split TEXT NOT NULL, "
                + "image_id BIGINT NOT NULL, "
                + "url TEXT NOT NULL, "
                + "PRIMARY KEY (split, image_id))",
            "CREATE INDEX IF NOT EXISTS imat_images_image_id_idx ON "
                + RawTable.IMAGES.qualifiedName() + " (image_id)",
            "CREATE TABLE IF NOT EXISTS " + RawTable.ANNOTATIONS.qualifiedName() + " ("
                + "split TEXT NOT NULL, "
                + "image_id BIGINT NOT NULL, "
                + "label_ids JSONB NOT NULL, "
                + "PRIMARY KEY (split, image_id))",
            "CREATE INDEX IF NOT EXISTS imat_annotations_image_id_idx ON "
                + RawTable.ANNOTATIONS.qualifiedName() + " (image_id)",
            // GIN serves containment queries (label_ids @> ...)
            "CREATE INDEX IF NOT EXISTS imat_annotations_label_ids_gin ON "
                + RawTable.ANNOTATIONS.qualifiedName() + " USING GIN (label_ids)");
    }
}
