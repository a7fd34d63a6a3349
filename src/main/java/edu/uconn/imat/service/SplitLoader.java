package edu.uconn.imat.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.uconn.imat.common.exception.BulkWriteException;
import edu.uconn.imat.common.exception.MalformedRecordException;
import edu.uconn.imat.common.exception.MissingFileException;
import edu.uconn.imat.config.LoaderProperties;
import edu.uconn.imat.copy.AnnotationRow;
import edu.uconn.imat.copy.BulkWriter;
import edu.uconn.imat.copy.CopyRow;
import edu.uconn.imat.copy.ImageRow;
import edu.uconn.imat.copy.RawTable;
import edu.uconn.imat.copy.RowBuffer;
import edu.uconn.imat.copy.SplitDocumentRow;
import edu.uconn.imat.json.JsonArrayStreamer;
import edu.uconn.imat.json.JsonDocumentScanner;
import edu.uconn.imat.json.JsonValues;
import edu.uconn.imat.repository.AnnotationRecordRepository;
import edu.uconn.imat.repository.ImageRecordRepository;
import edu.uconn.imat.repository.SplitInfoRepository;
import edu.uconn.imat.repository.SplitLicenseRepository;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.IntSupplier;

/**
 * Loads one split document into the raw tables.
 *
 * <p>A split load is four steps run in order: clear the split's rows, load
 * the top-level info/license objects, stream the images array, stream the
 * annotations array. Steps are not wrapped in a shared transaction: each
 * DELETE and each COPY batch commits on its own. A failure part-way leaves
 * the split with its old rows gone and only some new rows present; running
 * the split again restores a consistent state, since clearing comes first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SplitLoader {

    static final String INFO_FIELD = "info";
    static final String LICENSE_FIELD = "license";
    static final String IMAGES_PATH = "images";
    static final String ANNOTATIONS_PATH = "annotations";

    private final ImageRecordRepository imageRecordRepository;

    private final AnnotationRecordRepository annotationRecordRepository;

    private final SplitInfoRepository splitInfoRepository;

    private final SplitLicenseRepository splitLicenseRepository;

    private final BulkWriter bulkWriter;

    private final LoaderProperties properties;

    private final ObjectMapper objectMapper;

    /**
     * The steps of a split load, in the order they must run. The batch job
     * turns each one into a step of its own.
     */
    @Getter
    @RequiredArgsConstructor
    public enum Phase {
        CLEAR_PARTITION("clearPartition"),
        LOAD_INFO_LICENSE("loadInfoLicense"),
        LOAD_IMAGES("loadImages"),
        LOAD_ANNOTATIONS("loadAnnotations");

        private final String stepName;
    }

    /**
     * Runs every phase for {@code split}, in order.
     */
    public SplitLoadResult load(Path document, String split) {
        SplitLoadResult.SplitLoadResultBuilder result = SplitLoadResult.builder().split(split);
        for (Phase phase : Phase.values()) {
            run(phase, document, split, result);
        }
        return result.build();
    }

    /**
     * Runs one phase. Clearing checks that the document exists first, so a
     * missing file never costs the split its current rows.
     *
     * @return rows written by the phase
     */
    public long run(Phase phase, Path document, String split) {
        return run(phase, document, split, SplitLoadResult.builder().split(split));
    }

    private long run(Phase phase, Path document, String split, SplitLoadResult.SplitLoadResultBuilder result) {
        switch (phase) {
            case CLEAR_PARTITION:
                MissingFileException.requireFile(document);
                clearPartition(split);
                return 0;
            case LOAD_INFO_LICENSE:
                Set<RawTable> documents = loadInfoAndLicense(document, split);
                result.infoLoaded(documents.contains(RawTable.INFO))
                    .licenseLoaded(documents.contains(RawTable.LICENSE));
                return documents.size();
            case LOAD_IMAGES:
                long images = loadImages(document, split);
                result.imageRows(images);
                return images;
            case LOAD_ANNOTATIONS:
                long annotations = loadAnnotations(document, split);
                result.annotationRows(annotations);
                return annotations;
            default:
                throw new IllegalArgumentException("Unknown phase " + phase);
        }
    }

    /**
     * Deletes every images, annotations, info and license row of the split.
     */
    public void clearPartition(String split) {
        int images = delete(RawTable.IMAGES, () -> imageRecordRepository.deleteBySplit(split));
        int annotations = delete(RawTable.ANNOTATIONS, () -> annotationRecordRepository.deleteBySplit(split));
        delete(RawTable.INFO, () -> splitInfoRepository.deleteBySplit(split));
        delete(RawTable.LICENSE, () -> splitLicenseRepository.deleteBySplit(split));
        log.info("{}: cleared previous rows ({} images, {} annotations)", split, images, annotations);
    }

    /**
     * Loads the top-level "info" and "license" objects. Each one that is
     * absent gets a skip notice; that is expected for some splits.
     *
     * @return the tables that received a row
     */
    public Set<RawTable> loadInfoAndLicense(Path document, String split) {
        Map<String, JsonNode> fields = JsonDocumentScanner.readTopLevelFields(document,
            Set.of(INFO_FIELD, LICENSE_FIELD));
        Set<RawTable> loaded = EnumSet.noneOf(RawTable.class);
        loadDocument(RawTable.INFO, INFO_FIELD, fields, document, split, loaded);
        loadDocument(RawTable.LICENSE, LICENSE_FIELD, fields, document, split, loaded);
        if (!loaded.isEmpty()) {
            log.info("[OK] {}: loaded info/license ({})", split, loaded);
        }
        return loaded;
    }

    /**
     * Streams the images array into raw.imat_images.
     *
     * @return rows written
     */
    public long loadImages(Path document, String split) {
        RowBuffer<ImageRow> buffer = newBuffer(RawTable.IMAGES);
        try (JsonArrayStreamer images = JsonArrayStreamer.open(document, IMAGES_PATH)) {
            long index = 0;
            while (images.hasNext()) {
                buffer.add(toImageRow(split, index++, images.next()));
            }
        }
        long total = buffer.finish();
        log.info("[OK] {}: loaded images -> {} ({} rows)", split, RawTable.IMAGES.qualifiedName(), total);
        return total;
    }

    /**
     * Streams the annotations array into raw.imat_annotations.
     *
     * @return rows written
     */
    public long loadAnnotations(Path document, String split) {
        RowBuffer<AnnotationRow> buffer = newBuffer(RawTable.ANNOTATIONS);
        try (JsonArrayStreamer annotations = JsonArrayStreamer.open(document, ANNOTATIONS_PATH)) {
            long index = 0;
            while (annotations.hasNext()) {
                buffer.add(toAnnotationRow(split, index++, annotations.next()));
            }
        }
        long total = buffer.finish();
        log.info("[OK] {}: loaded annotations -> {} ({} rows)", split, RawTable.ANNOTATIONS.qualifiedName(), total);
        return total;
    }

    private void loadDocument(RawTable table, String field, Map<String, JsonNode> fields, Path document,
                              String split, Set<RawTable> loaded) {
        JsonNode value = fields.get(field);
        if (value == null) {
            log.info("[SKIP] {}: no {} in {}", split, field, document.getFileName());
            return;
        }
        bulkWriter.write(table, List.of(new SplitDocumentRow(split, toJson(value))));
        loaded.add(table);
    }

    ImageRow toImageRow(String split, long index, JsonNode element) {
        long imageId = JsonValues.asLong(element.get("imageId"))
            .orElseThrow(() -> malformed(split, IMAGES_PATH, index, "imageId is missing or not an integer", element));
        String url = JsonValues.asText(element.get("url"))
            .orElseThrow(() -> malformed(split, IMAGES_PATH, index, "url is missing or not text", element));
        return new ImageRow(split, imageId, url);
    }

    AnnotationRow toAnnotationRow(String split, long index, JsonNode element) {
        long imageId = JsonValues.asLong(element.get("imageId"))
            .orElseThrow(() -> malformed(split, ANNOTATIONS_PATH, index, "imageId is missing or not an integer",
                element));
        JsonNode labelIds = element.get("labelId");
        if (labelIds == null || !labelIds.isArray()) {
            throw malformed(split, ANNOTATIONS_PATH, index, "labelId is missing or not an array", element);
        }
        return new AnnotationRow(split, imageId, toJson(labelIds));
    }

    private <R extends CopyRow> RowBuffer<R> newBuffer(RawTable table) {
        return new RowBuffer<>(bulkWriter, table, properties.getBatchSize(), properties.getProgressInterval());
    }

    private int delete(RawTable table, IntSupplier deletion) {
        try {
            return deletion.getAsInt();
        } catch (DataAccessException e) {
            throw new BulkWriteException("DELETE from " + table.qualifiedName() + " failed", e);
        }
    }

    private MalformedRecordException malformed(String split, String array, long index, String problem,
                                               JsonNode element) {
        return new MalformedRecordException(
            split + ": " + array + "[" + index + "] " + problem, element == null ? "null" : element.toString());
    }

    private String toJson(JsonNode node) {
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize JSON value", e);
        }
    }
}
