package edu.uconn.imat.integration;

import edu.uconn.imat.batch.ImatLoadLauncher;
import edu.uconn.imat.common.exception.LoadJobFailedException;
import edu.uconn.imat.common.exception.MalformedRecordException;
import edu.uconn.imat.common.exception.MissingFileException;
import edu.uconn.imat.entity.AnnotationRecord;
import edu.uconn.imat.entity.ImageRecord;
import edu.uconn.imat.entity.LabelMapEntry;
import edu.uconn.imat.entity.SplitImageKey;
import edu.uconn.imat.excel.Workbooks;
import edu.uconn.imat.repository.AnnotationRecordRepository;
import edu.uconn.imat.repository.ImageMaterialView;
import edu.uconn.imat.repository.ImageRecordRepository;
import edu.uconn.imat.repository.LabelMapRepository;
import edu.uconn.imat.repository.SplitInfoRepository;
import edu.uconn.imat.repository.SplitLicenseRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.system.CapturedOutput;
import org.springframework.boot.test.system.OutputCaptureExtension;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Integration tests running the whole load job against a real PostgreSQL
 * database with Testcontainers. Skipped when Docker is not available.
 */
@SpringBootTest(properties = "imat.batch-size=2")
@Testcontainers(disabledWithoutDocker = true)
@ExtendWith(OutputCaptureExtension.class)
@ActiveProfiles("test")
@DisplayName("Load Job Integration Tests with Testcontainers")
class ImatLoadJobIntegrationTest {

    private static final String TRAIN_JSON = "{"
        + "\"images\":[{\"imageId\":\"1\",\"url\":\"http://x/1.jpg\"}],"
        + "\"annotations\":[{\"imageId\":\"1\",\"labelId\":[\"5\",\"9\"]}],"
        + "\"info\":{\"year\":2020},"
        + "\"license\":{\"name\":\"CC\"}"
        + "}";

    private static final String VALIDATION_JSON = "{\"images\":[],\"annotations\":[]}";

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
        .withDatabaseName("testdb")
        .withUsername("test")
        .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
    }

    @TempDir
    Path dir;

    @Autowired
    private ImatLoadLauncher launcher;

    @Autowired
    private LabelMapRepository labelMapRepository;

    @Autowired
    private ImageRecordRepository imageRecordRepository;

    @Autowired
    private AnnotationRecordRepository annotationRecordRepository;

    @Autowired
    private SplitInfoRepository splitInfoRepository;

    @Autowired
    private SplitLicenseRepository splitLicenseRepository;

    @BeforeEach
    void writeLabelMap() throws IOException {
        Workbooks.write(dir.resolve("label_map_228.xlsx"),
            Workbooks.HEADER,
            new Object[]{5, 1, "cotton", "material"},
            new Object[]{9, 2, "red", "color"},
            new Object[]{12, 1, "denim", "material"});
    }

    @Test
    @DisplayName("Should load label map, train split and empty validation split")
    void shouldLoadDataset(CapturedOutput output) throws Exception {
        // Given
        Files.writeString(dir.resolve("train.json"), TRAIN_JSON);
        Files.writeString(dir.resolve("validation.json"), VALIDATION_JSON);

        // When
        JobExecution execution = launcher.launch(dir);

        // Then
        assertThat(execution.getStatus()).isEqualTo(BatchStatus.COMPLETED);
        assertThat(labelMapRepository.count()).isEqualTo(3);
        assertThat(labelMapRepository.findByTaskNameOrderByLabelId("material"))
            .extracting(LabelMapEntry::getLabelName)
            .containsExactly("cotton", "denim");

        assertThat(imageRecordRepository.findBySplitOrderByImageId("train"))
            .extracting(ImageRecord::getImageId, ImageRecord::getUrl)
            .containsExactly(tuple(1L, "http://x/1.jpg"));

        AnnotationRecord annotation = annotationRecordRepository
            .findById(new SplitImageKey("train", 1L)).orElseThrow();
        assertThat(labels(annotation)).containsExactly("5", "9");

        assertThat(splitInfoRepository.findById("train")).hasValueSatisfying(
            info -> assertThat(info.getInfo().get("year").asInt()).isEqualTo(2020));
        assertThat(splitLicenseRepository.findById("train")).hasValueSatisfying(
            license -> assertThat(license.getLicense().get("name").asText()).isEqualTo("CC"));
        assertThat(splitInfoRepository.count()).isEqualTo(1);
        assertThat(splitLicenseRepository.count()).isEqualTo(1);

        assertThat(imageRecordRepository.countBySplit("validation")).isZero();
        assertThat(annotationRecordRepository.countBySplit("validation")).isZero();
        assertThat(splitInfoRepository.existsById("validation")).isFalse();
        assertThat(splitLicenseRepository.existsById("validation")).isFalse();
        assertThat(output).contains("[SKIP] validation: no info in validation.json")
            .contains("[SKIP] validation: no license in validation.json")
            .doesNotContain("[SKIP] train");
    }

    @Test
    @DisplayName("Should leave the same rows after loading the same files twice")
    void shouldBeIdempotent() throws Exception {
        // Given
        Files.writeString(dir.resolve("train.json"), manyImages(5));
        Files.writeString(dir.resolve("validation.json"), VALIDATION_JSON);

        // When
        launcher.launch(dir);
        List<ImageRecord> firstRun = imageRecordRepository.findBySplitOrderByImageId("train");
        launcher.launch(dir);

        // Then
        assertThat(imageRecordRepository.findBySplitOrderByImageId("train")).isEqualTo(firstRun);
        assertThat(firstRun).hasSize(5);
        assertThat(annotationRecordRepository.countBySplit("train")).isEqualTo(5);
        assertThat(labelMapRepository.count()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should answer label containment and material queries")
    void shouldQueryLoadedAnnotations() throws Exception {
        // Given
        Files.writeString(dir.resolve("train.json"), TRAIN_JSON);
        Files.writeString(dir.resolve("validation.json"),
            "{\"images\":[{\"imageId\":\"1\",\"url\":\"http://x/v1.jpg\"}],"
                + "\"annotations\":[{\"imageId\":\"1\",\"labelId\":[\"12\"]}]}");

        // When
        launcher.launch(dir);

        // Then
        assertThat(annotationRecordRepository.findBySplitContainingLabel("train", "9")).hasSize(1);
        assertThat(annotationRecordRepository.findBySplitContainingLabel("train", "12")).isEmpty();

        List<ImageMaterialView> materials = annotationRecordRepository.findImageMaterials("train");
        assertThat(materials).hasSize(1);
        assertThat(materials.get(0).getImageId()).isEqualTo(1L);
        assertThat(materials.get(0).getMaterialId()).isEqualTo(5);
        assertThat(materials.get(0).getMaterialName()).isEqualTo("cotton");

        // image_id 1 exists in both splits
        assertThat(imageRecordRepository.findByImageIdOrderBySplit(1L))
            .extracting(ImageRecord::getSplit)
            .containsExactly("train", "validation");
    }

    @Test
    @DisplayName("Should round-trip urls containing CSV special characters")
    void shouldRoundTripSpecialCharacters() throws Exception {
        // Given
        Files.writeString(dir.resolve("train.json"),
            "{\"images\":[{\"imageId\":\"1\",\"url\":\"http://x/a,b\\\"c\\nd.jpg\"}],\"annotations\":[]}");
        Files.writeString(dir.resolve("validation.json"), VALIDATION_JSON);

        // When
        launcher.launch(dir);

        // Then
        assertThat(imageRecordRepository.findById(new SplitImageKey("train", 1L)))
            .hasValueSatisfying(image -> assertThat(image.getUrl()).isEqualTo("http://x/a,b\"c\nd.jpg"));
    }

    @Test
    @DisplayName("Should fail the job on a malformed image and recover on re-run")
    void shouldFailOnMalformedImageAndRecover() throws Exception {
        // Given - batch size is 2, so the first two images are committed before the bad third one
        Files.writeString(dir.resolve("train.json"), TRAIN_JSON);
        Files.writeString(dir.resolve("validation.json"), VALIDATION_JSON);
        launcher.launch(dir);
        Files.writeString(dir.resolve("train.json"), "{\"images\":["
            + "{\"imageId\":\"1\",\"url\":\"u1\"},{\"imageId\":\"2\",\"url\":\"u2\"},{\"imageId\":\"3\"}],"
            + "\"annotations\":[{\"imageId\":\"1\",\"labelId\":[\"5\"]}]}");

        // When / Then
        assertThatThrownBy(() -> launcher.launch(dir))
            .isInstanceOf(LoadJobFailedException.class)
            .hasCauseInstanceOf(MalformedRecordException.class);

        // Partial state: old rows are gone, the first image batch is in, annotations never ran
        assertThat(imageRecordRepository.countBySplit("train")).isEqualTo(2);
        assertThat(annotationRecordRepository.countBySplit("train")).isZero();
        assertThat(splitInfoRepository.existsById("train")).isFalse();

        // Re-running with a fixed document restores a consistent split
        Files.writeString(dir.resolve("train.json"), TRAIN_JSON);
        launcher.launch(dir);
        assertThat(imageRecordRepository.countBySplit("train")).isEqualTo(1);
        assertThat(annotationRecordRepository.countBySplit("train")).isEqualTo(1);
        assertThat(splitInfoRepository.existsById("train")).isTrue();
    }

    @Test
    @DisplayName("Should fail the job when a split document is missing")
    void shouldFailOnMissingDocument() throws Exception {
        // Given - no validation.json
        Files.writeString(dir.resolve("train.json"), TRAIN_JSON);

        // When / Then
        assertThatThrownBy(() -> launcher.launch(dir))
            .isInstanceOf(LoadJobFailedException.class)
            .hasCauseInstanceOf(MissingFileException.class);
        assertThat(imageRecordRepository.countBySplit("train")).isEqualTo(1);
    }

    private List<String> labels(AnnotationRecord annotation) {
        List<String> labels = new ArrayList<>();
        annotation.getLabelIds().forEach(node -> labels.add(node.asText()));
        return labels;
    }

    private String manyImages(int count) {
        StringBuilder images = new StringBuilder();
        StringBuilder annotations = new StringBuilder();
        for (int i = 1; i <= count; i++) {
            String sep = i > 1 ? "," : "";
            images.append(sep).append("{\"imageId\":\"").append(i).append("\",\"url\":\"http://x/").append(i)
                .append(".jpg\"}");
            annotations.append(sep).append("{\"imageId\":\"").append(i).append("\",\"labelId\":[\"5\"]}");
        }
        return "{\"images\":[" + images + "],\"annotations\":[" + annotations + "]}";
    }
}
