package edu.uconn.imat.config;

import edu.uconn.imat.copy.RowBuffer;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Loader settings bound from the {@code imat.*} properties.
 */
@Component
@ConfigurationProperties(prefix = "imat")
@Validated
@Data
public class LoaderProperties {

    /**
     * Directory holding the label map spreadsheet and the split documents
     */
    private String dir = "imat";

    private String labelMapFile = "label_map_228.xlsx";

    /**
     * Splits in load order
     */
    private List<Split> splits = new ArrayList<>(List.of(
        new Split("train", "train.json"),
        new Split("validation", "validation.json")));

    /**
     * Rows per COPY batch
     */
    @Positive
    private int batchSize = RowBuffer.DEFAULT_BATCH_SIZE;

    /**
     * Log a progress line every this many streamed rows; 0 disables
     */
    @PositiveOrZero
    private long progressInterval = 100_000;

    /**
     * Launch the load job when the application starts
     */
    private boolean runOnStartup = true;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Split {
        private String name;
        private String file;
    }
}
