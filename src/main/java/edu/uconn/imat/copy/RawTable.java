package edu.uconn.imat.copy;

import java.util.List;

/**
 * Target relations of the loader, all under schema {@value #SCHEMA}.
 * Table and column names are fixed here and never derived from input data.
 */
public enum RawTable {

    LABEL_MAP("imat_label_map", "label_id", "task_id", "label_name", "task_name"),
    INFO("imat_info", "split", "info"),
    LICENSE("imat_license", "split", "license"),
    IMAGES("imat_images", "split", "image_id", "url"),
    ANNOTATIONS("imat_annotations", "split", "image_id", "label_ids");

    public static final String SCHEMA = "raw";

    private final String tableName;

    private final List<String> columns;

    RawTable(String tableName, String... columns) {
        this.tableName = tableName;
        this.columns = List.of(columns);
    }

    public String getTableName() {
        return tableName;
    }

    public List<String> getColumns() {
        return columns;
    }

    public String qualifiedName() {
        return SCHEMA + "." + tableName;
    }

    /**
     * COPY statement reading CSV rows for this table's columns from STDIN.
     */
    public String copySql() {
        return "COPY " + qualifiedName() + " (" + String.join(", ", columns) + ") FROM STDIN WITH (FORMAT CSV)";
    }
}
