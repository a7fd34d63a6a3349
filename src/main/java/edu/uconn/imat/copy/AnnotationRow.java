package edu.uconn.imat.copy;

import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Row of {@code raw.imat_annotations}. {@code labelIdsJson} is the JSON text
 * of the label id array, cast to JSONB by the store.
 */
@Value
public class AnnotationRow implements CopyRow {

    String split;

    long imageId;

    String labelIdsJson;

    @Override
    public List<Object> copyValues() {
        return Arrays.asList(split, imageId, labelIdsJson);
    }
}
