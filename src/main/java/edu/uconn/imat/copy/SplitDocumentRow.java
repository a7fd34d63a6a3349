package edu.uconn.imat.copy;

import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Row of the per-split document tables {@code raw.imat_info} and
 * {@code raw.imat_license}: the split key and the JSON text of the payload.
 */
@Value
public class SplitDocumentRow implements CopyRow {

    String split;

    String documentJson;

    @Override
    public List<Object> copyValues() {
        return Arrays.asList(split, documentJson);
    }
}
