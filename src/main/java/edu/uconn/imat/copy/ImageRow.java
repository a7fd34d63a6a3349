package edu.uconn.imat.copy;

import lombok.Value;

import java.util.Arrays;
import java.util.List;

/**
 * Row of {@code raw.imat_images}.
 */
@Value
public class ImageRow implements CopyRow {

    String split;

    long imageId;

    String url;

    @Override
    public List<Object> copyValues() {
        return Arrays.asList(split, imageId, url);
    }
}
