package edu.uconn.imat.service;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of loading one split.
 */
@Value
@Builder
public class SplitLoadResult {

    String split;

    boolean infoLoaded;

    boolean licenseLoaded;

    long imageRows;

    long annotationRows;
}
