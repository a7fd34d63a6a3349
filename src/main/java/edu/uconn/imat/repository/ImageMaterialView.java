package edu.uconn.imat.repository;

/**
 * Projection of an image paired with one of its material labels.
 */
public interface ImageMaterialView {

    String getSplit();

    Long getImageId();

    Integer getMaterialId();

    String getMaterialName();
}
