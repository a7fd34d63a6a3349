package edu.uconn.imat.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Composite key (split, image_id) of the per-image raw tables.
 * image_id alone is only unique within a split.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class SplitImageKey implements Serializable {

    private String split;

    private Long imageId;
}
