package edu.uconn.imat.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA Entity for the raw.imat_images table.
 * One row per image of a split; rows are written by COPY, never through JPA.
 */
@Entity
@IdClass(SplitImageKey.class)
@Table(schema = "raw", name = "imat_images", indexes = {
    @Index(name = "imat_images_image_id_idx", columnList = "image_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ImageRecord {

    @Id
    @Column(nullable = false, columnDefinition = "TEXT")
    private String split;

    @Id
    @Column(name = "image_id", nullable = false)
    private Long imageId;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String url;
}
