package edu.uconn.imat.entity;

import com.fasterxml.jackson.databind.JsonNode;
import io.hypersistence.utils.hibernate.type.json.JsonBinaryType;
import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Type;

/**
 * JPA Entity for the raw.imat_annotations table.
 * label_ids keeps the label identifiers exactly as the source listed them,
 * in the same order.
 */
@Entity
@IdClass(SplitImageKey.class)
@Table(schema = "raw", name = "imat_annotations", indexes = {
    @Index(name = "imat_annotations_image_id_idx", columnList = "image_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnnotationRecord {

    @Id
    @Column(nullable = false, columnDefinition = "TEXT")
    private String split;

    @Id
    @Column(name = "image_id", nullable = false)
    private Long imageId;

    @Type(JsonBinaryType.class)
    @Column(name = "label_ids", nullable = false, columnDefinition = "jsonb")
    private JsonNode labelIds;
}
