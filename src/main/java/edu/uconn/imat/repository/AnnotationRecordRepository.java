package edu.uconn.imat.repository;

import edu.uconn.imat.entity.AnnotationRecord;
import edu.uconn.imat.entity.SplitImageKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Repository for AnnotationRecord entities.
 */
@Repository
public interface AnnotationRecordRepository extends JpaRepository<AnnotationRecord, SplitImageKey> {

    /**
     * Delete every annotation row of a split
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM AnnotationRecord a WHERE a.split = :split")
    int deleteBySplit(@Param("split") String split);

    long countBySplit(String split);

    List<AnnotationRecord> findByImageIdOrderBySplit(Long imageId);

    /**
     * Annotations of a split whose label_ids contain the given label.
     * Served by the GIN index on label_ids.
     */
    @Query(value = "SELECT * FROM raw.imat_annotations a "
        + "WHERE a.split = :split AND a.label_ids @> jsonb_build_array(CAST(:labelId AS text)) "
        + "ORDER BY a.image_id", nativeQuery = true)
    List<AnnotationRecord> findBySplitContainingLabel(@Param("split") String split,
                                                      @Param("labelId") String labelId);

    /**
     * One row per (image, material label) of a split: label_ids exploded and
     * joined with the "material" task of the label map.
     */
    @Query(value = "SELECT a.split AS \"split\", a.image_id AS \"imageId\", "
        + "m.label_id AS \"materialId\", m.label_name AS \"materialName\" "
        + "FROM raw.imat_annotations a "
        + "CROSS JOIN LATERAL jsonb_array_elements_text(a.label_ids) AS l(label_id) "
        + "JOIN raw.imat_label_map m ON m.label_id = CAST(l.label_id AS integer) AND m.task_name = 'material' "
        + "WHERE a.split = :split "
        + "ORDER BY a.image_id, m.label_id", nativeQuery = true)
    List<ImageMaterialView> findImageMaterials(@Param("split") String split);
}
