package edu.uconn.imat.repository;

import edu.uconn.imat.entity.ImageRecord;
import edu.uconn.imat.entity.SplitImageKey;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Repository for ImageRecord entities.
 */
@Repository
public interface ImageRecordRepository extends JpaRepository<ImageRecord, SplitImageKey> {

    /**
     * Delete every image row of a split
     */
    @Modifying
    @Transactional
    @Query("DELETE FROM ImageRecord i WHERE i.split = :split")
    int deleteBySplit(@Param("split") String split);

    long countBySplit(String split);

    /**
     * Cross-split lookup by image id
     */
    List<ImageRecord> findByImageIdOrderBySplit(Long imageId);

    List<ImageRecord> findBySplitOrderByImageId(String split);
}
