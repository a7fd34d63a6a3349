package edu.uconn.imat.repository;

import edu.uconn.imat.entity.LabelMapEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Repository for the label map reference table.
 */
@Repository
public interface LabelMapRepository extends JpaRepository<LabelMapEntry, Integer> {

    /**
     * Remove every label map row ahead of a full reload
     */
    @Modifying
    @Transactional
    @Query(value = "TRUNCATE raw.imat_label_map", nativeQuery = true)
    void truncate();

    /**
     * Labels of one task, e.g. "material"
     */
    List<LabelMapEntry> findByTaskNameOrderByLabelId(String taskName);
}
