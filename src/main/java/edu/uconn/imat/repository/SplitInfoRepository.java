package edu.uconn.imat.repository;

import edu.uconn.imat.entity.SplitInfo;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

@Repository
public interface SplitInfoRepository extends JpaRepository<SplitInfo, String> {

    @Modifying
    @Transactional
    @Query("DELETE FROM SplitInfo i WHERE i.split = :split")
    int deleteBySplit(@Param("split") String split);
}
