package com.voxpop.backend.repositories;

import com.voxpop.backend.models.CampaignAudience;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;

@Repository
public interface CampaignAudienceRepository extends JpaRepository<CampaignAudience, Long> {

    boolean existsByTargetSegmentIdAndStatusIn(Long segmentId, Collection<String> statuses);

    @Query("SELECT COUNT(c) > 0 FROM CampaignAudience c JOIN c.targetTagIds t " +
            "WHERE t = :tagId AND c.status IN :statuses")
    boolean existsByTargetTagIdAndStatusIn(@Param("tagId") Long tagId, @Param("statuses") Collection<String> statuses);
}
