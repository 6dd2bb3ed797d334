package com.audiencemanager.repository.jpa;

import com.audiencemanager.entity.SegmentEntity;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the segment_catalog table (one row per rule).
 */
@Repository
public interface SegmentJpaRepository extends JpaRepository<SegmentEntity, Long> {

    Optional<SegmentEntity> findByRuleId(Long ruleId);
}
