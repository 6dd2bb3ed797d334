package com.audiencemanager.repository.jpa;

import com.audiencemanager.entity.MaterializationRunEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface MaterializationRunJpaRepository extends JpaRepository<MaterializationRunEntity, Long> {

    List<MaterializationRunEntity> findByRuleIdOrderByStartedAtDesc(Long ruleId);

    void deleteByRuleId(Long ruleId);
}
