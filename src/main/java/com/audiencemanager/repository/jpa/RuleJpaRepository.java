package com.audiencemanager.repository.jpa;

import com.audiencemanager.entity.RuleEntity;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * JPA repository for the rules table.
 *
 * <p>Active rules are the candidate pool of dependency resolution and the set the
 * scheduler registers at startup.
 */
@Repository
public interface RuleJpaRepository extends JpaRepository<RuleEntity, Long> {

    List<RuleEntity> findByActiveTrue();

    boolean existsByName(String name);
}
