package com.jimin.river.repository;

import com.jimin.river.entity.FilterGroup;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface FilterGroupRepository extends JpaRepository<FilterGroup, Long> {

    // 평가 순서: priority 오름차순, 같으면 name
    @EntityGraph(attributePaths = "rules")
    List<FilterGroup> findByActiveTrueOrderByPriorityAscNameAsc();

    @EntityGraph(attributePaths = "rules")
    Optional<FilterGroup> findWithRulesById(Long id);
}
