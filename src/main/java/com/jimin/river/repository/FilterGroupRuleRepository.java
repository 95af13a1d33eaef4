package com.jimin.river.repository;

import com.jimin.river.entity.FilterGroupRule;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface FilterGroupRuleRepository extends JpaRepository<FilterGroupRule, Long> {

    // 필터 삭제 시 해당 필터를 가리키는 규칙도 제거
    @Modifying
    @Query("DELETE FROM FilterGroupRule r WHERE r.filterId = :filterId")
    int deleteAllByFilterId(@Param("filterId") Long filterId);
}
