package com.jimin.river.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * FilterGroup Entity - 규칙 묶음 + keep/discard 동작
 *
 * DB 테이블: filter_groups
 * 관계: FilterGroup 1:N FilterGroupRule (position 순서로 평가)
 *
 * applyToCategory가 비어 있으면 모든 피드에 적용된다.
 */
@Entity
@Table(name = "filter_groups")
@Data
@NoArgsConstructor
public class FilterGroup {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    // keep | discard
    @Column(nullable = false, length = 20)
    private String action;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(nullable = false)
    private int priority;

    @Column(name = "apply_to_category", length = 100)
    private String applyToCategory;

    @OneToMany(mappedBy = "group", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("position ASC, id ASC")
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private List<FilterGroupRule> rules = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public void addRule(Long filterId, String operator, int position) {
        FilterGroupRule rule = new FilterGroupRule();
        rule.setGroup(this);
        rule.setFilterId(filterId);
        rule.setOperator(operator);
        rule.setPosition(position);
        rules.add(rule);
    }

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
        updatedAt = createdAt;
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = LocalDateTime.now();
    }
}
