package com.jimin.river.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * FilterGroupRule Entity - 그룹 안의 규칙 한 줄
 *
 * DB 테이블: filter_group_rules
 *
 * filterId는 EntryFilter에 대한 약한 참조 (조회 시점에 조인).
 * position 0 규칙의 operator는 무시된다 (결과의 시작값).
 */
@Entity
@Table(name = "filter_group_rules")
@Data
@NoArgsConstructor
public class FilterGroupRule {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "group_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private FilterGroup group;

    @Column(name = "filter_id", nullable = false)
    private Long filterId;

    // AND | OR
    @Column(nullable = false, length = 10)
    private String operator;

    @Column(nullable = false)
    private int position;
}
