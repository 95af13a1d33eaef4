package com.jimin.river.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * EntryFilter Entity - 항목 필터 (키워드 / 정규식)
 *
 * DB 테이블: entry_filters
 *
 * patternType: keyword | regex
 * targetType : title | content | feed_category | feed_tags
 *
 * 타입 컬럼은 문자열 그대로 저장한다. 알 수 없는 값은 FilterEngine이 평가 오류로 처리한다.
 */
@Entity
@Table(name = "entry_filters")
@Data
@NoArgsConstructor
public class EntryFilter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 100)
    private String name;

    @Column(nullable = false, length = 1000)
    private String pattern;

    @Column(name = "pattern_type", nullable = false, length = 20)
    private String patternType;

    @Column(name = "target_type", nullable = false, length = 20)
    private String targetType;

    @Column(name = "case_sensitive", nullable = false)
    private boolean caseSensitive;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

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
