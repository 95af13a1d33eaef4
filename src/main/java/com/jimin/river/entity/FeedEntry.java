package com.jimin.river.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.LocalDateTime;

/**
 * FeedEntry Entity - 피드에서 수집한 개별 항목
 *
 * DB 테이블: entries
 * 관계: FeedEntry N:1 Feed
 *
 * url은 전역 UNIQUE (재수집 시 중복 판단 키).
 * 같은 url이 다시 들어오면 publishedAt이 더 최신일 때만 title/content/publishedAt을 갱신한다.
 */
@Entity
@Table(name = "entries", indexes = {
        @Index(name = "idx_entries_feed_published", columnList = "feed_id, published_at")
})
@Data
@NoArgsConstructor
public class FeedEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "feed_id", nullable = false)
    @ToString.Exclude
    private Feed feed;

    @Column(nullable = false, length = 1000)
    private String title;

    @Column(nullable = false, length = 700, unique = true)
    private String url;

    @Column(columnDefinition = "TEXT")
    private String content;

    @Column(length = 1000)
    private String guid;

    @Column(name = "published_at", nullable = false)
    private LocalDateTime publishedAt;

    @Column(name = "favicon_url", length = 500)
    private String faviconUrl;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        createdAt = LocalDateTime.now();
    }
}
