package com.jimin.river.entity;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Feed Entity - 구독 중인 RSS/Atom 피드
 *
 * DB 테이블: feeds
 * 관계: Feed 1:N FeedEntry (피드 삭제 시 항목도 함께 삭제)
 *
 * 매 수집 주기마다 lastFetched, 검증자(lastModified/etag), 상태가 갱신된다.
 * title은 titleManuallyEdited가 false일 때만 피드 제목으로 덮어쓴다.
 */
@Entity
@Table(name = "feeds")
@Data
@NoArgsConstructor
public class Feed {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 700, unique = true)
    private String url;

    @Column(length = 500)
    private String title;

    @Column(name = "title_manually_edited", nullable = false)
    private boolean titleManuallyEdited;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private FeedStatus status = FeedStatus.ACTIVE;

    @Column(name = "error_count", nullable = false)
    private int errorCount;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "last_fetched")
    private LocalDateTime lastFetched;

    // HTTP 조건부 요청 검증자 (If-Modified-Since / If-None-Match)
    @Column(name = "last_modified", length = 100)
    private String lastModified;

    @Column(length = 255)
    private String etag;

    @Column(length = 100)
    private String category;

    // 필터 평가 입력값 (feed_tags 대상 규칙)
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "feed_tags", joinColumns = @JoinColumn(name = "feed_id"))
    @Column(name = "tag", length = 100)
    @OrderColumn(name = "tag_order")
    private List<String> tags = new ArrayList<>();

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    public Feed(String url, String title) {
        this.url = url;
        this.title = title;
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
