package com.jimin.river.repository;

import com.jimin.river.entity.FeedEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

public interface FeedEntryRepository extends JpaRepository<FeedEntry, Long> {

    // url은 전역 UNIQUE → upsert 충돌 판단
    Optional<FeedEntry> findByUrl(String url);

    /**
     * 피드의 워터마크 (이미 저장된 항목 중 가장 최신 publishedAt)
     *
     * @return 저장된 항목이 없으면 null
     */
    @Query("SELECT MAX(e.publishedAt) FROM FeedEntry e WHERE e.feed.id = :feedId")
    LocalDateTime findLatestPublishedAt(@Param("feedId") Long feedId);

    /**
     * 보존 정리용: 최신순으로 정렬된 항목 ID 목록
     */
    @Query("SELECT e.id FROM FeedEntry e WHERE e.feed.id = :feedId ORDER BY e.publishedAt DESC, e.id DESC")
    List<Long> findIdsByFeedIdNewestFirst(@Param("feedId") Long feedId);

    List<FeedEntry> findByFeedIdOrderByPublishedAtDesc(Long feedId);

    long countByFeedId(Long feedId);

    @Modifying
    @Query("DELETE FROM FeedEntry e WHERE e.feed.id = :feedId")
    int deleteAllByFeedId(@Param("feedId") Long feedId);
}
