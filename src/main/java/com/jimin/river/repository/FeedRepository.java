package com.jimin.river.repository;

import com.jimin.river.entity.Feed;
import com.jimin.river.entity.FeedStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface FeedRepository extends JpaRepository<Feed, Long> {

    List<Feed> findAllByOrderByIdAsc();

    Optional<Feed> findByUrl(String url);

    /**
     * 수집 실패 기록 (errorCount는 DB 레벨에서 원자적으로 증가)
     *
     * @return 업데이트된 행 수 (없는 ID: 0)
     */
    @Modifying(clearAutomatically = true)
    @Query("UPDATE Feed f SET f.status = :status, f.errorCount = f.errorCount + 1, "
            + "f.lastError = :message WHERE f.id = :id")
    int recordError(@Param("id") Long id, @Param("status") FeedStatus status, @Param("message") String message);
}
