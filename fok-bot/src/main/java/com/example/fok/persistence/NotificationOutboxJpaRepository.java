package com.example.fok.persistence;

import java.time.Instant;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationOutboxJpaRepository extends JpaRepository<NotificationOutboxEntity, Long> {

    List<NotificationOutboxEntity> findByDispatchedAtIsNullAndAttemptsLessThanOrderByIdAsc(
            int maxAttempts, Pageable pageable);

    @Modifying
    @Query("update NotificationOutboxEntity o set o.dispatchedAt = :dispatchedAt where o.id = :id")
    int markDispatched(@Param("id") Long id, @Param("dispatchedAt") Instant dispatchedAt);

    @Modifying
    @Query("update NotificationOutboxEntity o set o.attempts = o.attempts + 1, o.lastError = :error where o.id = :id")
    int markFailed(@Param("id") Long id, @Param("error") String error);

    @Modifying
    @Query("delete from NotificationOutboxEntity o where o.dispatchedAt is not null and o.dispatchedAt < :cutoff")
    int deleteDispatchedBefore(@Param("cutoff") Instant cutoff);
}
