package com.example.fok.persistence;

import com.example.fok.domain.ApplicationStatus;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApplicationJpaRepository extends JpaRepository<ApplicationEntity, String> {

    Optional<ApplicationEntity> findByPendingKey(String pendingKey);

    List<ApplicationEntity> findByUserIdOrderByCreatedAtDescIdDesc(String userId, Pageable pageable);

    List<ApplicationEntity> findByStatusOrderByCreatedAtDescIdDesc(ApplicationStatus status, Pageable pageable);

    List<ApplicationEntity> findByUserIdAndStatusOrderByCreatedAtDescIdDesc(
            String userId, ApplicationStatus status, Pageable pageable);

    long countByUserId(String userId);

    long countByUserIdAndStatus(String userId, ApplicationStatus status);

    @Query("select a.status, count(a) from ApplicationEntity a group by a.status")
    List<Object[]> countGroupedByStatus();

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(
            "update ApplicationEntity a "
                    + "set a.status = :status, a.pendingKey = :pendingKey, a.updatedAt = :updatedAt, "
                    + "a.processedBy = :processedBy, a.completedAt = :completedAt, a.cancelledAt = :cancelledAt, "
                    + "a.version = a.version + 1 "
                    + "where a.id = :id and a.version = :expectedVersion")
    int compareAndSetStatus(
            @Param("id") String id,
            @Param("expectedVersion") Long expectedVersion,
            @Param("status") ApplicationStatus status,
            @Param("pendingKey") String pendingKey,
            @Param("updatedAt") Instant updatedAt,
            @Param("processedBy") String processedBy,
            @Param("completedAt") Instant completedAt,
            @Param("cancelledAt") Instant cancelledAt);
}
