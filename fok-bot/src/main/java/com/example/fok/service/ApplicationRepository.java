package com.example.fok.service;

import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.domain.StatusChange;
import com.example.fok.notification.Notification;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface ApplicationRepository {

    Optional<Application> findById(String applicationId);

    Optional<Application> findPendingByKey(String pendingKey);

    /**
     * Stores a new pending application together with its initial history entry, the owner's application counter
     * and the outbox notification. Throws {@link org.springframework.dao.DataIntegrityViolationException} when a
     * pending application with the same key already exists.
     */
    Application create(Application application, Notification notification);

    /**
     * Writes {@code updated} only if the stored version still equals {@code expectedVersion}. The history entry and
     * the notification are recorded in the same transaction.
     *
     * @return {@code false} when another writer got there first
     */
    boolean compareAndSet(Application updated, long expectedVersion, StatusChange change, Notification notification);

    List<Application> findByUser(String userId, int page, int size);

    List<Application> findByStatus(ApplicationStatus status, int page, int size);

    List<Application> findByUserAndStatus(String userId, ApplicationStatus status, int page, int size);

    long countByUser(String userId);

    long countByUserAndStatus(String userId, ApplicationStatus status);

    /**
     * Counts every stored application by status. Statuses without applications may be absent from the map.
     */
    Map<ApplicationStatus, Long> countByStatus();
}
