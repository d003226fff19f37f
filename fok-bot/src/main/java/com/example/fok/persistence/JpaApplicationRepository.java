package com.example.fok.persistence;

import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.domain.StatusChange;
import com.example.fok.notification.Notification;
import com.example.fok.service.ApplicationRepository;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaApplicationRepository implements ApplicationRepository {

    private final ApplicationJpaRepository applicationJpaRepository;
    private final ApplicationStatusChangeJpaRepository historyJpaRepository;
    private final UserJpaRepository userJpaRepository;
    private final NotificationOutboxJpaRepository outboxJpaRepository;
    private final ApplicationEntityMapper mapper;
    private final NotificationOutboxMapper outboxMapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Application> findById(String applicationId) {
        if (!StringUtils.hasText(applicationId)) {
            return Optional.empty();
        }
        return applicationJpaRepository.findById(applicationId)
                .map(entity -> mapper.toDomain(
                        entity, historyJpaRepository.findByApplicationIdOrderByIdAsc(entity.getId())));
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Application> findPendingByKey(String pendingKey) {
        if (!StringUtils.hasText(pendingKey)) {
            return Optional.empty();
        }
        return applicationJpaRepository.findByPendingKey(pendingKey)
                .map(entity -> mapper.toDomain(
                        entity, historyJpaRepository.findByApplicationIdOrderByIdAsc(entity.getId())));
    }

    @Override
    @Transactional
    public Application create(Application application, Notification notification) {
        ApplicationEntity entity = mapper.toEntity(application);
        entity.setVersion(null);
        ApplicationEntity saved = applicationJpaRepository.saveAndFlush(entity);

        List<ApplicationStatusChangeEntity> history = application.getStatusHistory().stream()
                .map(change -> historyJpaRepository.save(mapper.toEntity(saved.getId(), change)))
                .toList();
        userJpaRepository.incrementTotalApplications(application.getUserId());
        if (notification != null) {
            outboxJpaRepository.save(outboxMapper.toEntity(notification));
        }
        return mapper.toDomain(saved, history);
    }

    @Override
    @Transactional
    public boolean compareAndSet(
            Application updated, long expectedVersion, StatusChange change, Notification notification) {
        int rows = applicationJpaRepository.compareAndSetStatus(
                updated.getId(),
                expectedVersion,
                updated.getStatus(),
                updated.pendingKey(),
                updated.getUpdatedAt(),
                updated.getProcessedBy(),
                updated.getCompletedAt(),
                updated.getCancelledAt());
        if (rows == 0) {
            return false;
        }
        historyJpaRepository.save(mapper.toEntity(updated.getId(), change));
        if (notification != null) {
            outboxJpaRepository.save(outboxMapper.toEntity(notification));
        }
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<Application> findByUser(String userId, int page, int size) {
        return withHistory(applicationJpaRepository.findByUserIdOrderByCreatedAtDescIdDesc(
                userId, PageRequest.of(page, size)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Application> findByStatus(ApplicationStatus status, int page, int size) {
        return withHistory(applicationJpaRepository.findByStatusOrderByCreatedAtDescIdDesc(
                status, PageRequest.of(page, size)));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Application> findByUserAndStatus(String userId, ApplicationStatus status, int page, int size) {
        return withHistory(applicationJpaRepository.findByUserIdAndStatusOrderByCreatedAtDescIdDesc(
                userId, status, PageRequest.of(page, size)));
    }

    @Override
    @Transactional(readOnly = true)
    public long countByUser(String userId) {
        return applicationJpaRepository.countByUserId(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public long countByUserAndStatus(String userId, ApplicationStatus status) {
        return applicationJpaRepository.countByUserIdAndStatus(userId, status);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<ApplicationStatus, Long> countByStatus() {
        Map<ApplicationStatus, Long> counts = new EnumMap<>(ApplicationStatus.class);
        for (Object[] row : applicationJpaRepository.countGroupedByStatus()) {
            counts.put((ApplicationStatus) row[0], ((Number) row[1]).longValue());
        }
        return counts;
    }

    private List<Application> withHistory(List<ApplicationEntity> entities) {
        if (entities.isEmpty()) {
            return List.of();
        }
        Map<String, List<ApplicationStatusChangeEntity>> histories = historyJpaRepository
                .findByApplicationIdInOrderByIdAsc(entities.stream().map(ApplicationEntity::getId).toList())
                .stream()
                .collect(Collectors.groupingBy(ApplicationStatusChangeEntity::getApplicationId));
        return entities.stream()
                .map(entity -> mapper.toDomain(entity, histories.getOrDefault(entity.getId(), List.of())))
                .toList();
    }
}
