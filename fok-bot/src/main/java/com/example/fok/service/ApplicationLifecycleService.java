package com.example.fok.service;

import com.example.fok.config.FokProperties;
import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatistics;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.domain.Capability;
import com.example.fok.domain.Facility;
import com.example.fok.domain.StatusChange;
import com.example.fok.domain.User;
import com.example.fok.domain.UserRole;
import com.example.fok.notification.Notification;
import com.example.fok.notification.NotificationTemplate;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Creates applications and moves them through their status graph. Every write is a compare-and-set on the
 * application version; the notification for the change is stored with the write so it is never lost.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ApplicationLifecycleService {

    private static final int MAX_SPORT_LENGTH = 128;

    private final ApplicationRepository applicationRepository;
    private final FacilityCatalog facilityCatalog;
    private final UserAccountService userAccountService;
    private final AdminAuthorizationService authorizationService;
    private final TransitionPolicy transitionPolicy;
    private final FokProperties fokProperties;
    private final Clock clock;

    /**
     * Submits an application. A second submission for the same user, facility and sport while the first is still
     * pending returns the existing application.
     */
    public Application create(String userId, String facilityId, String sport) {
        if (!StringUtils.hasText(facilityId)) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Facility id is required");
        }
        if (!StringUtils.hasText(sport) || sport.trim().length() > MAX_SPORT_LENGTH) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Sport must be between 1 and 128 characters");
        }
        User user = userAccountService.find(userId)
                .orElseThrow(() -> new ServiceException(ErrorCode.UNREGISTERED, "User is not registered"));
        if (!user.isRegistered()) {
            throw new ServiceException(ErrorCode.UNREGISTERED, "User has not completed registration");
        }
        if (user.isBlocked()) {
            throw new ServiceException(ErrorCode.BLOCKED, "User is blocked");
        }

        String trimmedSport = sport.trim();
        String pendingKey = Application.pendingKey(userId, facilityId, trimmedSport);
        Optional<Application> existing = StorageCalls.call(() -> applicationRepository.findPendingByKey(pendingKey));
        if (existing.isPresent()) {
            log.debug("Returning pending application {} for repeated submission", existing.get().getId());
            return existing.get();
        }

        Facility facility = StorageCalls.call(() -> facilityCatalog.findById(facilityId))
                .filter(Facility::isActive)
                .orElseThrow(() -> new ServiceException(ErrorCode.NOT_FOUND, "Facility not found"));

        Instant now = clock.instant();
        List<StatusChange> history = new ArrayList<>();
        history.add(StatusChange.builder().status(ApplicationStatus.PENDING).actor(userId).changedAt(now).build());
        Application application = Application.builder()
                .id(UUID.randomUUID().toString())
                .userId(userId)
                .facilityId(facility.getId())
                .facilityName(facility.getName())
                .sport(trimmedSport)
                .status(ApplicationStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .version(0L)
                .statusHistory(history)
                .build();
        Notification notification = Notification.of(
                Notification.ADMIN_CHANNEL,
                NotificationTemplate.APPLICATION_CREATED,
                createdParams(application, user, facility),
                now);

        try {
            Application created = StorageCalls.call(() -> applicationRepository.create(application, notification));
            log.info("Application {} created by {} for facility {} ({})",
                    created.getId(), userId, facilityId, trimmedSport);
            return created;
        } catch (DataIntegrityViolationException duplicate) {
            log.debug("Concurrent submission detected for key {}", pendingKey);
            return StorageCalls.call(() -> applicationRepository.findPendingByKey(pendingKey))
                    .orElseThrow(() -> new ServiceException(
                            ErrorCode.CONFLICT, "Application changed concurrently, please retry", duplicate));
        }
    }

    public Application transition(String applicationId, ApplicationStatus target, String actorId) {
        return transition(applicationId, target, actorId, null);
    }

    /**
     * Moves the application to {@code target}. When {@code expectedVersion} is given the caller's view is pinned
     * and any difference fails immediately; otherwise a lost race is retried against a fresh read.
     */
    public Application transition(
            String applicationId, ApplicationStatus target, String actorId, Long expectedVersion) {
        if (target == null) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Target status is required");
        }
        if (!StringUtils.hasText(actorId)) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Actor id is required");
        }
        UserRole actorRole = authorizationService.roleOf(actorId);
        if (!actorRole.isStaff()) {
            userAccountService.find(actorId)
                    .filter(User::isBlocked)
                    .ifPresent(blocked -> {
                        throw new ServiceException(ErrorCode.BLOCKED, "User is blocked");
                    });
        }

        int maxAttempts = Math.max(1, fokProperties.getLifecycle().getMaxTransitionAttempts());
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Application current = get(applicationId);
            if (expectedVersion != null && current.getVersion() != expectedVersion) {
                throw new ServiceException(ErrorCode.CONFLICT, "Application was modified by someone else");
            }
            transitionPolicy.check(current, target, actorId, actorRole);

            Instant now = clock.instant();
            Application updated = applyTransition(current, target, actorId, now);
            StatusChange change = StatusChange.builder().status(target).actor(actorId).changedAt(now).build();
            Notification notification = Notification.of(
                    current.getUserId(),
                    NotificationTemplate.APPLICATION_STATUS_CHANGED,
                    statusParams(updated, current.getStatus()),
                    now);

            long readVersion = current.getVersion();
            boolean written = StorageCalls.call(
                    () -> applicationRepository.compareAndSet(updated, readVersion, change, notification));
            if (written) {
                updated.getStatusHistory().add(change);
                log.info("Application {} moved {} -> {} by {}",
                        applicationId, current.getStatus(), target, actorId);
                return updated;
            }
            log.debug("Lost update race on application {} (attempt {}/{})", applicationId, attempt, maxAttempts);
        }
        throw new ServiceException(ErrorCode.CONFLICT, "Application is being changed concurrently, please retry");
    }

    public Application get(String applicationId) {
        return StorageCalls.call(() -> applicationRepository.findById(applicationId))
                .orElseThrow(() -> new ServiceException(ErrorCode.NOT_FOUND, "Application not found"));
    }

    /**
     * Returns the application if the viewer owns it or holds {@link Capability#VIEW_ALL_APPLICATIONS}.
     */
    public Application getVisibleTo(String applicationId, String viewerId) {
        Application application = get(applicationId);
        if (!application.getUserId().equals(viewerId)
                && !authorizationService.can(viewerId, Capability.VIEW_ALL_APPLICATIONS)) {
            throw new ServiceException(ErrorCode.FORBIDDEN, "Application belongs to another user");
        }
        return application;
    }

    public List<Application> listByUser(String userId, int page, int size) {
        int pageSize = pageSize(size);
        return StorageCalls.call(() -> applicationRepository.findByUser(userId, Math.max(0, page), pageSize));
    }

    public List<Application> listByStatus(ApplicationStatus status, int page, int size) {
        if (status == null) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Status is required");
        }
        int pageSize = pageSize(size);
        return StorageCalls.call(() -> applicationRepository.findByStatus(status, Math.max(0, page), pageSize));
    }

    public List<Application> listByUser(String userId, ApplicationStatus status, int page, int size) {
        if (status == null) {
            return listByUser(userId, page, size);
        }
        int pageSize = pageSize(size);
        return StorageCalls.call(
                () -> applicationRepository.findByUserAndStatus(userId, status, Math.max(0, page), pageSize));
    }

    public long countByUser(String userId) {
        return StorageCalls.call(() -> applicationRepository.countByUser(userId));
    }

    public long countByUser(String userId, ApplicationStatus status) {
        if (status == null) {
            return countByUser(userId);
        }
        return StorageCalls.call(() -> applicationRepository.countByUserAndStatus(userId, status));
    }

    /**
     * Totals for the staff overview; requires {@link Capability#VIEW_ALL_APPLICATIONS}.
     */
    public ApplicationStatistics statistics(String actorId) {
        authorizationService.require(actorId, Capability.VIEW_ALL_APPLICATIONS);
        Map<ApplicationStatus, Long> stored = StorageCalls.call(applicationRepository::countByStatus);
        Map<ApplicationStatus, Long> byStatus = new EnumMap<>(ApplicationStatus.class);
        for (ApplicationStatus status : ApplicationStatus.values()) {
            byStatus.put(status, stored.getOrDefault(status, 0L));
        }
        long applications = byStatus.values().stream().mapToLong(Long::longValue).sum();
        return new ApplicationStatistics(userAccountService.countUsers(), applications, byStatus);
    }

    private int pageSize(int requested) {
        FokProperties.Lifecycle lifecycle = fokProperties.getLifecycle();
        if (requested <= 0) {
            return lifecycle.getDefaultPageSize();
        }
        return Math.min(requested, lifecycle.getMaxPageSize());
    }

    private Application applyTransition(Application current, ApplicationStatus target, String actorId, Instant now) {
        Application.ApplicationBuilder builder = current.toBuilder()
                .status(target)
                .updatedAt(now)
                .version(current.getVersion() + 1)
                .statusHistory(new ArrayList<>(current.getStatusHistory()));
        if (!current.getUserId().equals(actorId)) {
            builder.processedBy(actorId);
        }
        if (target == ApplicationStatus.COMPLETED) {
            builder.completedAt(now);
        }
        if (target == ApplicationStatus.CANCELLED) {
            builder.cancelledAt(now);
        }
        return builder.build();
    }

    private Map<String, String> createdParams(Application application, User user, Facility facility) {
        Map<String, String> params = new HashMap<>();
        params.put("applicationId", application.getId());
        params.put("shortId", application.shortId());
        params.put("userId", user.getId());
        params.put("userName", StringUtils.hasText(user.getDisplayName()) ? user.getDisplayName() : user.getFirstName());
        params.put("username", user.getUsername());
        params.put("phone", user.getPhone());
        params.put("facilityName", facility.getName());
        params.put("district", facility.getDistrict());
        params.put("sport", application.getSport());
        params.values().removeIf(value -> value == null);
        return params;
    }

    private Map<String, String> statusParams(Application application, ApplicationStatus previous) {
        Map<String, String> params = new HashMap<>();
        params.put("applicationId", application.getId());
        params.put("shortId", application.shortId());
        params.put("facilityName", application.getFacilityName());
        params.put("sport", application.getSport());
        params.put("previousStatus", previous.name());
        params.put("status", application.getStatus().name());
        params.values().removeIf(value -> value == null);
        return params;
    }
}
