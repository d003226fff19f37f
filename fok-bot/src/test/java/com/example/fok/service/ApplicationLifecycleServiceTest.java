package com.example.fok.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.example.fok.config.FokProperties;
import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatistics;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.domain.Facility;
import com.example.fok.domain.RegistrationState;
import com.example.fok.domain.StatusChange;
import com.example.fok.domain.User;
import com.example.fok.domain.UserRole;
import com.example.fok.notification.Notification;
import com.example.fok.notification.NotificationTemplate;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import com.example.fok.support.InMemoryApplicationRepository;
import com.example.fok.support.InMemoryUserRepository;
import com.example.fok.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;

@DisplayName("ApplicationLifecycleService")
class ApplicationLifecycleServiceTest {

    private static final String OWNER = "100";
    private static final String ADMIN = "900";
    private static final String OTHER_ADMIN = "901";
    private static final String STRANGER = "200";
    private static final String FACILITY = "fok-1";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final Map<String, Facility> facilities = Map.of(
            FACILITY, Facility.builder().id(FACILITY).name("ФОК Северный").district("Северный").active(true).build(),
            "fok-closed", Facility.builder().id("fok-closed").name("ФОК Закрытый").active(false).build());

    private FokProperties properties;
    private InMemoryUserRepository users;
    private InMemoryApplicationRepository applications;
    private ApplicationLifecycleService service;
    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        properties = new FokProperties();
        users = new InMemoryUserRepository();
        applications = new InMemoryApplicationRepository();
        users.put(registered(OWNER, UserRole.NONE));
        users.put(registered(STRANGER, UserRole.NONE));
        users.put(registered(ADMIN, UserRole.ADMIN));
        users.put(registered(OTHER_ADMIN, UserRole.ADMIN));
        service = newService(applications);
    }

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("creates a pending application with its first history entry and an admin notification")
    void createsPendingApplication() {
        Application created = service.create(OWNER, FACILITY, "Футбол");

        assertThat(created.getStatus()).isEqualTo(ApplicationStatus.PENDING);
        assertThat(created.getVersion()).isZero();
        assertThat(created.getFacilityName()).isEqualTo("ФОК Северный");
        assertThat(created.getStatusHistory()).extracting(StatusChange::getStatus)
                .containsExactly(ApplicationStatus.PENDING);
        assertThat(applications.outbox()).singleElement().satisfies(notification -> {
            assertThat(notification.getTarget()).isEqualTo(Notification.ADMIN_CHANNEL);
            assertThat(notification.getTemplate()).isEqualTo(NotificationTemplate.APPLICATION_CREATED);
            assertThat(notification.getParams()).containsEntry("sport", "Футбол");
        });
    }

    @Test
    @DisplayName("returns the existing pending application when the same submission is repeated")
    void createIsIdempotent() {
        Application first = service.create(OWNER, FACILITY, "Футбол");
        Application second = service.create(OWNER, FACILITY, "  футбол ");

        assertThat(second.getId()).isEqualTo(first.getId());
        assertThat(applications.size()).isEqualTo(1);
        assertThat(applications.outbox()).hasSize(1);
    }

    @Test
    @DisplayName("allows a new submission once the previous one is no longer pending")
    void createAfterCancellationMakesNewApplication() {
        Application first = service.create(OWNER, FACILITY, "Футбол");
        service.transition(first.getId(), ApplicationStatus.CANCELLED, OWNER);

        Application second = service.create(OWNER, FACILITY, "Футбол");

        assertThat(second.getId()).isNotEqualTo(first.getId());
        assertThat(applications.size()).isEqualTo(2);
    }

    @Test
    @DisplayName("resolves a concurrent duplicate insert to the stored application")
    void createResolvesDuplicateInsertRace() {
        Application stored = service.create(OWNER, FACILITY, "Футбол");
        InMemoryApplicationRepository backing = applications;
        InMemoryApplicationRepository racing = new InMemoryApplicationRepository() {
            private boolean firstLookup = true;

            @Override
            public synchronized Optional<Application> findPendingByKey(String pendingKey) {
                if (firstLookup) {
                    firstLookup = false;
                    return Optional.empty();
                }
                return backing.findPendingByKey(pendingKey);
            }

            @Override
            public synchronized Application create(Application application, Notification notification) {
                throw new DataIntegrityViolationException("uk_applications_pending_key");
            }
        };

        Application result = newService(racing).create(OWNER, FACILITY, "Футбол");

        assertThat(result.getId()).isEqualTo(stored.getId());
    }

    @Test
    @DisplayName("rejects unregistered, blocked and unknown-facility submissions")
    void createPreconditions() {
        users.put(User.builder().id("300").registrationState(RegistrationState.AWAITING_PHONE).build());
        User blocked = registered("301", UserRole.NONE);
        blocked.setBlocked(true);
        users.put(blocked);

        assertCode(() -> service.create("300", FACILITY, "Футбол"), ErrorCode.UNREGISTERED);
        assertCode(() -> service.create("unknown", FACILITY, "Футбол"), ErrorCode.UNREGISTERED);
        assertCode(() -> service.create("301", FACILITY, "Футбол"), ErrorCode.BLOCKED);
        assertCode(() -> service.create(OWNER, "missing", "Футбол"), ErrorCode.NOT_FOUND);
        assertCode(() -> service.create(OWNER, "fok-closed", "Футбол"), ErrorCode.NOT_FOUND);
        assertCode(() -> service.create(OWNER, FACILITY, " "), ErrorCode.BAD_REQUEST);
    }

    @Test
    @DisplayName("admin accept bumps the version by one and notifies the owner once")
    void adminAcceptNotifiesOwner() {
        Application created = service.create(OWNER, FACILITY, "Футбол");
        applications.outbox().clear();
        clock.advance(Duration.ofMinutes(5));

        Application accepted = service.transition(created.getId(), ApplicationStatus.ACCEPTED, ADMIN, 0L);

        assertThat(accepted.getVersion()).isEqualTo(1L);
        assertThat(accepted.getProcessedBy()).isEqualTo(ADMIN);
        assertThat(accepted.getUpdatedAt()).isEqualTo(clock.instant());
        assertThat(accepted.getStatusHistory()).extracting(StatusChange::getStatus)
                .containsExactly(ApplicationStatus.PENDING, ApplicationStatus.ACCEPTED);
        assertThat(applications.outbox()).singleElement().satisfies(notification -> {
            assertThat(notification.getTarget()).isEqualTo(OWNER);
            assertThat(notification.getTemplate()).isEqualTo(NotificationTemplate.APPLICATION_STATUS_CHANGED);
            assertThat(notification.getParams()).containsEntry("status", "ACCEPTED");
        });
    }

    @Test
    @DisplayName("a replay carrying the old version fails with a conflict and changes nothing")
    void staleVersionReplayConflicts() {
        Application created = service.create(OWNER, FACILITY, "Футбол");
        service.transition(created.getId(), ApplicationStatus.ACCEPTED, ADMIN, 0L);
        applications.outbox().clear();

        assertCode(() -> service.transition(created.getId(), ApplicationStatus.CANCELLED, ADMIN, 0L),
                ErrorCode.CONFLICT);

        Application stored = service.get(created.getId());
        assertThat(stored.getStatus()).isEqualTo(ApplicationStatus.ACCEPTED);
        assertThat(stored.getVersion()).isEqualTo(1L);
        assertThat(applications.outbox()).isEmpty();
    }

    @Test
    @DisplayName("moving a completed application back to accepted is an invalid transition")
    void completedToAcceptedIsInvalid() {
        Application created = service.create(OWNER, FACILITY, "Футбол");
        service.transition(created.getId(), ApplicationStatus.ACCEPTED, ADMIN);
        Application completed = service.transition(created.getId(), ApplicationStatus.COMPLETED, ADMIN);
        assertThat(completed.getCompletedAt()).isNotNull();

        assertCode(() -> service.transition(created.getId(), ApplicationStatus.ACCEPTED, ADMIN),
                ErrorCode.INVALID_TRANSITION);
        assertCode(() -> service.transition(created.getId(), ApplicationStatus.ACCEPTED, OWNER),
                ErrorCode.INVALID_TRANSITION);
    }

    @Test
    @DisplayName("owners may only withdraw pending applications and strangers may do nothing")
    void ownerAndStrangerPermissions() {
        Application created = service.create(OWNER, FACILITY, "Футбол");

        assertCode(() -> service.transition(created.getId(), ApplicationStatus.ACCEPTED, OWNER), ErrorCode.FORBIDDEN);
        assertCode(() -> service.transition(created.getId(), ApplicationStatus.CANCELLED, STRANGER),
                ErrorCode.FORBIDDEN);

        Application cancelled = service.transition(created.getId(), ApplicationStatus.CANCELLED, OWNER);

        assertThat(cancelled.getStatus()).isEqualTo(ApplicationStatus.CANCELLED);
        assertThat(cancelled.getCancelledAt()).isEqualTo(clock.instant());
        assertThat(cancelled.getProcessedBy()).isNull();
    }

    @Test
    @DisplayName("owners cannot cancel once the application was accepted")
    void ownerCannotCancelAccepted() {
        Application created = service.create(OWNER, FACILITY, "Футбол");
        service.transition(created.getId(), ApplicationStatus.ACCEPTED, ADMIN);

        assertCode(() -> service.transition(created.getId(), ApplicationStatus.CANCELLED, OWNER), ErrorCode.FORBIDDEN);
    }

    @Test
    @DisplayName("statistics count users and applications per status for staff only")
    void statisticsForStaff() {
        Application football = service.create(OWNER, FACILITY, "Футбол");
        service.create(OWNER, FACILITY, "Плавание");
        service.create(STRANGER, FACILITY, "Футбол");
        service.transition(football.getId(), ApplicationStatus.ACCEPTED, ADMIN);

        ApplicationStatistics statistics = service.statistics(ADMIN);

        assertThat(statistics.users()).isEqualTo(4);
        assertThat(statistics.applications()).isEqualTo(3);
        assertThat(statistics.byStatus())
                .containsEntry(ApplicationStatus.PENDING, 2L)
                .containsEntry(ApplicationStatus.ACCEPTED, 1L)
                .containsEntry(ApplicationStatus.COMPLETED, 0L)
                .hasSize(ApplicationStatus.values().length);
        assertCode(() -> service.statistics(STRANGER), ErrorCode.FORBIDDEN);
    }

    @Test
    @DisplayName("a user's list filtered by status pages over matching applications only")
    void listByUserAndStatus() {
        Application football = service.create(OWNER, FACILITY, "Футбол");
        clock.advance(Duration.ofSeconds(1));
        service.create(OWNER, FACILITY, "Плавание");
        clock.advance(Duration.ofSeconds(1));
        Application tennis = service.create(OWNER, FACILITY, "Теннис");
        service.transition(football.getId(), ApplicationStatus.ACCEPTED, ADMIN);
        service.transition(tennis.getId(), ApplicationStatus.ACCEPTED, ADMIN);

        assertThat(service.listByUser(OWNER, ApplicationStatus.ACCEPTED, 0, 1))
                .extracting(Application::getId).containsExactly(tennis.getId());
        assertThat(service.listByUser(OWNER, ApplicationStatus.ACCEPTED, 1, 1))
                .extracting(Application::getId).containsExactly(football.getId());
        assertThat(service.countByUser(OWNER, ApplicationStatus.ACCEPTED)).isEqualTo(2);
        assertThat(service.countByUser(OWNER, null)).isEqualTo(3);
    }

    @Test
    @DisplayName("configured super admins may transition without a stored role")
    void configuredSuperAdminCanTransition() {
        properties.getAdmin().setSuperAdminIds(List.of("777"));
        Application created = service.create(OWNER, FACILITY, "Футбол");

        Application accepted = service.transition(created.getId(), ApplicationStatus.ACCEPTED, "777");

        assertThat(accepted.getStatus()).isEqualTo(ApplicationStatus.ACCEPTED);
    }

    @Test
    @DisplayName("gives up with a conflict after the configured number of lost races")
    void boundedRetryOnLostRaces() {
        Application created = service.create(OWNER, FACILITY, "Футбол");
        InMemoryApplicationRepository backing = applications;
        AtomicInteger attempts = new AtomicInteger();
        InMemoryApplicationRepository alwaysLosing = new InMemoryApplicationRepository() {
            @Override
            public synchronized Optional<Application> findById(String applicationId) {
                return backing.findById(applicationId);
            }

            @Override
            public synchronized boolean compareAndSet(
                    Application updated, long expectedVersion, StatusChange change, Notification notification) {
                attempts.incrementAndGet();
                return false;
            }
        };

        assertCode(() -> newService(alwaysLosing).transition(created.getId(), ApplicationStatus.ACCEPTED, ADMIN),
                ErrorCode.CONFLICT);
        assertThat(attempts).hasValue(3);
    }

    @Test
    @DisplayName("concurrent identical transitions succeed exactly once")
    void concurrentAcceptSucceedsOnce() throws Exception {
        Application created = service.create(OWNER, FACILITY, "Футбол");
        List<Outcome> outcomes = race(8, actor -> service.transition(created.getId(), ApplicationStatus.ACCEPTED, actor));

        assertThat(outcomes).filteredOn(Outcome::succeeded).hasSize(1);
        assertThat(outcomes).filteredOn(outcome -> !outcome.succeeded())
                .allSatisfy(outcome -> assertThat(outcome.code()).isEqualTo(ErrorCode.INVALID_TRANSITION));
        Application stored = service.get(created.getId());
        assertThat(stored.getVersion()).isEqualTo(1L);
        assertThat(stored.getStatusHistory()).hasSize(2);
    }

    @Test
    @DisplayName("concurrent competing transitions never share a version and history matches the successes")
    void concurrentCompetingTransitions() throws Exception {
        Application created = service.create(OWNER, FACILITY, "Футбол");
        ApplicationStatus[] targets = {
                ApplicationStatus.ACCEPTED, ApplicationStatus.CANCELLED,
                ApplicationStatus.ACCEPTED, ApplicationStatus.CANCELLED,
                ApplicationStatus.ACCEPTED, ApplicationStatus.CANCELLED
        };
        AtomicInteger next = new AtomicInteger();
        List<Outcome> outcomes = race(targets.length, actor -> service.transition(
                created.getId(), targets[next.getAndIncrement()], actor));

        List<Outcome> successes = outcomes.stream().filter(Outcome::succeeded).toList();
        Application stored = service.get(created.getId());
        assertThat(successes).isNotEmpty();
        assertThat(successes).extracting(Outcome::version).doesNotHaveDuplicates();
        assertThat(stored.getVersion()).isEqualTo(successes.size());
        assertThat(stored.getStatusHistory()).hasSize(1 + successes.size());
        assertThat(stored.getStatus().isTerminal()).isTrue();
    }

    private List<Outcome> race(int threads, Function<String, Application> action)
            throws Exception {
        executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<Outcome>> futures = new ArrayList<>();
        for (int i = 0; i < threads; i++) {
            String actor = i % 2 == 0 ? ADMIN : OTHER_ADMIN;
            Callable<Outcome> task = () -> {
                start.await();
                try {
                    Application result = action.apply(actor);
                    return new Outcome(true, result.getVersion(), null);
                } catch (ServiceException ex) {
                    return new Outcome(false, -1, ex.getCode());
                }
            };
            futures.add(executor.submit(task));
        }
        start.countDown();
        List<Outcome> outcomes = new ArrayList<>();
        for (Future<Outcome> future : futures) {
            outcomes.add(future.get(10, TimeUnit.SECONDS));
        }
        return outcomes;
    }

    private record Outcome(boolean succeeded, long version, ErrorCode code) {
    }

    private ApplicationLifecycleService newService(ApplicationRepository repository) {
        UserAccountService accounts = new UserAccountService(users, clock);
        AdminAuthorizationService authorization = new AdminAuthorizationService(accounts, properties);
        FacilityCatalog catalog = facilityId -> Optional.ofNullable(facilities.get(facilityId));
        return new ApplicationLifecycleService(
                repository, catalog, accounts, authorization, new TransitionPolicy(), properties, clock);
    }

    private static User registered(String id, UserRole role) {
        return User.builder()
                .id(id)
                .firstName("User " + id)
                .displayName("User " + id)
                .phone("+7999000" + id)
                .role(role)
                .registrationState(RegistrationState.COMPLETED)
                .build();
    }

    private static void assertCode(Runnable action, ErrorCode code) {
        assertThatThrownBy(action::run)
                .isInstanceOf(ServiceException.class)
                .extracting(ex -> ((ServiceException) ex).getCode())
                .isEqualTo(code);
    }
}
