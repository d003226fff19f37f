package com.example.fok.inbound;

import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.domain.Capability;
import com.example.fok.domain.User;
import com.example.fok.service.AdminAuthorizationService;
import com.example.fok.service.ApplicationLifecycleService;
import com.example.fok.service.RateLimitDecision;
import com.example.fok.service.RateLimiter;
import com.example.fok.service.UserAccountService;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Entry point for every inbound event: rate limiting, user resolution, dialogs, then commands and buttons.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventRouter {

    private static final Map<String, ApplicationStatus> ADMIN_ACTIONS = Map.of(
            "accept", ApplicationStatus.ACCEPTED,
            "transfer", ApplicationStatus.TRANSFERRED,
            "complete", ApplicationStatus.COMPLETED,
            "cancel", ApplicationStatus.CANCELLED);

    private final RateLimiter rateLimiter;
    private final UserAccountService userAccountService;
    private final AdminAuthorizationService authorizationService;
    private final ApplicationLifecycleService lifecycleService;
    private final ConversationStateMachine stateMachine;
    private final Clock clock;

    public BotReply route(InboundEvent event) {
        Instant now = clock.instant();
        RateLimitDecision decision = rateLimiter.admit(event.getUserId(), now);
        if (decision.throttled()) {
            return decision.warn() ? BotReply.of(BotMessages.COOLDOWN) : BotReply.empty();
        }
        try {
            User user = userAccountService.resolve(event.getUserId(), event.getUsername(), event.getFirstName());
            return dispatch(user, event, now);
        } catch (ServiceException ex) {
            log.info("Event {} from {} rejected: {} ({})",
                    event.getEventId(), event.getUserId(), ex.getErrorCode(), ex.getMessage());
            return BotReply.of(BotMessages.errorText(ex.getCode()));
        }
    }

    private BotReply dispatch(User user, InboundEvent event, Instant now) {
        InboundEventType type = event.effectiveType();
        String payload = event.trimmedPayload();
        boolean staff = authorizationService.isAdmin(user.getId());

        if (type == InboundEventType.COMMAND) {
            String command = commandName(payload);
            if ("/start".equals(command)) {
                return stateMachine.restart(user, staff, now);
            }
            if ("/cancel".equals(command)) {
                return stateMachine.abort(user, staff, now);
            }
        }

        Optional<BotReply> dialogReply = stateMachine.handle(user, event, now);
        if (dialogReply.isPresent()) {
            return dialogReply.get();
        }
        if (user.isBlocked()) {
            return BotReply.of(BotMessages.errorText(ErrorCode.BLOCKED));
        }

        return switch (type) {
            case COMMAND -> handleCommand(user, staff, payload);
            case CALLBACK -> handleCallback(user, staff, payload, now);
            default -> BotMessages.mainMenu(staff, BotMessages.UNKNOWN_COMMAND);
        };
    }

    private BotReply handleCommand(User user, boolean staff, String payload) {
        String command = commandName(payload);
        String argument = commandArgument(payload);
        return switch (command) {
            case "/menu" -> BotMessages.mainMenu(staff);
            case "/help" -> BotReply.of(BotMessages.HELP);
            case "/my" -> ownApplications(user);
            case "/admin" -> applicationsForStaff(user, argument);
            case "/stats" -> BotReply.of(BotMessages.statistics(lifecycleService.statistics(user.getId())))
                    .withKeyboard(List.of(List.of(BotButton.callback("🏠 Главное меню", "main_menu"))));
            case "/grant" -> withUserArgument(command, argument, target -> BotReply.of(
                    BotMessages.ADMIN_GRANTED.formatted(
                            authorizationService.grantAdmin(user.getId(), target).getId())));
            case "/revoke" -> withUserArgument(command, argument, target -> BotReply.of(
                    BotMessages.ADMIN_REVOKED.formatted(
                            authorizationService.revokeAdmin(user.getId(), target).getId())));
            case "/block" -> withUserArgument(command, argument, target -> BotReply.of(
                    BotMessages.USER_BLOCKED.formatted(
                            authorizationService.setBlocked(user.getId(), target, true).getId())));
            case "/unblock" -> withUserArgument(command, argument, target -> BotReply.of(
                    BotMessages.USER_UNBLOCKED.formatted(
                            authorizationService.setBlocked(user.getId(), target, false).getId())));
            default -> BotMessages.mainMenu(staff, BotMessages.UNKNOWN_COMMAND);
        };
    }

    private BotReply handleCallback(User user, boolean staff, String data, Instant now) {
        switch (data) {
            case "main_menu":
                return BotMessages.mainMenu(staff);
            case "my_applications":
                return ownApplications(user);
            case "admin_pending":
                return applicationsForStaff(user, "");
            case "admin_stats":
                return handleCommand(user, staff, "/stats");
            case "help":
                return BotReply.of(BotMessages.HELP);
            default:
                break;
        }
        String[] parts = data.split(":", 3);
        switch (parts[0]) {
            case "apply":
                if (parts.length < 2 || !StringUtils.hasText(parts[1])) {
                    break;
                }
                return stateMachine.beginSubmission(user, parts[1], parts.length == 3 ? parts[2] : null, now);
            case "cancel_app":
                if (parts.length != 2) {
                    break;
                }
                Application cancelled = lifecycleService.transition(parts[1], ApplicationStatus.CANCELLED, user.getId());
                return BotReply.of(BotMessages.APPLICATION_CANCELLED.formatted(cancelled.shortId()));
            case "admin":
                if (parts.length != 3 || !ADMIN_ACTIONS.containsKey(parts[1])) {
                    break;
                }
                Application updated = lifecycleService.transition(parts[2], ADMIN_ACTIONS.get(parts[1]), user.getId());
                return BotReply.of(BotMessages.APPLICATION_STATUS_SET.formatted(
                        updated.shortId(), updated.getStatus().getDisplayName()));
            default:
                break;
        }
        log.debug("Unrecognised callback '{}' from {}", data, user.getId());
        return BotMessages.mainMenu(staff, BotMessages.UNKNOWN_COMMAND);
    }

    private BotReply ownApplications(User user) {
        List<Application> applications = lifecycleService.listByUser(user.getId(), 0, 0);
        if (applications.isEmpty()) {
            return BotReply.of(BotMessages.NO_APPLICATIONS)
                    .withKeyboard(List.of(List.of(BotButton.callback("🏠 Главное меню", "main_menu"))));
        }
        long total = lifecycleService.countByUser(user.getId());
        StringBuilder text = new StringBuilder("📋 Ваши заявки (всего: %d):\n".formatted(total));
        List<List<BotButton>> rows = new ArrayList<>();
        for (Application application : applications) {
            text.append('\n').append(BotMessages.describe(application));
            if (application.getStatus() == ApplicationStatus.PENDING) {
                rows.add(List.of(BotButton.callback(
                        "❌ Отменить #" + application.shortId(), "cancel_app:" + application.getId())));
            }
        }
        rows.add(List.of(BotButton.callback("🏠 Главное меню", "main_menu")));
        return BotReply.of(text.toString()).withKeyboard(rows);
    }

    private BotReply applicationsForStaff(User user, String statusArgument) {
        authorizationService.require(user.getId(), Capability.VIEW_ALL_APPLICATIONS);
        ApplicationStatus status = parseStatus(statusArgument);
        List<Application> applications = lifecycleService.listByStatus(status, 0, 0);
        if (applications.isEmpty()) {
            return BotReply.of(BotMessages.NO_APPLICATIONS_IN_STATUS.formatted(status.getDisplayName()));
        }
        StringBuilder text = new StringBuilder("🛠 Заявки: %s\n".formatted(status.getDisplayName()));
        List<List<BotButton>> rows = new ArrayList<>();
        for (Application application : applications) {
            text.append('\n').append(BotMessages.describe(application));
            List<BotButton> actions = new ArrayList<>();
            ADMIN_ACTIONS.forEach((action, target) -> {
                if (application.getStatus().canTransitionTo(target)) {
                    actions.add(BotButton.callback(
                            BotMessages.actionLabel(target) + " #" + application.shortId(),
                            "admin:" + action + ":" + application.getId()));
                }
            });
            actions.sort((left, right) -> left.text().compareTo(right.text()));
            rows.add(actions);
        }
        return BotReply.of(text.toString()).withKeyboard(rows);
    }

    private ApplicationStatus parseStatus(String argument) {
        if (!StringUtils.hasText(argument)) {
            return ApplicationStatus.PENDING;
        }
        try {
            return ApplicationStatus.valueOf(argument.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new ServiceException(
                    ErrorCode.BAD_REQUEST, "Unknown status " + argument);
        }
    }

    private BotReply withUserArgument(String command, String argument, Function<String, BotReply> action) {
        if (!StringUtils.hasText(argument)) {
            return BotReply.of(BotMessages.USAGE_USER_ID.formatted(command));
        }
        return action.apply(argument.trim());
    }

    private static String commandName(String payload) {
        int space = payload.indexOf(' ');
        String command = space < 0 ? payload : payload.substring(0, space);
        int mention = command.indexOf('@');
        if (mention > 0) {
            command = command.substring(0, mention);
        }
        return command.toLowerCase(Locale.ROOT);
    }

    private static String commandArgument(String payload) {
        int space = payload.indexOf(' ');
        return space < 0 ? "" : payload.substring(space + 1).trim();
    }
}
