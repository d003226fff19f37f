package com.example.fok.inbound;

import com.example.fok.config.FokProperties;
import com.example.fok.domain.Application;
import com.example.fok.domain.ConversationFlow;
import com.example.fok.domain.ConversationSession;
import com.example.fok.domain.RegistrationState;
import com.example.fok.domain.User;
import com.example.fok.service.ApplicationLifecycleService;
import com.example.fok.service.ConversationSessionRepository;
import com.example.fok.service.PhoneNumbers;
import com.example.fok.service.UserAccountService;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Drives multi-step dialogs: registration and application submission. The dialog cursor lives in the shared
 * session store so any replica can continue a conversation.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConversationStateMachine {

    static final String STEP_STARTED = RegistrationState.STARTED.name();
    static final String STEP_AWAITING_PHONE = RegistrationState.AWAITING_PHONE.name();
    static final String STEP_AWAITING_SPORT = "AWAITING_SPORT";

    static final String SCRATCH_NAME = "name";
    static final String SCRATCH_FACILITY = "facilityId";

    private static final int MIN_TEXT_LENGTH = 2;
    private static final int MAX_TEXT_LENGTH = 64;

    private final ConversationSessionRepository sessionRepository;
    private final UserAccountService userAccountService;
    private final ApplicationLifecycleService lifecycleService;
    private final FokProperties fokProperties;

    /**
     * {@code /start}: registered users get the main menu, everyone else restarts registration from scratch.
     */
    public BotReply restart(User user, boolean staff, Instant now) {
        sessionRepository.delete(user.getId());
        if (user.isRegistered()) {
            return BotMessages.mainMenu(staff);
        }
        return promptForName(user, newSession(user.getId(), ConversationFlow.REGISTRATION, STEP_STARTED, now), now,
                BotMessages.WELCOME);
    }

    /**
     * {@code /cancel}: drops whatever dialog is open.
     */
    public BotReply abort(User user, boolean staff, Instant now) {
        sessionRepository.delete(user.getId());
        if (!user.isRegistered()) {
            return restart(user, staff, now);
        }
        return BotMessages.mainMenu(staff, BotMessages.ACTION_CANCELLED);
    }

    /**
     * Feeds an event into the open dialog.
     *
     * @return empty when no dialog applies to this event
     */
    public Optional<BotReply> handle(User user, InboundEvent event, Instant now) {
        Optional<ConversationSession> session = activeSession(user.getId(), now);
        if (!user.isRegistered()) {
            ConversationSession registration = session
                    .filter(s -> s.getFlow() == ConversationFlow.REGISTRATION)
                    .orElse(null);
            return Optional.of(handleRegistration(user, registration, event, now));
        }
        if (session.isEmpty() || session.get().getFlow() != ConversationFlow.SUBMIT_APPLICATION) {
            return Optional.empty();
        }
        InboundEventType type = event.effectiveType();
        if (type == InboundEventType.COMMAND || type == InboundEventType.CALLBACK) {
            return Optional.empty();
        }
        return Optional.of(handleSport(user, session.get(), event, now));
    }

    /**
     * Starts the submission dialog for a facility, or submits right away when the sport is already known.
     */
    public BotReply beginSubmission(User user, String facilityId, String sport, Instant now) {
        if (user.isBlocked()) {
            throw new ServiceException(ErrorCode.BLOCKED, "User is blocked");
        }
        if (sport != null && !sport.isBlank()) {
            sessionRepository.delete(user.getId());
            return submit(user, facilityId, sport.trim());
        }
        ConversationSession session = newSession(
                user.getId(), ConversationFlow.SUBMIT_APPLICATION, STEP_AWAITING_SPORT, now);
        session.getScratch().put(SCRATCH_FACILITY, facilityId);
        save(session, now);
        return BotReply.of(BotMessages.ASK_SPORT);
    }

    private BotReply handleRegistration(User user, ConversationSession session, InboundEvent event, Instant now) {
        if (session == null) {
            ConversationSession fresh = newSession(user.getId(), ConversationFlow.REGISTRATION, STEP_STARTED, now);
            Optional<String> name = nameFrom(event);
            if (name.isPresent()) {
                return acceptName(user, fresh, name.get(), now);
            }
            return promptForName(user, fresh, now, BotMessages.WELCOME);
        }
        if (STEP_AWAITING_PHONE.equals(session.getStep())) {
            return handlePhone(user, session, event, now);
        }
        Optional<String> name = nameFrom(event);
        if (name.isPresent()) {
            return acceptName(user, session, name.get(), now);
        }
        return promptForName(user, session, now, BotMessages.INVALID_NAME);
    }

    private BotReply promptForName(User user, ConversationSession session, Instant now, String message) {
        session.setStep(STEP_STARTED);
        session.getScratch().clear();
        save(session, now);
        RegistrationState state = user.getRegistrationState();
        if (state != RegistrationState.AWAITING_NAME && state != RegistrationState.COMPLETED) {
            user.setRegistrationState(RegistrationState.AWAITING_NAME);
            userAccountService.save(user);
        }
        return BotReply.of(message);
    }

    private BotReply acceptName(User user, ConversationSession session, String name, Instant now) {
        session.setStep(STEP_AWAITING_PHONE);
        session.getScratch().put(SCRATCH_NAME, name);
        save(session, now);
        if (user.getRegistrationState() != RegistrationState.AWAITING_PHONE) {
            user.setRegistrationState(RegistrationState.AWAITING_PHONE);
            userAccountService.save(user);
        }
        return BotReply.of(BotMessages.ASK_PHONE.formatted(name))
                .withKeyboard(List.of(List.of(BotButton.contactRequest(BotMessages.SHARE_CONTACT_BUTTON))));
    }

    private BotReply handlePhone(User user, ConversationSession session, InboundEvent event, Instant now) {
        Optional<String> phone = switch (event.effectiveType()) {
            case CONTACT -> PhoneNumbers.normalizeShared(event.trimmedPayload());
            case TEXT -> PhoneNumbers.isValidMobile(event.trimmedPayload())
                    ? PhoneNumbers.normalize(event.trimmedPayload())
                    : Optional.empty();
            default -> Optional.empty();
        };
        if (phone.isEmpty()) {
            save(session, now);
            return BotReply.of(BotMessages.INVALID_PHONE)
                    .withKeyboard(List.of(List.of(BotButton.contactRequest(BotMessages.SHARE_CONTACT_BUTTON))));
        }
        String name = session.getScratch().get(SCRATCH_NAME);
        user.setDisplayName(name);
        user.setPhone(phone.get());
        user.setRegistrationState(RegistrationState.COMPLETED);
        userAccountService.save(user);
        sessionRepository.delete(user.getId());
        log.info("User {} completed registration", user.getId());
        return BotMessages.mainMenu(false, BotMessages.REGISTRATION_COMPLETED.formatted(name));
    }

    private BotReply handleSport(User user, ConversationSession session, InboundEvent event, Instant now) {
        String sport = event.trimmedPayload();
        if (event.effectiveType() != InboundEventType.TEXT || !withinLength(sport)) {
            save(session, now);
            return BotReply.of(BotMessages.INVALID_SPORT);
        }
        String facilityId = session.getScratch().get(SCRATCH_FACILITY);
        try {
            BotReply reply = submit(user, facilityId, sport);
            sessionRepository.delete(user.getId());
            return reply;
        } catch (ServiceException ex) {
            if (!ex.isRetryable()) {
                sessionRepository.delete(user.getId());
            }
            throw ex;
        }
    }

    private BotReply submit(User user, String facilityId, String sport) {
        Application application = lifecycleService.create(user.getId(), facilityId, sport);
        return BotReply.of(BotMessages.APPLICATION_SUBMITTED.formatted(
                application.getFacilityName(), application.getSport(), application.shortId()));
    }

    private Optional<ConversationSession> activeSession(String userId, Instant now) {
        Optional<ConversationSession> session = sessionRepository.find(userId);
        if (session.isPresent() && session.get().isExpired(now)) {
            log.debug("Discarding expired {} session of user {}", session.get().getFlow(), userId);
            sessionRepository.delete(userId);
            return Optional.empty();
        }
        return session;
    }

    private Optional<String> nameFrom(InboundEvent event) {
        if (event.effectiveType() != InboundEventType.TEXT) {
            return Optional.empty();
        }
        String name = event.trimmedPayload();
        if (!withinLength(name) || name.chars().noneMatch(Character::isLetter)) {
            return Optional.empty();
        }
        return Optional.of(name);
    }

    private boolean withinLength(String text) {
        return text.length() >= MIN_TEXT_LENGTH && text.length() <= MAX_TEXT_LENGTH;
    }

    private ConversationSession newSession(String userId, ConversationFlow flow, String step, Instant now) {
        return ConversationSession.builder()
                .userId(userId)
                .flow(flow)
                .step(step)
                .scratch(new HashMap<>())
                .updatedAt(now)
                .build();
    }

    private void save(ConversationSession session, Instant now) {
        session.setUpdatedAt(now);
        session.setExpiresAt(now.plus(fokProperties.getConversation().getSessionTimeout()));
        sessionRepository.save(session, fokProperties.getConversation().getSessionTimeout());
    }
}
