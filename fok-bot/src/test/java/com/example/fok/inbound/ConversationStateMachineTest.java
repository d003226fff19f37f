package com.example.fok.inbound;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.example.fok.config.FokProperties;
import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.domain.ConversationFlow;
import com.example.fok.domain.RegistrationState;
import com.example.fok.domain.User;
import com.example.fok.service.ApplicationLifecycleService;
import com.example.fok.service.UserAccountService;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import com.example.fok.support.InMemorySessionRepository;
import com.example.fok.support.InMemoryUserRepository;
import com.example.fok.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("ConversationStateMachine")
class ConversationStateMachineTest {

    private static final String USER_ID = "100";

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private InMemoryUserRepository users;
    private InMemorySessionRepository sessions;
    private UserAccountService accounts;
    private ApplicationLifecycleService lifecycleService;
    private ConversationStateMachine stateMachine;

    @BeforeEach
    void setUp() {
        users = new InMemoryUserRepository();
        sessions = new InMemorySessionRepository();
        accounts = new UserAccountService(users, clock);
        lifecycleService = mock(ApplicationLifecycleService.class);
        FokProperties properties = new FokProperties();
        properties.getConversation().setSessionTimeout(Duration.ofMinutes(30));
        stateMachine = new ConversationStateMachine(sessions, accounts, lifecycleService, properties);
    }

    @Test
    @DisplayName("walks a new user from /start through name and phone to a completed registration")
    void completesRegistration() {
        BotReply welcome = stateMachine.restart(currentUser(), false, clock.instant());
        assertThat(welcome.messages()).containsExactly(BotMessages.WELCOME);
        assertThat(stored().getRegistrationState()).isEqualTo(RegistrationState.AWAITING_NAME);

        BotReply askPhone = send(text("Иван"));
        assertThat(askPhone.messages()).containsExactly(BotMessages.ASK_PHONE.formatted("Иван"));
        assertThat(askPhone.keyboard()).isNotEmpty();
        assertThat(stored().getRegistrationState()).isEqualTo(RegistrationState.AWAITING_PHONE);

        BotReply done = send(event(InboundEventType.CONTACT, "79991234567"));

        assertThat(done.messages()).startsWith(BotMessages.REGISTRATION_COMPLETED.formatted("Иван"));
        User user = stored();
        assertThat(user.getRegistrationState()).isEqualTo(RegistrationState.COMPLETED);
        assertThat(user.getPhone()).isEqualTo("+79991234567");
        assertThat(user.getDisplayName()).isEqualTo("Иван");
        assertThat(sessions.peek(USER_ID)).isEmpty();
    }

    @Test
    @DisplayName("a typed phone number is normalized")
    void acceptsTypedPhone() {
        stateMachine.restart(currentUser(), false, clock.instant());
        send(text("Иван"));

        send(text("8 (999) 123-45-67"));

        assertThat(stored().getPhone()).isEqualTo("+79991234567");
    }

    @Test
    @DisplayName("an invalid phone keeps the user waiting for a phone without touching the user record")
    void invalidPhoneIsRejected() {
        stateMachine.restart(currentUser(), false, clock.instant());
        send(text("Иван"));
        User user = currentUser();
        int savesBefore = users.saveCount();

        Optional<BotReply> reply = stateMachine.handle(user, text("12345"), clock.instant());

        assertThat(reply.orElseThrow().messages()).containsExactly(BotMessages.INVALID_PHONE);
        assertThat(users.saveCount()).isEqualTo(savesBefore);
        assertThat(stored().getRegistrationState()).isEqualTo(RegistrationState.AWAITING_PHONE);
        assertThat(sessions.peek(USER_ID).orElseThrow().getStep())
                .isEqualTo(ConversationStateMachine.STEP_AWAITING_PHONE);
    }

    @Test
    @DisplayName("a name without letters is asked for again")
    void invalidNameIsRejected() {
        stateMachine.restart(currentUser(), false, clock.instant());

        BotReply reply = send(text("12"));

        assertThat(reply.messages()).containsExactly(BotMessages.INVALID_NAME);
        assertThat(stored().getRegistrationState()).isEqualTo(RegistrationState.AWAITING_NAME);
    }

    @Test
    @DisplayName("an expired registration dialog starts over instead of taking the phone as a name")
    void expiredSessionRestarts() {
        stateMachine.restart(currentUser(), false, clock.instant());
        send(text("Иван"));
        clock.advance(Duration.ofMinutes(31));

        BotReply reply = send(text("+79991234567"));

        assertThat(reply.messages()).containsExactly(BotMessages.WELCOME);
        assertThat(stored().getRegistrationState()).isEqualTo(RegistrationState.AWAITING_NAME);
        assertThat(sessions.peek(USER_ID).orElseThrow().getStep())
                .isEqualTo(ConversationStateMachine.STEP_STARTED);
    }

    @Test
    @DisplayName("/start after the name was accepted asks for the name again and resets the user record")
    void restartAfterNameResetsRegistrationState() {
        stateMachine.restart(currentUser(), false, clock.instant());
        send(text("Иван"));
        assertThat(stored().getRegistrationState()).isEqualTo(RegistrationState.AWAITING_PHONE);

        BotReply reply = stateMachine.restart(currentUser(), false, clock.instant());

        assertThat(reply.messages()).containsExactly(BotMessages.WELCOME);
        assertThat(stored().getRegistrationState()).isEqualTo(RegistrationState.AWAITING_NAME);
        assertThat(sessions.peek(USER_ID).orElseThrow().getStep()).isEqualTo(ConversationStateMachine.STEP_STARTED);
        assertThat(sessions.peek(USER_ID).orElseThrow().getScratch()).isEmpty();
    }

    @Test
    @DisplayName("registered users outside a dialog are left to the command router")
    void registeredUserWithoutDialog() {
        users.put(registeredUser());

        Optional<BotReply> reply = stateMachine.handle(currentUser(), text("привет"), clock.instant());

        assertThat(reply).isEmpty();
    }

    @Test
    @DisplayName("/start for a registered user shows the main menu")
    void restartForRegisteredUser() {
        users.put(registeredUser());

        BotReply reply = stateMachine.restart(currentUser(), true, clock.instant());

        assertThat(reply.messages()).containsExactly(BotMessages.MAIN_MENU);
        assertThat(reply.keyboard()).hasSize(4);
    }

    @Test
    @DisplayName("submits an application once the sport is entered")
    void submitsApplicationAfterSport() {
        users.put(registeredUser());
        given(lifecycleService.create(USER_ID, "fok-1", "Футбол")).willReturn(Application.builder()
                .id("abcdef123456")
                .facilityName("ФОК Северный")
                .sport("Футбол")
                .status(ApplicationStatus.PENDING)
                .build());

        BotReply ask = stateMachine.beginSubmission(currentUser(), "fok-1", null, clock.instant());
        assertThat(ask.messages()).containsExactly(BotMessages.ASK_SPORT);
        assertThat(sessions.peek(USER_ID).orElseThrow().getFlow()).isEqualTo(ConversationFlow.SUBMIT_APPLICATION);

        BotReply submitted = send(text("Футбол"));

        assertThat(submitted.messages())
                .containsExactly(BotMessages.APPLICATION_SUBMITTED.formatted("ФОК Северный", "Футбол", "123456"));
        assertThat(sessions.peek(USER_ID)).isEmpty();
    }

    @Test
    @DisplayName("commands typed during submission are not taken as a sport")
    void commandDuringSubmissionIsIgnored() {
        users.put(registeredUser());
        stateMachine.beginSubmission(currentUser(), "fok-1", null, clock.instant());

        Optional<BotReply> reply = stateMachine.handle(currentUser(), text("/my"), clock.instant());

        assertThat(reply).isEmpty();
        verifyNoInteractions(lifecycleService);
    }

    @Test
    @DisplayName("a final submission error closes the dialog while a retryable one keeps it")
    void submissionErrors() {
        users.put(registeredUser());
        given(lifecycleService.create(anyString(), anyString(), anyString()))
                .willThrow(new ServiceException(ErrorCode.STORAGE_UNAVAILABLE, "down"))
                .willThrow(new ServiceException(ErrorCode.NOT_FOUND, "gone"));
        stateMachine.beginSubmission(currentUser(), "fok-1", null, clock.instant());

        assertThatThrownBy(() -> send(text("Футбол"))).isInstanceOf(ServiceException.class);
        assertThat(sessions.peek(USER_ID)).isPresent();

        assertThatThrownBy(() -> send(text("Футбол"))).isInstanceOf(ServiceException.class);
        assertThat(sessions.peek(USER_ID)).isEmpty();
        verify(lifecycleService, times(2)).create(USER_ID, "fok-1", "Футбол");
    }

    @Test
    @DisplayName("blocked users cannot start a submission")
    void blockedUserCannotSubmit() {
        User blocked = registeredUser();
        blocked.setBlocked(true);
        users.put(blocked);

        assertThatThrownBy(() -> stateMachine.beginSubmission(currentUser(), "fok-1", "Футбол", clock.instant()))
                .isInstanceOf(ServiceException.class);
        verifyNoInteractions(lifecycleService);
    }

    private BotReply send(InboundEvent event) {
        return stateMachine.handle(currentUser(), event, clock.instant()).orElseThrow();
    }

    private User currentUser() {
        return accounts.resolve(USER_ID, "ivan", "Ivan");
    }

    private User stored() {
        return users.findById(USER_ID).orElseThrow();
    }

    private static User registeredUser() {
        return User.builder()
                .id(USER_ID)
                .firstName("Ivan")
                .displayName("Иван")
                .phone("+79991234567")
                .registrationState(RegistrationState.COMPLETED)
                .build();
    }

    private static InboundEvent text(String payload) {
        return event(InboundEventType.TEXT, payload);
    }

    private static InboundEvent event(InboundEventType type, String payload) {
        return InboundEvent.builder().userId(USER_ID).type(type).payload(payload).build();
    }
}
