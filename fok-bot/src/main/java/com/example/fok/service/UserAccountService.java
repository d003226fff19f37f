package com.example.fok.service;

import com.example.fok.domain.RegistrationState;
import com.example.fok.domain.User;
import com.example.fok.domain.UserRole;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

@Slf4j
@Service
@RequiredArgsConstructor
public class UserAccountService {

    private final UserRepository userRepository;
    private final Clock clock;

    public Optional<User> find(String userId) {
        return StorageCalls.call(() -> userRepository.findById(userId));
    }

    public List<User> findByRoles(Collection<UserRole> roles) {
        return StorageCalls.call(() -> userRepository.findByRoles(roles));
    }

    public User require(String userId) {
        return find(userId).orElseThrow(() -> new ServiceException(ErrorCode.NOT_FOUND, "User not found"));
    }

    /**
     * Loads the user behind an inbound event, creating the record on first contact and refreshing the profile
     * fields the messenger reports.
     */
    public User resolve(String userId, String username, String firstName) {
        if (!StringUtils.hasText(userId)) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "User id is required");
        }
        Instant now = clock.instant();
        Optional<User> existing = find(userId);
        if (existing.isEmpty()) {
            return register(userId, username, firstName, now);
        }
        User user = existing.get();
        if (StringUtils.hasText(username)) {
            user.setUsername(username);
        }
        if (StringUtils.hasText(firstName)) {
            user.setFirstName(firstName);
        }
        user.setLastActivityAt(now);
        try {
            return save(user);
        } catch (ServiceException ex) {
            if (ex.getCode() != ErrorCode.CONFLICT) {
                throw ex;
            }
            log.debug("Concurrent update of user {} while recording activity", userId);
            return require(userId);
        }
    }

    public long countUsers() {
        return StorageCalls.call(userRepository::count);
    }

    public User save(User user) {
        return StorageCalls.call(() -> userRepository.save(user));
    }

    private User register(String userId, String username, String firstName, Instant now) {
        User user = User.builder()
                .id(userId)
                .username(username)
                .firstName(firstName)
                .registrationState(RegistrationState.STARTED)
                .createdAt(now)
                .lastActivityAt(now)
                .build();
        try {
            User created = save(user);
            log.info("Created user {} on first contact", userId);
            return created;
        } catch (DataIntegrityViolationException duplicate) {
            log.debug("User {} was created concurrently", userId);
            return require(userId);
        }
    }
}
