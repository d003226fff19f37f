package com.example.fok.service;

import com.example.fok.domain.User;
import com.example.fok.domain.UserRole;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface UserRepository {

    Optional<User> findById(String userId);

    /**
     * Inserts or updates the user. Updates are checked against {@link User#getVersion()}; inserting an id that
     * already exists raises {@link org.springframework.dao.DataIntegrityViolationException}.
     */
    User save(User user);

    List<User> findByRoles(Collection<UserRole> roles);

    long count();
}
