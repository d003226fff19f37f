package com.example.fok.persistence;

import com.example.fok.domain.User;
import com.example.fok.domain.UserRole;
import com.example.fok.service.UserRepository;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.CollectionUtils;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaUserRepository implements UserRepository {

    private final UserJpaRepository userJpaRepository;
    private final UserEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<User> findById(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Optional.empty();
        }
        return userJpaRepository.findById(userId).map(mapper::toDomain);
    }

    @Override
    @Transactional
    public User save(User user) {
        UserEntity saved = userJpaRepository.saveAndFlush(mapper.toEntity(user));
        user.setVersion(saved.getVersion());
        return mapper.toDomain(saved);
    }

    @Override
    @Transactional(readOnly = true)
    public List<User> findByRoles(Collection<UserRole> roles) {
        if (CollectionUtils.isEmpty(roles)) {
            return List.of();
        }
        return userJpaRepository.findByRoleIn(roles).stream().map(mapper::toDomain).toList();
    }

    @Override
    @Transactional(readOnly = true)
    public long count() {
        return userJpaRepository.count();
    }
}
