package com.example.fok.persistence;

import com.example.fok.domain.UserRole;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface UserJpaRepository extends JpaRepository<UserEntity, String> {

    List<UserEntity> findByRoleIn(Collection<UserRole> roles);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update UserEntity u set u.totalApplications = u.totalApplications + 1, u.version = u.version + 1 "
            + "where u.id = :userId")
    int incrementTotalApplications(@Param("userId") String userId);
}
