package com.example.fok.persistence;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ApplicationStatusChangeJpaRepository extends JpaRepository<ApplicationStatusChangeEntity, Long> {

    List<ApplicationStatusChangeEntity> findByApplicationIdOrderByIdAsc(String applicationId);

    List<ApplicationStatusChangeEntity> findByApplicationIdInOrderByIdAsc(Collection<String> applicationIds);
}
