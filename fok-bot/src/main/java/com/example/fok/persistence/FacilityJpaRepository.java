package com.example.fok.persistence;

import org.springframework.data.jpa.repository.JpaRepository;

public interface FacilityJpaRepository extends JpaRepository<FacilityEntity, String> {
}
