package com.example.fok.persistence;

import com.example.fok.domain.Facility;
import com.example.fok.service.FacilityCatalog;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Repository
@RequiredArgsConstructor
public class JpaFacilityCatalog implements FacilityCatalog {

    private final FacilityJpaRepository facilityJpaRepository;
    private final ApplicationEntityMapper mapper;

    @Override
    @Transactional(readOnly = true)
    public Optional<Facility> findById(String facilityId) {
        if (!StringUtils.hasText(facilityId)) {
            return Optional.empty();
        }
        return facilityJpaRepository.findById(facilityId).map(mapper::toDomain);
    }
}
