package com.example.fok.service;

import com.example.fok.domain.Facility;
import java.util.Optional;

public interface FacilityCatalog {

    Optional<Facility> findById(String facilityId);
}
