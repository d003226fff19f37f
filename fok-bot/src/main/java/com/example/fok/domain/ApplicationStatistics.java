package com.example.fok.domain;

import java.util.Map;

/**
 * Point-in-time counts for the staff overview. Every status is present in {@code byStatus}, zero included.
 */
public record ApplicationStatistics(long users, long applications, Map<ApplicationStatus, Long> byStatus) {
}
