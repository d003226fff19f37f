package com.example.fok.domain;

import java.io.Serializable;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StatusChange implements Serializable {

    private ApplicationStatus status;
    private String actor;
    private Instant changedAt;
}
