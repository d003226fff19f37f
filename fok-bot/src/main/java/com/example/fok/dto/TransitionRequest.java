package com.example.fok.dto;

import com.example.fok.domain.ApplicationStatus;
import jakarta.validation.constraints.NotNull;
import lombok.Data;

@Data
public class TransitionRequest {

    @NotNull
    private ApplicationStatus target;

    /**
     * Version the caller last saw. When present, any concurrent change fails the request with a conflict.
     */
    private Long expectedVersion;
}
