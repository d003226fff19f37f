package com.example.fok.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateApplicationRequest {

    @NotBlank
    @Size(max = 64)
    private String facilityId;

    @NotBlank
    @Size(max = 128)
    private String sport;
}
