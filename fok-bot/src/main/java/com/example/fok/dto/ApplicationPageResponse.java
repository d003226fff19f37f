package com.example.fok.dto;

import com.example.fok.domain.Application;
import java.util.List;

public record ApplicationPageResponse(List<Application> items, int page, int size, Long total) {
}
