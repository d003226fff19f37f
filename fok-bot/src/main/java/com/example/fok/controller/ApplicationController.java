package com.example.fok.controller;

import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatistics;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.domain.Capability;
import com.example.fok.dto.ApplicationPageResponse;
import com.example.fok.dto.CreateApplicationRequest;
import com.example.fok.dto.TransitionRequest;
import com.example.fok.service.AdminAuthorizationService;
import com.example.fok.service.ApplicationLifecycleService;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/applications")
public class ApplicationController {

    private static final String ACTOR_HEADER = "X-Actor-Id";

    private final ApplicationLifecycleService lifecycleService;
    private final AdminAuthorizationService authorizationService;

    public ApplicationController(
            ApplicationLifecycleService lifecycleService, AdminAuthorizationService authorizationService) {
        this.lifecycleService = lifecycleService;
        this.authorizationService = authorizationService;
    }

    @GetMapping("/stats")
    public ResponseEntity<ApplicationStatistics> statistics(@RequestHeader(ACTOR_HEADER) String actorId) {
        return ResponseEntity.ok(lifecycleService.statistics(actorId));
    }

    @GetMapping("/{applicationId}")
    public ResponseEntity<Application> getApplication(
            @PathVariable String applicationId, @RequestHeader(ACTOR_HEADER) String actorId) {
        return ResponseEntity.ok(lifecycleService.getVisibleTo(applicationId, actorId));
    }

    @GetMapping
    public ResponseEntity<ApplicationPageResponse> listApplications(
            @RequestHeader(ACTOR_HEADER) String actorId,
            @RequestParam(name = "userId", required = false) String userId,
            @RequestParam(name = "status", required = false) ApplicationStatus status,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "0") int size) {
        if (StringUtils.hasText(userId)) {
            if (!userId.equals(actorId)) {
                authorizationService.require(actorId, Capability.VIEW_ALL_APPLICATIONS);
            }
            List<Application> items = lifecycleService.listByUser(userId, status, page, size);
            return ResponseEntity.ok(new ApplicationPageResponse(
                    items, page, items.size(), lifecycleService.countByUser(userId, status)));
        }
        if (status == null) {
            throw new ServiceException(ErrorCode.BAD_REQUEST, "Either userId or status must be provided");
        }
        authorizationService.require(actorId, Capability.VIEW_ALL_APPLICATIONS);
        List<Application> items = lifecycleService.listByStatus(status, page, size);
        return ResponseEntity.ok(new ApplicationPageResponse(items, page, items.size(), null));
    }

    @PostMapping
    public ResponseEntity<Application> createApplication(
            @RequestHeader(ACTOR_HEADER) String actorId, @Valid @RequestBody CreateApplicationRequest request) {
        Application application = lifecycleService.create(actorId, request.getFacilityId(), request.getSport());
        return ResponseEntity.status(HttpStatus.CREATED).body(application);
    }

    @PostMapping("/{applicationId}/transition")
    public ResponseEntity<Application> transition(
            @PathVariable String applicationId,
            @RequestHeader(ACTOR_HEADER) String actorId,
            @Valid @RequestBody TransitionRequest request) {
        return ResponseEntity.ok(lifecycleService.transition(
                applicationId, request.getTarget(), actorId, request.getExpectedVersion()));
    }
}
