package com.example.fok.service;

import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.domain.Capability;
import com.example.fok.domain.UserRole;
import com.example.fok.service.exception.ErrorCode;
import com.example.fok.service.exception.ServiceException;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Decides whether an actor may move an application along an edge of the status graph. Staff may take every edge;
 * owners may only withdraw a pending application.
 */
@Component
public class TransitionPolicy {

    private record Edge(ApplicationStatus from, ApplicationStatus to) {
    }

    private static final Set<Edge> OWNER_EDGES = Set.of(new Edge(ApplicationStatus.PENDING, ApplicationStatus.CANCELLED));

    public void check(Application application, ApplicationStatus target, String actorId, UserRole actorRole) {
        ApplicationStatus current = application.getStatus();
        if (!current.canTransitionTo(target)) {
            throw new ServiceException(
                    ErrorCode.INVALID_TRANSITION,
                    "Cannot move application from %s to %s".formatted(current, target));
        }
        if (Capability.TRANSITION_APPLICATIONS.isGrantedTo(actorRole)) {
            return;
        }
        boolean owner = application.getUserId().equals(actorId);
        if (owner && OWNER_EDGES.contains(new Edge(current, target))) {
            return;
        }
        throw new ServiceException(ErrorCode.FORBIDDEN, "Actor is not allowed to perform this transition");
    }
}
