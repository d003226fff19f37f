package com.example.fok.persistence;

import com.example.fok.domain.Application;
import com.example.fok.domain.ApplicationStatus;
import com.example.fok.domain.Facility;
import com.example.fok.domain.StatusChange;
import java.util.ArrayList;
import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class ApplicationEntityMapper {

    public ApplicationEntity toEntity(Application application) {
        ApplicationEntity entity = new ApplicationEntity();
        entity.setId(application.getId());
        entity.setUserId(application.getUserId());
        entity.setFacilityId(application.getFacilityId());
        entity.setFacilityName(application.getFacilityName());
        entity.setSport(application.getSport());
        entity.setStatus(application.getStatus());
        entity.setPendingKey(application.pendingKey());
        entity.setCreatedAt(application.getCreatedAt());
        entity.setUpdatedAt(application.getUpdatedAt());
        entity.setProcessedBy(application.getProcessedBy());
        entity.setCompletedAt(application.getCompletedAt());
        entity.setCancelledAt(application.getCancelledAt());
        return entity;
    }

    public Application toDomain(ApplicationEntity entity, List<ApplicationStatusChangeEntity> history) {
        if (entity == null) {
            return null;
        }
        List<StatusChange> changes = history == null
                ? new ArrayList<>()
                : new ArrayList<>(history.stream().map(this::toDomain).toList());
        return Application.builder()
                .id(entity.getId())
                .userId(entity.getUserId())
                .facilityId(entity.getFacilityId())
                .facilityName(entity.getFacilityName())
                .sport(entity.getSport())
                .status(entity.getStatus() != null ? entity.getStatus() : ApplicationStatus.PENDING)
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .processedBy(entity.getProcessedBy())
                .completedAt(entity.getCompletedAt())
                .cancelledAt(entity.getCancelledAt())
                .version(entity.getVersion() != null ? entity.getVersion() : 0L)
                .statusHistory(changes)
                .build();
    }

    public ApplicationStatusChangeEntity toEntity(String applicationId, StatusChange change) {
        ApplicationStatusChangeEntity entity = new ApplicationStatusChangeEntity();
        entity.setApplicationId(applicationId);
        entity.setStatus(change.getStatus());
        entity.setActor(change.getActor());
        entity.setChangedAt(change.getChangedAt());
        return entity;
    }

    public StatusChange toDomain(ApplicationStatusChangeEntity entity) {
        return StatusChange.builder()
                .status(entity.getStatus())
                .actor(entity.getActor())
                .changedAt(entity.getChangedAt())
                .build();
    }

    public Facility toDomain(FacilityEntity entity) {
        return Facility.builder()
                .id(entity.getId())
                .name(entity.getName())
                .district(entity.getDistrict())
                .address(entity.getAddress())
                .active(entity.isActive())
                .build();
    }
}
