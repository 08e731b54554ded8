package com.equipinspect.app.modules.inspection.application;

import java.time.LocalDate;
import java.time.OffsetDateTime;

import com.equipinspect.app.modules.inspection.domain.InspectionFindings;
import com.equipinspect.app.modules.inspection.domain.InspectionStatus;
import com.equipinspect.app.modules.inspection.domain.PhotoReference;

/**
 * Read model of a record with its status evaluated against the day it was loaded.
 */
public record InspectionSnapshot(
        Long id,
        String platform,
        String module,
        String sector,
        String equipmentType,
        int sequence,
        String tag,
        LocalDate inspectionDate,
        LocalDate nextInspectionDate,
        InspectionStatus status,
        long daysUntilDue,
        InspectionFindings findings,
        String notes,
        PhotoReference photo,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {

    public boolean hasPhoto() {
        return photo != null && photo.optimizedPath() != null;
    }
}
