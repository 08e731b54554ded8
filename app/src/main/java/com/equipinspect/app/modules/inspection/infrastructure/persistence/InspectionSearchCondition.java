package com.equipinspect.app.modules.inspection.infrastructure.persistence;

import java.time.LocalDate;

/**
 * Storage-level filter; every bound is inclusive and null means unbounded.
 * Soft-deleted records never match.
 */
public record InspectionSearchCondition(
        String equipmentType,
        String tag,
        LocalDate inspectedFrom,
        LocalDate inspectedTo,
        LocalDate nextDueFrom,
        LocalDate nextDueTo,
        boolean descending
) {
}
