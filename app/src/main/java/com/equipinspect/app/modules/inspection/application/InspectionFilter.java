package com.equipinspect.app.modules.inspection.application;

import java.time.LocalDate;

import com.equipinspect.app.modules.inspection.domain.InspectionStatus;

/**
 * Listing criteria. Null fields are not applied; the inspection-date range is inclusive.
 */
public record InspectionFilter(
        InspectionStatus status,
        String equipmentType,
        String tag,
        LocalDate inspectedFrom,
        LocalDate inspectedTo,
        boolean descending
) {

    public static InspectionFilter all() {
        return new InspectionFilter(null, null, null, null, null, false);
    }

    public static InspectionFilter byStatus(InspectionStatus status) {
        return new InspectionFilter(status, null, null, null, null, false);
    }

    public InspectionFilter withEquipmentType(String value) {
        return new InspectionFilter(status, value, tag, inspectedFrom, inspectedTo, descending);
    }

    public InspectionFilter withTag(String value) {
        return new InspectionFilter(status, equipmentType, value, inspectedFrom, inspectedTo, descending);
    }

    public InspectionFilter inspectedBetween(LocalDate from, LocalDate to) {
        return new InspectionFilter(status, equipmentType, tag, from, to, descending);
    }

    public InspectionFilter newestDueFirst() {
        return new InspectionFilter(status, equipmentType, tag, inspectedFrom, inspectedTo, true);
    }
}
