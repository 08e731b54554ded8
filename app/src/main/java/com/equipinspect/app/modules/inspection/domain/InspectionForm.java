package com.equipinspect.app.modules.inspection.domain;

import java.time.LocalDate;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Everything a user enters for one inspection. TAG and due date are never part of it;
 * they are derived when the record is written. The sequence range and the date rules depend on
 * the option catalog and on today, so they are checked by the record service.
 */
public record InspectionForm(
        @NotBlank String platform,
        @NotBlank String module,
        @NotBlank String sector,
        @NotBlank String equipmentType,
        @NotNull Integer sequence,
        LocalDate inspectionDate,
        InspectionFindings findings,
        @Size(max = 4000) String notes
) {

    public InspectionForm {
        if (findings == null) {
            findings = InspectionFindings.NONE;
        }
    }
}
