package com.equipinspect.app.modules.inspection.domain;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import com.equipinspect.app.global.error.ValidationException;
import com.equipinspect.app.modules.catalog.domain.OptionCatalog;

/**
 * Date rules of an inspection. Every method takes "today" explicitly and keeps no state.
 */
public class InspectionDateValidator {

    private static final String FIELD_INSPECTION_DATE = "inspectionDate";

    private final OptionCatalog catalog;
    private final int warningWindowDays;
    private final int maxAgeDays;

    public InspectionDateValidator(OptionCatalog catalog, int warningWindowDays, int maxAgeDays) {
        this.catalog = Objects.requireNonNull(catalog, "catalog is required");
        if (warningWindowDays < 0) {
            throw new IllegalArgumentException("warningWindowDays must be >= 0");
        }
        if (maxAgeDays <= 0) {
            throw new IllegalArgumentException("maxAgeDays must be positive");
        }
        this.warningWindowDays = warningWindowDays;
        this.maxAgeDays = maxAgeDays;
    }

    public int getWarningWindowDays() {
        return warningWindowDays;
    }

    /**
     * Parses an ISO {@code yyyy-MM-dd} date typed by the user and validates it.
     */
    public LocalDate parseInspectionDate(String raw, LocalDate today) {
        if (raw == null || raw.isBlank()) {
            throw new ValidationException(ValidationException.INVALID_DATE, FIELD_INSPECTION_DATE, raw,
                    "Inspection date is required");
        }
        LocalDate date;
        try {
            date = LocalDate.parse(raw.trim());
        } catch (DateTimeParseException ex) {
            throw new ValidationException(ValidationException.INVALID_DATE, FIELD_INSPECTION_DATE, raw,
                    "Invalid date format, use YYYY-MM-DD");
        }
        validateInspectionDate(date, today);
        return date;
    }

    public void validateInspectionDate(LocalDate inspectionDate, LocalDate today) {
        Objects.requireNonNull(today, "today is required");
        if (inspectionDate == null) {
            throw new ValidationException(ValidationException.INVALID_DATE, FIELD_INSPECTION_DATE, null,
                    "Inspection date is required");
        }
        if (inspectionDate.isAfter(today)) {
            throw new ValidationException(ValidationException.INVALID_DATE, FIELD_INSPECTION_DATE, inspectionDate,
                    "Inspection date cannot be in the future");
        }
        if (inspectionDate.isBefore(today.minusDays(maxAgeDays))) {
            throw new ValidationException(ValidationException.INVALID_DATE, FIELD_INSPECTION_DATE, inspectionDate,
                    "Inspection date cannot be more than " + maxAgeDays + " days ago");
        }
    }

    public LocalDate computeNextInspection(LocalDate inspectionDate, String equipmentType) {
        Objects.requireNonNull(inspectionDate, "inspectionDate is required");
        try {
            return inspectionDate.plus(catalog.equipmentType(equipmentType).validityPeriod());
        } catch (IllegalArgumentException ex) {
            throw new ValidationException(ValidationException.UNKNOWN_OPTION, "equipmentType", equipmentType,
                    ex.getMessage());
        }
    }

    public InspectionStatus status(LocalDate today, LocalDate nextInspectionDate) {
        long daysLeft = daysUntilDue(today, nextInspectionDate);
        if (daysLeft < 0) {
            return InspectionStatus.OVERDUE;
        }
        if (daysLeft <= warningWindowDays) {
            return InspectionStatus.DUE_SOON;
        }
        return InspectionStatus.OK;
    }

    /**
     * Days from today until the due date; negative once overdue.
     */
    public long daysUntilDue(LocalDate today, LocalDate nextInspectionDate) {
        Objects.requireNonNull(today, "today is required");
        Objects.requireNonNull(nextInspectionDate, "nextInspectionDate is required");
        return ChronoUnit.DAYS.between(today, nextInspectionDate);
    }

    public void validateRange(LocalDate from, LocalDate to) {
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException(ValidationException.INVALID_RANGE, "inspectionDateFrom", from,
                    "Start date cannot be after end date");
        }
    }
}
