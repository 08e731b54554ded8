package com.equipinspect.app.modules.inspection.domain;

public enum InspectionStatus {
    OK,
    DUE_SOON,
    OVERDUE
}
