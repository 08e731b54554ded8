package com.equipinspect.app.modules.inspection.domain;

public enum HistoryAction {
    CREATED,
    UPDATED,
    PHOTO_ATTACHED,
    DELETED
}
