package com.equipinspect.app.modules.report.domain;

public enum ReportKind {
    SINGLE,
    BATCH,
    SUMMARY
}
