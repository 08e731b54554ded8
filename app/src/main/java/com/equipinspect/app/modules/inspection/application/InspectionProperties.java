package com.equipinspect.app.modules.inspection.application;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Date rules bound from {@code app.inspection}.
 */
@ConfigurationProperties(prefix = "app.inspection")
public class InspectionProperties {

    /**
     * Days before the due date during which a record is reported as DUE_SOON (inclusive).
     */
    private int warningWindowDays = 30;

    /**
     * Oldest accepted inspection date, in days before today.
     */
    private int maxAgeDays = 3650;

    public int getWarningWindowDays() {
        return warningWindowDays;
    }

    public void setWarningWindowDays(int warningWindowDays) {
        this.warningWindowDays = warningWindowDays;
    }

    public int getMaxAgeDays() {
        return maxAgeDays;
    }

    public void setMaxAgeDays(int maxAgeDays) {
        this.maxAgeDays = maxAgeDays;
    }
}
