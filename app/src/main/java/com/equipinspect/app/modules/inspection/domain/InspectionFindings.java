package com.equipinspect.app.modules.inspection.domain;

/**
 * Optional findings of an inspection. Each non-null value must come from the option catalog.
 */
public record InspectionFindings(
        String defect,
        String cause,
        String rtiCategory,
        String recommendation,
        String damageType
) {

    public static final InspectionFindings NONE = new InspectionFindings(null, null, null, null, null);
}
