package com.equipinspect.app.modules.catalog.domain;

/**
 * Form fields whose values are restricted to an enumerated set.
 */
public enum CatalogField {
    PLATFORM("platform"),
    MODULE("module"),
    SECTOR("sector"),
    EQUIPMENT_TYPE("equipmentType"),
    DEFECT("defect"),
    CAUSE("cause"),
    RTI_CATEGORY("rtiCategory"),
    RECOMMENDATION("recommendation"),
    DAMAGE_TYPE("damageType");

    private final String fieldName;

    CatalogField(String fieldName) {
        this.fieldName = fieldName;
    }

    public String fieldName() {
        return fieldName;
    }
}
