package com.equipinspect.app.modules.catalog.domain;

import java.time.Period;
import java.util.Objects;

/**
 * An inspectable equipment category.
 *
 * @param name           display name, also the stored value
 * @param tagPrefix      short code used in the TAG, unique across types
 * @param validityPeriod time after an inspection until the next one is due
 * @param maxSequence    highest equipment number of this type
 */
public record EquipmentType(String name, String tagPrefix, Period validityPeriod, int maxSequence) {

    public EquipmentType {
        Objects.requireNonNull(name, "name is required");
        Objects.requireNonNull(tagPrefix, "tagPrefix is required");
        Objects.requireNonNull(validityPeriod, "validityPeriod is required");
        if (name.isBlank() || tagPrefix.isBlank()) {
            throw new IllegalArgumentException("Equipment type name and tag prefix must not be blank");
        }
        if (validityPeriod.isNegative() || validityPeriod.isZero()) {
            throw new IllegalArgumentException("Validity period of " + name + " must be positive");
        }
        if (maxSequence <= 0) {
            throw new IllegalArgumentException("maxSequence of " + name + " must be positive");
        }
    }

    public static EquipmentType ofDays(String name, String tagPrefix, int validityDays, int maxSequence) {
        return new EquipmentType(name, tagPrefix, Period.ofDays(validityDays), maxSequence);
    }

    public boolean acceptsSequence(int sequence) {
        return sequence >= 1 && sequence <= maxSequence;
    }
}
