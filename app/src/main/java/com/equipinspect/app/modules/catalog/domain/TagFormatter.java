package com.equipinspect.app.modules.catalog.domain;

/**
 * TAG text rule: {@code platform/module/sector/PREFIX-NNN}.
 * The separator is barred from catalog values, so distinct inputs never share a TAG.
 */
public final class TagFormatter {

    public static final char SEPARATOR = '/';

    private TagFormatter() {
    }

    public static String format(String platform, String module, String sector, String tagPrefix, int sequence) {
        return platform + SEPARATOR + module + SEPARATOR + sector + SEPARATOR + equipmentCode(tagPrefix, sequence);
    }

    public static String equipmentCode(String tagPrefix, int sequence) {
        return tagPrefix + "-" + formatSequence(sequence);
    }

    public static String formatSequence(int sequence) {
        if (sequence <= 0) {
            throw new IllegalArgumentException("sequence must be positive");
        }
        return String.format("%03d", sequence);
    }
}
