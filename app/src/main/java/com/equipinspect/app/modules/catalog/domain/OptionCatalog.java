package com.equipinspect.app.modules.catalog.domain;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Immutable set of allowed form values and the TAG rule built on them.
 * Built once at startup and passed to the components that validate input.
 * Unknown keys raise {@link IllegalArgumentException}; callers turn that into a validation failure.
 */
public final class OptionCatalog {

    private final Map<CatalogField, List<String>> options;
    private final Map<String, EquipmentType> equipmentTypes;

    private OptionCatalog(Map<CatalogField, List<String>> options, Map<String, EquipmentType> equipmentTypes) {
        this.options = options;
        this.equipmentTypes = equipmentTypes;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> values(CatalogField field) {
        Objects.requireNonNull(field, "field is required");
        if (field == CatalogField.EQUIPMENT_TYPE) {
            return List.copyOf(equipmentTypes.keySet());
        }
        return options.getOrDefault(field, List.of());
    }

    public boolean allows(CatalogField field, String value) {
        return value != null && values(field).contains(value);
    }

    public Collection<EquipmentType> equipmentTypes() {
        return equipmentTypes.values();
    }

    public EquipmentType equipmentType(String name) {
        EquipmentType type = name == null ? null : equipmentTypes.get(name);
        if (type == null) {
            throw new IllegalArgumentException("Unknown equipment type: " + name);
        }
        return type;
    }

    /**
     * Builds the TAG of one piece of equipment. Every component must belong to the catalog and
     * the sequence must fall inside the type's range.
     */
    public String tag(String platform, String module, String sector, String equipmentType, int sequence) {
        requireKnown(CatalogField.PLATFORM, platform);
        requireKnown(CatalogField.MODULE, module);
        requireKnown(CatalogField.SECTOR, sector);
        EquipmentType type = equipmentType(equipmentType);
        if (!type.acceptsSequence(sequence)) {
            throw new IllegalArgumentException("Sequence " + sequence + " outside 1.." + type.maxSequence()
                    + " for " + type.name());
        }
        return TagFormatter.format(platform, module, sector, type.tagPrefix(), sequence);
    }

    /**
     * Selectable equipment codes of a type, e.g. {@code VP-001 .. VP-050}.
     */
    public List<String> tagsFor(String equipmentType) {
        EquipmentType type = equipmentType(equipmentType);
        return IntStream.rangeClosed(1, type.maxSequence())
                .mapToObj(sequence -> TagFormatter.equipmentCode(type.tagPrefix(), sequence))
                .toList();
    }

    private void requireKnown(CatalogField field, String value) {
        if (!allows(field, value)) {
            throw new IllegalArgumentException("Unknown " + field.fieldName() + ": " + value);
        }
    }

    public static final class Builder {

        private final Map<CatalogField, List<String>> options = new EnumMap<>(CatalogField.class);
        private final List<EquipmentType> equipmentTypes = new ArrayList<>();

        private Builder() {
        }

        public Builder options(CatalogField field, Collection<String> values) {
            if (field == CatalogField.EQUIPMENT_TYPE) {
                throw new IllegalArgumentException("Equipment types are registered with equipmentType()");
            }
            options.put(field, values == null ? List.of() : List.copyOf(new LinkedHashSet<>(values)));
            return this;
        }

        public Builder platforms(Collection<String> values) {
            return options(CatalogField.PLATFORM, values);
        }

        public Builder modules(Collection<String> values) {
            return options(CatalogField.MODULE, values);
        }

        public Builder sectors(Collection<String> values) {
            return options(CatalogField.SECTOR, values);
        }

        public Builder equipmentType(EquipmentType type) {
            equipmentTypes.add(Objects.requireNonNull(type, "type is required"));
            return this;
        }

        public OptionCatalog build() {
            for (CatalogField field : List.of(CatalogField.PLATFORM, CatalogField.MODULE, CatalogField.SECTOR)) {
                if (options.getOrDefault(field, List.of()).isEmpty()) {
                    throw new IllegalStateException("Catalog needs at least one " + field.fieldName());
                }
            }
            if (equipmentTypes.isEmpty()) {
                throw new IllegalStateException("Catalog needs at least one equipment type");
            }
            options.forEach((field, values) -> values.forEach(value -> requireUsable(field, value)));

            Map<String, EquipmentType> byName = new LinkedHashMap<>();
            Set<String> prefixes = new HashSet<>();
            for (EquipmentType type : equipmentTypes) {
                requireUsable(CatalogField.EQUIPMENT_TYPE, type.name());
                requireUsable(CatalogField.EQUIPMENT_TYPE, type.tagPrefix());
                if (byName.putIfAbsent(type.name(), type) != null) {
                    throw new IllegalStateException("Duplicate equipment type: " + type.name());
                }
                if (!prefixes.add(type.tagPrefix())) {
                    throw new IllegalStateException("Duplicate tag prefix: " + type.tagPrefix());
                }
            }
            return new OptionCatalog(Collections.unmodifiableMap(new EnumMap<>(options)),
                    Collections.unmodifiableMap(byName));
        }

        private static void requireUsable(CatalogField field, String value) {
            if (value == null || value.isBlank()) {
                throw new IllegalStateException("Blank " + field.fieldName() + " in catalog");
            }
            if (value.indexOf(TagFormatter.SEPARATOR) >= 0) {
                throw new IllegalStateException("Catalog " + field.fieldName() + " '" + value
                        + "' must not contain '" + TagFormatter.SEPARATOR + "'");
            }
        }
    }
}
