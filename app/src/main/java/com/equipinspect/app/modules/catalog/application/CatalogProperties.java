package com.equipinspect.app.modules.catalog.application;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Option catalog values bound from {@code app.catalog}.
 * <pre>
 * app:
 *   catalog:
 *     platforms: [P-1, P-2]
 *     equipment-types:
 *       - name: Tanque
 *         tag-prefix: TQ
 *         validity-days: 360
 *         max-sequence: 40
 * </pre>
 * Values are checked when the {@code OptionCatalog} is built, not here.
 */
@ConfigurationProperties(prefix = "app.catalog")
public class CatalogProperties {

    private List<String> platforms = new ArrayList<>();
    private List<String> modules = new ArrayList<>();
    private List<String> sectors = new ArrayList<>();
    private List<EquipmentTypeEntry> equipmentTypes = new ArrayList<>();
    private List<String> defects = new ArrayList<>();
    private List<String> causes = new ArrayList<>();
    private List<String> rtiCategories = new ArrayList<>();
    private List<String> recommendations = new ArrayList<>();
    private List<String> damageTypes = new ArrayList<>();

    public List<String> getPlatforms() {
        return platforms;
    }

    public void setPlatforms(List<String> platforms) {
        this.platforms = platforms;
    }

    public List<String> getModules() {
        return modules;
    }

    public void setModules(List<String> modules) {
        this.modules = modules;
    }

    public List<String> getSectors() {
        return sectors;
    }

    public void setSectors(List<String> sectors) {
        this.sectors = sectors;
    }

    public List<EquipmentTypeEntry> getEquipmentTypes() {
        return equipmentTypes;
    }

    public void setEquipmentTypes(List<EquipmentTypeEntry> equipmentTypes) {
        this.equipmentTypes = equipmentTypes;
    }

    public List<String> getDefects() {
        return defects;
    }

    public void setDefects(List<String> defects) {
        this.defects = defects;
    }

    public List<String> getCauses() {
        return causes;
    }

    public void setCauses(List<String> causes) {
        this.causes = causes;
    }

    public List<String> getRtiCategories() {
        return rtiCategories;
    }

    public void setRtiCategories(List<String> rtiCategories) {
        this.rtiCategories = rtiCategories;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    public void setRecommendations(List<String> recommendations) {
        this.recommendations = recommendations;
    }

    public List<String> getDamageTypes() {
        return damageTypes;
    }

    public void setDamageTypes(List<String> damageTypes) {
        this.damageTypes = damageTypes;
    }

    public static class EquipmentTypeEntry {

        private String name;
        private String tagPrefix;
        private int validityDays = 360;
        private int maxSequence = 999;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTagPrefix() {
            return tagPrefix;
        }

        public void setTagPrefix(String tagPrefix) {
            this.tagPrefix = tagPrefix;
        }

        public int getValidityDays() {
            return validityDays;
        }

        public void setValidityDays(int validityDays) {
            this.validityDays = validityDays;
        }

        public int getMaxSequence() {
            return maxSequence;
        }

        public void setMaxSequence(int maxSequence) {
            this.maxSequence = maxSequence;
        }
    }
}
