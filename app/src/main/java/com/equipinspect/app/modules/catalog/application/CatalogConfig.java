package com.equipinspect.app.modules.catalog.application;

import com.equipinspect.app.modules.catalog.domain.CatalogField;
import com.equipinspect.app.modules.catalog.domain.EquipmentType;
import com.equipinspect.app.modules.catalog.domain.OptionCatalog;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class CatalogConfig {

    private static final Logger log = LoggerFactory.getLogger(CatalogConfig.class);

    @Bean
    public OptionCatalog optionCatalog(CatalogProperties properties) {
        OptionCatalog.Builder builder = OptionCatalog.builder()
                .platforms(properties.getPlatforms())
                .modules(properties.getModules())
                .sectors(properties.getSectors())
                .options(CatalogField.DEFECT, properties.getDefects())
                .options(CatalogField.CAUSE, properties.getCauses())
                .options(CatalogField.RTI_CATEGORY, properties.getRtiCategories())
                .options(CatalogField.RECOMMENDATION, properties.getRecommendations())
                .options(CatalogField.DAMAGE_TYPE, properties.getDamageTypes());
        for (CatalogProperties.EquipmentTypeEntry entry : properties.getEquipmentTypes()) {
            builder.equipmentType(EquipmentType.ofDays(
                    entry.getName(),
                    entry.getTagPrefix(),
                    entry.getValidityDays(),
                    entry.getMaxSequence()
            ));
        }
        OptionCatalog catalog = builder.build();
        log.info("Option catalog loaded: {} platforms, {} equipment types",
                catalog.values(CatalogField.PLATFORM).size(),
                catalog.equipmentTypes().size());
        return catalog;
    }
}
