package com.equipinspect.app.modules.inspection.application;

import com.equipinspect.app.modules.catalog.domain.OptionCatalog;
import com.equipinspect.app.modules.inspection.domain.InspectionDateValidator;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class InspectionConfig {

    @Bean
    public InspectionDateValidator inspectionDateValidator(OptionCatalog optionCatalog, InspectionProperties properties) {
        return new InspectionDateValidator(optionCatalog, properties.getWarningWindowDays(), properties.getMaxAgeDays());
    }
}
