package com.equipinspect.app.global.config;

import com.equipinspect.app.modules.catalog.application.CatalogProperties;
import com.equipinspect.app.modules.inspection.application.InspectionProperties;
import com.equipinspect.app.modules.photo.application.PhotoProperties;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({
        StorageProperties.class,
        CatalogProperties.class,
        InspectionProperties.class,
        PhotoProperties.class
})
public class PropertiesConfig {
}
