package com.equipinspect.app.modules.inspection.infrastructure.persistence;

import java.util.Optional;

import com.equipinspect.app.modules.inspection.domain.InspectionRecord;

import org.springframework.data.jpa.repository.JpaRepository;

public interface InspectionRecordRepository
        extends JpaRepository<InspectionRecord, Long>, InspectionRecordRepositoryCustom {

    Optional<InspectionRecord> findByIdAndDeletedAtIsNull(Long id);
}
