package com.equipinspect.app.modules.inspection.infrastructure.persistence;

import java.util.List;
import java.util.Optional;

import com.equipinspect.app.modules.inspection.domain.InspectionHistory;

import org.springframework.data.jpa.repository.JpaRepository;

public interface InspectionHistoryRepository extends JpaRepository<InspectionHistory, Long> {

    List<InspectionHistory> findByRecordIdOrderByChangedAtAscIdAsc(Long recordId);

    Optional<InspectionHistory> findTopByRecordIdOrderByChangedAtDescIdDesc(Long recordId);
}
