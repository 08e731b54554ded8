package com.equipinspect.app.modules.inspection.infrastructure.persistence;

import java.util.List;

import com.equipinspect.app.modules.inspection.domain.InspectionRecord;

public interface InspectionRecordRepositoryCustom {

    List<InspectionRecord> search(InspectionSearchCondition condition);
}
