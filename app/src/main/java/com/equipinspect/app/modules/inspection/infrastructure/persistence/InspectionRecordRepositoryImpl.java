package com.equipinspect.app.modules.inspection.infrastructure.persistence;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.equipinspect.app.modules.inspection.domain.InspectionRecord;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

@Repository
public class InspectionRecordRepositoryImpl implements InspectionRecordRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<InspectionRecord> search(InspectionSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();
        whereClauses.add("r.deletedAt is null");

        if (StringUtils.hasText(condition.equipmentType())) {
            whereClauses.add("r.equipmentType = :equipmentType");
            params.put("equipmentType", condition.equipmentType());
        }
        if (StringUtils.hasText(condition.tag())) {
            whereClauses.add("r.tag = :tag");
            params.put("tag", condition.tag());
        }
        if (condition.inspectedFrom() != null) {
            whereClauses.add("r.inspectionDate >= :inspectedFrom");
            params.put("inspectedFrom", condition.inspectedFrom());
        }
        if (condition.inspectedTo() != null) {
            whereClauses.add("r.inspectionDate <= :inspectedTo");
            params.put("inspectedTo", condition.inspectedTo());
        }
        if (condition.nextDueFrom() != null) {
            whereClauses.add("r.nextInspectionDate >= :nextDueFrom");
            params.put("nextDueFrom", condition.nextDueFrom());
        }
        if (condition.nextDueTo() != null) {
            whereClauses.add("r.nextInspectionDate <= :nextDueTo");
            params.put("nextDueTo", condition.nextDueTo());
        }

        String direction = condition.descending() ? "desc" : "asc";
        String jpql = "select r from InspectionRecord r where " + String.join(" and ", whereClauses)
                + " order by r.nextInspectionDate " + direction + ", r.id " + direction;

        TypedQuery<InspectionRecord> query = entityManager.createQuery(jpql, InspectionRecord.class);
        params.forEach(query::setParameter);
        return query.getResultList();
    }
}
