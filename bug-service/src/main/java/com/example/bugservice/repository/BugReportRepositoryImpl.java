package com.example.bugservice.repository;

import com.example.bugservice.entity.BugReport;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * JPQL-built listing query. Only portable constructs are used so the same
 * statement runs on PostgreSQL and on H2 in PostgreSQL mode.
 */
@Repository
@Slf4j
public class BugReportRepositoryImpl implements BugReportRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public Page<BugReport> search(BugSearchCriteria criteria) {
        Map<String, Object> params = new HashMap<>();
        String where = buildWhereClause(criteria, params);

        TypedQuery<Long> countQuery = entityManager.createQuery(
                "SELECT COUNT(b) FROM BugReport b" + where, Long.class);
        params.forEach(countQuery::setParameter);
        long total = countQuery.getSingleResult();

        TypedQuery<BugReport> query = entityManager.createQuery(
                "SELECT b FROM BugReport b" + where + " ORDER BY " + criteria.sort().getOrderBy(),
                BugReport.class);
        params.forEach(query::setParameter);
        query.setFirstResult((criteria.page() - 1) * criteria.limit());
        query.setMaxResults(criteria.limit());

        List<BugReport> bugs = query.getResultList();
        log.debug("Bug search matched {} rows (page={}, limit={})", total, criteria.page(), criteria.limit());

        return new PageImpl<>(bugs, PageRequest.of(criteria.page() - 1, criteria.limit()), total);
    }

    private String buildWhereClause(BugSearchCriteria criteria, Map<String, Object> params) {
        StringBuilder where = new StringBuilder(" WHERE b.deletedAt IS NULL");

        if (criteria.status() != null) {
            where.append(" AND b.status = :status");
            params.put("status", criteria.status());
        }
        if (criteria.priority() != null) {
            where.append(" AND b.priority = :priority");
            params.put("priority", criteria.priority());
        }
        if (criteria.tags() != null) {
            for (int i = 0; i < criteria.tags().size(); i++) {
                String name = "tag" + i;
                where.append(" AND :").append(name).append(" MEMBER OF b.tags");
                params.put(name, criteria.tags().get(i));
            }
        }
        if (criteria.application() != null) {
            where.append(" AND b.applicationId IN (SELECT a.id FROM Application a WHERE LOWER(a.name) LIKE :application)");
            params.put("application", likePattern(criteria.application()));
        }
        if (criteria.company() != null) {
            where.append(" AND b.assignedCompanyId IN (SELECT c.id FROM Company c WHERE LOWER(c.name) LIKE :company)");
            params.put("company", likePattern(criteria.company()));
        }
        if (criteria.search() != null) {
            where.append(" AND (LOWER(b.title) LIKE :search OR LOWER(b.description) LIKE :search")
                 .append(" OR b.applicationId IN (SELECT sa.id FROM Application sa WHERE LOWER(sa.name) LIKE :search))");
            params.put("search", likePattern(criteria.search()));
        }
        if (criteria.createdAfter() != null) {
            where.append(" AND b.createdAt > :createdAfter");
            params.put("createdAfter", criteria.createdAfter());
        }
        return where.toString();
    }

    private static String likePattern(String value) {
        return "%" + value.toLowerCase(Locale.ROOT) + "%";
    }
}
