package com.example.bugservice.repository;

import com.example.bugservice.entity.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for AuditLog entity. Append and read only.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, UUID> {

    @Query("SELECT a FROM AuditLog a WHERE " +
           "(:action IS NULL OR a.action = :action) AND " +
           "(:resource IS NULL OR a.resource = :resource) AND " +
           "(:userId IS NULL OR a.userId = :userId) " +
           "ORDER BY a.createdAt DESC")
    Page<AuditLog> findByFilters(@Param("action") String action,
                                 @Param("resource") String resource,
                                 @Param("userId") UUID userId,
                                 Pageable pageable);

    List<AuditLog> findByResourceIdOrderByCreatedAtDesc(UUID resourceId);
}
