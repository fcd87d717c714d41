package com.example.bugservice.repository;

import com.example.bugservice.entity.Application;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface ApplicationRepository extends JpaRepository<Application, UUID> {

    /**
     * Case-insensitive exact name match. Oldest wins if several exist.
     */
    Optional<Application> findFirstByNameIgnoreCaseOrderByCreatedAtAsc(String name);

    Optional<Application> findFirstByUrlOrderByCreatedAtAsc(String url);

    /**
     * Link unowned applications whose URL contains the domain or whose name contains the company name.
     * Patterns are expected lower-cased and wrapped in %.
     */
    @Modifying
    @Query("UPDATE Application a SET a.companyId = :companyId " +
           "WHERE a.companyId IS NULL " +
           "AND (LOWER(a.url) LIKE :domainPattern OR LOWER(a.name) LIKE :namePattern)")
    int linkUnownedApplications(@Param("companyId") UUID companyId,
                                @Param("domainPattern") String domainPattern,
                                @Param("namePattern") String namePattern);
}
