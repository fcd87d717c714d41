package com.example.bugservice.repository;

import com.example.bugservice.entity.Company;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompanyRepository extends JpaRepository<Company, UUID> {

    Optional<Company> findByDomain(String domain);

    Optional<Company> findByIdAndVerificationToken(UUID id, String verificationToken);

    /**
     * Find companies by filters. searchPattern is lower-cased and wrapped in %.
     */
    @Query("SELECT c FROM Company c WHERE " +
           "(:verified IS NULL OR c.verified = :verified) AND " +
           "(:searchPattern IS NULL OR LOWER(c.name) LIKE :searchPattern OR LOWER(c.domain) LIKE :searchPattern)")
    Page<Company> findByFilters(@Param("verified") Boolean verified,
                                @Param("searchPattern") String searchPattern,
                                Pageable pageable);
}
