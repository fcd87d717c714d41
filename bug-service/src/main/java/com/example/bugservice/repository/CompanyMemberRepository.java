package com.example.bugservice.repository;

import com.example.bugservice.entity.CompanyMember;
import com.example.bugservice.entity.CompanyRole;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CompanyMemberRepository extends JpaRepository<CompanyMember, UUID> {

    boolean existsByCompanyIdAndUserId(UUID companyId, UUID userId);

    Optional<CompanyMember> findByCompanyIdAndUserId(UUID companyId, UUID userId);

    long countByCompanyIdAndRole(UUID companyId, CompanyRole role);
}
