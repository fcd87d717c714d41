package com.example.bugservice.service;

import com.example.bugservice.entity.CompanyMember;
import com.example.bugservice.repository.CompanyMemberRepository;
import com.example.bugservice.security.CurrentUser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Company-scoped permission checks.
 */
@Component
@RequiredArgsConstructor
public class CompanyAccessPolicy {

    private final CompanyMemberRepository memberRepository;

    /**
     * Platform admins, or members (any role) of the given company. A null company admits admins only.
     */
    public boolean canActForCompany(CurrentUser actor, UUID companyId) {
        if (actor.isAdmin()) {
            return true;
        }
        return companyId != null && memberRepository.existsByCompanyIdAndUserId(companyId, actor.getUserId());
    }

    public boolean isCompanyAdmin(UUID userId, UUID companyId) {
        return memberRepository.findByCompanyIdAndUserId(companyId, userId)
                .map(CompanyMember::isAdmin)
                .orElse(false);
    }
}
