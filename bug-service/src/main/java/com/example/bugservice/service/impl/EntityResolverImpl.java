package com.example.bugservice.service.impl;

import com.example.bugservice.entity.Application;
import com.example.bugservice.entity.Company;
import com.example.bugservice.repository.ApplicationRepository;
import com.example.bugservice.repository.CompanyRepository;
import com.example.bugservice.service.EntityResolver;
import com.example.bugservice.util.DomainNames;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(propagation = Propagation.MANDATORY)
public class EntityResolverImpl implements EntityResolver {

    private final ApplicationRepository applicationRepository;
    private final CompanyRepository companyRepository;

    @Override
    public Application resolveApplication(String name, String url) {
        String appUrl = hasText(url) ? url : null;

        Optional<Application> existing = applicationRepository.findFirstByNameIgnoreCaseOrderByCreatedAtAsc(name);
        if (existing.isEmpty() && appUrl != null) {
            existing = applicationRepository.findFirstByUrlOrderByCreatedAtAsc(appUrl);
        }

        Application application = existing.orElseGet(() -> {
            Application created = applicationRepository.save(Application.builder()
                    .name(name)
                    .url(appUrl)
                    .build());
            log.info("Application created: applicationId={}, name={}", created.getId(), name);
            return created;
        });

        if (application.getCompanyId() == null) {
            Company company = resolveCompany(name, appUrl);
            application.setCompanyId(company.getId());
            applicationRepository.save(application);
            log.info("Application linked to company: applicationId={}, companyId={}",
                    application.getId(), company.getId());
        }

        return application;
    }

    @Override
    public Company resolveCompany(String appName, String appUrl) {
        boolean fromUrl = hasText(appUrl);
        String domain = DomainNames.deriveDomain(fromUrl ? appUrl : appName);

        return companyRepository.findByDomain(domain).orElseGet(() -> {
            String companyName = fromUrl ? DomainNames.companyNameFromUrl(appUrl) : appName;
            Company created = companyRepository.save(Company.builder()
                    .name(companyName)
                    .domain(domain)
                    .verified(false)
                    .build());
            log.info("Company created: companyId={}, domain={}", created.getId(), domain);
            return created;
        });
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
