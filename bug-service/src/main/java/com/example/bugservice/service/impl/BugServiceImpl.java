package com.example.bugservice.service.impl;

import com.example.bugservice.cache.BugCache;
import com.example.bugservice.cache.BugCacheKeys;
import com.example.bugservice.dto.request.BugListQuery;
import com.example.bugservice.dto.request.CreateBugRequest;
import com.example.bugservice.dto.response.BugListResponse;
import com.example.bugservice.dto.response.BugResponse;
import com.example.bugservice.dto.response.PaginationResponse;
import com.example.bugservice.entity.Application;
import com.example.bugservice.entity.BugPriority;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.BugStatus;
import com.example.bugservice.event.BugChangedEvent;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.exception.ResourceNotFoundException;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.repository.BugSearchCriteria;
import com.example.bugservice.repository.BugSortOrder;
import com.example.bugservice.service.BugResponseAssembler;
import com.example.bugservice.service.BugService;
import com.example.bugservice.service.EntityResolver;
import com.example.bugservice.util.InputSanitizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Implementation of BugService.
 * Reads go through the cache; writes only publish an eviction event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class BugServiceImpl implements BugService {

    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;
    private static final Duration TRENDING_WINDOW = Duration.ofDays(30);

    private final BugReportRepository bugReportRepository;
    private final EntityResolver entityResolver;
    private final BugResponseAssembler assembler;
    private final BugCache bugCache;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public BugResponse createBug(CreateBugRequest request, UUID reporterId) {
        String title = InputSanitizer.validateString(request.getTitle(), 5, 255)
                .orElseThrow(BadRequestException::invalidTitle);
        String description = InputSanitizer.validateString(request.getDescription(), 10, 5000)
                .orElseThrow(BadRequestException::invalidDescription);
        String applicationName = InputSanitizer.validateString(request.getApplicationName(), 1, 255)
                .orElseThrow(BadRequestException::invalidApplicationName);

        String applicationUrl = null;
        if (hasText(request.getApplicationUrl())) {
            applicationUrl = InputSanitizer.validateUrl(request.getApplicationUrl())
                    .orElseThrow(BadRequestException::invalidApplicationUrl);
        }
        if (hasText(request.getContactEmail()) && InputSanitizer.validateEmail(request.getContactEmail()).isEmpty()) {
            throw BadRequestException.invalidContactEmail();
        }

        BugPriority priority = BugPriority.MEDIUM;
        if (hasText(request.getPriority())) {
            priority = BugPriority.fromValue(request.getPriority())
                    .orElseThrow(() -> BadRequestException.invalidPriority(request.getPriority()));
        }

        if (request.getTags() != null && request.getTags().size() > InputSanitizer.MAX_TAGS) {
            throw BadRequestException.tooManyTags(InputSanitizer.MAX_TAGS);
        }
        Set<String> tags = InputSanitizer.normalizeTags(request.getTags());

        log.info("Creating bug report: title={}, application={}, anonymous={}",
                title, applicationName, reporterId == null);

        Application application = entityResolver.resolveApplication(applicationName, applicationUrl);

        BugReport bug = BugReport.builder()
                .title(title)
                .description(description)
                .status(BugStatus.OPEN)
                .priority(priority)
                .tags(tags)
                .operatingSystem(optionalField(request.getOperatingSystem(), 100))
                .deviceType(optionalField(request.getDeviceType(), 100))
                .appVersion(optionalField(request.getAppVersion(), 50))
                .browserVersion(optionalField(request.getBrowserVersion(), 100))
                .applicationId(application.getId())
                .reporterId(reporterId)
                .assignedCompanyId(application.getCompanyId())
                .build();

        BugReport saved = bugReportRepository.save(bug);
        eventPublisher.publishEvent(BugChangedEvent.listsOnly());

        log.info("Bug report created: bugId={}, applicationId={}, companyId={}",
                saved.getId(), application.getId(), application.getCompanyId());
        return assembler.toResponse(saved);
    }

    @Override
    public BugListResponse listBugs(BugListQuery query) {
        BugSearchCriteria criteria = normalize(query);
        boolean cacheable = BugCacheKeys.isCacheable(criteria);
        String cacheKey = cacheable ? BugCacheKeys.listKey(criteria) : null;

        if (cacheable) {
            Optional<BugListResponse> cached = bugCache.getList(cacheKey);
            if (cached.isPresent()) {
                log.debug("Bug list cache hit: key={}", cacheKey);
                return cached.get();
            }
        }

        Page<BugReport> page = bugReportRepository.search(criteria);
        BugListResponse response = BugListResponse.builder()
                .bugs(assembler.toResponses(page.getContent()))
                .pagination(PaginationResponse.of(criteria.page(), criteria.limit(), page.getTotalElements()))
                .build();

        if (cacheable) {
            bugCache.putList(cacheKey, response);
        }
        return response;
    }

    @Override
    public BugResponse getBug(UUID bugId) {
        Optional<BugResponse> cached = bugCache.getBug(bugId);
        if (cached.isPresent()) {
            log.debug("Bug cache hit: bugId={}", bugId);
            return cached.get();
        }

        BugReport bug = bugReportRepository.findActiveById(bugId)
                .orElseThrow(() -> ResourceNotFoundException.bugNotFound(bugId));
        BugResponse response = assembler.toDetailResponse(bug);

        bugCache.putBug(bugId, response);
        return response;
    }

    /**
     * Defaults and bounds for the listing query. Unknown status or priority values are ignored.
     */
    BugSearchCriteria normalize(BugListQuery query) {
        int page = query.getPage() == null || query.getPage() <= 0 ? 1 : query.getPage();
        int limit = query.getLimit() == null || query.getLimit() <= 0 || query.getLimit() > MAX_PAGE_SIZE
                ? DEFAULT_PAGE_SIZE
                : query.getLimit();

        BugStatus status = query.getStatus() != null ? BugStatus.fromValue(query.getStatus()).orElse(null) : null;
        BugPriority priority = query.getPriority() != null
                ? BugPriority.fromValue(query.getPriority()).orElse(null)
                : null;

        List<String> tags = null;
        if (hasText(query.getTags())) {
            Set<String> normalized = InputSanitizer.normalizeTags(Arrays.asList(query.getTags().split(",")));
            tags = normalized.isEmpty() ? null : new ArrayList<>(normalized);
        }

        BugSortOrder sort = BugSortOrder.fromValue(query.getSort());
        Instant createdAfter = sort == BugSortOrder.TRENDING ? Instant.now().minus(TRENDING_WINDOW) : null;

        return new BugSearchCriteria(
                trimToNull(query.getSearch()),
                status,
                priority,
                tags,
                trimToNull(query.getApplication()),
                trimToNull(query.getCompany()),
                createdAfter,
                sort,
                page,
                limit);
    }

    private static String optionalField(String value, int maxLength) {
        if (!hasText(value)) {
            return null;
        }
        return InputSanitizer.validateString(value, 1, maxLength).orElse(null);
    }

    private static String trimToNull(String value) {
        return hasText(value) ? value.trim() : null;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
