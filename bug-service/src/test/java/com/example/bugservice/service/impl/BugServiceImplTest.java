package com.example.bugservice.service.impl;

import com.example.bugservice.cache.BugCache;
import com.example.bugservice.dto.request.BugListQuery;
import com.example.bugservice.dto.request.CreateBugRequest;
import com.example.bugservice.dto.response.BugListResponse;
import com.example.bugservice.dto.response.BugResponse;
import com.example.bugservice.entity.BugPriority;
import com.example.bugservice.entity.BugReport;
import com.example.bugservice.entity.BugStatus;
import com.example.bugservice.exception.BadRequestException;
import com.example.bugservice.repository.BugReportRepository;
import com.example.bugservice.repository.BugSearchCriteria;
import com.example.bugservice.repository.BugSortOrder;
import com.example.bugservice.service.BugResponseAssembler;
import com.example.bugservice.service.EntityResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.data.domain.PageImpl;

import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class BugServiceImplTest {

    @Mock
    private BugReportRepository bugReportRepository;
    @Mock
    private EntityResolver entityResolver;
    @Mock
    private BugResponseAssembler assembler;
    @Mock
    private BugCache bugCache;
    @Mock
    private ApplicationEventPublisher eventPublisher;

    @InjectMocks
    private BugServiceImpl bugService;

    @Test
    void getBug_cacheHit_doesNotTouchDatabase() {
        // GIVEN
        UUID bugId = UUID.randomUUID();
        BugResponse cached = BugResponse.builder().id(bugId).title("Cached").build();
        when(bugCache.getBug(bugId)).thenReturn(Optional.of(cached));

        // WHEN
        BugResponse result = bugService.getBug(bugId);

        // THEN
        assertThat(result).isSameAs(cached);
        verifyNoInteractions(bugReportRepository, assembler);
    }

    @Test
    void listBugs_cachedFirstPage_doesNotTouchDatabase() {
        BugListResponse cached = BugListResponse.builder().bugs(List.of()).build();
        when(bugCache.getList(anyString())).thenReturn(Optional.of(cached));

        BugListResponse result = bugService.listBugs(BugListQuery.builder().build());

        assertThat(result).isSameAs(cached);
        verifyNoInteractions(bugReportRepository);
    }

    @Test
    void listBugs_searchQuery_bypassesCache() {
        when(bugReportRepository.search(any()))
                .thenReturn(new PageImpl<>(List.<BugReport>of()));
        when(assembler.toResponses(List.of())).thenReturn(List.of());

        bugService.listBugs(BugListQuery.builder().search("crash").build());

        verifyNoInteractions(bugCache);
    }

    @Test
    void normalize_appliesDefaultsAndIgnoresInvalidFilters() {
        // GIVEN
        BugListQuery query = BugListQuery.builder()
                .page(0)
                .limit(500)
                .status("closed")
                .priority("HIGH")
                .tags(" UI ,login,,ui")
                .sort("nonsense")
                .search("  ")
                .build();

        // WHEN
        BugSearchCriteria criteria = bugService.normalize(query);

        // THEN
        assertThat(criteria.page()).isEqualTo(1);
        assertThat(criteria.limit()).isEqualTo(20);
        assertThat(criteria.status()).isNull();
        assertThat(criteria.priority()).isEqualTo(BugPriority.HIGH);
        assertThat(criteria.tags()).containsExactly("ui", "login");
        assertThat(criteria.sort()).isEqualTo(BugSortOrder.RECENT);
        assertThat(criteria.search()).isNull();
        assertThat(criteria.createdAfter()).isNull();
    }

    @Test
    void normalize_trendingRestrictsToRecentBugs() {
        BugSearchCriteria criteria = bugService.normalize(BugListQuery.builder()
                .sort("trending").status("fixed").build());

        assertThat(criteria.sort()).isEqualTo(BugSortOrder.TRENDING);
        assertThat(criteria.status()).isEqualTo(BugStatus.FIXED);
        assertThat(criteria.createdAfter()).isNotNull();
    }

    @Test
    void createBug_tooManyTags_rejectedBeforeAnyWrite() {
        CreateBugRequest request = validRequest();
        request.setTags(Collections.nCopies(11, "tag"));

        assertThatThrownBy(() -> bugService.createBug(request, null))
                .isInstanceOf(BadRequestException.class)
                .hasFieldOrPropertyWithValue("code", "TOO_MANY_TAGS");
        verifyNoInteractions(entityResolver, bugReportRepository);
    }

    @Test
    void createBug_fieldErrors_useFieldSpecificCodes() {
        CreateBugRequest shortTitle = validRequest();
        shortTitle.setTitle("Bug");
        assertThatThrownBy(() -> bugService.createBug(shortTitle, null))
                .hasFieldOrPropertyWithValue("code", "INVALID_TITLE");

        CreateBugRequest badUrl = validRequest();
        badUrl.setApplicationUrl("ftp://acme.com");
        assertThatThrownBy(() -> bugService.createBug(badUrl, null))
                .hasFieldOrPropertyWithValue("code", "INVALID_APPLICATION_URL");

        CreateBugRequest badPriority = validRequest();
        badPriority.setPriority("urgent");
        assertThatThrownBy(() -> bugService.createBug(badPriority, null))
                .hasFieldOrPropertyWithValue("code", "INVALID_PRIORITY");

        CreateBugRequest badEmail = validRequest();
        badEmail.setContactEmail("nope");
        assertThatThrownBy(() -> bugService.createBug(badEmail, null))
                .hasFieldOrPropertyWithValue("code", "INVALID_CONTACT_EMAIL");

        verifyNoInteractions(entityResolver, bugReportRepository);
    }

    private static CreateBugRequest validRequest() {
        return CreateBugRequest.builder()
                .title("Login broken")
                .description("The login button does nothing on Safari")
                .applicationName("Acme App")
                .build();
    }
}
