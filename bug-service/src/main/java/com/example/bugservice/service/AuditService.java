package com.example.bugservice.service;

import com.example.bugservice.entity.AuditAction;
import com.example.bugservice.entity.AuditLog;
import com.example.bugservice.repository.AuditLogRepository;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.util.UUID;

/**
 * Writes audit logs for administrative actions.
 *
 * Each record runs in its own transaction (REQUIRES_NEW) so it can be written
 * after the business transaction committed. Failures propagate; callers decide
 * whether an audit failure is fatal (flag) or best-effort (everything else).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    private static final int MAX_USER_AGENT_LENGTH = 500;

    private final AuditLogRepository auditLogRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditLog record(AuditAction action, String resource, UUID resourceId, String details, UUID userId) {
        AuditLog.Builder builder = AuditLog.builder()
                .action(action)
                .resource(resource)
                .resourceId(resourceId)
                .details(details)
                .userId(userId);

        addRequestContext(builder);

        AuditLog saved = auditLogRepository.save(builder.build());
        log.info("Audit log created: {} on {}:{} by {}", action.getValue(), resource, resourceId, userId);
        return saved;
    }

    private void addRequestContext(AuditLog.Builder builder) {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes servletAttributes) {
            HttpServletRequest request = servletAttributes.getRequest();
            builder.ipAddress(getClientIp(request));
            builder.userAgent(truncate(request.getHeader("User-Agent")));
        }
    }

    private String getClientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return xForwardedFor.split(",")[0].trim();
        }
        return request.getRemoteAddr();
    }

    private String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= MAX_USER_AGENT_LENGTH) {
            return userAgent;
        }
        return userAgent.substring(0, MAX_USER_AGENT_LENGTH);
    }
}
