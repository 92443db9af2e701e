package com.moveinsync.fleetcompliance.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.moveinsync.fleetcompliance.dto.AuditLogFilter;
import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import com.moveinsync.fleetcompliance.entity.AuditLogEntry;
import com.moveinsync.fleetcompliance.exception.ValidationException;
import com.moveinsync.fleetcompliance.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * AuditService: Audit & Compliance Tracking
 *
 * Records an immutable entry for every mutation and report access, and provides
 * the read-only queries behind the audit REST API.
 *
 * Design decisions:
 *  1. SERVER timestamp only: taken from the injected Clock, never from the request.
 *  2. Best effort: a failed audit write is caught, counted and written to the
 *     AUDIT_FALLBACK logger. It is NOT rethrown, so the triggering mutation still
 *     completes.
 *  3. Own transaction: see AuditLogWriter.
 *  4. Written only once the surrounding transaction has committed. A mutation
 *     that rolls back (and is possibly retried) leaves no entry behind; outside
 *     a transaction the entry is written immediately.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuditService {

    /** Fallback channel for entries that could not be persisted */
    private static final Logger FALLBACK = LoggerFactory.getLogger("AUDIT_FALLBACK");

    private final AuditLogWriter auditLogWriter;
    private final AuditLogRepository auditLogRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final AtomicLong failedWrites = new AtomicLong();

    /**
     * Appends an audit entry, after commit when called inside a transaction. Never throws.
     *
     * @param userId       acting user
     * @param action       what happened
     * @param entityType   kind of entity touched
     * @param entityId     entity id, null for fleet-wide actions (reports, system init)
     * @param details      structured payload, e.g. before/after values; serialized as JSON
     * @param registration vehicle registration when the entity belongs to a vehicle
     */
    public void record(String userId, AuditAction action, AuditEntityType entityType,
                       String entityId, Map<String, Object> details, String registration) {
        AuditLogEntry entry;
        try {
            entry = AuditLogEntry.builder()
                    .timestamp(LocalDateTime.now(clock))
                    .userId(userId)
                    .action(action)
                    .entityType(entityType)
                    .entityId(entityId)
                    .entityRegistration(registration)
                    .details(objectMapper.writeValueAsString(details != null ? details : Map.of()))
                    .build();
        } catch (Exception e) {
            fail(action, entityType, entityId, userId, details, e);
            return;
        }

        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    write(entry, details);
                }

                @Override
                public void afterCompletion(int status) {
                    if (status == STATUS_ROLLED_BACK) {
                        log.debug("AUDIT: {} for {} #{} discarded, transaction rolled back",
                                action, entityType, entityId != null ? entityId : "-");
                    }
                }
            });
        } else {
            write(entry, details);
        }
    }

    private void write(AuditLogEntry entry, Map<String, Object> details) {
        try {
            auditLogWriter.append(entry);
            log.info("AUDIT: {} persisted: {} #{} ({}), user: '{}'",
                    entry.getAction(), entry.getEntityType(),
                    entry.getEntityId() != null ? entry.getEntityId() : "-",
                    entry.getEntityRegistration() != null ? entry.getEntityRegistration() : "-",
                    entry.getUserId());
        } catch (Exception e) {
            fail(entry.getAction(), entry.getEntityType(), entry.getEntityId(), entry.getUserId(), details, e);
        }
    }

    private void fail(AuditAction action, AuditEntityType entityType, String entityId,
                      String userId, Map<String, Object> details, Exception e) {
        long failures = failedWrites.incrementAndGet();
        FALLBACK.error("AUDIT: Failed to persist {} for {} #{} by '{}' (failure #{}): details: {}",
                action, entityType, entityId, userId, failures, details, e);
    }

    /** Number of audit entries that could not be persisted since startup */
    public long getFailedWriteCount() {
        return failedWrites.get();
    }

    /**
     * Filtered audit listing, newest first.
     *
     * @throws ValidationException if the date range is inverted
     */
    @Transactional(readOnly = true)
    public List<AuditLogEntry> search(AuditLogFilter filter) {
        if (filter.getFrom() != null && filter.getTo() != null && filter.getFrom().isAfter(filter.getTo())) {
            throw new ValidationException("from",
                    "from (" + filter.getFrom() + ") must not be after to (" + filter.getTo() + ")");
        }
        LocalDateTime from = filter.getFrom() != null ? filter.getFrom().atStartOfDay() : null;
        // "to" is inclusive by calendar day
        LocalDateTime toExclusive = filter.getTo() != null ? filter.getTo().plusDays(1).atStartOfDay() : null;

        log.debug("AUDIT: Querying entries: {}", filter);
        List<AuditLogEntry> entries = auditLogRepository.search(
                blankToNull(filter.getUserId()), filter.getEntityType(), filter.getAction(), from, toExclusive);
        log.info("AUDIT: Found {} entr(ies) for {}", entries.size(), filter);
        return entries;
    }

    /** Full history of one entity, newest first. Survives deletion of the entity itself. */
    @Transactional(readOnly = true)
    public List<AuditLogEntry> historyForEntity(AuditEntityType entityType, String entityId) {
        return auditLogRepository.findByEntityTypeAndEntityIdOrderByTimestampDescIdDesc(entityType, entityId);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
