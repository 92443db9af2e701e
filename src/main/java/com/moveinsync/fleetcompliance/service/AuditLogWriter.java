package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.AuditLogEntry;
import com.moveinsync.fleetcompliance.repository.AuditLogRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Persists audit entries in their own transaction.
 *
 * Kept in a separate bean so the REQUIRES_NEW boundary goes through the Spring
 * proxy: a failed insert rolls back only this inner transaction, never the
 * mutation that triggered it. AuditService calls it after that mutation has
 * committed, so a new transaction is required here.
 */
@Component
@RequiredArgsConstructor
public class AuditLogWriter {

    private final AuditLogRepository auditLogRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public AuditLogEntry append(AuditLogEntry entry) {
        return auditLogRepository.save(entry);
    }
}
