package com.moveinsync.fleetcompliance.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.moveinsync.fleetcompliance.dto.AuditLogFilter;
import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import com.moveinsync.fleetcompliance.entity.AuditLogEntry;
import com.moveinsync.fleetcompliance.exception.ValidationException;
import com.moveinsync.fleetcompliance.repository.AuditLogRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.moveinsync.fleetcompliance.service.TestDocuments.CLOCK;
import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for AuditService: best-effort append and query validation.
 */
@ExtendWith(MockitoExtension.class)
class AuditServiceTest {

    // ── Mocks ────────────────────────────────────────────────────────────────

    @Mock private AuditLogWriter     auditLogWriter;
    @Mock private AuditLogRepository auditLogRepository;

    private AuditService auditService;

    @BeforeEach
    void setUp() {
        auditService = new AuditService(auditLogWriter, auditLogRepository,
                new ObjectMapper().findAndRegisterModules(), CLOCK);
    }

    // ── record ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("record: entry carries server timestamp and JSON details")
    void record_persistsEntry() {
        Map<String, Object> change = new LinkedHashMap<>();
        change.put("old", "Tata");
        change.put("new", "Volvo");

        auditService.record("ops-lead", AuditAction.UPDATE_VEHICLE, AuditEntityType.VEHICLE,
                "7", Map.of("make", change), "KA01AB1234");

        ArgumentCaptor<AuditLogEntry> captor = ArgumentCaptor.forClass(AuditLogEntry.class);
        verify(auditLogWriter).append(captor.capture());
        AuditLogEntry entry = captor.getValue();
        assertThat(entry.getTimestamp()).isEqualTo(LocalDateTime.of(2026, 10, 19, 10, 0));
        assertThat(entry.getUserId()).isEqualTo("ops-lead");
        assertThat(entry.getAction()).isEqualTo(AuditAction.UPDATE_VEHICLE);
        assertThat(entry.getEntityType()).isEqualTo(AuditEntityType.VEHICLE);
        assertThat(entry.getEntityId()).isEqualTo("7");
        assertThat(entry.getEntityRegistration()).isEqualTo("KA01AB1234");
        assertThat(entry.getDetails()).isEqualTo("{\"make\":{\"old\":\"Tata\",\"new\":\"Volvo\"}}");
        assertThat(auditService.getFailedWriteCount()).isZero();
    }

    @Test
    @DisplayName("record: null details are stored as an empty object")
    void record_nullDetails() {
        auditService.record("system", AuditAction.SYSTEM_INIT, AuditEntityType.SYSTEM, null, null, null);

        ArgumentCaptor<AuditLogEntry> captor = ArgumentCaptor.forClass(AuditLogEntry.class);
        verify(auditLogWriter).append(captor.capture());
        assertThat(captor.getValue().getDetails()).isEqualTo("{}");
        assertThat(captor.getValue().getEntityId()).isNull();
    }

    @Test
    @DisplayName("record: store failure is swallowed and counted, caller is unaffected")
    void record_storeFailure_notPropagated() {
        when(auditLogWriter.append(any())).thenThrow(new DataAccessResourceFailureException("db down"));

        assertThatCode(() -> auditService.record("ops-lead", AuditAction.DELETE_VEHICLE,
                AuditEntityType.VEHICLE, "7", Map.of("removedAlerts", 2), "KA01AB1234"))
                .doesNotThrowAnyException();
        assertThat(auditService.getFailedWriteCount()).isEqualTo(1);
    }

    @Test
    @DisplayName("record inside a transaction: written only after commit")
    void record_inTransaction_deferredUntilCommit() {
        TransactionSynchronizationManager.initSynchronization();
        try {
            auditService.record("ops-lead", AuditAction.UPLOAD_DOCUMENT, AuditEntityType.DOCUMENT,
                    "11", Map.of("documentType", "INSURANCE"), "KA01AB1234");
            verifyNoInteractions(auditLogWriter);

            List<TransactionSynchronization> pending = TransactionSynchronizationManager.getSynchronizations();
            assertThat(pending).hasSize(1);
            pending.forEach(TransactionSynchronization::afterCommit);
            pending.forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_COMMITTED));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        ArgumentCaptor<AuditLogEntry> captor = ArgumentCaptor.forClass(AuditLogEntry.class);
        verify(auditLogWriter).append(captor.capture());
        assertThat(captor.getValue().getEntityId()).isEqualTo("11");
        assertThat(captor.getValue().getTimestamp()).isEqualTo(LocalDateTime.of(2026, 10, 19, 10, 0));
    }

    @Test
    @DisplayName("record inside a transaction that rolls back: nothing written, nothing counted")
    void record_inTransaction_rollbackDiscards() {
        TransactionSynchronizationManager.initSynchronization();
        try {
            auditService.record("ops-lead", AuditAction.CREATE_VEHICLE, AuditEntityType.VEHICLE,
                    "7", Map.of(), "KA01AB1234");
            TransactionSynchronizationManager.getSynchronizations()
                    .forEach(s -> s.afterCompletion(TransactionSynchronization.STATUS_ROLLED_BACK));
        } finally {
            TransactionSynchronizationManager.clearSynchronization();
        }

        verifyNoInteractions(auditLogWriter);
        assertThat(auditService.getFailedWriteCount()).isZero();
    }

    // ── search ────────────────────────────────────────────────────────────────

    @Test
    @DisplayName("search: inverted date range → ValidationException, store not queried")
    void search_invertedRange_rejected() {
        AuditLogFilter filter = AuditLogFilter.builder()
                .from(LocalDate.of(2026, 10, 19))
                .to(LocalDate.of(2026, 10, 1))
                .build();

        assertThatThrownBy(() -> auditService.search(filter))
                .isInstanceOf(ValidationException.class)
                .extracting("field").isEqualTo("from");
        verifyNoInteractions(auditLogRepository);
    }

    @Test
    @DisplayName("search: 'to' is inclusive by day, blank userId means any user")
    void search_dayRangeInclusive() {
        when(auditLogRepository.search(any(), any(), any(), any(), any())).thenReturn(List.of());

        auditService.search(AuditLogFilter.builder()
                .userId("  ")
                .entityType(AuditEntityType.VEHICLE)
                .from(LocalDate.of(2026, 10, 1))
                .to(LocalDate.of(2026, 10, 19))
                .build());

        verify(auditLogRepository).search(null, AuditEntityType.VEHICLE, null,
                LocalDateTime.of(2026, 10, 1, 0, 0),
                LocalDateTime.of(2026, 10, 20, 0, 0));
    }
}
