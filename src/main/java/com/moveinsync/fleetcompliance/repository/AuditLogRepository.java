package com.moveinsync.fleetcompliance.repository;

import com.moveinsync.fleetcompliance.entity.AuditAction;
import com.moveinsync.fleetcompliance.entity.AuditEntityType;
import com.moveinsync.fleetcompliance.entity.AuditLogEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Repository for AuditLogEntry: append and query only.
 *
 * The DB indexes on (event_timestamp) and (entity_type, entity_id) back the
 * listing and per-entity history queries.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntry, Long> {

    /**
     * Filtered audit listing, newest first. Every parameter is optional (null = no filter).
     *
     * @param from inclusive lower bound on the entry timestamp
     * @param to   exclusive upper bound on the entry timestamp
     */
    @Query("SELECT a FROM AuditLogEntry a "
            + "WHERE (:userId IS NULL OR a.userId = :userId) "
            + "AND (:entityType IS NULL OR a.entityType = :entityType) "
            + "AND (:action IS NULL OR a.action = :action) "
            + "AND (:from IS NULL OR a.timestamp >= :from) "
            + "AND (:to IS NULL OR a.timestamp < :to) "
            + "ORDER BY a.timestamp DESC, a.id DESC")
    List<AuditLogEntry> search(@Param("userId") String userId,
                               @Param("entityType") AuditEntityType entityType,
                               @Param("action") AuditAction action,
                               @Param("from") LocalDateTime from,
                               @Param("to") LocalDateTime to);

    List<AuditLogEntry> findByEntityTypeAndEntityIdOrderByTimestampDescIdDesc(AuditEntityType entityType,
                                                                                String entityId);
}
