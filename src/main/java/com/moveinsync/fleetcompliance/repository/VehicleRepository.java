package com.moveinsync.fleetcompliance.repository;

import com.moveinsync.fleetcompliance.entity.Vehicle;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for Vehicle entity
 */
@Repository
public interface VehicleRepository extends JpaRepository<Vehicle, Long> {

    /**
     * Per-vehicle mutation lock.
     *
     * Acquires a PESSIMISTIC_WRITE (SELECT FOR UPDATE) lock on the Vehicle row so
     * a document upload and the alert synchronization that follows it commit as
     * one unit. Two concurrent uploads for the same vehicle are serialized here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT v FROM Vehicle v WHERE v.id = :id")
    Optional<Vehicle> findByIdForUpdate(@Param("id") Long id);

    Optional<Vehicle> findByRegistrationNumber(String registrationNumber);

    boolean existsByRegistrationNumber(String registrationNumber);

    /** Fleet snapshot for summaries and reports: documents fetched in the same query */
    @EntityGraph(attributePaths = "documents")
    @Query("SELECT DISTINCT v FROM Vehicle v ORDER BY v.registrationNumber ASC")
    List<Vehicle> findAllWithDocuments();

    @Query("SELECT v.id FROM Vehicle v ORDER BY v.registrationNumber ASC")
    List<Long> findAllIds();
}
