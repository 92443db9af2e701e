package com.moveinsync.fleetcompliance.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Outcome of a fleet-wide alert synchronization for one owner.
 * A failing vehicle is listed in failedVehicleIds; the others are still synchronized.
 */
@Value
@Builder
public class FleetSyncResult {

    String ownerId;
    int totalVehicles;
    int synchronizedVehicles;
    List<Long> failedVehicleIds;
    long unreadAlerts;

    public int getFailedVehicles() {
        return failedVehicleIds.size();
    }
}
