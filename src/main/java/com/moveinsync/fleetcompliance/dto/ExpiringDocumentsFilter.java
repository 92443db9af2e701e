package com.moveinsync.fleetcompliance.dto;

import com.moveinsync.fleetcompliance.entity.DocumentStatus;
import com.moveinsync.fleetcompliance.entity.DocumentType;
import lombok.*;

import java.util.Set;

/**
 * Report filter; an empty or null set means "all".
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
public class ExpiringDocumentsFilter {

    private Set<DocumentStatus> statuses;
    private Set<DocumentType> documentTypes;

    public boolean acceptsStatus(DocumentStatus status) {
        return statuses == null || statuses.isEmpty() || statuses.contains(status);
    }

    public boolean acceptsType(DocumentType type) {
        return documentTypes == null || documentTypes.isEmpty() || documentTypes.contains(type);
    }
}
