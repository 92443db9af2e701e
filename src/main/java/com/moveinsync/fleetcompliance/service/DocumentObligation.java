package com.moveinsync.fleetcompliance.service;

import com.moveinsync.fleetcompliance.entity.DocumentType;
import com.moveinsync.fleetcompliance.entity.VehicleDocument;
import lombok.Value;

/**
 * A tracked obligation: one (document type, custom name) pair.
 * The custom name is only meaningful for OTHER and is null for every other type.
 */
@Value
public class DocumentObligation {

    DocumentType documentType;
    String customTypeName;

    public static DocumentObligation of(DocumentType documentType, String customTypeName) {
        return new DocumentObligation(documentType,
                documentType == DocumentType.OTHER ? customTypeName : null);
    }

    public static DocumentObligation of(VehicleDocument document) {
        return of(document.getDocumentType(), document.getCustomTypeName());
    }

    public boolean matches(VehicleDocument document) {
        return equals(of(document));
    }

    public String getDisplayName() {
        return documentType == DocumentType.OTHER && customTypeName != null
                ? customTypeName : documentType.getLabel();
    }
}
