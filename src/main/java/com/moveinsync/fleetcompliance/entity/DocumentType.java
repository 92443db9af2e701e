package com.moveinsync.fleetcompliance.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Regulatory document kinds tracked per vehicle.
 *
 * Stored as a String in the DB via @Enumerated(EnumType.STRING).
 * OTHER documents carry a free-text custom type name that is part of their identity.
 */
public enum DocumentType {

    INSURANCE("Insurance", true),

    FITNESS_CERTIFICATE("Fitness Certificate", true),

    /** Pollution Under Control certificate */
    POLLUTION_CERTIFICATE("Pollution Certificate", true),

    /** Tourist / goods carriage permit */
    PERMIT("Permit", false),

    REGISTRATION_CARD("Registration Card", false),

    OTHER("Other", false);

    private final String label;

    /** Essential kinds force MISSING_INFO when the vehicle has no governing document for them */
    private final boolean essential;

    DocumentType(String label, boolean essential) {
        this.label = label;
        this.essential = essential;
    }

    public String getLabel() {
        return label;
    }

    public boolean isEssential() {
        return essential;
    }

    public static Set<DocumentType> essentialTypes() {
        Set<DocumentType> result = EnumSet.noneOf(DocumentType.class);
        for (DocumentType type : values()) {
            if (type.essential) {
                result.add(type);
            }
        }
        return result;
    }
}
