package com.wayfarer.crm.domain;

import java.util.Optional;

/** Pipeline stages of a lead, stored by label. */
public enum LeadStatus {
    NEW("New"),
    CONTACTED("Contacted"),
    QUALIFIED("Qualified"),
    PROPOSAL("Proposal"),
    NEGOTIATION("Negotiation"),
    CLOSED_WON("Closed Won"),
    CLOSED_LOST("Closed Lost");

    private final String label;

    LeadStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Case-insensitive lookup by stored label. */
    public static Optional<LeadStatus> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (LeadStatus status : values()) {
            if (status.label.equalsIgnoreCase(label.strip())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
