package com.wayfarer.crm.domain;

import java.util.Optional;

/** Support ticket lifecycle, stored by label. */
public enum TicketStatus {
    OPEN("Open"),
    IN_PROGRESS("In Progress"),
    RESOLVED("Resolved"),
    CLOSED("Closed");

    private final String label;

    TicketStatus(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /** Whether entering this status stamps {@code resolved_at}. */
    public boolean isTerminal() {
        return this == RESOLVED || this == CLOSED;
    }

    public static Optional<TicketStatus> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        for (TicketStatus status : values()) {
            if (status.label.equalsIgnoreCase(label.strip())) {
                return Optional.of(status);
            }
        }
        return Optional.empty();
    }
}
