package com.wayfarer.crm.domain;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Status labels")
class StatusLabelsTest {

    @Test
    @DisplayName("lead statuses resolve case-insensitively by label")
    void leadStatus() {
        assertThat(LeadStatus.fromLabel(" closed won ")).contains(LeadStatus.CLOSED_WON);
        assertThat(LeadStatus.fromLabel("CLOSED_WON")).isEmpty();
        assertThat(LeadStatus.fromLabel(null)).isEmpty();
    }

    @Test
    @DisplayName("only resolved and closed tickets are terminal")
    void ticketStatus() {
        assertThat(TicketStatus.fromLabel("in progress")).contains(TicketStatus.IN_PROGRESS);
        assertThat(TicketStatus.RESOLVED.isTerminal()).isTrue();
        assertThat(TicketStatus.CLOSED.isTerminal()).isTrue();
        assertThat(TicketStatus.OPEN.isTerminal()).isFalse();
    }
}
