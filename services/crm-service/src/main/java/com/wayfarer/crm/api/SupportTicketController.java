package com.wayfarer.crm.api;

import com.wayfarer.crm.domain.SupportTicket;
import com.wayfarer.crm.domain.TicketStatus;
import com.wayfarer.crm.infrastructure.persistence.SupportTicketRepository;
import com.wayfarer.crm.infrastructure.web.RequiresPermission;
import com.wayfarer.security.Action;
import com.wayfarer.security.Modules;
import com.wayfarer.security.Principal;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/support-tickets")
public class SupportTicketController {

    private final SupportTicketRepository tickets;

    public SupportTicketController(SupportTicketRepository tickets) {
        this.tickets = tickets;
    }

    @GetMapping
    @RequiresPermission(module = Modules.SUPPORT_TICKETS, action = Action.READ)
    public List<SupportTicket> list(Principal principal) {
        return tickets.findAll(principal);
    }

    @GetMapping("/{id}")
    @RequiresPermission(module = Modules.SUPPORT_TICKETS, action = Action.READ)
    public SupportTicket get(Principal principal, @PathVariable long id) {
        return tickets.findVisible(principal, id);
    }

    @PatchMapping("/{id}/status")
    @RequiresPermission(module = Modules.SUPPORT_TICKETS, action = Action.UPDATE)
    public SupportTicket updateStatus(
            Principal principal, @PathVariable long id, @Valid @RequestBody StatusUpdateRequest request) {
        TicketStatus status = TicketStatus.fromLabel(request.status())
                .orElseThrow(() -> new IllegalArgumentException("Unknown ticket status: " + request.status()));
        return tickets.updateStatus(principal, id, status);
    }
}
