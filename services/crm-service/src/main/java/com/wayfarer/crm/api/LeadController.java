package com.wayfarer.crm.api;

import com.wayfarer.crm.domain.Lead;
import com.wayfarer.crm.domain.LeadStatus;
import com.wayfarer.crm.infrastructure.persistence.LeadRepository;
import com.wayfarer.crm.infrastructure.web.RequiresPermission;
import com.wayfarer.security.Action;
import com.wayfarer.security.Modules;
import com.wayfarer.security.Principal;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Leads. Agents and sales see the leads assigned to them; other granted roles see all.
 */
@RestController
@RequestMapping("/api/v1/leads")
public class LeadController {

    private final LeadRepository leads;

    public LeadController(LeadRepository leads) {
        this.leads = leads;
    }

    @GetMapping
    @RequiresPermission(module = Modules.LEADS, action = Action.READ)
    public List<Lead> list(Principal principal) {
        return leads.findAll(principal);
    }

    @GetMapping("/{id}")
    @RequiresPermission(module = Modules.LEADS, action = Action.READ)
    public Lead get(Principal principal, @PathVariable long id) {
        return leads.findVisible(principal, id);
    }

    @PatchMapping("/{id}/status")
    @RequiresPermission(module = Modules.LEADS, action = Action.UPDATE)
    public Lead updateStatus(
            Principal principal, @PathVariable long id, @Valid @RequestBody StatusUpdateRequest request) {
        LeadStatus status = LeadStatus.fromLabel(request.status())
                .orElseThrow(() -> new IllegalArgumentException("Unknown lead status: " + request.status()));
        return leads.updateStatus(principal, id, status);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @RequiresPermission(module = Modules.LEADS, action = Action.DELETE)
    public void delete(Principal principal, @PathVariable long id) {
        leads.deleteVisible(principal, id);
    }
}
