package com.wayfarer.crm.api;

import com.wayfarer.crm.domain.Reservation;
import com.wayfarer.crm.infrastructure.persistence.ReservationRepository;
import com.wayfarer.crm.infrastructure.web.RequiresPermission;
import com.wayfarer.security.Action;
import com.wayfarer.security.Modules;
import com.wayfarer.security.Principal;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/reservations")
public class ReservationController {

    private final ReservationRepository reservations;

    public ReservationController(ReservationRepository reservations) {
        this.reservations = reservations;
    }

    @GetMapping
    @RequiresPermission(module = Modules.RESERVATIONS, action = Action.READ)
    public List<Reservation> list(Principal principal) {
        return reservations.findAll(principal);
    }

    @GetMapping("/{id}")
    @RequiresPermission(module = Modules.RESERVATIONS, action = Action.READ)
    public Reservation get(Principal principal, @PathVariable long id) {
        return reservations.findVisible(principal, id);
    }
}
