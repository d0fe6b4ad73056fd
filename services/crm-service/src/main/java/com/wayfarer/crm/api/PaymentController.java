package com.wayfarer.crm.api;

import com.wayfarer.crm.domain.Payment;
import com.wayfarer.crm.infrastructure.persistence.PaymentRepository;
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
@RequestMapping("/api/v1/payments")
public class PaymentController {

    private final PaymentRepository payments;

    public PaymentController(PaymentRepository payments) {
        this.payments = payments;
    }

    @GetMapping
    @RequiresPermission(module = Modules.PAYMENTS, action = Action.READ)
    public List<Payment> list(Principal principal) {
        return payments.findAll(principal);
    }

    @GetMapping("/{id}")
    @RequiresPermission(module = Modules.PAYMENTS, action = Action.READ)
    public Payment get(Principal principal, @PathVariable long id) {
        return payments.findVisible(principal, id);
    }
}
