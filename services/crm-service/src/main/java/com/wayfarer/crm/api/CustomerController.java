package com.wayfarer.crm.api;

import com.wayfarer.crm.domain.Customer;
import com.wayfarer.crm.infrastructure.persistence.CustomerRepository;
import com.wayfarer.crm.infrastructure.web.RequiresPermission;
import com.wayfarer.security.Action;
import com.wayfarer.security.Modules;
import com.wayfarer.security.Principal;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * Customer accounts. A customer sees only their own account, an agent the accounts assigned
 * to them.
 */
@RestController
@RequestMapping("/api/v1/customers")
public class CustomerController {

    private final CustomerRepository customers;

    public CustomerController(CustomerRepository customers) {
        this.customers = customers;
    }

    @GetMapping
    @RequiresPermission(module = Modules.CUSTOMERS, action = Action.READ)
    public List<Customer> list(Principal principal) {
        return customers.findAll(principal);
    }

    @GetMapping("/{id}")
    @RequiresPermission(module = Modules.CUSTOMERS, action = Action.READ)
    public Customer get(Principal principal, @PathVariable long id) {
        return customers.findVisible(principal, id);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @RequiresPermission(module = Modules.CUSTOMERS, action = Action.DELETE)
    public void delete(Principal principal, @PathVariable long id) {
        customers.deleteVisible(principal, id);
    }
}
