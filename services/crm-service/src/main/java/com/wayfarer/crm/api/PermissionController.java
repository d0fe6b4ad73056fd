package com.wayfarer.crm.api;

import com.wayfarer.security.Action;
import com.wayfarer.security.Modules;
import com.wayfarer.security.PermissionResolver;
import com.wayfarer.security.Principal;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Exposes the caller's effective grants. Ungated: any authenticated principal may ask about
 * itself.
 */
@RestController
@RequestMapping("/api/v1/permissions")
public class PermissionController {

    private final PermissionResolver resolver;

    public PermissionController(PermissionResolver resolver) {
        this.resolver = resolver;
    }

    @GetMapping("/me")
    public PermissionSummary me(Principal principal) {
        Map<String, List<String>> permissions = new TreeMap<>();
        if (principal.isAdmin()) {
            List<String> all = Arrays.stream(Action.values()).map(Action::value).toList();
            Modules.SEEDED.forEach(module -> permissions.put(module, all));
        } else {
            for (String module : resolver.modulesWithAnyGrant(principal.role())) {
                permissions.put(
                        module,
                        resolver.actionsFor(principal.role(), module).stream()
                                .sorted(Comparator.naturalOrder())
                                .map(Action::value)
                                .toList());
            }
        }
        return new PermissionSummary(principal.id(), principal.role(), principal.isAdmin(), permissions);
    }
}
