package com.wayfarer.crm.infrastructure.web;

import com.wayfarer.observability.MetricFactory;
import com.wayfarer.security.AccessDecision;
import com.wayfarer.security.AccessGate;
import com.wayfarer.security.Principal;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.util.Locale;
import org.springframework.stereotype.Component;
import org.springframework.web.method.HandlerMethod;
import org.springframework.web.servlet.HandlerInterceptor;

/**
 * Runs the {@link AccessGate} for handlers annotated with {@link RequiresPermission}.
 *
 * <p>Every decision is counted in {@value #DECISIONS_METRIC}, tagged with module, action and
 * outcome, and the gate's latency is recorded in {@value #CHECK_TIMER_METRIC} per module. A non-allow decision is thrown as the matching authorization exception and rendered
 * by {@link GlobalExceptionHandler}; the handler never runs.
 */
@Component
public class AccessGateInterceptor implements HandlerInterceptor {

    public static final String DECISIONS_METRIC = "wayfarer.authz.decisions";
    public static final String CHECK_TIMER_METRIC = "wayfarer.authz.check";

    private final AccessGate accessGate;
    private final MetricFactory metrics;

    public AccessGateInterceptor(AccessGate accessGate, MetricFactory metrics) {
        this.accessGate = accessGate;
        this.metrics = metrics;
    }

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        if (!(handler instanceof HandlerMethod method)) {
            return true;
        }
        RequiresPermission required = method.getMethodAnnotation(RequiresPermission.class);
        if (required == null) {
            return true;
        }

        Principal principal = AuthenticationFilter.principalOf(request).orElse(null);
        AccessDecision decision = metrics.timer(CHECK_TIMER_METRIC, "Access gate latency", "module", required.module())
                .record(() -> accessGate.check(principal, required.module(), required.action()));

        metrics.counter(
                        DECISIONS_METRIC,
                        "Access gate decisions",
                        "module", required.module(),
                        "action", required.action().value(),
                        "outcome", decision.outcome().name().toLowerCase(Locale.ROOT))
                .increment();

        if (!decision.isAllowed()) {
            throw decision.toException(required.module(), required.action());
        }
        return true;
    }
}
