package com.hyperdesk.vmrequest.infrastructure.messaging;

import com.hyperdesk.observability.CorrelationContext;
import com.hyperdesk.observability.CorrelationContextHolder;
import com.hyperdesk.tenant.TenantContext;
import com.hyperdesk.tenant.TenantContextHolder;
import org.springframework.core.task.TaskDecorator;

import java.util.Optional;

/**
 * Carries the submitting thread's correlation and tenant context over to the executor thread,
 * and clears both once the task ends.
 */
public class CorrelationContextTaskDecorator implements TaskDecorator {

    @Override
    public Runnable decorate(Runnable runnable) {
        Optional<CorrelationContext> correlation = CorrelationContextHolder.get();
        Optional<TenantContext> tenant = TenantContextHolder.get();
        return () -> {
            correlation.ifPresent(CorrelationContextHolder::set);
            tenant.ifPresent(TenantContextHolder::set);
            try {
                runnable.run();
            } finally {
                CorrelationContextHolder.clear();
                TenantContextHolder.clear();
            }
        };
    }
}
