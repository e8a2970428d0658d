package com.hyperdesk.vmrequest.infrastructure.messaging;

import com.hyperdesk.tenant.TenantContext;
import com.hyperdesk.tenant.TenantContextHolder;
import com.hyperdesk.vmrequest.application.provisioning.VmProvisioningSaga;
import com.hyperdesk.vmrequest.domain.events.VmRequestApproved;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Async;

/** Hands approval events to the provisioning saga on the provisioning executor. */
public class VmProvisioningEventListener {

    public static final String EXECUTOR = "provisioningExecutor";

    private static final Logger log = LoggerFactory.getLogger(VmProvisioningEventListener.class);

    private final VmProvisioningSaga saga;

    public VmProvisioningEventListener(VmProvisioningSaga saga) {
        this.saga = saga;
    }

    @Async(EXECUTOR)
    @EventListener
    public void onApproved(VmRequestApproved event) {
        TenantContextHolder.set(TenantContext.of(event.metadata().tenantId()));
        try {
            saga.onApproved(event);
        } catch (RuntimeException e) {
            log.error("Provisioning saga crashed for VM request {} of tenant {}",
                    event.requestId(), event.metadata().tenantId(), e);
            throw e;
        } finally {
            TenantContextHolder.clear();
        }
    }
}
