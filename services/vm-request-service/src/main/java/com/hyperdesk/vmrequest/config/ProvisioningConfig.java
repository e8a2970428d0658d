package com.hyperdesk.vmrequest.config;

import com.hyperdesk.observability.SpanHelper;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorPort;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.ResourceMapper;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.ResourceMappingRepository;
import com.hyperdesk.vmrequest.application.provisioning.ProvisionVmHandler;
import com.hyperdesk.vmrequest.application.provisioning.ResilientProvisioningService;
import com.hyperdesk.vmrequest.application.provisioning.VmProvisioningSaga;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestFailedHandler;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestProvisioningHandler;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestReadyHandler;
import com.hyperdesk.vmrequest.application.vmrequest.CommandInstrumentation;
import com.hyperdesk.vmrequest.application.vmrequest.SyncVmStatusHandler;
import com.hyperdesk.vmrequest.application.vmrequest.VmRequestEventStream;
import com.hyperdesk.vmrequest.infrastructure.messaging.CorrelationContextTaskDecorator;
import com.hyperdesk.vmrequest.infrastructure.messaging.VmProvisioningEventListener;
import com.hyperdesk.vmrequest.infrastructure.persistence.JdbcVmRequestProjectionRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;

/** Saga, provisioning handler, status sync and the executor approval events are processed on. */
@Configuration(proxyBeanMethods = false)
@EnableAsync
public class ProvisioningConfig {

    @Bean(name = VmProvisioningEventListener.EXECUTOR)
    public ThreadPoolTaskExecutor provisioningExecutor(ProvisioningProperties properties) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.executorPoolSize());
        executor.setMaxPoolSize(properties.executorPoolSize());
        executor.setThreadNamePrefix("provisioning-");
        executor.setTaskDecorator(new CorrelationContextTaskDecorator());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    @Bean
    public ResilientProvisioningService resilientProvisioningService(HypervisorPort hypervisorPort,
                                                                     ProvisioningProperties properties) {
        return new ResilientProvisioningService(hypervisorPort, properties.retryPolicy());
    }

    @Bean
    public ProvisionVmHandler provisionVmHandler(MarkVmRequestProvisioningHandler markProvisioning,
                                                 MarkVmRequestReadyHandler markReady,
                                                 MarkVmRequestFailedHandler markFailed,
                                                 ResourceMappingRepository mappings,
                                                 ResourceMapper resourceMapper,
                                                 ResilientProvisioningService provisioningService,
                                                 SpanHelper spanHelper,
                                                 Clock clock) {
        return new ProvisionVmHandler(markProvisioning, markReady, markFailed, mappings, resourceMapper,
                provisioningService, spanHelper, clock);
    }

    @Bean
    public VmProvisioningSaga vmProvisioningSaga(VmRequestEventStream eventStream,
                                                 ProvisionVmHandler provisionVmHandler) {
        return new VmProvisioningSaga(eventStream, provisionVmHandler);
    }

    @Bean
    public VmProvisioningEventListener vmProvisioningEventListener(VmProvisioningSaga saga) {
        return new VmProvisioningEventListener(saga);
    }

    @Bean
    public SyncVmStatusHandler syncVmStatusHandler(HypervisorPort hypervisorPort,
                                                   JdbcVmRequestProjectionRepository projections,
                                                   CommandInstrumentation instrumentation,
                                                   Clock clock) {
        return new SyncVmStatusHandler(hypervisorPort, projections, projections, instrumentation, clock);
    }
}
