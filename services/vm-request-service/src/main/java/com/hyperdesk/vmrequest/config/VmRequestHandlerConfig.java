package com.hyperdesk.vmrequest.config;

import com.hyperdesk.eventstore.EventSerializer;
import com.hyperdesk.eventstore.EventStore;
import com.hyperdesk.vmrequest.application.notification.VmRequestNotificationSender;
import com.hyperdesk.vmrequest.application.vmrequest.ApproveVmRequestHandler;
import com.hyperdesk.vmrequest.application.vmrequest.CancelVmRequestHandler;
import com.hyperdesk.vmrequest.application.vmrequest.CommandInstrumentation;
import com.hyperdesk.vmrequest.application.vmrequest.CreateVmRequestHandler;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestFailedHandler;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestProvisioningHandler;
import com.hyperdesk.vmrequest.application.vmrequest.MarkVmRequestReadyHandler;
import com.hyperdesk.vmrequest.application.vmrequest.QuotaChecker;
import com.hyperdesk.vmrequest.application.vmrequest.RejectVmRequestHandler;
import com.hyperdesk.vmrequest.application.vmrequest.VmRequestEventPublisher;
import com.hyperdesk.vmrequest.application.vmrequest.VmRequestEventStream;
import com.hyperdesk.vmrequest.application.vmrequest.VmRequestProjectionRebuilder;
import com.hyperdesk.vmrequest.application.vmrequest.VmRequestSideEffectPorts;
import com.hyperdesk.vmrequest.infrastructure.messaging.SpringVmRequestEventPublisher;
import com.hyperdesk.vmrequest.infrastructure.notification.LoggingVmRequestNotificationSender;
import com.hyperdesk.vmrequest.infrastructure.persistence.JdbcTimelineEventRepository;
import com.hyperdesk.vmrequest.infrastructure.persistence.JdbcVmRequestProjectionRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;

/** Command handlers and the ports they write to after a successful append. */
@Configuration(proxyBeanMethods = false)
public class VmRequestHandlerConfig {

    @Bean
    public JdbcVmRequestProjectionRepository vmRequestProjectionRepository(NamedParameterJdbcTemplate jdbc) {
        return new JdbcVmRequestProjectionRepository(jdbc);
    }

    @Bean
    public JdbcTimelineEventRepository timelineEventRepository(NamedParameterJdbcTemplate jdbc) {
        return new JdbcTimelineEventRepository(jdbc);
    }

    @Bean
    @ConditionalOnMissingBean
    public VmRequestNotificationSender vmRequestNotificationSender() {
        return new LoggingVmRequestNotificationSender();
    }

    @Bean
    @ConditionalOnMissingBean
    public QuotaChecker quotaChecker() {
        return QuotaChecker.alwaysAllow();
    }

    @Bean
    public VmRequestEventPublisher vmRequestEventPublisher(ApplicationEventPublisher applicationEventPublisher) {
        return new SpringVmRequestEventPublisher(applicationEventPublisher);
    }

    @Bean
    public VmRequestSideEffectPorts vmRequestSideEffectPorts(JdbcVmRequestProjectionRepository projections,
                                                             JdbcTimelineEventRepository timeline,
                                                             VmRequestNotificationSender notifications,
                                                             VmRequestEventPublisher publisher) {
        return new VmRequestSideEffectPorts(projections, timeline, notifications, publisher);
    }

    @Bean
    public VmRequestEventStream vmRequestEventStream(EventStore eventStore, EventSerializer serializer) {
        return new VmRequestEventStream(eventStore, serializer);
    }

    @Bean
    public CreateVmRequestHandler createVmRequestHandler(VmRequestEventStream stream, VmRequestSideEffectPorts ports,
                                                         CommandInstrumentation instrumentation,
                                                         QuotaChecker quotaChecker) {
        return new CreateVmRequestHandler(stream, ports, instrumentation, quotaChecker);
    }

    @Bean
    public CancelVmRequestHandler cancelVmRequestHandler(VmRequestEventStream stream, VmRequestSideEffectPorts ports,
                                                         CommandInstrumentation instrumentation) {
        return new CancelVmRequestHandler(stream, ports, instrumentation);
    }

    @Bean
    public ApproveVmRequestHandler approveVmRequestHandler(VmRequestEventStream stream,
                                                           VmRequestSideEffectPorts ports,
                                                           CommandInstrumentation instrumentation) {
        return new ApproveVmRequestHandler(stream, ports, instrumentation);
    }

    @Bean
    public RejectVmRequestHandler rejectVmRequestHandler(VmRequestEventStream stream, VmRequestSideEffectPorts ports,
                                                         CommandInstrumentation instrumentation) {
        return new RejectVmRequestHandler(stream, ports, instrumentation);
    }

    @Bean
    public MarkVmRequestProvisioningHandler markVmRequestProvisioningHandler(VmRequestEventStream stream,
                                                                             VmRequestSideEffectPorts ports,
                                                                             CommandInstrumentation instrumentation) {
        return new MarkVmRequestProvisioningHandler(stream, ports, instrumentation);
    }

    @Bean
    public MarkVmRequestReadyHandler markVmRequestReadyHandler(VmRequestEventStream stream,
                                                               VmRequestSideEffectPorts ports,
                                                               CommandInstrumentation instrumentation) {
        return new MarkVmRequestReadyHandler(stream, ports, instrumentation);
    }

    @Bean
    public MarkVmRequestFailedHandler markVmRequestFailedHandler(VmRequestEventStream stream,
                                                                 VmRequestSideEffectPorts ports,
                                                                 CommandInstrumentation instrumentation) {
        return new MarkVmRequestFailedHandler(stream, ports, instrumentation);
    }

    @Bean
    public VmRequestProjectionRebuilder vmRequestProjectionRebuilder(VmRequestEventStream stream,
                                                                     JdbcVmRequestProjectionRepository projections) {
        return new VmRequestProjectionRebuilder(stream, projections);
    }
}
