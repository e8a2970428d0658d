package com.hyperdesk.vmrequest.config;

import com.hyperdesk.vmrequest.application.hypervisor.HypervisorPort;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.ResourceMapper;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.ResourceMappingRepository;
import com.hyperdesk.vmrequest.infrastructure.hypervisor.SimulatedHypervisorAdapter;
import com.hyperdesk.vmrequest.infrastructure.hypervisor.rest.RestHypervisorAdapter;
import com.hyperdesk.vmrequest.infrastructure.hypervisor.rest.RestHypervisorErrorMapper;
import com.hyperdesk.vmrequest.infrastructure.mapping.ConfiguredResourceMappingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

/** Selects the hypervisor backend from {@code hyperdesk.hypervisor.type}. */
@Configuration(proxyBeanMethods = false)
public class HypervisorConfig {

    private static final Logger log = LoggerFactory.getLogger(HypervisorConfig.class);

    @Bean
    public HypervisorPort hypervisorPort(HypervisorProperties properties, Clock clock) {
        return switch (properties.type()) {
            case SIMULATED -> {
                var simulated = properties.simulated();
                log.info("Using simulated hypervisor with {} vCPU / {} GB", simulated.totalCpu(),
                        simulated.totalMemoryGb());
                yield new SimulatedHypervisorAdapter(simulated.totalCpu(), simulated.totalMemoryGb(), clock);
            }
            case REST -> restAdapter(properties.rest(), clock);
        };
    }

    @Bean
    public ResourceMappingRepository resourceMappingRepository(HypervisorProperties properties) {
        var repository = new ConfiguredResourceMappingRepository(properties.resourceMappings());
        log.info("Loaded hypervisor resource mappings for {} tenant(s)", repository.size());
        return repository;
    }

    @Bean
    public ResourceMapper resourceMapper() {
        return new ResourceMapper();
    }

    private static RestHypervisorAdapter restAdapter(HypervisorProperties.Rest rest, Clock clock) {
        if (rest.baseUrl() == null || rest.baseUrl().isBlank()) {
            throw new IllegalStateException("hyperdesk.hypervisor.rest.base-url is required for the REST hypervisor");
        }
        var requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(rest.connectTimeout());
        requestFactory.setReadTimeout(rest.readTimeout());

        RestClient.Builder builder = RestClient.builder()
                .baseUrl(rest.baseUrl())
                .requestFactory(requestFactory);
        if (rest.apiToken() != null && !rest.apiToken().isBlank()) {
            builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + rest.apiToken());
        }
        log.info("Using REST hypervisor at {}", rest.baseUrl());
        return new RestHypervisorAdapter(builder.build(), new RestHypervisorErrorMapper(rest.readTimeout()),
                rest.baseUrl(), clock);
    }
}
