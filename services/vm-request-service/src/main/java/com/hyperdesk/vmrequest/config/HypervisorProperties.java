package com.hyperdesk.vmrequest.config;

import com.hyperdesk.vmrequest.application.hypervisor.HypervisorType;
import com.hyperdesk.vmrequest.application.hypervisor.mapping.TenantResourceMapping;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Hypervisor backend selection and per-tenant resource mappings, bound from
 * {@code hyperdesk.hypervisor.*}.
 *
 * <pre>
 * hyperdesk:
 *   hypervisor:
 *     type: REST
 *     rest:
 *       base-url: https://hv.example.internal
 *       api-token: ${HYPERVISOR_API_TOKEN}
 *     tenant-mappings:
 *       acme:
 *         compute-target: cluster-a
 *         datastore: ds-01
 *         template: ubuntu-22.04
 *         default-network: default
 *         networks:
 *           default: net-100
 * </pre>
 */
@ConfigurationProperties(prefix = "hyperdesk.hypervisor")
@Validated
public record HypervisorProperties(
        @NotNull HypervisorType type,
        @Valid Rest rest,
        @Valid Simulated simulated,
        Map<String, TenantMapping> tenantMappings) {

    public HypervisorProperties {
        if (type == null) {
            type = HypervisorType.SIMULATED;
        }
        if (rest == null) {
            rest = new Rest(null, null, null, null);
        }
        if (simulated == null) {
            simulated = new Simulated(0, 0);
        }
        tenantMappings = tenantMappings == null ? Map.of() : Map.copyOf(tenantMappings);
    }

    public List<TenantResourceMapping> resourceMappings() {
        return tenantMappings.entrySet().stream()
                .map(entry -> entry.getValue().toMapping(entry.getKey()))
                .toList();
    }

    /**
     * @param apiToken sent as a bearer token; never logged
     */
    public record Rest(String baseUrl, String apiToken, Duration connectTimeout, Duration readTimeout) {

        public Rest {
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(60);
            }
        }

        @Override
        public String toString() {
            return "Rest[baseUrl=" + baseUrl + ", apiToken=***, connectTimeout=" + connectTimeout
                    + ", readTimeout=" + readTimeout + "]";
        }
    }

    public record Simulated(int totalCpu, int totalMemoryGb) {

        public Simulated {
            if (totalCpu <= 0) {
                totalCpu = 64;
            }
            if (totalMemoryGb <= 0) {
                totalMemoryGb = 256;
            }
        }
    }

    public record TenantMapping(String computeTarget, String datastore, String template,
                                Map<String, String> networks, String defaultNetwork) {

        TenantResourceMapping toMapping(String tenantId) {
            return new TenantResourceMapping(tenantId, computeTarget, datastore, template, networks, defaultNetwork);
        }
    }
}
