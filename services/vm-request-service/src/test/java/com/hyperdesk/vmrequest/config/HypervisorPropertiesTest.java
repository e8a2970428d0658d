package com.hyperdesk.vmrequest.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.hyperdesk.vmrequest.application.hypervisor.HypervisorType;
import java.time.Duration;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("HypervisorProperties")
class HypervisorPropertiesTest {

    @Test
    @DisplayName("defaults to the simulated backend with default capacity and timeouts")
    void defaults() {
        var props = new HypervisorProperties(null, null, null, null);

        assertThat(props.type()).isEqualTo(HypervisorType.SIMULATED);
        assertThat(props.simulated().totalCpu()).isEqualTo(64);
        assertThat(props.simulated().totalMemoryGb()).isEqualTo(256);
        assertThat(props.rest().connectTimeout()).isEqualTo(Duration.ofSeconds(5));
        assertThat(props.rest().readTimeout()).isEqualTo(Duration.ofSeconds(60));
        assertThat(props.resourceMappings()).isEmpty();
    }

    @Test
    @DisplayName("turns tenant mappings into resource mappings keyed by tenant")
    void resourceMappings() {
        var props = new HypervisorProperties(HypervisorType.REST, null, null, Map.of("acme",
                new HypervisorProperties.TenantMapping("cluster-a", "ds-01", "ubuntu-22.04",
                        Map.of("default", "net-100"), "default")));

        assertThat(props.resourceMappings()).singleElement().satisfies(mapping -> {
            assertThat(mapping.tenantId()).isEqualTo("acme");
            assertThat(mapping.computeTarget()).isEqualTo("cluster-a");
            assertThat(mapping.networks()).containsEntry("default", "net-100");
        });
    }

    @Test
    @DisplayName("never prints the API token")
    void masksToken() {
        var rest = new HypervisorProperties.Rest("https://hv.example.test", "s3cr3t", null, null);

        assertThat(rest.toString()).doesNotContain("s3cr3t").contains("apiToken=***");
    }
}
