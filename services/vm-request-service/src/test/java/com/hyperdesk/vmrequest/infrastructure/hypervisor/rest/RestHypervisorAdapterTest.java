package com.hyperdesk.vmrequest.infrastructure.hypervisor.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.client.ExpectedCount.never;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withException;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.hyperdesk.vmrequest.application.hypervisor.HypervisorError;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorType;
import com.hyperdesk.vmrequest.application.hypervisor.HypervisorVmSpec;
import com.hyperdesk.vmrequest.application.hypervisor.ResourceKind;
import com.hyperdesk.vmrequest.application.hypervisor.ResourceNode;
import com.hyperdesk.vmrequest.application.hypervisor.VmPowerState;
import java.net.ConnectException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

@DisplayName("RestHypervisorAdapter")
class RestHypervisorAdapterTest {

    private static final String BASE_URL = "https://hv.example.test";
    private static final Instant NOW = Instant.parse("2026-01-01T12:00:00Z");

    private MockRestServiceServer server;
    private RestHypervisorAdapter adapter;

    @BeforeEach
    void setUp() {
        RestClient.Builder builder = RestClient.builder()
                .baseUrl(BASE_URL)
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer token-1");
        server = MockRestServiceServer.bindTo(builder).build();
        adapter = new RestHypervisorAdapter(builder.build(), new RestHypervisorErrorMapper(Duration.ofSeconds(30)),
                BASE_URL, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    private static HypervisorVmSpec spec(int cpu, int memoryGb) {
        return new HypervisorVmSpec("web-01", "web-01", "ubuntu-22.04", cpu, memoryGb, 100,
                "cluster-a", "ds-01", "net-100");
    }

    @Test
    @DisplayName("testConnection reads the API version")
    void testConnection() {
        server.expect(requestTo(BASE_URL + "/api/v1/status"))
                .andExpect(header(HttpHeaders.AUTHORIZATION, "Bearer token-1"))
                .andRespond(withSuccess("{\"version\":\"7.2\"}", MediaType.APPLICATION_JSON));

        var info = adapter.testConnection().value();

        assertThat(info.type()).isEqualTo(HypervisorType.REST);
        assertThat(info.version()).isEqualTo("7.2");
        server.verify();
    }

    @Test
    @DisplayName("listResources converts the resource tree")
    void listResources() {
        server.expect(requestTo(BASE_URL + "/api/v1/resources"))
                .andRespond(withSuccess("""
                        [{"id":"dc-1","name":"DC","kind":"datacenter","children":[
                          {"id":"c-1","name":"Cluster","kind":"cluster"},
                          {"id":"ds-1","name":"Store","kind":"datastore"},
                          {"id":"n-1","name":"Net","kind":"portgroup"}]}]
                        """, MediaType.APPLICATION_JSON));

        var nodes = adapter.listResources().value();

        assertThat(nodes).hasSize(1);
        assertThat(nodes.get(0).kind()).isEqualTo(ResourceKind.SITE);
        assertThat(nodes.get(0).children().stream().map(ResourceNode::kind).toList())
                .containsExactly(ResourceKind.COMPUTE, ResourceKind.STORAGE, ResourceKind.NETWORK);
    }

    @Nested
    @DisplayName("createVm")
    class CreateVm {

        @Test
        @DisplayName("posts the VM definition and returns the created VM")
        void creates() {
            server.expect(requestTo(BASE_URL + "/api/v1/vms"))
                    .andExpect(method(HttpMethod.POST))
                    .andExpect(jsonPath("$.name").value("web-01"))
                    .andExpect(jsonPath("$.cpu").value(4))
                    .andExpect(jsonPath("$.networkId").value("net-100"))
                    .andRespond(withStatus(HttpStatus.CREATED).contentType(MediaType.APPLICATION_JSON).body("""
                            {"id":"vm-901","name":"web-01","ipAddress":"10.1.2.3","hostname":"web-01.corp",
                             "createdAt":"2026-01-01T11:59:00Z","warning":"guest tools outdated"}
                            """));

            var result = adapter.createVm(spec(4, 8)).value();

            assertThat(result.vmId()).isEqualTo("vm-901");
            assertThat(result.ipAddress()).isEqualTo("10.1.2.3");
            assertThat(result.hostname()).isEqualTo("web-01.corp");
            assertThat(result.provisionedAt()).isEqualTo(Instant.parse("2026-01-01T11:59:00Z"));
            assertThat(result.warningMessage()).isEqualTo("guest tools outdated");
            server.verify();
        }

        @Test
        @DisplayName("falls back to the requested hostname and the clock when the API omits them")
        void fallbacks() {
            server.expect(requestTo(BASE_URL + "/api/v1/vms"))
                    .andRespond(withSuccess("{\"id\":\"vm-902\"}", MediaType.APPLICATION_JSON));

            var result = adapter.createVm(spec(2, 4)).value();

            assertThat(result.hostname()).isEqualTo("web-01");
            assertThat(result.provisionedAt()).isEqualTo(NOW);
            assertThat(result.ipAddress()).isNull();
        }

        @Test
        @DisplayName("a response without id is an unknown error")
        void missingId() {
            server.expect(requestTo(BASE_URL + "/api/v1/vms"))
                    .andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

            assertThat(adapter.createVm(spec(2, 4)).error()).isInstanceOf(HypervisorError.UnknownError.class);
        }

        @Test
        @DisplayName("a size beyond the per-VM limit is rejected without calling the API")
        void oversized() {
            server.expect(never(), requestTo(BASE_URL + "/api/v1/vms"));

            var error = adapter.createVm(spec(128, 8)).error();

            assertThat(error).isInstanceOf(HypervisorError.InvalidVmSpec.class);
            server.verify();
        }

        @Test
        @DisplayName("a name conflict maps to ResourceAlreadyExists")
        void conflict() {
            server.expect(requestTo(BASE_URL + "/api/v1/vms"))
                    .andRespond(withStatus(HttpStatus.CONFLICT).contentType(MediaType.APPLICATION_JSON)
                            .body("{\"message\":\"exists\"}"));

            assertThat(adapter.createVm(spec(2, 4)).error())
                    .isEqualTo(new HypervisorError.ResourceAlreadyExists("vm", "web-01"));
        }

        @Test
        @DisplayName("a server error maps to a retriable OperationFailed")
        void serverError() {
            server.expect(requestTo(BASE_URL + "/api/v1/vms"))
                    .andRespond(withStatus(HttpStatus.SERVICE_UNAVAILABLE));

            var error = adapter.createVm(spec(2, 4)).error();

            assertThat(error).isInstanceOf(HypervisorError.OperationFailed.class);
            assertThat(error.retriable()).isTrue();
        }

        @Test
        @DisplayName("an unreachable API maps to ConnectionFailed")
        void unreachable() {
            server.expect(requestTo(BASE_URL + "/api/v1/vms"))
                    .andRespond(withException(new ConnectException("Connection refused")));

            assertThat(adapter.createVm(spec(2, 4)).error()).isInstanceOf(HypervisorError.ConnectionFailed.class);
        }
    }

    @Nested
    @DisplayName("VM lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("getVm maps the power state")
        void getVm() {
            server.expect(requestTo(BASE_URL + "/api/v1/vms/vm-1"))
                    .andRespond(withSuccess("""
                            {"id":"vm-1","name":"web-01","powerState":"Running","cpu":2,"memoryGb":4}
                            """, MediaType.APPLICATION_JSON));

            var vm = adapter.getVm("vm-1").value();

            assertThat(vm.powerState()).isEqualTo(VmPowerState.POWERED_ON);
            assertThat(vm.cpuCores()).isEqualTo(2);
        }

        @Test
        @DisplayName("getVm of a missing VM maps to ResourceNotFound")
        void getMissingVm() {
            server.expect(requestTo(BASE_URL + "/api/v1/vms/vm-404"))
                    .andRespond(withStatus(HttpStatus.NOT_FOUND));

            assertThat(adapter.getVm("vm-404").error()).isEqualTo(new HypervisorError.ResourceNotFound("vm", "vm-404"));
        }

        @Test
        @DisplayName("start, stop, delete and migrate call their endpoints")
        void powerOperations() {
            server.expect(requestTo(BASE_URL + "/api/v1/vms/vm-1/start")).andExpect(method(HttpMethod.POST))
                    .andRespond(withSuccess());
            server.expect(requestTo(BASE_URL + "/api/v1/vms/vm-1/stop")).andExpect(method(HttpMethod.POST))
                    .andRespond(withSuccess());
            server.expect(requestTo(BASE_URL + "/api/v1/vms/vm-1/migrate"))
                    .andExpect(jsonPath("$.targetComputeId").value("cluster-b"))
                    .andRespond(withSuccess());
            server.expect(requestTo(BASE_URL + "/api/v1/vms/vm-1")).andExpect(method(HttpMethod.DELETE))
                    .andRespond(withSuccess());

            assertThat(adapter.startVm("vm-1").isSuccess()).isTrue();
            assertThat(adapter.stopVm("vm-1").isSuccess()).isTrue();
            assertThat(adapter.migrateVm("vm-1", "cluster-b").isSuccess()).isTrue();
            assertThat(adapter.deleteVm("vm-1").isSuccess()).isTrue();
            server.verify();
        }

        @Test
        @DisplayName("snapshots are not supported")
        void snapshotsUnsupported() {
            assertThat(adapter.createSnapshot("vm-1", "snap").error())
                    .isEqualTo(new HypervisorError.OperationNotSupported("createSnapshot", HypervisorType.REST));
        }
    }
}
