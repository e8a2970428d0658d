package com.hyperdesk.vmrequest.application.vmrequest;

import static com.hyperdesk.vmrequest.VmRequestTestData.ADMIN;
import static com.hyperdesk.vmrequest.VmRequestTestData.ADMIN_NAME;
import static com.hyperdesk.vmrequest.VmRequestTestData.OTHER_TENANT;
import static com.hyperdesk.vmrequest.VmRequestTestData.TENANT;
import static com.hyperdesk.vmrequest.VmRequestTestData.metadata;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.HandlerFixture;
import com.hyperdesk.vmrequest.VmRequestTestData;
import com.hyperdesk.vmrequest.application.projection.NewVmRequestProjection;
import com.hyperdesk.vmrequest.application.projection.ProjectionError;
import com.hyperdesk.vmrequest.application.projection.VmDetailsUpdate;
import com.hyperdesk.vmrequest.application.projection.VmRequestStatusUpdate;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("VmRequestProjectionRebuilder")
class VmRequestProjectionRebuilderTest {

    private HandlerFixture fixture;
    private VmRequestProjectionRebuilder rebuilder;

    @BeforeEach
    void setUp() {
        fixture = new HandlerFixture();
        rebuilder = new VmRequestProjectionRebuilder(fixture.eventStream, fixture.projections);
    }

    @Test
    @DisplayName("rewrites a ready request with approver and VM details")
    void rebuildsReadyRequest() throws Exception {
        var request = VmRequestTestData.provisioningRequest();
        request.markReady("vm-42", "10.0.0.5", "web-01", Instant.parse("2026-01-01T10:10:00Z"), null,
                metadata("system:provisioning"));
        fixture.seed(request);

        var result = rebuilder.rebuild(TENANT, request.id());

        assertThat(result.value()).isEqualTo(4L);
        var inserted = ArgumentCaptor.forClass(NewVmRequestProjection.class);
        verify(fixture.projections).insert(inserted.capture());
        assertThat(inserted.getValue().status()).isEqualTo(VmRequestStatus.PENDING);

        var status = ArgumentCaptor.forClass(VmRequestStatusUpdate.class);
        verify(fixture.projections).updateStatus(status.capture());
        assertThat(status.getValue().status()).isEqualTo(VmRequestStatus.READY);
        assertThat(status.getValue().approvedBy()).isEqualTo(ADMIN);
        assertThat(status.getValue().approvedByName()).isEqualTo(ADMIN_NAME);
        assertThat(status.getValue().version()).isEqualTo(4);

        var details = ArgumentCaptor.forClass(VmDetailsUpdate.class);
        verify(fixture.projections).updateVmDetails(details.capture());
        assertThat(details.getValue().hypervisorVmId()).isEqualTo("vm-42");
    }

    @Test
    @DisplayName("carries rejection details")
    void rebuildsRejectedRequest() throws Exception {
        var request = VmRequestTestData.pendingRequest();
        request.reject("Out of budget for this quarter", ADMIN_NAME, metadata(ADMIN));
        fixture.seed(request);

        rebuilder.rebuild(TENANT, request.id());

        var status = ArgumentCaptor.forClass(VmRequestStatusUpdate.class);
        verify(fixture.projections).updateStatus(status.capture());
        assertThat(status.getValue().rejectedBy()).isEqualTo(ADMIN);
        assertThat(status.getValue().rejectionReason()).isEqualTo("Out of budget for this quarter");
        verify(fixture.projections, never()).updateVmDetails(any());
    }

    @Test
    @DisplayName("refuses to rebuild a request of another tenant")
    void otherTenant() {
        var request = fixture.seed(VmRequestTestData.pendingRequest());

        var result = rebuilder.rebuild(OTHER_TENANT, request.id());

        assertThat(result.error()).isInstanceOf(VmRequestError.NotFound.class);
        verify(fixture.projections, never()).insert(any());
    }

    @Test
    @DisplayName("stops at the first projection failure")
    void projectionFailure() {
        var request = fixture.seed(VmRequestTestData.approvedRequest());
        when(fixture.projections.insert(any()))
                .thenReturn(Result.failure(new ProjectionError.DatabaseError("table missing")));

        var result = rebuilder.rebuild(TENANT, request.id());

        assertThat(result.error()).isEqualTo(new VmRequestError.PersistenceFailure("table missing"));
        verify(fixture.projections, never()).updateStatus(any());
    }
}
