package com.hyperdesk.vmrequest.application.vmrequest;

import static com.hyperdesk.vmrequest.VmRequestTestData.ADMIN;
import static com.hyperdesk.vmrequest.VmRequestTestData.ADMIN_NAME;
import static com.hyperdesk.vmrequest.VmRequestTestData.OTHER_TENANT;
import static com.hyperdesk.vmrequest.VmRequestTestData.REQUESTER;
import static com.hyperdesk.vmrequest.VmRequestTestData.TENANT;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

import com.hyperdesk.vmrequest.HandlerFixture;
import com.hyperdesk.vmrequest.VmRequestTestData;
import com.hyperdesk.vmrequest.application.projection.NewTimelineEvent;
import com.hyperdesk.vmrequest.application.projection.VmRequestStatusUpdate;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("CancelVmRequestHandler")
class CancelVmRequestHandlerTest {

    private HandlerFixture fixture;
    private CancelVmRequestHandler handler;

    @BeforeEach
    void setUp() {
        fixture = new HandlerFixture();
        handler = new CancelVmRequestHandler(fixture.eventStream, fixture.ports, fixture.instrumentation);
    }

    private CancelVmRequestCommand cancel(VmRequestId id, String userId, String reason) {
        return new CancelVmRequestCommand(TENANT, userId, id, reason, "corr-cancel");
    }

    @Test
    @DisplayName("cancels a pending request of the requester")
    void cancelsPending() {
        var request = fixture.seed(VmRequestTestData.pendingRequest());

        var result = handler.handle(cancel(request.id(), REQUESTER, "Plans changed"));

        assertThat(result.value().version()).isEqualTo(2);
        assertThat(result.value().stateChanged()).isTrue();
        assertThat(fixture.eventStream.load(request.id()).value().status()).isEqualTo(VmRequestStatus.CANCELLED);

        var status = ArgumentCaptor.forClass(VmRequestStatusUpdate.class);
        verify(fixture.projections).updateStatus(status.capture());
        assertThat(status.getValue().status()).isEqualTo(VmRequestStatus.CANCELLED);
        assertThat(status.getValue().version()).isEqualTo(2);

        var timeline = ArgumentCaptor.forClass(NewTimelineEvent.class);
        verify(fixture.timeline).addTimelineEvent(timeline.capture());
        assertThat(timeline.getValue().details()).isEqualTo("Request cancelled: Plans changed");
    }

    @Test
    @DisplayName("omits the reason from the timeline when none is given")
    void timelineWithoutReason() {
        var request = fixture.seed(VmRequestTestData.pendingRequest());

        handler.handle(cancel(request.id(), REQUESTER, null));

        var timeline = ArgumentCaptor.forClass(NewTimelineEvent.class);
        verify(fixture.timeline).addTimelineEvent(timeline.capture());
        assertThat(timeline.getValue().details()).isEqualTo("Request cancelled");
    }

    @Test
    @DisplayName("a second cancel succeeds without appending or side effects")
    void idempotent() {
        var request = fixture.seed(VmRequestTestData.pendingRequest());
        handler.handle(cancel(request.id(), REQUESTER, null));

        var again = handler.handle(cancel(request.id(), REQUESTER, null));

        assertThat(again.value().stateChanged()).isFalse();
        assertThat(again.value().version()).isEqualTo(2);
        assertThat(fixture.eventStore.currentVersion(request.id().value())).isEqualTo(2);
        verify(fixture.publisher).publish(any());
    }

    @Test
    @DisplayName("only the requester may cancel")
    void otherUserForbidden() {
        var request = fixture.seed(VmRequestTestData.pendingRequest());

        var result = handler.handle(cancel(request.id(), "user-2", null));

        assertThat(result.error()).isInstanceOf(VmRequestError.Forbidden.class);
        assertThat(fixture.eventStore.currentVersion(request.id().value())).isEqualTo(1);
        verifyNoInteractions(fixture.projections, fixture.publisher);
    }

    @Test
    @DisplayName("an approved request can no longer be cancelled")
    void approvedIsInvalidState() {
        var request = fixture.seed(VmRequestTestData.approvedRequest());

        var result = handler.handle(cancel(request.id(), REQUESTER, null));

        assertThat(result.error()).isInstanceOfSatisfying(VmRequestError.InvalidState.class,
                error -> assertThat(error.currentState()).isEqualTo(VmRequestStatus.APPROVED));
        verify(fixture.publisher, never()).publish(any());
    }

    @Test
    @DisplayName("a rejected request can no longer be cancelled")
    void rejectedIsInvalidState() {
        var request = fixture.seed(VmRequestTestData.pendingRequest());
        var rejectHandler = new RejectVmRequestHandler(fixture.eventStream, fixture.ports, fixture.instrumentation);
        rejectHandler.handle(new RejectVmRequestCommand(TENANT, ADMIN, ADMIN_NAME, request.id(),
                "Use the shared staging cluster instead", null, "corr-reject"));

        var result = handler.handle(cancel(request.id(), REQUESTER, "Plans changed"));

        assertThat(result.error()).isInstanceOfSatisfying(VmRequestError.InvalidState.class,
                error -> assertThat(error.currentState()).isEqualTo(VmRequestStatus.REJECTED));
        assertThat(fixture.eventStore.currentVersion(request.id().value())).isEqualTo(2);
    }

    @Test
    @DisplayName("a request of another tenant is reported as not found")
    void otherTenantNotFound() {
        var request = fixture.seed(VmRequestTestData.pendingRequest());

        var result = handler.handle(new CancelVmRequestCommand(OTHER_TENANT, REQUESTER, request.id(), null,
                "corr-x"));

        assertThat(result.error()).isEqualTo(new VmRequestError.NotFound(request.id()));
    }

    @Test
    @DisplayName("an unknown id is reported as not found")
    void unknownNotFound() {
        var id = VmRequestId.generate();

        var result = handler.handle(cancel(id, REQUESTER, null));

        assertThat(result.error()).isEqualTo(new VmRequestError.NotFound(id));
        assertThat(fixture.outcomeCount(CancelVmRequestHandler.COMMAND, "NotFound")).isEqualTo(1);
    }
}
