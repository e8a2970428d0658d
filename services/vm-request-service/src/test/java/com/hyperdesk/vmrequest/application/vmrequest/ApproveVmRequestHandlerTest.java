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
import com.hyperdesk.vmrequest.application.notification.VmRequestApprovedNotification;
import com.hyperdesk.vmrequest.application.projection.VmRequestStatusUpdate;
import com.hyperdesk.vmrequest.domain.VmRequestId;
import com.hyperdesk.vmrequest.domain.VmRequestStatus;
import com.hyperdesk.vmrequest.domain.events.VmRequestApproved;
import com.hyperdesk.vmrequest.domain.events.VmRequestEvent;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

@DisplayName("ApproveVmRequestHandler")
class ApproveVmRequestHandlerTest {

    private HandlerFixture fixture;
    private ApproveVmRequestHandler handler;

    @BeforeEach
    void setUp() {
        fixture = new HandlerFixture();
        handler = new ApproveVmRequestHandler(fixture.eventStream, fixture.ports, fixture.instrumentation);
    }

    private ApproveVmRequestCommand approve(VmRequestId id, String adminId, Long expectedVersion) {
        return new ApproveVmRequestCommand(TENANT, adminId, ADMIN_NAME, id, expectedVersion, "corr-approve");
    }

    @Nested
    @DisplayName("on success")
    class OnSuccess {

        @Test
        @DisplayName("approves and records the approver on the projection")
        void approves() {
            var request = fixture.seed(VmRequestTestData.pendingRequest());

            var result = handler.handle(approve(request.id(), ADMIN, 1L));

            assertThat(result.value().version()).isEqualTo(2);
            var update = ArgumentCaptor.forClass(VmRequestStatusUpdate.class);
            verify(fixture.projections).updateStatus(update.capture());
            assertThat(update.getValue().status()).isEqualTo(VmRequestStatus.APPROVED);
            assertThat(update.getValue().approvedBy()).isEqualTo(ADMIN);
            assertThat(update.getValue().approvedByName()).isEqualTo(ADMIN_NAME);
        }

        @Test
        @DisplayName("notifies the requester and publishes the approval")
        @SuppressWarnings("unchecked")
        void notifiesAndPublishes() {
            var request = fixture.seed(VmRequestTestData.pendingRequest());

            handler.handle(approve(request.id(), ADMIN, null));

            var notification = ArgumentCaptor.forClass(VmRequestApprovedNotification.class);
            verify(fixture.notifications).sendApprovedNotification(notification.capture());
            assertThat(notification.getValue().approverName()).isEqualTo(ADMIN_NAME);

            ArgumentCaptor<List<VmRequestEvent>> published = ArgumentCaptor.forClass(List.class);
            verify(fixture.publisher).publish(published.capture());
            assertThat(published.getValue()).singleElement().isInstanceOf(VmRequestApproved.class);
        }
    }

    @Nested
    @DisplayName("on refusal")
    class OnRefusal {

        @Test
        @DisplayName("the requester cannot approve their own request")
        void selfApproval() {
            var request = fixture.seed(VmRequestTestData.pendingRequest());

            var result = handler.handle(approve(request.id(), REQUESTER, null));

            assertThat(result.error()).isInstanceOf(VmRequestError.Forbidden.class);
            assertThat(fixture.eventStore.currentVersion(request.id().value())).isEqualTo(1);
            verifyNoInteractions(fixture.publisher);
        }

        @Test
        @DisplayName("a stale expected version is a concurrency conflict")
        void staleVersion() {
            var request = fixture.seed(VmRequestTestData.pendingRequest());

            var result = handler.handle(approve(request.id(), ADMIN, 0L));

            assertThat(result.error()).isEqualTo(new VmRequestError.ConcurrencyConflict(0, 1));
            verify(fixture.projections, never()).updateStatus(any());
        }

        @Test
        @DisplayName("approving twice is an invalid state")
        void approveTwice() {
            var request = fixture.seed(VmRequestTestData.pendingRequest());
            handler.handle(approve(request.id(), ADMIN, null));

            var result = handler.handle(approve(request.id(), "admin-2", null));

            assertThat(result.error()).isInstanceOfSatisfying(VmRequestError.InvalidState.class,
                    error -> assertThat(error.currentState()).isEqualTo(VmRequestStatus.APPROVED));
            assertThat(fixture.outcomeCount(ApproveVmRequestHandler.COMMAND, "InvalidState")).isEqualTo(1);
        }

        @Test
        @DisplayName("an admin of another tenant gets not found")
        void otherTenant() {
            var request = fixture.seed(VmRequestTestData.pendingRequest());

            var result = handler.handle(new ApproveVmRequestCommand(OTHER_TENANT, ADMIN, ADMIN_NAME, request.id(),
                    null, "corr-x"));

            assertThat(result.error()).isInstanceOf(VmRequestError.NotFound.class);
        }
    }
}
