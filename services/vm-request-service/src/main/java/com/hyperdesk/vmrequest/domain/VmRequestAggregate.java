package com.hyperdesk.vmrequest.domain;

import com.hyperdesk.eventstore.AggregateRoot;
import com.hyperdesk.eventstore.DomainEvent;
import com.hyperdesk.eventstore.EventMetadata;
import com.hyperdesk.vmrequest.domain.events.VmRequestApproved;
import com.hyperdesk.vmrequest.domain.events.VmRequestCancelled;
import com.hyperdesk.vmrequest.domain.events.VmRequestCreated;
import com.hyperdesk.vmrequest.domain.events.VmRequestProvisioningFailed;
import com.hyperdesk.vmrequest.domain.events.VmRequestProvisioningStarted;
import com.hyperdesk.vmrequest.domain.events.VmRequestReady;
import com.hyperdesk.vmrequest.domain.events.VmRequestRejected;

import java.time.Instant;
import java.util.List;

/**
 * Event-sourced VM request.
 * <p>
 * Lifecycle: {@code PENDING -> APPROVED | REJECTED | CANCELLED}, {@code APPROVED -> PROVISIONING},
 * {@code PROVISIONING -> READY | FAILED}. Repeating the transition into the terminal state the
 * request is already in is a no-op that produces no event.
 * <p>
 * Every operation either applies completely or throws before touching state. Authorization
 * beyond separation of duties (who may cancel, tenant ownership) is the command handler's job.
 */
public final class VmRequestAggregate extends AggregateRoot<VmRequestId> {

    public static final int MIN_JUSTIFICATION_LENGTH = 10;

    private final VmRequestId id;

    private String tenantId;
    private String requesterId;
    private String requesterName;
    private ProjectId projectId;
    private String projectName;
    private VmName vmName;
    private VmSize size;
    private String justification;
    private String requesterEmail;
    private VmRequestStatus status;
    private Instant createdAt;

    private VmRequestAggregate(VmRequestId id) {
        this.id = id;
    }

    /**
     * Opens a new request in {@code PENDING}.
     *
     * @throws IllegalArgumentException if the justification is shorter than
     *                                  {@value #MIN_JUSTIFICATION_LENGTH} characters
     */
    public static VmRequestAggregate create(String requesterId,
                                            String requesterName,
                                            ProjectId projectId,
                                            String projectName,
                                            VmName vmName,
                                            VmSize size,
                                            String justification,
                                            String requesterEmail,
                                            EventMetadata metadata) {
        if (justification == null || justification.trim().length() < MIN_JUSTIFICATION_LENGTH) {
            throw new IllegalArgumentException(
                    "Justification must be at least " + MIN_JUSTIFICATION_LENGTH + " characters");
        }
        if (requesterId == null || requesterId.isBlank()) {
            throw new IllegalArgumentException("requesterId must not be blank");
        }

        var aggregate = new VmRequestAggregate(VmRequestId.generate());
        aggregate.applyEvent(new VmRequestCreated(
                aggregate.id.value(),
                projectId.value(),
                projectName,
                requesterId,
                requesterName,
                vmName.value(),
                size,
                justification.trim(),
                requesterEmail,
                metadata));
        return aggregate;
    }

    /** Rebuilds the request by folding its stream in order. */
    public static VmRequestAggregate reconstitute(VmRequestId id, List<? extends DomainEvent> history) {
        var aggregate = new VmRequestAggregate(id);
        history.forEach(aggregate::replay);
        return aggregate;
    }

    /**
     * Withdraws a pending request. No-op if already cancelled.
     *
     * @throws InvalidStateException    from any state other than {@code PENDING} or {@code CANCELLED}
     * @throws IllegalArgumentException if the reason is too long
     */
    public void cancel(String reason, EventMetadata metadata) throws InvalidStateException {
        if (status == VmRequestStatus.CANCELLED) {
            return;
        }
        requireStatus(VmRequestStatus.PENDING, "cancel");
        if (reason != null && reason.length() > VmRequestCancelled.MAX_REASON_LENGTH) {
            throw new IllegalArgumentException(
                    "Cancellation reason must not exceed " + VmRequestCancelled.MAX_REASON_LENGTH + " characters");
        }
        applyEvent(new VmRequestCancelled(id.value(), reason, metadata));
    }

    /**
     * Approves a pending request. The approver is {@code metadata.userId()}.
     *
     * @throws SelfApprovalException if the approver is the requester
     * @throws InvalidStateException if the request is not {@code PENDING}
     */
    public void approve(String approverName, EventMetadata metadata)
            throws SelfApprovalException, InvalidStateException {
        requireNotRequester(metadata.userId(), "approve");
        requireStatus(VmRequestStatus.PENDING, "approve");
        applyEvent(new VmRequestApproved(
                id.value(), vmName.value(), projectId.value(), requesterId, requesterEmail, approverName, metadata));
    }

    /**
     * Rejects a pending request with a mandatory reason. No-op if already rejected.
     *
     * @throws SelfApprovalException    if the rejecting admin is the requester
     * @throws InvalidStateException    if the request is neither {@code PENDING} nor {@code REJECTED}
     * @throws IllegalArgumentException if the reason length is out of bounds
     */
    public void reject(String reason, String rejectorName, EventMetadata metadata)
            throws SelfApprovalException, InvalidStateException {
        requireNotRequester(metadata.userId(), "reject");
        if (status == VmRequestStatus.REJECTED) {
            return;
        }
        requireStatus(VmRequestStatus.PENDING, "reject");
        if (reason == null
                || reason.trim().length() < VmRequestRejected.MIN_REASON_LENGTH
                || reason.length() > VmRequestRejected.MAX_REASON_LENGTH) {
            throw new IllegalArgumentException("Rejection reason must be between "
                    + VmRequestRejected.MIN_REASON_LENGTH + " and " + VmRequestRejected.MAX_REASON_LENGTH
                    + " characters");
        }
        applyEvent(new VmRequestRejected(
                id.value(), reason, vmName.value(), projectId.value(), requesterId, requesterEmail,
                rejectorName, metadata));
    }

    /**
     * Starts provisioning. Valid only once, from {@code APPROVED}.
     *
     * @throws InvalidStateException from any other state
     */
    public void markProvisioning(EventMetadata metadata) throws InvalidStateException {
        requireStatus(VmRequestStatus.APPROVED, "markProvisioning");
        applyEvent(new VmRequestProvisioningStarted(id.value(), metadata));
    }

    /**
     * Records the created VM. No-op if already ready.
     *
     * @throws InvalidStateException if the request is not {@code PROVISIONING}
     */
    public void markReady(String hypervisorVmId,
                          String ipAddress,
                          String hostname,
                          Instant provisionedAt,
                          String warningMessage,
                          EventMetadata metadata) throws InvalidStateException {
        if (status == VmRequestStatus.READY) {
            return;
        }
        requireStatus(VmRequestStatus.PROVISIONING, "markReady");
        applyEvent(new VmRequestReady(
                id.value(), hypervisorVmId, ipAddress, hostname, provisionedAt, warningMessage, metadata));
    }

    /**
     * Records that provisioning gave up. No-op if already failed.
     *
     * @throws InvalidStateException if the request is not {@code PROVISIONING}
     */
    public void markFailed(String errorCode,
                           String reason,
                           boolean retriable,
                           int retryCount,
                           Instant lastAttemptAt,
                           EventMetadata metadata) throws InvalidStateException {
        if (status == VmRequestStatus.FAILED) {
            return;
        }
        requireStatus(VmRequestStatus.PROVISIONING, "markFailed");
        applyEvent(new VmRequestProvisioningFailed(
                id.value(), errorCode, reason, retriable, retryCount, lastAttemptAt, metadata));
    }

    @Override
    protected void handleEvent(DomainEvent event) {
        if (event instanceof VmRequestCreated created) {
            tenantId = created.metadata().tenantId();
            requesterId = created.requesterId();
            requesterName = created.requesterName();
            projectId = new ProjectId(created.projectId());
            projectName = created.projectName();
            vmName = new VmName(created.vmName());
            size = created.size();
            justification = created.justification();
            requesterEmail = created.requesterEmail();
            createdAt = created.metadata().timestamp();
            status = VmRequestStatus.PENDING;
        } else if (event instanceof VmRequestCancelled) {
            status = VmRequestStatus.CANCELLED;
        } else if (event instanceof VmRequestApproved) {
            status = VmRequestStatus.APPROVED;
        } else if (event instanceof VmRequestRejected) {
            status = VmRequestStatus.REJECTED;
        } else if (event instanceof VmRequestProvisioningStarted) {
            status = VmRequestStatus.PROVISIONING;
        } else if (event instanceof VmRequestReady) {
            status = VmRequestStatus.READY;
        } else if (event instanceof VmRequestProvisioningFailed) {
            status = VmRequestStatus.FAILED;
        } else {
            throw new IllegalArgumentException("Not a VM request event: " + event.getClass().getName());
        }
    }

    private void requireStatus(VmRequestStatus expected, String operation) throws InvalidStateException {
        if (status != expected) {
            throw new InvalidStateException(status, expected, operation);
        }
    }

    private void requireNotRequester(String adminId, String operation) throws SelfApprovalException {
        if (requesterId != null && requesterId.equals(adminId)) {
            throw new SelfApprovalException(adminId, operation);
        }
    }

    @Override
    public VmRequestId id() {
        return id;
    }

    public String tenantId() {
        return tenantId;
    }

    public String requesterId() {
        return requesterId;
    }

    public String requesterName() {
        return requesterName;
    }

    public ProjectId projectId() {
        return projectId;
    }

    public String projectName() {
        return projectName;
    }

    public VmName vmName() {
        return vmName;
    }

    public VmSize size() {
        return size;
    }

    public String justification() {
        return justification;
    }

    public String requesterEmail() {
        return requesterEmail;
    }

    public VmRequestStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }
}
