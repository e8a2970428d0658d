package com.hyperdesk.vmrequest.application.notification;

import com.hyperdesk.eventstore.Result;

/**
 * Fire-and-forget notifications to the requester. How they are delivered (mail, chat, queue)
 * is up to the implementation.
 */
public interface VmRequestNotificationSender {

    Result<Void, NotificationError> sendCreatedNotification(VmRequestCreatedNotification notification);

    Result<Void, NotificationError> sendApprovedNotification(VmRequestApprovedNotification notification);

    Result<Void, NotificationError> sendRejectedNotification(VmRequestRejectedNotification notification);
}
