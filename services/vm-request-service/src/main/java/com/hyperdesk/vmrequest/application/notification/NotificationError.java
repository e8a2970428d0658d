package com.hyperdesk.vmrequest.application.notification;

/** Why a notification was not delivered. Callers log it; it never fails a command. */
public sealed interface NotificationError {

    String message();

    record SendFailure(String message) implements NotificationError {}

    record TemplateError(String templateName, String message) implements NotificationError {}
}
