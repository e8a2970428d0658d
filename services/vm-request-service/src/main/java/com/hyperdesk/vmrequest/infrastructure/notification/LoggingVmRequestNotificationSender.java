package com.hyperdesk.vmrequest.infrastructure.notification;

import com.hyperdesk.eventstore.Result;
import com.hyperdesk.vmrequest.application.notification.NotificationError;
import com.hyperdesk.vmrequest.application.notification.VmRequestApprovedNotification;
import com.hyperdesk.vmrequest.application.notification.VmRequestCreatedNotification;
import com.hyperdesk.vmrequest.application.notification.VmRequestNotificationSender;
import com.hyperdesk.vmrequest.application.notification.VmRequestRejectedNotification;
import com.hyperdesk.vmrequest.domain.EmailAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.util.Map;

/**
 * Renders notification mails from the plain-text Thymeleaf templates under
 * {@code templates/email/} and writes them to the log instead of sending them. Used where no mail
 * transport is configured.
 */
public class LoggingVmRequestNotificationSender implements VmRequestNotificationSender {

    private static final Logger log = LoggerFactory.getLogger(LoggingVmRequestNotificationSender.class);

    static final String CREATED_TEMPLATE = "vm-request-created";
    static final String APPROVED_TEMPLATE = "vm-request-approved";
    static final String REJECTED_TEMPLATE = "vm-request-rejected";

    private final TemplateEngine templateEngine;

    public LoggingVmRequestNotificationSender() {
        this.templateEngine = createTemplateEngine();
        log.warn("No mail transport configured, VM request notifications are only logged");
    }

    @Override
    public Result<Void, NotificationError> sendCreatedNotification(VmRequestCreatedNotification notification) {
        return send(notification.tenantId(), notification.requesterEmail(),
                "VM request submitted: " + notification.vmName(), CREATED_TEMPLATE,
                Map.of("vmName", notification.vmName(),
                        "size", notification.size().name(),
                        "projectName", String.valueOf(notification.projectName())));
    }

    @Override
    public Result<Void, NotificationError> sendApprovedNotification(VmRequestApprovedNotification notification) {
        return send(notification.tenantId(), notification.requesterEmail(),
                "VM request approved: " + notification.vmName(), APPROVED_TEMPLATE,
                Map.of("vmName", notification.vmName(),
                        "projectName", String.valueOf(notification.projectName()),
                        "approver", String.valueOf(notification.approverName())));
    }

    @Override
    public Result<Void, NotificationError> sendRejectedNotification(VmRequestRejectedNotification notification) {
        return send(notification.tenantId(), notification.requesterEmail(),
                "VM request rejected: " + notification.vmName(), REJECTED_TEMPLATE,
                Map.of("vmName", notification.vmName(),
                        "projectName", String.valueOf(notification.projectName()),
                        "reason", notification.reason()));
    }

    private Result<Void, NotificationError> send(String tenantId, EmailAddress recipient, String subject,
                                                 String templateName, Map<String, Object> model) {
        var rendered = render(templateName, model);
        if (rendered.isFailure()) {
            log.warn("Could not render notification template '{}': {}", templateName, rendered.error().message());
            return Result.failure(rendered.error());
        }
        log.info("[mail] tenant={} to={} subject=\"{}\" body=\"{}\"",
                tenantId, recipient, subject, rendered.value());
        return Result.success();
    }

    Result<String, NotificationError> render(String templateName, Map<String, Object> model) {
        var ctx = new Context();
        model.forEach(ctx::setVariable);
        try {
            return Result.success(templateEngine.process(templateName, ctx).strip());
        } catch (TemplateEngineException e) {
            return Result.failure(new NotificationError.TemplateError(templateName, e.getMessage()));
        }
    }

    private static TemplateEngine createTemplateEngine() {
        var resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/email/");
        resolver.setSuffix(".txt");
        resolver.setTemplateMode(TemplateMode.TEXT);
        resolver.setCharacterEncoding("UTF-8");
        resolver.setCheckExistence(true);
        resolver.setCacheable(true);

        var engine = new TemplateEngine();
        engine.setTemplateResolver(resolver);
        return engine;
    }
}
