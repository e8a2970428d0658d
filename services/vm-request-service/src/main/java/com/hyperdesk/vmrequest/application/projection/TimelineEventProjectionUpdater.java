package com.hyperdesk.vmrequest.application.projection;

import com.hyperdesk.eventstore.Result;

/** Appends entries to a request's history timeline. Re-adding an existing entry id is a success. */
public interface TimelineEventProjectionUpdater {

    Result<Void, ProjectionError> addTimelineEvent(NewTimelineEvent event);
}
