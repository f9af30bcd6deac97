package me.internalizable.conduit.api.event.types;

import me.internalizable.conduit.api.event.Event;
import me.internalizable.conduit.api.event.EventPriority;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.Map;
import java.util.Objects;

/**
 * Fired after a task was created in the task tracker.
 */
public class TaskCreatedEvent extends Event {

    public static final String TYPE = "task.created";

    public TaskCreatedEvent(@Nonnull String taskId, @Nonnull String taskTitle, long createdBy,
                            @Nullable String assignee, @Nullable String project,
                            @Nullable Map<String, ?> metadata) {
        super(Event.builder(TYPE)
            .payload("taskId", Objects.requireNonNull(taskId, "taskId"))
            .payload("taskTitle", Objects.requireNonNull(taskTitle, "taskTitle"))
            .payload("createdBy", createdBy)
            .payload("assignee", assignee)
            .payload("project", project)
            .originUser(createdBy)
            .priority(EventPriority.HIGH)
            .metadata(metadata));
    }

    @Nonnull
    public String getTaskId() {
        return (String) getPayloadValue("taskId");
    }

    @Nonnull
    public String getTaskTitle() {
        return (String) getPayloadValue("taskTitle");
    }

    public long getCreatedBy() {
        return (Long) getPayloadValue("createdBy");
    }

    @Nullable
    public String getAssignee() {
        return (String) getPayloadValue("assignee");
    }

    @Nullable
    public String getProject() {
        return (String) getPayloadValue("project");
    }
}
