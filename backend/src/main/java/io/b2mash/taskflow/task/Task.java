package io.b2mash.taskflow.task;

import java.time.Instant;

/**
 * Immutable task record as delivered in a snapshot. Derived views never modify a task.
 *
 * @param id opaque identifier
 * @param description task text
 * @param completed whether the task is done
 * @param priority priority, or {@code null} when the source carried an unrecognized value
 * @param dueDate due instant, or {@code null} when absent or unparseable
 * @param createdAt creation instant
 * @param projectId owning project, nullable
 * @param assignedToId assignee, nullable
 * @param parentTaskId parent task for subtasks, nullable
 */
public record Task(
    String id,
    String description,
    boolean completed,
    TaskPriority priority,
    Instant dueDate,
    Instant createdAt,
    String projectId,
    String assignedToId,
    String parentTaskId) {

  public boolean hasDueDate() {
    return dueDate != null;
  }

  public boolean isAssigned() {
    return assignedToId != null;
  }
}
