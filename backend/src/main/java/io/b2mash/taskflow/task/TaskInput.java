package io.b2mash.taskflow.task;

import jakarta.validation.constraints.NotBlank;
import java.time.Instant;
import java.time.ZoneId;

/**
 * A task as it arrives in a request body. Priority and dates are kept as raw strings so that an
 * unknown priority or a malformed date degrades to a fallback instead of failing the request.
 */
public record TaskInput(
    @NotBlank(message = "id is required") String id,
    String description,
    boolean completed,
    String priority,
    String dueDate,
    String createdAt,
    String projectId,
    String assignedToId,
    String parentTaskId) {

  /**
   * Converts to a {@link Task}.
   *
   * <ul>
   *   <li>missing priority -> MEDIUM; unrecognized priority -> {@code null} (lowest sort rank)
   *   <li>missing or unparseable due date -> no due date
   *   <li>missing or unparseable creation time -> {@code receivedAt}
   * </ul>
   */
  public Task toTask(ZoneId zone, Instant receivedAt) {
    TaskPriority resolvedPriority =
        priority == null ? TaskPriority.MEDIUM : TaskPriority.fromValue(priority).orElse(null);
    return new Task(
        id,
        description != null ? description : "",
        completed,
        resolvedPriority,
        TaskDates.parse(dueDate, zone).orElse(null),
        TaskDates.parse(createdAt, zone).orElse(receivedAt),
        projectId,
        assignedToId,
        parentTaskId);
  }
}
