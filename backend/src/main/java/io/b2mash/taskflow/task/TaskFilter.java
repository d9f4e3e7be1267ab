package io.b2mash.taskflow.task;

import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Optional;

/** List filters offered by the task pages, keyed by their URL value. */
public enum TaskFilter {
  ALL("all"),
  ACTIVE("active"),
  COMPLETED("completed"),
  OVERDUE("overdue"),
  DUE_SOON("due-soon"),
  HIGH_PRIORITY("high-priority"),
  COMPLETED_TODAY("completed-today");

  private final String value;

  TaskFilter(String value) {
    this.value = value;
  }

  public String value() {
    return value;
  }

  /**
   * Returns true if the task belongs in this filter's list at the given time. Date-based filters
   * reuse {@link TaskClassifier} so that "overdue" means the same thing everywhere.
   */
  public boolean matches(Task task, ZonedDateTime now) {
    return switch (this) {
      case ALL -> true;
      case ACTIVE -> !task.completed();
      case COMPLETED -> task.completed();
      case OVERDUE -> TaskClassifier.classify(task, now) == TaskDueStatus.OVERDUE;
      case DUE_SOON -> {
        var status = TaskClassifier.classify(task, now);
        yield status == TaskDueStatus.DUE_TODAY || status == TaskDueStatus.DUE_TOMORROW;
      }
      case HIGH_PRIORITY -> !task.completed() && task.priority() == TaskPriority.HIGH;
      // The record has no completion timestamp; the creation day stands in for it.
      case COMPLETED_TODAY ->
          task.completed()
              && task.createdAt() != null
              && TaskClassifier.calendarDay(task.createdAt(), now.getZone())
                  .isEqual(now.toLocalDate());
    };
  }

  /**
   * Looks up a filter by URL value. {@code null} or blank means {@link #ALL}; {@code pending} is
   * accepted as the mobile view's name for {@link #ACTIVE}.
   */
  public static Optional<TaskFilter> fromValue(String value) {
    if (value == null || value.isBlank()) {
      return Optional.of(ALL);
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    if ("pending".equals(normalized)) {
      return Optional.of(ACTIVE);
    }
    for (TaskFilter filter : values()) {
      if (filter.value.equals(normalized)) {
        return Optional.of(filter);
      }
    }
    return Optional.empty();
  }
}
