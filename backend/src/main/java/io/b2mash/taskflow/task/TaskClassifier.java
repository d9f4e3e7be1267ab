package io.b2mash.taskflow.task;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Maps a task and a reference time to a {@link TaskDueStatus}. Pure utility class with no Spring
 * dependencies.
 *
 * <p>Due dates are compared by calendar day in the zone of {@code now}, never as raw instants, so
 * a task due at 08:00 today is {@code DUE_TODAY} at 17:00, not overdue.
 *
 * <ol>
 *   <li>Completed -> COMPLETED, whatever the due date
 *   <li>No due date -> NO_DUE_DATE
 *   <li>Due day before today -> OVERDUE
 *   <li>Due day is today -> DUE_TODAY
 *   <li>Due day is tomorrow -> DUE_TOMORROW
 *   <li>Anything later -> UPCOMING
 * </ol>
 */
public final class TaskClassifier {

  private TaskClassifier() {}

  public static TaskDueStatus classify(Task task, ZonedDateTime now) {
    if (task.completed()) {
      return TaskDueStatus.COMPLETED;
    }
    if (!task.hasDueDate()) {
      return TaskDueStatus.NO_DUE_DATE;
    }

    LocalDate dueDay = calendarDay(task.dueDate(), now.getZone());
    LocalDate today = now.toLocalDate();
    LocalDate tomorrow = today.plusDays(1);

    if (dueDay.isBefore(today)) {
      return TaskDueStatus.OVERDUE;
    }
    if (dueDay.isEqual(today)) {
      return TaskDueStatus.DUE_TODAY;
    }
    if (dueDay.isEqual(tomorrow)) {
      return TaskDueStatus.DUE_TOMORROW;
    }
    return TaskDueStatus.UPCOMING;
  }

  /** Truncates an instant to the calendar day it falls on in the given zone. */
  static LocalDate calendarDay(Instant instant, ZoneId zone) {
    return LocalDate.ofInstant(instant, zone);
  }
}
