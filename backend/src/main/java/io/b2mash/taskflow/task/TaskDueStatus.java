package io.b2mash.taskflow.task;

/** Classification of a task relative to a reference instant. */
public enum TaskDueStatus {
  COMPLETED,
  OVERDUE,
  DUE_TODAY,
  DUE_TOMORROW,
  UPCOMING,
  NO_DUE_DATE;

  /** Returns true for the statuses that warrant a reminder: overdue, due today or tomorrow. */
  public boolean isInReminderWindow() {
    return this == OVERDUE || this == DUE_TODAY || this == DUE_TOMORROW;
  }
}
