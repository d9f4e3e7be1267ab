package io.b2mash.taskflow.task;

import java.time.ZonedDateTime;
import java.util.Collection;

/**
 * Counts the tasks that fall in the reminder window: open tasks due any time up to the end of
 * tomorrow. Overdue tasks always count, however old.
 */
public final class ReminderWindowCounter {

  private ReminderWindowCounter() {}

  public static int reminderCount(Collection<Task> tasks, ZonedDateTime now) {
    int count = 0;
    for (Task task : tasks) {
      if (TaskClassifier.classify(task, now).isInReminderWindow()) {
        count++;
      }
    }
    return count;
  }
}
