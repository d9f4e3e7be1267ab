package io.b2mash.taskflow.task;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Default ordering for task lists. Keys, most significant first:
 *
 * <ol>
 *   <li>open tasks before completed ones
 *   <li>priority descending by {@link TaskPriority#rankOf}
 *   <li>due date ascending; a task with a due date precedes one without
 * </ol>
 *
 * <p>The sort is stable, so tasks equal on all three keys keep their snapshot order.
 */
public final class TaskSorter {

  static final Comparator<Task> DEFAULT_ORDER =
      Comparator.comparing(Task::completed)
          .thenComparing(
              Comparator.comparingInt((Task task) -> TaskPriority.rankOf(task.priority()))
                  .reversed())
          .thenComparing(Task::dueDate, Comparator.nullsLast(Comparator.<Instant>naturalOrder()));

  private TaskSorter() {}

  /** Returns a sorted copy of the snapshot. The input list is left untouched. */
  public static List<Task> sortedView(List<Task> tasks) {
    var sorted = new ArrayList<>(tasks);
    // List.sort is a stable merge sort
    sorted.sort(DEFAULT_ORDER);
    return List.copyOf(sorted);
  }
}
