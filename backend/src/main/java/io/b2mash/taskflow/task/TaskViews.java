package io.b2mash.taskflow.task;

import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/** Filtering, search and aggregate helpers over a task snapshot. All methods are pure. */
public final class TaskViews {

  private TaskViews() {}

  public static List<Task> filter(
      List<Task> tasks, TaskFilter filter, AssigneeFilter assignee, ZonedDateTime now) {
    return tasks.stream().filter(t -> filter.matches(t, now)).filter(assignee::matches).toList();
  }

  /** Case-insensitive substring match on the description. A blank term matches everything. */
  public static List<Task> search(List<Task> tasks, String term) {
    if (term == null || term.isBlank()) {
      return tasks;
    }
    String needle = term.trim().toLowerCase(Locale.ROOT);
    return tasks.stream()
        .filter(
            t ->
                t.description() != null
                    && t.description().toLowerCase(Locale.ROOT).contains(needle))
        .toList();
  }

  public static List<ClassifiedTask> classify(List<Task> tasks, ZonedDateTime now) {
    return tasks.stream().map(t -> new ClassifiedTask(t, TaskClassifier.classify(t, now))).toList();
  }

  /** Distinct assignee ids in natural order, skipping unassigned tasks. */
  public static List<String> assignees(List<Task> tasks) {
    return tasks.stream()
        .map(Task::assignedToId)
        .filter(Objects::nonNull)
        .distinct()
        .sorted()
        .toList();
  }

  public static TaskSummary summarize(List<Task> tasks, ZonedDateTime now) {
    var byStatus = new EnumMap<TaskDueStatus, Integer>(TaskDueStatus.class);
    for (Task task : tasks) {
      byStatus.merge(TaskClassifier.classify(task, now), 1, Integer::sum);
    }

    int total = tasks.size();
    int completed = byStatus.getOrDefault(TaskDueStatus.COMPLETED, 0);
    int overdue = byStatus.getOrDefault(TaskDueStatus.OVERDUE, 0);
    int dueToday = byStatus.getOrDefault(TaskDueStatus.DUE_TODAY, 0);
    int dueTomorrow = byStatus.getOrDefault(TaskDueStatus.DUE_TOMORROW, 0);
    int completionPercent = total == 0 ? 0 : completed * 100 / total;

    return new TaskSummary(
        total,
        total - completed,
        completed,
        overdue,
        dueToday,
        dueTomorrow,
        ReminderWindowCounter.reminderCount(tasks, now),
        completionPercent);
  }

  /** Subtask progress per parent, in the order each parent is first referenced. */
  public static List<SubtaskProgress> subtaskProgress(List<Task> tasks) {
    var completedByParent = new LinkedHashMap<String, Integer>();
    var totalByParent = new LinkedHashMap<String, Integer>();
    for (Task task : tasks) {
      if (task.parentTaskId() == null) {
        continue;
      }
      totalByParent.merge(task.parentTaskId(), 1, Integer::sum);
      completedByParent.merge(task.parentTaskId(), task.completed() ? 1 : 0, Integer::sum);
    }

    var progress = new ArrayList<SubtaskProgress>(totalByParent.size());
    totalByParent.forEach(
        (parentId, total) ->
            progress.add(new SubtaskProgress(parentId, completedByParent.get(parentId), total)));
    return List.copyOf(progress);
  }
}
