package io.b2mash.taskflow.task;

/**
 * Headline counts over a whole task snapshot.
 *
 * @param total number of tasks
 * @param active tasks not completed
 * @param completed completed tasks
 * @param overdue open tasks due before today
 * @param dueToday open tasks due today
 * @param dueTomorrow open tasks due tomorrow
 * @param reminderCount open tasks in the reminder window
 * @param completionPercent completed * 100 / total, rounded down; 0 for an empty snapshot
 */
public record TaskSummary(
    int total,
    int active,
    int completed,
    int overdue,
    int dueToday,
    int dueTomorrow,
    int reminderCount,
    int completionPercent) {}
