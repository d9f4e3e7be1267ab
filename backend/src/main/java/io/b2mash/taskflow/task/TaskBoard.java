package io.b2mash.taskflow.task;

import java.util.List;

/**
 * Everything the task pages render from one snapshot.
 *
 * @param tasks the filtered tasks in default sort order
 * @param overdue the overdue subset of {@code tasks}, same order
 * @param summary counts over the whole snapshot, before filtering
 * @param assignees assignee ids offered by the assignment filter
 * @param subtaskProgress progress per parent task across the whole snapshot
 */
public record TaskBoard(
    List<ClassifiedTask> tasks,
    List<ClassifiedTask> overdue,
    TaskSummary summary,
    List<String> assignees,
    List<SubtaskProgress> subtaskProgress) {}
