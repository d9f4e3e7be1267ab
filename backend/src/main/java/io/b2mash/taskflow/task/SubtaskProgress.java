package io.b2mash.taskflow.task;

/**
 * Completion progress of the subtasks under one parent task.
 *
 * @param parentTaskId the parent task
 * @param completed number of completed subtasks
 * @param total number of subtasks in the snapshot
 */
public record SubtaskProgress(String parentTaskId, int completed, int total) {}
