package io.b2mash.taskflow.task;

/** A task paired with its due status at the time the view was built. */
public record ClassifiedTask(Task task, TaskDueStatus dueStatus) {}
