package io.b2mash.taskflow.task;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/task-views")
public class TaskViewController {

  private final TaskViewService taskViewService;

  public TaskViewController(TaskViewService taskViewService) {
    this.taskViewService = taskViewService;
  }

  @PostMapping
  public ResponseEntity<TaskBoardResponse> buildBoard(
      @Valid @RequestBody TaskBoardRequest request) {
    var snapshot = taskViewService.toSnapshot(request.tasks());
    var board =
        taskViewService.buildBoard(
            snapshot, request.filter(), request.assignee(), request.search());
    return ResponseEntity.ok(TaskBoardResponse.from(board));
  }

  @PostMapping("/reminders")
  public ResponseEntity<ReminderCountResponse> reminderCount(
      @Valid @RequestBody TaskSnapshotRequest request) {
    var snapshot = taskViewService.toSnapshot(request.tasks());
    return ResponseEntity.ok(new ReminderCountResponse(taskViewService.reminderCount(snapshot)));
  }

  // --- DTOs ---

  public record TaskBoardRequest(
      @NotNull(message = "tasks is required")
          List<@Valid @NotNull(message = "tasks must not contain null entries") TaskInput> tasks,
      String filter,
      String assignee,
      String search) {}

  public record TaskSnapshotRequest(
      @NotNull(message = "tasks is required")
          List<@Valid @NotNull(message = "tasks must not contain null entries") TaskInput>
              tasks) {}

  public record ReminderCountResponse(int reminderCount) {}

  public record TaskViewItem(
      String id,
      String description,
      boolean completed,
      String priority,
      Instant dueDate,
      Instant createdAt,
      String projectId,
      String assignedToId,
      String parentTaskId,
      String dueStatus) {

    public static TaskViewItem from(ClassifiedTask classified) {
      var task = classified.task();
      return new TaskViewItem(
          task.id(),
          task.description(),
          task.completed(),
          task.priority() != null ? task.priority().value() : null,
          task.dueDate(),
          task.createdAt(),
          task.projectId(),
          task.assignedToId(),
          task.parentTaskId(),
          classified.dueStatus().name());
    }
  }

  public record TaskBoardResponse(
      List<TaskViewItem> tasks,
      List<TaskViewItem> overdue,
      int reminderCount,
      TaskSummary summary,
      List<String> assignees,
      List<SubtaskProgress> subtaskProgress) {

    public static TaskBoardResponse from(TaskBoard board) {
      return new TaskBoardResponse(
          board.tasks().stream().map(TaskViewItem::from).toList(),
          board.overdue().stream().map(TaskViewItem::from).toList(),
          board.summary().reminderCount(),
          board.summary(),
          board.assignees(),
          board.subtaskProgress());
    }
  }
}
