package io.b2mash.taskflow.task;

import io.b2mash.taskflow.exception.InvalidStateException;
import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds derived task views from a caller-supplied snapshot. Holds no state between calls; the only
 * collaborator is the injected {@link Clock}.
 */
@Service
public class TaskViewService {

  private static final Logger log = LoggerFactory.getLogger(TaskViewService.class);

  private final Clock clock;

  public TaskViewService(Clock clock) {
    this.clock = clock;
  }

  public ZonedDateTime now() {
    return ZonedDateTime.now(clock);
  }

  /** Parses request inputs into tasks, applying the boundary fallbacks of {@link TaskInput}. */
  public List<Task> toSnapshot(List<TaskInput> inputs) {
    var receivedAt = clock.instant();
    var tasks = inputs.stream().map(input -> input.toTask(clock.getZone(), receivedAt)).toList();
    long unrecognized = tasks.stream().filter(t -> t.priority() == null).count();
    if (unrecognized > 0) {
      log.debug("{} of {} tasks carried an unrecognized priority", unrecognized, tasks.size());
    }
    return tasks;
  }

  public TaskBoard buildBoard(
      List<Task> snapshot, String filterValue, String assigneeValue, String search) {
    var filter =
        TaskFilter.fromValue(filterValue)
            .orElseThrow(
                () ->
                    new InvalidStateException(
                        "Invalid filter", "Unknown task filter: " + filterValue, filterValue));
    var assignee = AssigneeFilter.parse(assigneeValue);
    var now = now();

    var visible = TaskViews.search(TaskViews.filter(snapshot, filter, assignee, now), search);
    var sorted = TaskViews.classify(TaskSorter.sortedView(visible), now);
    var overdue = sorted.stream().filter(ct -> ct.dueStatus() == TaskDueStatus.OVERDUE).toList();

    log.debug(
        "Built task board: snapshot={}, visible={}, filter={}, assignee={}",
        snapshot.size(),
        sorted.size(),
        filter.value(),
        assignee.mode());

    return new TaskBoard(
        sorted,
        overdue,
        TaskViews.summarize(snapshot, now),
        TaskViews.assignees(snapshot),
        TaskViews.subtaskProgress(snapshot));
  }

  public int reminderCount(List<Task> snapshot) {
    return ReminderWindowCounter.reminderCount(snapshot, now());
  }
}
