package io.b2mash.taskflow.task;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TaskInputTest {

  private static final Instant RECEIVED_AT = Instant.parse("2024-06-10T09:00:00Z");

  private static TaskInput input(String priority, String dueDate, String createdAt) {
    return new TaskInput("t1", "Write report", false, priority, dueDate, createdAt, "p1", "u1", null);
  }

  @Test
  void toTask_copiesFieldsAndParsesDates() {
    var task =
        input("high", "2024-06-11T17:00:00Z", "2024-06-01T08:00:00Z")
            .toTask(ZoneOffset.UTC, RECEIVED_AT);

    assertThat(task.id()).isEqualTo("t1");
    assertThat(task.description()).isEqualTo("Write report");
    assertThat(task.priority()).isEqualTo(TaskPriority.HIGH);
    assertThat(task.dueDate()).isEqualTo(Instant.parse("2024-06-11T17:00:00Z"));
    assertThat(task.createdAt()).isEqualTo(Instant.parse("2024-06-01T08:00:00Z"));
    assertThat(task.projectId()).isEqualTo("p1");
    assertThat(task.assignedToId()).isEqualTo("u1");
    assertThat(task.parentTaskId()).isNull();
  }

  @Test
  void toTask_missingPriorityDefaultsToMedium() {
    assertThat(input(null, null, null).toTask(ZoneOffset.UTC, RECEIVED_AT).priority())
        .isEqualTo(TaskPriority.MEDIUM);
  }

  @Test
  void toTask_unknownPriorityBecomesNull() {
    assertThat(input("urgent", null, null).toTask(ZoneOffset.UTC, RECEIVED_AT).priority())
        .isNull();
  }

  @Test
  void toTask_malformedDueDateIsAbsent() {
    var task = input("low", "not-a-date", null).toTask(ZoneOffset.UTC, RECEIVED_AT);

    assertThat(task.dueDate()).isNull();
    assertThat(task.hasDueDate()).isFalse();
  }

  @Test
  void toTask_missingCreatedAtUsesReceivedTime() {
    assertThat(input("low", null, null).toTask(ZoneOffset.UTC, RECEIVED_AT).createdAt())
        .isEqualTo(RECEIVED_AT);
  }

  @Test
  void toTask_nullDescriptionBecomesEmpty() {
    var task =
        new TaskInput("t2", null, true, "low", null, null, null, null, null)
            .toTask(ZoneOffset.UTC, RECEIVED_AT);

    assertThat(task.description()).isEmpty();
    assertThat(task.completed()).isTrue();
  }
}
