package io.b2mash.taskflow.task;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class TaskPriorityTest {

  @Test
  void ranks() {
    assertThat(TaskPriority.HIGH.rank()).isEqualTo(3);
    assertThat(TaskPriority.MEDIUM.rank()).isEqualTo(2);
    assertThat(TaskPriority.LOW.rank()).isEqualTo(1);
  }

  @Test
  void rankOf_null_isLowest() {
    assertThat(TaskPriority.rankOf(null)).isEqualTo(TaskPriority.UNRECOGNIZED_RANK).isZero();
  }

  @Test
  void fromValue_isCaseInsensitive() {
    assertThat(TaskPriority.fromValue("high")).contains(TaskPriority.HIGH);
    assertThat(TaskPriority.fromValue("Medium")).contains(TaskPriority.MEDIUM);
    assertThat(TaskPriority.fromValue(" LOW ")).contains(TaskPriority.LOW);
  }

  @Test
  void fromValue_unknown_isEmpty() {
    assertThat(TaskPriority.fromValue("urgent")).isEmpty();
    assertThat(TaskPriority.fromValue("")).isEmpty();
    assertThat(TaskPriority.fromValue(null)).isEmpty();
  }

  @Test
  void value_isLowerCase() {
    assertThat(TaskPriority.HIGH.value()).isEqualTo("high");
  }
}
