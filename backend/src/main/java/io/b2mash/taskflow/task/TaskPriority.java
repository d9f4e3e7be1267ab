package io.b2mash.taskflow.task;

import java.util.Locale;
import java.util.Optional;

/** Task priority with the ordinal table used for sorting. */
public enum TaskPriority {
  HIGH(3),
  MEDIUM(2),
  LOW(1);

  /** Rank given to a priority value that is not one of the three known ones. */
  public static final int UNRECOGNIZED_RANK = 0;

  private final int rank;

  TaskPriority(int rank) {
    this.rank = rank;
  }

  public int rank() {
    return rank;
  }

  /** Wire value: {@code high}, {@code medium} or {@code low}. */
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Returns the rank of the given priority, or {@link #UNRECOGNIZED_RANK} for {@code null}. */
  public static int rankOf(TaskPriority priority) {
    return priority != null ? priority.rank : UNRECOGNIZED_RANK;
  }

  /** Case-insensitive lookup by wire value. Empty for anything not recognized. */
  public static Optional<TaskPriority> fromValue(String value) {
    if (value == null) {
      return Optional.empty();
    }
    for (TaskPriority priority : values()) {
      if (priority.value().equalsIgnoreCase(value.trim())) {
        return Optional.of(priority);
      }
    }
    return Optional.empty();
  }
}
