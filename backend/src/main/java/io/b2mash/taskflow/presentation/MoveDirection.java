package io.b2mash.taskflow.presentation;

import java.util.Locale;

public enum MoveDirection {
  UP,
  DOWN;

  /**
   * Case-insensitive lookup.
   *
   * @throws IllegalArgumentException for anything other than up or down
   */
  public static MoveDirection of(String value) {
    if (value != null) {
      for (MoveDirection direction : values()) {
        if (direction.name().equals(value.trim().toUpperCase(Locale.ROOT))) {
          return direction;
        }
      }
    }
    throw new IllegalArgumentException("Move direction must be up or down, got: " + value);
  }
}
