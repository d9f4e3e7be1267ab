package io.b2mash.taskflow.presentation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Layout of a slide. Serialized with the hyphenated values the editor uses. */
public enum SlideType {
  TITLE("title"),
  CONTENT("content"),
  IMAGE("image"),
  BULLET_POINTS("bullet-points"),
  QUOTE("quote"),
  CONCLUSION("conclusion");

  private final String value;

  SlideType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Looks up a slide type by its wire value.
   *
   * @throws IllegalArgumentException if the value names no slide type
   */
  @JsonCreator
  public static SlideType of(String value) {
    for (SlideType type : values()) {
      if (type.value.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown slide type: " + value);
  }
}
