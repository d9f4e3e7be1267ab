package io.b2mash.taskflow.presentation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The slide fields an editor may change in place. Neither {@code id} nor {@code order} is one. */
public enum SlideField {
  TITLE("title"),
  CONTENT("content"),
  SLIDE_TYPE("slideType");

  private final String value;

  SlideField(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /**
   * Returns a copy of the slide with this field replaced.
   *
   * @throws IllegalArgumentException if this is {@link #SLIDE_TYPE} and the value names no type
   */
  Slide applyTo(Slide slide, String newValue) {
    return switch (this) {
      case TITLE -> slide.withTitle(newValue);
      case CONTENT -> slide.withContent(newValue);
      case SLIDE_TYPE -> slide.withSlideType(SlideType.of(newValue));
    };
  }

  /**
   * @throws IllegalArgumentException if the value names no editable field
   */
  @JsonCreator
  public static SlideField of(String value) {
    for (SlideField field : values()) {
      if (field.value.equals(value)) {
        return field;
      }
    }
    throw new IllegalArgumentException("Slide field cannot be edited: " + value);
  }
}
