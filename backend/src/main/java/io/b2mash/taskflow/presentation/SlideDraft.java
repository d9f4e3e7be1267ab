package io.b2mash.taskflow.presentation;

/** Fields for a slide that has not been added to a deck yet. Any of them may be null. */
public record SlideDraft(String title, String content, SlideType slideType) {

  public static SlideDraft blank() {
    return new SlideDraft(null, null, null);
  }
}
