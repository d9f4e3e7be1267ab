package io.b2mash.taskflow.presentation;

/**
 * One slide of a presentation deck.
 *
 * @param id identifier, unique within the deck and never reused
 * @param title slide heading
 * @param content slide body
 * @param slideType layout
 * @param order 1-based position in the deck
 */
public record Slide(int id, String title, String content, SlideType slideType, int order) {

  Slide withOrder(int newOrder) {
    return newOrder == order ? this : new Slide(id, title, content, slideType, newOrder);
  }

  Slide withTitle(String newTitle) {
    return new Slide(id, newTitle, content, slideType, order);
  }

  Slide withContent(String newContent) {
    return new Slide(id, title, newContent, slideType, order);
  }

  Slide withSlideType(SlideType newSlideType) {
    return new Slide(id, title, content, newSlideType, order);
  }
}
