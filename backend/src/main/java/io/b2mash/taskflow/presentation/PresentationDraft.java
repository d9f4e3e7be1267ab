package io.b2mash.taskflow.presentation;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * An open presentation editing session: details plus a {@link SlideDeck}. Methods are synchronized
 * so that two requests against the same draft never interleave inside a deck operation.
 */
public class PresentationDraft {

  private final UUID id;
  private final SlideDeck deck;
  private final Instant createdAt;
  private PresentationDetails details;
  private Instant lastActivityAt;

  public PresentationDraft(UUID id, PresentationDetails details, SlideDeck deck, Instant createdAt) {
    this.id = id;
    this.details = details;
    this.deck = deck;
    this.createdAt = createdAt;
    this.lastActivityAt = createdAt;
  }

  public synchronized void updateDetails(PresentationDetails details, Instant at) {
    this.details = details;
    this.lastActivityAt = at;
  }

  public synchronized Slide appendSlide(SlideDraft draft, Instant at) {
    this.lastActivityAt = at;
    return deck.append(draft);
  }

  public synchronized boolean removeSlide(int slideId, Instant at) {
    this.lastActivityAt = at;
    return deck.remove(slideId);
  }

  public synchronized boolean moveSlide(int slideId, MoveDirection direction, Instant at) {
    this.lastActivityAt = at;
    return deck.move(slideId, direction);
  }

  public synchronized boolean updateSlide(int slideId, SlideField field, String value, Instant at) {
    this.lastActivityAt = at;
    return deck.update(slideId, field, value);
  }

  public UUID getId() {
    return id;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public synchronized PresentationDetails getDetails() {
    return details;
  }

  public synchronized List<Slide> getSlides() {
    return deck.slides();
  }

  public synchronized Instant getLastActivityAt() {
    return lastActivityAt;
  }
}
