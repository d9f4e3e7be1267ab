package io.b2mash.taskflow.presentation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * The ordered slides of one editing session. Every mutation keeps the {@code order} fields equal to
 * {@code 1..N} in list position, and leaves the relative order of untouched slides alone.
 *
 * <p>Slide ids come from a counter that only moves forward, so an id retired by {@link #remove} is
 * never handed out again within the deck.
 *
 * <p>Not thread-safe: a deck belongs to a single editing session.
 */
public class SlideDeck {

  static final String DEFAULT_SLIDE_TITLE_PREFIX = "Slide ";

  private final List<Slide> slides = new ArrayList<>();
  private int lastIssuedId;

  public SlideDeck() {}

  /** The deck a new presentation starts with: an introduction slide and one content slide. */
  public static SlideDeck withDefaultSlides() {
    var deck = new SlideDeck();
    deck.append(new SlideDraft("Introduction", "", SlideType.TITLE));
    deck.append(new SlideDraft("Content Slide", "", SlideType.CONTENT));
    return deck;
  }

  /**
   * Rebuilds a deck from existing slides, e.g. a previously saved presentation. Slides are placed by
   * their current {@code order} (ties keep list order) and then reindexed; ids are kept as-is and
   * the id counter continues above the highest one.
   *
   * @throws IllegalArgumentException if two slides share an id
   */
  public static SlideDeck of(List<Slide> existing) {
    var deck = new SlideDeck();
    var byOrder = new ArrayList<>(existing);
    byOrder.sort(Comparator.comparingInt(Slide::order));
    for (Slide slide : byOrder) {
      if (deck.indexOf(slide.id()) >= 0) {
        throw new IllegalArgumentException("Duplicate slide id: " + slide.id());
      }
      deck.slides.add(slide);
      deck.lastIssuedId = Math.max(deck.lastIssuedId, slide.id());
    }
    deck.reindex();
    return deck;
  }

  /**
   * Adds a slide at the end. Missing fields default to a {@code "Slide <n>"} title, empty content
   * and {@link SlideType#CONTENT}.
   *
   * @return the slide as stored, with its assigned id and order
   */
  public Slide append(SlideDraft draft) {
    int order = slides.size() + 1;
    var slide =
        new Slide(
            ++lastIssuedId,
            draft.title() != null ? draft.title() : DEFAULT_SLIDE_TITLE_PREFIX + order,
            draft.content() != null ? draft.content() : "",
            draft.slideType() != null ? draft.slideType() : SlideType.CONTENT,
            order);
    slides.add(slide);
    return slide;
  }

  /** Removes the slide with the given id. Returns false, changing nothing, if there is none. */
  public boolean remove(int id) {
    int index = indexOf(id);
    if (index < 0) {
      return false;
    }
    slides.remove(index);
    reindex();
    return true;
  }

  /**
   * Swaps the slide with its neighbour in the given direction. Moving the first slide up, the last
   * slide down, or an unknown id changes nothing and returns false.
   */
  public boolean move(int id, MoveDirection direction) {
    int index = indexOf(id);
    if (index < 0) {
      return false;
    }
    int target = direction == MoveDirection.UP ? index - 1 : index + 1;
    if (target < 0 || target >= slides.size()) {
      return false;
    }
    Collections.swap(slides, index, target);
    reindex();
    return true;
  }

  /**
   * Replaces one field of the slide with the given id. Returns false if there is no such slide.
   *
   * @throws IllegalArgumentException if the value is not valid for the field
   */
  public boolean update(int id, SlideField field, String value) {
    int index = indexOf(id);
    if (index < 0) {
      return false;
    }
    slides.set(index, field.applyTo(slides.get(index), value));
    return true;
  }

  /** The slides in display order. The returned list is an immutable copy. */
  public List<Slide> slides() {
    return List.copyOf(slides);
  }

  public int size() {
    return slides.size();
  }

  public int lastIssuedId() {
    return lastIssuedId;
  }

  private int indexOf(int id) {
    for (int i = 0; i < slides.size(); i++) {
      if (slides.get(i).id() == id) {
        return i;
      }
    }
    return -1;
  }

  private void reindex() {
    for (int i = 0; i < slides.size(); i++) {
      slides.set(i, slides.get(i).withOrder(i + 1));
    }
  }
}
