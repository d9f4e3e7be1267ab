package io.b2mash.taskflow.presentation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import java.util.List;
import java.util.stream.IntStream;
import org.junit.jupiter.api.Test;

class SlideDeckTest {

  private static SlideDeck threeSlides() {
    return SlideDeck.of(
        List.of(
            new Slide(1, "One", "", SlideType.TITLE, 1),
            new Slide(2, "Two", "", SlideType.CONTENT, 2),
            new Slide(3, "Three", "", SlideType.CONCLUSION, 3)));
  }

  private static List<Integer> ids(SlideDeck deck) {
    return deck.slides().stream().map(Slide::id).toList();
  }

  private static void assertContiguous(SlideDeck deck) {
    assertThat(deck.slides())
        .extracting(Slide::order)
        .containsExactlyElementsOf(IntStream.rangeClosed(1, deck.size()).boxed().toList());
  }

  @Test
  void withDefaultSlides_startsWithIntroductionAndContent() {
    var deck = SlideDeck.withDefaultSlides();

    assertThat(deck.slides())
        .containsExactly(
            new Slide(1, "Introduction", "", SlideType.TITLE, 1),
            new Slide(2, "Content Slide", "", SlideType.CONTENT, 2));
  }

  @Test
  void append_assignsNextOrderAndFreshId() {
    var deck = threeSlides();

    var added = deck.append(SlideDraft.blank());

    assertThat(added).isEqualTo(new Slide(4, "Slide 4", "", SlideType.CONTENT, 4));
    assertThat(ids(deck)).containsExactly(1, 2, 3, 4);
  }

  @Test
  void append_keepsProvidedFields() {
    var deck = new SlideDeck();

    var added = deck.append(new SlideDraft("Quote", "Less is more", SlideType.QUOTE));

    assertThat(added).isEqualTo(new Slide(1, "Quote", "Less is more", SlideType.QUOTE, 1));
  }

  @Test
  void remove_reindexesRemainingSlides() {
    var deck = threeSlides();

    assertThat(deck.remove(2)).isTrue();

    assertThat(deck.slides())
        .extracting(Slide::id, Slide::order)
        .containsExactly(tuple(1, 1), tuple(3, 2));
  }

  @Test
  void remove_unknownIdIsNoOp() {
    var deck = threeSlides();
    var before = deck.slides();

    assertThat(deck.remove(42)).isFalse();

    assertThat(deck.slides()).isEqualTo(before);
  }

  @Test
  void remove_lastRemainingSlideLeavesEmptyDeck() {
    var deck = SlideDeck.of(List.of(new Slide(7, "Only", "", SlideType.TITLE, 1)));

    assertThat(deck.remove(7)).isTrue();

    assertThat(deck.slides()).isEmpty();
  }

  @Test
  void idsAreNeverReusedAfterRemoval() {
    var deck = threeSlides();

    deck.remove(3);
    var added = deck.append(SlideDraft.blank());

    assertThat(added.id()).isEqualTo(4);
    assertThat(added.order()).isEqualTo(3);

    deck.remove(4);
    deck.remove(2);
    assertThat(deck.append(SlideDraft.blank()).id()).isEqualTo(5);
  }

  @Test
  void move_upSwapsWithPreviousSlide() {
    var deck = threeSlides();

    assertThat(deck.move(3, MoveDirection.UP)).isTrue();

    assertThat(ids(deck)).containsExactly(1, 3, 2);
    assertContiguous(deck);
  }

  @Test
  void move_downSwapsWithNextSlide() {
    var deck = threeSlides();

    assertThat(deck.move(1, MoveDirection.DOWN)).isTrue();

    assertThat(ids(deck)).containsExactly(2, 1, 3);
    assertContiguous(deck);
  }

  @Test
  void move_atBoundaryLeavesDeckUnchanged() {
    var deck = threeSlides();
    var before = deck.slides();

    assertThat(deck.move(1, MoveDirection.UP)).isFalse();
    assertThat(deck.move(3, MoveDirection.DOWN)).isFalse();

    assertThat(deck.slides()).isEqualTo(before);
  }

  @Test
  void move_unknownIdIsNoOp() {
    var deck = threeSlides();
    var before = deck.slides();

    assertThat(deck.move(99, MoveDirection.DOWN)).isFalse();

    assertThat(deck.slides()).isEqualTo(before);
  }

  @Test
  void update_replacesOneFieldOnly() {
    var deck = threeSlides();

    assertThat(deck.update(2, SlideField.TITLE, "Agenda")).isTrue();
    assertThat(deck.update(2, SlideField.CONTENT, "- intro\n- plan")).isTrue();
    assertThat(deck.update(2, SlideField.SLIDE_TYPE, "bullet-points")).isTrue();

    assertThat(deck.slides().get(1))
        .isEqualTo(new Slide(2, "Agenda", "- intro\n- plan", SlideType.BULLET_POINTS, 2));
    assertThat(deck.slides().get(0)).isEqualTo(new Slide(1, "One", "", SlideType.TITLE, 1));
  }

  @Test
  void update_unknownIdIsNoOp() {
    var deck = threeSlides();
    var before = deck.slides();

    assertThat(deck.update(5, SlideField.TITLE, "Nope")).isFalse();

    assertThat(deck.slides()).isEqualTo(before);
  }

  @Test
  void update_invalidSlideTypeIsRejected() {
    var deck = threeSlides();

    assertThatThrownBy(() -> deck.update(1, SlideField.SLIDE_TYPE, "video"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("Unknown slide type");
  }

  @Test
  void of_placesSlidesByOrderAndClosesGaps() {
    var deck =
        SlideDeck.of(
            List.of(
                new Slide(10, "C", "", SlideType.CONTENT, 9),
                new Slide(4, "A", "", SlideType.TITLE, 2),
                new Slide(6, "B", "", SlideType.CONTENT, 5)));

    assertThat(ids(deck)).containsExactly(4, 6, 10);
    assertContiguous(deck);
    assertThat(deck.append(SlideDraft.blank()).id()).isEqualTo(11);
  }

  @Test
  void of_duplicateIdsAreRejected() {
    assertThatThrownBy(
            () ->
                SlideDeck.of(
                    List.of(
                        new Slide(1, "A", "", SlideType.TITLE, 1),
                        new Slide(1, "B", "", SlideType.CONTENT, 2))))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void orderStaysContiguousThroughMixedEdits() {
    var deck = SlideDeck.withDefaultSlides();
    for (int i = 0; i < 5; i++) {
      deck.append(SlideDraft.blank());
    }
    deck.move(3, MoveDirection.UP);
    deck.remove(1);
    deck.move(7, MoveDirection.DOWN);
    deck.append(SlideDraft.blank());
    deck.remove(5);
    deck.move(2, MoveDirection.DOWN);
    deck.remove(42);

    assertThat(deck.size()).isEqualTo(6);
    assertContiguous(deck);
    assertThat(ids(deck)).doesNotHaveDuplicates();
  }

  @Test
  void slides_returnsImmutableCopy() {
    var deck = threeSlides();

    assertThatThrownBy(() -> deck.slides().clear())
        .isInstanceOf(UnsupportedOperationException.class);
  }
}
