package io.b2mash.taskflow.presentation;

import io.b2mash.taskflow.config.TaskflowProperties;
import io.b2mash.taskflow.exception.InvalidStateException;
import io.b2mash.taskflow.exception.ResourceNotFoundException;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Holds open presentation drafts in memory. A draft lives from {@link #createDraft} until it is
 * submitted, discarded, or expired for inactivity.
 */
@Service
public class PresentationDraftService {

  private static final Logger log = LoggerFactory.getLogger(PresentationDraftService.class);

  private final Map<UUID, PresentationDraft> drafts = new ConcurrentHashMap<>();
  private final Clock clock;
  private final TaskflowProperties.Presentation settings;

  public PresentationDraftService(Clock clock, TaskflowProperties properties) {
    this.clock = clock;
    this.settings = properties.presentation();
  }

  /**
   * Opens a new draft. Creates are serialized so the size check and the insert cannot interleave
   * with another create; removals only ever lower the count.
   *
   * @throws InvalidStateException when {@code max-open-drafts} drafts are already open
   */
  public synchronized PresentationDraft createDraft(PresentationDetails requested) {
    if (drafts.size() >= settings.maxOpenDrafts()) {
      throw new InvalidStateException(
          "Too many open drafts",
          "At most " + settings.maxOpenDrafts() + " presentation drafts may be open at once");
    }

    var draft =
        new PresentationDraft(
            UUID.randomUUID(),
            withDefaults(requested),
            SlideDeck.withDefaultSlides(),
            clock.instant());
    drafts.put(draft.getId(), draft);

    log.info("Opened presentation draft {}", draft.getId());
    return draft;
  }

  public PresentationDraft getDraft(UUID draftId) {
    var draft = drafts.get(draftId);
    if (draft == null) {
      throw new ResourceNotFoundException("PresentationDraft", draftId);
    }
    return draft;
  }

  public PresentationDraft updateDetails(UUID draftId, PresentationDetails requested) {
    var draft = getDraft(draftId);
    draft.updateDetails(withDefaults(requested), clock.instant());
    log.info("Updated details of presentation draft {}", draftId);
    return draft;
  }

  public Slide addSlide(UUID draftId, SlideDraft slideDraft) {
    var draft = getDraft(draftId);
    var slide = draft.appendSlide(slideDraft, clock.instant());
    log.info("Added slide {} at position {} to draft {}", slide.id(), slide.order(), draftId);
    return slide;
  }

  public PresentationDraft removeSlide(UUID draftId, int slideId) {
    var draft = getDraft(draftId);
    if (draft.removeSlide(slideId, clock.instant())) {
      log.info("Removed slide {} from draft {}", slideId, draftId);
    } else {
      log.debug("Slide {} not in draft {}, nothing removed", slideId, draftId);
    }
    return draft;
  }

  public PresentationDraft moveSlide(UUID draftId, int slideId, MoveDirection direction) {
    var draft = getDraft(draftId);
    if (draft.moveSlide(slideId, direction, clock.instant())) {
      log.info("Moved slide {} {} in draft {}", slideId, direction, draftId);
    } else {
      log.debug("Slide {} in draft {} cannot move {}", slideId, draftId, direction);
    }
    return draft;
  }

  public PresentationDraft updateSlide(
      UUID draftId, int slideId, SlideField field, String value) {
    var draft = getDraft(draftId);
    if (draft.updateSlide(slideId, field, value, clock.instant())) {
      log.info("Updated {} of slide {} in draft {}", field.value(), slideId, draftId);
    } else {
      log.debug("Slide {} not in draft {}, nothing updated", slideId, draftId);
    }
    return draft;
  }

  /** Closes the draft and returns the batch to persist. */
  public PresentationSubmission submit(UUID draftId) {
    var draft = drafts.remove(draftId);
    if (draft == null) {
      throw new ResourceNotFoundException("PresentationDraft", draftId);
    }

    var slides =
        draft.getSlides().stream().sorted(Comparator.comparingInt(Slide::order)).toList();
    var submission =
        new PresentationSubmission(
            draftId, PresentationSubmission.TYPE, draft.getDetails(), slides, clock.instant());

    log.info("Submitted presentation draft {} with {} slides", draftId, slides.size());
    return submission;
  }

  public void discard(UUID draftId) {
    if (drafts.remove(draftId) == null) {
      throw new ResourceNotFoundException("PresentationDraft", draftId);
    }
    log.info("Discarded presentation draft {}", draftId);
  }

  /** Drops every draft whose last activity is older than the configured idle timeout. */
  public int expireIdleDrafts() {
    var cutoff = clock.instant().minus(settings.draftIdleTimeout());
    int before = drafts.size();
    drafts.values().removeIf(draft -> draft.getLastActivityAt().isBefore(cutoff));
    return before - drafts.size();
  }

  public int openDraftCount() {
    return drafts.size();
  }

  private PresentationDetails withDefaults(PresentationDetails requested) {
    if (requested == null) {
      return new PresentationDetails(
          "",
          "",
          "",
          "",
          LocalDate.now(clock),
          null,
          settings.defaultTheme(),
          "",
          "",
          settings.defaultDurationMinutes());
    }
    return new PresentationDetails(
        requested.title(),
        requested.subtitle(),
        requested.author(),
        requested.company(),
        requested.date() != null ? requested.date() : LocalDate.now(clock),
        requested.projectId(),
        requested.theme() != null && !requested.theme().isBlank()
            ? requested.theme()
            : settings.defaultTheme(),
        requested.audience(),
        requested.objective(),
        requested.durationMinutes() > 0
            ? requested.durationMinutes()
            : settings.defaultDurationMinutes());
  }
}
