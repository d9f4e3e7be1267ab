package io.b2mash.taskflow.presentation;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;
import java.net.URI;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/presentation-drafts")
public class PresentationDraftController {

  private final PresentationDraftService draftService;

  public PresentationDraftController(PresentationDraftService draftService) {
    this.draftService = draftService;
  }

  @PostMapping
  public ResponseEntity<PresentationDraftResponse> createDraft(
      @Valid @RequestBody(required = false) PresentationDetailsRequest request) {
    var draft = draftService.createDraft(request != null ? request.toDetails() : null);
    return ResponseEntity.created(URI.create("/api/presentation-drafts/" + draft.getId()))
        .body(PresentationDraftResponse.from(draft));
  }

  @GetMapping("/{draftId}")
  public ResponseEntity<PresentationDraftResponse> getDraft(@PathVariable UUID draftId) {
    return ResponseEntity.ok(PresentationDraftResponse.from(draftService.getDraft(draftId)));
  }

  @PutMapping("/{draftId}")
  public ResponseEntity<PresentationDraftResponse> updateDetails(
      @PathVariable UUID draftId, @Valid @RequestBody PresentationDetailsRequest request) {
    var draft = draftService.updateDetails(draftId, request.toDetails());
    return ResponseEntity.ok(PresentationDraftResponse.from(draft));
  }

  @PostMapping("/{draftId}/slides")
  public ResponseEntity<Slide> addSlide(
      @PathVariable UUID draftId, @Valid @RequestBody(required = false) AddSlideRequest request) {
    var slideDraft =
        request != null
            ? new SlideDraft(request.title(), request.content(), request.slideType())
            : SlideDraft.blank();
    var slide = draftService.addSlide(draftId, slideDraft);
    return ResponseEntity.created(
            URI.create("/api/presentation-drafts/" + draftId + "/slides/" + slide.id()))
        .body(slide);
  }

  @DeleteMapping("/{draftId}/slides/{slideId}")
  public ResponseEntity<PresentationDraftResponse> removeSlide(
      @PathVariable UUID draftId, @PathVariable int slideId) {
    var draft = draftService.removeSlide(draftId, slideId);
    return ResponseEntity.ok(PresentationDraftResponse.from(draft));
  }

  @PostMapping("/{draftId}/slides/{slideId}/move")
  public ResponseEntity<PresentationDraftResponse> moveSlide(
      @PathVariable UUID draftId, @PathVariable int slideId, @RequestParam String direction) {
    var draft = draftService.moveSlide(draftId, slideId, MoveDirection.of(direction));
    return ResponseEntity.ok(PresentationDraftResponse.from(draft));
  }

  @PatchMapping("/{draftId}/slides/{slideId}")
  public ResponseEntity<PresentationDraftResponse> updateSlide(
      @PathVariable UUID draftId,
      @PathVariable int slideId,
      @Valid @RequestBody UpdateSlideRequest request) {
    var draft = draftService.updateSlide(draftId, slideId, request.field(), request.value());
    return ResponseEntity.ok(PresentationDraftResponse.from(draft));
  }

  @PostMapping("/{draftId}/submit")
  public ResponseEntity<PresentationSubmission> submit(@PathVariable UUID draftId) {
    return ResponseEntity.ok(draftService.submit(draftId));
  }

  @DeleteMapping("/{draftId}")
  public ResponseEntity<Void> discard(@PathVariable UUID draftId) {
    draftService.discard(draftId);
    return ResponseEntity.noContent().build();
  }

  // --- DTOs ---

  public record PresentationDetailsRequest(
      @Size(max = 200, message = "title must be at most 200 characters") String title,
      @Size(max = 200, message = "subtitle must be at most 200 characters") String subtitle,
      @Size(max = 200, message = "author must be at most 200 characters") String author,
      @Size(max = 200, message = "company must be at most 200 characters") String company,
      LocalDate date,
      String projectId,
      String theme,
      @Size(max = 500, message = "audience must be at most 500 characters") String audience,
      @Size(max = 500, message = "objective must be at most 500 characters") String objective,
      @PositiveOrZero(message = "durationMinutes must not be negative") Integer durationMinutes) {

    PresentationDetails toDetails() {
      return new PresentationDetails(
          title,
          subtitle,
          author,
          company,
          date,
          projectId,
          theme,
          audience,
          objective,
          durationMinutes != null ? durationMinutes : 0);
    }
  }

  public record AddSlideRequest(
      @Size(max = 500, message = "title must be at most 500 characters") String title,
      String content,
      SlideType slideType) {}

  public record UpdateSlideRequest(
      @NotNull(message = "field is required") SlideField field, String value) {}

  public record PresentationDraftResponse(
      UUID id,
      PresentationDetails details,
      List<Slide> slides,
      Instant createdAt,
      Instant lastActivityAt) {

    public static PresentationDraftResponse from(PresentationDraft draft) {
      return new PresentationDraftResponse(
          draft.getId(),
          draft.getDetails(),
          draft.getSlides(),
          draft.getCreatedAt(),
          draft.getLastActivityAt());
    }
  }
}
