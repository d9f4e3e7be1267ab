package io.b2mash.taskflow.presentation;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * The batch handed to the document store when an editing session is saved.
 *
 * @param draftId the editing session this came from
 * @param type document type, always {@value #TYPE}
 * @param details presentation details
 * @param slides slides sorted by order
 * @param submittedAt when the session was closed
 */
public record PresentationSubmission(
    UUID draftId,
    String type,
    PresentationDetails details,
    List<Slide> slides,
    Instant submittedAt) {

  public static final String TYPE = "presentation";
}
