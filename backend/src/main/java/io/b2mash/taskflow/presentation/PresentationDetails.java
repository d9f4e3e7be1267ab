package io.b2mash.taskflow.presentation;

import java.time.LocalDate;

/**
 * The descriptive part of a presentation, everything except its slides.
 *
 * @param title presentation title, shown on the opening title slide
 * @param subtitle subtitle under the title
 * @param author presenter name
 * @param company presenter's company
 * @param date presentation date
 * @param projectId project the presentation belongs to, nullable
 * @param theme visual theme name
 * @param audience intended audience
 * @param objective what the presentation should achieve
 * @param durationMinutes planned length
 */
public record PresentationDetails(
    String title,
    String subtitle,
    String author,
    String company,
    LocalDate date,
    String projectId,
    String theme,
    String audience,
    String objective,
    int durationMinutes) {}
