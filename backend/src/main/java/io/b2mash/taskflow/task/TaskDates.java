package io.b2mash.taskflow.task;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Lenient parsing of the date strings found in task snapshots. Accepts, in order: an ISO instant
 * ({@code 2024-06-10T09:00:00Z}), an offset date-time ({@code 2024-06-10T09:00:00+02:00}), a local
 * date-time ({@code 2024-06-10T09:00}) and a plain date ({@code 2024-06-10}). Local forms are read
 * in the given zone; a plain date means midnight of that day.
 */
public final class TaskDates {

  private static final Logger log = LoggerFactory.getLogger(TaskDates.class);

  private TaskDates() {}

  /** Returns the parsed instant, or empty for a blank or unparseable value. Never throws. */
  public static Optional<Instant> parse(String raw, ZoneId zone) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String value = raw.trim();

    try {
      return Optional.of(Instant.parse(value));
    } catch (DateTimeParseException ignored) {
      // try the next format
    }
    try {
      return Optional.of(OffsetDateTime.parse(value).toInstant());
    } catch (DateTimeParseException ignored) {
      // try the next format
    }
    try {
      return Optional.of(LocalDateTime.parse(value).atZone(zone).toInstant());
    } catch (DateTimeParseException ignored) {
      // try the next format
    }
    try {
      return Optional.of(LocalDate.parse(value).atStartOfDay(zone).toInstant());
    } catch (DateTimeParseException e) {
      log.debug("Treating unparseable date '{}' as absent", value);
      return Optional.empty();
    }
  }
}
