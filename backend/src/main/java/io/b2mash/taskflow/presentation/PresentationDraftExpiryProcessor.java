package io.b2mash.taskflow.presentation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Scheduled job that discards presentation drafts nobody has touched within the idle timeout. */
@Component
public class PresentationDraftExpiryProcessor {

  private static final Logger log = LoggerFactory.getLogger(PresentationDraftExpiryProcessor.class);

  private final PresentationDraftService draftService;

  public PresentationDraftExpiryProcessor(PresentationDraftService draftService) {
    this.draftService = draftService;
  }

  @Scheduled(fixedRateString = "${taskflow.presentation.expiry-interval:600000}")
  public void expireIdleDrafts() {
    int expired = draftService.expireIdleDrafts();
    if (expired > 0) {
      log.info(
          "Draft expiry processor completed: {} drafts expired, {} still open",
          expired,
          draftService.openDraftCount());
    } else {
      log.debug("Draft expiry processor completed: no drafts expired");
    }
  }
}
