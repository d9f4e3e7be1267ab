package io.b2mash.taskflow.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * A well-formed request that cannot be served as asked. Answers 400; when a single input value is
 * to blame it is echoed back as the {@code rejectedValue} problem property.
 */
public class InvalidStateException extends ErrorResponseException {

  public InvalidStateException(String title, String detail) {
    this(title, detail, null);
  }

  public InvalidStateException(String title, String detail, Object rejectedValue) {
    super(
        HttpStatus.BAD_REQUEST,
        ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail),
        null);
    getBody().setTitle(title);
    if (rejectedValue != null) {
      getBody().setProperty("rejectedValue", rejectedValue);
    }
  }
}
