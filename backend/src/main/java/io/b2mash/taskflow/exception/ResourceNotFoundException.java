package io.b2mash.taskflow.exception;

import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.ErrorResponseException;

/**
 * An id that names nothing open right now, such as a draft that was submitted, discarded or
 * expired. The problem body carries {@code resourceType} and {@code resourceId}.
 */
public class ResourceNotFoundException extends ErrorResponseException {

  private final String resourceType;
  private final Object resourceId;

  public ResourceNotFoundException(String resourceType, Object resourceId) {
    super(
        HttpStatus.NOT_FOUND,
        ProblemDetail.forStatusAndDetail(
            HttpStatus.NOT_FOUND, "No " + resourceType + " found with id " + resourceId),
        null);
    this.resourceType = resourceType;
    this.resourceId = resourceId;
    getBody().setTitle(resourceType + " not found");
    getBody().setProperty("resourceType", resourceType);
    getBody().setProperty("resourceId", String.valueOf(resourceId));
  }

  public String getResourceType() {
    return resourceType;
  }

  public Object getResourceId() {
    return resourceId;
  }
}
