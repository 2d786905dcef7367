package io.dealmotion.autopilot.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.ErrorResponseException;

public class ResourceConflictException extends ErrorResponseException {

  public ResourceConflictException(String title, String detail) {
    super(
        HttpStatus.CONFLICT,
        InvalidStateException.problem(HttpStatus.CONFLICT, title, detail),
        null);
  }
}
