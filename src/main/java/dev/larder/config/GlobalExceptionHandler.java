package dev.larder.config;

import dev.larder.provider.UnsupportedLocaleException;
import dev.larder.validation.ImportSessionNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * Maps {@link IllegalArgumentException} (unknown provider, unknown catalog id, invalid input)
   * to a 400 Bad Request Problem Detail.
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail = ex.getBindingResult().getFieldErrors().stream()
        .map(error -> error.getField() + " " + error.getDefaultMessage())
        .findFirst()
        .orElse("Invalid request body");
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
  }

  /**
   * Maps {@link UnsupportedLocaleException} to 422: the provider exists but has no edition for
   * the configured language.
   */
  @ExceptionHandler(UnsupportedLocaleException.class)
  ProblemDetail handleUnsupportedLocale(UnsupportedLocaleException ex) {
    ProblemDetail problem = ProblemDetail.forStatusAndDetail(HttpStatus.UNPROCESSABLE_ENTITY, ex.getMessage());
    problem.setProperty("provider", ex.getProviderId());
    problem.setProperty("language", ex.getLanguage());
    return problem;
  }

  @ExceptionHandler(ImportSessionNotFoundException.class)
  ProblemDetail handleSessionNotFound(ImportSessionNotFoundException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  /** Maps {@link IllegalStateException} (import step called in the wrong phase) to 409. */
  @ExceptionHandler(IllegalStateException.class)
  ProblemDetail handleIllegalState(IllegalStateException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
  }
}
