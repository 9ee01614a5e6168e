package dev.lorekeeper.config;

import dev.lorekeeper.answer.CompletionProviderException;
import dev.lorekeeper.querylog.QueryLogNotFoundException;
import dev.lorekeeper.querylog.QueryLoggingException;
import dev.lorekeeper.resource.ResourceNotFoundException;
import java.util.stream.Collectors;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>400 - {@link IllegalArgumentException}, bean validation failures
 *   <li>404 - unknown resource or query id
 *   <li>500 - a completed query could not be logged
 *   <li>502 - the completion provider failed
 *   <li>503 - a worker pool is saturated
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  /**
   * Maps {@link IllegalArgumentException} to a 400 Bad Request Problem Detail.
   *
   * @param ex the exception thrown by validation logic
   * @return a Problem Detail with HTTP 400 status and the exception message
   */
  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleInvalidBody(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .collect(Collectors.joining("; "));
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
  }

  @ExceptionHandler({ResourceNotFoundException.class, QueryLogNotFoundException.class})
  ProblemDetail handleNotFound(RuntimeException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(QueryLoggingException.class)
  ProblemDetail handleQueryLogging(QueryLoggingException ex) {
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.INTERNAL_SERVER_ERROR, "The answer could not be recorded");
  }

  @ExceptionHandler(CompletionProviderException.class)
  ProblemDetail handleCompletionProvider(CompletionProviderException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_GATEWAY, ex.getMessage());
  }

  @ExceptionHandler(TaskRejectedException.class)
  ProblemDetail handleRejected(TaskRejectedException ex) {
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.SERVICE_UNAVAILABLE, "Server is busy, retry later");
  }
}
