package dev.newsdesk.config;

import java.util.stream.Collectors;

import dev.newsdesk.ingestion.ItemNotFoundException;
import dev.newsdesk.ledger.CrawlAlreadyRunningException;
import dev.newsdesk.ledger.CrawlRunNotFoundException;
import dev.newsdesk.run.DispatchRejectedException;
import dev.newsdesk.source.DuplicateSourceException;
import dev.newsdesk.source.SourceNotFoundException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Global REST error handler that maps application exceptions to RFC 9457 Problem Detail responses.
 *
 * <ul>
 *   <li>400 - invalid input (bean validation, bad parameters, {@link IllegalArgumentException})
 *   <li>404 - unknown source, crawl run or item
 *   <li>409 - duplicate source name, crawl already running
 *   <li>503 - crawl worker pool saturated
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  @ExceptionHandler(IllegalArgumentException.class)
  ProblemDetail handleIllegalArgument(IllegalArgumentException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, ex.getMessage());
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  ProblemDetail handleValidation(MethodArgumentNotValidException ex) {
    String detail =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + ": " + error.getDefaultMessage())
            .sorted()
            .collect(Collectors.joining("; "));
    return ProblemDetail.forStatusAndDetail(HttpStatus.BAD_REQUEST, detail);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  ProblemDetail handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return ProblemDetail.forStatusAndDetail(
        HttpStatus.BAD_REQUEST, "Invalid value for parameter '" + ex.getName() + "'");
  }

  @ExceptionHandler({
    SourceNotFoundException.class,
    CrawlRunNotFoundException.class,
    ItemNotFoundException.class
  })
  ProblemDetail handleNotFound(RuntimeException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler({DuplicateSourceException.class, CrawlAlreadyRunningException.class})
  ProblemDetail handleConflict(RuntimeException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.CONFLICT, ex.getMessage());
  }

  @ExceptionHandler(DispatchRejectedException.class)
  ProblemDetail handleRejected(DispatchRejectedException ex) {
    return ProblemDetail.forStatusAndDetail(HttpStatus.SERVICE_UNAVAILABLE, ex.getMessage());
  }
}
