package com.scholary.vidsub.api;

import com.scholary.vidsub.ffmpeg.TranscoderException;
import com.scholary.vidsub.reconcile.EmptyTranscriptException;
import com.scholary.vidsub.reconcile.ReconciliationException;
import com.scholary.vidsub.render.FontResolutionException;
import com.scholary.vidsub.service.VideoTooLongException;
import com.scholary.vidsub.translation.TranslationException;
import com.scholary.vidsub.whisper.WhisperException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

/**
 * Maps failures to HTTP responses with a consistent {@link ErrorResponse} body.
 *
 * <p>Upstream failures (transcription, translation, ffmpeg) are reported as 502. Messages are
 * truncated because ffmpeg output can be long.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

  private static final Logger LOGGER = LoggerFactory.getLogger(GlobalExceptionHandler.class);

  private static final int MAX_MESSAGE_LENGTH = 3500;

  @ExceptionHandler(ReconciliationException.class)
  public ResponseEntity<ErrorResponse> handleReconciliation(ReconciliationException ex) {
    return respond(HttpStatus.CONFLICT, "count_mismatch", ex);
  }

  @ExceptionHandler(EmptyTranscriptException.class)
  public ResponseEntity<ErrorResponse> handleEmptyTranscript(EmptyTranscriptException ex) {
    return respond(HttpStatus.UNPROCESSABLE_ENTITY, "empty_transcript", ex);
  }

  @ExceptionHandler(FontResolutionException.class)
  public ResponseEntity<ErrorResponse> handleFontResolution(FontResolutionException ex) {
    LOGGER.error("Font resolution failed", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "font_resolution", ex);
  }

  @ExceptionHandler({
    WhisperException.class,
    TranslationException.class,
    TranscoderException.class
  })
  public ResponseEntity<ErrorResponse> handleUpstream(RuntimeException ex) {
    LOGGER.error("Upstream failure: {}", ex.getMessage(), ex);
    return respond(HttpStatus.BAD_GATEWAY, "upstream_failure", ex);
  }

  @ExceptionHandler(VideoTooLongException.class)
  public ResponseEntity<ErrorResponse> handleVideoTooLong(VideoTooLongException ex) {
    return respond(HttpStatus.BAD_REQUEST, "video_too_long", ex);
  }

  @ExceptionHandler(MaxUploadSizeExceededException.class)
  public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
    return respond(HttpStatus.PAYLOAD_TOO_LARGE, "upload_too_large", ex);
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
    String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .reduce((a, b) -> a + ", " + b)
            .orElse("Validation failed");
    return ResponseEntity.badRequest().body(new ErrorResponse("bad_request", truncate(message)));
  }

  @ExceptionHandler({
    IllegalArgumentException.class,
    HttpMessageNotReadableException.class,
    MissingServletRequestPartException.class,
    MissingServletRequestParameterException.class,
    MethodArgumentTypeMismatchException.class
  })
  public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex) {
    return respond(HttpStatus.BAD_REQUEST, "bad_request", ex);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleUnexpected(Exception ex) {
    LOGGER.error("Unhandled error", ex);
    return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", ex);
  }

  private static ResponseEntity<ErrorResponse> respond(
      HttpStatus status, String error, Exception ex) {
    return ResponseEntity.status(status).body(new ErrorResponse(error, truncate(ex.getMessage())));
  }

  static String truncate(String message) {
    if (message == null) {
      return "";
    }
    return message.length() <= MAX_MESSAGE_LENGTH
        ? message
        : message.substring(0, MAX_MESSAGE_LENGTH) + "...";
  }
}
