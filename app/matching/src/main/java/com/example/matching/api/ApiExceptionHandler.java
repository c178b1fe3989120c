/*
 * どこで: Matching API
 * 何を: 例外を HTTP レスポンスへ変換する
 * なぜ: API 仕様に沿ったエラー応答を統一するため
 */
package com.example.matching.api;

import com.example.matching.model.InvalidPairException;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.support.DefaultMessageSourceResolvable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

@RestControllerAdvice
public class ApiExceptionHandler {

  private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

  @ExceptionHandler(InvalidSelfActionException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidSelfAction(InvalidSelfActionException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_SELF_ACTION, ex.getMessage());
  }

  @ExceptionHandler(InvalidPairException.class)
  public ResponseEntity<ApiErrorResponse> handleInvalidPair(InvalidPairException ex) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.INVALID_PAIR, ex.getMessage());
  }

  @ExceptionHandler(DecisionAlreadyExistsException.class)
  public ResponseEntity<ApiErrorResponse> handleDecisionAlreadyExists(
      DecisionAlreadyExistsException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.DECISION_ALREADY_EXISTS, ex.getMessage());
  }

  @ExceptionHandler(NoActiveMatchException.class)
  public ResponseEntity<ApiErrorResponse> handleNoActiveMatch(NoActiveMatchException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.NO_ACTIVE_MATCH, ex.getMessage());
  }

  @ExceptionHandler(NotAMatchMemberException.class)
  public ResponseEntity<ApiErrorResponse> handleNotAMatchMember(NotAMatchMemberException ex) {
    return error(HttpStatus.FORBIDDEN, ApiErrorCode.NOT_A_MATCH_MEMBER, ex.getMessage());
  }

  @ExceptionHandler(UserNotFoundException.class)
  public ResponseEntity<ApiErrorResponse> handleUserNotFound(UserNotFoundException ex) {
    return error(HttpStatus.NOT_FOUND, ApiErrorCode.USER_NOT_FOUND, ex.getMessage());
  }

  @ExceptionHandler(UserAlreadyExistsException.class)
  public ResponseEntity<ApiErrorResponse> handleUserAlreadyExists(UserAlreadyExistsException ex) {
    return error(HttpStatus.CONFLICT, ApiErrorCode.USER_ALREADY_EXISTS, ex.getMessage());
  }

  @ExceptionHandler(StorageUnavailableException.class)
  public ResponseEntity<ApiErrorResponse> handleStorageUnavailable(StorageUnavailableException ex) {
    logger.warn("storage unavailable operation={}", ex.operation(), ex);
    return error(
        HttpStatus.SERVICE_UNAVAILABLE, ApiErrorCode.STORAGE_UNAVAILABLE, "storage unavailable");
  }

  @ExceptionHandler(MissingRequestHeaderException.class)
  public ResponseEntity<ApiErrorResponse> handleMissingHeader(MissingRequestHeaderException ex) {
    if (UserIdHeader.NAME.equalsIgnoreCase(ex.getHeaderName())) {
      return error(HttpStatus.UNAUTHORIZED, ApiErrorCode.UNAUTHENTICATED, "user not authenticated");
    }
    return badRequest(ex.getHeaderName() + " is required");
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  public ResponseEntity<ApiErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
    return badRequest(ex.getName() + " is invalid");
  }

  @ExceptionHandler(MethodArgumentNotValidException.class)
  public ResponseEntity<ApiErrorResponse> handleMethodArgumentNotValid(
      MethodArgumentNotValidException ex) {
    // フィールド単位のメッセージを優先し、クライアントに最短で伝える。
    final String message =
        ex.getBindingResult().getFieldErrors().stream()
            .map(DefaultMessageSourceResolvable::getDefaultMessage)
            .filter(this::hasText)
            .findFirst()
            .orElse("request body is invalid");
    return badRequest(message);
  }

  @ExceptionHandler(HttpMessageNotReadableException.class)
  public ResponseEntity<ApiErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
    // JSONパーサの内部文言は露出しない。
    final String rawMessage = Optional.ofNullable(ex.getMessage()).orElse("");
    if (rawMessage.contains("Required request body is missing")) {
      return badRequest("request body is required");
    }
    return badRequest("request body is invalid");
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<ApiErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
    return badRequest(ex.getMessage());
  }

  @ExceptionHandler(RuntimeException.class)
  public ResponseEntity<ApiErrorResponse> handleRuntime(RuntimeException ex) {
    logger.error("unhandled api error", ex);
    return error(
        HttpStatus.INTERNAL_SERVER_ERROR, ApiErrorCode.INTERNAL_ERROR, "internal server error");
  }

  private ResponseEntity<ApiErrorResponse> badRequest(String message) {
    return error(HttpStatus.BAD_REQUEST, ApiErrorCode.BAD_REQUEST, message);
  }

  private ResponseEntity<ApiErrorResponse> error(
      HttpStatus status, ApiErrorCode code, String message) {
    return ResponseEntity.status(status).body(new ApiErrorResponse(code, message));
  }

  private boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
