package com.example.dutyroster.exception;

import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(ConstraintViolationException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getConstraintViolations().forEach((violation) -> {
            String path = violation.getPropertyPath().toString();
            String fieldName = path.substring(path.lastIndexOf('.') + 1);
            errors.put(fieldName, violation.getMessage());
        });

        ErrorResponse errorResponse = new ErrorResponse(
                "バリデーションエラー",
                "入力データに問題があります",
                errors,
                LocalDateTime.now()
        );

        logger.warn("バリデーションエラーが発生しました: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(InstanceFormatException.class)
    public ResponseEntity<ErrorResponse> handleInstanceFormatException(InstanceFormatException ex) {
        Map<String, String> details = new HashMap<>();
        details.put("errorCode", ex.getErrorCode());
        if (ex.getSection() != null) {
            details.put("section", ex.getSection());
        }
        if (ex.getLineNumber() > 0) {
            details.put("line", Integer.toString(ex.getLineNumber()));
        }
        ErrorResponse errorResponse = new ErrorResponse(
                "インスタンス書式エラー",
                ex.getMessage(),
                details,
                LocalDateTime.now()
        );

        logger.warn("インスタンス書式エラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "業務エラー",
                ex.getMessage(),
                Map.of("errorCode", ex.getErrorCode()),
                LocalDateTime.now()
        );

        logger.warn("業務エラーが発生しました: {} {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "引数エラー",
                String.format("パラメータ %s の値が不正です: %s", ex.getName(), ex.getValue()),
                null,
                LocalDateTime.now()
        );

        logger.warn("引数エラーが発生しました: {}={}", ex.getName(), ex.getValue());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ErrorResponse> handleUnreadableRequest(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "リクエストエラー",
                "リクエスト本文を読み取れません",
                null,
                LocalDateTime.now()
        );

        logger.warn("リクエスト本文を読み取れません: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "未定義のパス",
                "リソースが見つかりません: /" + ex.getResourcePath(),
                null,
                LocalDateTime.now()
        );

        logger.debug("未定義のパスへのリクエスト: {}", ex.getResourcePath());
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(errorResponse);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "引数エラー",
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.warn("引数エラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "内部サーバーエラー",
                "予期しないエラーが発生しました",
                null,
                LocalDateTime.now()
        );

        logger.error("予期しないエラーが発生しました", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
