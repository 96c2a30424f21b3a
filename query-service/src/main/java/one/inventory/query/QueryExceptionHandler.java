package one.inventory.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

/**
 * 统一错误响应：{"detail": "..."}
 */
@Slf4j
@RestControllerAdvice
public class QueryExceptionHandler {

    @ExceptionHandler(QueryException.class)
    public ResponseEntity<ErrorDetail> handleQueryException(QueryException e) {
        if (e.getStatus().is5xxServerError()) {
            log.error("❌ 查询处理失败 ({}): {}", e.getStatus().value(), e.getMessage());
        } else {
            log.warn("⚠️ 查询处理失败 ({}): {}", e.getStatus().value(), e.getMessage());
        }
        return ResponseEntity.status(e.getStatus()).body(new ErrorDetail(e.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorDetail handleInvalidRequest(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getDefaultMessage())
                .sorted()
                .collect(Collectors.joining("; "));
        log.warn("⚠️ 请求参数校验失败: {}", detail);
        return new ErrorDetail(detail);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorDetail handleUnreadableBody(HttpMessageNotReadableException e) {
        log.warn("⚠️ 请求体无法解析: {}", e.getMessage());
        return new ErrorDetail("Malformed request body: " + e.getMostSpecificCause().getMessage());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorDetail> handleUnexpected(Exception e) {
        if (e instanceof ErrorResponse) {
            ErrorResponse errorResponse = (ErrorResponse) e;
            log.warn("⚠️ 请求处理失败: {}", e.getMessage());
            return ResponseEntity.status(errorResponse.getStatusCode())
                    .body(new ErrorDetail(errorResponse.getBody().getDetail()));
        }
        log.error("❌ 未知错误", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(new ErrorDetail(String.format("An unexpected error occurred: %s: %s",
                        e.getClass().getSimpleName(), e.getMessage())));
    }
}
