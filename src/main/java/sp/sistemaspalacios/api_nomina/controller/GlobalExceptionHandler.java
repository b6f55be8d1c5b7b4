package sp.sistemaspalacios.api_nomina.controller;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import sp.sistemaspalacios.api_nomina.exception.*;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler({ConflictException.class, NotActiveException.class, AmbiguousScheduleException.class})
    public ResponseEntity<Map<String, Object>> handleConflict(PayrollDomainException e) {
        log.warn("⚠️ {}", e.getMessage());
        return body(HttpStatus.CONFLICT, "Conflict", e);
    }

    @ExceptionHandler({ContractInactiveException.class, EvidenceRequiredException.class,
            CycleDetectedException.class, SettingsDepthExceededException.class})
    public ResponseEntity<Map<String, Object>> handleUnprocessable(PayrollDomainException e) {
        log.warn("⚠️ {}", e.getMessage());
        return body(HttpStatus.UNPROCESSABLE_ENTITY, "Unprocessable Entity", e);
    }

    @ExceptionHandler(PermissionDeniedException.class)
    public ResponseEntity<Map<String, Object>> handleForbidden(PermissionDeniedException e) {
        log.warn("⚠️ {}", e.getMessage());
        return body(HttpStatus.FORBIDDEN, "Forbidden", e);
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ResourceNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, "Not Found", e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleBadRequest(IllegalArgumentException e) {
        return body(HttpStatus.BAD_REQUEST, "Bad Request", e);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(MethodArgumentNotValidException e) {
        String message = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", "Bad Request");
        response.put("message", message);
        response.put("exceptionType", e.getClass().getSimpleName());
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(HttpMessageNotReadableException e) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", "Bad Request");
        response.put("message", "Cuerpo de la petición ausente o mal formado");
        response.put("exceptionType", e.getClass().getSimpleName());
        return new ResponseEntity<>(response, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleException(Exception e) {
        log.error("❌ Error no controlado", e);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", "Internal Server Error");
        response.put("message", e.getMessage());
        response.put("exceptionType", e.getClass().getSimpleName());
        Throwable rootCause = getRootCause(e);
        response.put("rootCause", rootCause.getClass().getSimpleName());
        return new ResponseEntity<>(response, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String error, RuntimeException e) {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("error", error);
        response.put("message", e.getMessage());
        response.put("exceptionType", e.getClass().getSimpleName());
        return new ResponseEntity<>(response, status);
    }

    private static Throwable getRootCause(Throwable throwable) {
        Throwable rootCause = throwable;
        while (rootCause.getCause() != null) {
            rootCause = rootCause.getCause();
        }
        return rootCause;
    }
}
