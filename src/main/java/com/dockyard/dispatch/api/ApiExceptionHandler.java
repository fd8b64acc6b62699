package com.dockyard.dispatch.api;

import com.dockyard.core.ports.PortConflictException;
import com.dockyard.core.ports.PortExhaustedException;
import com.dockyard.core.production.DeploymentInProgressException;
import com.dockyard.core.production.InvalidTransitionException;
import com.dockyard.core.production.RollbackFailedException;
import com.dockyard.core.production.VersionNotFoundException;
import com.dockyard.core.project.ProjectNotFoundException;
import com.dockyard.core.queue.InvalidJobStateException;
import com.dockyard.core.queue.JobNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps domain exceptions to {@code {"error": "..."}} bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler({JobNotFoundException.class, ProjectNotFoundException.class, VersionNotFoundException.class})
    public ResponseEntity<Map<String, Object>> notFound(RuntimeException e) {
        return error(HttpStatus.NOT_FOUND, e.getMessage());
    }

    @ExceptionHandler({InvalidJobStateException.class, DeploymentInProgressException.class,
            InvalidTransitionException.class, PortConflictException.class})
    public ResponseEntity<Map<String, Object>> conflict(RuntimeException e) {
        return error(HttpStatus.CONFLICT, e.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> unreadable(HttpMessageNotReadableException e) {
        return error(HttpStatus.BAD_REQUEST, "Malformed request body");
    }

    @ExceptionHandler(PortExhaustedException.class)
    public ResponseEntity<Map<String, Object>> portsExhausted(PortExhaustedException e) {
        log.error("Port range exhausted: {}", e.getMessage());
        return error(HttpStatus.SERVICE_UNAVAILABLE, e.getMessage());
    }

    @ExceptionHandler(RollbackFailedException.class)
    public ResponseEntity<Map<String, Object>> rollbackFailed(RollbackFailedException e) {
        log.error("Rollback failed: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("error", message != null ? message : status.getReasonPhrase()));
    }
}
