package com.agentflow.api.rest;

import com.agentflow.core.exception.AgentAlreadyRunningException;
import com.agentflow.core.exception.AgentExecutionException;
import com.agentflow.core.exception.AgentFlowException;
import com.agentflow.core.exception.NotFoundException;
import com.agentflow.core.exception.PipelineConfigException;
import com.agentflow.core.exception.PromptNotPendingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps the agentflow exception tree to HTTP responses.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ErrorResponse> notFound(NotFoundException e) {
        return respond(HttpStatus.NOT_FOUND, e);
    }

    @ExceptionHandler({AgentAlreadyRunningException.class, PromptNotPendingException.class})
    public ResponseEntity<ErrorResponse> conflict(AgentFlowException e) {
        return respond(HttpStatus.CONFLICT, e);
    }

    @ExceptionHandler({PipelineConfigException.class, AgentExecutionException.class})
    public ResponseEntity<ErrorResponse> unprocessable(AgentFlowException e) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, e);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> badRequest(IllegalArgumentException e) {
        return ResponseEntity.badRequest().body(new ErrorResponse("BAD_REQUEST", e.getMessage()));
    }

    @ExceptionHandler(AgentFlowException.class)
    public ResponseEntity<ErrorResponse> internal(AgentFlowException e) {
        log.error("Request failed: {}", e.getMessage(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e);
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, AgentFlowException e) {
        return ResponseEntity.status(status).body(new ErrorResponse(e.getErrorCode(), e.getMessage()));
    }

    public record ErrorResponse(String errorCode, String message) {}
}
