package com.climateplatform.collector.controller;

import com.climateplatform.collector.dto.ErrorResponse;
import com.climateplatform.common.exception.ClimateDataException;
import com.climateplatform.common.exception.InvalidRangeException;
import com.climateplatform.common.exception.InvalidSourceException;
import com.climateplatform.common.exception.SourceUnavailableException;
import com.climateplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebExchange;

import java.time.Instant;

/** Maps the collector error taxonomy onto HTTP status codes. */
@RestControllerAdvice
public class ClimateDataExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ClimateDataExceptionHandler.class);

    @ExceptionHandler(InvalidSourceException.class)
    public ResponseEntity<ErrorResponse> invalidSource(InvalidSourceException e, ServerWebExchange exchange) {
        return respond(HttpStatus.NOT_FOUND, e, exchange);
    }

    @ExceptionHandler(InvalidRangeException.class)
    public ResponseEntity<ErrorResponse> invalidRange(InvalidRangeException e, ServerWebExchange exchange) {
        return respond(HttpStatus.BAD_REQUEST, e, exchange);
    }

    @ExceptionHandler(SourceUnavailableException.class)
    public ResponseEntity<ErrorResponse> sourceUnavailable(SourceUnavailableException e, ServerWebExchange exchange) {
        log.error("Source unavailable. source={}", e.getSource(), e.getCause());
        return respond(HttpStatus.BAD_GATEWAY, e, exchange);
    }

    @ExceptionHandler(ClimateDataException.class)
    public ResponseEntity<ErrorResponse> other(ClimateDataException e, ServerWebExchange exchange) {
        log.error("Unhandled collector error. source={}", e.getSource(), e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, e, exchange);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, ClimateDataException e, ServerWebExchange exchange) {
        String traceId = exchange.getRequest().getHeaders().getFirst(TraceContextUtil.TRACE_ID_HEADER);
        ErrorResponse body = new ErrorResponse(status.value(), status.getReasonPhrase(), e.getSource(),
            e.getMessage(), traceId == null ? "unknown" : traceId, Instant.now());
        log.warn("Request failed. status={} source={} message={}", status.value(), e.getSource(), e.getMessage());
        return ResponseEntity.status(status).body(body);
    }
}
