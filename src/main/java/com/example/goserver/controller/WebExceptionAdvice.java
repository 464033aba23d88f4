package com.example.goserver.controller;

import com.example.goserver.ai.AiCancelledException;
import com.example.goserver.ai.AiUnavailableException;
import com.example.goserver.ai.AiUnresponsiveException;
import com.example.goserver.logic.RuleViolationException;
import com.example.goserver.model.dto.ErrorResponse;
import com.example.goserver.service.GameNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice
public class WebExceptionAdvice {

    @ExceptionHandler(GameNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public ErrorResponse notFound(GameNotFoundException e) {
        return ErrorResponse.of("NOT_FOUND", e);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public ErrorResponse badRequest(Exception e) {
        return ErrorResponse.of("BAD_REQUEST", e);
    }

    @ExceptionHandler(RuleViolationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse ruleViolation(RuleViolationException e) {
        return ErrorResponse.of(e.getReason().name(), e);
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public ErrorResponse conflict(IllegalStateException e) {
        return ErrorResponse.of("CONFLICT", e);
    }

    @ExceptionHandler({AiUnavailableException.class, AiUnresponsiveException.class, AiCancelledException.class})
    @ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
    public ErrorResponse aiUnavailable(RuntimeException e) {
        log.warn("AI engine unavailable: {}", e.getMessage());
        return ErrorResponse.of("AI_UNAVAILABLE", e);
    }
}
