package com.example.goserver.model.dto;

/**
 * Body of every rejected request, REST or STOMP.
 */
public record ErrorResponse(String error, String message) {

    public static ErrorResponse of(String error, Throwable e) {
        return new ErrorResponse(error, e.getMessage());
    }
}
