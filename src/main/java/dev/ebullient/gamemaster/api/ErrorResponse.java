package dev.ebullient.gamemaster.api;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(
        String error,
        String message,
        String path,
        String expected,
        String actual) {

    public static ErrorResponse of(String error, String message) {
        return new ErrorResponse(error, message, null, null, null);
    }
}
