package com.covidanalytics.api;

import com.covidanalytics.domain.error.ErrorKind;
import lombok.Value;

import java.time.Instant;

/**
 * Body returned for every failed request.
 */
@Value
public class ErrorResponse {
    Instant timestamp;
    ErrorKind kind;
    String detail;

    public static ErrorResponse of(ErrorKind kind, String detail) {
        return new ErrorResponse(Instant.now(), kind, detail);
    }
}
