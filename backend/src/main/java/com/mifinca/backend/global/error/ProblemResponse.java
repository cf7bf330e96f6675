package com.mifinca.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

/**
 * Error body returned by every endpoint, shaped after RFC 7807. {@code code} is the stable
 * machine-readable key clients branch on ({@code ANIMAL_NOT_FOUND}, {@code FORBIDDEN}, ...);
 * {@code type} is a URN derived from it.
 */
public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String TYPE_URN_PREFIX = "urn:mifinca:problem:";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        String problemCode = (code == null || code.isBlank())
                ? httpStatus.name()
                : code.trim().toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]+", "_");
        String problemDetail = (detail == null || detail.isBlank()) ? httpStatus.getReasonPhrase() : detail;
        String type = TYPE_URN_PREFIX + problemCode.toLowerCase(Locale.ROOT).replace('_', '-');
        return new ProblemResponse(type, httpStatus.getReasonPhrase(), httpStatus.value(), problemDetail, instance, problemCode);
    }
}
