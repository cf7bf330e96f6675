package com.mifinca.backend.global.error;

import org.springframework.web.server.ResponseStatusException;

public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:mifinca:";

    private final ProblemCategory category;
    private final String code;
    private final String detail;
    private final String type;

    public ProblemException(ProblemCategory category, String code) {
        this(category, code, null, null);
    }

    public ProblemException(ProblemCategory category, String code, String detail) {
        this(category, code, detail, null);
    }

    public ProblemException(ProblemCategory category, String code, String detail, Throwable cause) {
        super(category.getStatus(), code, cause);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.category = category;
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;
    }

    public static ProblemException notFound(String code) {
        return new ProblemException(ProblemCategory.NOT_FOUND, code);
    }

    public static ProblemException forbidden() {
        return new ProblemException(ProblemCategory.FORBIDDEN, "FORBIDDEN");
    }

    public static ProblemException alreadyExists(String code) {
        return new ProblemException(ProblemCategory.ALREADY_EXISTS, code);
    }

    public static ProblemException invalid(String code, String detail) {
        return new ProblemException(ProblemCategory.INVALID, code, detail);
    }

    public ProblemCategory getCategory() {
        return category;
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }
}
