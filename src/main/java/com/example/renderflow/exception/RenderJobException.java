package com.example.renderflow.exception;

import com.example.renderflow.util.RenderErrorCode;

import java.util.Map;

/**
 * Failure of one pipeline stage. The worker turns it into a single terminal failure write
 * carrying {@link #getCode()}.
 */
public class RenderJobException extends RuntimeException {
    private final RenderErrorCode code;
    private final Map<String, Object> details;

    public RenderJobException(RenderErrorCode code, String message) {
        this(code, message, null, Map.of());
    }

    public RenderJobException(RenderErrorCode code, String message, Throwable cause) {
        this(code, message, cause, Map.of());
    }

    public RenderJobException(RenderErrorCode code, String message, Throwable cause, Map<String, Object> details) {
        super(message, cause);
        this.code = code;
        this.details = details == null ? Map.of() : details;
    }

    public RenderErrorCode getCode() {
        return code;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
