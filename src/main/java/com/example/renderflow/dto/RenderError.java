package com.example.renderflow.dto;

import com.example.renderflow.exception.RenderJobException;
import com.example.renderflow.util.RenderErrorCode;

import java.util.Map;

public record RenderError(RenderErrorCode code,
                          String message,
                          Map<String, Object> details) {

    public static RenderError of(RenderErrorCode code, String message) {
        return new RenderError(code, message, Map.of());
    }

    public static RenderError from(RenderJobException ex) {
        return new RenderError(ex.getCode(), ex.getMessage(), ex.getDetails());
    }
}
