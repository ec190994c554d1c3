package com.example.renderflow.exception;

import com.example.renderflow.util.RenderErrorCode;

public class PlanValidationException extends RenderJobException {
    public PlanValidationException(String message) {
        super(RenderErrorCode.VALIDATION, message);
    }
}
