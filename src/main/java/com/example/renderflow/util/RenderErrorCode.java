package com.example.renderflow.util;

public enum RenderErrorCode {
    VALIDATION,
    ASSET_DOWNLOAD,
    ENCODER_SPAWN,
    ENCODER_EXEC,
    TIMEOUT,
    SYSTEM_RESTART,
    INTERNAL
}
