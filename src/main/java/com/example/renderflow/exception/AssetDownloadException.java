package com.example.renderflow.exception;

import com.example.renderflow.util.RenderErrorCode;

import java.util.Map;

public class AssetDownloadException extends RenderJobException {
    public AssetDownloadException(String url, String message, Throwable cause) {
        super(RenderErrorCode.ASSET_DOWNLOAD, message, cause, Map.of("url", url));
    }
}
