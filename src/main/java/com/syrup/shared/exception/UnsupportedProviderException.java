package com.syrup.shared.exception;

/**
 * 找不到對應 AI 供應商的實作（建立 agent 時拋出，API 層轉成 400）
 */
public class UnsupportedProviderException extends RuntimeException {

    public UnsupportedProviderException(String message) {
        super(message);
    }
}
