package com.syrup.shared.exception;

/**
 * 找不到對應平台的 adapter（註冊時拋出，API 層轉成 400）
 */
public class UnsupportedPlatformException extends RuntimeException {

    public UnsupportedPlatformException(String message) {
        super(message);
    }
}
