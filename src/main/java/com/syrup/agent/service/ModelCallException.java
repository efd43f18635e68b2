package com.syrup.agent.service;

/**
 * 呼叫 AI 供應商失敗（連線錯誤、HTTP 非 2xx、回應格式不對）
 * 只在 agent 內部流動，對外轉成 error 分析結果或「不交易」
 */
public class ModelCallException extends Exception {

    public ModelCallException(String message) {
        super(message);
    }

    public ModelCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
