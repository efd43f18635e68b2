package com.syrup.shared.dto;

import lombok.Value;

/**
 * REST 錯誤回應，由 GlobalExceptionHandler 產生
 *
 * 400：不支援的平台 / 憑證不足 / 請求 body 格式錯誤 / 欄位驗證失敗
 * 404：agent 名稱不存在
 * 500：其他未預期例外
 *
 * 交易本身的失敗不走這裡，是 200 + FAILED 的 TradeResult。
 */
@Value
public class ErrorResponse {

    /** 錯誤分類 */
    String error;

    /** 底層例外訊息 */
    String message;
}
