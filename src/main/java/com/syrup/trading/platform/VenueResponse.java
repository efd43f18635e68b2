package com.syrup.trading.platform;

import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import lombok.Getter;

/**
 * 平台 HTTP 呼叫的結果
 *
 * 兩種情況：
 * - 傳輸失敗（斷線、逾時、回應不是 JSON）：transportFailure = true，error 為原因
 * - 收到回應：httpCode + body，4xx/5xx 的 body 也保留，讓平台的拒絕訊息原樣帶出去
 */
@Getter
public final class VenueResponse {

    private final boolean transportFailure;
    private final int httpCode;
    private final JsonElement body;
    private final String error;

    private VenueResponse(boolean transportFailure, int httpCode, JsonElement body, String error) {
        this.transportFailure = transportFailure;
        this.httpCode = httpCode;
        this.body = body != null ? body : JsonNull.INSTANCE;
        this.error = error;
    }

    public static VenueResponse of(int httpCode, JsonElement body) {
        return new VenueResponse(false, httpCode, body, null);
    }

    public static VenueResponse failure(String error) {
        return new VenueResponse(true, 0, JsonNull.INSTANCE, error);
    }

    public boolean isHttpSuccess() {
        return !transportFailure && httpCode >= 200 && httpCode < 300;
    }

    /**
     * body 不是 JSON object 時回傳空物件，方便呼叫端直接 has()/get()
     */
    public JsonObject object() {
        return body.isJsonObject() ? body.getAsJsonObject() : new JsonObject();
    }

    /**
     * 取出平台回傳的錯誤訊息；error 可能是字串或 {"message": ...} 物件
     */
    public String errorMessage(String fallback) {
        if (transportFailure) {
            return error;
        }
        JsonObject json = object();
        if (json.has("error") && !json.get("error").isJsonNull()) {
            JsonElement err = json.get("error");
            if (err.isJsonPrimitive()) {
                return err.getAsString();
            }
            if (err.isJsonObject() && err.getAsJsonObject().has("message")) {
                return err.getAsJsonObject().get("message").getAsString();
            }
            return err.toString();
        }
        if (json.has("message") && json.get("message").isJsonPrimitive()) {
            return json.get("message").getAsString();
        }
        return fallback;
    }
}
