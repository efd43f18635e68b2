package com.syrup.shared.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.util.HexFormat;

/**
 * HMAC SHA256 簽名工具
 * Polymarket 要求每個請求都帶 timestamp + method + path + body 的簽名
 */
public class HmacSignatureUtil {

    private HmacSignatureUtil() {}

    /**
     * 使用 HMAC SHA256 對字串簽名
     *
     * @param data      要簽名的內容
     * @param secretKey API secret，null 視為空字串
     * @return 簽名後的 hex 字串
     */
    public static String sign(String data, String secretKey) {
        try {
            Mac mac = Mac.getInstance("HmacSHA256");
            byte[] key = (secretKey != null ? secretKey : "").getBytes(StandardCharsets.UTF_8);
            // 空 key 不被 SecretKeySpec 接受，以單一 0 byte 代替（HMAC 規格中兩者等價）
            SecretKeySpec keySpec = new SecretKeySpec(key.length > 0 ? key : new byte[1], "HmacSHA256");
            mac.init(keySpec);
            byte[] hash = mac.doFinal(data.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to sign request", e);
        }
    }
}
