package com.syrup.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.NonNull;
import lombok.ToString;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * 單一平台的憑證
 *
 * 對 TradeRouter 而言是不透明的，只有對應的 adapter 在建構時讀取。
 * 各平台用到的欄位：
 * - Solana: rpc_url, private_key (base58 keypair)
 * - Polymarket: api_key, secret, passphrase
 * - Kalshi: api_key (登入帳號), private_key (登入密碼)
 */
@Value
@Builder
@Jacksonized
public class PlatformCredentials {

    @NonNull
    Platform platform;

    @JsonProperty("rpc_url")
    String rpcUrl;

    @ToString.Exclude
    @JsonProperty("api_key")
    String apiKey;

    @ToString.Exclude
    String secret;

    @ToString.Exclude
    @JsonProperty("private_key")
    String privateKey;

    @ToString.Exclude
    String passphrase;

    @JsonProperty("wallet_address")
    String walletAddress;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
