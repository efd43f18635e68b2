package com.syrup.trading.platform.solana;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.syrup.shared.exception.InvalidCredentialsException;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.PlatformCredentials;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeResult;
import com.syrup.shared.model.TradeStatus;
import com.syrup.shared.model.TradeType;
import com.syrup.trading.config.VenueConfig;
import com.syrup.trading.platform.AbstractPlatformAdapter;
import com.syrup.trading.platform.TradeValidation;
import com.syrup.trading.platform.VenueResponse;
import lombok.extern.slf4j.Slf4j;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Solana 鏈上 swap（Jupiter aggregator）
 *
 * 下單流程：
 * 1. Jupiter /quote 取得報價（amount 轉成最小單位，slippage 轉成 bps）
 * 2. Jupiter /swap 取得序列化交易
 * 3. 用錢包私鑰簽名
 * 4. RPC sendTransaction 送出，回傳交易簽名作為 trade_id
 *
 * 只接受 SWAP；鏈上交易一旦送出就無法撤銷，cancelOrder 永遠是 false。
 */
@Slf4j
public class SolanaAdapter extends AbstractPlatformAdapter {

    static final String WALLET_NOT_INITIALIZED = "wallet not initialized";

    private static final String TOKEN_PROGRAM_ID = "TokenkegQfeZyiNwAJbNbGKPFXCWuBvf9Ss623VQ5DA";
    private static final long BASE_FEE_LAMPORTS = 5000;

    private final String rpcUrl;
    private final String quoteApiUrl;
    private final String priceApiUrl;
    private final SolanaKeypair wallet;
    private final AtomicLong rpcRequestId = new AtomicLong(1);

    public SolanaAdapter(PlatformCredentials credentials, OkHttpClient baseClient, VenueConfig venueConfig) {
        super(baseClient, venueConfig.getReadTimeoutSeconds());
        requirePlatform(Platform.SOLANA, credentials.getPlatform());
        this.rpcUrl = credentials.getRpcUrl() != null && !credentials.getRpcUrl().isBlank()
                ? credentials.getRpcUrl() : venueConfig.getSolanaRpcUrl();
        this.quoteApiUrl = venueConfig.getJupiterQuoteUrl();
        this.priceApiUrl = venueConfig.getJupiterPriceUrl();
        this.wallet = loadWallet(credentials.getPrivateKey());
        log.info("Solana adapter 初始化: rpc={} wallet={}", rpcUrl, wallet != null ? wallet.address() : "未設定");
    }

    private static SolanaKeypair loadWallet(String privateKey) {
        if (privateKey == null || privateKey.isBlank()) {
            return null;
        }
        try {
            return SolanaKeypair.fromBase58(privateKey);
        } catch (IllegalArgumentException e) {
            throw new InvalidCredentialsException("Invalid Solana private key: " + e.getMessage(), e);
        }
    }

    @Override
    public Platform platform() {
        return Platform.SOLANA;
    }

    @Override
    protected Set<TradeType> supportedTradeTypes() {
        return Set.of(TradeType.SWAP);
    }

    public Optional<String> walletAddress() {
        return Optional.ofNullable(wallet).map(SolanaKeypair::address);
    }

    /**
     * 沒有錢包就直接拒絕，不發任何網路請求
     */
    @Override
    public TradeValidation validateTrade(TradeRequest trade) {
        if (wallet == null) {
            return TradeValidation.reject(WALLET_NOT_INITIALIZED);
        }
        return super.validateTrade(trade);
    }

    // ==================== 下單 ====================

    @Override
    protected TradeResult submitTrade(TradeRequest trade) {
        Optional<SwapPair> pairOpt = SwapPair.parse(trade.getSymbol());
        if (pairOpt.isEmpty()) {
            return TradeResult.failed(platform(),
                    "Unsupported swap symbol: " + trade.getSymbol() + " (expected IN/OUT, e.g. SOL/USDC)");
        }
        SwapPair pair = pairOpt.get();

        OptionalLong baseUnits = pair.input().toBaseUnits(trade.getAmount());
        if (baseUnits.isEmpty()) {
            return TradeResult.failed(platform(), "Amount too large for " + pair.input());
        }
        long inBaseUnits = baseUnits.getAsLong();

        // 1. 報價
        int slippageBps = (int) Math.round(trade.getSlippage() * 10_000);
        HttpUrl quoteUrl = HttpUrl.get(quoteApiUrl + "/quote").newBuilder()
                .addQueryParameter("inputMint", pair.input().getMint())
                .addQueryParameter("outputMint", pair.output().getMint())
                .addQueryParameter("amount", String.valueOf(inBaseUnits))
                .addQueryParameter("slippageBps", String.valueOf(slippageBps))
                .build();
        VenueResponse quoteResponse = send(new Request.Builder().url(quoteUrl).get().build());
        if (!quoteResponse.isHttpSuccess() || !quoteResponse.object().has("outAmount")) {
            return TradeResult.failed(platform(), quoteResponse.errorMessage("Failed to get quote"));
        }
        JsonObject quote = quoteResponse.object();
        log.info("Jupiter 報價: {} {} → {} outAmount={} priceImpact={}",
                trade.getAmount(), pair.input(), pair.output(),
                optString(quote, "outAmount", "?"), optString(quote, "priceImpactPct", "?"));

        // 2. 取得 swap 交易
        JsonObject swapBody = new JsonObject();
        swapBody.add("quoteResponse", quote);
        swapBody.addProperty("userPublicKey", wallet.address());
        swapBody.addProperty("wrapAndUnwrapSol", true);
        VenueResponse swapResponse = send(new Request.Builder()
                .url(quoteApiUrl + "/swap")
                .post(RequestBody.create(gson.toJson(swapBody), JSON_MEDIA))
                .build());
        String serializedTx = optString(swapResponse.object(), "swapTransaction", null);
        if (!swapResponse.isHttpSuccess() || serializedTx == null) {
            return TradeResult.failed(platform(), swapResponse.errorMessage("Failed to build swap transaction"));
        }

        // 3. 簽名 + 4. 送出
        String signedTx = wallet.signSerializedTransaction(serializedTx);
        JsonObject sendOptions = new JsonObject();
        sendOptions.addProperty("encoding", "base64");
        sendOptions.addProperty("preflightCommitment", "confirmed");
        VenueResponse sendResponse = rpc("sendTransaction", List.of(signedTx, sendOptions));
        JsonObject sendJson = sendResponse.object();
        if (sendResponse.isTransportFailure() || !sendJson.has("result")) {
            return TradeResult.failed(platform(), sendResponse.errorMessage("sendTransaction failed"));
        }
        String signature = sendJson.get("result").getAsString();

        double inAmount = pair.input().fromBaseUnits(optDouble(quote, "inAmount", inBaseUnits));
        double outAmount = pair.output().fromBaseUnits(optDouble(quote, "outAmount", 0));
        long priorityLamports = (long) optDouble(swapResponse.object(), "prioritizationFeeLamports", 0);

        return TradeResult.builder()
                .tradeId(signature)
                .platform(platform())
                .status(TradeStatus.COMPLETED)
                .transactionHash(signature)
                .executedAmount(trade.getAmount())
                .executedPrice(inAmount > 0 ? outAmount / inAmount : null)
                .fee(SolanaToken.SOL.fromBaseUnits(BASE_FEE_LAMPORTS + priorityLamports))
                .timestamp(Instant.now())
                .metadata(Map.of("route", "jupiter", "out_amount", outAmount))
                .build();
    }

    // ==================== 查詢 ====================

    @Override
    protected Map<String, Double> fetchBalance(String token) {
        if (wallet == null) {
            return Map.of();
        }

        VenueResponse solResponse = rpc("getBalance", List.of(wallet.address()));
        JsonObject result = solResponse.object().getAsJsonObject("result");
        if (solResponse.isTransportFailure() || result == null || !result.has("value")) {
            log.warn("Solana 查詢 SOL 餘額失敗: {}", solResponse.errorMessage("no result"));
            return Map.of();
        }

        Map<String, Double> balances = new LinkedHashMap<>();
        balances.put("SOL", SolanaToken.SOL.fromBaseUnits(result.get("value").getAsDouble()));
        balances.putAll(fetchTokenBalances());

        if (token != null && !token.isBlank()) {
            Map<String, Double> filtered = new LinkedHashMap<>();
            balances.forEach((asset, qty) -> {
                if (asset.equalsIgnoreCase(token)) {
                    filtered.put(asset, qty);
                }
            });
            return filtered;
        }
        return balances;
    }

    /**
     * SPL token 餘額；失敗時只回傳空 Map，不影響 SOL 餘額
     */
    private Map<String, Double> fetchTokenBalances() {
        JsonObject programFilter = new JsonObject();
        programFilter.addProperty("programId", TOKEN_PROGRAM_ID);
        JsonObject encoding = new JsonObject();
        encoding.addProperty("encoding", "jsonParsed");

        VenueResponse response = rpc("getTokenAccountsByOwner", List.of(wallet.address(), programFilter, encoding));
        JsonObject result = response.object().getAsJsonObject("result");
        if (result == null || !result.has("value")) {
            log.warn("Solana 查詢 SPL 餘額失敗: {}", response.errorMessage("no result"));
            return Map.of();
        }

        Map<String, Double> balances = new LinkedHashMap<>();
        for (JsonElement accountElem : result.getAsJsonArray("value")) {
            JsonObject info = accountElem.getAsJsonObject()
                    .getAsJsonObject("account")
                    .getAsJsonObject("data")
                    .getAsJsonObject("parsed")
                    .getAsJsonObject("info");
            String mint = info.get("mint").getAsString();
            double uiAmount = optDouble(info.getAsJsonObject("tokenAmount"), "uiAmount", 0);
            String asset = SolanaToken.fromMint(mint).map(Enum::name).orElse(mint);
            balances.merge(asset, uiAmount, Double::sum);
        }
        return balances;
    }

    /**
     * 以 USDC 計價的現價，symbol 可為 "SOL" 或 "SOL/USDC"（取前者）
     */
    @Override
    protected double fetchPrice(String symbol) {
        String base = symbol.contains("/") ? symbol.substring(0, symbol.indexOf('/')) : symbol;
        String mint = SolanaToken.fromSymbol(base).map(SolanaToken::getMint).orElse(base);

        HttpUrl url = HttpUrl.get(priceApiUrl).newBuilder()
                .addQueryParameter("ids", mint)
                .build();
        VenueResponse response = send(new Request.Builder().url(url).get().build());
        JsonObject data = response.object().getAsJsonObject("data");
        if (data == null || !data.has(mint) || data.get(mint).isJsonNull()) {
            log.warn("Jupiter 查無價格: {} {}", symbol, response.errorMessage(""));
            return 0.0;
        }
        return optDouble(data.getAsJsonObject(mint), "price", 0.0);
    }

    @Override
    protected Map<String, Object> fetchOrderStatus(String orderId) {
        JsonObject options = new JsonObject();
        options.addProperty("commitment", "confirmed");
        options.addProperty("maxSupportedTransactionVersion", 0);

        VenueResponse response = rpc("getTransaction", List.of(orderId, options));
        JsonObject json = response.object();
        if (response.isTransportFailure() || json.has("error")) {
            return Map.of("status", "error", "error", response.errorMessage("getTransaction failed"));
        }
        JsonElement result = json.get("result");
        if (result == null || result.isJsonNull()) {
            return Map.of("status", "not_found");
        }
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("status", "confirmed");
        status.put("signature", orderId);
        status.put("slot", result.getAsJsonObject().get("slot").getAsLong());
        return status;
    }

    @Override
    protected boolean requestCancel(String orderId) {
        return false;
    }

    // ==================== JSON-RPC ====================

    private VenueResponse rpc(String method, List<Object> params) {
        JsonObject body = new JsonObject();
        body.addProperty("jsonrpc", "2.0");
        body.addProperty("id", rpcRequestId.getAndIncrement());
        body.addProperty("method", method);
        JsonArray paramArray = new JsonArray();
        for (Object p : params) {
            paramArray.add(gson.toJsonTree(p));
        }
        body.add("params", paramArray);

        return send(new Request.Builder()
                .url(rpcUrl)
                .post(RequestBody.create(gson.toJson(body), JSON_MEDIA))
                .build());
    }

    /**
     * "SOL/USDC" → (SOL, USDC)
     */
    record SwapPair(SolanaToken input, SolanaToken output) {

        static Optional<SwapPair> parse(String symbol) {
            String[] parts = symbol.split("/");
            if (parts.length != 2) {
                return Optional.empty();
            }
            Optional<SolanaToken> in = SolanaToken.fromSymbol(parts[0]);
            Optional<SolanaToken> out = SolanaToken.fromSymbol(parts[1]);
            if (in.isEmpty() || out.isEmpty() || in.get() == out.get()) {
                return Optional.empty();
            }
            return Optional.of(new SwapPair(in.get(), out.get()));
        }
    }
}
