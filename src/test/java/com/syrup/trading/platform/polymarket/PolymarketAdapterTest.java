package com.syrup.trading.platform.polymarket;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.syrup.shared.model.Platform;
import com.syrup.shared.model.PlatformCredentials;
import com.syrup.shared.model.TradeRequest;
import com.syrup.shared.model.TradeResult;
import com.syrup.shared.model.TradeStatus;
import com.syrup.shared.model.TradeType;
import com.syrup.shared.util.HmacSignatureUtil;
import com.syrup.trading.config.VenueConfig;
import okhttp3.Call;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;

import static com.syrup.support.OkHttpMocks.bodyOf;
import static com.syrup.support.OkHttpMocks.buildResponse;
import static com.syrup.support.OkHttpMocks.mockClient;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * PolymarketAdapter 單元測試
 *
 * 覆蓋：簽名 header、下單格式、平台拒絕訊息原樣帶出、傳輸錯誤、查詢
 */
class PolymarketAdapterTest {

    private Call mockCall;
    private OkHttpClient httpClient;
    private PolymarketAdapter adapter;

    @BeforeEach
    void setUp() {
        mockCall = mock(Call.class);
        httpClient = mockClient(mockCall);
        adapter = new PolymarketAdapter(PlatformCredentials.builder()
                .platform(Platform.POLYMARKET)
                .apiKey("pm-key")
                .secret("pm-secret")
                .passphrase("pm-pass")
                .build(), httpClient, VenueConfig.defaults());
    }

    private TradeRequest.TradeRequestBuilder order(TradeType type) {
        return TradeRequest.builder()
                .platform(Platform.POLYMARKET)
                .tradeType(type)
                .symbol("will-btc-hit-100k")
                .amount(25);
    }

    private Request capturedRequest() {
        ArgumentCaptor<Request> captor = ArgumentCaptor.forClass(Request.class);
        verify(httpClient).newCall(captor.capture());
        return captor.getValue();
    }

    @Nested
    @DisplayName("executeTrade")
    class ExecuteTradeTests {

        @Test
        @DisplayName("限價買單：LIMIT、BUY，成功回傳 orderId")
        void limitBuySucceeds() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, """
                    {"success":true,"orderId":"pm-123","transactionHash":"0xabc","executedPrice":0.62,"fee":0.05}
                    """));

            TradeResult result = adapter.executeTrade(order(TradeType.BUY).price(0.62).build());

            assertThat(result.getStatus()).isEqualTo(TradeStatus.COMPLETED);
            assertThat(result.getTradeId()).isEqualTo("pm-123");
            assertThat(result.getTransactionHash()).isEqualTo("0xabc");
            assertThat(result.getExecutedAmount()).isEqualTo(25.0);
            assertThat(result.getExecutedPrice()).isEqualTo(0.62);
            assertThat(result.getFee()).isEqualTo(0.05);

            Request request = capturedRequest();
            assertThat(request.method()).isEqualTo("POST");
            assertThat(request.url().encodedPath()).isEqualTo("/orders");
            JsonObject body = JsonParser.parseString(bodyOf(request)).getAsJsonObject();
            assertThat(body.get("market").getAsString()).isEqualTo("will-btc-hit-100k");
            assertThat(body.get("side").getAsString()).isEqualTo("BUY");
            assertThat(body.get("type").getAsString()).isEqualTo("LIMIT");
            assertThat(body.get("size").getAsDouble()).isEqualTo(25.0);
        }

        @Test
        @DisplayName("市價賣單：MARKET、SELL，fee 預設 0")
        void marketSellDefaultsFee() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"success\":true,\"orderId\":\"pm-9\"}"));

            TradeResult result = adapter.executeTrade(order(TradeType.SELL).build());

            assertThat(result.getStatus()).isEqualTo(TradeStatus.COMPLETED);
            assertThat(result.getFee()).isZero();
            JsonObject body = JsonParser.parseString(bodyOf(capturedRequest())).getAsJsonObject();
            assertThat(body.get("side").getAsString()).isEqualTo("SELL");
            assertThat(body.get("type").getAsString()).isEqualTo("MARKET");
        }

        @Test
        @DisplayName("平台拒絕：error 原樣帶出")
        void venueRejectionVerbatim() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"success\":false,\"error\":\"Market closed\"}"));

            TradeResult result = adapter.executeTrade(order(TradeType.BUY).build());

            assertThat(result.getStatus()).isEqualTo(TradeStatus.FAILED);
            assertThat(result.getError()).isEqualTo("Market closed");
            assertThat(result.getTradeId()).isEmpty();
        }

        @Test
        @DisplayName("沒有 error 欄位：Unknown error")
        void unknownError() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"success\":false}"));

            assertThat(adapter.executeTrade(order(TradeType.BUY).build()).getError()).isEqualTo("Unknown error");
        }

        @Test
        @DisplayName("連線失敗：FAILED 並帶出例外訊息")
        void transportFailure() throws Exception {
            when(mockCall.execute()).thenThrow(new IOException("timeout"));

            TradeResult result = adapter.executeTrade(order(TradeType.BUY).build());

            assertThat(result.getStatus()).isEqualTo(TradeStatus.FAILED);
            assertThat(result.getError()).isEqualTo("timeout");
        }

        @Test
        @DisplayName("SWAP 不支援：不送出請求")
        void swapNotSupported() {
            TradeResult result = adapter.executeTrade(order(TradeType.SWAP).build());

            assertThat(result.getError()).isEqualTo("Trade type swap not supported on polymarket");
            verify(httpClient, never()).newCall(any());
        }
    }

    @Nested
    @DisplayName("簽名")
    class SignatureTests {

        @Test
        @DisplayName("POLY-* header：HMAC(timestamp + METHOD + path + body)")
        void signedHeaders() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"success\":true,\"orderId\":\"1\"}"));

            adapter.executeTrade(order(TradeType.BUY).price(0.5).build());

            Request request = capturedRequest();
            String timestamp = request.header("POLY-TIMESTAMP");
            String body = bodyOf(request);
            assertThat(timestamp).matches("\\d+");
            assertThat(request.header("POLY-API-KEY")).isEqualTo("pm-key");
            assertThat(request.header("POLY-PASSPHRASE")).isEqualTo("pm-pass");
            assertThat(request.header("POLY-SIGNATURE"))
                    .isEqualTo(HmacSignatureUtil.sign(timestamp + "POST" + "/orders" + body, "pm-secret"));
        }

        @Test
        @DisplayName("GET 請求：body 為空字串參與簽名")
        void getRequestSignedWithoutBody() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"success\":true,\"lastPrice\":0.41}"));

            adapter.getPrice("will-btc-hit-100k");

            Request request = capturedRequest();
            String timestamp = request.header("POLY-TIMESTAMP");
            assertThat(request.header("POLY-SIGNATURE"))
                    .isEqualTo(HmacSignatureUtil.sign(timestamp + "GET" + "/markets/will-btc-hit-100k", "pm-secret"));
        }

        @Test
        @DisplayName("symbol 含 / 與空白：編碼成單一路徑段，簽名用編碼後的 path")
        void symbolEncodedAsSingleSegment() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"success\":true,\"lastPrice\":0.41}"));

            adapter.getPrice("btc/100k yes");

            Request request = capturedRequest();
            assertThat(request.url().encodedPath()).isEqualTo("/markets/btc%2F100k%20yes");
            assertThat(request.url().pathSegments()).containsExactly("markets", "btc/100k yes");
            String timestamp = request.header("POLY-TIMESTAMP");
            assertThat(request.header("POLY-SIGNATURE"))
                    .isEqualTo(HmacSignatureUtil.sign(timestamp + "GET" + "/markets/btc%2F100k%20yes", "pm-secret"));
        }

        @Test
        @DisplayName("orderId 帶 ../：不會跳出 /orders")
        void orderIdCannotEscapeOrdersPath() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"success\":true}"));

            adapter.cancelOrder("../balances");

            Request request = capturedRequest();
            assertThat(request.url().pathSegments()).containsExactly("orders", "../balances");
            assertThat(request.url().encodedPath()).isEqualTo("/orders/..%2Fbalances");
        }
    }

    @Nested
    @DisplayName("下單前檢查")
    class ValidationTests {

        private void assertRejected(TradeRequest trade, String reason) {
            TradeResult result = adapter.executeTrade(trade);

            assertThat(result.getStatus()).isEqualTo(TradeStatus.FAILED);
            assertThat(result.getError()).isEqualTo(reason);
            verify(httpClient, never()).newCall(any());
        }

        @Test
        @DisplayName("amount = 0：FAILED 且不送出請求")
        void zeroAmount() {
            assertRejected(order(TradeType.BUY).amount(0).build(), "Amount must be positive");
        }

        @Test
        @DisplayName("負數 amount：FAILED 且不送出請求")
        void negativeAmount() {
            assertRejected(order(TradeType.SELL).amount(-1).build(), "Amount must be positive");
        }

        @Test
        @DisplayName("amount = Infinity：FAILED 且不送出請求")
        void infiniteAmount() {
            assertRejected(order(TradeType.BUY).amount(Double.POSITIVE_INFINITY).build(), "Amount must be positive");
        }

        @Test
        @DisplayName("slippage < 0：FAILED 且不送出請求")
        void negativeSlippage() {
            assertRejected(order(TradeType.BUY).slippage(-0.1).build(), "Slippage must be between 0 and 1");
        }

        @Test
        @DisplayName("slippage > 1：FAILED 且不送出請求")
        void slippageAboveOne() {
            assertRejected(order(TradeType.BUY).slippage(1.5).build(), "Slippage must be between 0 and 1");
        }
    }

    @Nested
    @DisplayName("查詢")
    class QueryTests {

        @Test
        @DisplayName("價格：lastPrice")
        void price() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"success\":true,\"lastPrice\":0.41}"));

            assertThat(adapter.getPrice("m")).isEqualTo(0.41);
        }

        @Test
        @DisplayName("餘額：balances 物件")
        void balances() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200,
                    "{\"success\":true,\"balances\":{\"USDC\":150.0,\"YES-1\":10}}"));

            assertThat(adapter.getBalance(null)).containsEntry("USDC", 150.0).containsEntry("YES-1", 10.0);
        }

        @Test
        @DisplayName("餘額查詢失敗：空 Map")
        void balanceFailure() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(401, "{\"error\":\"unauthorized\"}"));

            assertThat(adapter.getBalance(null)).isEmpty();
        }

        @Test
        @DisplayName("查單：回傳平台原始內容")
        void orderStatus() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"orderId\":\"pm-1\",\"status\":\"open\"}"));

            assertThat(adapter.getOrderStatus("pm-1")).containsEntry("status", "open");
        }

        @Test
        @DisplayName("撤單：DELETE /orders/{id}，依 success 判斷")
        void cancel() throws Exception {
            when(mockCall.execute()).thenReturn(buildResponse(200, "{\"success\":true}"));

            assertThat(adapter.cancelOrder("pm-1")).isTrue();
            Request request = capturedRequest();
            assertThat(request.method()).isEqualTo("DELETE");
            assertThat(request.url().encodedPath()).isEqualTo("/orders/pm-1");
        }
    }
}
