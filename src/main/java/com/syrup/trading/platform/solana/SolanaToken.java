package com.syrup.trading.platform.solana;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * 常用 SPL token：代號 → mint 地址與小數位數
 */
public enum SolanaToken {

    SOL("So11111111111111111111111111111111111111112", 9),
    USDC("EPjFWdd5AufqSSqeM2qN1xzybapC8G4wEGGkZwyTDt1v", 6),
    USDT("Es9vMFrzaCERmJfrF4H2FYD4KCoNkY11McCe8BenwNYB", 6),
    JUP("JUPyiwrYJFskUPiHa7hkeR8VUtAeFoSYbKedZNsDvCN", 6),
    BONK("DezXAZ8z7PnrnRJjz3wXBoRgixCa6xjnB7YaB1pPB263", 5);

    private final String mint;
    private final int decimals;

    SolanaToken(String mint, int decimals) {
        this.mint = mint;
        this.decimals = decimals;
    }

    public String getMint() {
        return mint;
    }

    public int getDecimals() {
        return decimals;
    }

    /**
     * 整顆 token 數量 → 最小單位（例如 SOL → lamports），四捨五入到整數
     *
     * @return 超出 long 範圍或不是有限數時為 empty
     */
    public OptionalLong toBaseUnits(double amount) {
        if (!Double.isFinite(amount)) {
            return OptionalLong.empty();
        }
        try {
            return OptionalLong.of(BigDecimal.valueOf(amount)
                    .movePointRight(decimals)
                    .setScale(0, RoundingMode.HALF_UP)
                    .longValueExact());
        } catch (ArithmeticException e) {
            return OptionalLong.empty();
        }
    }

    public double fromBaseUnits(double baseUnits) {
        return baseUnits / Math.pow(10, decimals);
    }

    public static Optional<SolanaToken> fromSymbol(String symbol) {
        if (symbol == null) {
            return Optional.empty();
        }
        for (SolanaToken t : values()) {
            if (t.name().equalsIgnoreCase(symbol.trim())) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }

    public static Optional<SolanaToken> fromMint(String mint) {
        for (SolanaToken t : values()) {
            if (t.mint.equals(mint)) {
                return Optional.of(t);
            }
        }
        return Optional.empty();
    }
}
