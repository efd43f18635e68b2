package com.syrup.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HmacSignatureUtilTest {

    @Test
    @DisplayName("RFC 4231 test case 2")
    void rfcVector() {
        assertThat(HmacSignatureUtil.sign("what do ya want for nothing?", "Jefe"))
                .isEqualTo("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843");
    }

    @Test
    @DisplayName("相同輸入簽名一致，內容不同簽名不同")
    void deterministic() {
        String a = HmacSignatureUtil.sign("1700000000POST/orders{}", "secret");

        assertThat(HmacSignatureUtil.sign("1700000000POST/orders{}", "secret")).isEqualTo(a).hasSize(64);
        assertThat(HmacSignatureUtil.sign("1700000001POST/orders{}", "secret")).isNotEqualTo(a);
    }

    @Test
    @DisplayName("null secret 視為空 key，不拋例外")
    void nullSecret() {
        assertThat(HmacSignatureUtil.sign("data", null)).isEqualTo(HmacSignatureUtil.sign("data", ""));
    }
}
