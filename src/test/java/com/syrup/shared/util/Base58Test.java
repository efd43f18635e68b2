package com.syrup.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Base58Test {

    @Test
    @DisplayName("已知向量")
    void knownVector() {
        assertThat(Base58.encode("Hello World!".getBytes(StandardCharsets.UTF_8))).isEqualTo("2NEpo7TZRRrLZSi2U");
        assertThat(new String(Base58.decode("2NEpo7TZRRrLZSi2U"), StandardCharsets.UTF_8)).isEqualTo("Hello World!");
    }

    @Test
    @DisplayName("前導 0 byte 對應前導 '1'")
    void leadingZeros() {
        assertThat(Base58.encode(new byte[]{0, 0, 1})).isEqualTo("112");
        assertThat(Base58.decode("112")).containsExactly(0, 0, 1);
        assertThat(Base58.decode("11")).containsExactly(0, 0);
    }

    @Test
    @DisplayName("空輸入")
    void empty() {
        assertThat(Base58.encode(new byte[0])).isEmpty();
        assertThat(Base58.decode("")).isEmpty();
    }

    @Test
    @DisplayName("非 Base58 字元：IllegalArgumentException")
    void invalidCharacter() {
        assertThatThrownBy(() -> Base58.decode("0OIl"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid Base58 character");
    }
}
