package com.syrup.trading.platform.solana;

import com.syrup.shared.util.Base58;

import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.EdECPrivateKeySpec;
import java.security.spec.NamedParameterSpec;
import java.util.Arrays;
import java.util.Base64;

/**
 * Solana 錢包（Ed25519）
 *
 * 私鑰格式為 base58 編碼的 64 bytes：前 32 bytes 是 seed，後 32 bytes 是公鑰。
 */
public final class SolanaKeypair {

    private static final int KEYPAIR_LENGTH = 64;
    private static final int SIGNATURE_LENGTH = 64;

    private final PrivateKey privateKey;
    private final byte[] publicKey;

    private SolanaKeypair(PrivateKey privateKey, byte[] publicKey) {
        this.privateKey = privateKey;
        this.publicKey = publicKey;
    }

    /**
     * @throws IllegalArgumentException 不是合法的 base58 或長度不對
     */
    public static SolanaKeypair fromBase58(String encoded) {
        byte[] raw = Base58.decode(encoded.trim());
        if (raw.length != KEYPAIR_LENGTH) {
            throw new IllegalArgumentException("expected " + KEYPAIR_LENGTH + "-byte keypair, got " + raw.length);
        }
        try {
            byte[] seed = Arrays.copyOfRange(raw, 0, 32);
            KeyFactory keyFactory = KeyFactory.getInstance("Ed25519");
            PrivateKey key = keyFactory.generatePrivate(new EdECPrivateKeySpec(NamedParameterSpec.ED25519, seed));
            return new SolanaKeypair(key, Arrays.copyOfRange(raw, 32, KEYPAIR_LENGTH));
        } catch (GeneralSecurityException e) {
            throw new IllegalArgumentException("cannot load Ed25519 key: " + e.getMessage(), e);
        }
    }

    /** 錢包地址（base58 公鑰） */
    public String address() {
        return Base58.encode(publicKey);
    }

    public byte[] sign(byte[] message) {
        try {
            Signature signer = Signature.getInstance("Ed25519");
            signer.initSign(privateKey);
            signer.update(message);
            return signer.sign();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("Ed25519 signing failed: " + e.getMessage(), e);
        }
    }

    /**
     * 對 Jupiter 回傳的序列化交易（base64）簽名
     *
     * 格式: [compact-u16 簽名數][64 bytes × 簽名數][message]
     * 錢包是 fee payer，簽名放在第 0 格。
     */
    public String signSerializedTransaction(String base64Transaction) {
        byte[] tx = Base64.getDecoder().decode(base64Transaction);

        int signatureCount = 0;
        int shift = 0;
        int offset = 0;
        while (true) {
            if (offset >= tx.length || offset > 2) {
                throw new IllegalArgumentException("Malformed transaction: bad signature count");
            }
            int b = tx[offset++] & 0xFF;
            signatureCount |= (b & 0x7F) << shift;
            if ((b & 0x80) == 0) {
                break;
            }
            shift += 7;
        }

        int messageOffset = offset + SIGNATURE_LENGTH * signatureCount;
        if (signatureCount < 1 || messageOffset >= tx.length) {
            throw new IllegalArgumentException("Malformed transaction: " + signatureCount + " signatures, "
                    + tx.length + " bytes");
        }

        byte[] signature = sign(Arrays.copyOfRange(tx, messageOffset, tx.length));
        System.arraycopy(signature, 0, tx, offset, SIGNATURE_LENGTH);
        return Base64.getEncoder().encodeToString(tx);
    }
}
