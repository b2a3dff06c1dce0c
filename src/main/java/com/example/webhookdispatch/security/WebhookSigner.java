package com.example.webhookdispatch.security;

import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * HMAC-SHA256 出站签名。
 *
 * <p>接收方验签约定：使用共享密钥对收到的原始请求体字节重新计算 HMAC-SHA256，
 * 去掉 {@code X-Webhook-Signature} 头中的 {@code sha256=} 前缀后做常量时间比较
 * （见 {@link #verify(byte[], String, String)}）。不要对解析后再序列化的 JSON 验签。
 */
@Component
public class WebhookSigner {

    public static final String SIGNATURE_PREFIX = "sha256=";

    private static final String HMAC_SHA256 = "HmacSHA256";

    /**
     * 计算签名。
     *
     * @param payload 原始请求体
     * @param secret  接收端密钥
     * @return 64 位小写十六进制字符串
     */
    public String sign(byte[] payload, String secret) {
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(keyBytes(secret), HMAC_SHA256));
            return bytesToHex(mac.doFinal(payload));
        } catch (GeneralSecurityException e) {
            // HmacSHA256 是 JDK 必备算法
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    // SecretKeySpec 不接受空数组；HMAC 会把密钥补零到块长度，空密钥与单个零字节等价
    private static byte[] keyBytes(String secret) {
        byte[] key = secret.getBytes(StandardCharsets.UTF_8);
        return key.length == 0 ? new byte[1] : key;
    }

    /**
     * 签名请求头的值，即 {@code sha256=<hex>}。
     */
    public String signatureHeader(byte[] payload, String secret) {
        return SIGNATURE_PREFIX + sign(payload, secret);
    }

    /**
     * 接收方验签参考实现。
     *
     * @param payload   收到的原始字节
     * @param secret    共享密钥
     * @param signature 签名头的值，可带 sha256= 前缀
     * @return 校验通过返回 true
     */
    public boolean verify(byte[] payload, String secret, String signature) {
        if (payload == null || secret == null || signature == null) {
            return false;
        }
        String cleanSignature = signature.startsWith(SIGNATURE_PREFIX)
                ? signature.substring(SIGNATURE_PREFIX.length())
                : signature;
        String expected = sign(payload, secret);
        return MessageDigest.isEqual(
                cleanSignature.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder hexString = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1)
                hexString.append('0');
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
