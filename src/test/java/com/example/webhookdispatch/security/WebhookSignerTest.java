package com.example.webhookdispatch.security;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignerTest {

    private final WebhookSigner signer = new WebhookSigner();

    @Test
    void testKnownVector() {
        // RFC 4231 test case 2
        String signature = signer.sign("what do ya want for nothing?".getBytes(StandardCharsets.UTF_8), "Jefe");
        assertEquals("5bdcc146bf60754e6a042426089575c75a003f089d2739839dec58b964ec3843", signature);
    }

    @Test
    void testEmptySecret() {
        // HMAC-SHA256 with empty key and empty message
        assertEquals("b613679a0814d9ec772f95d778c35fc5ff1697c493715653c6c712144292c5ad",
                signer.sign(new byte[0], ""));

        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        String header = assertDoesNotThrow(() -> signer.signatureHeader(body, ""));
        assertTrue(signer.verify(body, "", header));
        assertFalse(signer.verify(body, "x", header));
    }

    @Test
    void testSignatureIsLowercaseHex() {
        String signature = signer.sign("{\"a\":1}".getBytes(StandardCharsets.UTF_8), "k");
        assertEquals(64, signature.length());
        assertTrue(signature.matches("[0-9a-f]{64}"));
    }

    @Test
    void testHeaderHasPrefix() {
        byte[] body = "{}".getBytes(StandardCharsets.UTF_8);
        String header = signer.signatureHeader(body, "secret");
        assertTrue(header.startsWith("sha256="));
        assertEquals(signer.sign(body, "secret"), header.substring("sha256=".length()));
    }

    @Test
    void testDeterministic() {
        byte[] body = "{\"event\":\"company.created\"}".getBytes(StandardCharsets.UTF_8);
        assertEquals(signer.sign(body, "s1"), signer.sign(body, "s1"));
        assertNotEquals(signer.sign(body, "s1"), signer.sign(body, "s2"));
    }

    @Test
    void testVerify() {
        byte[] body = "{\"data\":{\"id\":7}}".getBytes(StandardCharsets.UTF_8);
        String header = signer.signatureHeader(body, "secret");

        assertTrue(signer.verify(body, "secret", header));
        assertTrue(signer.verify(body, "secret", header.substring(7)));
        assertFalse(signer.verify(body, "other", header));
        assertFalse(signer.verify("{\"data\": {\"id\": 7}}".getBytes(StandardCharsets.UTF_8), "secret", header));
        assertFalse(signer.verify(body, "secret", null));
    }
}
