package ru.aritmos.padlock.core;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SensitiveDataSanitizerTest {

    @Test
    void shouldMaskBearerTokensAndFormParameters() {
        String out = SensitiveDataSanitizer.sanitizeText(
                "Authorization: Bearer gho_abc client_secret=s3cr3t&code=xyz&code_verifier=ver&redirect_uri=http://x");

        assertFalse(out.contains("gho_abc"));
        assertFalse(out.contains("s3cr3t"));
        assertFalse(out.contains("xyz"));
        assertFalse(out.contains("=ver"));
        assertTrue(out.contains("redirect_uri=http://x"));
    }

    @Test
    void shouldMaskJsonTokenFieldsAndFlattenLines() {
        String out = SensitiveDataSanitizer.sanitizeText("{\"access_token\":\"at-1\",\n\"scope\":\"read\"}");

        assertEquals("{\"access_token\":\"***\", \"scope\":\"read\"}", out);
    }

    @Test
    void describeFallsBackToClassName() {
        assertEquals("IllegalStateException", SensitiveDataSanitizer.describe(new IllegalStateException()));
        assertNull(SensitiveDataSanitizer.describe(null));
    }
}
