package com.demoBank.advisor.gateway.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("UserIdMasker")
class UserIdMaskerTest {

    @Test
    @DisplayName("keeps the edges of long ids and a stable tag")
    void longId() {
        String masked = UserIdMasker.mask("user-0001");

        assertTrue(masked.matches("us\\*\\*\\*01#[0-9a-f]{6}"));
        assertEquals(masked, UserIdMasker.mask(" user-0001 "));
        assertNotEquals(masked, UserIdMasker.mask("user-0002"));
    }

    @Test
    @DisplayName("short and missing ids reveal almost nothing")
    void shortAndMissing() {
        assertTrue(UserIdMasker.mask("u42").startsWith("u***#"));
        assertEquals("<none>", UserIdMasker.mask(null));
        assertEquals("<none>", UserIdMasker.mask("  "));
    }
}
