package com.autohistorian.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

/**
 * Tests for {@link TokenAccounting} cost estimation defaults (per-1K prices converted from per-1M).
 */
class TokenAccountingTest {

    @AfterEach
    void cleanUp() {
        TokenAccounting.reset();
    }

    @Test
    void gemini20Flash_pricing_is_per_1k_converted_from_per_1m() {
        // 10M input + 5M output => (10_000 * 0.0001) + (5_000 * 0.0004) = 1.00 + 2.00
        long prompt = 10_000_000L;
        long completion = 5_000_000L;

        TokenAccounting.recordUsage("gemini-2.0-flash", prompt, completion, prompt + completion);

        TokenAccounting.UsageWithCost usage = TokenAccounting.snapshotWithCosts().get("gemini-2.0-flash");
        assertNotNull(usage);
        assertEquals(3.00, usage.costUsd, 0.001);
        assertEquals(1, usage.requests);
    }

    @Test
    void usageAccumulatesAcrossCallsPerModel() {
        TokenAccounting.recordUsage("gemini-2.5-flash", 100, 50, 150);
        TokenAccounting.recordUsage("gemini-2.5-flash", 200, 25, 225);
        TokenAccounting.recordUsage(null, 10, 10, 20);

        Map<String, TokenAccounting.UsageWithCost> snap = TokenAccounting.snapshotWithCosts();
        TokenAccounting.UsageWithCost flash = snap.get("gemini-2.5-flash");
        assertEquals(2, flash.requests);
        assertEquals(300, flash.promptTokens);
        assertEquals(75, flash.completionTokens);
        assertEquals(375, flash.totalTokens);
        assertNotNull(snap.get("unknown"));
    }

    @Test
    void unknownModelCostsNothing() {
        TokenAccounting.recordUsage("some-local-model", 1_000_000, 1_000_000, 2_000_000);
        assertEquals(0.0, TokenAccounting.totalCostUsd(TokenAccounting.snapshotWithCosts()), 0.0);
    }
}
