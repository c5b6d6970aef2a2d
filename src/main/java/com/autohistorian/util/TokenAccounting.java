package com.autohistorian.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.LongAdder;

/**
 * Process-wide ledger of generation token usage for the current ingest run.
 *
 * <p>The ingest workflow resets it when a run starts, the generation backend records every
 * response's usage metadata, and the run report reads {@link #snapshotWithCosts()}.
 *
 * <p>Prices are per 1K tokens. Built-in Gemini prices can be replaced through
 * {@code GEMINI_COST_<MODEL>_INPUT_PER_1K} / {@code GEMINI_COST_<MODEL>_OUTPUT_PER_1K}, where
 * {@code <MODEL>} is the model name upper-cased with every other character turned into '_'.
 */
public final class TokenAccounting {
    private static final Logger log = LoggerFactory.getLogger(TokenAccounting.class);

    // "gemini-2.0-flash-lite" before "gemini-2.0-flash": first match wins.
    private static final Map<String, Price> DEFAULT_PRICES = new LinkedHashMap<>();
    static {
        DEFAULT_PRICES.put("gemini-2.5-flash", new Price(0.0003, 0.0025));
        DEFAULT_PRICES.put("gemini-2.0-flash-lite", new Price(0.000075, 0.0003));
        DEFAULT_PRICES.put("gemini-2.0-flash", new Price(0.0001, 0.0004));
    }
    private static final Price FREE = new Price(0.0, 0.0);

    private static final ConcurrentHashMap<String, Counters> LEDGER = new ConcurrentHashMap<>();

    private TokenAccounting() {}

    private static final class Counters {
        final LongAdder requests = new LongAdder();
        final LongAdder prompt = new LongAdder();
        final LongAdder completion = new LongAdder();
        final LongAdder total = new LongAdder();
    }

    private static final class Price {
        final double inputPer1k;
        final double outputPer1k;

        Price(double inputPer1k, double outputPer1k) {
            this.inputPer1k = inputPer1k;
            this.outputPer1k = outputPer1k;
        }

        double cost(long promptTokens, long completionTokens) {
            return promptTokens / 1000.0 * inputPer1k + completionTokens / 1000.0 * outputPer1k;
        }
    }

    public static final class UsageWithCost {
        public final String model;
        public final long requests;
        public final long promptTokens;
        public final long completionTokens;
        public final long totalTokens;
        public final double costUsd;

        UsageWithCost(String model, long requests, long promptTokens, long completionTokens, long totalTokens, double costUsd) {
            this.model = model;
            this.requests = requests;
            this.promptTokens = promptTokens;
            this.completionTokens = completionTokens;
            this.totalTokens = totalTokens;
            this.costUsd = costUsd;
        }
    }

    public static void reset() {
        LEDGER.clear();
    }

    public static void recordUsage(String model, long prompt, long completion, long total) {
        String key = model == null || model.isBlank() ? "unknown" : model;
        Counters c = LEDGER.computeIfAbsent(key, k -> new Counters());
        c.requests.increment();
        c.prompt.add(Math.max(0, prompt));
        c.completion.add(Math.max(0, completion));
        c.total.add(Math.max(0, total));
    }

    public static Map<String, UsageWithCost> snapshotWithCosts() {
        Map<String, UsageWithCost> out = new LinkedHashMap<>();
        LEDGER.forEach((model, c) -> {
            long prompt = c.prompt.sum();
            long completion = c.completion.sum();
            double cost = priceFor(model).cost(prompt, completion);
            out.put(model, new UsageWithCost(model, c.requests.sum(), prompt, completion, c.total.sum(), cents(cost)));
        });
        return out;
    }

    public static double totalCostUsd(Map<String, UsageWithCost> snapshot) {
        if (snapshot == null) return 0.0;
        return cents(snapshot.values().stream().mapToDouble(u -> u.costUsd).sum());
    }

    private static Price priceFor(String model) {
        String envKey = model.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
        Double in = envPrice("GEMINI_COST_" + envKey + "_INPUT_PER_1K");
        Double out = envPrice("GEMINI_COST_" + envKey + "_OUTPUT_PER_1K");
        if (in != null || out != null) {
            return new Price(in != null ? in : 0.0, out != null ? out : 0.0);
        }
        String lower = model.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, Price> e : DEFAULT_PRICES.entrySet()) {
            if (lower.contains(e.getKey())) return e.getValue();
        }
        return FREE;
    }

    private static Double envPrice(String name) {
        String raw = System.getenv(name);
        if (raw == null || raw.isBlank()) return null;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring {}={}: not a number", name, raw);
            return null;
        }
    }

    private static double cents(double usd) {
        return Math.round(usd * 100.0) / 100.0;
    }
}
