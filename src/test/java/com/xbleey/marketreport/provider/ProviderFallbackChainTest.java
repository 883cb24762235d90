package com.xbleey.marketreport.provider;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ProviderFallbackChainTest {

    @Test
    void stopsAtFirstSuccessfulTierInPriorityOrder() {
        List<String> calls = new ArrayList<>();
        ProviderFallbackChain chain = new ProviderFallbackChain("news", List.of(
                new ProviderEntry("scrape", 2, recording(calls, "scrape", true)),
                new ProviderEntry("llm", 0, recording(calls, "llm", false)),
                new ProviderEntry("feed", 1, recording(calls, "feed", true))
        ));

        assertThat(chain.run()).isTrue();
        assertThat(calls).containsExactly("llm", "feed");
    }

    @Test
    void exhaustedChainReturnsFalseAfterTryingEveryTier() {
        List<String> calls = new ArrayList<>();
        ProviderFallbackChain chain = new ProviderFallbackChain("macro", List.of(
                new ProviderEntry("a", 0, recording(calls, "a", false)),
                new ProviderEntry("b", 1, recording(calls, "b", false)),
                new ProviderEntry("c", 2, recording(calls, "c", false))
        ));

        assertThat(chain.run()).isFalse();
        assertThat(calls).containsExactly("a", "b", "c");
    }

    @Test
    void throwingTierCountsAsFailure() {
        List<String> calls = new ArrayList<>();
        ProviderFallbackChain chain = new ProviderFallbackChain("news", List.of(
                new ProviderEntry("llm", 0, () -> {
                    calls.add("llm");
                    throw new java.io.IOException("connection refused");
                }),
                new ProviderEntry("feed", 1, recording(calls, "feed", true))
        ));

        assertThat(chain.run()).isTrue();
        assertThat(calls).containsExactly("llm", "feed");
    }

    @Test
    void equalPrioritiesKeepRegistrationOrder() {
        List<String> calls = new ArrayList<>();
        ProviderFallbackChain chain = new ProviderFallbackChain("news", List.of(
                new ProviderEntry("first", 1, recording(calls, "first", false)),
                new ProviderEntry("second", 1, recording(calls, "second", false))
        ));

        chain.run();

        assertThat(chain.getEntries()).extracting(ProviderEntry::name).containsExactly("first", "second");
        assertThat(calls).containsExactly("first", "second");
    }

    @Test
    void emptyChainFails() {
        assertThat(new ProviderFallbackChain("empty", List.of()).run()).isFalse();
    }

    private static ReportContentProvider recording(List<String> calls, String name, boolean result) {
        return () -> {
            calls.add(name);
            return result;
        };
    }
}
