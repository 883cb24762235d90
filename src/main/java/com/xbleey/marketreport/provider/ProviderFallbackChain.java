package com.xbleey.marketreport.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Tries providers in ascending priority until one reports success.
 * <p>
 * A provider that throws counts as a provider that returned {@code false}. Equal
 * priorities keep their registration order.
 */
public class ProviderFallbackChain {

    private static final Logger log = LoggerFactory.getLogger(ProviderFallbackChain.class);

    private final String name;
    private final List<ProviderEntry> entries;

    public ProviderFallbackChain(String name, List<ProviderEntry> entries) {
        this.name = name;
        List<ProviderEntry> sorted = new ArrayList<>(entries == null ? List.of() : entries);
        sorted.sort(Comparator.comparingInt(ProviderEntry::priority));
        this.entries = List.copyOf(sorted);
    }

    public boolean run() {
        List<String> failures = new ArrayList<>();
        for (ProviderEntry entry : entries) {
            String reason;
            try {
                if (entry.provider().produceAndSend()) {
                    log.info("Chain {} succeeded with tier {} (priority {})", name, entry.name(), entry.priority());
                    return true;
                }
                reason = "reported failure";
            } catch (Exception ex) {
                reason = ex.getClass().getSimpleName() + ": " + ex.getMessage();
                log.debug("Chain {} tier {} threw", name, entry.name(), ex);
            }
            log.warn("Chain {} tier {} (priority {}) failed: {}, trying next", name, entry.name(), entry.priority(), reason);
            failures.add(entry.name() + " -> " + reason);
        }
        log.error("Chain {} exhausted all {} tiers: {}", name, entries.size(), failures);
        return false;
    }

    public String getName() {
        return name;
    }

    public List<ProviderEntry> getEntries() {
        return entries;
    }
}
