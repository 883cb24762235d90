package com.xbleey.marketreport.provider;

public record ProviderEntry(String name, int priority, ReportContentProvider provider) {

    public ProviderEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("provider name must not be blank");
        }
        if (provider == null) {
            throw new IllegalArgumentException("provider must not be null");
        }
    }
}
