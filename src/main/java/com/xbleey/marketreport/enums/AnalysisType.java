package com.xbleey.marketreport.enums;

import lombok.Getter;

import java.util.Locale;

@Getter
public enum AnalysisType {
    INDUSTRY_FLOW("industry_flow", "--industry"),
    ABNORMAL_VOLUME("abnormal_volume", "--volume"),
    US_STOCK("us_stock", "--us");

    public static final String ALL_FLAG = "--all";

    private final String code;
    private final String flag;

    AnalysisType(String code, String flag) {
        this.code = code;
        this.flag = flag;
    }

    public static AnalysisType fromCode(String code) {
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("analysis type must not be blank");
        }
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        for (AnalysisType type : values()) {
            if (type.code.equals(normalized) || type.name().equalsIgnoreCase(normalized)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown analysis type: " + code);
    }
}
