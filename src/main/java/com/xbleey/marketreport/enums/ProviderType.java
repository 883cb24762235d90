package com.xbleey.marketreport.enums;

public enum ProviderType {
    CHAT_MODEL,
    COMMAND,
    JSON_FEED,
    HTML_SCRAPE
}
