package com.xbleey.marketreport.enums;

public enum MarkerStoreType {
    FILE,
    REDIS,
    DATABASE
}
