package com.xbleey.marketreport.provider;

/**
 * One tier of a fallback chain. All configuration is owned by the tier itself.
 */
@FunctionalInterface
public interface ReportContentProvider {

    /**
     * @return true when content was produced and delivered
     */
    boolean produceAndSend() throws Exception;
}
