package com.xbleey.marketreport.task;

import com.xbleey.marketreport.provider.ProviderFallbackChain;

public class FallbackChainReportTask implements ReportTask {

    private final String taskId;
    private final ProviderFallbackChain chain;

    public FallbackChainReportTask(String taskId, ProviderFallbackChain chain) {
        this.taskId = taskId;
        this.chain = chain;
    }

    @Override
    public String taskId() {
        return taskId;
    }

    @Override
    public boolean execute() {
        return chain.run();
    }

    public ProviderFallbackChain getChain() {
        return chain;
    }
}
