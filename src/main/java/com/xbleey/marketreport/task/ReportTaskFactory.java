package com.xbleey.marketreport.task;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.xbleey.marketreport.config.ReportTaskProperties;
import com.xbleey.marketreport.enums.ReportTaskType;
import com.xbleey.marketreport.notify.NotificationDispatcher;
import com.xbleey.marketreport.notify.ReportDelivery;
import com.xbleey.marketreport.provider.ChatModelContentProvider;
import com.xbleey.marketreport.provider.CommandContentProvider;
import com.xbleey.marketreport.provider.HtmlHeadlineContentProvider;
import com.xbleey.marketreport.provider.JsonFeedContentProvider;
import com.xbleey.marketreport.provider.ProviderEntry;
import com.xbleey.marketreport.provider.ProviderFallbackChain;
import com.xbleey.marketreport.provider.ReportContentProvider;
import okhttp3.OkHttpClient;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns configured task definitions into runnable report tasks.
 */
@Component
public class ReportTaskFactory {

    private final TaskRunner taskRunner;
    private final NotificationDispatcher dispatcher;
    private final OkHttpClient okHttpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReportTaskFactory(
            TaskRunner taskRunner,
            NotificationDispatcher dispatcher,
            OkHttpClient okHttpClient,
            ObjectMapper objectMapper,
            Clock clock
    ) {
        this.taskRunner = taskRunner;
        this.dispatcher = dispatcher;
        this.okHttpClient = okHttpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public ReportTask create(ReportTaskProperties.TaskDefinition definition) {
        ReportDelivery delivery = new ReportDelivery(
                definition.resolvedTitle(),
                definition.getChannels(),
                dispatcher,
                clock
        );
        if (definition.getType() == ReportTaskType.COMMAND) {
            ReportTaskProperties.CommandDefinition command = definition.getCommand();
            return new CommandReportTask(
                    definition.getId(),
                    TaskCommand.from(command),
                    command.resolvedAnalysisTypes(),
                    taskRunner,
                    delivery
            );
        }
        List<ProviderEntry> entries = new ArrayList<>();
        for (ReportTaskProperties.ProviderDefinition provider : definition.getProviders()) {
            entries.add(new ProviderEntry(
                    provider.resolvedName(),
                    provider.getPriority(),
                    createProvider(provider, delivery)
            ));
        }
        return new FallbackChainReportTask(definition.getId(), new ProviderFallbackChain(definition.getId(), entries));
    }

    ReportContentProvider createProvider(ReportTaskProperties.ProviderDefinition provider, ReportDelivery delivery) {
        String name = provider.resolvedName();
        return switch (provider.getType()) {
            case CHAT_MODEL -> new ChatModelContentProvider(
                    name,
                    delivery,
                    clientFor(provider),
                    objectMapper,
                    provider.getBaseUrl(),
                    provider.getModel(),
                    provider.getPrompt(),
                    clock
            );
            case JSON_FEED -> new JsonFeedContentProvider(
                    name,
                    delivery,
                    clientFor(provider),
                    objectMapper,
                    provider.getUrl(),
                    provider.getItemsPointer(),
                    provider.getTitleField(),
                    provider.getSummaryField(),
                    provider.getLimit()
            );
            case HTML_SCRAPE -> new HtmlHeadlineContentProvider(
                    name,
                    delivery,
                    clientFor(provider),
                    provider.getUrl(),
                    provider.getSelector(),
                    provider.getLimit()
            );
            case COMMAND -> new CommandContentProvider(
                    name,
                    delivery,
                    taskRunner,
                    TaskCommand.from(provider.getCommand())
            );
        };
    }

    private OkHttpClient clientFor(ReportTaskProperties.ProviderDefinition provider) {
        return okHttpClient.newBuilder()
                .readTimeout(provider.getTimeout())
                .callTimeout(provider.getTimeout())
                .build();
    }
}
