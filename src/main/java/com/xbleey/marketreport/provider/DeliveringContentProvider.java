package com.xbleey.marketreport.provider;

import com.xbleey.marketreport.notify.ReportDelivery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Tier that produces report text and delivers it itself. Producing non-blank
 * content is what makes the tier succeed; delivery failures are only logged.
 */
public abstract class DeliveringContentProvider implements ReportContentProvider {

    private static final Logger log = LoggerFactory.getLogger(DeliveringContentProvider.class);

    private final String name;
    private final ReportDelivery delivery;

    protected DeliveringContentProvider(String name, ReportDelivery delivery) {
        this.name = name;
        this.delivery = delivery;
    }

    @Override
    public boolean produceAndSend() throws Exception {
        Optional<String> content = produce().map(String::trim).filter(text -> !text.isEmpty());
        if (content.isEmpty()) {
            log.warn("Provider {} produced no content", name);
            return false;
        }
        if (!delivery.deliver(content.get())) {
            log.warn("Provider {} produced a report that no channel delivered", name);
        }
        return true;
    }

    protected abstract Optional<String> produce() throws Exception;

    public String getName() {
        return name;
    }
}
