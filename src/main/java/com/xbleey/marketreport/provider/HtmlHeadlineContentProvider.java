package com.xbleey.marketreport.provider;

import com.xbleey.marketreport.notify.ReportDelivery;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Scraping tier: collects headline texts from a page by CSS selector.
 */
public class HtmlHeadlineContentProvider extends HttpContentProvider {

    private final String url;
    private final String selector;
    private final int limit;

    public HtmlHeadlineContentProvider(
            String name,
            ReportDelivery delivery,
            OkHttpClient okHttpClient,
            String url,
            String selector,
            int limit
    ) {
        super(name, delivery, okHttpClient);
        this.url = url;
        this.selector = selector;
        this.limit = Math.max(1, limit);
    }

    @Override
    protected Optional<String> produce() throws Exception {
        Request request = new Request.Builder()
                .url(url)
                .header("User-Agent", "Mozilla/5.0 (compatible; market-report-scheduler)")
                .get()
                .build();
        Document document = Jsoup.parse(executeForBody(request), url);
        Set<String> headlines = new LinkedHashSet<>();
        for (Element element : document.select(selector)) {
            String text = element.text().trim();
            if (!text.isEmpty()) {
                headlines.add(text);
            }
            if (headlines.size() >= limit) {
                break;
            }
        }
        if (headlines.isEmpty()) {
            return Optional.empty();
        }
        List<String> lines = new ArrayList<>();
        for (String headline : headlines) {
            lines.add((lines.size() + 1) + ". " + headline);
        }
        return Optional.of(String.join("\n", lines));
    }
}
