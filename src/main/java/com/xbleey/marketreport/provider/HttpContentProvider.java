package com.xbleey.marketreport.provider;

import com.xbleey.marketreport.notify.ReportDelivery;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;

import java.io.IOException;

public abstract class HttpContentProvider extends DeliveringContentProvider {

    protected final OkHttpClient okHttpClient;

    protected HttpContentProvider(String name, ReportDelivery delivery, OkHttpClient okHttpClient) {
        super(name, delivery);
        this.okHttpClient = okHttpClient;
    }

    protected String executeForBody(Request request) throws IOException {
        try (Response response = okHttpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new IOException("http status " + response.code() + " from " + request.url());
            }
            if (response.body() == null) {
                throw new IOException("empty body from " + request.url());
            }
            return response.body().string();
        }
    }
}
