package com.communitybot.client;

import okhttp3.Call;
import okhttp3.Callback;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Keeps an external uptime monitor informed: a GET to the configured URL on every {@link #ping()}.
 * The call is asynchronous, so a slow monitor never holds up the event loop.
 */
public class UptimePinger {
    private static final Logger log = LoggerFactory.getLogger(UptimePinger.class);

    public static final Duration INTERVAL = Duration.ofMinutes(5);

    private final OkHttpClient client;
    private final String url;

    public UptimePinger(String url) {
        this(url, new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(10, TimeUnit.SECONDS)
                .callTimeout(10, TimeUnit.SECONDS)
                .build());
    }

    UptimePinger(String url, OkHttpClient client) {
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("Uptime URL must not be empty");
        }
        this.url = url;
        this.client = client;
    }

    public void ping() {
        Request request = new Request.Builder()
                .url(url)
                .get()
                .build();
        client.newCall(request).enqueue(new Callback() {
            @Override
            public void onResponse(Call call, Response response) {
                try (response) {
                    if (response.isSuccessful()) {
                        log.debug("Uptime ping OK ({})", response.code());
                    } else {
                        log.warn("Uptime ping returned HTTP {}", response.code());
                    }
                }
            }

            @Override
            public void onFailure(Call call, IOException e) {
                log.warn("Uptime ping failed: {}", e.getMessage());
            }
        });
    }

    public void shutdown() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
