package io.github.gittask.remote;

import java.util.concurrent.TimeUnit;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Builds the OkHttp clients used by the REST trackers, with the credential header each tracker expects. */
public final class TrackerAuth {
    private static final Logger logger = LogManager.getLogger(TrackerAuth.class);

    private TrackerAuth() {}

    public static OkHttpClient.Builder baseBuilder() {
        return new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(30, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .followRedirects(true);
    }

    /** A client sending {@code headerName: headerValue} on every request; unauthenticated when the value is blank. */
    public static OkHttpClient buildClient(TrackerKind kind, String headerName, @Nullable String headerValue) {
        var builder = baseBuilder();
        if (headerValue != null && !headerValue.isBlank()) {
            builder.addInterceptor(chain -> {
                Request originalRequest = chain.request();
                Request authenticatedRequest = originalRequest.newBuilder()
                        .header(headerName, headerValue)
                        .build();
                return chain.proceed(authenticatedRequest);
            });
            logger.debug("Authenticated OkHttpClient ({}) created for {}", headerName, kind.getDisplayName());
        } else {
            logger.warn("No {} credentials configured. Proceeding with unauthenticated client.", kind.getDisplayName());
        }
        return builder.build();
    }

    public static String bearer(String token) {
        return "Bearer " + token;
    }

    public static String basic(String user, String token) {
        return Credentials.basic(user, token);
    }
}
