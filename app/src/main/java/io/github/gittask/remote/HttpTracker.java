package io.github.gittask.remote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.gittask.exception.GitTaskException;
import io.github.gittask.exception.RemoteFailureException;
import io.github.gittask.exception.ValidationException;
import io.github.gittask.util.Json;
import java.io.IOException;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/** Base of the trackers that speak JSON over REST through OkHttp. */
abstract class HttpTracker implements RemoteTracker {
    private static final Logger logger = LogManager.getLogger(HttpTracker.class);
    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    protected final OkHttpClient client;
    protected final HttpUrl baseUrl;
    protected final ObjectMapper mapper = Json.mapper();

    protected HttpTracker(OkHttpClient client, String baseUrl) throws ValidationException {
        this.client = client;
        var parsed = HttpUrl.parse(baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl);
        if (parsed == null) {
            throw new ValidationException("Invalid " + kind().getDisplayName() + " URL: " + baseUrl);
        }
        this.baseUrl = parsed;
    }

    protected HttpUrl.Builder url(String... segments) {
        var builder = baseUrl.newBuilder();
        for (String segment : segments) {
            builder.addPathSegment(segment);
        }
        return builder;
    }

    protected JsonNode get(HttpUrl url, String what) throws GitTaskException {
        return execute(new Request.Builder().url(url).get(), what);
    }

    protected JsonNode send(String method, HttpUrl url, @Nullable JsonNode body, String what) throws GitTaskException {
        RequestBody requestBody = null;
        if (body != null) {
            requestBody = RequestBody.create(body.toString(), JSON);
        } else if (!"DELETE".equals(method)) {
            requestBody = RequestBody.create(new byte[0], null);
        }
        return execute(new Request.Builder().url(url).method(method, requestBody), what);
    }

    private JsonNode execute(Request.Builder builder, String what) throws GitTaskException {
        Request request = builder.header("Accept", "application/json").build();
        logger.trace("{} {} {}", kind().getDisplayName(), request.method(), request.url());
        try (Response response = client.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String text = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                logger.debug("{} {} {} failed with {}: {}",
                        kind().getDisplayName(), request.method(), request.url(), response.code(), text);
                throw HttpErrors.fromStatus(kind(), response.code(), what, response.message());
            }
            if (text.isBlank()) {
                return mapper.missingNode();
            }
            return mapper.readTree(text);
        } catch (JsonProcessingException e) {
            throw new RemoteFailureException(kind(), RemoteFailureException.Reason.HTTP, false,
                    "Unexpected response from " + kind().getDisplayName() + " for " + what + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw HttpErrors.fromIOException(kind(), e, what);
        }
    }

    /** {@link #get} for use inside a page fetcher. */
    protected JsonNode getPage(HttpUrl url, String what) throws RemoteFailureException {
        try {
            return get(url, what);
        } catch (GitTaskException e) {
            throw HttpErrors.forListing(kind(), e);
        }
    }
}
