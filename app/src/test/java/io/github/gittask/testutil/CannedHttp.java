package io.github.gittask.testutil;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import okhttp3.HttpUrl;
import okhttp3.Interceptor;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Response;
import okhttp3.ResponseBody;
import okio.Buffer;
import org.jetbrains.annotations.Nullable;

/**
 * OkHttp interceptor that answers tracker calls with canned JSON instead of going to the network, and records every
 * request it sees. Responses registered for the same route are served in order; the last one repeats.
 */
public final class CannedHttp implements Interceptor {
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    public record Recorded(String method, HttpUrl url, String body) {
        public String path() {
            return url.encodedPath();
        }

        public @Nullable String query(String name) {
            return url.queryParameter(name);
        }
    }

    private record Canned(int code, String body) {}

    private record Route(String method, String path, Map<String, String> query, Deque<Canned> responses) {
        boolean matches(String requestMethod, HttpUrl url) {
            if (!method.equals(requestMethod) || !path.equals(url.encodedPath())) {
                return false;
            }
            return query.entrySet().stream().allMatch(e -> e.getValue().equals(url.queryParameter(e.getKey())));
        }
    }

    private final List<Route> routes = new ArrayList<>();
    private final List<Recorded> requests = Collections.synchronizedList(new ArrayList<>());

    public CannedHttp on(String method, String path, int code, String body) {
        return on(method, path, Map.of(), code, body);
    }

    public synchronized CannedHttp on(String method, String path, Map<String, String> query, int code, String body) {
        for (Route route : routes) {
            if (route.method().equals(method) && route.path().equals(path) && route.query().equals(query)) {
                route.responses().add(new Canned(code, body));
                return this;
            }
        }
        var responses = new ArrayDeque<Canned>();
        responses.add(new Canned(code, body));
        routes.add(new Route(method, path, Map.copyOf(query), responses));
        return this;
    }

    public OkHttpClient client() {
        return new OkHttpClient.Builder().addInterceptor(this).build();
    }

    public List<Recorded> requests() {
        synchronized (requests) {
            return List.copyOf(requests);
        }
    }

    public List<Recorded> requests(String method) {
        return requests().stream().filter(r -> r.method().equals(method)).toList();
    }

    @Override
    public Response intercept(Chain chain) throws IOException {
        var request = chain.request();
        String body = "";
        if (request.body() != null) {
            var buffer = new Buffer();
            request.body().writeTo(buffer);
            body = buffer.readUtf8();
        }
        requests.add(new Recorded(request.method(), request.url(), body));

        Canned canned = next(request.method(), request.url());
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(canned.code())
                .message(canned.code() < 400 ? "OK" : "Error")
                .body(ResponseBody.create(canned.body(), JSON))
                .build();
    }

    private synchronized Canned next(String method, HttpUrl url) {
        // most specific route first: the one with the most query constraints
        Route best = null;
        for (Route route : routes) {
            if (route.matches(method, url) && (best == null || route.query().size() > best.query().size())) {
                best = route;
            }
        }
        if (best == null) {
            return new Canned(404, "{\"message\":\"no canned response for " + method + " " + url.encodedPath() + "\"}");
        }
        return best.responses().size() > 1 ? best.responses().poll() : best.responses().peek();
    }
}
