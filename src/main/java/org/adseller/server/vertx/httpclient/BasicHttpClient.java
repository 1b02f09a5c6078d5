package org.adseller.server.vertx.httpclient;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import io.vertx.core.http.HttpMethod;
import io.vertx.core.http.RequestOptions;
import org.adseller.server.vertx.httpclient.model.HttpClientResponse;

import java.util.Objects;
import java.util.concurrent.TimeoutException;

/**
 * {@link HttpClient} backed by the Vert.x core HTTP client.
 */
public class BasicHttpClient implements HttpClient {

    private final io.vertx.core.http.HttpClient httpClient;

    public BasicHttpClient(io.vertx.core.http.HttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient);
    }

    @Override
    public Future<HttpClientResponse> post(String url, MultiMap headers, String body, long timeoutMs) {
        if (timeoutMs <= 0) {
            return Future.failedFuture(new TimeoutException("Timeout has been exceeded"));
        }

        final RequestOptions options = new RequestOptions()
                .setMethod(HttpMethod.POST)
                .setAbsoluteURI(url)
                .setHeaders(headers)
                .setIdleTimeout(timeoutMs);

        return httpClient.request(options)
                .compose(request -> request.send(body))
                .compose(response -> response.body()
                        .map(buffer -> HttpClientResponse.of(
                                response.statusCode(), response.headers(), buffer.toString())));
    }
}
