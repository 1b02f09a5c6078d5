package org.adseller.server.vertx.httpclient;

import io.vertx.core.Future;
import io.vertx.core.MultiMap;
import org.adseller.server.vertx.httpclient.model.HttpClientResponse;

/**
 * Asynchronous HTTP client used by remote collaborator adapters.
 */
public interface HttpClient {

    Future<HttpClientResponse> post(String url, MultiMap headers, String body, long timeoutMs);
}
