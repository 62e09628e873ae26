package dev.odoorpc.client.transport;

import dev.odoorpc.client.ConnectorConfigurationException;
import dev.odoorpc.transport.RpcConnectionException;
import dev.odoorpc.transport.Wire;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.apache.http.Header;
import org.apache.http.HttpEntity;
import org.apache.http.client.config.CookieSpecs;
import org.apache.http.client.config.RequestConfig;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpUriRequest;
import org.apache.http.client.methods.RequestBuilder;
import org.apache.http.cookie.Cookie;
import org.apache.http.entity.ByteArrayEntity;
import org.apache.http.impl.client.BasicCookieStore;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.impl.client.HttpClients;
import org.apache.http.impl.conn.PoolingHttpClientConnectionManager;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Blocking HTTP client shared by the JSON and the plain HTTP proxy of one connector. Holds the
 * single cookie store of the connector, so a session opened through one proxy is carried by the
 * other, and the timeout applied to every request. Failed requests are never retried.
 */
public class HttpTransport implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(HttpTransport.class);

    private final BasicCookieStore cookieStore = new BasicCookieStore();
    private final CloseableHttpClient httpClient;

    private volatile Duration timeout;

    public HttpTransport(Duration timeout) {
        this.timeout = checkTimeout(timeout);
        this.httpClient = HttpClients.custom()
            .setConnectionManager(new PoolingHttpClientConnectionManager())
            .setDefaultCookieStore(cookieStore)
            .disableAutomaticRetries()
            .build();
    }

    public Duration getTimeout() {
        return timeout;
    }

    /**
     * Change the timeout used by every subsequent request, whichever proxy issues it.
     * @param timeout connect, read and pool-lease timeout; {@link Duration#ZERO} waits forever
     */
    public void setTimeout(Duration timeout) {
        this.timeout = checkTimeout(timeout);
    }

    public List<Cookie> getCookies() {
        return cookieStore.getCookies();
    }

    public Optional<String> getCookie(String name) {
        return cookieStore.getCookies().stream()
            .filter(cookie -> cookie.getName().equals(name))
            .map(Cookie::getValue)
            .findFirst();
    }

    public RawResponse execute(String method, URI uri, Map<String, String> headers, byte[] body)
        throws RpcConnectionException {
        RequestBuilder builder = RequestBuilder.create(method)
            .setUri(uri)
            .setConfig(requestConfig());
        if (headers != null) {
            headers.forEach(builder::addHeader);
        }
        if (body != null) {
            builder.setEntity(new ByteArrayEntity(body));
        }
        HttpUriRequest request = builder.build();
        Wire.tx(method, uri.toString(), body);
        try (CloseableHttpResponse response = httpClient.execute(request)) {
            int status = response.getStatusLine().getStatusCode();
            HttpEntity entity = response.getEntity();
            byte[] content = entity == null ? new byte[0] : EntityUtils.toByteArray(entity);
            Wire.rx(uri.toString(), status, content);
            return new RawResponse(status, headersOf(response), content);
        } catch (IOException e) {
            LOGGER.warn("{} {} failed: {}", method, uri, e.toString());
            throw new RpcConnectionException(method + " " + uri + " failed: " + e.getMessage(), e);
        }
    }

    private RequestConfig requestConfig() {
        int millis = timeoutMillis(timeout);
        return RequestConfig.custom()
            .setCookieSpec(CookieSpecs.STANDARD)
            .setConnectTimeout(millis)
            .setSocketTimeout(millis)
            .setConnectionRequestTimeout(millis)
            .build();
    }

    private static Map<String, List<String>> headersOf(CloseableHttpResponse response) {
        Map<String, List<String>> headers = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (Header header : response.getAllHeaders()) {
            headers.computeIfAbsent(header.getName(), name -> new ArrayList<>()).add(header.getValue());
        }
        return headers;
    }

    /**
     * Convert a timeout to the milliseconds HttpClient expects, where {@code 0} means no timeout.
     * A positive timeout never maps to {@code 0}: sub-millisecond values round up to 1 ms and
     * values beyond {@link Integer#MAX_VALUE} ms are capped.
     */
    static int timeoutMillis(Duration timeout) {
        if (timeout.isZero()) {
            return 0;
        }
        if (timeout.compareTo(Duration.ofMillis(Integer.MAX_VALUE)) >= 0) {
            return Integer.MAX_VALUE;
        }
        long millis = timeout.toMillis();
        return (int) Math.max(1, millis + (timeout.minusMillis(millis).isZero() ? 0 : 1));
    }

    /**
     * Validate a timeout setting.
     * @return the timeout, unchanged
     * @throws ConnectorConfigurationException when it is {@code null} or negative
     */
    public static Duration checkTimeout(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new ConnectorConfigurationException("The timeout '" + timeout + "' is invalid. A non-negative duration is required.");
        }
        return timeout;
    }

    @Override
    public void close() throws IOException {
        httpClient.close();
    }
}
