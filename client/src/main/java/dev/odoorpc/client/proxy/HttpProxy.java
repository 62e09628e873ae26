package dev.odoorpc.client.proxy;

import dev.odoorpc.client.transport.HttpTransport;
import dev.odoorpc.client.transport.RawResponse;
import dev.odoorpc.transport.RpcConnectionException;
import java.net.URI;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Plain GET/POST access to the server's {@code http} controllers (report downloads, binary
 * content). Nothing is parsed: the caller gets the status, headers and raw bytes.
 */
public final class HttpProxy {

    private final HttpTransport transport;
    private final URI baseUri;

    public HttpProxy(HttpTransport transport, URI baseUri) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
    }

    /**
     * Send a POST when {@code data} is given, a GET otherwise.
     * @param path absolute URL or path relative to the server root, query string allowed
     * @param data request body, or {@code null}
     * @param headers extra request headers, or {@code null}
     */
    public RawResponse request(String path, byte[] data, Map<String, String> headers) throws RpcConnectionException {
        String method = data == null ? "GET" : "POST";
        return transport.execute(method, resolve(path), headers, data);
    }

    public RawResponse get(String path) throws RpcConnectionException {
        return request(path, null, null);
    }

    public RawResponse post(String path, byte[] data, String contentType) throws RpcConnectionException {
        Map<String, String> headers = contentType == null ? null : Map.of("Content-Type", contentType);
        return request(path, data == null ? new byte[0] : data, headers);
    }

    public URI resolve(String path) {
        Objects.requireNonNull(path, "path");
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            return URI.create(path);
        }
        return URI.create(baseUri + (path.startsWith("/") ? path : "/" + path));
    }

    @Override
    public String toString() {
        return "HttpProxy[" + baseUri + "]";
    }
}
