package dev.odoorpc.client.proxy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.odoorpc.client.transport.HttpTransport;
import dev.odoorpc.client.transport.RawResponse;
import dev.odoorpc.transport.JsonRpcCodec;
import dev.odoorpc.transport.JsonRpcRequest;
import dev.odoorpc.transport.RemoteFaultException;
import dev.odoorpc.transport.RpcException;
import dev.odoorpc.transport.RpcProtocolException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Addresses a JSON controller of the server by its URL path and calls it. Instances are
 * immutable: each {@link #segment(String)} returns a new proxy, so a partially built path can be
 * shared and extended freely.
 *
 * <pre>
 * ObjectNode response = connector.getProxyJson()
 *     .segment("web").segment("dataset").segment("call")
 *     .call(Map.of("model", "res.partner", "method", "read", "args", List.of(List.of(1))));
 *
 * // same endpoint
 * connector.getProxyJson().path("/web/dataset/call").call(params);
 * </pre>
 *
 * <p>The full response envelope is returned, {@code id} and {@code jsonrpc} included.
 */
public final class JsonProxy {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonProxy.class);

    private static final Map<String, String> JSON_HEADERS = Map.of(
        "Content-Type", "application/json",
        "Accept", "application/json");

    private final HttpTransport transport;
    private final JsonRpcCodec codec;
    private final URI baseUri;
    private final boolean deserialize;
    private final List<String> segments;

    public JsonProxy(HttpTransport transport, JsonRpcCodec codec, URI baseUri, boolean deserialize) {
        this(transport, codec, baseUri, deserialize, List.of());
    }

    private JsonProxy(HttpTransport transport, JsonRpcCodec codec, URI baseUri, boolean deserialize,
        List<String> segments) {
        this.transport = Objects.requireNonNull(transport, "transport");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.baseUri = Objects.requireNonNull(baseUri, "baseUri");
        this.deserialize = deserialize;
        this.segments = segments;
    }

    public JsonProxy segment(String name) {
        if (name == null || name.isBlank() || name.indexOf('/') >= 0) {
            throw new IllegalArgumentException("Invalid path segment '" + name + "'");
        }
        List<String> extended = new ArrayList<>(segments.size() + 1);
        extended.addAll(segments);
        extended.add(name);
        return new JsonProxy(transport, codec, baseUri, deserialize, Collections.unmodifiableList(extended));
    }

    /**
     * Append every non-empty part of a slash-delimited path, e.g. {@code "/web/session/authenticate"}.
     */
    public JsonProxy path(String path) {
        Objects.requireNonNull(path, "path");
        JsonProxy proxy = this;
        for (String part : path.split("/")) {
            if (!part.isEmpty()) {
                proxy = proxy.segment(part);
            }
        }
        return proxy;
    }

    public List<String> getSegments() {
        return segments;
    }

    public String getPath() {
        return "/" + String.join("/", segments);
    }

    public URI getUri() {
        try {
            return new URIBuilder(baseUri).setPathSegments(segments).build();
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid endpoint " + getPath(), e);
        }
    }

    public boolean isDeserialize() {
        return deserialize;
    }

    public ObjectNode call() throws RpcException {
        return send(codec.newRequest((ObjectNode) null));
    }

    public ObjectNode call(Map<String, ?> params) throws RpcException {
        return send(codec.newRequest(params));
    }

    public ObjectNode call(ObjectNode params) throws RpcException {
        return send(codec.newRequest(params));
    }

    /**
     * Same as {@link #call(Map)} but returns only the {@code result} member of the envelope.
     */
    public JsonNode callForResult(Map<String, ?> params) throws RpcException {
        return call(params).get("result");
    }

    private ObjectNode send(JsonRpcRequest request) throws RpcException {
        URI uri = getUri();
        RawResponse response = transport.execute("POST", uri, JSON_HEADERS, codec.encode(request));
        try {
            return codec.decode(response.body(), deserialize);
        } catch (RemoteFaultException e) {
            LOGGER.debug("Call {} id={} failed remotely: {} ({})", getPath(), request.id(), e.getMessage(),
                e.getRemoteName());
            throw e;
        } catch (RpcProtocolException e) {
            if (!response.isSuccess()) {
                throw new RpcProtocolException("HTTP " + response.status() + " from " + uri + ": " + e.getMessage(), e);
            }
            throw e;
        }
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof JsonProxy proxy)) {
            return false;
        }
        return transport == proxy.transport
            && deserialize == proxy.deserialize
            && baseUri.equals(proxy.baseUri)
            && segments.equals(proxy.segments);
    }

    @Override
    public int hashCode() {
        return Objects.hash(System.identityHashCode(transport), baseUri, deserialize, segments);
    }

    @Override
    public String toString() {
        return "JsonProxy[" + baseUri + getPath() + "]";
    }
}
