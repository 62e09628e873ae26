package dev.odoorpc.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import dev.odoorpc.client.proxy.HttpProxy;
import dev.odoorpc.client.proxy.JsonProxy;
import dev.odoorpc.client.transport.HttpTransport;
import dev.odoorpc.transport.JsonRpcCodec;
import dev.odoorpc.transport.RpcException;
import dev.odoorpc.transport.RpcProtocolException;
import java.io.Closeable;
import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.Duration;
import org.apache.http.client.utils.URIBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for talking to one server over JSON-RPC. A connector owns a single
 * {@link HttpTransport}, and therefore a single cookie store, shared by its JSON proxy and its
 * plain HTTP proxy: authenticating through {@code /web/session/authenticate} on the JSON proxy
 * also authenticates downloads made through the HTTP proxy.
 *
 * <pre>
 * try (Connector connector = Connector.jsonRpc("localhost", 8069)) {
 *     connector.getProxyJson().path("/web/session/authenticate")
 *         .call(Map.of("db", "demo", "login", "admin", "password", "admin"));
 *     RawResponse pdf = connector.getProxyHttp().get("/report/pdf/sale.report_saleorder/7");
 * }
 * </pre>
 *
 * <p>The proxies are created on first access. If no version was configured, the server version is
 * read from {@value #VERSION_INFO_PATH} at that moment.
 */
public class Connector implements Closeable {

    private static final Logger LOGGER = LoggerFactory.getLogger(Connector.class);

    public static final int DEFAULT_PORT = 8069;
    public static final int MAX_PORT = 65535;
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(120);
    public static final String VERSION_INFO_PATH = "/web/webclient/version_info";

    private final String host;
    private final int port;
    private final boolean ssl;
    private final boolean deserialize;
    private final URI baseUri;
    private final JsonRpcCodec codec;
    private final HttpTransport transport;

    private String version;
    private JsonProxy proxyJson;
    private HttpProxy proxyHttp;

    private Connector(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.ssl = builder.ssl;
        this.deserialize = builder.deserialize;
        this.version = builder.version;
        this.baseUri = baseUri(builder.host, builder.port, builder.ssl);
        this.codec = new JsonRpcCodec();
        this.transport = new HttpTransport(builder.timeout);
    }

    public static Builder builder(String host) {
        return new Builder(host);
    }

    public static Connector jsonRpc(String host, int port) {
        return builder(host).port(port).build();
    }

    public static Connector jsonRpcSsl(String host, int port) {
        return builder(host).port(port).ssl(true).build();
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public boolean isSsl() {
        return ssl;
    }

    public Protocol getProtocol() {
        return ssl ? Protocol.JSONRPC_SSL : Protocol.JSONRPC;
    }

    public boolean isDeserialize() {
        return deserialize;
    }

    public URI getBaseUri() {
        return baseUri;
    }

    public Duration getTimeout() {
        return transport.getTimeout();
    }

    /**
     * Change the timeout of both proxies. Takes effect on their next request.
     */
    public void setTimeout(Duration timeout) {
        transport.setTimeout(timeout);
    }

    public HttpTransport getTransport() {
        return transport;
    }

    public synchronized JsonProxy getProxyJson() throws RpcException {
        initProxies();
        return proxyJson;
    }

    public synchronized HttpProxy getProxyHttp() throws RpcException {
        initProxies();
        return proxyHttp;
    }

    /**
     * @return the configured version, the detected server version, or {@code null} when the
     * server does not report one
     */
    public synchronized String getVersion() throws RpcException {
        initProxies();
        return version;
    }

    private void initProxies() throws RpcException {
        if (proxyJson != null) {
            return;
        }
        JsonProxy json = new JsonProxy(transport, codec, baseUri, deserialize);
        HttpProxy http = new HttpProxy(transport, baseUri);
        if (version == null) {
            version = detectVersion(json);
        }
        proxyJson = json;
        proxyHttp = http;
    }

    private String detectVersion(JsonProxy json) throws RpcException {
        JsonNode result = json.path(VERSION_INFO_PATH).call().get("result");
        if (!deserialize && result != null && result.isTextual()) {
            try {
                result = codec.mapper().readTree(result.asText());
            } catch (JsonProcessingException e) {
                throw new RpcProtocolException("Unreadable version information from " + baseUri, e);
            }
        }
        JsonNode serverVersion = result == null ? null : result.get("server_version");
        if (serverVersion == null || !serverVersion.isTextual()) {
            LOGGER.info("Server {} did not report its version", baseUri);
            return null;
        }
        LOGGER.info("Detected server version {} on {}", serverVersion.asText(), baseUri);
        return serverVersion.asText();
    }

    private static URI baseUri(String host, int port, boolean ssl) {
        try {
            return new URIBuilder()
                .setScheme(ssl ? "https" : "http")
                .setHost(host)
                .setPort(port)
                .build();
        } catch (URISyntaxException e) {
            throw new ConnectorConfigurationException("The host '" + host + "' is invalid.", e);
        }
    }

    @Override
    public void close() throws IOException {
        transport.close();
    }

    @Override
    public String toString() {
        return "Connector[" + getProtocol().protocolName() + " " + baseUri + "]";
    }

    /**
     * Collects and validates connector settings. Every setter fails fast with a
     * {@link ConnectorConfigurationException}.
     */
    public static final class Builder {

        private final String host;
        private int port = DEFAULT_PORT;
        private Duration timeout = DEFAULT_TIMEOUT;
        private boolean ssl;
        private String version;
        private boolean deserialize = true;

        private Builder(String host) {
            if (host == null || host.isBlank()) {
                throw new ConnectorConfigurationException("A host is required.");
            }
            this.host = host.trim();
        }

        public Builder port(int port) {
            if (port < 0 || port > MAX_PORT) {
                throw invalidPort(String.valueOf(port), null);
            }
            this.port = port;
            return this;
        }

        public Builder port(String port) {
            if (port == null) {
                throw invalidPort(null, null);
            }
            try {
                return port(Integer.parseInt(port.trim()));
            } catch (NumberFormatException e) {
                throw invalidPort(port, e);
            }
        }

        public Builder timeout(Duration timeout) {
            this.timeout = HttpTransport.checkTimeout(timeout);
            return this;
        }

        public Builder ssl(boolean ssl) {
            this.ssl = ssl;
            return this;
        }

        public Builder protocol(Protocol protocol) {
            if (protocol == null) {
                throw new ConnectorConfigurationException("A protocol is required.");
            }
            this.ssl = protocol.isSsl();
            return this;
        }

        public Builder protocol(String protocolName) {
            return protocol(Protocol.fromName(protocolName));
        }

        public Builder version(String version) {
            this.version = version == null || version.isBlank() ? null : version;
            return this;
        }

        public Builder deserialize(boolean deserialize) {
            this.deserialize = deserialize;
            return this;
        }

        public Connector build() {
            return new Connector(this);
        }

        private static ConnectorConfigurationException invalidPort(String port, Throwable cause) {
            return new ConnectorConfigurationException(
                "The port '" + port + "' is invalid. An integer between 0 and " + MAX_PORT + " is required.", cause);
        }
    }
}
