package dev.odoorpc.client.config;

import dev.odoorpc.client.Connector;
import dev.odoorpc.client.Protocol;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.convert.DurationUnit;
import org.springframework.lang.Nullable;

/**
 * Configuration properties describing the server a {@link Connector} talks to. The port is kept
 * as text so that a malformed value is reported by the connector itself rather than by the
 * binder.
 */
@ConfigurationProperties(prefix = "odoo.rpc")
public class ConnectorProperties {

	/**
	 * Server host name. Defaults to {@code localhost}.
	 */
	private String host = "localhost";

	/**
	 * Server port. Defaults to {@code 8069}.
	 */
	private String port = String.valueOf(Connector.DEFAULT_PORT);

	/**
	 * Request timeout. A bare number is read as seconds.
	 */
	@DurationUnit(ChronoUnit.SECONDS)
	private Duration timeout = Connector.DEFAULT_TIMEOUT;

	/**
	 * Protocol name, {@code jsonrpc} or {@code jsonrpc+ssl}.
	 */
	private String protocol = Protocol.JSONRPC.protocolName();

	/**
	 * Server version. When {@code null} it is detected on first use.
	 */
	@Nullable
	private String version;

	/**
	 * Whether the {@code result} member of responses is decoded. When {@code false} it is kept as
	 * JSON text.
	 */
	private boolean deserialize = true;

	public String getHost() {
		return host;
	}

	public void setHost(String host) {
		this.host = host;
	}

	public String getPort() {
		return port;
	}

	public void setPort(String port) {
		this.port = port;
	}

	public Duration getTimeout() {
		return timeout;
	}

	public void setTimeout(Duration timeout) {
		this.timeout = Objects.requireNonNullElse(timeout, Connector.DEFAULT_TIMEOUT);
	}

	public String getProtocol() {
		return protocol;
	}

	public void setProtocol(String protocol) {
		this.protocol = protocol;
	}

	@Nullable
	public String getVersion() {
		return version;
	}

	public void setVersion(@Nullable String version) {
		this.version = version;
	}

	public boolean isDeserialize() {
		return deserialize;
	}

	public void setDeserialize(boolean deserialize) {
		this.deserialize = deserialize;
	}

	/**
	 * Build a connector from these properties. No request is sent.
	 * @return a new connector
	 */
	public Connector toConnector() {
		return Connector.builder(host)
			.port(port)
			.timeout(timeout)
			.protocol(protocol)
			.version(version)
			.deserialize(deserialize)
			.build();
	}

}
