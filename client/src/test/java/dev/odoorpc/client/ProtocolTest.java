package dev.odoorpc.client;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProtocolTest {

    @Test
    void resolvesProtocolsByName() {
        assertEquals(Protocol.JSONRPC, Protocol.fromName("jsonrpc"));
        assertEquals(Protocol.JSONRPC_SSL, Protocol.fromName("jsonrpc+ssl"));
        assertEquals(Protocol.JSONRPC_SSL, Protocol.fromName("JSONRPC+SSL"));
    }

    @Test
    void sslFlagSelectsScheme() {
        assertFalse(Protocol.JSONRPC.isSsl());
        assertEquals("http", Protocol.JSONRPC.scheme());
        assertTrue(Protocol.JSONRPC_SSL.isSsl());
        assertEquals("https", Protocol.JSONRPC_SSL.scheme());
    }

    @Test
    void unknownProtocolIsAConfigurationError() {
        assertThatThrownBy(() -> Protocol.fromName("xmlrpc"))
            .isInstanceOf(ConnectorConfigurationException.class)
            .hasMessageContaining("jsonrpc+ssl");
        assertThatThrownBy(() -> Protocol.fromName(null))
            .isInstanceOf(ConnectorConfigurationException.class);
    }
}
