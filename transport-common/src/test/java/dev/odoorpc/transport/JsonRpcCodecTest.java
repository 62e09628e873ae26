package dev.odoorpc.transport;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

class JsonRpcCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final JsonRpcCodec codec = new JsonRpcCodec(mapper);

    @Test
    void encodedRequestCarriesVersionMethodAndParams() throws Exception {
        Map<String, Object> params = Map.of(
            "model", "res.partner",
            "method", "read",
            "args", List.of(List.of(1)));

        JsonNode body = mapper.readTree(codec.encode(codec.newRequest(params)));

        assertEquals("2.0", body.get("jsonrpc").asText());
        assertEquals("call", body.get("method").asText());
        assertEquals(mapper.valueToTree(params), body.get("params"));
        assertThat(body.get("id").isInt()).isTrue();
        assertThat(body.size()).isEqualTo(4);
    }

    @Test
    void nullParamsEncodeAsEmptyObject() throws Exception {
        JsonNode body = mapper.readTree(codec.encode(codec.newRequest((Map<String, ?>) null)));

        assertThat(body.get("params").isObject()).isTrue();
        assertThat(body.get("params").size()).isZero();
    }

    @Test
    void requestParamsAreCopiedFromCallerNode() {
        ObjectNode params = mapper.createObjectNode().put("db", "demo");

        JsonRpcRequest request = codec.newRequest(params);
        params.put("db", "changed");

        assertEquals("demo", request.params().get("db").asText());
    }

    @Test
    void consecutiveIdsNeverRepeat() {
        int previous = codec.newRequest(Map.of()).id();
        for (int i = 0; i < 1000; i++) {
            int current = codec.newRequest(Map.of()).id();
            assertNotEquals(previous, current);
            assertThat(current).isNotNegative();
            previous = current;
        }
    }

    @Test
    void resultEnvelopeIsReturnedUnchanged() throws Exception {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":7,\"result\":{\"uid\":1}}";

        ObjectNode envelope = codec.decode(bytes(body), true);

        assertEquals(mapper.readTree(body), envelope);
    }

    @Test
    void resultIsLeftEncodedWhenDeserializationIsDisabled() throws Exception {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":7,\"result\":{\"uid\":1,\"name\":\"Admin\"}}";

        ObjectNode envelope = codec.decode(bytes(body), false);

        assertThat(envelope.get("result").isTextual()).isTrue();
        assertEquals(mapper.readTree("{\"uid\":1,\"name\":\"Admin\"}"),
            mapper.readTree(envelope.get("result").asText()));
        assertEquals(7, envelope.get("id").asInt());
    }

    @Test
    void errorEnvelopeRaisesRemoteFault() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":7,\"error\":{\"message\":\"Access Denied\",\"code\":200,"
            + "\"data\":{\"name\":\"odoo.exceptions.AccessDenied\",\"debug\":\"Traceback\",\"message\":\"Wrong login\"}}}";

        RemoteFaultException fault = assertThrows(RemoteFaultException.class, () -> codec.decode(bytes(body), true));

        assertEquals("Access Denied", fault.getMessage());
        assertEquals(Integer.valueOf(200), fault.getCode());
        assertEquals("odoo.exceptions.AccessDenied", fault.getRemoteName());
        assertEquals("Wrong login", fault.getRemoteMessage());
        assertEquals("Traceback", fault.getDebug());
    }

    @Test
    void errorWithoutDataLeavesRemoteDetailsEmpty() {
        String body = "{\"jsonrpc\":\"2.0\",\"id\":3,\"error\":{\"message\":\"Session expired\"}}";

        RemoteFaultException fault = assertThrows(RemoteFaultException.class, () -> codec.decode(bytes(body), true));

        assertEquals("Session expired", fault.getMessage());
        assertNull(fault.getCode());
        assertNull(fault.getRemoteName());
        assertNull(fault.getDebug());
        assertThat(fault.getData().isMissingNode()).isTrue();
    }

    @Test
    void malformedBodyRaisesProtocolError() {
        assertThatThrownBy(() -> codec.decode(bytes("not json"), true))
            .isInstanceOf(RpcProtocolException.class)
            .isNotInstanceOf(RemoteFaultException.class);
    }

    @Test
    void nonObjectBodiesRaiseProtocolError() {
        assertThatThrownBy(() -> codec.decode(bytes("\"not json\""), true))
            .isInstanceOf(RpcProtocolException.class);
        assertThatThrownBy(() -> codec.decode(bytes("[1,2]"), true))
            .isInstanceOf(RpcProtocolException.class);
        assertThatThrownBy(() -> codec.decode(new byte[0], true))
            .isInstanceOf(RpcProtocolException.class);
    }

    @Test
    void envelopeWithNeitherOrBothMembersRaisesProtocolError() {
        assertThatThrownBy(() -> codec.decode(bytes("{\"jsonrpc\":\"2.0\",\"id\":1}"), true))
            .isInstanceOf(RpcProtocolException.class)
            .hasMessageContaining("neither");
        assertThatThrownBy(() -> codec.decode(
            bytes("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":1,\"error\":{\"message\":\"x\"}}"), true))
            .isInstanceOf(RpcProtocolException.class)
            .hasMessageContaining("both");
    }

    @Test
    void nullResultIsStillAResult() throws Exception {
        ObjectNode envelope = codec.decode(bytes("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":null}"), true);

        assertThat(envelope.get("result").isNull()).isTrue();
    }

    private static byte[] bytes(String value) {
        return value.getBytes(StandardCharsets.UTF_8);
    }
}
