package dev.odoorpc.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Encodes {@code call} requests and decodes the response envelopes returned by the server.
 *
 * <p>Responses are returned whole ({@code jsonrpc}, {@code id} and {@code result}) so callers can
 * still inspect the correlation id. An {@code error} member is turned into a
 * {@link RemoteFaultException}; anything that is not an envelope becomes a
 * {@link RpcProtocolException}.
 */
public final class JsonRpcCodec {

    public static final String JSONRPC_VERSION = "2.0";
    public static final String METHOD_CALL = "call";

    private static final int MAX_ID = 1_000_000_000;

    private final ObjectMapper mapper;
    private final AtomicInteger lastId = new AtomicInteger(-1);

    public JsonRpcCodec() {
        this(new ObjectMapper());
    }

    public JsonRpcCodec(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public ObjectMapper mapper() {
        return mapper;
    }

    public JsonRpcRequest newRequest(Map<String, ?> params) {
        if (params == null) {
            return newRequest(mapper.createObjectNode());
        }
        return newRequest((ObjectNode) mapper.valueToTree(params));
    }

    public JsonRpcRequest newRequest(ObjectNode params) {
        ObjectNode copy = params == null ? mapper.createObjectNode() : params.deepCopy();
        return new JsonRpcRequest(JSONRPC_VERSION, METHOD_CALL, copy, nextId());
    }

    public byte[] encode(JsonRpcRequest request) throws RpcProtocolException {
        try {
            return mapper.writeValueAsBytes(request);
        } catch (JsonProcessingException e) {
            throw new RpcProtocolException("Unable to encode request " + request.id(), e);
        }
    }

    /**
     * Decode a response body.
     * @param body raw HTTP response body
     * @param deserialize when {@code false} the {@code result} member is replaced by a text node
     * holding its JSON encoding, leaving decoding to the caller
     * @return the response envelope
     * @throws RemoteFaultException when the envelope carries an {@code error}
     * @throws RpcProtocolException when the body is not a response envelope
     */
    public ObjectNode decode(byte[] body, boolean deserialize) throws RpcException {
        JsonNode tree;
        try {
            tree = mapper.readTree(body == null ? new byte[0] : body);
        } catch (IOException e) {
            throw new RpcProtocolException("Response is not valid JSON: " + Wire.preview(body), e);
        }
        if (tree == null || !tree.isObject()) {
            throw new RpcProtocolException("Response is not a JSON object: " + Wire.preview(body));
        }
        ObjectNode envelope = (ObjectNode) tree;
        boolean hasResult = envelope.has("result");
        boolean hasError = envelope.has("error");
        if (hasResult && hasError) {
            throw new RpcProtocolException("Response carries both result and error (id="
                + envelope.path("id").asText() + ")");
        }
        if (!hasResult && !hasError) {
            throw new RpcProtocolException("Response carries neither result nor error (id="
                + envelope.path("id").asText() + ")");
        }
        if (hasError) {
            JsonNode error = envelope.get("error");
            if (!error.isObject()) {
                throw new RpcProtocolException("Response error member is not an object: " + error);
            }
            throw RemoteFaultException.fromError(error);
        }
        if (!deserialize) {
            envelope.put("result", envelope.get("result").toString());
        }
        return envelope;
    }

    int nextId() {
        while (true) {
            int previous = lastId.get();
            int next = ThreadLocalRandom.current().nextInt(MAX_ID);
            // consecutive ids must differ
            if (next != previous && lastId.compareAndSet(previous, next)) {
                return next;
            }
        }
    }
}
