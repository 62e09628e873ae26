package dev.odoorpc.transport;

import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * JSON-RPC request body as posted to an Odoo web controller. Component order matches the order
 * of the members on the wire.
 */
public record JsonRpcRequest(
    String jsonrpc,
    String method,
    ObjectNode params,
    int id
) {
}
