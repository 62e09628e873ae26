package dev.odoorpc.transport;

import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simple helper for logging HTTP traffic in a consistent format so that the JSON and the plain
 * HTTP channel produce identical log lines.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    private static final int MAX_BODY = 200;

    private static final Pattern PASSWORD = Pattern.compile("(\"password\"\\s*:\\s*)\"(?:[^\"\\\\]|\\\\.)*\"");

    private Wire() {
    }

    public static void tx(String method, String uri, byte[] body) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("TX {} {} bytes={} body={}",
                method,
                uri,
                body == null ? 0 : body.length,
                preview(body));
        }
    }

    public static void rx(String uri, int status, byte[] body) {
        if (LOGGER.isDebugEnabled()) {
            LOGGER.debug("RX {} status={} bytes={} body={}",
                uri,
                status,
                body == null ? 0 : body.length,
                preview(body));
        }
    }

    public static String preview(byte[] body) {
        if (body == null) {
            return null;
        }
        return truncate(mask(new String(body, StandardCharsets.UTF_8)), MAX_BODY);
    }

    /**
     * Replace the value of every {@code "password"} member with {@code "***"}.
     */
    public static String mask(String json) {
        if (json == null) {
            return null;
        }
        return PASSWORD.matcher(json).replaceAll("$1\"***\"");
    }

    public static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        if (value.length() <= max) {
            return value;
        }
        return value.substring(0, max) + "...";
    }
}
