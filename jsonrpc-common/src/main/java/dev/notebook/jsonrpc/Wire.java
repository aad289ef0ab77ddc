package dev.notebook.jsonrpc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs request and response bodies in one format so that traffic can be followed from a single
 * logger.
 */
public final class Wire {

    private static final Logger LOGGER = LoggerFactory.getLogger("WIRE");

    static final int MAX_LOGGED_CHARS = 200;

    private Wire() {
    }

    public static void rx(String remote, String body) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("RX remote={} chars={} json={}", remote, body.length(), truncate(body, MAX_LOGGED_CHARS));
        }
    }

    public static void tx(String remote, String body) {
        if (LOGGER.isInfoEnabled()) {
            LOGGER.info("TX remote={} chars={} json={}", remote, body.length(), truncate(body, MAX_LOGGED_CHARS));
        }
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
