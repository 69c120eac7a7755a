package com.questrail.gateway.config;

import java.net.InetSocketAddress;
import java.util.Objects;

/**
 * Parses listener bind addresses.
 *
 * <p>Accepted forms: {@code host:port}, {@code :port} (all interfaces) and
 * {@code [ipv6]:port}.</p>
 */
public final class BindAddresses
{
    private BindAddresses() {}

    public static InetSocketAddress parse(String text) {
        Objects.requireNonNull(text, "text");
        String s = text.trim();
        int p = s.lastIndexOf(':');
        if (p == -1) {
            throw new IllegalArgumentException("Missing port in bind address: " + text);
        }

        String host = s.substring(0, p);
        int port;
        try {
            port = Integer.parseInt(s.substring(p + 1));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid port in bind address: " + text, e);
        }
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Port out of range in bind address: " + text);
        }

        if (host.startsWith("[") && host.endsWith("]")) {
            host = host.substring(1, host.length() - 1);
        }
        if (host.isEmpty()) {
            return new InetSocketAddress(port);
        }
        return InetSocketAddress.createUnresolved(host, port);
    }
}
