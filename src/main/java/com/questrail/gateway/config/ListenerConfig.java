package com.questrail.gateway.config;

import com.questrail.gateway.transport.ListenerKind;

import java.net.InetSocketAddress;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Configuration of one network listener.
 *
 * @param name        unique listener name, used in thread names and logs
 * @param kind        transport variant
 * @param bindAddress address to bind; may be unresolved, it is resolved when binding
 * @param certFile    PEM certificate chain, TLS only
 * @param keyFile     PEM private key (PKCS#8), TLS only
 * @param path        HTTP path of the upgrade endpoint, WebSocket only
 */
public record ListenerConfig(
    String name,
    ListenerKind kind,
    InetSocketAddress bindAddress,
    Path certFile,
    Path keyFile,
    String path
) {
    public static final String DEFAULT_WEBSOCKET_PATH = "/mqtt";

    public ListenerConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(bindAddress, "bindAddress");
        if (kind == ListenerKind.TLS) {
            Objects.requireNonNull(certFile, "certFile");
            Objects.requireNonNull(keyFile, "keyFile");
        }
        if (kind == ListenerKind.WEBSOCKET) {
            Objects.requireNonNull(path, "path");
        }
    }

    public static ListenerConfig plain(InetSocketAddress bindAddress) {
        return new ListenerConfig("mqtt", ListenerKind.PLAIN, bindAddress, null, null, null);
    }

    public static ListenerConfig tls(InetSocketAddress bindAddress, Path certFile, Path keyFile) {
        return new ListenerConfig("mqtts", ListenerKind.TLS, bindAddress, certFile, keyFile, null);
    }

    public static ListenerConfig webSocket(InetSocketAddress bindAddress, String path) {
        return new ListenerConfig("mqtt-ws", ListenerKind.WEBSOCKET, bindAddress, null, null, path);
    }

    /**
     * Same listener under another name.
     */
    public ListenerConfig named(String newName) {
        return new ListenerConfig(newName, kind, bindAddress, certFile, keyFile, path);
    }

    /**
     * Bind address as {@code host:port}, for logs.
     */
    public String bindAddressText() {
        return bindAddress.getHostString() + ":" + bindAddress.getPort();
    }
}
