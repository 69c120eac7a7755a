package com.questrail.gateway.transport.netty;

import com.questrail.gateway.transport.CertificateLoadException;

import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;

import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;

/**
 * Builds server {@link SslContext}s from PEM files.
 */
final class TlsContexts
{
    private TlsContexts() {}

    /**
     * @param certFile PEM certificate chain
     * @param keyFile  PEM private key in PKCS#8 format
     * @throws CertificateLoadException if a file is missing or unusable
     */
    static SslContext serverContext(Path certFile, Path keyFile) {
        requireReadable(certFile, "certificate");
        requireReadable(keyFile, "private key");
        try {
            return SslContextBuilder.forServer(certFile.toFile(), keyFile.toFile()).build();
        } catch (Exception e) {
            throw new CertificateLoadException("Loading of certificate " + certFile + " or private key "
                    + keyFile + " failed: " + e.getMessage(), e);
        }
    }

    private static void requireReadable(Path file, String what) {
        if (!Files.isReadable(file)) {
            throw new CertificateLoadException("Cannot read " + what + " file " + file,
                    new NoSuchFileException(file.toString()));
        }
    }
}
