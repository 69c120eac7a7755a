package com.questrail.gateway.transport;

/**
 * The certificate chain or private key of a TLS listener could not be loaded.
 * The listener never reaches {@link ListenerState#RUNNING}.
 */
public final class CertificateLoadException extends ListenerException
{
    public CertificateLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
