package com.questrail.gateway.api;

/**
 * PvStatus
 * -----------------------------------------------------------------------------
 * Quality tag attached to every {@link ProcessValue}.
 *
 * <p>On the wire the status travels as an integer code. Codes are grouped in
 * ranges so that controllers and clients may use finer-grained values:</p>
 * <ul>
 *   <li>{@code 0..99}: {@link #GOOD}</li>
 *   <li>{@code 100..199}: {@link #UNCERTAIN}</li>
 *   <li>everything else (including negative codes): {@link #BAD}</li>
 * </ul>
 */
public enum PvStatus
{
    GOOD(0),
    UNCERTAIN(100),
    BAD(200);

    private final int code;

    PvStatus(int code) {
        this.code = code;
    }

    /**
     * Canonical wire code of this status.
     */
    public int code() {
        return code;
    }

    public static PvStatus fromCode(int code) {
        if (code >= 0 && code < 100) {
            return GOOD;
        }
        if (code >= 100 && code < 200) {
            return UNCERTAIN;
        }
        return BAD;
    }
}
