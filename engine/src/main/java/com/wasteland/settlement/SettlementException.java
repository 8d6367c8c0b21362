package com.wasteland.settlement;

import lombok.Getter;

/**
 * A settlement call reached the remote side, or tried to, and did not succeed.
 */
@Getter
public class SettlementException extends Exception {

    /**
     * Diagnostic text from the remote side or the transport.
     */
    private final String detail;

    public SettlementException(String message, String detail) {
        super(message);
        this.detail = detail;
    }

    public SettlementException(String message, String detail, Throwable cause) {
        super(message, cause);
        this.detail = detail;
    }
}
