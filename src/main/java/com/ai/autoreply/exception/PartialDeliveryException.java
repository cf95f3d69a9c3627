package com.ai.autoreply.exception;

/**
 * A multi-message send that stopped midway. {@link #getDelivered()} messages reached the gateway before the failure.
 */
public class PartialDeliveryException extends GatewayException {

    private final int delivered;

    public PartialDeliveryException(int delivered, Throwable cause) {
        super("Delivery failed after " + delivered + " message(s): " + cause.getMessage(), cause);
        this.delivered = delivered;
    }

    public int getDelivered() {
        return delivered;
    }
}
