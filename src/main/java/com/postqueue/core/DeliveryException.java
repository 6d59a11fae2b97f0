package com.postqueue.core;

/**
 * Raised by a dispatcher when a message could not be delivered.
 *
 * <p>Delivery failures are never fatal to the scheduler. The execution
 * orchestrator converts them into failed execution records; they are not
 * retried.</p>
 */
public class DeliveryException extends Exception {

    private final String target;
    private final int statusCode;

    public DeliveryException(String target, String reason) {
        super(reason);
        this.target = target;
        this.statusCode = -1;
    }

    public DeliveryException(String target, String reason, int statusCode) {
        super(reason);
        this.target = target;
        this.statusCode = statusCode;
    }

    public DeliveryException(String target, String reason, Throwable cause) {
        super(reason, cause);
        this.target = target;
        this.statusCode = -1;
    }

    /**
     * Get the target the delivery was addressed to.
     *
     * @return the target identifier
     */
    public String getTarget() {
        return target;
    }

    /**
     * Get the transport status code, if the transport reported one.
     *
     * @return the status code, or -1 if not available
     */
    public int getStatusCode() {
        return statusCode;
    }
}
