package com.postqueue.dispatch;

import com.postqueue.core.DeliveryException;
import com.postqueue.core.DeliveryReceipt;

/**
 * Delivers one message to one target.
 *
 * <p>The scheduler treats both arguments as opaque and imposes no timeout;
 * bounding the call is the implementation's job.</p>
 */
public interface Dispatcher {

    /**
     * @param target the destination channel or endpoint identifier
     * @param payload the message content, passed through as stored
     * @return the transport's receipt for the delivered message
     * @throws DeliveryException if the message could not be delivered
     */
    DeliveryReceipt deliver(String target, String payload) throws DeliveryException;
}
