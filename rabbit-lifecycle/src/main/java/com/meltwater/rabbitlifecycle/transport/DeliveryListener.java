package com.meltwater.rabbitlifecycle.transport;

import com.rabbitmq.client.Delivery;

/**
 * Receives the deliveries of one broker subscription.
 */
@FunctionalInterface
public interface DeliveryListener {

    /**
     * @param delivery the delivered message, or null if the broker cancelled the subscription
     */
    void onDelivery(Delivery delivery);
}
