package com.meltwater.rabbitlifecycle.transport.impl;

import com.meltwater.rabbitlifecycle.transport.TransportListener;
import com.meltwater.rabbitlifecycle.util.Logger;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.ShutdownListener;
import com.rabbitmq.client.ShutdownSignalException;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Translates the shutdown signal of a connection or channel into {@link TransportListener} notifications.
 */
class TransportListeners implements ShutdownListener {

    private static final Logger log = new Logger(TransportListeners.class);

    private final String resource;
    private final List<TransportListener> listeners = new CopyOnWriteArrayList<>();

    TransportListeners(String resource) {
        this.resource = resource;
    }

    void add(TransportListener listener) {
        listeners.add(listener);
    }

    void remove(TransportListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void shutdownCompleted(ShutdownSignalException cause) {
        boolean hadError = !cause.isInitiatedByApplication() && !isNormalClose(cause.getReason());
        log.debugWithParams("Shutdown signal received.",
                "resource", resource,
                "initiatedByApplication", cause.isInitiatedByApplication(),
                "hadError", hadError,
                "reason", cause.getReason());
        if (hadError) {
            for (TransportListener listener : listeners) {
                try {
                    listener.onError(cause);
                } catch (RuntimeException e) {
                    log.errorWithParams("Transport listener failed on error notification.", e,
                            "resource", resource);
                }
            }
        }
        for (TransportListener listener : listeners) {
            try {
                listener.onClose(hadError);
            } catch (RuntimeException e) {
                log.errorWithParams("Transport listener failed on close notification.", e,
                        "resource", resource);
            }
        }
    }

    private static boolean isNormalClose(Method reason) {
        if (reason instanceof AMQP.Connection.Close) {
            return ((AMQP.Connection.Close) reason).getReplyCode() == AMQP.REPLY_SUCCESS;
        }
        if (reason instanceof AMQP.Channel.Close) {
            return ((AMQP.Channel.Close) reason).getReplyCode() == AMQP.REPLY_SUCCESS;
        }
        return false;
    }
}
