package com.meltwater.rabbitlifecycle.transport;

/**
 * Gets notified when a {@link TransportResource} goes down.
 *
 * When the broker or the network closes the resource then {@link #onError(Throwable)} is called first (if the close
 * carried an error) and {@link #onClose(boolean)} afterwards. When the application closes it only
 * {@link #onClose(boolean)} is called, with hadError set to false.
 */
public interface TransportListener {

    default void onError(Throwable error) {}

    default void onClose(boolean hadError) {}
}
