package com.meltwater.rabbitlifecycle.exception;

/**
 * The channel was closed by the broker (or went down with its connection), not by the application.
 */
public class ChannelClosedException extends ChannelException {

    private final boolean hadError;

    public ChannelClosedException(boolean hadError) {
        super("Channel closed by peer (hadError=" + hadError + ")");
        this.hadError = hadError;
    }

    public boolean hadError() {
        return hadError;
    }
}
