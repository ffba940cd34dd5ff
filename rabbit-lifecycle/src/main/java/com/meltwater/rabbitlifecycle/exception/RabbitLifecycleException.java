package com.meltwater.rabbitlifecycle.exception;

import com.google.common.base.Throwables;
import com.rabbitmq.client.ShutdownSignalException;
import rx.exceptions.CompositeException;

import java.util.List;

/**
 * Base class of every failure raised by this library.
 *
 * Each failure is tagged with the {@link Level} of the hierarchy it originated at. If anything in the chain of
 * causes is a {@link ShutdownSignalException} then the broker's close reason is captured as the transport diagnostic,
 * so that {@link #report()} can show the whole story in one place.
 */
public abstract class RabbitLifecycleException extends RuntimeException {

    public enum Level {
        CONNECTION,
        CHANNEL,
        CONSUMER,
        MESSAGE
    }

    private final Level level;
    private final String transportDiagnostic;

    protected RabbitLifecycleException(Level level, String message, Throwable cause) {
        super(message, cause);
        this.level = level;
        this.transportDiagnostic = cause == null ? null : findTransportDiagnostic(cause);
    }

    public Level getLevel() {
        return level;
    }

    /**
     * @return the close reason reported by the broker, or null if no transport shutdown is part of the cause chain
     */
    public String getTransportDiagnostic() {
        return transportDiagnostic;
    }

    /**
     * Formats this failure, every failure in its cause chain (including the inner failures of aggregated
     * {@link CompositeException}s) and the transport diagnostic into a single multi line report.
     */
    public String report() {
        StringBuilder sb = new StringBuilder();
        List<Throwable> chain = Throwables.getCausalChain(this);
        for (int i = 0; i < chain.size(); i++) {
            Throwable t = chain.get(i);
            sb.append(i == 0 ? "" : "  caused by: ").append(describe(t)).append('\n');
            if (t instanceof CompositeException) {
                List<Throwable> inner = ((CompositeException) t).getExceptions();
                for (int j = 0; j < inner.size(); j++) {
                    sb.append("    inner failure ").append(j + 1).append(": ").append(describe(inner.get(j))).append('\n');
                }
            }
        }
        if (transportDiagnostic != null) {
            sb.append("  transport diagnostic: ").append(transportDiagnostic).append('\n');
        }
        return sb.toString();
    }

    private static String describe(Throwable t) {
        String prefix = t instanceof RabbitLifecycleException
                ? "[" + ((RabbitLifecycleException) t).getLevel().name().toLowerCase() + "] "
                : "";
        return prefix + t.getClass().getSimpleName() + ": " + t.getMessage();
    }

    private static String findTransportDiagnostic(Throwable cause) {
        for (Throwable t : Throwables.getCausalChain(cause)) {
            if (t instanceof RabbitLifecycleException && ((RabbitLifecycleException) t).transportDiagnostic != null) {
                return ((RabbitLifecycleException) t).transportDiagnostic;
            }
            if (t instanceof ShutdownSignalException) {
                ShutdownSignalException signal = (ShutdownSignalException) t;
                return signal.getReason() != null ? signal.getReason().toString() : signal.getMessage();
            }
        }
        return null;
    }
}
