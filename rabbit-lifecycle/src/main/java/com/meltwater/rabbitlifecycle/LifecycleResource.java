package com.meltwater.rabbitlifecycle;

import com.meltwater.rabbitlifecycle.util.Logger;
import rx.Completable;
import rx.Scheduler;
import rx.Subscription;
import rx.functions.Func0;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Shared lifecycle of connections, channels and consumers.
 *
 * A resource is open until it starts dying (the first close request, made by the application or caused by the
 * broker) or until its completion is settled, whichever happens first. The completion is settled exactly once.
 */
abstract class LifecycleResource {

    private static final Logger log = new Logger(LifecycleResource.class);

    private final AtomicBoolean dying = new AtomicBoolean(false);
    protected final Outcome completion = new Outcome();
    protected final Scheduler ioScheduler;
    protected final Scheduler timerScheduler;

    LifecycleResource(Scheduler ioScheduler, Scheduler timerScheduler) {
        this.ioScheduler = ioScheduler;
        this.timerScheduler = timerScheduler;
    }

    /**
     * Checking this method should be only for information,
     * because of the race conditions - state can change after the call.
     */
    public boolean isOpen() {
        return !dying.get() && !completion.isSettled();
    }

    /**
     * @return a completable that completes when this resource is closed, or errors with the reason it was closed for
     */
    public Completable completion() {
        return completion.toCompletable();
    }

    /**
     * @return true for the one caller that moved this resource into dying
     */
    protected boolean beginDying() {
        return dying.compareAndSet(false, true);
    }

    protected boolean isDying() {
        return dying.get();
    }

    /**
     * Starts a timer that fails the completion when it fires first. The work it bounds is never interrupted.
     *
     * @return the timer subscription, to be unsubscribed when the bounded work is done
     */
    protected Subscription armDeadline(long timeoutMillis, Func0<? extends Throwable> timeoutError) {
        return Completable.timer(timeoutMillis, TimeUnit.MILLISECONDS, timerScheduler)
                .subscribe(() -> {
                    Throwable error = timeoutError.call();
                    if (completion.fail(error)) {
                        log.warnWithParams("Deadline passed, giving up waiting.",
                                "resource", this,
                                "timeoutMillis", timeoutMillis,
                                "error", error.getMessage());
                    }
                });
    }

    /**
     * Runs a blocking transport call on the io scheduler.
     */
    protected Completable blocking(Callable<?> transportCall) {
        return Completable.fromCallable(transportCall).subscribeOn(ioScheduler);
    }

    /**
     * Runs a best effort cleanup call on the io scheduler. Failures are logged and never propagated.
     */
    protected Completable bestEffort(String description, Callable<?> transportCall) {
        return blocking(transportCall)
                .doOnError(e -> log.warnWithParams("Failed to " + description + ", ignoring.", e,
                        "resource", this))
                .onErrorComplete();
    }

    /**
     * Settles the completion with the reason if given, else with success.
     */
    protected void finish(Throwable reason) {
        if (completion.settle(reason)) {
            log.infoWithParams("Closed.",
                    "resource", this,
                    "reason", reason == null ? null : reason.getMessage());
        }
    }
}
