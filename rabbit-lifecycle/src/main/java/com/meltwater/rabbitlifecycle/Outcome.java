package com.meltwater.rabbitlifecycle;

import rx.Completable;
import rx.subjects.AsyncSubject;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A result that is settled exactly once, either with success or with a failure.
 *
 * Only the first call to {@link #succeed()}, {@link #fail(Throwable)} or {@link #settle(Throwable)} has any effect,
 * later calls are ignored and return false. Any number of observers can wait for the settlement through
 * {@link #toCompletable()}, also after it has happened.
 */
public class Outcome {

    private final AtomicBoolean settled = new AtomicBoolean(false);
    private final AsyncSubject<Void> subject = AsyncSubject.create();
    private volatile Throwable failure;

    public boolean succeed() {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        subject.onCompleted();
        return true;
    }

    public boolean fail(Throwable reason) {
        if (!settled.compareAndSet(false, true)) {
            return false;
        }
        failure = reason;
        subject.onError(reason);
        return true;
    }

    /**
     * @param reason the failure to settle with, or null to settle with success
     */
    public boolean settle(Throwable reason) {
        return reason == null ? succeed() : fail(reason);
    }

    public boolean isSettled() {
        return settled.get();
    }

    /**
     * @return the failure this outcome settled with, or null if it succeeded or is not yet settled
     */
    public Throwable getFailure() {
        return failure;
    }

    public Completable toCompletable() {
        return subject.toCompletable();
    }

    /**
     * @return a completable that completes on settlement, whether it succeeded or failed
     */
    public Completable awaitQuietly() {
        return toCompletable().onErrorComplete();
    }
}
