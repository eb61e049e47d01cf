package com.packages.search.feed;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative, one-shot cancellation signal shared by every source query of a fetch.
 *
 * <p>Feeds either poll {@link #isCancelled()} / {@link #throwIfCancelled()} or compose
 * {@link #whenCancelled()} into their pipelines, e.g. with {@code takeUntilOther}.</p>
 */
public final class CancellationSignal {

    private static final CancellationSignal NONE = new CancellationSignal(false);

    private final boolean cancellable;

    private final AtomicBoolean cancelled = new AtomicBoolean();

    private final Sinks.One<Boolean> sink = Sinks.one();

    private CancellationSignal(final boolean cancellable) {
        this.cancellable = cancellable;
    }

    /**
     * @return a fresh signal that fires once {@link #cancel()} is called
     */
    public static CancellationSignal create() {
        return new CancellationSignal(true);
    }

    /**
     * @return a shared signal that never fires
     */
    public static CancellationSignal none() {
        return NONE;
    }

    /**
     * Fires the signal. Repeated calls have no further effect.
     *
     * @throws UnsupportedOperationException on {@link #none()}
     */
    public void cancel() {
        if (!cancellable) {
            throw new UnsupportedOperationException("The 'none' cancellation signal cannot be cancelled");
        }
        if (cancelled.compareAndSet(false, true)) {
            sink.tryEmitValue(Boolean.TRUE);
        }
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @throws CancellationException if the signal has fired
     */
    public void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException("Operation was cancelled");
        }
    }

    /**
     * Emits {@code true} once the signal fires; subscribers arriving later receive
     * the value immediately. Never completes for {@link #none()}.
     *
     * @return cancellation notification
     */
    public Mono<Boolean> whenCancelled() {
        return cancellable ? sink.asMono() : Mono.never();
    }
}
