/*
 * Copyright 2014 the original author or authors.
 *
 *  Licensed under the Apache License, Version 2.0 (the "License");
 *  you may not use this file except in compliance with the License.
 *  You may obtain a copy of the License at
 *
 *       http://www.apache.org/licenses/LICENSE-2.0
 *
 *  Unless required by applicable law or agreed to in writing, software
 *  distributed under the License is distributed on an "AS IS" BASIS,
 *  WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 *  See the License for the specific language governing permissions and
 *  limitations under the License.
 */

package org.streamstore.core.impl;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.streamstore.core.EventStore;
import org.streamstore.core.EventStoreDisposedException;
import org.streamstore.core.StoreNotifier;
import org.streamstore.core.StoredEvent;
import org.streamstore.core.Subscription;
import org.streamstore.core.SubscriptionDropped;
import org.streamstore.core.SubscriptionDroppedReason;
import org.streamstore.core.SubscriptionFaultedException;
import org.streamstore.core.SubscriptionState;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * The state machine shared by all subscriptions. A subscription runs as one task: it registers with the notifier, catches up
 * by reading pages until it reaches the head, and then waits for signals. Each signal causes one more pass of page reads from
 * the last delivered position. Signals that arrive while a pass runs are coalesced into a single follow-up pass.
 *
 * <p>The listener is registered before the first read, so an event committed after the last page of the catch-up still causes
 * a pass. Every read starts right after the last delivered position, which keeps delivery free of gaps and duplicates.</p>
 *
 * @author Tommy Wassgren
 */
abstract class AbstractSubscription implements Subscription {
    /**
     * Wraps failures thrown by the event handler so they can be told apart from store failures.
     */
    private static final class SubscriberFailure extends RuntimeException {
        private static final long serialVersionUID = 1L;

        private SubscriberFailure(final RuntimeException cause) {
            super(cause);
        }
    }

    private static final Object SIGNAL = new Object();
    protected final Logger log = LoggerFactory.getLogger(getClass());
    protected final int pageSize;
    protected final EventStore store;
    private final Runnable caughtUp;
    private final AtomicBoolean disposed = new AtomicBoolean();
    private final SubscriptionDropped dropped;
    private final AtomicBoolean droppedNotified = new AtomicBoolean();
    private final Consumer<StoredEvent> eventReceived;
    private final String name;
    private final NotifierHandle notifierHandle;
    private final Consumer<AbstractSubscription> onStopped;
    private StoreNotifier notifier;
    private String registrationId;
    private volatile Future<?> runner;
    // One slot: a signal arriving while one is pending is dropped
    private final BlockingQueue<Object> signals = new ArrayBlockingQueue<>(1);
    private final AtomicReference<SubscriptionState> state = new AtomicReference<>(SubscriptionState.INITIALIZING);

    AbstractSubscription(
            final String name,
            final EventStore store,
            final NotifierHandle notifierHandle,
            final int pageSize,
            final Consumer<StoredEvent> eventReceived,
            final SubscriptionDropped dropped,
            final Runnable caughtUp,
            final Consumer<AbstractSubscription> onStopped) {

        this.name = name;
        this.store = store;
        this.notifierHandle = notifierHandle;
        this.pageSize = pageSize;
        this.eventReceived = eventReceived;
        this.dropped = dropped;
        this.caughtUp = caughtUp;
        this.onStopped = onStopped;
    }

    @Override
    public void close() {
        dispose(true);
    }

    @Override
    public String name() {
        return name;
    }

    /**
     * Wakes up the subscription, new events may exist.
     */
    public void signal() {
        signals.offer(SIGNAL);
    }

    @Override
    public SubscriptionState state() {
        return state.get();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[name=" + name + ", state=" + state.get() + "]";
    }

    /**
     * Resolves the starting position, invoked once before catching up.
     */
    protected abstract void initialize();

    protected boolean isDisposed() {
        return disposed.get();
    }

    /**
     * Reads and delivers the next page of events.
     *
     * @return True if the page was the last one, i.e. the head has been reached.
     */
    protected abstract boolean pullPage();

    /**
     * Hands one event to the event handler.
     *
     * @return False if the subscription was disposed and the event was not delivered.
     */
    protected boolean deliver(final StoredEvent event) {
        if (isDisposed()) {
            return false;
        }

        try {
            eventReceived.accept(event);
        } catch (final RuntimeException e) {
            throw new SubscriberFailure(e);
        }
        return true;
    }

    void start(final ExecutorService executorService) {
        runner = executorService.submit(this::run);
    }

    private void catchUp() {
        boolean isEnd;
        do {
            isEnd = pullPage();
        } while (!isEnd && !isDisposed());
    }

    private void dispose(final boolean interruptRunner) {
        if (!disposed.compareAndSet(false, true)) {
            return;
        }

        log.debug("Disposing subscription [name={}]", name);
        state.getAndUpdate(current -> current == SubscriptionState.FAULTED ? current : SubscriptionState.DISPOSED);
        if (interruptRunner && runner != null) {
            runner.cancel(true);
        }
        stopped();
        notifyDropped(SubscriptionDroppedReason.DISPOSED, null);
    }

    private void fault(final SubscriptionDroppedReason reason, final Throwable cause) {
        log.error("Subscription faulted [name={}, reason={}]", name, reason, cause);
        state.set(SubscriptionState.FAULTED);
        stopped();
        notifyDropped(reason, new SubscriptionFaultedException(name, reason, cause));
    }

    private void notifyDropped(final SubscriptionDroppedReason reason, final Throwable exception) {
        if (droppedNotified.compareAndSet(false, true)) {
            try {
                dropped.onDropped(this, reason, exception);
            } catch (final RuntimeException e) {
                log.error("Subscription dropped handler failed [name={}]", name, e);
            }
        }
    }

    private synchronized void register(final StoreNotifier notifier) {
        if (!isDisposed()) {
            this.notifier = notifier;
            this.registrationId = notifier.addListener(this::signal);
        }
    }

    private synchronized void releaseRegistration() {
        if (registrationId != null) {
            try {
                notifier.removeListener(registrationId);
            } catch (final RuntimeException e) {
                log.warn("Unable to remove notifier listener [name={}]", name, e);
            }
            registrationId = null;
        }
    }

    private void run() {
        try {
            register(notifierHandle.get());
            initialize();

            transition(SubscriptionState.CATCHING_UP);
            catchUp();

            if (transition(SubscriptionState.LIVE) && caughtUp != null) {
                caughtUp.run();
            }

            while (!isDisposed()) {
                signals.take();
                catchUp();
            }
        } catch (final InterruptedException e) {
            if (isDisposed()) {
                log.debug("Subscription stopping [name={}]", name);
            } else {
                // Interrupted by the executor, e.g. a caller supplied pool shut down with shutdownNow
                Thread.currentThread().interrupt();
                fault(SubscriptionDroppedReason.STORE_ERROR, e);
            }
        } catch (final SubscriberFailure e) {
            stopWithFailure(SubscriptionDroppedReason.SUBSCRIBER_ERROR, e.getCause());
        } catch (final EventStoreDisposedException e) {
            log.debug("Store disposed while the subscription was running [name={}]", name);
            dispose(false);
        } catch (final RuntimeException e) {
            stopWithFailure(SubscriptionDroppedReason.STORE_ERROR, e);
        } finally {
            releaseRegistration();
        }
    }

    private void stopWithFailure(final SubscriptionDroppedReason reason, final Throwable cause) {
        if (isDisposed()) {
            // Failures caused by the interrupt of a disposal are expected
            log.debug("Subscription stopped while disposing [name={}]", name, cause);
        } else {
            fault(reason, cause);
        }
    }

    private void stopped() {
        releaseRegistration();
        onStopped.accept(this);
    }

    private boolean transition(final SubscriptionState next) {
        final SubscriptionState previous = state.getAndUpdate(current -> current.isTerminal() ? current : next);
        if (previous.isTerminal()) {
            return false;
        }
        log.debug("Subscription state changed [name={}, from={}, to={}]", name, previous, next);
        return true;
    }
}
