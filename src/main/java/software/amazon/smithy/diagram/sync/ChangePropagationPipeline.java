/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.sync;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;
import software.amazon.smithy.diagram.protocol.LspAdapter;

/**
 * Delivers new diagram states of documents to their subscribers.
 *
 * <p>Each subscription debounces on its own: a reparse restarts the
 * subscription's timer, and only the state current when the timer fires is
 * delivered, so a subscriber never sees intermediate states of a burst of
 * edits. A subscription with a debounce of zero is notified synchronously on
 * every reparse.
 *
 * <p>Events are computed lazily, at most once per reparse, by the first
 * subscription whose timer fires.
 */
public final class ChangePropagationPipeline implements AutoCloseable {
    public static final long DEFAULT_DEBOUNCE_MS = 100;
    public static final long MAX_DEBOUNCE_MS = 500;

    private static final Logger LOGGER = Logger.getLogger(ChangePropagationPipeline.class.getName());

    private final CoalescingScheduler scheduler;
    private final long defaultDebounceMs;
    private final long maxDebounceMs;
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong nextId = new AtomicLong();

    public ChangePropagationPipeline() {
        this(DEFAULT_DEBOUNCE_MS, MAX_DEBOUNCE_MS);
    }

    /**
     * @param defaultDebounceMs Debounce of subscriptions that don't choose
     *                          their own
     * @param maxDebounceMs Upper bound of any subscription's debounce
     */
    public ChangePropagationPipeline(long defaultDebounceMs, long maxDebounceMs) {
        this.scheduler = new CoalescingScheduler();
        this.maxDebounceMs = Math.max(0, maxDebounceMs);
        this.defaultDebounceMs = clamp(defaultDebounceMs);
    }

    private static final class Subscription {
        final SubscriptionHandle handle;
        final ModelChangeListener listener;
        final AtomicReference<Supplier<ModelChangeEvent>> pending = new AtomicReference<>();

        Subscription(SubscriptionHandle handle, ModelChangeListener listener) {
            this.handle = handle;
            this.listener = listener;
        }

        String timerKey() {
            return handle.uri() + "#" + handle.id();
        }
    }

    /**
     * @param uri The document to watch
     * @param debounceMs Quiet period before delivering, or {@code null} for
     *                   the default. Clamped to {@code [0, maxDebounceMs]}.
     * @param listener Receives the events
     * @return A handle to unsubscribe with
     * @throws IllegalArgumentException If {@code uri} isn't a document URI
     */
    public SubscriptionHandle subscribe(String uri, Long debounceMs, ModelChangeListener listener) {
        if (!LspAdapter.isDocumentUri(uri)) {
            throw new IllegalArgumentException("Invalid URI format: " + uri);
        }

        long effective = debounceMs == null ? defaultDebounceMs : clamp(debounceMs);
        SubscriptionHandle handle = new SubscriptionHandle("sub-" + nextId.incrementAndGet(), uri, effective);
        subscriptions.put(handle.id(), new Subscription(handle, listener));
        LOGGER.fine(() -> "Subscribed " + handle);
        return handle;
    }

    /**
     * Stops delivery to a subscription, dropping any event it has pending.
     * Unsubscribing twice does nothing.
     *
     * @param handle The subscription
     */
    public void unsubscribe(SubscriptionHandle handle) {
        Subscription subscription = subscriptions.remove(handle.id());
        handle.deactivate();
        if (subscription != null) {
            scheduler.cancel(subscription.timerKey());
            subscription.pending.set(null);
            LOGGER.fine(() -> "Unsubscribed " + handle);
        }
    }

    /**
     * @param uri A document
     * @return The active subscriptions to the document
     */
    public List<SubscriptionHandle> subscriptionsOf(String uri) {
        List<SubscriptionHandle> handles = new ArrayList<>();
        for (Subscription subscription : subscriptions.values()) {
            if (subscription.handle.uri().equals(uri)) {
                handles.add(subscription.handle);
            }
        }
        return handles;
    }

    /**
     * Notifies subscribers of a document that it was reparsed.
     *
     * @param uri The document
     * @param event Computes the new state, called when the first subscriber
     *              is due
     */
    public void onParsed(String uri, Supplier<ModelChangeEvent> event) {
        Supplier<ModelChangeEvent> once = memoize(event);
        for (Subscription subscription : subscriptions.values()) {
            if (!subscription.handle.uri().equals(uri)) {
                continue;
            }

            if (subscription.handle.debounceMs() == 0) {
                deliver(subscription, once);
            } else {
                subscription.pending.set(once);
                scheduler.schedule(subscription.timerKey(), subscription.handle.debounceMs(),
                        () -> firePending(subscription));
            }
        }
    }

    /**
     * Delivers every pending event of a document's subscriptions now.
     *
     * @param uri The document
     */
    public void flush(String uri) {
        for (Subscription subscription : subscriptions.values()) {
            if (subscription.handle.uri().equals(uri)) {
                scheduler.cancel(subscription.timerKey());
                firePending(subscription);
            }
        }
    }

    /**
     * Sends a final event to the subscribers of a closed document, then ends
     * their subscriptions. Pending updates are dropped.
     *
     * @param uri The document
     * @param version The last version of the document
     */
    public void onClosed(String uri, int version) {
        ModelChangeEvent closed = ModelChangeEvent.closed(uri, version);
        for (SubscriptionHandle handle : subscriptionsOf(uri)) {
            Subscription subscription = subscriptions.get(handle.id());
            unsubscribe(handle);
            if (subscription != null) {
                notifyListener(subscription, closed);
            }
        }
    }

    @Override
    public void close() {
        for (Subscription subscription : subscriptions.values()) {
            subscription.handle.deactivate();
        }
        subscriptions.clear();
        scheduler.close();
    }

    private void firePending(Subscription subscription) {
        Supplier<ModelChangeEvent> event = subscription.pending.getAndSet(null);
        if (event != null) {
            deliver(subscription, event);
        }
    }

    private void deliver(Subscription subscription, Supplier<ModelChangeEvent> event) {
        if (!subscription.handle.isActive()) {
            return;
        }

        ModelChangeEvent computed;
        try {
            computed = event.get();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, e, () -> "Failed to compute the model of " + subscription.handle.uri());
            return;
        }
        notifyListener(subscription, computed);
    }

    private static void notifyListener(Subscription subscription, ModelChangeEvent event) {
        try {
            subscription.listener.onModelChanged(event);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, e, () -> "Subscriber " + subscription.handle.id() + " failed");
        }
    }

    private long clamp(long debounceMs) {
        return Math.max(0, Math.min(maxDebounceMs, debounceMs));
    }

    private static <T> Supplier<T> memoize(Supplier<T> supplier) {
        return new Supplier<>() {
            private T value;

            @Override
            public synchronized T get() {
                if (value == null) {
                    value = supplier.get();
                }
                return value;
            }
        };
    }
}
