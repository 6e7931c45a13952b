/*
 * Copyright Amazon.com, Inc. or its affiliates. All Rights Reserved.
 * SPDX-License-Identifier: Apache-2.0
 */

package software.amazon.smithy.diagram.sync;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A subscriber's interest in one document, returned by
 * {@link ChangePropagationPipeline#subscribe}.
 */
public final class SubscriptionHandle {
    private final String id;
    private final String uri;
    private final long debounceMs;
    private final AtomicBoolean active = new AtomicBoolean(true);

    SubscriptionHandle(String id, String uri, long debounceMs) {
        this.id = id;
        this.uri = uri;
        this.debounceMs = debounceMs;
    }

    public String id() {
        return id;
    }

    public String uri() {
        return uri;
    }

    /**
     * @return The debounce interval in effect, after clamping
     */
    public long debounceMs() {
        return debounceMs;
    }

    /**
     * @return Whether events are still delivered for this subscription
     */
    public boolean isActive() {
        return active.get();
    }

    boolean deactivate() {
        return active.getAndSet(false);
    }

    @Override
    public String toString() {
        return "SubscriptionHandle{id=" + id + ", uri=" + uri + ", debounceMs=" + debounceMs + "}";
    }
}
