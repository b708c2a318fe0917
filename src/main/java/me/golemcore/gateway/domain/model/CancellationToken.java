/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.gateway.domain.model;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal handed to a tool call by its caller.
 * Handlers poll {@link #isCancellationRequested()} at their wait points;
 * listeners registered with {@link #onCancel(Runnable)} run once, on the thread
 * that requests cancellation (or immediately if already cancelled).
 */
@Slf4j
public final class CancellationToken {

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * A token that is never cancelled.
     */
    public static CancellationToken none() {
        return NONE;
    }

    public void cancel() {
        if (!cancellable || !cancelled.compareAndSet(false, true)) {
            return;
        }
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                runListener(listener);
            }
        }
    }

    public boolean isCancellationRequested() {
        return cancelled.get();
    }

    /**
     * Registers a listener for cancellation.
     *
     * @return handle that removes the listener; callers whose work finished
     *         without cancellation should unregister so a long-lived token does
     *         not accumulate listeners
     */
    public Registration onCancel(Runnable listener) {
        if (!cancellable) {
            return Registration.NOOP;
        }
        Runnable entry = listener::run;
        listeners.add(entry);
        if (cancelled.get() && listeners.remove(entry)) {
            runListener(entry);
        }
        return () -> listeners.remove(entry);
    }

    int listenerCount() {
        return listeners.size();
    }

    private static void runListener(Runnable listener) {
        try {
            listener.run();
        } catch (RuntimeException e) {
            log.warn("[Cancellation] Listener failed", e);
        }
    }

    /**
     * Handle returned by {@link #onCancel(Runnable)}.
     */
    @FunctionalInterface
    public interface Registration {

        Registration NOOP = () -> {
        };

        void unregister();
    }
}
