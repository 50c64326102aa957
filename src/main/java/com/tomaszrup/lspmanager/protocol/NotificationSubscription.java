////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.lspmanager.protocol;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Predicate;

import com.tomaszrup.lspmanager.LanguageServerException;

/**
 * Bounded channel of server notifications for one subscriber.
 *
 * <p>When the subscriber falls behind, the oldest buffered notification is
 * dropped. The channel is closed when the subscriber calls {@link #close()}
 * or when the session ends; in the latter case {@link #getCloseCause()}
 * reports why.</p>
 */
public class NotificationSubscription implements AutoCloseable {

    private final int capacity;
    private final Consumer<NotificationSubscription> onClose;
    private final ReentrantLock lock = new ReentrantLock();
    private final Condition available = lock.newCondition();
    private final Deque<ServerNotification> buffer = new ArrayDeque<>();
    private boolean closed;
    private LanguageServerException closeCause;
    private long dropped;

    NotificationSubscription(int capacity, Consumer<NotificationSubscription> onClose) {
        this.capacity = Math.max(1, capacity);
        this.onClose = onClose;
    }

    void offer(ServerNotification notification) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            if (buffer.size() >= capacity) {
                buffer.pollFirst();
                dropped++;
            }
            buffer.addLast(notification);
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits up to {@code timeout} for the next notification.
     *
     * @return the notification, or null on timeout or once the channel is
     *         closed and drained
     */
    public ServerNotification poll(Duration timeout) throws InterruptedException {
        long remaining = timeout.toNanos();
        lock.lock();
        try {
            while (buffer.isEmpty()) {
                if (closed || remaining <= 0) {
                    return null;
                }
                remaining = available.awaitNanos(remaining);
            }
            return buffer.pollFirst();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Waits for the first notification with the given method whose params
     * satisfy {@code filter}. Non-matching notifications are discarded.
     *
     * @return the match, or null on timeout or close
     */
    public ServerNotification await(String method, Predicate<ServerNotification> filter, Duration timeout)
            throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (true) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return null;
            }
            ServerNotification next = poll(Duration.ofNanos(remaining));
            if (next == null) {
                return null;
            }
            if (next.getMethod().equals(method) && filter.test(next)) {
                return next;
            }
        }
    }

    void closeWith(LanguageServerException cause) {
        lock.lock();
        try {
            if (closed) {
                return;
            }
            closed = true;
            closeCause = cause;
            available.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        closeWith(null);
        onClose.accept(this);
    }

    public boolean isClosed() {
        lock.lock();
        try {
            return closed;
        } finally {
            lock.unlock();
        }
    }

    /** Termination cause of the session, or null if closed by the subscriber or still open. */
    public LanguageServerException getCloseCause() {
        lock.lock();
        try {
            return closeCause;
        } finally {
            lock.unlock();
        }
    }

    public long getDroppedCount() {
        lock.lock();
        try {
            return dropped;
        } finally {
            lock.unlock();
        }
    }
}
