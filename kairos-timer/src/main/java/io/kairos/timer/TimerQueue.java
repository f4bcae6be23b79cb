/*
 * Copyright 2014-2025 Real Logic Limited.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * https://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.kairos.timer;

import io.kairos.exceptions.ConcurrentConcludeException;
import io.kairos.exceptions.ConfigurationException;
import io.kairos.exceptions.EmptyTimerQueueException;
import io.kairos.exceptions.TimerCapacityException;
import org.agrona.ErrorHandler;
import org.agrona.collections.ArrayUtil;

import java.io.OutputStream;
import java.io.PrintStream;
import java.util.Comparator;
import java.util.Objects;

import static io.kairos.timer.TimerArena.NULL_HANDLE;
import static org.agrona.SystemUtil.getSizeAsInt;

/**
 * Queue of timers ordered by deadline which an event loop uses to decide how long to wait and which deferred
 * operations to run once it wakes up.
 * <p>
 * Each timer is registered under an identity and all timers sharing an identity can be cancelled in one call. Every
 * timer ends with exactly one callback on its {@link TimerHandler}: {@link TimerHandler#onTimerFired()} when
 * dispatched, or {@link TimerHandler#onTimerCancelled()} when cancelled.
 * <p>
 * <b>Caveats</b>
 * <p>
 * Timers with the same deadline are not ordered with one another, and timers sharing an identity are cancelled newest
 * first.
 * <p>
 * A handler called during {@link #dispatchDue(Object)} may use the queue freely. A handler called during
 * {@link #cancel(Object)} or {@link #cancelAll()} may only {@link #enqueue(Object, TimerHandler, Object)}.
 * <p>
 * <b>Note:</b> Not thread safe.
 *
 * @param <T> type of the deadline.
 * @param <K> type of the identity timers are registered under.
 */
public final class TimerQueue<T, K>
{
    /**
     * Consumer of pending timers for {@link #forEach(TimerConsumer)}.
     *
     * @param <T> type of the deadline.
     * @param <K> type of the identity.
     */
    @FunctionalInterface
    public interface TimerConsumer<T, K>
    {
        /**
         * Accept a pending timer.
         *
         * @param deadline of the timer.
         * @param identity the timer is registered under.
         */
        void accept(T deadline, K identity);
    }

    private final Comparator<? super T> deadlineComparator;
    private final ErrorHandler errorHandler;
    private final TimerArena<T, K> arena;
    private final DeadlineHeap<T> heap;
    private final IdentityIndex<K> index;
    private boolean isCancelling;

    /**
     * Construct a queue with default configuration.
     *
     * @param deadlineComparator ordering of deadlines, a deadline is earlier if it compares less than another.
     */
    public TimerQueue(final Comparator<? super T> deadlineComparator)
    {
        this(deadlineComparator, new Context());
    }

    /**
     * Construct a queue using the supplied {@link Context}, which is concluded by this call.
     *
     * @param deadlineComparator ordering of deadlines, a deadline is earlier if it compares less than another.
     * @param ctx                configuration of the queue.
     */
    public TimerQueue(final Comparator<? super T> deadlineComparator, final Context ctx)
    {
        this.deadlineComparator = Objects.requireNonNull(deadlineComparator, "deadlineComparator");
        ctx.conclude();

        errorHandler = ctx.errorHandler();
        arena = new TimerArena<>(ctx.initialCapacity(), ctx.maxCapacity());
        heap = new DeadlineHeap<>(arena, deadlineComparator, ctx.initialCapacity(), ctx.maxCapacity());
        index = new IdentityIndex<>(arena);
    }

    /**
     * Create a queue for deadlines with a natural ordering, such as {@link Long} or {@link java.time.Instant}.
     *
     * @param <T> type of the deadline.
     * @param <K> type of the identity.
     * @return a new queue with default configuration.
     */
    public static <T extends Comparable<? super T>, K> TimerQueue<T, K> naturalOrder()
    {
        return new TimerQueue<>(Comparator.naturalOrder());
    }

    /**
     * Create a queue for deadlines with a natural ordering, such as {@link Long} or {@link java.time.Instant}.
     *
     * @param ctx configuration of the queue.
     * @param <T> type of the deadline.
     * @param <K> type of the identity.
     * @return a new queue.
     */
    public static <T extends Comparable<? super T>, K> TimerQueue<T, K> naturalOrder(final Context ctx)
    {
        return new TimerQueue<>(Comparator.naturalOrder(), ctx);
    }

    /**
     * Schedule a timer. If it becomes the earliest timer the caller should recompute how long it waits.
     * <p>
     * A timer with a deadline equal to the current earliest deadline does not become the earliest.
     *
     * @param deadline when the timer becomes due.
     * @param handler  to call back when the timer fires or is cancelled.
     * @param identity to register the timer under for cancellation.
     * @return true if the timer is now the earliest in the queue.
     * @throws TimerCapacityException if max capacity has been reached, in which case the queue is unchanged.
     */
    public boolean enqueue(final T deadline, final TimerHandler handler, final K identity)
    {
        Objects.requireNonNull(deadline, "deadline");
        Objects.requireNonNull(handler, "handler");
        Objects.requireNonNull(identity, "identity");

        heap.ensureCapacity(heap.size() + 1);
        final int handle = arena.allocate(deadline, handler, identity);

        try
        {
            index.register(handle);
        }
        catch (final Throwable ex)
        {
            arena.release(handle);
            throw ex;
        }

        return heap.insert(handle);
    }

    /**
     * Is the queue without pending timers.
     *
     * @return true if there are no pending timers.
     */
    public boolean isEmpty()
    {
        return heap.isEmpty();
    }

    /**
     * Number of pending timers.
     *
     * @return number of pending timers.
     */
    public int size()
    {
        return heap.size();
    }

    /**
     * The earliest deadline of the pending timers. Check {@link #isEmpty()} first.
     *
     * @return the earliest deadline of the pending timers.
     * @throws EmptyTimerQueueException if there are no pending timers.
     */
    public T earliestDeadline()
    {
        return arena.deadline(heap.peekMin());
    }

    /**
     * Fire all timers with a deadline strictly earlier than the cutoff. Timers due exactly at the cutoff remain
     * pending.
     *
     * @param cutoff time before which timers are due.
     * @return number of timers fired.
     */
    public int dispatchDue(final T cutoff)
    {
        return dispatchDue(cutoff, Integer.MAX_VALUE);
    }

    /**
     * Fire timers with a deadline strictly earlier than the cutoff, earliest first, up to a limit.
     *
     * @param cutoff time before which timers are due.
     * @param limit  maximum number of timers to fire.
     * @return number of timers fired.
     */
    public int dispatchDue(final T cutoff, final int limit)
    {
        Objects.requireNonNull(cutoff, "cutoff");
        ensureNotCancelling();

        int fired = 0;
        while (fired < limit && !heap.isEmpty())
        {
            final int handle = heap.handleAt(0);
            if (deadlineComparator.compare(arena.deadline(handle), cutoff) >= 0)
            {
                break;
            }

            final TimerHandler handler = remove(handle);
            fired++;

            try
            {
                handler.onTimerFired();
            }
            catch (final Exception ex)
            {
                errorHandler.onError(ex);
            }
        }

        return fired;
    }

    /**
     * Cancel all timers registered under an identity. Cancelling an unknown identity is a no-op.
     *
     * @param identity of the timers to cancel.
     * @return number of timers cancelled.
     */
    public int cancel(final K identity)
    {
        Objects.requireNonNull(identity, "identity");
        ensureNotCancelling();

        int handle = index.find(identity);
        if (NULL_HANDLE == handle)
        {
            return 0;
        }

        int cancelled = 0;
        isCancelling = true;
        try
        {
            while (NULL_HANDLE != handle)
            {
                final int next = arena.next(handle);
                onCancelled(remove(handle));
                cancelled++;
                handle = next;
            }
        }
        finally
        {
            isCancelling = false;
        }

        return cancelled;
    }

    /**
     * Cancel every pending timer.
     *
     * @return number of timers cancelled.
     */
    public int cancelAll()
    {
        ensureNotCancelling();

        int cancelled = 0;
        isCancelling = true;
        try
        {
            while (!heap.isEmpty())
            {
                onCancelled(remove(heap.handleAt(heap.size() - 1)));
                cancelled++;
            }
        }
        finally
        {
            isCancelling = false;
        }

        return cancelled;
    }

    /**
     * Does the identity have pending timers.
     *
     * @param identity to check.
     * @return true if at least one timer is pending for the identity.
     */
    public boolean isPending(final K identity)
    {
        Objects.requireNonNull(identity, "identity");

        return NULL_HANDLE != index.find(identity);
    }

    /**
     * Number of pending timers registered under an identity.
     *
     * @param identity to count timers for.
     * @return number of pending timers registered under the identity.
     */
    public int pendingCount(final K identity)
    {
        Objects.requireNonNull(identity, "identity");

        return index.chainLength(identity);
    }

    /**
     * Visit all pending timers in heap order, which is not sorted by deadline beyond the first element.
     *
     * @param consumer of the pending timers.
     */
    public void forEach(final TimerConsumer<? super T, ? super K> consumer)
    {
        for (int i = 0, size = heap.size(); i < size; i++)
        {
            final int handle = heap.handleAt(i);
            consumer.accept(arena.deadline(handle), arena.identity(handle));
        }
    }

    TimerArena<T, K> arena()
    {
        return arena;
    }

    DeadlineHeap<T> heap()
    {
        return heap;
    }

    IdentityIndex<K> index()
    {
        return index;
    }

    private TimerHandler remove(final int handle)
    {
        final TimerHandler handler = arena.handler(handle);

        heap.removeAt(arena.heapIndex(handle));
        index.unlink(handle);
        arena.release(handle);

        return handler;
    }

    private void onCancelled(final TimerHandler handler)
    {
        try
        {
            handler.onTimerCancelled();
        }
        catch (final Exception ex)
        {
            errorHandler.onError(ex);
        }
    }

    private void ensureNotCancelling()
    {
        if (isCancelling)
        {
            throw new IllegalStateException("timers are being cancelled, only enqueue is allowed from a handler");
        }
    }

    /**
     * Configuration options for the {@link TimerQueue} which can be set by system properties.
     */
    public static final class Configuration
    {
        /**
         * Initial capacity for timer records, grown on demand.
         */
        public static final String INITIAL_CAPACITY_PROP_NAME = "kairos.timer.queue.initial.capacity";

        /**
         * Default initial capacity for timer records.
         */
        public static final int INITIAL_CAPACITY_DEFAULT = 8;

        /**
         * Maximum number of pending timers, enqueue fails with {@link TimerCapacityException} beyond it.
         */
        public static final String MAX_CAPACITY_PROP_NAME = "kairos.timer.queue.max.capacity";

        /**
         * Default maximum number of pending timers.
         */
        public static final int MAX_CAPACITY_DEFAULT = ArrayUtil.MAX_CAPACITY;

        /**
         * Stream the default error handler prints to: {@code stderr}, {@code stdout} or {@code no_op}.
         */
        public static final String FALLBACK_LOGGER_PROP_NAME = "kairos.fallback.logger";

        /**
         * Default error handler which prints to the {@link #fallbackLogger()}.
         */
        public static final ErrorHandler DEFAULT_ERROR_HANDLER =
            (throwable) ->
            {
                final PrintStream out = fallbackLogger();
                synchronized (out)
                {
                    out.println(System.currentTimeMillis() + " Exception:");
                    throwable.printStackTrace(out);
                }
            };

        private static final PrintStream NO_OP_LOGGER = new PrintStream(new OutputStream()
        {
            public void write(final int b)
            {
            }
        });

        private Configuration()
        {
        }

        /**
         * Initial capacity for timer records.
         *
         * @return {@link #INITIAL_CAPACITY_DEFAULT} or system property {@link #INITIAL_CAPACITY_PROP_NAME} if set.
         */
        public static int initialCapacity()
        {
            return getSizeAsInt(INITIAL_CAPACITY_PROP_NAME, INITIAL_CAPACITY_DEFAULT);
        }

        /**
         * Maximum number of pending timers.
         *
         * @return {@link #MAX_CAPACITY_DEFAULT} or system property {@link #MAX_CAPACITY_PROP_NAME} if set.
         */
        public static int maxCapacity()
        {
            return getSizeAsInt(MAX_CAPACITY_PROP_NAME, MAX_CAPACITY_DEFAULT);
        }

        /**
         * Stream for reporting errors when no {@link ErrorHandler} has been provided.
         *
         * @return stream selected by the system property {@link #FALLBACK_LOGGER_PROP_NAME}, {@link System#err} by
         * default.
         */
        public static PrintStream fallbackLogger()
        {
            final String fallbackLoggerName = System.getProperty(FALLBACK_LOGGER_PROP_NAME, "stderr");
            switch (fallbackLoggerName)
            {
                case "stdout":
                    return System.out;

                case "no_op":
                    return NO_OP_LOGGER;

                case "stderr":
                default:
                    return System.err;
            }
        }
    }

    /**
     * Context for configuring a {@link TimerQueue}. A context is concluded by the queue it is passed to and must not
     * be reused.
     */
    public static final class Context
    {
        private boolean isConcluded;
        private int initialCapacity = Configuration.initialCapacity();
        private int maxCapacity = Configuration.maxCapacity();
        private ErrorHandler errorHandler;

        /**
         * Resolve defaults and validate the configuration.
         *
         * @throws ConcurrentConcludeException if already concluded.
         * @throws ConfigurationException      if the capacities are out of range.
         */
        public void conclude()
        {
            if (isConcluded)
            {
                throw new ConcurrentConcludeException();
            }
            isConcluded = true;

            if (maxCapacity < 1 || maxCapacity > ArrayUtil.MAX_CAPACITY)
            {
                throw new ConfigurationException(
                    "maxCapacity must be in the range 1 - " + ArrayUtil.MAX_CAPACITY + ": " + maxCapacity);
            }

            if (initialCapacity < 1 || initialCapacity > maxCapacity)
            {
                throw new ConfigurationException(
                    "initialCapacity must be in the range 1 - " + maxCapacity + ": " + initialCapacity);
            }

            if (null == errorHandler)
            {
                errorHandler = Configuration.DEFAULT_ERROR_HANDLER;
            }
        }

        /**
         * Has the context been concluded.
         *
         * @return true if {@link #conclude()} has been called.
         */
        public boolean isConcluded()
        {
            return isConcluded;
        }

        /**
         * Set the initial capacity for timer records.
         *
         * @param initialCapacity for timer records.
         * @return this for a fluent API.
         * @see Configuration#INITIAL_CAPACITY_PROP_NAME
         */
        public Context initialCapacity(final int initialCapacity)
        {
            this.initialCapacity = initialCapacity;
            return this;
        }

        /**
         * Get the initial capacity for timer records.
         *
         * @return the initial capacity for timer records.
         * @see Configuration#INITIAL_CAPACITY_PROP_NAME
         */
        public int initialCapacity()
        {
            return initialCapacity;
        }

        /**
         * Set the maximum number of pending timers.
         *
         * @param maxCapacity number of pending timers.
         * @return this for a fluent API.
         * @see Configuration#MAX_CAPACITY_PROP_NAME
         */
        public Context maxCapacity(final int maxCapacity)
        {
            this.maxCapacity = maxCapacity;
            return this;
        }

        /**
         * Get the maximum number of pending timers.
         *
         * @return the maximum number of pending timers.
         * @see Configuration#MAX_CAPACITY_PROP_NAME
         */
        public int maxCapacity()
        {
            return maxCapacity;
        }

        /**
         * Set the handler for exceptions thrown by {@link TimerHandler} callbacks.
         *
         * @param errorHandler for exceptions thrown by callbacks.
         * @return this for a fluent API.
         */
        public Context errorHandler(final ErrorHandler errorHandler)
        {
            this.errorHandler = errorHandler;
            return this;
        }

        /**
         * Get the handler for exceptions thrown by {@link TimerHandler} callbacks.
         *
         * @return the handler for exceptions thrown by callbacks.
         */
        public ErrorHandler errorHandler()
        {
            return errorHandler;
        }

        /**
         * {@inheritDoc}
         */
        public String toString()
        {
            return "TimerQueue.Context" +
                "\n{" +
                "\n    isConcluded=" + isConcluded +
                "\n    initialCapacity=" + initialCapacity +
                "\n    maxCapacity=" + maxCapacity +
                "\n    errorHandler=" + errorHandler +
                "\n}";
        }
    }
}
