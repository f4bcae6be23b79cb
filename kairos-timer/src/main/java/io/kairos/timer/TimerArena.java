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

import io.kairos.exceptions.TimerCapacityException;

import java.util.Arrays;

/**
 * Storage for timer records addressed by {@code int} handles. Fields are kept in parallel arrays and released
 * handles are kept on a free list to be reused by later allocations.
 * <p>
 * <b>Note:</b> Not thread safe.
 *
 * @param <T> type of the deadline.
 * @param <K> type of the identity.
 */
final class TimerArena<T, K>
{
    /**
     * Handle value used for an absent record, e.g. the end of a chain.
     */
    static final int NULL_HANDLE = -1;

    private final int maxCapacity;
    private Object[] deadlines;
    private Object[] identities;
    private TimerHandler[] handlers;
    private int[] heapIndices;
    private int[] nextHandles;
    private int[] prevHandles;
    private int[] freeHandles;
    private int freeHandleCount;
    private int highWaterMark;

    TimerArena(final int initialCapacity, final int maxCapacity)
    {
        this.maxCapacity = maxCapacity;
        deadlines = new Object[initialCapacity];
        identities = new Object[initialCapacity];
        handlers = new TimerHandler[initialCapacity];
        heapIndices = new int[initialCapacity];
        nextHandles = new int[initialCapacity];
        prevHandles = new int[initialCapacity];
        freeHandles = new int[initialCapacity];
    }

    /**
     * Allocate a record which is not yet in the heap nor in any chain.
     *
     * @param deadline of the timer.
     * @param handler  of the timer.
     * @param identity of the timer.
     * @return handle of the allocated record.
     * @throws TimerCapacityException if the arena is full and at its max capacity.
     */
    int allocate(final T deadline, final TimerHandler handler, final K identity)
    {
        final int handle;
        if (freeHandleCount > 0)
        {
            handle = freeHandles[--freeHandleCount];
        }
        else
        {
            if (highWaterMark == deadlines.length)
            {
                grow(highWaterMark + 1);
            }
            handle = highWaterMark++;
        }

        deadlines[handle] = deadline;
        identities[handle] = identity;
        handlers[handle] = handler;
        heapIndices[handle] = NULL_HANDLE;
        nextHandles[handle] = NULL_HANDLE;
        prevHandles[handle] = NULL_HANDLE;

        return handle;
    }

    /**
     * Release a record so its slot can be reused. References held by the record are dropped.
     *
     * @param handle of the record to release.
     */
    void release(final int handle)
    {
        deadlines[handle] = null;
        identities[handle] = null;
        handlers[handle] = null;
        heapIndices[handle] = NULL_HANDLE;
        nextHandles[handle] = NULL_HANDLE;
        prevHandles[handle] = NULL_HANDLE;
        freeHandles[freeHandleCount++] = handle;
    }

    int liveCount()
    {
        return highWaterMark - freeHandleCount;
    }

    int capacity()
    {
        return deadlines.length;
    }

    boolean isLive(final int handle)
    {
        return handle >= 0 && handle < highWaterMark && null != handlers[handle];
    }

    @SuppressWarnings("unchecked")
    T deadline(final int handle)
    {
        return (T)deadlines[handle];
    }

    @SuppressWarnings("unchecked")
    K identity(final int handle)
    {
        return (K)identities[handle];
    }

    TimerHandler handler(final int handle)
    {
        return handlers[handle];
    }

    int heapIndex(final int handle)
    {
        return heapIndices[handle];
    }

    void heapIndex(final int handle, final int heapIndex)
    {
        heapIndices[handle] = heapIndex;
    }

    int next(final int handle)
    {
        return nextHandles[handle];
    }

    void next(final int handle, final int next)
    {
        nextHandles[handle] = next;
    }

    int prev(final int handle)
    {
        return prevHandles[handle];
    }

    void prev(final int handle, final int prev)
    {
        prevHandles[handle] = prev;
    }

    private void grow(final int requiredCapacity)
    {
        final int newCapacity = newCapacity(deadlines.length, requiredCapacity, maxCapacity);

        deadlines = Arrays.copyOf(deadlines, newCapacity);
        identities = Arrays.copyOf(identities, newCapacity);
        handlers = Arrays.copyOf(handlers, newCapacity);
        heapIndices = Arrays.copyOf(heapIndices, newCapacity);
        nextHandles = Arrays.copyOf(nextHandles, newCapacity);
        prevHandles = Arrays.copyOf(prevHandles, newCapacity);
        freeHandles = Arrays.copyOf(freeHandles, newCapacity);
    }

    /**
     * Capacity to grow to for holding at least {@code requiredCapacity} elements. Grows by half of the current
     * capacity, limited by the {@code maxCapacity}.
     *
     * @param currentCapacity  of the array.
     * @param requiredCapacity to be held.
     * @param maxCapacity      which cannot be exceeded.
     * @return the new capacity.
     * @throws TimerCapacityException if {@code requiredCapacity} exceeds {@code maxCapacity}.
     */
    static int newCapacity(final int currentCapacity, final int requiredCapacity, final int maxCapacity)
    {
        if (requiredCapacity > maxCapacity)
        {
            throw new TimerCapacityException(maxCapacity);
        }

        int newCapacity = Math.max(currentCapacity + (currentCapacity >> 1), requiredCapacity);
        if (newCapacity < 0 || newCapacity > maxCapacity)
        {
            newCapacity = maxCapacity;
        }

        return newCapacity;
    }
}
