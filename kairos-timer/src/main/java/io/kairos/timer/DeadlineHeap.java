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

import io.kairos.exceptions.EmptyTimerQueueException;

import java.util.Arrays;
import java.util.Comparator;

import static io.kairos.timer.TimerArena.NULL_HANDLE;

/**
 * Binary min-heap of record handles ordered by deadline. Each record tracks its own index in the heap so an arbitrary
 * record can be removed in O(log n).
 * <p>
 * Records with equal deadlines are not ordered with one another.
 * <p>
 * <b>Note:</b> Not thread safe.
 *
 * @param <T> type of the deadline.
 */
final class DeadlineHeap<T>
{
    private final TimerArena<T, ?> arena;
    private final Comparator<? super T> comparator;
    private final int maxCapacity;
    private int[] handles;
    private int size;

    DeadlineHeap(
        final TimerArena<T, ?> arena,
        final Comparator<? super T> comparator,
        final int initialCapacity,
        final int maxCapacity)
    {
        this.arena = arena;
        this.comparator = comparator;
        this.maxCapacity = maxCapacity;
        this.handles = new int[initialCapacity];
    }

    int size()
    {
        return size;
    }

    boolean isEmpty()
    {
        return 0 == size;
    }

    int handleAt(final int index)
    {
        return handles[index];
    }

    /**
     * Make sure the backing array can hold {@code requiredCapacity} handles without allocating on insert.
     *
     * @param requiredCapacity number of handles to be held.
     */
    void ensureCapacity(final int requiredCapacity)
    {
        final int currentCapacity = handles.length;
        if (requiredCapacity > currentCapacity)
        {
            handles = Arrays.copyOf(handles, TimerArena.newCapacity(currentCapacity, requiredCapacity, maxCapacity));
        }
    }

    /**
     * Insert a record and move it up to its position.
     *
     * @param handle of the record to insert.
     * @return true if the record is now at the top of the heap.
     */
    boolean insert(final int handle)
    {
        ensureCapacity(size + 1);

        final int index = size++;
        handles[index] = handle;
        arena.heapIndex(handle, index);
        upHeap(index);

        return handles[0] == handle;
    }

    /**
     * Handle of the record with the earliest deadline.
     *
     * @return handle of the record with the earliest deadline.
     * @throws EmptyTimerQueueException if the heap is empty.
     */
    int peekMin()
    {
        if (0 == size)
        {
            throw new EmptyTimerQueueException("no pending timers");
        }

        return handles[0];
    }

    /**
     * Remove the record at the given index, restoring heap order for the record moved into its place.
     *
     * @param index in the heap of the record to remove.
     * @return handle of the removed record.
     */
    int removeAt(final int index)
    {
        final int removedHandle = handles[index];
        final int lastIndex = size - 1;

        if (0 == lastIndex)
        {
            size = 0;
        }
        else
        {
            swap(index, lastIndex);
            size = lastIndex;

            if (index < lastIndex)
            {
                if (index > 0 && isEarlier(index, parent(index)))
                {
                    upHeap(index);
                }
                else
                {
                    downHeap(index);
                }
            }
        }

        handles[lastIndex] = NULL_HANDLE;
        arena.heapIndex(removedHandle, NULL_HANDLE);

        return removedHandle;
    }

    private void upHeap(final int startIndex)
    {
        int index = startIndex;
        while (index > 0)
        {
            final int parentIndex = parent(index);
            if (!isEarlier(index, parentIndex))
            {
                break;
            }

            swap(index, parentIndex);
            index = parentIndex;
        }
    }

    private void downHeap(final int startIndex)
    {
        int index = startIndex;
        int child = (index << 1) + 1;
        while (child < size)
        {
            final int right = child + 1;
            final int minChild = right < size && isEarlier(right, child) ? right : child;
            if (!isEarlier(minChild, index))
            {
                break;
            }

            swap(index, minChild);
            index = minChild;
            child = (index << 1) + 1;
        }
    }

    private boolean isEarlier(final int index, final int otherIndex)
    {
        return comparator.compare(arena.deadline(handles[index]), arena.deadline(handles[otherIndex])) < 0;
    }

    private void swap(final int index, final int otherIndex)
    {
        final int handle = handles[index];
        final int otherHandle = handles[otherIndex];

        handles[index] = otherHandle;
        handles[otherIndex] = handle;
        arena.heapIndex(otherHandle, index);
        arena.heapIndex(handle, otherIndex);
    }

    private static int parent(final int index)
    {
        return (index - 1) >>> 1;
    }
}
