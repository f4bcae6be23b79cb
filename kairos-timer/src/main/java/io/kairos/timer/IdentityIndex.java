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

import org.agrona.collections.Object2IntHashMap;

import static io.kairos.timer.TimerArena.NULL_HANDLE;

/**
 * Index from identity to the head of a chain of records sharing that identity. Chains are doubly linked through the
 * arena, newest record first. An identity with no pending records has no entry.
 * <p>
 * <b>Note:</b> Not thread safe.
 *
 * @param <K> type of the identity.
 */
final class IdentityIndex<K>
{
    private final TimerArena<?, K> arena;
    private final Object2IntHashMap<K> headByIdentity = new Object2IntHashMap<>(NULL_HANDLE);

    IdentityIndex(final TimerArena<?, K> arena)
    {
        this.arena = arena;
    }

    /**
     * Add a record to the front of the chain for its identity, creating the chain if needed.
     *
     * @param handle of the record to register.
     */
    void register(final int handle)
    {
        final K identity = arena.identity(handle);
        final int head = headByIdentity.getValue(identity);

        // replacing the value of an existing key does not allocate, so links are only patched after a put succeeds
        headByIdentity.put(identity, handle);

        if (NULL_HANDLE != head)
        {
            arena.next(handle, head);
            arena.prev(head, handle);
        }
    }

    /**
     * Detach a record from its chain, removing the identity entry when the chain becomes empty.
     *
     * @param handle of the record to unlink.
     */
    void unlink(final int handle)
    {
        final int prev = arena.prev(handle);
        final int next = arena.next(handle);

        if (NULL_HANDLE == prev)
        {
            final K identity = arena.identity(handle);
            if (NULL_HANDLE == next)
            {
                headByIdentity.removeKey(identity);
            }
            else
            {
                headByIdentity.put(identity, next);
            }
        }
        else
        {
            arena.next(prev, next);
        }

        if (NULL_HANDLE != next)
        {
            arena.prev(next, prev);
        }

        arena.next(handle, NULL_HANDLE);
        arena.prev(handle, NULL_HANDLE);
    }

    /**
     * Find the head of the chain for an identity.
     *
     * @param identity to look up.
     * @return handle of the most recently registered record or {@link TimerArena#NULL_HANDLE} if none.
     */
    int find(final K identity)
    {
        return headByIdentity.getValue(identity);
    }

    int chainLength(final K identity)
    {
        int length = 0;
        for (int handle = find(identity); NULL_HANDLE != handle; handle = arena.next(handle))
        {
            length++;
        }

        return length;
    }

    int size()
    {
        return headByIdentity.size();
    }

    boolean isEmpty()
    {
        return headByIdentity.isEmpty();
    }
}
