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

import org.agrona.concurrent.Agent;
import org.agrona.concurrent.NanoClock;

import java.util.Objects;

/**
 * {@link Agent} which fires due timers from a {@link TimerQueue} with deadlines in {@link NanoClock} nanoseconds on
 * each duty cycle. The host decides how long to idle between cycles using {@link #timeUntilNextDeadlineNs(long)}.
 * <p>
 * Pending timers are cancelled when the agent is closed.
 *
 * @param <K> type of the identity timers are registered under.
 */
public class TimerQueueAgent<K> implements Agent
{
    /**
     * Default max number of timers to fire per duty cycle.
     */
    public static final int DISPATCH_LIMIT_DEFAULT = 20;

    private final String roleName;
    private final TimerQueue<Long, K> timerQueue;
    private final NanoClock nanoClock;
    private final int dispatchLimit;
    private boolean isClosed = false;

    /**
     * Construct an agent with the {@link #DISPATCH_LIMIT_DEFAULT}.
     *
     * @param roleName   of the agent.
     * @param timerQueue to dispatch.
     * @param nanoClock  source of the current time in the units of the deadlines.
     */
    public TimerQueueAgent(final String roleName, final TimerQueue<Long, K> timerQueue, final NanoClock nanoClock)
    {
        this(roleName, timerQueue, nanoClock, DISPATCH_LIMIT_DEFAULT);
    }

    /**
     * Construct an agent.
     *
     * @param roleName      of the agent.
     * @param timerQueue    to dispatch.
     * @param nanoClock     source of the current time in the units of the deadlines.
     * @param dispatchLimit max number of timers to fire per duty cycle.
     */
    public TimerQueueAgent(
        final String roleName,
        final TimerQueue<Long, K> timerQueue,
        final NanoClock nanoClock,
        final int dispatchLimit)
    {
        if (dispatchLimit < 1)
        {
            throw new IllegalArgumentException("dispatchLimit must be positive: " + dispatchLimit);
        }

        this.roleName = Objects.requireNonNull(roleName, "roleName");
        this.timerQueue = Objects.requireNonNull(timerQueue, "timerQueue");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock");
        this.dispatchLimit = dispatchLimit;
    }

    /**
     * {@inheritDoc}
     */
    public String roleName()
    {
        return roleName;
    }

    /**
     * {@inheritDoc}
     */
    public int doWork()
    {
        if (timerQueue.isEmpty())
        {
            return 0;
        }

        return timerQueue.dispatchDue(nanoClock.nanoTime(), dispatchLimit);
    }

    /**
     * {@inheritDoc}
     */
    public void onClose()
    {
        if (isClosed)
        {
            return;
        }

        isClosed = true;
        timerQueue.cancelAll();
    }

    /**
     * How long the host can wait before the next timer becomes due.
     *
     * @param maxWaitNs upper bound to return, also returned when there are no pending timers.
     * @return nanoseconds until the earliest deadline, clamped to the range 0 to {@code maxWaitNs}.
     */
    public long timeUntilNextDeadlineNs(final long maxWaitNs)
    {
        if (timerQueue.isEmpty())
        {
            return maxWaitNs;
        }

        final long deadlineNs = timerQueue.earliestDeadline();
        final long nowNs = nanoClock.nanoTime();
        if (deadlineNs <= nowNs)
        {
            return 0;
        }

        final long waitNs = deadlineNs - nowNs;

        return waitNs < 0 || waitNs > maxWaitNs ? maxWaitNs : waitNs;
    }

    /**
     * The queue dispatched by this agent.
     *
     * @return the queue dispatched by this agent.
     */
    public TimerQueue<Long, K> timerQueue()
    {
        return timerQueue;
    }
}
