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

import java.util.Objects;

/**
 * Callbacks for a timer scheduled on a {@link TimerQueue}. Exactly one of the two methods is invoked, exactly once,
 * over the lifetime of the timer.
 */
public interface TimerHandler
{
    /**
     * Invoked from {@link TimerQueue#dispatchDue(Object)} when the deadline of the timer has passed.
     */
    void onTimerFired();

    /**
     * Invoked from {@link TimerQueue#cancel(Object)} or {@link TimerQueue#cancelAll()} when the timer is cancelled
     * before it could fire.
     */
    void onTimerCancelled();

    /**
     * Create a handler from a pair of actions.
     *
     * @param onFired     action to run when the timer fires.
     * @param onCancelled action to run when the timer is cancelled.
     * @return a new handler delegating to the actions.
     */
    static TimerHandler of(final Runnable onFired, final Runnable onCancelled)
    {
        Objects.requireNonNull(onFired, "onFired");
        Objects.requireNonNull(onCancelled, "onCancelled");

        return new TimerHandler()
        {
            public void onTimerFired()
            {
                onFired.run();
            }

            public void onTimerCancelled()
            {
                onCancelled.run();
            }
        };
    }
}
