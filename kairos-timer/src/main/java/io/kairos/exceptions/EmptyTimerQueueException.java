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
package io.kairos.exceptions;

/**
 * Raised when the earliest deadline is requested from a queue with no pending timers. Callers are expected to check
 * for emptiness first.
 */
public class EmptyTimerQueueException extends KairosException
{
    private static final long serialVersionUID = -3156305440357165482L;

    /**
     * Construct an exception with detail of the operation attempted on the empty queue.
     *
     * @param message detail for the error.
     */
    public EmptyTimerQueueException(final String message)
    {
        super(message, Category.ERROR);
    }
}
