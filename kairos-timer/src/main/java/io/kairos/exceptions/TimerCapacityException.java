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
 * Indicates that a new timer could not be allocated as the configured maximum capacity has been reached.
 */
public class TimerCapacityException extends KairosException
{
    private static final long serialVersionUID = 7461330281722961958L;

    private final int maxCapacity;

    /**
     * Construct an exception for the capacity which has been exhausted.
     *
     * @param maxCapacity which has been reached.
     */
    public TimerCapacityException(final int maxCapacity)
    {
        super("max capacity reached: " + maxCapacity, Category.FATAL);
        this.maxCapacity = maxCapacity;
    }

    /**
     * The maximum capacity which was reached.
     *
     * @return the maximum capacity which was reached.
     */
    public int maxCapacity()
    {
        return maxCapacity;
    }
}
