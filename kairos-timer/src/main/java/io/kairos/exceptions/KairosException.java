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
 * Base exception for all errors raised by the timer queue and its collaborators.
 */
public class KairosException extends RuntimeException
{
    private static final long serialVersionUID = 4012585617470386317L;

    /**
     * Category of {@link Exception}.
     */
    public enum Category
    {
        /**
         * The queue cannot continue with the requested operation, e.g. no more records can be allocated.
         */
        FATAL,

        /**
         * A contract of the API was broken by the caller.
         */
        ERROR
    }

    private final Category category;

    /**
     * Exception with provided message and {@link Category#ERROR}.
     *
     * @param message to detail the exception.
     */
    public KairosException(final String message)
    {
        this(message, Category.ERROR);
    }

    /**
     * Exception with a detailed message and provided {@link Category}.
     *
     * @param message  providing detail on the error.
     * @param category of the exception.
     */
    public KairosException(final String message, final Category category)
    {
        super(category.name() + " - " + message);
        this.category = category;
    }

    /**
     * {@link Category} of exception for determining what follow-up action can be taken.
     *
     * @return {@link Category} of exception for determining what follow-up action can be taken.
     */
    public Category category()
    {
        return category;
    }

    /**
     * Determines if a {@link Throwable} is a {@link Category#FATAL} {@link KairosException}.
     *
     * @param t throwable to check if fatal.
     * @return true if this is a KairosException with a category set to {@link Category#FATAL}, false otherwise.
     */
    public static boolean isFatal(final Throwable t)
    {
        return t instanceof KairosException && Category.FATAL == ((KairosException)t).category;
    }
}
