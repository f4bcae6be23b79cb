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
 * Conclude has been called more than once on a context, most likely because it was shared between queues.
 */
public class ConcurrentConcludeException extends KairosException
{
    private static final long serialVersionUID = 3465213154462831781L;

    /**
     * Construct the exception with a default message.
     */
    public ConcurrentConcludeException()
    {
        super("context has already been concluded, contexts must not be reused");
    }
}
