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

/**
 * Timer scheduling for single threaded event loops.
 * <p>
 * A {@link io.kairos.timer.TimerQueue} keeps pending timers in a binary heap ordered by deadline together with an
 * index from identity to every timer registered under it. The event loop:
 * <ul>
 *     <li>enqueues timers and learns when a new timer has become the earliest,</li>
 *     <li>sizes its wait on the earliest deadline,</li>
 *     <li>dispatches every timer due strictly before the current time after waking up,</li>
 *     <li>cancels all timers for an identity at once.</li>
 * </ul>
 * {@link io.kairos.timer.TimerQueueAgent} runs this as an agrona {@link org.agrona.concurrent.Agent} duty cycle.
 */
package io.kairos.timer;
