/* Copyright (C) 2024 ConstraintLib contributors
 * This file is part of ConstraintLib.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package de.constraintlib.algorithm.refinement;

/**
 * Why a {@link RefinementLoop} stopped.
 *
 * @author ConstraintLib contributors
 */
public enum TerminationReason {

    /** The configured number of rounds has been run. */
    MAX_ROUNDS,

    /** The best candidate is a perfect separator with no more literals than the best of the previous round. */
    CONVERGED,

    /** The generator could not produce inputs for any challenge. */
    UNSATISFIABLE,

    /** All generated inputs were already known or had to be dropped. */
    NO_NEW_INPUTS,

    /** Mining found no candidate, so there is nothing to challenge. */
    NO_CANDIDATES,

    /** The wall-clock budget has been used up. */
    TIMEOUT,

    /** The running thread has been interrupted. */
    INTERRUPTED
}
