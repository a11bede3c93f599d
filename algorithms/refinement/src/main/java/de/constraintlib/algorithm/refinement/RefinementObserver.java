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

import de.constraintlib.algorithm.mining.MiningObserver;
import de.constraintlib.datastructure.constraint.Constraint;
import de.constraintlib.datastructure.derivation.Corpus;

/**
 * Receives progress notifications from a {@link RefinementLoop}. All methods default to doing nothing.
 *
 * @author ConstraintLib contributors
 */
public interface RefinementObserver extends MiningObserver {

    RefinementObserver NONE = new RefinementObserver() {};

    default void onStateChanged(int round, RefinementState state) {}

    default void onRoundStarted(int round, Corpus corpus) {}

    default void onChallengeUnsatisfiable(Constraint challenge, Exception cause) {}

    /**
     * Called for every generated input that is discarded, because it cannot be parsed or classified.
     *
     * @param text
     *         the discarded input
     * @param cause
     *         the parser or oracle failure
     */
    default void onInputDropped(String text, Exception cause) {}

    default void onRoundFinished(RoundReport report) {}

    default void onTerminated(RefinementResult result) {}
}
