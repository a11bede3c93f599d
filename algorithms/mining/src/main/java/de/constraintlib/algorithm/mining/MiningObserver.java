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
package de.constraintlib.algorithm.mining;

import java.util.List;

/**
 * Receives progress notifications from a {@link ConstraintMiner}. All methods default to doing nothing.
 *
 * @author ConstraintLib contributors
 */
public interface MiningObserver {

    MiningObserver NONE = new MiningObserver() {};

    default void onCandidatesInstantiated(int count) {}

    /**
     * Called after all atomic candidates have been evaluated.
     *
     * @param evaluated
     *         the number of evaluated atomic candidates
     * @param fullRecall
     *         the number of atomic candidates holding for every failing input
     * @param retained
     *         the number of atomic candidates passing the precision filter
     */
    default void onCandidatesEvaluated(int evaluated, int fullRecall, int retained) {}

    default void onConjunctionsFound(int count) {}

    default void onMiningFinished(List<Candidate> result) {}
}
