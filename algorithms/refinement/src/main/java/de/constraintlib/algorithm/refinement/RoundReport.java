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

import java.util.List;

import com.google.common.collect.ImmutableList;
import de.constraintlib.algorithm.mining.Candidate;
import de.constraintlib.datastructure.constraint.Constraint;

/**
 * Statistics of one refinement round.
 *
 * @author ConstraintLib contributors
 */
public final class RoundReport {

    private final int round;
    private final int corpusSize;
    private final int failingCount;
    private final ImmutableList<Candidate> candidates;
    private final ImmutableList<Constraint> challenges;
    private final int unsatisfiableChallenges;
    private final int generatedInputs;
    private final int droppedInputs;
    private final int mergedInputs;

    RoundReport(int round,
                int corpusSize,
                int failingCount,
                List<Candidate> candidates,
                List<Constraint> challenges,
                int unsatisfiableChallenges,
                int generatedInputs,
                int droppedInputs,
                int mergedInputs) {
        this.round = round;
        this.corpusSize = corpusSize;
        this.failingCount = failingCount;
        this.candidates = ImmutableList.copyOf(candidates);
        this.challenges = ImmutableList.copyOf(challenges);
        this.unsatisfiableChallenges = unsatisfiableChallenges;
        this.generatedInputs = generatedInputs;
        this.droppedInputs = droppedInputs;
        this.mergedInputs = mergedInputs;
    }

    /**
     * Returns the one-based number of this round.
     *
     * @return the round number
     */
    public int getRound() {
        return round;
    }

    /**
     * Returns the size of the corpus mined in this round.
     *
     * @return the corpus size
     */
    public int getCorpusSize() {
        return corpusSize;
    }

    public int getFailingCount() {
        return failingCount;
    }

    /**
     * Returns the candidates mined in this round, best first.
     *
     * @return the mined candidates
     */
    public List<Candidate> getCandidates() {
        return candidates;
    }

    public List<Constraint> getChallenges() {
        return challenges;
    }

    public int getUnsatisfiableChallenges() {
        return unsatisfiableChallenges;
    }

    public int getGeneratedInputs() {
        return generatedInputs;
    }

    public int getDroppedInputs() {
        return droppedInputs;
    }

    public int getMergedInputs() {
        return mergedInputs;
    }

    @Override
    public String toString() {
        return "Round " + round + ": corpus=" + corpusSize + " (" + failingCount + " failing), candidates=" +
               candidates.size() + ", challenges=" + challenges.size() + " (" + unsatisfiableChallenges +
               " unsatisfiable), generated=" + generatedInputs + ", dropped=" + droppedInputs + ", merged=" +
               mergedInputs;
    }
}
