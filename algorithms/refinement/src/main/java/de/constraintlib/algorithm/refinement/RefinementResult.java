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
import de.constraintlib.datastructure.derivation.Corpus;

/**
 * The outcome of a {@link RefinementLoop}: the best candidates known when the loop stopped, the final corpus and the
 * history of all rounds.
 *
 * @author ConstraintLib contributors
 */
public final class RefinementResult {

    private final ImmutableList<Candidate> candidates;
    private final Corpus corpus;
    private final TerminationReason terminationReason;
    private final ImmutableList<RoundReport> rounds;

    RefinementResult(List<Candidate> candidates,
                     Corpus corpus,
                     TerminationReason terminationReason,
                     List<RoundReport> rounds) {
        this.candidates = ImmutableList.copyOf(candidates);
        this.corpus = corpus;
        this.terminationReason = terminationReason;
        this.rounds = ImmutableList.copyOf(rounds);
    }

    /**
     * Returns the best candidates of the last completed mining step, best first. Each candidate is evaluated on the
     * corpus it was mined from, which may be smaller than {@link #getCorpus()}.
     *
     * @return the ranked candidates
     */
    public List<Candidate> getCandidates() {
        return candidates;
    }

    public Corpus getCorpus() {
        return corpus;
    }

    public TerminationReason getTerminationReason() {
        return terminationReason;
    }

    public int getRoundCount() {
        return rounds.size();
    }

    public List<RoundReport> getRounds() {
        return rounds;
    }

    @Override
    public String toString() {
        return "RefinementResult[" + terminationReason + " after " + rounds.size() + " rounds, " + corpus + ", best=" +
               (candidates.isEmpty() ? "none" : candidates.get(0).render()) + ']';
    }
}
