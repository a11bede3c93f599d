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
import java.util.stream.Collectors;

import de.constraintlib.datastructure.constraint.AtomicConstraint;
import de.constraintlib.datastructure.derivation.Corpus;

/**
 * Computes the truth tables of atomic constraints on a corpus and filters the resulting candidates.
 * <p>
 * Constraints are evaluated independently of each other on parallel workers. The corpus is immutable, so no
 * synchronization is needed.
 *
 * @author ConstraintLib contributors
 */
public final class CandidateEvaluator {

    private CandidateEvaluator() {
        // prevent instantiation
    }

    /**
     * Evaluates constraints on a corpus.
     *
     * @param constraints
     *         the constraints to evaluate
     * @param corpus
     *         the corpus
     *
     * @return one evaluated candidate per constraint, in the order of {@code constraints}
     */
    public static List<AtomicCandidate> evaluate(List<? extends AtomicConstraint> constraints, Corpus corpus) {
        return constraints.parallelStream().map(c -> {
            AtomicCandidate candidate = new AtomicCandidate(c, corpus);
            candidate.getTruthTable();
            return candidate;
        }).collect(Collectors.toList());
    }

    /**
     * Keeps the candidates that hold for every failing input.
     *
     * @param candidates
     *         the evaluated candidates
     * @param <C>
     *         candidate type
     *
     * @return the candidates with recall 1
     */
    public static <C extends Candidate> List<C> withFullRecall(List<C> candidates) {
        return candidates.stream().filter(c -> c.getTruthTable().hasFullRecall()).collect(Collectors.toList());
    }

    /**
     * Keeps the candidates that hold for every failing input and are more precise than a threshold.
     *
     * @param candidates
     *         the evaluated candidates
     * @param minPrecision
     *         the exclusive lower precision bound
     * @param <C>
     *         candidate type
     *
     * @return the retained candidates
     */
    public static <C extends Candidate> List<C> filter(List<C> candidates, double minPrecision) {
        return candidates.stream()
                         .filter(c -> c.getTruthTable().hasFullRecall() && c.precision() > minPrecision)
                         .collect(Collectors.toList());
    }
}
