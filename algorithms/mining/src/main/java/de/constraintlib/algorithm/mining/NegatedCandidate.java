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

import java.util.Collections;
import java.util.List;

import de.constraintlib.datastructure.constraint.Negation;
import de.constraintlib.datastructure.derivation.Corpus;

/**
 * The negation of a literal. Its truth table is the pointwise complement of the negated candidate's table.
 *
 * @author ConstraintLib contributors
 */
public final class NegatedCandidate extends Candidate {

    private final Candidate negated;
    private final Negation constraint;

    public NegatedCandidate(Candidate negated) {
        super(negated.getCorpus());
        this.negated = negated;
        this.constraint = new Negation(negated.getConstraint());
    }

    public Candidate getNegated() {
        return negated;
    }

    @Override
    protected TruthTable computeTruthTable() {
        return negated.getTruthTable().not();
    }

    @Override
    public Negation getConstraint() {
        return constraint;
    }

    @Override
    public List<Candidate> getLiterals() {
        return Collections.singletonList(this);
    }

    @Override
    public NegatedCandidate reevaluate(Corpus newCorpus) {
        return new NegatedCandidate(negated.reevaluate(newCorpus));
    }
}
