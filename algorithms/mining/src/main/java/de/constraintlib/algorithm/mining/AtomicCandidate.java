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

import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import de.constraintlib.datastructure.constraint.AtomicConstraint;
import de.constraintlib.datastructure.constraint.ConstraintEvaluator;
import de.constraintlib.datastructure.derivation.Corpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A candidate for a single instantiated template.
 *
 * @author ConstraintLib contributors
 */
public final class AtomicCandidate extends Candidate {

    private static final Logger LOGGER = LoggerFactory.getLogger(AtomicCandidate.class);

    private final AtomicConstraint constraint;

    public AtomicCandidate(AtomicConstraint constraint, Corpus corpus) {
        super(corpus);
        this.constraint = constraint;
    }

    @Override
    protected TruthTable computeTruthTable() {
        Corpus corpus = getCorpus();
        BitSet values = new BitSet(corpus.size());
        for (int i = 0; i < corpus.size(); i++) {
            try {
                values.set(i, ConstraintEvaluator.evaluate(constraint, corpus.get(i).getTree()));
            } catch (RuntimeException e) {
                LOGGER.warn("Evaluating '{}' on '{}' failed, counting as false", constraint, corpus.get(i).getText(), e);
            }
        }
        return TruthTable.of(corpus, values);
    }

    @Override
    public AtomicConstraint getConstraint() {
        return constraint;
    }

    @Override
    public List<Candidate> getLiterals() {
        return Collections.singletonList(this);
    }

    @Override
    public AtomicCandidate reevaluate(Corpus newCorpus) {
        return new AtomicCandidate(constraint, newCorpus);
    }
}
