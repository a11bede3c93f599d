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
import java.util.List;

import com.google.common.base.Preconditions;
import de.constraintlib.datastructure.derivation.Corpus;
import de.constraintlib.datastructure.derivation.LabeledInput;

/**
 * The outcome of a predicate on every input of a corpus, together with the labels of these inputs. Bit {@code i}
 * refers to {@code corpus.get(i)}.
 * <p>
 * Instances are immutable.
 *
 * @author ConstraintLib contributors
 */
public final class TruthTable {

    private final int size;
    private final BitSet values;
    private final BitSet failing;

    private final int support;
    private final int truePositives;
    private final int failingCount;

    private TruthTable(int size, BitSet values, BitSet failing) {
        this.size = size;
        this.values = values;
        this.failing = failing;

        BitSet tp = (BitSet) values.clone();
        tp.and(failing);
        this.support = values.cardinality();
        this.truePositives = tp.cardinality();
        this.failingCount = failing.cardinality();
    }

    /**
     * Creates a truth table for a corpus.
     *
     * @param corpus
     *         the corpus the values refer to
     * @param values
     *         the outcome per input, in corpus order; bits beyond the corpus size are ignored
     *
     * @return the truth table
     */
    public static TruthTable of(Corpus corpus, BitSet values) {
        int n = corpus.size();
        BitSet failing = new BitSet(n);
        List<LabeledInput> inputs = corpus.getInputs();
        for (int i = 0; i < n; i++) {
            if (inputs.get(i).isFailing()) {
                failing.set(i);
            }
        }
        BitSet copy = values.get(0, n);
        return new TruthTable(n, copy, failing);
    }

    public int size() {
        return size;
    }

    public boolean get(int index) {
        Preconditions.checkElementIndex(index, size);
        return values.get(index);
    }

    public TruthTable and(TruthTable other) {
        Preconditions.checkArgument(size == other.size && failing.equals(other.failing),
                                    "truth tables refer to different corpora");
        BitSet result = (BitSet) values.clone();
        result.and(other.values);
        return new TruthTable(size, result, failing);
    }

    public TruthTable not() {
        BitSet result = (BitSet) values.clone();
        result.flip(0, size);
        return new TruthTable(size, result, failing);
    }

    /**
     * Returns the number of inputs the predicate holds for.
     *
     * @return the support
     */
    public int support() {
        return support;
    }

    public int truePositives() {
        return truePositives;
    }

    public double precision() {
        return support == 0 ? 0.0 : (double) truePositives / support;
    }

    public double recall() {
        return failingCount == 0 ? 0.0 : (double) truePositives / failingCount;
    }

    public boolean hasFullRecall() {
        return failingCount > 0 && truePositives == failingCount;
    }

    public boolean isPerfect() {
        return hasFullRecall() && truePositives == support;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(size);
        for (int i = 0; i < size; i++) {
            sb.append(values.get(i) ? '1' : '0');
        }
        return sb.toString();
    }
}
