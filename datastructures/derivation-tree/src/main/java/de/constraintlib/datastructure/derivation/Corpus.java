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
package de.constraintlib.datastructure.derivation;

import java.util.Collection;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.constraintlib.api.InputParser;
import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.ParseException;
import net.automatalib.commons.util.Pair;

/**
 * An immutable, insertion-ordered snapshot of labeled inputs. Texts are unique within a corpus: merging never replaces
 * the label of a text that is already present.
 * <p>
 * The failing and passing inputs are views computed on construction, not separately maintained collections.
 *
 * @author ConstraintLib contributors
 */
public final class Corpus implements Iterable<LabeledInput> {

    private static final Corpus EMPTY = new Corpus(ImmutableMap.of());

    private final ImmutableList<LabeledInput> inputs;
    private final ImmutableMap<String, Integer> indexByText;
    private final ImmutableList<LabeledInput> failing;
    private final ImmutableList<LabeledInput> passing;

    private Corpus(ImmutableMap<String, LabeledInput> byText) {
        this.inputs = byText.values().asList();
        ImmutableMap.Builder<String, Integer> index = ImmutableMap.builder();
        ImmutableList.Builder<LabeledInput> failingBuilder = ImmutableList.builder();
        ImmutableList.Builder<LabeledInput> passingBuilder = ImmutableList.builder();
        for (int i = 0; i < inputs.size(); i++) {
            LabeledInput input = inputs.get(i);
            index.put(input.getText(), i);
            (input.isFailing() ? failingBuilder : passingBuilder).add(input);
        }
        this.indexByText = index.build();
        this.failing = failingBuilder.build();
        this.passing = passingBuilder.build();
    }

    public static Corpus empty() {
        return EMPTY;
    }

    public static Corpus of(Collection<? extends LabeledInput> inputs) {
        return EMPTY.merge(inputs);
    }

    public static Corpus of(LabeledInput... inputs) {
        return of(ImmutableList.copyOf(inputs));
    }

    public static Builder builder(InputParser<DerivationNode> parser) {
        return new Builder(parser);
    }

    /**
     * Returns a new corpus containing the inputs of this corpus followed by those new inputs whose text is not yet
     * contained. This corpus is left unchanged.
     *
     * @param newInputs
     *         the inputs to add
     *
     * @return the merged corpus
     */
    public Corpus merge(Collection<? extends LabeledInput> newInputs) {
        Map<String, LabeledInput> byText = new LinkedHashMap<>();
        for (LabeledInput input : inputs) {
            byText.put(input.getText(), input);
        }
        boolean changed = false;
        for (LabeledInput input : newInputs) {
            if (!byText.containsKey(input.getText())) {
                byText.put(input.getText(), input);
                changed = true;
            }
        }
        return changed ? new Corpus(ImmutableMap.copyOf(byText)) : this;
    }

    public List<LabeledInput> getInputs() {
        return inputs;
    }

    public List<LabeledInput> getFailing() {
        return failing;
    }

    public List<LabeledInput> getPassing() {
        return passing;
    }

    public int size() {
        return inputs.size();
    }

    public boolean isEmpty() {
        return inputs.isEmpty();
    }

    public LabeledInput get(int index) {
        return inputs.get(index);
    }

    public boolean containsText(String text) {
        return indexByText.containsKey(text);
    }

    /**
     * Returns the position of an input in this corpus.
     *
     * @param input
     *         the input to look up
     *
     * @return the index of {@code input}, or {@code -1} if it is not part of this corpus
     */
    public int indexOf(LabeledInput input) {
        Integer idx = indexByText.get(input.getText());
        if (idx == null || !inputs.get(idx).equals(input)) {
            return -1;
        }
        return idx;
    }

    /**
     * Returns the fraction of failing inputs, i.e. the precision of a predicate that holds for every input.
     *
     * @return the failure rate, {@code 0} for an empty corpus
     */
    public double failureRate() {
        return inputs.isEmpty() ? 0.0 : (double) failing.size() / inputs.size();
    }

    /**
     * Returns all non-terminal tags occurring in the failing inputs, in order of first appearance.
     *
     * @return the non-terminal tags of the failing inputs
     */
    public Set<String> failingNonTerminalTags() {
        Set<String> tags = new LinkedHashSet<>();
        for (LabeledInput input : failing) {
            tags.addAll(input.getTree().nonTerminalTags());
        }
        return ImmutableSet.copyOf(tags);
    }

    @Override
    public Iterator<LabeledInput> iterator() {
        return inputs.iterator();
    }

    @Override
    public String toString() {
        return "Corpus[" + failing.size() + " failing, " + passing.size() + " passing]";
    }

    /**
     * Converts raw (text, label) pairs into a corpus.
     */
    public static final class Builder {

        private final InputParser<DerivationNode> parser;
        private final Map<String, LabeledInput> byText = new LinkedHashMap<>();

        Builder(InputParser<DerivationNode> parser) {
            this.parser = parser;
        }

        /**
         * Parses and adds an input. Inputs whose text was added before are ignored.
         *
         * @param text
         *         the input text
         * @param label
         *         the oracle verdict for {@code text}
         *
         * @return this builder
         *
         * @throws ParseException
         *         if the text cannot be parsed; the builder is left unchanged
         */
        public Builder add(String text, OracleResult label) throws ParseException {
            if (!byText.containsKey(text)) {
                byText.put(text, LabeledInput.parse(parser, text, label));
            }
            return this;
        }

        public Builder add(Pair<String, OracleResult> raw) throws ParseException {
            return add(raw.getFirst(), raw.getSecond());
        }

        public Builder addAll(Collection<Pair<String, OracleResult>> raw) throws ParseException {
            for (Pair<String, OracleResult> p : raw) {
                add(p);
            }
            return this;
        }

        public Builder add(LabeledInput input) {
            byText.putIfAbsent(input.getText(), input);
            return this;
        }

        public Corpus build() {
            return byText.isEmpty() ? EMPTY : new Corpus(ImmutableMap.copyOf(byText));
        }
    }
}
