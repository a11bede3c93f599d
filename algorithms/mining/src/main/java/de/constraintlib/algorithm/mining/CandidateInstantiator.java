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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import de.constraintlib.datastructure.constraint.AtomicConstraint;
import de.constraintlib.datastructure.constraint.ConstraintTemplate;
import de.constraintlib.datastructure.derivation.Corpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Binds the templates of a {@link PatternCatalog} to the non-terminals and literal values observed in the failing
 * inputs of a corpus.
 * <p>
 * Binding rules per template kind:
 * <ul>
 * <li>numeric comparison: every numeric non-terminal with every whole number observed for it,</li>
 * <li>string equality: every non-terminal with every text observed for it,</li>
 * <li>existential membership: only non-terminals occurring at least twice in some failing input, with every observed
 * text (and, for containment, their longest common substring),</li>
 * <li>length and arithmetic relations: every ordered pair of distinct non-terminals whose numeric slots are bound to
 * numeric non-terminals. Symmetric relations take every unordered pair once.</li>
 * </ul>
 *
 * @author ConstraintLib contributors
 */
public class CandidateInstantiator {

    private static final Logger LOGGER = LoggerFactory.getLogger(CandidateInstantiator.class);

    private final PatternCatalog catalog;

    public CandidateInstantiator(PatternCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Instantiates all templates of the catalog.
     *
     * @param corpus
     *         the corpus providing observed values
     * @param nonTerminals
     *         the non-terminals to bind; tags that never occur in a failing input are skipped
     *
     * @return the distinct instantiated constraints
     */
    public List<AtomicConstraint> instantiate(Corpus corpus, Collection<String> nonTerminals) {
        Map<String, ObservedValues> observed = ObservedValues.collect(corpus, nonTerminals);
        List<ObservedValues> present = new ArrayList<>();
        for (ObservedValues values : observed.values()) {
            if (values.isObserved()) {
                present.add(values);
            }
        }

        Set<AtomicConstraint> result = new LinkedHashSet<>();
        for (ConstraintTemplate template : catalog.getTemplates()) {
            int before = result.size();
            instantiate(template, present, result);
            LOGGER.debug("Template '{}' yields {} constraints", template, result.size() - before);
        }
        return new ArrayList<>(result);
    }

    private void instantiate(ConstraintTemplate template, List<ObservedValues> present, Set<AtomicConstraint> sink) {
        switch (template.getKind()) {
            case NUMERIC_COMPARISON:
                for (ObservedValues values : present) {
                    if (!values.isNumeric()) {
                        continue;
                    }
                    for (BigInteger value : values.getIntegers()) {
                        sink.add(template.bind(values.getNonTerminal(), value));
                    }
                }
                break;
            case STRING_EQUALITY:
                for (ObservedValues values : present) {
                    for (String value : values.getStrings()) {
                        sink.add(template.bind(values.getNonTerminal(), value));
                    }
                }
                break;
            case EXISTENTIAL_MEMBERSHIP:
                for (ObservedValues values : present) {
                    if (!values.isRecurring()) {
                        continue;
                    }
                    boolean containment = template == ConstraintTemplate.EXISTS_STR_CONTAINS;
                    for (String value : containment ? values.getSubstrings() : values.getStrings()) {
                        if (!containment || !value.isEmpty()) {
                            sink.add(template.bind(values.getNonTerminal(), value));
                        }
                    }
                }
                break;
            case LENGTH_RELATION:
                for (ObservedValues numeric : present) {
                    if (!numeric.isNumeric()) {
                        continue;
                    }
                    for (ObservedValues other : present) {
                        if (numeric != other) {
                            sink.add(template.bind(numeric.getNonTerminal(), other.getNonTerminal()));
                        }
                    }
                }
                break;
            case ARITHMETIC_RELATION:
                bindPairs(template, present, sink);
                break;
            default:
                throw new IllegalArgumentException("Unknown template kind " + template.getKind());
        }
    }

    private static void bindPairs(ConstraintTemplate template, List<ObservedValues> present, Set<AtomicConstraint> sink) {
        boolean symmetric = template == ConstraintTemplate.INT_EQUAL_INT;
        for (int i = 0; i < present.size(); i++) {
            ObservedValues left = present.get(i);
            if (!left.isNumeric()) {
                continue;
            }
            for (int j = symmetric ? i + 1 : 0; j < present.size(); j++) {
                ObservedValues right = present.get(j);
                if (i != j && right.isNumeric()) {
                    sink.add(template.bind(left.getNonTerminal(), right.getNonTerminal()));
                }
            }
        }
    }

    public PatternCatalog getCatalog() {
        return catalog;
    }
}
