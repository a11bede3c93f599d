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
package de.constraintlib.datastructure.constraint;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import de.constraintlib.api.exception.NotNumericException;
import de.constraintlib.datastructure.derivation.DerivationNode;
import de.constraintlib.datastructure.derivation.NonTerminalOccurrence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides constraints on a single derivation tree.
 * <p>
 * Relations over occurrences are universal: a constraint on {@code <N>} holds if it holds for every occurrence of
 * {@code <N>} (for every pair of occurrences, for binary relations). A constraint referencing a non-terminal that does
 * not occur in the tree is false. Non-numeric text compared numerically makes the constraint false for this tree.
 * Existential constraints hold if some occurrence matches.
 * <p>
 * An evaluator caches the occurrences of each non-terminal it looks up, so evaluating a conjunction searches the tree
 * once per non-terminal. Instances are not thread-safe; use one per tree and thread.
 *
 * @author ConstraintLib contributors
 */
public final class ConstraintEvaluator implements ConstraintVisitor<Boolean> {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConstraintEvaluator.class);

    private final DerivationNode tree;
    private final Map<String, List<NonTerminalOccurrence>> occurrences = new HashMap<>();

    public ConstraintEvaluator(DerivationNode tree) {
        this.tree = tree;
    }

    /**
     * Decides a constraint on a tree.
     *
     * @param constraint
     *         the constraint
     * @param tree
     *         the derivation tree
     *
     * @return whether {@code tree} satisfies {@code constraint}
     */
    public static boolean evaluate(Constraint constraint, DerivationNode tree) {
        return new ConstraintEvaluator(tree).check(constraint);
    }

    public boolean check(Constraint constraint) {
        return constraint.accept(this);
    }

    private List<NonTerminalOccurrence> lookup(String tag) {
        return occurrences.computeIfAbsent(tag, tree::findAll);
    }

    @Override
    public Boolean visitNumericComparison(NumericComparison constraint) {
        List<NonTerminalOccurrence> occs = lookup(constraint.getNonTerminal());
        if (occs.isEmpty()) {
            return false;
        }
        BigDecimal bound = new BigDecimal(constraint.getValue());
        try {
            for (NonTerminalOccurrence occ : occs) {
                if (!constraint.getOperator().test(occ.toNumber().compareTo(bound))) {
                    return false;
                }
            }
        } catch (NotNumericException e) {
            LOGGER.trace("'{}' does not hold on '{}'", constraint, tree.getText(), e);
            return false;
        }
        return true;
    }

    @Override
    public Boolean visitStringEquality(StringEquality constraint) {
        List<NonTerminalOccurrence> occs = lookup(constraint.getNonTerminal());
        if (occs.isEmpty()) {
            return false;
        }
        for (NonTerminalOccurrence occ : occs) {
            if (!occ.getText().equals(constraint.getValue())) {
                return false;
            }
        }
        return true;
    }

    @Override
    public Boolean visitExistentialMembership(ExistentialMembership constraint) {
        for (NonTerminalOccurrence occ : lookup(constraint.getNonTerminal())) {
            if (constraint.matches(occ.getText())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Boolean visitLengthRelation(LengthRelation constraint) {
        List<NonTerminalOccurrence> numbers = lookup(constraint.getNumericNonTerminal());
        List<NonTerminalOccurrence> texts = lookup(constraint.getLengthNonTerminal());
        if (numbers.isEmpty() || texts.isEmpty()) {
            return false;
        }
        try {
            for (NonTerminalOccurrence number : numbers) {
                BigDecimal value = number.toNumber();
                for (NonTerminalOccurrence text : texts) {
                    if (value.compareTo(BigDecimal.valueOf(text.length())) != 0) {
                        return false;
                    }
                }
            }
        } catch (NotNumericException e) {
            LOGGER.trace("'{}' does not hold on '{}'", constraint, tree.getText(), e);
            return false;
        }
        return true;
    }

    @Override
    public Boolean visitArithmeticRelation(ArithmeticRelation constraint) {
        List<NonTerminalOccurrence> lefts = lookup(constraint.getLeft());
        List<NonTerminalOccurrence> rights = lookup(constraint.getRight());
        if (lefts.isEmpty() || rights.isEmpty()) {
            return false;
        }
        try {
            for (NonTerminalOccurrence left : lefts) {
                BigDecimal l = left.toNumber();
                for (NonTerminalOccurrence right : rights) {
                    if (!constraint.getOperator().test(l.compareTo(right.toNumber()))) {
                        return false;
                    }
                }
            }
        } catch (NotNumericException e) {
            LOGGER.trace("'{}' does not hold on '{}'", constraint, tree.getText(), e);
            return false;
        }
        return true;
    }

    @Override
    public Boolean visitNegation(Negation constraint) {
        return !constraint.getNegated().accept(this);
    }

    @Override
    public Boolean visitConjunction(Conjunction constraint) {
        for (Constraint member : constraint.getMembers()) {
            if (!member.accept(this)) {
                return false;
            }
        }
        return true;
    }
}
