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

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

/**
 * A parametrized constraint pattern: an operator kind, typed placeholder slots and a rule turning bound slot values
 * into an {@link AtomicConstraint}.
 * <p>
 * Slot values are bound positionally: {@link PlaceholderType#NON_TERMINAL} and {@link PlaceholderType#STRING} slots
 * take {@link String}s, {@link PlaceholderType#INTEGER} slots take {@link BigInteger}s. Binding values of the wrong
 * number or type is a programming error and raises an {@link IllegalArgumentException}.
 *
 * @author ConstraintLib contributors
 */
public final class ConstraintTemplate {

    public static final ConstraintTemplate INT_LESS_EQUAL = numeric(ComparisonOperator.LESS_EQUAL);
    public static final ConstraintTemplate INT_EQUAL = numeric(ComparisonOperator.EQUAL);
    public static final ConstraintTemplate INT_GREATER_EQUAL = numeric(ComparisonOperator.GREATER_EQUAL);

    public static final ConstraintTemplate STR_EQUAL =
            new ConstraintTemplate(TemplateKind.STRING_EQUALITY,
                                   "str(<NON_TERMINAL>) == <STRING>",
                                   ImmutableList.of(PlaceholderType.NON_TERMINAL, PlaceholderType.STRING),
                                   b -> new StringEquality((String) b.get(0), (String) b.get(1)));

    public static final ConstraintTemplate EXISTS_STR_EQUAL =
            new ConstraintTemplate(TemplateKind.EXISTENTIAL_MEMBERSHIP,
                                   "exists <elem> in <NON_TERMINAL>: str(<elem>) == <STRING>",
                                   ImmutableList.of(PlaceholderType.NON_TERMINAL, PlaceholderType.STRING),
                                   b -> new ExistentialMembership((String) b.get(0),
                                                                  ExistentialMembership.Mode.EQUALS,
                                                                  (String) b.get(1)));

    public static final ConstraintTemplate EXISTS_STR_CONTAINS =
            new ConstraintTemplate(TemplateKind.EXISTENTIAL_MEMBERSHIP,
                                   "exists <elem> in <NON_TERMINAL>: <STRING> in str(<elem>)",
                                   ImmutableList.of(PlaceholderType.NON_TERMINAL, PlaceholderType.STRING),
                                   b -> new ExistentialMembership((String) b.get(0),
                                                                  ExistentialMembership.Mode.CONTAINS,
                                                                  (String) b.get(1)));

    public static final ConstraintTemplate INT_EQUALS_LENGTH =
            new ConstraintTemplate(TemplateKind.LENGTH_RELATION,
                                   "int(<NON_TERMINAL>) == len(str(<NON_TERMINAL>))",
                                   ImmutableList.of(PlaceholderType.NON_TERMINAL, PlaceholderType.NON_TERMINAL),
                                   b -> new LengthRelation((String) b.get(0), (String) b.get(1)));

    public static final ConstraintTemplate INT_LESS_EQUAL_INT = arithmetic(ComparisonOperator.LESS_EQUAL);
    public static final ConstraintTemplate INT_EQUAL_INT = arithmetic(ComparisonOperator.EQUAL);

    private final TemplateKind kind;
    private final String pattern;
    private final ImmutableList<PlaceholderType> slots;
    private final Function<List<Object>, AtomicConstraint> binder;

    private ConstraintTemplate(TemplateKind kind,
                               String pattern,
                               ImmutableList<PlaceholderType> slots,
                               Function<List<Object>, AtomicConstraint> binder) {
        this.kind = kind;
        this.pattern = pattern;
        this.slots = slots;
        this.binder = binder;
    }

    private static ConstraintTemplate numeric(ComparisonOperator operator) {
        return new ConstraintTemplate(TemplateKind.NUMERIC_COMPARISON,
                                      "int(<NON_TERMINAL>) " + operator.getSymbol() + " <INTEGER>",
                                      ImmutableList.of(PlaceholderType.NON_TERMINAL, PlaceholderType.INTEGER),
                                      b -> new NumericComparison((String) b.get(0), operator, (BigInteger) b.get(1)));
    }

    private static ConstraintTemplate arithmetic(ComparisonOperator operator) {
        return new ConstraintTemplate(TemplateKind.ARITHMETIC_RELATION,
                                      "int(<NON_TERMINAL>) " + operator.getSymbol() + " int(<NON_TERMINAL>)",
                                      ImmutableList.of(PlaceholderType.NON_TERMINAL, PlaceholderType.NON_TERMINAL),
                                      b -> new ArithmeticRelation((String) b.get(0), operator, (String) b.get(1)));
    }

    /**
     * Returns all built-in templates.
     *
     * @return the built-in templates
     */
    public static List<ConstraintTemplate> builtIns() {
        return ImmutableList.of(INT_LESS_EQUAL,
                                INT_EQUAL,
                                INT_GREATER_EQUAL,
                                STR_EQUAL,
                                EXISTS_STR_EQUAL,
                                EXISTS_STR_CONTAINS,
                                INT_EQUALS_LENGTH,
                                INT_LESS_EQUAL_INT,
                                INT_EQUAL_INT);
    }

    public TemplateKind getKind() {
        return kind;
    }

    public String getPattern() {
        return pattern;
    }

    public List<PlaceholderType> getSlots() {
        return slots;
    }

    public int countSlots(PlaceholderType type) {
        int count = 0;
        for (PlaceholderType slot : slots) {
            if (slot == type) {
                count++;
            }
        }
        return count;
    }

    /**
     * Binds the slots of this template.
     *
     * @param bindings
     *         one value per slot, in slot order
     *
     * @return the bound constraint
     *
     * @throws IllegalArgumentException
     *         if the number or types of the values do not match the slots
     */
    public AtomicConstraint bind(List<?> bindings) {
        if (bindings.size() != slots.size()) {
            throw new IllegalArgumentException("Template '" + pattern + "' expects " + slots.size() +
                                               " bindings, got " + bindings.size());
        }
        for (int i = 0; i < slots.size(); i++) {
            Object value = bindings.get(i);
            if (value == null || !slots.get(i).accepts(value)) {
                throw new IllegalArgumentException("Illegal value '" + value + "' for slot " + i + " (" +
                                                   slots.get(i).getPlaceholder() + ") of template '" + pattern +
                                                   '\'');
            }
        }
        return binder.apply(ImmutableList.<Object>copyOf(bindings));
    }

    public AtomicConstraint bind(Object... bindings) {
        return bind(Arrays.asList(bindings));
    }

    @Override
    public String toString() {
        return pattern;
    }
}
