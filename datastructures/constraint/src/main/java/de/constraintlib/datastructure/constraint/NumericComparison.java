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
import java.util.Collections;
import java.util.Set;

/**
 * {@code int(<N>) <op> <INT>}: every occurrence of a non-terminal is numeric and compares to a constant.
 */
public final class NumericComparison extends AtomicConstraint {

    private final String nonTerminal;
    private final ComparisonOperator operator;
    private final BigInteger value;

    public NumericComparison(String nonTerminal, ComparisonOperator operator, BigInteger value) {
        this.nonTerminal = nonTerminal;
        this.operator = operator;
        this.value = value;
    }

    public String getNonTerminal() {
        return nonTerminal;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public BigInteger getValue() {
        return value;
    }

    @Override
    public TemplateKind getKind() {
        return TemplateKind.NUMERIC_COMPARISON;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitNumericComparison(this);
    }

    @Override
    protected String doRender() {
        return "int(" + nt(nonTerminal) + ") " + operator.getSymbol() + ' ' + value;
    }

    @Override
    public Set<String> getNonTerminals() {
        return Collections.singleton(nonTerminal);
    }
}
