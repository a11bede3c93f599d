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

import java.util.Set;

import com.google.common.collect.ImmutableSet;

/**
 * {@code int(<N1>) <op> int(<N2>)}: the numeric values of two non-terminals compare.
 */
public final class ArithmeticRelation extends AtomicConstraint {

    private final String left;
    private final ComparisonOperator operator;
    private final String right;

    public ArithmeticRelation(String left, ComparisonOperator operator, String right) {
        this.left = left;
        this.operator = operator;
        this.right = right;
    }

    public String getLeft() {
        return left;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public String getRight() {
        return right;
    }

    @Override
    public TemplateKind getKind() {
        return TemplateKind.ARITHMETIC_RELATION;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitArithmeticRelation(this);
    }

    @Override
    protected String doRender() {
        return "int(" + nt(left) + ") " + operator.getSymbol() + " int(" + nt(right) + ')';
    }

    @Override
    public Set<String> getNonTerminals() {
        return ImmutableSet.of(left, right);
    }
}
