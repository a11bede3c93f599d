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
 * {@code int(<N1>) == len(str(<N2>))}: the numeric value of one non-terminal equals the length of another.
 */
public final class LengthRelation extends AtomicConstraint {

    private final String numericNonTerminal;
    private final String lengthNonTerminal;

    public LengthRelation(String numericNonTerminal, String lengthNonTerminal) {
        this.numericNonTerminal = numericNonTerminal;
        this.lengthNonTerminal = lengthNonTerminal;
    }

    public String getNumericNonTerminal() {
        return numericNonTerminal;
    }

    public String getLengthNonTerminal() {
        return lengthNonTerminal;
    }

    @Override
    public TemplateKind getKind() {
        return TemplateKind.LENGTH_RELATION;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitLengthRelation(this);
    }

    @Override
    protected String doRender() {
        return "int(" + nt(numericNonTerminal) + ") == len(str(" + nt(lengthNonTerminal) + "))";
    }

    @Override
    public Set<String> getNonTerminals() {
        return ImmutableSet.of(numericNonTerminal, lengthNonTerminal);
    }
}
