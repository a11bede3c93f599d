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

/**
 * The logical negation of a constraint.
 */
public final class Negation extends Constraint {

    private final Constraint negated;

    public Negation(Constraint negated) {
        this.negated = negated;
    }

    public Constraint getNegated() {
        return negated;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitNegation(this);
    }

    @Override
    protected String doRender() {
        return "not (" + negated.render() + ')';
    }

    @Override
    public Set<String> getNonTerminals() {
        return negated.getNonTerminals();
    }
}
