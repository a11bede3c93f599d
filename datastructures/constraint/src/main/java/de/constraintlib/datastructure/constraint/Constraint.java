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

import java.util.Collections;
import java.util.List;
import java.util.Set;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A boolean predicate over the non-terminal occurrences of a derivation tree.
 * <p>
 * The set of variants is closed: the five atomic kinds listed in {@link TemplateKind} plus {@link Negation} and
 * {@link Conjunction}. Code dispatching on the variant does so through a {@link ConstraintVisitor}, so adding a variant
 * breaks every consumer at compile time instead of silently falling through.
 * <p>
 * Constraints are immutable. Their identity is their rendered expression: two constraints rendering to the same text
 * are equal.
 *
 * @author ConstraintLib contributors
 */
public abstract class Constraint {

    private @Nullable String rendered;

    // only the variants of this package
    Constraint() {}

    public abstract <R> R accept(ConstraintVisitor<R> visitor);

    /**
     * Renders this constraint as a stable textual expression, suitable for handing over to an input generator.
     *
     * @return the constraint expression
     */
    public final String render() {
        String result = rendered;
        if (result == null) {
            result = doRender();
            rendered = result;
        }
        return result;
    }

    protected abstract String doRender();

    /**
     * Returns the tags of all non-terminals referenced by this constraint.
     *
     * @return the referenced non-terminal tags
     */
    public abstract Set<String> getNonTerminals();

    /**
     * Returns the literals of this constraint: the members of a conjunction, or the constraint itself otherwise.
     *
     * @return the literals of this constraint
     */
    public List<Constraint> getLiterals() {
        return Collections.singletonList(this);
    }

    public boolean isAtomic() {
        return true;
    }

    @Override
    public final boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Constraint)) {
            return false;
        }
        return render().equals(((Constraint) o).render());
    }

    @Override
    public final int hashCode() {
        return render().hashCode();
    }

    @Override
    public String toString() {
        return render();
    }

    static String nt(String tag) {
        return '<' + tag + '>';
    }

    static String quote(String value) {
        return '\'' + value.replace("\\", "\\\\").replace("'", "\\'") + '\'';
    }
}
