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

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

/**
 * The conjunction of two or more constraints. Nested conjunctions are flattened, the order of the members is kept.
 */
public final class Conjunction extends Constraint {

    private final ImmutableList<Constraint> members;

    public Conjunction(List<? extends Constraint> members) {
        ImmutableList.Builder<Constraint> flat = ImmutableList.builder();
        for (Constraint c : members) {
            if (c instanceof Conjunction) {
                flat.addAll(((Conjunction) c).members);
            } else {
                flat.add(c);
            }
        }
        this.members = flat.build();
        Preconditions.checkArgument(this.members.size() >= 2, "A conjunction needs at least two members");
    }

    public List<Constraint> getMembers() {
        return members;
    }

    @Override
    public List<Constraint> getLiterals() {
        return members;
    }

    @Override
    public boolean isAtomic() {
        return false;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitConjunction(this);
    }

    @Override
    protected String doRender() {
        return members.stream().map(Constraint::render).collect(Collectors.joining(" and "));
    }

    @Override
    public Set<String> getNonTerminals() {
        Set<String> result = new LinkedHashSet<>();
        for (Constraint c : members) {
            result.addAll(c.getNonTerminals());
        }
        return ImmutableSet.copyOf(result);
    }
}
