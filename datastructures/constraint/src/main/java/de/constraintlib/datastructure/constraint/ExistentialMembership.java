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
import java.util.Set;

/**
 * {@code exists <e> in <N>: ...}: at least one occurrence of a (typically recurring) non-terminal matches a string.
 */
public final class ExistentialMembership extends AtomicConstraint {

    /**
     * How an occurrence is matched against the string of the constraint.
     */
    public enum Mode {
        /** {@code str(<e>) == <STR>}. */
        EQUALS,
        /** {@code <STR> in str(<e>)}. */
        CONTAINS
    }

    private final String nonTerminal;
    private final Mode mode;
    private final String value;

    public ExistentialMembership(String nonTerminal, Mode mode, String value) {
        this.nonTerminal = nonTerminal;
        this.mode = mode;
        this.value = value;
    }

    public String getNonTerminal() {
        return nonTerminal;
    }

    public Mode getMode() {
        return mode;
    }

    public String getValue() {
        return value;
    }

    public boolean matches(String occurrenceText) {
        return mode == Mode.EQUALS ? occurrenceText.equals(value) : occurrenceText.contains(value);
    }

    @Override
    public TemplateKind getKind() {
        return TemplateKind.EXISTENTIAL_MEMBERSHIP;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitExistentialMembership(this);
    }

    @Override
    protected String doRender() {
        String prefix = "exists <elem> in " + nt(nonTerminal) + ": ";
        if (mode == Mode.EQUALS) {
            return prefix + "str(<elem>) == " + quote(value);
        }
        return prefix + quote(value) + " in str(<elem>)";
    }

    @Override
    public Set<String> getNonTerminals() {
        return Collections.singleton(nonTerminal);
    }
}
