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
 * {@code str(<N>) == <STR>}: every occurrence of a non-terminal covers exactly the given text.
 */
public final class StringEquality extends AtomicConstraint {

    private final String nonTerminal;
    private final String value;

    public StringEquality(String nonTerminal, String value) {
        this.nonTerminal = nonTerminal;
        this.value = value;
    }

    public String getNonTerminal() {
        return nonTerminal;
    }

    public String getValue() {
        return value;
    }

    @Override
    public TemplateKind getKind() {
        return TemplateKind.STRING_EQUALITY;
    }

    @Override
    public <R> R accept(ConstraintVisitor<R> visitor) {
        return visitor.visitStringEquality(this);
    }

    @Override
    protected String doRender() {
        return "str(" + nt(nonTerminal) + ") == " + quote(value);
    }

    @Override
    public Set<String> getNonTerminals() {
        return Collections.singleton(nonTerminal);
    }
}
