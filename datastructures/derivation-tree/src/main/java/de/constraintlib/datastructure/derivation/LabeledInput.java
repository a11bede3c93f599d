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
package de.constraintlib.datastructure.derivation;

import java.util.Objects;

import com.google.common.base.Preconditions;
import de.constraintlib.api.InputParser;
import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.ParseException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * An input text together with its derivation tree and the verdict of the oracle. Two labeled inputs are equal if they
 * have the same text and the same label.
 */
public final class LabeledInput {

    private final String text;
    private final DerivationNode tree;
    private final OracleResult label;

    public LabeledInput(String text, DerivationNode tree, OracleResult label) {
        Preconditions.checkArgument(text.equals(tree.getText()),
                                    "derivation tree covers '%s', but the input is '%s'",
                                    tree.getText(),
                                    text);
        this.text = text;
        this.tree = tree;
        this.label = Objects.requireNonNull(label, "label");
    }

    public LabeledInput(DerivationNode tree, OracleResult label) {
        this(tree.getText(), tree, label);
    }

    /**
     * Parses a text and labels it.
     *
     * @param parser
     *         the grammar parser
     * @param text
     *         the input text
     * @param label
     *         the oracle verdict for {@code text}
     *
     * @return the labeled input
     *
     * @throws ParseException
     *         if {@code text} cannot be parsed
     */
    public static LabeledInput parse(InputParser<DerivationNode> parser, String text, OracleResult label)
            throws ParseException {
        return new LabeledInput(text, parser.parse(text), label);
    }

    public String getText() {
        return text;
    }

    public DerivationNode getTree() {
        return tree;
    }

    public OracleResult getLabel() {
        return label;
    }

    public boolean isFailing() {
        return label.isFailing();
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof LabeledInput)) {
            return false;
        }
        LabeledInput that = (LabeledInput) o;
        return text.equals(that.text) && label == that.label;
    }

    @Override
    public int hashCode() {
        return Objects.hash(text, label);
    }

    @Override
    public String toString() {
        return text + " (" + label + ')';
    }
}
