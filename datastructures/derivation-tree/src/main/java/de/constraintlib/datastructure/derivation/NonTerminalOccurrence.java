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

import java.math.BigDecimal;
import java.util.regex.Pattern;

import de.constraintlib.api.exception.NotNumericException;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * One concrete occurrence of a non-terminal inside the derivation tree of one input. Occurrences compare by identity:
 * two occurrences with the same tag and text at different positions of a tree are distinct.
 */
public final class NonTerminalOccurrence {

    private static final Pattern NUMBER = Pattern.compile("^[-+]?(?:\\d+|\\d*\\.\\d+)(?:[eE][-+]?\\d+)?$");

    private final String tag;
    private final DerivationNode node;

    public NonTerminalOccurrence(String tag, DerivationNode node) {
        this.tag = tag;
        this.node = node;
    }

    public String getTag() {
        return tag;
    }

    public DerivationNode getNode() {
        return node;
    }

    public String getText() {
        return node.getText();
    }

    public int length() {
        return node.getText().length();
    }

    public boolean isNumeric() {
        return isNumeric(node.getText());
    }

    /**
     * Parses the covered text as an integer or decimal number.
     *
     * @return the numeric value of the occurrence
     *
     * @throws NotNumericException
     *         if the text is not a numeric token
     */
    public BigDecimal toNumber() throws NotNumericException {
        return parseNumber(node.getText());
    }

    public static boolean isNumeric(String text) {
        return toBigDecimal(text) != null;
    }

    public static BigDecimal parseNumber(String text) throws NotNumericException {
        BigDecimal value = toBigDecimal(text);
        if (value == null) {
            throw new NotNumericException(text);
        }
        return value;
    }

    // tokens whose exponent does not fit into an int are not representable
    private static @Nullable BigDecimal toBigDecimal(String text) {
        if (!NUMBER.matcher(text).matches()) {
            return null;
        }
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return '<' + tag + ">: " + node.getText();
    }
}
