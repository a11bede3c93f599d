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
package de.constraintlib.testsupport.calculator;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import de.constraintlib.api.InputParser;
import de.constraintlib.api.exception.ParseException;
import de.constraintlib.datastructure.derivation.DerivationNode;

/**
 * Parses the inputs of a small calculator language:
 *
 * <pre>
 * &lt;start&gt;       ::= &lt;arithexp&gt;
 * &lt;arithexp&gt;    ::= &lt;function&gt; "(" &lt;number&gt; ")"
 * &lt;function&gt;    ::= "sqrt" | "cos" | "sin" | "tan"
 * &lt;number&gt;      ::= &lt;maybeminus&gt; &lt;onenine&gt; &lt;maybedigits&gt; | "0"
 * &lt;maybeminus&gt;  ::= "-" | ""
 * &lt;onenine&gt;     ::= "1" | ... | "9"
 * &lt;maybedigits&gt; ::= "" | &lt;digit&gt; &lt;maybedigits&gt;
 * &lt;digit&gt;       ::= "0" | &lt;onenine&gt;
 * </pre>
 */
public class CalculatorParser implements InputParser<DerivationNode> {

    public static final String START = "start";
    public static final String ARITHEXP = "arithexp";
    public static final String FUNCTION = "function";
    public static final String NUMBER = "number";
    public static final String MAYBEMINUS = "maybeminus";
    public static final String ONENINE = "onenine";
    public static final String MAYBEDIGITS = "maybedigits";
    public static final String DIGIT = "digit";

    private static final Pattern INPUT = Pattern.compile("(sqrt|cos|sin|tan)\\((.*)\\)");
    private static final Pattern NUMBER_TOKEN = Pattern.compile("0|-?[1-9][0-9]*");

    @Override
    public DerivationNode parse(String text) throws ParseException {
        Matcher m = INPUT.matcher(text);
        if (!m.matches()) {
            throw new ParseException(text, "not of the form <function>(<number>): '" + text + '\'');
        }
        String number = m.group(2);
        if (!NUMBER_TOKEN.matcher(number).matches()) {
            throw new ParseException(text, "'" + number + "' is not derivable from <number>");
        }
        DerivationNode arithexp = DerivationNode.nonTerminal(ARITHEXP,
                                                             DerivationNode.nonTerminal(FUNCTION,
                                                                                        DerivationNode.terminal(m.group(1))),
                                                             DerivationNode.terminal("("),
                                                             number(number),
                                                             DerivationNode.terminal(")"));
        return DerivationNode.nonTerminal(START, arithexp);
    }

    private static DerivationNode number(String token) {
        if ("0".equals(token)) {
            return DerivationNode.nonTerminal(NUMBER, DerivationNode.terminal("0"));
        }
        boolean negative = token.charAt(0) == '-';
        String digits = negative ? token.substring(1) : token;

        // right-recursive <maybedigits>, built from the innermost (empty) derivation outwards
        DerivationNode tail = DerivationNode.nonTerminal(MAYBEDIGITS, DerivationNode.terminal(""));
        for (int i = digits.length() - 1; i >= 1; i--) {
            tail = DerivationNode.nonTerminal(MAYBEDIGITS, digit(digits.charAt(i)), tail);
        }

        return DerivationNode.nonTerminal(NUMBER,
                                          DerivationNode.nonTerminal(MAYBEMINUS,
                                                                     DerivationNode.terminal(negative ? "-" : "")),
                                          oneNine(digits.charAt(0)),
                                          tail);
    }

    private static DerivationNode digit(char c) {
        if (c == '0') {
            return DerivationNode.nonTerminal(DIGIT, DerivationNode.terminal("0"));
        }
        return DerivationNode.nonTerminal(DIGIT, oneNine(c));
    }

    private static DerivationNode oneNine(char c) {
        return DerivationNode.nonTerminal(ONENINE, DerivationNode.terminal(String.valueOf(c)));
    }
}
