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

import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.OracleException;
import de.constraintlib.api.oracle.InputOracle;

/**
 * Evaluates calculator inputs. An input fails if its result is not a number, which is exactly the square root of a
 * negative argument.
 */
public class CalculatorOracle implements InputOracle {

    private static final Pattern INPUT = Pattern.compile("(sqrt|cos|sin|tan)\\((-?\\d+)\\)");

    @Override
    public OracleResult classify(String text) throws OracleException {
        Matcher m = INPUT.matcher(text);
        if (!m.matches()) {
            throw new OracleException("cannot evaluate '" + text + '\'');
        }
        double arg = Double.parseDouble(m.group(2));
        double result;
        switch (m.group(1)) {
            case "sqrt":
                result = Math.sqrt(arg);
                break;
            case "cos":
                result = Math.cos(arg);
                break;
            case "sin":
                result = Math.sin(arg);
                break;
            default:
                result = Math.tan(arg);
        }
        return OracleResult.fromFailing(Double.isNaN(result));
    }
}
