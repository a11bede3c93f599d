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
package de.constraintlib.oracle.wrapper;

import java.util.concurrent.atomic.AtomicLong;

import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.OracleException;
import de.constraintlib.api.oracle.InputOracle;

/**
 * Counts the queries posed to an oracle, separately for passing and failing verdicts. Queries that raise an exception
 * are counted as errors.
 *
 * @author ConstraintLib contributors
 */
public class CountingInputOracle implements InputOracle {

    private final InputOracle delegate;
    private final AtomicLong passing = new AtomicLong();
    private final AtomicLong failing = new AtomicLong();
    private final AtomicLong errors = new AtomicLong();

    public CountingInputOracle(InputOracle delegate) {
        this.delegate = delegate;
    }

    @Override
    public OracleResult classify(String text) throws OracleException {
        OracleResult result;
        try {
            result = delegate.classify(text);
        } catch (OracleException | RuntimeException e) {
            errors.incrementAndGet();
            throw e;
        }
        (result.isFailing() ? failing : passing).incrementAndGet();
        return result;
    }

    public long getQueryCount() {
        return passing.get() + failing.get() + errors.get();
    }

    public long getPassingCount() {
        return passing.get();
    }

    public long getFailingCount() {
        return failing.get();
    }

    public long getErrorCount() {
        return errors.get();
    }

    public void reset() {
        passing.set(0);
        failing.set(0);
        errors.set(0);
    }

    @Override
    public String toString() {
        return "Queries: " + getQueryCount() + " (" + failing.get() + " failing, " + passing.get() + " passing, " +
               errors.get() + " errors)";
    }
}
