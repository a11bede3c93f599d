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

import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.OracleException;
import de.constraintlib.api.exception.QueryLimitException;
import de.constraintlib.api.oracle.InputOracle;

/**
 * An oracle wrapper that answers at most a fixed number of queries. Any further query raises a
 * {@link QueryLimitException}.
 * <p>
 * This oracle is <b>not</b> thread-safe.
 *
 * @author ConstraintLib contributors
 */
public class QueryLimitInputOracle implements InputOracle {

    private final long queryLimit;
    private long queryCount;
    private final InputOracle delegate;

    public QueryLimitInputOracle(long queryLimit, InputOracle delegate) {
        this.queryLimit = queryLimit;
        this.queryCount = 0;
        this.delegate = delegate;
    }

    @Override
    public OracleResult classify(String text) throws OracleException {
        if (queryCount >= queryLimit) {
            throw new QueryLimitException("query limit of " + queryLimit + " reached");
        }
        queryCount++;
        return delegate.classify(text);
    }

    public long getQueryCount() {
        return queryCount;
    }

    public long getQueryLimit() {
        return queryLimit;
    }
}
