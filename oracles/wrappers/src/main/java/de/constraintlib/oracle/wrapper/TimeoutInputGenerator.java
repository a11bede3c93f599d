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

import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import de.constraintlib.api.exception.UnsatisfiableException;
import de.constraintlib.api.oracle.InputGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounds the time an {@link InputGenerator} may search. A search that does not finish in time is cancelled and
 * reported as {@link UnsatisfiableException}, as is an interrupted wait (the interrupt flag is restored).
 * <p>
 * The generator runs on a single daemon worker thread owned by this wrapper; {@link #close()} releases it.
 *
 * @param <C>
 *         constraint expression type
 *
 * @author ConstraintLib contributors
 */
public class TimeoutInputGenerator<C> implements InputGenerator<C>, AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(TimeoutInputGenerator.class);

    private final InputGenerator<C> delegate;
    private final long timeout;
    private final TimeUnit unit;
    private final ExecutorService executor;

    public TimeoutInputGenerator(InputGenerator<C> delegate, long timeout, TimeUnit unit) {
        Preconditions.checkArgument(timeout > 0, "timeout must be positive");
        this.delegate = delegate;
        this.timeout = timeout;
        this.unit = unit;
        this.executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder().setNameFormat("input-generator-%d")
                                                                                    .setDaemon(true)
                                                                                    .build());
    }

    @Override
    public List<String> generate(C constraint, int desiredCount, long seed) throws UnsatisfiableException {
        Future<List<String>> future = executor.submit(() -> delegate.generate(constraint, desiredCount, seed));
        try {
            return future.get(timeout, unit);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.info("Generating inputs for '{}' timed out after {} {}", constraint, timeout, unit);
            throw new UnsatisfiableException("no input found within " + timeout + ' ' + unit, e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new UnsatisfiableException("interrupted while generating inputs", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof UnsatisfiableException) {
                throw (UnsatisfiableException) cause;
            } else if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            } else if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw new IllegalStateException(cause);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
