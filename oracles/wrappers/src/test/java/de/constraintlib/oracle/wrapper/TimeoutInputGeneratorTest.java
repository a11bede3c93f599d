package de.constraintlib.oracle.wrapper;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import de.constraintlib.api.exception.UnsatisfiableException;
import de.constraintlib.api.oracle.InputGenerator;
import org.testng.Assert;
import org.testng.annotations.Test;

public class TimeoutInputGeneratorTest {

    @Test
    public void fastGeneratorPassesThrough() throws UnsatisfiableException {
        InputGenerator<String> echo = (constraint, count, seed) -> Collections.nCopies(count, constraint + seed);
        try (TimeoutInputGenerator<String> generator = new TimeoutInputGenerator<>(echo, 5, TimeUnit.SECONDS)) {
            List<String> result = generator.generate("x", 2, 7L);
            Assert.assertEquals(result, Collections.nCopies(2, "x7"));
        }
    }

    @Test(timeOut = 10_000)
    public void slowGeneratorIsReportedUnsatisfiable() throws Exception {
        CountDownLatch never = new CountDownLatch(1);
        InputGenerator<String> hanging = (constraint, count, seed) -> {
            try {
                never.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return Collections.emptyList();
        };
        try (TimeoutInputGenerator<String> generator = new TimeoutInputGenerator<>(hanging, 100, TimeUnit.MILLISECONDS)) {
            Assert.assertThrows(UnsatisfiableException.class, () -> generator.generate("x", 1, 0L));
        }
        Assert.assertFalse(Thread.currentThread().isInterrupted());
    }

    @Test
    public void generatorFailuresPropagate() {
        InputGenerator<String> unsatisfiable = (constraint, count, seed) -> {
            throw new UnsatisfiableException("contradiction: " + constraint);
        };
        try (TimeoutInputGenerator<String> generator = new TimeoutInputGenerator<>(unsatisfiable, 5, TimeUnit.SECONDS)) {
            generator.generate("x", 1, 0L);
            Assert.fail("expected an exception");
        } catch (UnsatisfiableException e) {
            Assert.assertEquals(e.getMessage(), "contradiction: x");
        }

        InputGenerator<String> broken = (constraint, count, seed) -> {
            throw new IllegalStateException("broken");
        };
        try (TimeoutInputGenerator<String> generator = new TimeoutInputGenerator<>(broken, 5, TimeUnit.SECONDS)) {
            Assert.assertThrows(IllegalStateException.class, () -> generator.generate("x", 1, 0L));
        }
    }
}
