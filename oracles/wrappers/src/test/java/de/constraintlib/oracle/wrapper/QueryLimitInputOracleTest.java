package de.constraintlib.oracle.wrapper;

import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.OracleException;
import de.constraintlib.api.exception.QueryLimitException;
import de.constraintlib.api.oracle.InputOracle;
import org.testng.Assert;
import org.testng.annotations.Test;

public class QueryLimitInputOracleTest {

    private static final InputOracle EVEN_LENGTH_FAILS = text -> OracleResult.fromFailing(text.length() % 2 == 0);

    @Test
    public void limitIsEnforced() throws OracleException {
        QueryLimitInputOracle oracle = new QueryLimitInputOracle(2, EVEN_LENGTH_FAILS);
        Assert.assertEquals(oracle.classify("ab"), OracleResult.FAILING);
        Assert.assertEquals(oracle.classify("a"), OracleResult.PASSING);
        Assert.assertEquals(oracle.getQueryCount(), 2);
        Assert.assertThrows(QueryLimitException.class, () -> oracle.classify("abc"));
        Assert.assertEquals(oracle.getQueryCount(), 2);
    }

    @Test
    public void countingOracle() throws OracleException {
        CountingInputOracle oracle = new CountingInputOracle(text -> {
            if (text.isEmpty()) {
                throw new OracleException("empty input");
            }
            return EVEN_LENGTH_FAILS.classify(text);
        });
        oracle.classify("ab");
        oracle.classify("abc");
        oracle.classify("abcd");
        Assert.assertThrows(OracleException.class, () -> oracle.classify(""));

        Assert.assertEquals(oracle.getQueryCount(), 4);
        Assert.assertEquals(oracle.getFailingCount(), 2);
        Assert.assertEquals(oracle.getPassingCount(), 1);
        Assert.assertEquals(oracle.getErrorCount(), 1);
        oracle.reset();
        Assert.assertEquals(oracle.getQueryCount(), 0);
    }
}
