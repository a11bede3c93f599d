package de.constraintlib.testsupport.calculator;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;

import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.UnsatisfiableException;
import de.constraintlib.datastructure.constraint.ComparisonOperator;
import de.constraintlib.datastructure.constraint.Conjunction;
import de.constraintlib.datastructure.constraint.Constraint;
import de.constraintlib.datastructure.constraint.ConstraintEvaluator;
import de.constraintlib.datastructure.constraint.Negation;
import de.constraintlib.datastructure.constraint.NumericComparison;
import de.constraintlib.datastructure.constraint.StringEquality;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CalculatorGeneratorTest {

    private final CalculatorParser parser = new CalculatorParser();

    private static Constraint challenge() {
        return new Conjunction(Arrays.asList(new Negation(new NumericComparison(CalculatorParser.NUMBER,
                                                                                ComparisonOperator.LESS_EQUAL,
                                                                                BigInteger.valueOf(-10))),
                                             new StringEquality(CalculatorParser.FUNCTION, "sqrt")));
    }

    @Test
    public void generatedInputsSatisfyConstraint() throws Exception {
        List<String> inputs = new CalculatorGenerator().generate(challenge(), 10, 42L);
        Assert.assertEquals(inputs.size(), 10);
        for (String input : inputs) {
            Assert.assertTrue(ConstraintEvaluator.evaluate(challenge(), parser.parse(input)), input);
        }
        Assert.assertEquals(inputs.stream().distinct().count(), 10L);
    }

    @Test
    public void seedMakesGenerationReproducible() throws Exception {
        CalculatorGenerator generator = new CalculatorGenerator();
        Assert.assertEquals(generator.generate(challenge(), 5, 7L), generator.generate(challenge(), 5, 7L));
    }

    @Test(expectedExceptions = UnsatisfiableException.class)
    public void unsatisfiableConstraint() throws Exception {
        new CalculatorGenerator().generate(new StringEquality(CalculatorParser.FUNCTION, "log"), 3, 1L);
    }

    @Test
    public void oracleFailsOnNegativeSquareRoots() throws Exception {
        CalculatorOracle oracle = new CalculatorOracle();
        Assert.assertEquals(oracle.classify("sqrt(-1)"), OracleResult.FAILING);
        Assert.assertEquals(oracle.classify("sqrt(0)"), OracleResult.PASSING);
        Assert.assertEquals(oracle.classify("sin(-900)"), OracleResult.PASSING);
        Assert.assertEquals(CalculatorCorpus.initial().getFailing().size(), 2);
        Assert.assertEquals(CalculatorCorpus.classified("sqrt(-3)", "tan(3)").getPassing().size(), 1);
    }
}
