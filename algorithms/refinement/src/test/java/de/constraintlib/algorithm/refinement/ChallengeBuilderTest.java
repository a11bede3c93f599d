package de.constraintlib.algorithm.refinement;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import de.constraintlib.algorithm.mining.AtomicCandidate;
import de.constraintlib.algorithm.mining.Candidate;
import de.constraintlib.algorithm.mining.ConjunctionCandidate;
import de.constraintlib.algorithm.mining.NegatedCandidate;
import de.constraintlib.datastructure.constraint.ComparisonOperator;
import de.constraintlib.datastructure.constraint.NumericComparison;
import de.constraintlib.datastructure.constraint.StringEquality;
import de.constraintlib.datastructure.derivation.Corpus;
import de.constraintlib.testsupport.calculator.CalculatorCorpus;
import de.constraintlib.testsupport.calculator.CalculatorParser;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ChallengeBuilderTest {

    private final Corpus corpus = CalculatorCorpus.initial();
    private final AtomicCandidate isSqrt =
            new AtomicCandidate(new StringEquality(CalculatorParser.FUNCTION, "sqrt"), corpus);
    private final AtomicCandidate atMostMinusTen =
            new AtomicCandidate(new NumericComparison(CalculatorParser.NUMBER,
                                                      ComparisonOperator.LESS_EQUAL,
                                                      BigInteger.valueOf(-10)), corpus);

    private static List<String> render(List<Candidate> challenges) {
        return challenges.stream().map(Candidate::render).collect(Collectors.toList());
    }

    @Test
    public void firstLiteralIsNegated() {
        ConjunctionCandidate candidate = new ConjunctionCandidate(Arrays.asList(isSqrt, atMostMinusTen));
        Assert.assertEquals(render(ChallengeBuilder.challenges(candidate, NegationStrategy.FIRST_LITERAL)),
                            Arrays.asList("not (int(<number>) <= -10) and str(<function>) == 'sqrt'"));
    }

    @Test
    public void atomicCandidate() {
        List<Candidate> challenges = ChallengeBuilder.challenges(isSqrt, NegationStrategy.FIRST_LITERAL);
        Assert.assertEquals(render(challenges), Arrays.asList("not (str(<function>) == 'sqrt')"));
        Assert.assertTrue(challenges.get(0) instanceof NegatedCandidate);
        // sqrt(-900) sqrt(-10) sqrt(0) sin(-900) sqrt(2) cos(10)
        Assert.assertEquals(challenges.get(0).getTruthTable().toString(), "000101");
    }

    @Test
    public void challengesExcludeKnownFailingInputs() {
        ConjunctionCandidate candidate = new ConjunctionCandidate(Arrays.asList(isSqrt, atMostMinusTen));
        Candidate challenge = ChallengeBuilder.challenges(candidate, NegationStrategy.FIRST_LITERAL).get(0);

        Assert.assertTrue(challenge instanceof ConjunctionCandidate);
        Assert.assertSame(challenge.getCorpus(), corpus);
        Assert.assertEquals(challenge.getTruthTable().toString(), "001010");
        Assert.assertEquals(challenge.recall(), 0.0, 1e-9);
    }

    @Test
    public void allCombinations() {
        ConjunctionCandidate candidate = new ConjunctionCandidate(Arrays.asList(isSqrt, atMostMinusTen));
        Assert.assertEquals(render(ChallengeBuilder.challenges(candidate, NegationStrategy.ALL_COMBINATIONS)),
                            Arrays.asList("not (int(<number>) <= -10) and str(<function>) == 'sqrt'",
                                          "int(<number>) <= -10 and not (str(<function>) == 'sqrt')",
                                          "not (int(<number>) <= -10) and not (str(<function>) == 'sqrt')"));
    }
}
