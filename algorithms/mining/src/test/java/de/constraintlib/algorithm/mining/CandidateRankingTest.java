package de.constraintlib.algorithm.mining;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import de.constraintlib.datastructure.constraint.ComparisonOperator;
import de.constraintlib.datastructure.constraint.NumericComparison;
import de.constraintlib.datastructure.constraint.StringEquality;
import de.constraintlib.datastructure.derivation.Corpus;
import de.constraintlib.testsupport.calculator.CalculatorCorpus;
import de.constraintlib.testsupport.calculator.CalculatorParser;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CandidateRankingTest {

    private final Corpus corpus = CalculatorCorpus.initial();

    private AtomicCandidate atom(String nonTerminal, String value) {
        return new AtomicCandidate(new StringEquality(nonTerminal, value), corpus);
    }

    private AtomicCandidate atMost(long bound) {
        return new AtomicCandidate(new NumericComparison(CalculatorParser.NUMBER,
                                                         ComparisonOperator.LESS_EQUAL,
                                                         BigInteger.valueOf(bound)), corpus);
    }

    @Test
    public void perfectSeparatorsComeFirst() {
        AtomicCandidate isSqrt = atom(CalculatorParser.FUNCTION, "sqrt");
        AtomicCandidate hasMinus = atom(CalculatorParser.MAYBEMINUS, "-");
        ConjunctionCandidate perfect = new ConjunctionCandidate(Arrays.asList(isSqrt, hasMinus));
        AtomicCandidate bound = atMost(-10);

        List<Candidate> ranked = CandidateRanking.top(Arrays.asList(isSqrt, bound, perfect, hasMinus), 4);
        Assert.assertSame(ranked.get(0), perfect);
        // equal precision, recall and support: the rendered text decides
        Assert.assertSame(ranked.get(1), bound);
        Assert.assertSame(ranked.get(2), hasMinus);
        Assert.assertSame(ranked.get(3), isSqrt);
    }

    @Test
    public void rankingIgnoresInputOrder() {
        List<Candidate> candidates = Arrays.asList(atMost(-10),
                                                   atMost(-900),
                                                   atom(CalculatorParser.FUNCTION, "sqrt"),
                                                   atom(CalculatorParser.NUMBER, "-10"));
        List<Candidate> reversed = Arrays.asList(candidates.get(3), candidates.get(2), candidates.get(1), candidates.get(0));
        Assert.assertEquals(CandidateRanking.top(candidates, 10), CandidateRanking.top(reversed, 10));
    }

    @Test
    public void zeroSelectsAllTiedAtBestRank() {
        AtomicCandidate bound = atMost(-10);
        AtomicCandidate hasMinus = atom(CalculatorParser.MAYBEMINUS, "-");
        AtomicCandidate isSqrt = atom(CalculatorParser.FUNCTION, "sqrt");

        Assert.assertEquals(CandidateRanking.top(Arrays.asList(isSqrt, hasMinus, bound), 0),
                            Arrays.asList(bound, hasMinus));
        Assert.assertEquals(CandidateRanking.top(Arrays.asList(isSqrt, hasMinus, bound), 1),
                            Collections.singletonList(bound));
        Assert.assertTrue(CandidateRanking.top(Collections.<Candidate>emptyList(), 0).isEmpty());
    }
}
