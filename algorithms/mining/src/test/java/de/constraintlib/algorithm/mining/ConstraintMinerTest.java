package de.constraintlib.algorithm.mining;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

import de.constraintlib.api.OracleResult;
import de.constraintlib.datastructure.derivation.Corpus;
import de.constraintlib.datastructure.derivation.LabeledInput;
import de.constraintlib.testsupport.calculator.CalculatorCorpus;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ConstraintMinerTest {

    private static List<String> render(List<Candidate> candidates) {
        return candidates.stream().map(Candidate::render).collect(Collectors.toList());
    }

    @Test
    public void calculatorScenario() {
        List<Candidate> result = new ConstraintMiner().mine(CalculatorCorpus.initial(),
                                                            CalculatorCorpus.RELEVANT_NON_TERMINALS);

        Assert.assertFalse(result.isEmpty());
        Candidate best = result.get(0);
        Assert.assertEquals(best.render(), "int(<number>) <= -10 and str(<function>) == 'sqrt'");
        Assert.assertEquals(best.precision(), 1.0, 1e-9);
        Assert.assertEquals(best.recall(), 1.0, 1e-9);
        Assert.assertEquals(render(result),
                            Arrays.asList("int(<number>) <= -10 and str(<function>) == 'sqrt'",
                                    "str(<function>) == 'sqrt' and str(<maybeminus>) == '-'"));
    }

    @Test
    public void everyResultHasFullRecall() {
        ConstraintMiner miner = new ConstraintMinerBuilder().withMaxResults(50).create();
        Corpus corpus = CalculatorCorpus.classified("sqrt(-900)",
                                                    "sqrt(-10)",
                                                    "sqrt(-1)",
                                                    "sqrt(0)",
                                                    "sin(-900)",
                                                    "sqrt(2)",
                                                    "cos(10)",
                                                    "tan(-3)");
        List<Candidate> result = miner.mine(corpus);
        Assert.assertFalse(result.isEmpty());
        Assert.assertTrue(result.size() <= 50);
        for (Candidate c : result) {
            Assert.assertEquals(c.recall(), 1.0, 1e-9, c.toString());
            Assert.assertTrue(c.precision() > corpus.failureRate(), c.toString());
        }
        List<Candidate> sorted = new ArrayList<>(result);
        sorted.sort(CandidateRanking.ORDER);
        Assert.assertEquals(render(sorted), render(result));
    }

    @Test
    public void miningIsIdempotent() {
        ConstraintMiner miner = new ConstraintMinerBuilder().withMaxResults(20).create();
        Corpus corpus = CalculatorCorpus.initial();
        Assert.assertEquals(render(miner.mine(corpus)), render(miner.mine(corpus)));
    }

    @Test
    public void perfectCandidatesStayComplete() {
        Corpus small = CalculatorCorpus.initial();
        Corpus large = small.merge(CalculatorCorpus.classified("sqrt(-3)", "sqrt(-77)", "cos(-5)", "tan(12)")
                                                   .getInputs());
        ConstraintMiner miner = new ConstraintMinerBuilder().withMaxResults(100).create();
        for (Candidate c : miner.mine(large, CalculatorCorpus.RELEVANT_NON_TERMINALS)) {
            if (c.isPerfect()) {
                Assert.assertEquals(c.reevaluate(small).recall(), 1.0, 1e-9, c.toString());
            }
        }
    }

    @Test
    public void noFailingInputsYieldsNothing() {
        Corpus passing = CalculatorCorpus.classified("sqrt(1)", "cos(-1)");
        Assert.assertTrue(new ConstraintMiner().mine(passing).isEmpty());
    }

    @Test
    public void observerIsNotified() {
        List<String> events = new ArrayList<>();
        MiningObserver observer = new MiningObserver() {

            @Override
            public void onCandidatesInstantiated(int count) {
                events.add("instantiated");
            }

            @Override
            public void onCandidatesEvaluated(int evaluated, int fullRecall, int retained) {
                Assert.assertTrue(retained <= fullRecall && fullRecall <= evaluated);
                events.add("evaluated");
            }

            @Override
            public void onConjunctionsFound(int count) {
                events.add("conjunctions");
            }

            @Override
            public void onMiningFinished(List<Candidate> result) {
                events.add("finished");
            }
        };

        new ConstraintMinerBuilder().withObserver(observer)
                                    .create()
                                    .mine(CalculatorCorpus.initial(), CalculatorCorpus.RELEVANT_NON_TERMINALS);
        Assert.assertEquals(events, Arrays.asList("instantiated", "evaluated", "conjunctions", "finished"));
    }

    @Test
    public void conjunctionsCanBeDisabled() {
        ConstraintMiner miner = new ConstraintMinerBuilder().withMaxConjunctionSize(1).create();
        List<Candidate> result = miner.mine(CalculatorCorpus.initial(), CalculatorCorpus.RELEVANT_NON_TERMINALS);
        Assert.assertFalse(result.isEmpty());
        for (Candidate c : result) {
            Assert.assertEquals(c.getLiteralCount(), 1);
            Assert.assertFalse(c.isPerfect());
        }
    }

    @Test
    public void unrepresentableNumbersDoNotAbortMining() {
        Corpus corpus = Corpus.of(new LabeledInput(CandidateInstantiatorTest.number("1e2147483648"), OracleResult.FAILING),
                                  new LabeledInput(CandidateInstantiatorTest.number("5"), OracleResult.PASSING));
        Assert.assertEquals(render(new ConstraintMiner().mine(corpus)),
                            Arrays.asList("str(<number>) == '1e2147483648'", "str(<start>) == '1e2147483648'"));
    }
}
