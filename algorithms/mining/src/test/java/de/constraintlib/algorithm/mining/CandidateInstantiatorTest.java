package de.constraintlib.algorithm.mining;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import com.google.common.collect.ImmutableSet;
import de.constraintlib.api.OracleResult;
import de.constraintlib.datastructure.constraint.AtomicConstraint;
import de.constraintlib.datastructure.constraint.Constraint;
import de.constraintlib.datastructure.constraint.ConstraintTemplate;
import de.constraintlib.datastructure.constraint.TemplateKind;
import de.constraintlib.datastructure.derivation.Corpus;
import de.constraintlib.datastructure.derivation.DerivationNode;
import de.constraintlib.datastructure.derivation.LabeledInput;
import de.constraintlib.testsupport.calculator.CalculatorCorpus;
import de.constraintlib.testsupport.calculator.CalculatorParser;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CandidateInstantiatorTest {

    private static Set<String> render(List<AtomicConstraint> constraints) {
        return constraints.stream().map(Constraint::render).collect(Collectors.toSet());
    }

    @Test
    public void valuesComeFromFailingInputsOnly() {
        CandidateInstantiator instantiator = new CandidateInstantiator(PatternCatalog.of(ConstraintTemplate.INT_LESS_EQUAL,
                                                                                         ConstraintTemplate.STR_EQUAL));
        Set<String> rendered = render(instantiator.instantiate(CalculatorCorpus.initial(),
                                                               Collections.singleton(CalculatorParser.NUMBER)));

        Assert.assertEquals(rendered,
                            ImmutableSet.of("int(<number>) <= -900",
                                            "int(<number>) <= -10",
                                            "str(<number>) == '-900'",
                                            "str(<number>) == '-10'"));
    }

    @Test
    public void numericSlotsNeedNumericNonTerminals() {
        CandidateInstantiator instantiator = new CandidateInstantiator(PatternCatalog.builtIn(TemplateKind.NUMERIC_COMPARISON,
                                                                                              TemplateKind.LENGTH_RELATION,
                                                                                              TemplateKind.ARITHMETIC_RELATION));
        Set<String> rendered = render(instantiator.instantiate(CalculatorCorpus.initial(),
                                                               Arrays.asList(CalculatorParser.FUNCTION,
                                                                             CalculatorParser.NUMBER)));
        Assert.assertTrue(rendered.contains("int(<number>) == len(str(<function>))"));
        Assert.assertTrue(rendered.contains("int(<number>) >= -10"));
        for (String r : rendered) {
            Assert.assertFalse(r.startsWith("int(<function>)"), r);
        }
    }

    @Test
    public void existentialTemplatesNeedRecurringNonTerminals() {
        Corpus corpus = CalculatorCorpus.initial();
        CandidateInstantiator instantiator = new CandidateInstantiator(PatternCatalog.builtIn(TemplateKind.EXISTENTIAL_MEMBERSHIP));

        // <digit> occurs twice in sqrt(-900), <number> once per input
        Set<String> rendered = render(instantiator.instantiate(corpus,
                                                               Arrays.asList(CalculatorParser.DIGIT,
                                                                             CalculatorParser.NUMBER)));
        Assert.assertEquals(rendered,
                            ImmutableSet.of("exists <elem> in <digit>: str(<elem>) == '0'",
                                            "exists <elem> in <digit>: '0' in str(<elem>)"));
    }

    @Test
    public void longestCommonSubstringIsAnExtraValue() {
        Corpus corpus = Corpus.of(new LabeledInput(words("xabcy", "abcz"), OracleResult.FAILING),
                                  new LabeledInput(words("zzabc"), OracleResult.FAILING),
                                  new LabeledInput(words("ab", "c"), OracleResult.PASSING));

        Assert.assertEquals(ObservedValues.collect(corpus, "word").getCommonSubstring(), "abc");
        Set<String> rendered = render(new CandidateInstantiator(PatternCatalog.of(ConstraintTemplate.EXISTS_STR_CONTAINS))
                                              .instantiate(corpus, Collections.singleton("word")));
        Assert.assertEquals(rendered,
                            ImmutableSet.of("exists <elem> in <word>: 'xabcy' in str(<elem>)",
                                            "exists <elem> in <word>: 'abcz' in str(<elem>)",
                                            "exists <elem> in <word>: 'zzabc' in str(<elem>)",
                                            "exists <elem> in <word>: 'abc' in str(<elem>)"));

        Assert.assertNull(ObservedValues.longestCommonSubstring(Arrays.asList("ab", "ba")));
        Assert.assertNull(ObservedValues.longestCommonSubstring(Collections.emptyList()));
    }

    // <words> ::= <word> (" " <word>)*
    private static DerivationNode words(String... words) {
        List<DerivationNode> children = new ArrayList<>();
        for (String w : words) {
            if (!children.isEmpty()) {
                children.add(DerivationNode.terminal(" "));
            }
            children.add(DerivationNode.nonTerminal("word", DerivationNode.terminal(w)));
        }
        return DerivationNode.nonTerminal("words", children);
    }

    @Test
    public void unobservedNonTerminalsAreSkipped() {
        CandidateInstantiator instantiator = new CandidateInstantiator(PatternCatalog.builtIn());
        Assert.assertTrue(instantiator.instantiate(CalculatorCorpus.initial(), Collections.singleton("missing"))
                                      .isEmpty());
    }

    // <start> ::= <number>
    static DerivationNode number(String text) {
        return DerivationNode.nonTerminal("start", DerivationNode.nonTerminal("number", DerivationNode.terminal(text)));
    }

    @Test
    public void hugeIntegersAreNotBound() {
        Corpus corpus = Corpus.of(new LabeledInput(number("1e100000000"), OracleResult.FAILING),
                                  new LabeledInput(number("-3"), OracleResult.FAILING),
                                  new LabeledInput(number("5"), OracleResult.PASSING));
        ObservedValues values = ObservedValues.collect(corpus, "number");
        Assert.assertTrue(values.isNumeric());
        Assert.assertEquals(values.getIntegers(), ImmutableSet.of(BigInteger.valueOf(-3)));

        Set<String> rendered = render(new CandidateInstantiator(PatternCatalog.of(ConstraintTemplate.INT_LESS_EQUAL))
                                              .instantiate(corpus, Collections.singleton("number")));
        Assert.assertEquals(rendered, ImmutableSet.of("int(<number>) <= -3"));

        Assert.assertNull(ObservedValues.toWholeNumber(new BigDecimal("2.50")));
        Assert.assertEquals(ObservedValues.toWholeNumber(new BigDecimal("1.2E+3")), BigInteger.valueOf(1200));
    }

    @Test
    public void numericSlotsNeedOnlyNumericValues() {
        Corpus corpus = Corpus.of(new LabeledInput(number("7"), OracleResult.FAILING),
                                  new LabeledInput(number("x"), OracleResult.FAILING),
                                  new LabeledInput(number("5"), OracleResult.PASSING));
        Assert.assertFalse(ObservedValues.collect(corpus, "number").isNumeric());

        CandidateInstantiator instantiator = new CandidateInstantiator(PatternCatalog.builtIn(TemplateKind.NUMERIC_COMPARISON,
                                                                                              TemplateKind.ARITHMETIC_RELATION));
        Assert.assertTrue(instantiator.instantiate(corpus, Collections.singleton("number")).isEmpty());
    }
}
