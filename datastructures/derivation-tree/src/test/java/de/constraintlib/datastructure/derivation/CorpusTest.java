package de.constraintlib.datastructure.derivation;

import java.util.Arrays;
import java.util.Collections;

import com.google.common.collect.ImmutableSet;
import de.constraintlib.api.InputParser;
import de.constraintlib.api.OracleResult;
import de.constraintlib.api.exception.ParseException;
import net.automatalib.commons.util.Pair;
import org.testng.Assert;
import org.testng.annotations.Test;

public class CorpusTest {

    // <word> ::= <letter>*, rejecting anything but lower case letters
    private static final InputParser<DerivationNode> PARSER = text -> {
        DerivationNode[] letters = new DerivationNode[text.length()];
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 'a' || c > 'z') {
                throw new ParseException(text, "unexpected character '" + c + "' at " + i);
            }
            letters[i] = DerivationNode.nonTerminal("letter", DerivationNode.terminal(String.valueOf(c)));
        }
        return DerivationNode.nonTerminal("word", letters);
    };

    private static LabeledInput input(String text, OracleResult label) throws ParseException {
        return LabeledInput.parse(PARSER, text, label);
    }

    @Test
    public void views() throws ParseException {
        Corpus corpus = Corpus.of(input("ab", OracleResult.FAILING),
                                  input("b", OracleResult.PASSING),
                                  input("c", OracleResult.PASSING),
                                  input("abc", OracleResult.FAILING));
        Assert.assertEquals(corpus.size(), 4);
        Assert.assertEquals(corpus.getFailing().size(), 2);
        Assert.assertEquals(corpus.getPassing().size(), 2);
        Assert.assertEquals(corpus.failureRate(), 0.5, 1e-9);
        Assert.assertEquals(corpus.get(3).getText(), "abc");
        Assert.assertEquals(corpus.indexOf(input("c", OracleResult.PASSING)), 2);
        Assert.assertEquals(corpus.indexOf(input("c", OracleResult.FAILING)), -1);
        Assert.assertEquals(corpus.failingNonTerminalTags(), ImmutableSet.of("word", "letter"));
    }

    @Test
    public void mergeKeepsFirstLabelAndReceiver() throws ParseException {
        Corpus corpus = Corpus.of(input("ab", OracleResult.FAILING), input("b", OracleResult.PASSING));
        Corpus merged = corpus.merge(Arrays.asList(input("ab", OracleResult.PASSING), input("zz", OracleResult.PASSING)));

        Assert.assertEquals(corpus.size(), 2);
        Assert.assertEquals(merged.size(), 3);
        Assert.assertTrue(merged.get(0).isFailing());
        Assert.assertTrue(merged.containsText("zz"));
        Assert.assertSame(merged.merge(Collections.singletonList(input("zz", OracleResult.FAILING))), merged);
    }

    @Test
    public void builderParsesRawPairs() throws ParseException {
        Corpus corpus = Corpus.builder(PARSER)
                              .add("abc", OracleResult.FAILING)
                              .addAll(Arrays.asList(Pair.of("x", OracleResult.PASSING),
                                                    Pair.of("abc", OracleResult.PASSING)))
                              .build();
        Assert.assertEquals(corpus.size(), 2);
        Assert.assertEquals(corpus.get(0).getLabel(), OracleResult.FAILING);
        Assert.assertEquals(corpus.get(0).getTree().findAll("letter").size(), 3);
        Assert.assertTrue(Corpus.builder(PARSER).build().isEmpty());
    }

    @Test
    public void builderRejectsUnparsableInput() {
        Corpus.Builder builder = Corpus.builder(PARSER);
        try {
            builder.add("a1", OracleResult.FAILING);
            Assert.fail("expected a parse error");
        } catch (ParseException e) {
            Assert.assertEquals(e.getInput(), "a1");
        }
        Assert.assertTrue(builder.build().isEmpty());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void treeMustCoverText() {
        new LabeledInput("abc", DerivationNode.terminal("ab"), OracleResult.PASSING);
    }
}
