package de.constraintlib.datastructure.constraint;

import java.math.BigInteger;
import java.util.Arrays;

import de.constraintlib.datastructure.derivation.DerivationNode;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ConstraintEvaluatorTest {

    private static DerivationNode leaf(String tag, String text) {
        return DerivationNode.nonTerminal(tag, DerivationNode.terminal(text));
    }

    // <call> ::= <name> "(" <arg> ("," <arg>)* ")"
    private static DerivationNode call(String name, String... args) {
        DerivationNode[] children = new DerivationNode[2 * args.length + 2];
        children[0] = leaf("name", name);
        children[1] = DerivationNode.terminal("(");
        for (int i = 0; i < args.length; i++) {
            children[2 + 2 * i] = leaf("arg", args[i]);
            children[3 + 2 * i] = DerivationNode.terminal(i == args.length - 1 ? ")" : ",");
        }
        return DerivationNode.nonTerminal("call", children);
    }

    @Test
    public void numericComparisonIsUniversal() {
        NumericComparison atMostTen = new NumericComparison("arg", ComparisonOperator.LESS_EQUAL, BigInteger.TEN);
        Assert.assertTrue(ConstraintEvaluator.evaluate(atMostTen, call("f", "3", "10")));
        Assert.assertFalse(ConstraintEvaluator.evaluate(atMostTen, call("f", "3", "11")));
        Assert.assertTrue(ConstraintEvaluator.evaluate(atMostTen, call("f", "-2.5")));
    }

    @Test
    public void nonNumericTextIsFalse() {
        NumericComparison atLeastZero = new NumericComparison("arg", ComparisonOperator.GREATER_EQUAL, BigInteger.ZERO);
        Assert.assertFalse(ConstraintEvaluator.evaluate(atLeastZero, call("f", "1", "x")));
        Assert.assertTrue(ConstraintEvaluator.evaluate(new Negation(atLeastZero), call("f", "1", "x")));
    }

    @Test
    public void absentNonTerminalIsFalse() {
        DerivationNode noArgs = DerivationNode.nonTerminal("call", leaf("name", "f"), DerivationNode.terminal("()"));
        Assert.assertFalse(ConstraintEvaluator.evaluate(new StringEquality("arg", "1"), noArgs));
        Assert.assertFalse(ConstraintEvaluator.evaluate(new NumericComparison("arg",
                                                                              ComparisonOperator.EQUAL,
                                                                              BigInteger.ONE), noArgs));
        Assert.assertFalse(ConstraintEvaluator.evaluate(new ExistentialMembership("arg",
                                                                                  ExistentialMembership.Mode.EQUALS,
                                                                                  "1"), noArgs));
        Assert.assertFalse(ConstraintEvaluator.evaluate(new LengthRelation("arg", "name"), noArgs));
    }

    @Test
    public void stringEqualityVersusExistential() {
        DerivationNode tree = call("g", "ab", "xaby");
        Assert.assertFalse(ConstraintEvaluator.evaluate(new StringEquality("arg", "ab"), tree));
        Assert.assertTrue(ConstraintEvaluator.evaluate(new ExistentialMembership("arg",
                                                                                 ExistentialMembership.Mode.EQUALS,
                                                                                 "ab"), tree));
        Assert.assertTrue(ConstraintEvaluator.evaluate(new ExistentialMembership("arg",
                                                                                 ExistentialMembership.Mode.CONTAINS,
                                                                                 "aby"), tree));
        Assert.assertFalse(ConstraintEvaluator.evaluate(new ExistentialMembership("arg",
                                                                                  ExistentialMembership.Mode.CONTAINS,
                                                                                  "zz"), tree));
    }

    @Test
    public void lengthRelation() {
        LengthRelation relation = new LengthRelation("arg", "name");
        Assert.assertTrue(ConstraintEvaluator.evaluate(relation, call("abc", "3")));
        Assert.assertFalse(ConstraintEvaluator.evaluate(relation, call("abc", "3", "4")));
        Assert.assertFalse(ConstraintEvaluator.evaluate(relation, call("abc", "three")));
    }

    @Test
    public void arithmeticRelationOverAllPairs() {
        DerivationNode tree = DerivationNode.nonTerminal("range",
                                                         leaf("low", "1"),
                                                         DerivationNode.terminal(".."),
                                                         leaf("high", "5"),
                                                         DerivationNode.terminal(".."),
                                                         leaf("high", "2"));
        Assert.assertTrue(ConstraintEvaluator.evaluate(new ArithmeticRelation("low", ComparisonOperator.LESS_EQUAL,
                                                                              "high"), tree));
        Assert.assertFalse(ConstraintEvaluator.evaluate(new ArithmeticRelation("high", ComparisonOperator.LESS_EQUAL,
                                                                               "low"), tree));
        Assert.assertFalse(ConstraintEvaluator.evaluate(new ArithmeticRelation("low", ComparisonOperator.EQUAL,
                                                                               "high"), tree));
    }

    @Test
    public void compositeConstraints() {
        StringEquality isSqrt = new StringEquality("name", "sqrt");
        NumericComparison negative = new NumericComparison("arg", ComparisonOperator.LESS_EQUAL, BigInteger.valueOf(-1));
        Conjunction both = new Conjunction(Arrays.asList(isSqrt, negative));
        Conjunction challenge = new Conjunction(Arrays.asList(new Negation(isSqrt), negative));

        Assert.assertTrue(ConstraintEvaluator.evaluate(both, call("sqrt", "-4")));
        Assert.assertFalse(ConstraintEvaluator.evaluate(both, call("sqrt", "4")));
        Assert.assertTrue(ConstraintEvaluator.evaluate(challenge, call("cos", "-4")));
        Assert.assertFalse(ConstraintEvaluator.evaluate(challenge, call("sqrt", "-4")));

        ConstraintEvaluator evaluator = new ConstraintEvaluator(call("sqrt", "-4"));
        Assert.assertTrue(evaluator.check(isSqrt));
        Assert.assertTrue(evaluator.check(negative));
        Assert.assertFalse(evaluator.check(new Negation(both)));
    }
}
