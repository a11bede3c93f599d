package de.constraintlib.datastructure.constraint;

import java.math.BigInteger;
import java.util.Arrays;

import com.google.common.collect.ImmutableSet;
import org.testng.Assert;
import org.testng.annotations.Test;

public class ConstraintTemplateTest {

    @Test
    public void rendering() {
        Assert.assertEquals(ConstraintTemplate.INT_LESS_EQUAL.bind("number", BigInteger.valueOf(-10)).render(),
                            "int(<number>) <= -10");
        Assert.assertEquals(ConstraintTemplate.STR_EQUAL.bind("function", "sqrt").render(),
                            "str(<function>) == 'sqrt'");
        Assert.assertEquals(ConstraintTemplate.EXISTS_STR_EQUAL.bind("digit", "7").render(),
                            "exists <elem> in <digit>: str(<elem>) == '7'");
        Assert.assertEquals(ConstraintTemplate.EXISTS_STR_CONTAINS.bind("word", "it's").render(),
                            "exists <elem> in <word>: 'it\\'s' in str(<elem>)");
        Assert.assertEquals(ConstraintTemplate.INT_EQUALS_LENGTH.bind("len", "payload").render(),
                            "int(<len>) == len(str(<payload>))");
        Assert.assertEquals(ConstraintTemplate.INT_LESS_EQUAL_INT.bind("a", "b").render(), "int(<a>) <= int(<b>)");
    }

    @Test
    public void compositeRendering() {
        Constraint number = ConstraintTemplate.INT_LESS_EQUAL.bind("number", BigInteger.valueOf(-10));
        Constraint function = ConstraintTemplate.STR_EQUAL.bind("function", "sqrt");
        Conjunction conjunction = new Conjunction(Arrays.asList(new Negation(number), function));

        Assert.assertEquals(conjunction.render(), "not (int(<number>) <= -10) and str(<function>) == 'sqrt'");
        Assert.assertEquals(conjunction.getNonTerminals(), ImmutableSet.of("number", "function"));
        Assert.assertFalse(conjunction.isAtomic());
        Assert.assertEquals(new Conjunction(Arrays.asList(conjunction, number)).getLiterals().size(), 3);
    }

    @Test
    public void equalityByRendering() {
        Constraint a = new StringEquality("function", "sqrt");
        Constraint b = ConstraintTemplate.STR_EQUAL.bind("function", "sqrt");
        Assert.assertEquals(a, b);
        Assert.assertEquals(a.hashCode(), b.hashCode());
        Assert.assertNotEquals(a, new StringEquality("function", "cos"));
    }

    @Test
    public void slots() {
        Assert.assertEquals(ConstraintTemplate.builtIns().size(), 9);
        Assert.assertEquals(ConstraintTemplate.INT_EQUALS_LENGTH.countSlots(PlaceholderType.NON_TERMINAL), 2);
        Assert.assertEquals(ConstraintTemplate.INT_EQUAL.countSlots(PlaceholderType.INTEGER), 1);
        Assert.assertEquals(ConstraintTemplate.EXISTS_STR_EQUAL.getKind(), TemplateKind.EXISTENTIAL_MEMBERSHIP);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void wrongSlotCount() {
        ConstraintTemplate.STR_EQUAL.bind("function");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void wrongSlotType() {
        ConstraintTemplate.INT_EQUAL.bind("number", "ten");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void nullBinding() {
        ConstraintTemplate.STR_EQUAL.bind("function", null);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void singleMemberConjunction() {
        new Conjunction(Arrays.asList(new StringEquality("function", "sqrt")));
    }
}
