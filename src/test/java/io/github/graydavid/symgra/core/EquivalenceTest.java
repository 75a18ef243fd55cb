package io.github.graydavid.symgra.core;

import static io.github.graydavid.symgra.core.TestData.DOUBLE;
import static io.github.graydavid.symgra.core.TestData.INT;
import static io.github.graydavid.symgra.core.TestData.MUL;
import static io.github.graydavid.symgra.core.TestData.add;
import static io.github.graydavid.symgra.core.TestData.constant;
import static io.github.graydavid.symgra.core.TestData.mul;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import io.github.graydavid.symgra.core.TestData.DivModOp;

public class EquivalenceTest {
    private final ValueNode x = DOUBLE.makeVariable("x");
    private final ValueNode y = DOUBLE.makeVariable("y");

    @Test
    public void throwsExceptionGivenNullArguments() {
        assertThrows(NullPointerException.class, () -> Equivalence.equalComputations(null, List.of()));
        assertThrows(NullPointerException.class, () -> Equivalence.equalComputations(List.of(), null));
    }

    @Test
    public void throwsExceptionGivenDifferentNumbersOfGraphs() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> Equivalence.equalComputations(List.of(x), List.of(x, y)));

        assertThat(thrown.getMessage(), containsString("1 vs. 2"));
    }

    @Test
    public void separatelyBuiltIdenticalComputationsAreEqual() {
        assertTrue(Equivalence.equalComputations(List.of(add(x, y)), List.of(add(x, y))));
    }

    @Test
    public void inputOrderMatters() {
        assertFalse(Equivalence.equalComputations(List.of(add(x, y)), List.of(add(y, x))));
    }

    @Test
    public void differentOperationsAreNotEqual() {
        assertFalse(Equivalence.equalComputations(List.of(add(x, y)), List.of(mul(x, y))));
    }

    @Test
    public void unownedNodesAreEqualOnlyToThemselves() {
        assertTrue(Equivalence.equalComputations(List.of(x), List.of(x)));
        assertFalse(Equivalence.equalComputations(List.of(x), List.of(y)));
    }

    @Test
    public void inputCorrespondenceMakesDifferentInputsEqual() {
        ValueNode x2 = DOUBLE.makeVariable("x2");
        ValueNode y2 = DOUBLE.makeVariable("y2");
        ValueNode first = mul(add(x, y), x);
        ValueNode second = mul(add(x2, y2), x2);

        assertTrue(Equivalence.equalComputations(List.of(first), List.of(second), List.of(x, y), List.of(x2, y2),
                true));
        assertFalse(Equivalence.equalComputations(List.of(first), List.of(second)));
        assertFalse(Equivalence.equalComputations(List.of(first), List.of(second), List.of(x, y), List.of(y2, x2),
                true));
    }

    @Test
    public void inputCorrespondenceCoversUnownedGraphs() {
        ValueNode x2 = DOUBLE.makeVariable("x2");

        assertTrue(Equivalence.equalComputations(List.of(x), List.of(x2), List.of(x), List.of(x2), true));
    }

    @Test
    public void inputCorrespondenceMustHaveMatchingSizes() {
        ValueNode x2 = DOUBLE.makeVariable("x2");

        assertFalse(Equivalence.equalComputations(List.of(add(x, y)), List.of(add(x2, y)), List.of(x, y),
                List.of(x2), true));
    }

    @Test
    public void inputCorrespondenceMustHaveMatchingTypeClasses() {
        ValueNode i = INT.makeVariable("i");

        assertFalse(Equivalence.equalComputations(List.of(add(x, y)), List.of(add(i, y)), List.of(x), List.of(i),
                true));
    }

    @Test
    public void graphsOfDifferentTypeClassesAreNotEqual() {
        ValueNode i = INT.makeVariable("i");

        assertFalse(Equivalence.equalComputations(List.of(x), List.of(i)));
    }

    @Test
    public void separateConstantsWithTheSameDataAreEqual() {
        assertTrue(Equivalence.equalComputations(List.of(add(x, constant(1.0))), List.of(add(x, constant(1.0)))));
        assertFalse(Equivalence.equalComputations(List.of(add(x, constant(1.0))), List.of(add(x, constant(2.0)))));
    }

    @Test
    public void topLevelConstantsAreComparedBySignature() {
        assertTrue(Equivalence.equalComputations(List.of(constant(2.0)), List.of(constant(2.0))));
        assertFalse(Equivalence.equalComputations(List.of(constant(2.0)), List.of(constant(3.0))));
    }

    @Test
    public void strictDtypeDecidesWhetherDifferentlyTypedConstantsAreEqual() {
        ValueNode withDouble = add(x, new ConstantNode(DOUBLE, 1.0));
        ValueNode withInt = add(x, new ConstantNode(INT, 1L));

        assertFalse(Equivalence.equalComputations(List.of(withDouble), List.of(withInt), List.of(), List.of(), true));
        assertTrue(Equivalence.equalComputations(List.of(withDouble), List.of(withInt), List.of(), List.of(), false));
    }

    @Test
    public void nonStrictDtypeStillComparesConstantValues() {
        ValueNode withDouble = add(x, new ConstantNode(DOUBLE, 1.5));
        ValueNode withInt = add(x, new ConstantNode(INT, 1L));

        assertFalse(Equivalence.equalComputations(List.of(withDouble), List.of(withInt), List.of(), List.of(), false));
    }

    @Test
    public void outputsAtDifferentIndexesAreNotEqual() {
        DivModOp divMod = new DivModOp();
        ApplicationNode first = divMod.makeNode(List.of(x, y));
        ApplicationNode second = divMod.makeNode(List.of(x, y));

        assertFalse(Equivalence.equalComputations(List.of(first.getOutputs().get(0)),
                List.of(second.getOutputs().get(1))));
        assertTrue(Equivalence.equalComputations(List.of(first.getOutputs().get(1)),
                List.of(second.getOutputs().get(1))));
    }

    @Test
    public void ownedAndUnownedNodesAreNotEqual() {
        assertFalse(Equivalence.equalComputations(List.of(add(x, y)), List.of(x)));
        assertFalse(Equivalence.equalComputations(List.of(x), List.of(add(x, y))));
    }

    @Test
    public void inputsFromOwnedAndUnownedNodesAreNotEqual() {
        assertFalse(Equivalence.equalComputations(List.of(add(add(x, y), y)), List.of(add(x, y))));
    }

    @Test
    public void sharedStructureEqualsSeparatelyBuiltStructure() {
        ValueNode shared = add(x, y);
        ValueNode usingShared = mul(shared, shared);
        ValueNode usingSeparate = mul(add(x, y), add(x, y));

        assertTrue(Equivalence.equalComputations(List.of(usingShared), List.of(usingSeparate)));
    }

    @Test
    public void multipleGraphsMustAllBeEqual() {
        ValueNode sum = add(x, y);

        assertTrue(Equivalence.equalComputations(List.of(sum, mul(sum, x)), List.of(add(x, y), mul(add(x, y), x))));
        assertFalse(Equivalence.equalComputations(List.of(sum, mul(sum, x)), List.of(add(x, y), mul(add(x, y), y))));
    }

    @Test
    public void differencesDeepInTheGraphAreFound() {
        ValueNode first = MUL.apply(add(add(x, y), y), x);
        ValueNode second = MUL.apply(add(add(y, x), y), x);

        assertFalse(Equivalence.equalComputations(List.of(first), List.of(second)));
    }

    @Test
    public void veryDeepChainsAreComparedWithoutOverflowingTheStack() {
        ValueNode first = x;
        ValueNode second = x;
        for (int i = 0; i < 20_000; ++i) {
            first = add(first, y);
            second = add(second, y);
        }

        assertTrue(Equivalence.equalComputations(List.of(first), List.of(second)));
    }

    @Test
    public void differenceAtTheBottomOfVeryDeepChainsIsFound() {
        ValueNode first = x;
        ValueNode second = y;
        for (int i = 0; i < 20_000; ++i) {
            first = add(first, y);
            second = add(second, y);
        }

        assertFalse(Equivalence.equalComputations(List.of(first), List.of(second)));
    }

    @Test
    public void knownDifferencesAreReusedAcrossGraphs() {
        ValueNode first = add(add(x, y), y);
        ValueNode second = add(add(y, x), y);

        assertFalse(Equivalence.equalComputations(List.of(mul(first, x), first), List.of(mul(second, x), second)));
        assertFalse(Equivalence.equalComputations(List.of(first, mul(first, x)), List.of(second, mul(second, x))));
    }

    @Test
    public void nominalsFromDifferentRegistriesWithTheSameSignatureAreEqual() {
        NominalNode first = new NominalRegistry().nominal(3, DOUBLE);
        NominalNode second = new NominalRegistry().nominal(3, DOUBLE);
        NominalNode other = new NominalRegistry().nominal(4, DOUBLE);

        assertTrue(Equivalence.equalComputations(List.of(add(x, first)), List.of(add(x, second))));
        assertFalse(Equivalence.equalComputations(List.of(add(x, first)), List.of(add(x, other))));
    }

    @Test
    public void topLevelNominalsAreComparedBySignature() {
        NominalNode first = new NominalRegistry().nominal(3, DOUBLE);
        NominalNode second = new NominalRegistry().nominal(3, DOUBLE);

        assertTrue(Equivalence.equalComputations(List.of(first), List.of(second)));
        assertFalse(Equivalence.equalComputations(List.of(first), List.of(new NominalRegistry().nominal(3, INT))));
    }

    @Test
    public void nominalsAndConstantsAreNeverEqual() {
        NominalNode nominal = new NominalRegistry().nominal(1, DOUBLE);

        assertFalse(Equivalence.equalComputations(List.of(add(x, nominal)), List.of(add(x, constant(1.0))), List.of(),
                List.of(), false));
    }

    @Test
    public void numericallyEqualComparesNumbersByValue() {
        assertTrue(Equivalence.numericallyEqual(1, 1L));
        assertTrue(Equivalence.numericallyEqual(1.0, 1L));
        assertTrue(Equivalence.numericallyEqual(1.5, 1.5f));
        assertFalse(Equivalence.numericallyEqual(1.5, 1L));
    }

    @Test
    public void numericallyEqualComparesArraysElementwise() {
        assertTrue(Equivalence.numericallyEqual(new double[] {1.0, 2.0}, new long[] {1, 2}));
        assertFalse(Equivalence.numericallyEqual(new double[] {1.0, 2.0}, new long[] {1, 3}));
        assertFalse(Equivalence.numericallyEqual(new double[] {1.0, 2.0}, new double[] {1.0}));
    }

    @Test
    public void numericallyEqualFallsBackToDeepEquals() {
        assertTrue(Equivalence.numericallyEqual("a", "a"));
        assertFalse(Equivalence.numericallyEqual("a", 1));
        assertTrue(Equivalence.numericallyEqual(null, null));
    }
}
