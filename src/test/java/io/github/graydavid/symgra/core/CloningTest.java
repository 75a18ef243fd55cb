package io.github.graydavid.symgra.core;

import static io.github.graydavid.symgra.core.TestData.DOUBLE;
import static io.github.graydavid.symgra.core.TestData.INT;
import static io.github.graydavid.symgra.core.TestData.add;
import static io.github.graydavid.symgra.core.TestData.mul;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import io.github.graydavid.symgra.core.TestData.InnerGraphOp;

public class CloningTest {
    private final ValueNode x = DOUBLE.makeVariable("x");
    private final ConstantNode one = TestData.constant(1);
    // x -> add -> m -> mul -> o
    private final ValueNode m = add(x, one);
    private final ValueNode o = mul(m, x);

    @Test
    public void cloneCopiesInputsAndEverythingBetween() {
        ClonedGraph cloned = Cloning.clone(List.of(x), List.of(o));

        ValueNode clonedX = cloned.getInputs().get(0);
        ValueNode clonedO = cloned.getOutputs().get(0);
        assertThat(clonedX, not(sameInstance(x)));
        assertThat(clonedX.getName().get(), is("x"));
        assertThat(clonedO, not(sameInstance(o)));
        ApplicationNode clonedMul = clonedO.getOwner().get();
        ValueNode clonedM = clonedMul.getInputs().get(0);
        assertThat(clonedM, not(sameInstance(m)));
        assertThat(clonedMul.getInputs().get(1), sameInstance(clonedX));
        assertThat(clonedM.getOwner().get().getInputs(), contains(clonedX, one));
        assertThat(Equivalence.equalComputations(List.of(o), List.of(clonedO), List.of(x), List.of(clonedX), true),
                is(true));
    }

    @Test
    public void cloneLeavesOriginalUntouched() {
        ApplicationNode mulNode = o.getOwner().get();

        Cloning.clone(List.of(x), List.of(o));

        assertThat(o.getOwner().get(), sameInstance(mulNode));
        assertThat(mulNode.getInputs(), contains(m, x));
        assertThat(x.hasOwner(), is(false));
    }

    @Test
    public void cloneCanKeepInputs() {
        ClonedGraph cloned = Cloning.clone(List.of(x), List.of(o), false);

        assertThat(cloned.getInputs().get(0), sameInstance(x));
        assertThat(cloned.getOutputs().get(0), not(sameInstance(o)));
        assertThat(cloned.getOutputs().get(0).getOwner().get().getInputs().get(1), sameInstance(x));
    }

    @Test
    public void clonePreservesSharing() {
        ValueNode shared = add(x, x);
        ValueNode output = mul(shared, shared);

        ValueNode clonedOutput = Cloning.clone(List.of(x), List.of(output)).getOutputs().get(0);

        List<ValueNode> clonedInputs = clonedOutput.getOwner().get().getInputs();
        assertThat(clonedInputs.get(0), sameInstance(clonedInputs.get(1)));
        assertThat(clonedInputs.get(0), not(sameInstance(shared)));
    }

    @Test
    public void cloneCopiesOrphansOnlyIfRequested() {
        ValueNode orphan = DOUBLE.makeVariable("orphan");
        ValueNode output = add(x, orphan);

        ValueNode withCopiedOrphans = Cloning.clone(List.of(x), List.of(output), true, true, false)
                .getOutputs()
                .get(0);
        ValueNode withKeptOrphans = Cloning.clone(List.of(x), List.of(output), true, false, false)
                .getOutputs()
                .get(0);

        assertThat(withCopiedOrphans.getOwner().get().getInputs().get(1), not(sameInstance(orphan)));
        assertThat(withKeptOrphans.getOwner().get().getInputs().get(1), sameInstance(orphan));
    }

    @Test
    public void cloneNeverCopiesConstants() {
        ClonedGraph cloned = Cloning.clone(List.of(one), List.of(o), true, true, false);

        assertThat(cloned.getInputs().get(0), sameInstance((ValueNode) one));
    }

    @Test
    public void cloneGetEquivSubstitutesSeededReplacements() {
        ValueNode w = DOUBLE.makeVariable("w");

        CloneMemo memo = Cloning.cloneGetEquiv(List.of(x), List.of(o), false, false,
                CloneMemo.withValues(Map.of(x, w)), false);

        ValueNode substituted = memo.getValue(o).get();
        assertThat(memo.getValue(x).get(), sameInstance(w));
        assertThat(substituted.getOwner().get().getInputs().get(1), sameInstance(w));
        assertThat(GraphTraversals.variableDependsOn(substituted, x), is(false));
        assertThat(memo.getApplication(o.getOwner().get()).get(), sameInstance(substituted.getOwner().get()));
    }

    @Test
    public void cloneGetEquivConvertsSubstitutesInStrictMode() {
        ValueNode i = INT.makeVariable("i");

        CloneMemo memo = Cloning.cloneGetEquiv(List.of(x), List.of(m), false, false,
                CloneMemo.withValues(Map.of(x, i)), false, true);

        ValueNode substituted = memo.getValue(m).get();
        assertThat(substituted.getType(), is(DOUBLE));
        assertThat(GraphTraversals.variableDependsOn(substituted, i), is(true));
        assertThat(substituted.getOwner().get().getInputs().get(0), not(sameInstance(i)));
    }

    @Test
    public void cloneGetEquivRebuildsNodesInNonStrictMode() {
        ValueNode i = INT.makeVariable("i");
        ValueNode sum = add(x, x);

        CloneMemo memo = Cloning.cloneGetEquiv(List.of(x), List.of(sum), false, false,
                CloneMemo.withValues(Map.of(x, i)), false, false);
        ValueNode substituted = memo.getValue(sum).get();

        assertThat(substituted.getType(), is(INT));
        assertThat(substituted.getOwner().get().getInputs(), contains(i, i));
    }

    @Test
    public void cloneNodeAndCacheThrowsExceptionGivenMissingReplacements() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> Cloning.cloneNodeAndCache(m.getOwner().get(), CloneMemo.empty(), false, true));

        assertThat(thrown.getMessage(), containsString("has no replacement"));
    }

    @Test
    public void cloneNodeAndCacheSkipsNodesWhoseOutputsAreReplaced() {
        CloneMemo memo = CloneMemo.withValues(Map.of(m, DOUBLE.makeVariable()));

        Optional<ApplicationNode> cloned = Cloning.cloneNodeAndCache(m.getOwner().get(), memo, false, true);

        assertThat(cloned.isPresent(), is(false));
    }

    @Test
    public void cloneCanCloneInnerGraphsOncePerOperation() {
        ValueNode innerInput = DOUBLE.makeVariable("p");
        InnerGraphOp operation = new InnerGraphOp(List.of(innerInput), List.of(add(innerInput, innerInput)));
        ValueNode first = operation.makeNode(List.of(x)).defaultOutput();
        ValueNode second = operation.makeNode(List.of(first)).defaultOutput();

        ValueNode deep = Cloning.clone(List.of(x), List.of(second), true, true, true).getOutputs().get(0);
        ValueNode shallow = Cloning.clone(List.of(x), List.of(second), true, true, false).getOutputs().get(0);

        Operation deepSecondOperation = deep.getOwner().get().getOperation();
        Operation deepFirstOperation = deep.getOwner().get().getInputs().get(0).getOwner().get().getOperation();
        assertThat(deepSecondOperation, not(sameInstance((Operation) operation)));
        assertThat(deepFirstOperation, sameInstance(deepSecondOperation));
        assertThat(shallow.getOwner().get().getOperation(), sameInstance((Operation) operation));
    }

    @Test
    public void replaceNominalsWithDummiesReplacesOnlyNominalInputs() {
        NominalNode nominal = new NominalRegistry().nominal(0, DOUBLE);
        ValueNode y = DOUBLE.makeVariable("y");
        ValueNode output = add(nominal, y);

        ClonedGraph replaced = Cloning.replaceNominalsWithDummies(List.of(nominal, y), List.of(output));

        ValueNode dummy = replaced.getInputs().get(0);
        assertThat(dummy.getKind(), is(ValueNode.Kind.VARIABLE));
        assertThat(dummy.getType(), is(DOUBLE));
        assertThat(replaced.getInputs().get(1), sameInstance(y));
        assertThat(replaced.getOutputs().get(0).getOwner().get().getInputs(), contains(dummy, y));
    }

    @Test
    public void replaceNominalsWithDummiesReturnsGraphUnchangedWithoutNominals() {
        ClonedGraph replaced = Cloning.replaceNominalsWithDummies(List.of(x), List.of(o));

        assertThat(replaced.getInputs(), contains(x));
        assertThat(replaced.getOutputs(), contains(o));
    }
}
