package io.github.graydavid.symgra.core;

import static io.github.graydavid.symgra.core.TestData.DOUBLE;
import static io.github.graydavid.symgra.core.TestData.add;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

public class CloneMemoTest {
    private final ValueNode x = DOUBLE.makeVariable("x");
    private final ValueNode replacement = DOUBLE.makeVariable("replacement");

    @Test
    public void emptyMemoReplacesNothing() {
        CloneMemo memo = CloneMemo.empty();

        assertFalse(memo.containsValue(x));
        assertTrue(memo.getValue(x).isEmpty());
        assertTrue(memo.getValues().isEmpty());
    }

    @Test
    public void withValuesSeedsReplacements() {
        CloneMemo memo = CloneMemo.withValues(Map.of(x, replacement));

        assertThat(memo.getValue(x).get(), sameInstance(replacement));
    }

    @Test
    public void putValueOverwritesButPutValueIfAbsentDoesnt() {
        ValueNode other = DOUBLE.makeVariable("other");
        CloneMemo memo = CloneMemo.empty();

        memo.putValue(x, replacement);
        memo.putValueIfAbsent(x, other);
        assertThat(memo.getValue(x).get(), sameInstance(replacement));

        memo.putValue(x, other);
        assertThat(memo.getValue(x).get(), sameInstance(other));
    }

    @Test
    public void applicationsAndOperationsAreRecordedSeparately() {
        ApplicationNode original = add(x, x).getOwner().get();
        ApplicationNode clone = add(replacement, replacement).getOwner().get();
        Operation clonedOperation = new TestData.ViewOp();
        CloneMemo memo = CloneMemo.empty();

        memo.putApplication(original, clone);
        memo.putOperationIfAbsent(original.getOperation(), clonedOperation);
        memo.putOperationIfAbsent(original.getOperation(), new TestData.ViewOp());

        assertThat(memo.getApplication(original).get(), sameInstance(clone));
        assertThat(memo.getOperation(original.getOperation()).get(), sameInstance(clonedOperation));
        assertThat(memo.getValues().size(), is(0));
    }

    @Test
    public void getValuesIsUnmodifiable() {
        CloneMemo memo = CloneMemo.empty();

        assertThrows(UnsupportedOperationException.class, () -> memo.getValues().put(x, replacement));
    }
}
