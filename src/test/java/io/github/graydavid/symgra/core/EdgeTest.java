package io.github.graydavid.symgra.core;

import static io.github.graydavid.symgra.core.TestData.DOUBLE;
import static io.github.graydavid.symgra.core.TestData.add;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.allOf;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.not;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Optional;

import org.junit.jupiter.api.Test;

public class EdgeTest {
    private final ValueNode x = DOUBLE.makeVariable("x");
    private final ApplicationNode consumer = add(x, x).getOwner().get();

    @Test
    public void toInputThrowsExceptionGivenNullConsumer() {
        assertThrows(NullPointerException.class, () -> Edge.toInput(null, 0));
    }

    @Test
    public void toInputThrowsExceptionGivenPositionOutsideOfConsumerInputs() {
        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class,
                () -> Edge.toInput(consumer, 2));

        assertThat(thrown.getMessage(), allOf(containsString("position 2"), containsString("only has 2 inputs")));
        assertThrows(IllegalArgumentException.class, () -> Edge.toInput(consumer, -1));
    }

    @Test
    public void toGraphOutputThrowsExceptionGivenNegativePosition() {
        assertThrows(IllegalArgumentException.class, () -> Edge.toGraphOutput(-1));
    }

    @Test
    public void accessorsExposeInputProperties() {
        Edge edge = Edge.toInput(consumer, 1);

        assertThat(edge.getConsumer(), is(Optional.of(consumer)));
        assertThat(edge.getPosition(), is(1));
        assertFalse(edge.isGraphOutput());
    }

    @Test
    public void accessorsExposeGraphOutputProperties() {
        Edge edge = Edge.toGraphOutput(3);

        assertTrue(edge.getConsumer().isEmpty());
        assertThat(edge.getPosition(), is(3));
        assertTrue(edge.isGraphOutput());
    }

    @Test
    public void equalsComparesConsumerIdentityAndPosition() {
        ApplicationNode otherConsumer = add(x, x).getOwner().get();

        assertThat(Edge.toInput(consumer, 0), equalTo(Edge.toInput(consumer, 0)));
        assertThat(Edge.toInput(consumer, 0).hashCode(), is(Edge.toInput(consumer, 0).hashCode()));
        assertThat(Edge.toInput(consumer, 0), not(equalTo(Edge.toInput(consumer, 1))));
        assertThat(Edge.toInput(consumer, 0), not(equalTo(Edge.toInput(otherConsumer, 0))));
        assertThat(Edge.toInput(consumer, 0), not(equalTo(Edge.toGraphOutput(0))));
        assertThat(Edge.toGraphOutput(0), equalTo(Edge.toGraphOutput(0)));
    }

    @Test
    public void toStringIncludesConsumerOperationAndPosition() {
        assertThat(Edge.toInput(consumer, 1).toString(), is("{add}->{1}"));
        assertThat(Edge.toGraphOutput(0).toString(), is("{output}->{0}"));
    }
}
