package io.github.graydavid.symgra.link;

import static io.github.graydavid.symgra.core.TestData.DOUBLE;
import static io.github.graydavid.symgra.core.TestData.INT;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import io.github.graydavid.symgra.core.StorageCell;
import io.github.graydavid.symgra.core.Type;
import io.github.graydavid.symgra.core.ValueNode;

public class ContainerTest {
    private final StorageCell cell = new StorageCell();

    @Test
    public void builderThrowsExceptionGivenNullArguments() {
        assertThrows(NullPointerException.class, () -> Container.builder((Type) null, cell));
        assertThrows(NullPointerException.class, () -> Container.builder(DOUBLE, null));
        assertThrows(NullPointerException.class, () -> Container.builder((ValueNode) null, cell));
    }

    @Test
    public void builderFromNodeUsesNodeTypeAndName() {
        ValueNode x = DOUBLE.makeVariable("x");

        Container container = Container.builder(x, cell).build();

        assertThat(container.getType(), is(DOUBLE));
        assertThat(container.getName(), is("x"));
        assertThat(container.getStorage(), sameInstance(cell));
        assertFalse(container.isReadonly());
    }

    @Test
    public void builderFromUnnamedNodeHasNoName() {
        Container container = Container.builder(DOUBLE.makeVariable(), cell).build();

        assertNull(container.getName());
    }

    @Test
    public void setFiltersValueIntoStorage() {
        Container container = Container.builder(DOUBLE, cell).build();

        container.set(1);

        assertEquals(1.0, container.get());
        assertEquals(1.0, cell.get());
    }

    @Test
    public void setNullClearsStorage() {
        Container container = Container.builder(DOUBLE, new StorageCell(2.0)).build();

        container.set(null);

        assertNull(container.get());
    }

    @Test
    public void strictContainerRejectsNonCanonicalValues() {
        Container container = Container.builder(DOUBLE, cell).name("x").strict().build();

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, () -> container.set(1));

        assertThat(thrown.getMessage(), containsString("(Container name 'x')"));
        assertTrue(cell.isEmpty());
    }

    @Test
    public void allowDowncastPermitsLossyConversions() {
        Container strict = Container.builder(INT, cell).build();
        Container lossy = Container.builder(INT, cell).allowDowncast().build();

        assertThrows(IllegalArgumentException.class, () -> strict.set(1.5));
        lossy.set(1.5);

        assertEquals(1L, cell.get());
    }

    @Test
    public void readonlyContainerCannotBeSet() {
        Container container = Container.builder(DOUBLE, new StorageCell(2.0)).name("out").readonly().build();

        IllegalStateException thrown = assertThrows(IllegalStateException.class, () -> container.set(1.0));

        assertThat(thrown.getMessage(), containsString("out"));
        assertTrue(container.isReadonly());
        assertEquals(2.0, container.get());
    }

    @Test
    public void toStringDescribesStorage() {
        Container container = Container.builder(DOUBLE, new StorageCell(2.0)).build();

        assertThat(container.toString(), is("<2.0>"));
    }
}
