package io.github.graydavid.symgra.core;

import static io.github.graydavid.symgra.core.TestData.DOUBLE;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class TagTest {
    @Test
    public void emptyTagHasNoKeys() {
        Tag tag = Tag.empty();

        assertThat(tag.keys(), empty());
        assertThat(tag.get("anything").isPresent(), is(false));
        assertThat(tag.contains("anything"), is(false));
    }

    @Test
    public void putStoresValuesUnderKeys() {
        Tag tag = Tag.empty();

        tag.put("trace", "here");
        tag.put("count", 2);

        assertEquals("here", tag.get("trace").get());
        assertEquals(2, tag.get("count").get());
        assertThat(tag.contains("trace"), is(true));
        assertThat(tag.keys(), containsInAnyOrder("trace", "count"));
    }

    @Test
    public void removeDeletesKeys() {
        Tag tag = Tag.empty();
        tag.put("trace", "here");

        tag.remove("trace");

        assertThat(tag.contains("trace"), is(false));
    }

    @Test
    public void validatingTagFiltersValuesOfValidatedKey() {
        Tag tag = Tag.validating("value", DOUBLE::filter);

        tag.put("value", 3);
        tag.put("other", 3);

        assertEquals(3.0, tag.get("value").get());
        assertEquals(3, tag.get("other").get());
    }

    @Test
    public void validatingTagRejectsInvalidValuesWithoutChangingTag() {
        Tag tag = Tag.validating("value", DOUBLE::filter);
        tag.put("value", 1.0);

        assertThrows(IllegalArgumentException.class, () -> tag.put("value", "not a number"));

        assertEquals(1.0, tag.get("value").get());
    }

    @Test
    public void copyIsIndependentButKeepsValidators() {
        Tag tag = Tag.validating("value", DOUBLE::filter);
        tag.put("value", 1.0);

        Tag copy = tag.copy();
        copy.put("value", 2);

        assertEquals(1.0, tag.get("value").get());
        assertEquals(2.0, copy.get("value").get());
        assertThrows(IllegalArgumentException.class, () -> copy.put("value", "not a number"));
    }

    @Test
    public void updatePutsAllOfOthersEntriesAndReturnsThis() {
        Tag tag = Tag.validating("value", DOUBLE::filter);
        Tag other = Tag.empty();
        other.put("value", 4);
        other.put("trace", "there");

        Tag updated = tag.update(other);

        assertThat(updated, sameInstance(tag));
        assertEquals(4.0, tag.get("value").get());
        assertEquals("there", tag.get("trace").get());
    }

    @Test
    public void putThrowsExceptionGivenNullKey() {
        assertThrows(NullPointerException.class, () -> Tag.empty().put(null, 1));
    }
}
