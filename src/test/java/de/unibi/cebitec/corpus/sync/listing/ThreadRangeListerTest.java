package de.unibi.cebitec.corpus.sync.listing;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import de.unibi.cebitec.corpus.sync.model.ObjectDescriptor;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class ThreadRangeListerTest {

    private static List<String> keys(ListingResult result) {
        List<String> keys = new ArrayList<>();
        for (ObjectDescriptor descriptor : result.getObjects()) {
            keys.add(descriptor.getKey());
        }
        return keys;
    }

    @Test
    void listsConsecutiveZeroPaddedArchives() throws InvalidThreadRangeException {
        ListingResult result = ThreadRangeLister.startingAt(8).list("https://example.org/zipfiles/", "", 3);
        assertEquals(Arrays.asList("008.zip", "009.zip", "010.zip"), keys(result));
        assertFalse(result.isPartial());
    }

    @Test
    void clampsCountToTheEndOfTheRange() throws InvalidThreadRangeException {
        ListingResult result = ThreadRangeLister.startingAt(998).list("", "", 10);
        assertEquals(Arrays.asList("998.zip", "999.zip"), keys(result));
    }

    @Test
    void unboundedCoversTheRestOfTheRange() throws InvalidThreadRangeException {
        assertEquals(10, ThreadRangeLister.startingAt(990).list("", "", ObjectLister.UNBOUNDED).getObjects().size());
        assertEquals(1000, ThreadRangeLister.effectiveCount(0, ObjectLister.UNBOUNDED));
        assertEquals(0, ThreadRangeLister.startingAt(0).list("", "", 0).getObjects().size());
    }

    @Test
    void rejectsStartOutsideTheRange() {
        assertThrows(InvalidThreadRangeException.class, () -> ThreadRangeLister.startingAt(1000));
        assertThrows(InvalidThreadRangeException.class, () -> ThreadRangeLister.startingAt(-1));
    }

    @Test
    void formatsKeys() {
        assertEquals("000.zip", ThreadRangeLister.keyOf(0));
        assertEquals("042.zip", ThreadRangeLister.keyOf(42));
        assertEquals("999.zip", ThreadRangeLister.keyOf(999));
    }

    @Test
    void prependsPrefix() throws InvalidThreadRangeException {
        ListingResult result = ThreadRangeLister.startingAt(1).list("", "zipfiles/", 1);
        assertEquals(Arrays.asList("zipfiles/001.zip"), keys(result));
    }
}
