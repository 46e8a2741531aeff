/**
 *
 */
package org.theseed.crn.laws;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.linear.ArrayFieldVector;
import org.apache.commons.math3.linear.FieldVector;
import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
class ConservationBasisSearchTest {

    /**
     * @return a basis vector built from integers
     *
     * @param values	vector entries
     */
    private static FieldVector<BigFraction> vec(int... values) {
        BigFraction[] entries = new BigFraction[values.length];
        for (int i = 0; i < values.length; i++)
            entries[i] = new BigFraction(values[i]);
        return new ArrayFieldVector<BigFraction>(entries, false);
    }

    @Test
    void testCombinationOrder() {
        List<String> found = new ArrayList<String>();
        int[] combo = ConservationBasisSearch.firstCombination(2);
        while (combo != null) {
            found.add(combo[0] + "" + combo[1]);
            combo = ConservationBasisSearch.nextCombination(combo, 4);
        }
        assertThat(found, contains("01", "02", "03", "12", "13", "23"));
        combo = ConservationBasisSearch.firstCombination(3);
        assertThat(combo, equalTo(new int[] { 0, 1, 2 }));
        combo = ConservationBasisSearch.nextCombination(combo, 3);
        assertThat(combo, nullValue());
    }

    @Test
    void testSeedsOnly() throws BasisSearchException {
        ConservationBasisSearch search = new ConservationBasisSearch(List.of(vec(1, 1, 0, 0), vec(0, 0, 1, 1)), 4);
        List<int[]> laws = search.search();
        assertThat(laws.size(), equalTo(2));
        assertThat(laws.get(0), equalTo(new int[] { 1, 1, 0, 0 }));
        assertThat(laws.get(1), equalTo(new int[] { 0, 0, 1, 1 }));
        assertThat(search.getTested(), equalTo(0));
    }

    @Test
    void testCombinations() throws BasisSearchException {
        // This is the enzyme basis:  the second vector must be combined with the first.
        ConservationBasisSearch search = new ConservationBasisSearch(List.of(vec(1, 0, 1, 0), vec(-1, 1, 0, 1)), 4);
        List<int[]> laws = search.search();
        assertThat(laws.size(), equalTo(2));
        assertThat(laws.get(0), equalTo(new int[] { 1, 0, 1, 0 }));
        assertThat(laws.get(1), equalTo(new int[] { 0, 1, 1, 1 }));
        assertThat(search.getTested(), equalTo(1));
    }

    @Test
    void testSupersetRejected() throws BasisSearchException {
        // The first combination is a superset of the first seed, so the second one must be used.
        ConservationBasisSearch search = new ConservationBasisSearch(List.of(vec(1, 1, 0, 0), vec(0, 0, 1, 0),
                vec(-1, -1, 0, 1)), 4);
        List<int[]> laws = search.search();
        assertThat(laws.size(), equalTo(3));
        assertThat(laws.get(2), equalTo(new int[] { 0, 0, 0, 1 }));
        assertThat(search.getTested(), equalTo(2));
    }

    @Test
    void testFractions() {
        // Two half-vectors combine into a law, but no second law can be formed.
        BigFraction half = new BigFraction(1, 2);
        FieldVector<BigFraction> v1 = new ArrayFieldVector<BigFraction>(new BigFraction[] { half, half, BigFraction.ZERO }, false);
        FieldVector<BigFraction> v2 = new ArrayFieldVector<BigFraction>(new BigFraction[] { half, half.negate(), BigFraction.ONE }, false);
        ConservationBasisSearch search = new ConservationBasisSearch(List.of(v1, v2), 3);
        BasisSearchException e = assertThrows(BasisSearchException.class, () -> search.search());
        assertThat(e.getFound(), equalTo(1));
        assertThat(e.getRequired(), equalTo(2));
        assertThat(search.getTested(), equalTo(1));
    }

    @Test
    void testExhausted() {
        ConservationBasisSearch search = new ConservationBasisSearch(List.of(vec(2, 1)), 2);
        BasisSearchException e = assertThrows(BasisSearchException.class, () -> search.search());
        assertThat(e.getFound(), equalTo(0));
        assertThat(e.getRequired(), equalTo(1));
    }

    @Test
    void testBadWidth() {
        assertThrows(IllegalArgumentException.class, () -> new ConservationBasisSearch(List.of(vec(1, 1)), 3));
    }

}
