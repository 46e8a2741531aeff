/**
 *
 */
package org.theseed.crn;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * @author Bruce Parrello
 *
 */
class SpeciesOrderTest {

    @Test
    void testSuffixes() {
        assertThat(SpeciesOrder.suffixOf("X1"), equalTo(1L));
        assertThat(SpeciesOrder.suffixOf("X10"), equalTo(10L));
        assertThat(SpeciesOrder.suffixOf("atp_2"), equalTo(2L));
        assertThat(SpeciesOrder.suffixOf("ATP"), equalTo(-1L));
        assertThat(SpeciesOrder.suffixOf("12"), equalTo(-1L));
        assertThat(SpeciesOrder.suffixOf("X1a"), equalTo(-1L));
    }

    @Test
    void testOrders() throws NetworkFormatException {
        List<String> numbered = List.of("X10", "X2", "Y1", "X1");
        assertThat(SpeciesOrder.LEXICOGRAPHIC.sort(numbered), contains("X1", "X10", "X2", "Y1"));
        assertThat(SpeciesOrder.NUMERIC_SUFFIX.sort(numbered), contains("X1", "Y1", "X2", "X10"));
        assertThat(SpeciesOrder.AUTO.sort(numbered), contains("X1", "Y1", "X2", "X10"));
        assertThat(SpeciesOrder.DECLARED.sort(numbered), contains("X10", "X2", "Y1", "X1"));
        List<String> mixed = List.of("X2", "ATP", "X1");
        assertThat(SpeciesOrder.AUTO.sort(mixed), contains("ATP", "X1", "X2"));
        NetworkFormatException e = assertThrows(NetworkFormatException.class,
                () -> SpeciesOrder.NUMERIC_SUFFIX.sort(mixed));
        assertThat(e.getKind(), equalTo(NetworkFormatException.Kind.UNORDERED_SPECIES));
    }

    @Test
    void testIndex() throws IOException, NetworkFormatException {
        ReactionNetwork network = ReactionNetwork.load(new File("data", "isomers.json"));
        SpeciesIndex index = new SpeciesIndex(network, SpeciesOrder.AUTO);
        assertThat(index.getNames(), contains("W", "X", "Y", "Z"));
        assertThat(index.size(), equalTo(4));
        assertThat(index.indexOf("Y"), equalTo(2));
        assertThat(index.indexOf("Q"), equalTo(-1));
        assertThat(index.get(3), equalTo("Z"));
        index = new SpeciesIndex(network, SpeciesOrder.DECLARED);
        assertThat(index.getNames(), contains("X", "Y", "Z", "W"));
        assertThrows(IllegalArgumentException.class, () -> new SpeciesIndex(List.of("A", "B", "A")));
    }

}
