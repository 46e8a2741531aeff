/**
 *
 */
package org.theseed.crn.laws;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.fraction.BigFractionField;
import org.apache.commons.math3.linear.Array2DRowFieldMatrix;
import org.apache.commons.math3.linear.FieldMatrix;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.crn.NetworkFormatException;
import org.theseed.crn.ReactionNetwork;
import org.theseed.crn.SpeciesOrder;
import org.theseed.crn.StoichiometricMatrix;

/**
 * @author Bruce Parrello
 *
 */
public class ConservationAnalysisTest {

    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ConservationAnalysisTest.class);

    /** two enzymes sharing a substrate cycle */
    private static final List<String> CYCLE = List.of("E + S -> ES", "ES -> E + P", "F + P -> FP", "FP -> F + S");

    /**
     * @return a network built from formulas
     *
     * @param id			network ID
     * @param formulas		reaction formulas
     *
     * @throws NetworkFormatException
     */
    private static ReactionNetwork build(String id, List<String> formulas) throws NetworkFormatException {
        ReactionNetwork retVal = new ReactionNetwork(id);
        for (String formula : formulas)
            retVal.addReaction(formula);
        return retVal;
    }

    /**
     * Verify the structural properties of a canonical basis.
     *
     * @param analysis	analysis to check
     */
    private static void checkBasis(ConservationAnalysis analysis) {
        StoichiometricMatrix matrix = analysis.getMatrix();
        List<int[]> basis = analysis.getBasis();
        final int m = matrix.getSpeciesCount();
        assertThat(basis.size(), equalTo(analysis.getRawBasis().size()));
        assertThat(analysis.getLaws().size(), equalTo(basis.size()));
        List<BitSet> supports = new ArrayList<BitSet>();
        int lastFirst = -1;
        for (int[] law : basis) {
            assertThat(law.length, equalTo(m));
            BitSet support = new BitSet(m);
            for (int i = 0; i < m; i++) {
                assertThat(law[i], anyOf(equalTo(0), equalTo(1)));
                if (law[i] == 1)
                    support.set(i);
            }
            assertThat("Empty law.", ! support.isEmpty());
            assertThat("Law not conserved.", matrix.isConserved(law));
            int first = support.nextSetBit(0);
            assertThat(first, greaterThanOrEqualTo(lastFirst));
            lastFirst = first;
            supports.add(support);
        }
        for (int i = 0; i < supports.size(); i++) {
            for (int j = 0; j < supports.size(); j++) {
                if (i != j) {
                    BitSet leftover = (BitSet) supports.get(j).clone();
                    leftover.andNot(supports.get(i));
                    assertThat("Law " + i + " contains law " + j + ".", ! leftover.isEmpty());
                }
            }
        }
        if (! basis.isEmpty()) {
            FieldMatrix<BigFraction> rows = new Array2DRowFieldMatrix<BigFraction>(BigFractionField.getInstance(),
                    basis.size(), m);
            for (int r = 0; r < basis.size(); r++) {
                for (int i = 0; i < m; i++)
                    rows.setEntry(r, i, new BigFraction(basis.get(r)[i]));
            }
            assertThat(new NullSpaceSolver.Echelon(rows).rank(), equalTo(basis.size()));
        }
    }

    /**
     * @return the conservation laws as sets of species names
     *
     * @param analysis	analysis whose laws are desired
     */
    private static Set<Set<String>> lawSets(ConservationAnalysis analysis) {
        return analysis.getLaws().stream().map(x -> Set.copyOf(x.getTerms())).collect(Collectors.toSet());
    }

    @Test
    public void testChain() throws IOException, NetworkFormatException, BasisSearchException {
        ConservationAnalysis analysis = new ConservationAnalysis(ReactionNetwork.load(new File("data", "chain.json")));
        assertThat("No laws found.", analysis.hasLaws());
        assertThat(analysis.getLawCount(), equalTo(1));
        assertThat(analysis.getLaws().get(0).toString(), equalTo("A + B + C = T1"));
        assertThat(analysis.getLeftSides(), contains("A + B + C"));
        assertThat(analysis.getTotals(), contains("T1"));
        assertThat(analysis.getBasis().get(0), equalTo(new int[] { 1, 1, 1 }));
        checkBasis(analysis);
    }

    @Test
    public void testIsomers() throws IOException, NetworkFormatException, BasisSearchException {
        ReactionNetwork network = ReactionNetwork.load(new File("data", "isomers.json"));
        ConservationAnalysis analysis = new ConservationAnalysis(network, SpeciesOrder.DECLARED, false);
        List<String> laws = analysis.getLaws().stream().map(x -> x.toString()).collect(Collectors.toList());
        assertThat(laws, contains("X + Y = T1", "Z + W = T2"));
        assertThat(analysis.getMatrix().getColumnCount(), equalTo(4));
        checkBasis(analysis);
        ConservationAnalysis analysis2 = new ConservationAnalysis(network);
        laws = analysis2.getLaws().stream().map(x -> x.toString()).collect(Collectors.toList());
        assertThat(laws, contains("W + Z = T1", "X + Y = T2"));
        assertThat(lawSets(analysis2), equalTo(lawSets(analysis)));
        checkBasis(analysis2);
    }

    @Test
    public void testEnzyme() throws IOException, NetworkFormatException, BasisSearchException {
        ReactionNetwork network = ReactionNetwork.load(new File("data", "enzyme.json"));
        ConservationAnalysis analysis = new ConservationAnalysis(network);
        List<String> laws = analysis.getLaws().stream().map(x -> x.toString()).collect(Collectors.toList());
        assertThat(laws, contains("X1 + X3 = T1", "X2 + X3 + X4 = T2"));
        assertThat(analysis.getLaws().get(1).getFirstRow(), equalTo(1));
        checkBasis(analysis);
        analysis = new ConservationAnalysis(network, SpeciesOrder.AUTO, true);
        assertThat(analysis.getLeftSides(), contains("x1 + x3", "x2 + x3 + x4"));
        StringWriter buffer = new StringWriter();
        try (PrintWriter writer = new PrintWriter(buffer)) {
            analysis.writeBasis(writer);
            analysis.writeRawBasis(writer);
        }
        String[] lines = buffer.toString().split("\\R");
        assertThat(lines[0], equalTo("species\tT1\tT2"));
        assertThat(lines[3], equalTo("X3\t1\t1"));
        assertThat(lines[5], equalTo("species\tw1\tw2"));
        assertThat(lines[6], equalTo("X1\t1\t-1"));
    }

    @Test
    public void testCycle() throws NetworkFormatException, BasisSearchException {
        ConservationAnalysis analysis = new ConservationAnalysis(build("cycle", CYCLE));
        List<String> laws = analysis.getLaws().stream().map(x -> x.toString()).collect(Collectors.toList());
        assertThat(laws, contains("E + ES = T1", "ES + FP + P + S = T2", "F + FP = T3"));
        checkBasis(analysis);
        List<ConservationLaw> found = analysis.getLaws();
        assertThrows(UnsupportedOperationException.class, () -> found.remove(0));
        assertThrows(UnsupportedOperationException.class, () -> found.clear());
        assertThat(analysis.getLawCount(), equalTo(3));
    }

    @Test
    public void testNoLaws() throws IOException, NetworkFormatException, BasisSearchException {
        ConservationAnalysis analysis = new ConservationAnalysis(ReactionNetwork.load(new File("data", "nolaws.json")));
        assertThat("Laws found.", ! analysis.hasLaws());
        assertThat(analysis.getLawCount(), equalTo(0));
        assertThat(analysis.getBasis(), empty());
        assertThat(analysis.getLaws(), empty());
        assertThat(analysis.getLeftSides(), empty());
        assertThat(analysis.getTotals(), empty());
        assertThat(analysis.getRawBasis(), empty());
        assertThat(analysis.getMatrix().getColumnCount(), equalTo(4));
        StringWriter buffer = new StringWriter();
        try (PrintWriter writer = new PrintWriter(buffer)) {
            analysis.writeLaws(writer);
        }
        assertThat(buffer.toString().trim(), equalTo("inflow has no conservation laws."));
    }

    @Test
    public void testFailures() throws IOException, NetworkFormatException {
        ReactionNetwork dimer = ReactionNetwork.load(new File("data", "dimer.json"));
        BasisSearchException e = assertThrows(BasisSearchException.class, () -> new ConservationAnalysis(dimer));
        assertThat(e.getRequired(), equalTo(1));
        ReactionNetwork empty = ReactionNetwork.load(new File("data", "empty.json"));
        NetworkFormatException e2 = assertThrows(NetworkFormatException.class, () -> new ConservationAnalysis(empty));
        assertThat(e2.getKind(), equalTo(NetworkFormatException.Kind.EMPTY_NETWORK));
        ReactionNetwork mixed = build("mixed", List.of("X1 -> ATP"));
        e2 = assertThrows(NetworkFormatException.class,
                () -> new ConservationAnalysis(mixed, SpeciesOrder.NUMERIC_SUFFIX, false));
        assertThat(e2.getKind(), equalTo(NetworkFormatException.Kind.UNORDERED_SPECIES));
    }

    @Test
    public void testReversibility() throws NetworkFormatException, BasisSearchException {
        List<String> reversed = CYCLE.stream().map(x -> x.replace("->", "<->")).collect(Collectors.toList());
        ConservationAnalysis forward = new ConservationAnalysis(build("fwd", CYCLE));
        ConservationAnalysis both = new ConservationAnalysis(build("rev", reversed));
        assertThat(both.getMatrix().getColumnCount(), equalTo(forward.getMatrix().getColumnCount() + CYCLE.size()));
        List<String> laws1 = forward.getLaws().stream().map(x -> x.toString()).collect(Collectors.toList());
        List<String> laws2 = both.getLaws().stream().map(x -> x.toString()).collect(Collectors.toList());
        assertThat(laws2, equalTo(laws1));
        // Making a single reaction reversible adds one column.
        List<String> oneReversed = new ArrayList<String>(CYCLE);
        oneReversed.set(1, "ES <-> E + P");
        ConservationAnalysis one = new ConservationAnalysis(build("one", oneReversed));
        assertThat(one.getMatrix().getColumnCount(), equalTo(forward.getMatrix().getColumnCount() + 1));
        assertThat(lawSets(one), equalTo(lawSets(forward)));
    }

    @Test
    public void testPermutations() throws NetworkFormatException, BasisSearchException {
        Set<Set<String>> expected = lawSets(new ConservationAnalysis(build("cycle", CYCLE)));
        Random rand = new Random(1234);
        Set<List<String>> orders = new HashSet<List<String>>();
        for (int i = 0; i < 10; i++) {
            List<String> shuffled = new ArrayList<String>(CYCLE);
            Collections.shuffle(shuffled, rand);
            orders.add(shuffled);
            ConservationAnalysis analysis = new ConservationAnalysis(build("shuffle" + i, shuffled));
            assertThat(shuffled.toString(), lawSets(analysis), equalTo(expected));
            checkBasis(analysis);
        }
        log.info("{} distinct reaction orders tested.", orders.size());
    }

}
