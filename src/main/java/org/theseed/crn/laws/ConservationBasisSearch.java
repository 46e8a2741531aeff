/**
 *
 */
package org.theseed.crn.laws;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.linear.FieldVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object converts an arbitrary basis of the left null space of a stoichiometric matrix into
 * a basis whose vectors contain only zeroes and ones.  Each such vector is a conservation law:  the
 * total concentration of the species with a 1 never changes.
 *
 * Basis vectors that are already 0/1 are accepted directly.  The remaining laws are found by adding
 * together subsets of the original basis vectors, smallest subsets first and, within a size, in
 * ascending lexicographic order of the selected vector indices.  A sum is accepted if it is a nonzero
 * 0/1 vector, its species set neither contains nor is contained in the species set of a law already
 * accepted, and it is linearly independent of the accepted laws.  The search stops as soon as there
 * is one law per basis vector.
 *
 * @author Bruce Parrello
 *
 */
public class ConservationBasisSearch {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ConservationBasisSearch.class);
    /** original basis vectors */
    private final List<FieldVector<BigFraction>> raw;
    /** number of species */
    private final int width;
    /** accepted laws, in order found */
    private List<int[]> accepted;
    /** species sets of the accepted laws */
    private List<BitSet> supports;
    /** accepted laws reduced to echelon form, for independence checks */
    private List<BigFraction[]> echelon;
    /** pivot position of each echelon row */
    private List<Integer> pivots;
    /** number of linear combinations tested */
    private int tested;

    /**
     * Create a search for a specific null-space basis.
     *
     * @param raw		basis vectors of the left null space
     * @param width		number of species (length of each vector)
     */
    public ConservationBasisSearch(List<FieldVector<BigFraction>> raw, int width) {
        this.raw = raw;
        this.width = width;
        for (FieldVector<BigFraction> vector : raw) {
            if (vector.getDimension() != width)
                throw new IllegalArgumentException("Basis vector has " + vector.getDimension()
                        + " entries, but there are " + width + " species.");
        }
    }

    /**
     * Compute the 0/1 conservation basis.
     *
     * @return a list of 0/1 law vectors, in the order they were found
     *
     * @throws BasisSearchException		if the search is exhausted before a full basis is found
     */
    public List<int[]> search() throws BasisSearchException {
        final int k = this.raw.size();
        this.accepted = new ArrayList<int[]>(k);
        this.supports = new ArrayList<BitSet>(k);
        this.echelon = new ArrayList<BigFraction[]>(k);
        this.pivots = new ArrayList<Integer>(k);
        this.tested = 0;
        // Seed the laws with the basis vectors that are already 0/1.
        for (FieldVector<BigFraction> vector : this.raw)
            this.consider(vector.toArray());
        log.info("{} of {} basis vectors are already 0/1 laws.", this.accepted.size(), k);
        // Search the linear combinations.
        boolean done = (this.accepted.size() >= k);
        for (int size = 2; size <= k && ! done; size++) {
            int[] combo = firstCombination(size);
            while (combo != null && ! done) {
                this.tested++;
                boolean found = this.consider(this.sum(combo));
                if (found) {
                    log.debug("Law {} found by combining basis vectors {}.", this.accepted.size(),
                            Arrays.toString(combo));
                    done = (this.accepted.size() >= k);
                }
                combo = nextCombination(combo, k);
            }
        }
        log.info("{} combinations tested.  {} conservation laws found.", this.tested, this.accepted.size());
        if (this.accepted.size() < k)
            throw new BasisSearchException(this.accepted.size(), k);
        return this.accepted;
    }

    /**
     * @return the number of linear combinations tested by the last search
     */
    public int getTested() {
        return this.tested;
    }

    /**
     * @return the first combination of the specified size
     *
     * @param size	number of indices to select
     */
    protected static int[] firstCombination(int size) {
        int[] retVal = new int[size];
        for (int i = 0; i < size; i++)
            retVal[i] = i;
        return retVal;
    }

    /**
     * Advance to the next combination in lexicographic order.
     *
     * @param combo		current combination (modified in place)
     * @param n			number of indices available
     *
     * @return the next combination, or NULL if the current one was the last
     */
    protected static int[] nextCombination(int[] combo, int n) {
        final int size = combo.length;
        int pos = size - 1;
        while (pos >= 0 && combo[pos] == n - size + pos)
            pos--;
        int[] retVal = null;
        if (pos >= 0) {
            combo[pos]++;
            for (int i = pos + 1; i < size; i++)
                combo[i] = combo[i - 1] + 1;
            retVal = combo;
        }
        return retVal;
    }

    /**
     * @return the sum of the selected basis vectors
     *
     * @param combo		indices of the basis vectors to add
     */
    private BigFraction[] sum(int[] combo) {
        BigFraction[] retVal = this.raw.get(combo[0]).toArray();
        for (int c = 1; c < combo.length; c++) {
            FieldVector<BigFraction> vector = this.raw.get(combo[c]);
            for (int i = 0; i < this.width; i++)
                retVal[i] = retVal[i].add(vector.getEntry(i));
        }
        return retVal;
    }

    /**
     * Test a candidate vector and accept it if it is a new conservation law.
     *
     * @param candidate		candidate vector
     *
     * @return TRUE if the candidate was accepted
     */
    private boolean consider(BigFraction[] candidate) {
        boolean retVal = false;
        int[] law = toBinary(candidate);
        if (law != null) {
            BitSet support = supportOf(law);
            if (! support.isEmpty() && this.isIrredundant(support)) {
                BigFraction[] reduced = this.reduce(law);
                int pivot = firstNonZero(reduced);
                if (pivot >= 0) {
                    this.accepted.add(law);
                    this.supports.add(support);
                    this.echelon.add(reduced);
                    this.pivots.add(pivot);
                    retVal = true;
                }
            }
        }
        return retVal;
    }

    /**
     * @return the candidate as an integer vector, or NULL if any entry is not 0 or 1
     *
     * @param candidate		vector to convert
     */
    protected static int[] toBinary(BigFraction[] candidate) {
        int[] retVal = new int[candidate.length];
        for (int i = 0; i < candidate.length && retVal != null; i++) {
            BigFraction value = candidate[i];
            if (value.equals(BigFraction.ONE))
                retVal[i] = 1;
            else if (! NullSpaceSolver.isZero(value))
                retVal = null;
        }
        return retVal;
    }

    /**
     * @return the set of positions with a 1 in a law vector
     *
     * @param law	0/1 law vector
     */
    protected static BitSet supportOf(int[] law) {
        BitSet retVal = new BitSet(law.length);
        for (int i = 0; i < law.length; i++) {
            if (law[i] != 0)
                retVal.set(i);
        }
        return retVal;
    }

    /**
     * Determine whether a species set is unrelated to the species sets already accepted.
     *
     * @param support	species set to check
     *
     * @return TRUE if the species set neither contains nor is contained in an accepted one
     */
    private boolean isIrredundant(BitSet support) {
        boolean retVal = true;
        for (int i = 0; i < this.supports.size() && retVal; i++) {
            BitSet other = this.supports.get(i);
            retVal = ! (containsAll(support, other) || containsAll(other, support));
        }
        return retVal;
    }

    /**
     * @return TRUE if every member of the second set is in the first
     *
     * @param big		set that may contain the other
     * @param small		set that may be contained
     */
    private static boolean containsAll(BitSet big, BitSet small) {
        BitSet leftover = (BitSet) small.clone();
        leftover.andNot(big);
        return leftover.isEmpty();
    }

    /**
     * Reduce a law vector against the echelon form of the accepted laws.  The result is zero if the
     * law is a linear combination of the accepted laws.
     *
     * @param law	law vector to reduce
     *
     * @return the reduced vector
     */
    private BigFraction[] reduce(int[] law) {
        BigFraction[] retVal = new BigFraction[law.length];
        for (int i = 0; i < law.length; i++)
            retVal[i] = new BigFraction(law[i]);
        for (int r = 0; r < this.echelon.size(); r++) {
            int p = this.pivots.get(r);
            if (! NullSpaceSolver.isZero(retVal[p])) {
                BigFraction[] row = this.echelon.get(r);
                BigFraction factor = retVal[p].divide(row[p]);
                for (int i = 0; i < retVal.length; i++)
                    retVal[i] = retVal[i].subtract(factor.multiply(row[i]));
            }
        }
        return retVal;
    }

    /**
     * @return the index of the first nonzero entry in a vector, or -1 if it is all zero
     *
     * @param vector	vector to examine
     */
    private static int firstNonZero(BigFraction[] vector) {
        int retVal = -1;
        for (int i = 0; i < vector.length && retVal < 0; i++) {
            if (! NullSpaceSolver.isZero(vector[i]))
                retVal = i;
        }
        return retVal;
    }

}
