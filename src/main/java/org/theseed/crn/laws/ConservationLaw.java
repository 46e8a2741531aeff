/**
 *
 */
package org.theseed.crn.laws;

import java.util.List;

/**
 * This object represents a single conservation law.  The law states that the sum of the
 * concentrations of a set of species is equal to a constant total amount.
 *
 * @author Bruce Parrello
 *
 */
public class ConservationLaw {

    // FIELDS
    /** 0/1 law vector, indexed by species */
    private final int[] vector;
    /** concentration names of the species in the law, in species order */
    private final List<String> terms;
    /** name of the total-amount symbol */
    private final String total;

    /**
     * Construct a conservation law.
     *
     * @param vector	0/1 law vector
     * @param terms		concentration names for the species with a 1
     * @param total		name of the total-amount symbol
     */
    public ConservationLaw(int[] vector, List<String> terms, String total) {
        this.vector = vector;
        this.terms = List.copyOf(terms);
        this.total = total;
    }

    /**
     * @return a copy of the law vector
     */
    public int[] getVector() {
        return this.vector.clone();
    }

    /**
     * @return the concentration names in the left-hand side
     */
    public List<String> getTerms() {
        return this.terms;
    }

    /**
     * @return the name of the total-amount symbol
     */
    public String getTotal() {
        return this.total;
    }

    /**
     * @return the left-hand side of the law as text
     */
    public String getLeftSide() {
        return String.join(" + ", this.terms);
    }

    /**
     * @return the row index of the first species in the law
     */
    public int getFirstRow() {
        return firstRow(this.vector);
    }

    /**
     * @return the index of the first nonzero entry in a law vector, or the vector length if there is none
     *
     * @param law	law vector to examine
     */
    public static int firstRow(int[] law) {
        int retVal = 0;
        while (retVal < law.length && law[retVal] == 0)
            retVal++;
        return retVal;
    }

    @Override
    public String toString() {
        return this.getLeftSide() + " = " + this.total;
    }

}
