/**
 *
 */
package org.theseed.crn.laws;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.theseed.crn.SpeciesIndex;

/**
 * This object converts 0/1 law vectors into conservation-law equations.  The vectors are put in
 * canonical order (by the position of the first species in each law) and each one is paired with
 * a total-amount symbol "T1", "T2", and so forth.
 *
 * @author Bruce Parrello
 *
 */
public class LawRenderer {

    // FIELDS
    /** species index for the law vectors */
    private final SpeciesIndex species;
    /** TRUE to use lower-case concentration names */
    private final boolean lowerCase;
    /** prefix for total-amount symbols */
    public static final String TOTAL_PREFIX = "T";

    /**
     * Construct a law renderer.
     *
     * @param species		species index for the law vectors
     * @param lowerCase		TRUE to write concentrations as lower-case species names
     */
    public LawRenderer(SpeciesIndex species, boolean lowerCase) {
        this.species = species;
        this.lowerCase = lowerCase;
    }

    /**
     * Sort law vectors by the position of their first species.  The sort is stable, so laws that
     * start at the same species keep their discovery order.
     *
     * @param laws	law vectors to sort
     *
     * @return a new list containing the sorted vectors
     */
    public static List<int[]> order(List<int[]> laws) {
        List<int[]> retVal = new ArrayList<int[]>(laws);
        retVal.sort(Comparator.comparingInt(ConservationLaw::firstRow));
        return retVal;
    }

    /**
     * Create the conservation laws for a set of law vectors.
     *
     * @param laws	0/1 law vectors, in any order
     *
     * @return the conservation laws, in canonical order
     */
    public List<ConservationLaw> render(List<int[]> laws) {
        List<int[]> ordered = order(laws);
        List<ConservationLaw> retVal = new ArrayList<ConservationLaw>(ordered.size());
        for (int[] law : ordered) {
            List<String> terms = new ArrayList<String>();
            for (int i = 0; i < law.length; i++) {
                if (law[i] != 0)
                    terms.add(this.concentration(i));
            }
            retVal.add(new ConservationLaw(law, terms, TOTAL_PREFIX + (retVal.size() + 1)));
        }
        return retVal;
    }

    /**
     * @return the concentration name for a species
     *
     * @param idx	index of the species
     */
    public String concentration(int idx) {
        String retVal = this.species.get(idx);
        if (this.lowerCase)
            retVal = StringUtils.lowerCase(retVal);
        return retVal;
    }

}
