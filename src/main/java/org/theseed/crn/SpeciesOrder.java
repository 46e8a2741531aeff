/**
 *
 */
package org.theseed.crn;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * This enumeration describes the ways species can be ordered in the rows of the stoichiometric
 * matrix.  The order is fixed once for the network and used for every matrix and basis row.
 *
 * @author Bruce Parrello
 *
 */
public enum SpeciesOrder {
    /** natural string order */
    LEXICOGRAPHIC {
        @Override
        public List<String> sort(Collection<String> declared) {
            List<String> retVal = new ArrayList<String>(declared);
            retVal.sort(Comparator.naturalOrder());
            return retVal;
        }
    },
    /** order by the integer at the end of each name ("X2" before "X10") */
    NUMERIC_SUFFIX {
        @Override
        public List<String> sort(Collection<String> declared) throws NetworkFormatException {
            for (String name : declared) {
                if (suffixOf(name) < 0)
                    throw new NetworkFormatException(NetworkFormatException.Kind.UNORDERED_SPECIES,
                            "Species \"" + name + "\" does not end in a number.");
            }
            List<String> retVal = new ArrayList<String>(declared);
            retVal.sort(SUFFIX_SORTER);
            return retVal;
        }
    },
    /** numeric-suffix order if every name has one, else lexicographic */
    AUTO {
        @Override
        public List<String> sort(Collection<String> declared) throws NetworkFormatException {
            boolean numbered = declared.stream().allMatch(x -> suffixOf(x) >= 0);
            SpeciesOrder actual = (numbered ? NUMERIC_SUFFIX : LEXICOGRAPHIC);
            return actual.sort(declared);
        }
    },
    /** order of first appearance in the reactions */
    DECLARED {
        @Override
        public List<String> sort(Collection<String> declared) {
            return new ArrayList<String>(declared);
        }
    };

    /** pattern for a name with an alphabetic prefix and a numeric suffix */
    private static final Pattern NUMBERED_NAME = Pattern.compile("[A-Za-z_]+(\\d+)");

    /** comparator for numeric-suffix ordering; ties are broken by the full name */
    private static final Comparator<String> SUFFIX_SORTER =
            Comparator.comparingLong(SpeciesOrder::suffixOf).thenComparing(Comparator.naturalOrder());

    /**
     * @return the numeric suffix of a species name, or -1 if the name is not a prefix plus a number
     *
     * @param name		species name to parse
     */
    public static long suffixOf(String name) {
        long retVal = -1;
        Matcher m = NUMBERED_NAME.matcher(name);
        if (m.matches()) {
            try {
                retVal = Long.parseLong(m.group(1));
            } catch (NumberFormatException e) {
                // Too many digits to be an index.
                retVal = -1;
            }
        }
        return retVal;
    }

    /**
     * Sort the species of a network.
     *
     * @param declared	species names in order of first appearance (no duplicates)
     *
     * @return the species names in canonical order
     *
     * @throws NetworkFormatException	if this ordering cannot be applied to the names
     */
    public abstract List<String> sort(Collection<String> declared) throws NetworkFormatException;

}
