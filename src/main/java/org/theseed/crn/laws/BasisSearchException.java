/**
 *
 */
package org.theseed.crn.laws;

/**
 * This exception is thrown when a conservation basis cannot be converted to a set of
 * nonnegative 0/1 vectors.
 *
 * @author Bruce Parrello
 *
 */
public class BasisSearchException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = -2873059617154410262L;

    /** number of laws found */
    private final int found;
    /** number of laws required */
    private final int required;

    /**
     * Construct a basis search exception.
     *
     * @param found		number of laws found
     * @param required	number of laws required
     */
    public BasisSearchException(int found, int required) {
        super("Could not canonicalize basis: only " + found + " of " + required
                + " conservation laws have 0/1 form.");
        this.found = found;
        this.required = required;
    }

    /**
     * @return the number of laws found before the search was exhausted
     */
    public int getFound() {
        return this.found;
    }

    /**
     * @return the number of laws required
     */
    public int getRequired() {
        return this.required;
    }

}
