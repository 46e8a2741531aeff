/**
 *
 */
package org.theseed.crn;

/**
 * This exception is thrown when a reaction network is malformed.  The kind of
 * failure is available as an enumeration so that callers can react to specific
 * problems.
 *
 * @author Bruce Parrello
 *
 */
public class NetworkFormatException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = 6117538942031562781L;

    /**
     * Types of network format failures.
     */
    public static enum Kind {
        /** the network has no reactions */
        EMPTY_NETWORK,
        /** a species name is missing */
        BLANK_SPECIES,
        /** a stoichiometric coefficient is not a positive integer */
        BAD_COEFFICIENT,
        /** species and coefficient lists have different lengths */
        MISMATCHED_LISTS,
        /** a reaction formula could not be parsed */
        BAD_FORMULA,
        /** the network JSON is invalid */
        BAD_JSON,
        /** the requested species ordering cannot be applied */
        UNORDERED_SPECIES;
    }

    /** type of failure */
    private final Kind kind;

    /**
     * Construct a network format exception.
     *
     * @param kind		type of failure
     * @param message	description of the failure
     */
    public NetworkFormatException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    /**
     * Construct a network format exception with an underlying cause.
     *
     * @param kind		type of failure
     * @param message	description of the failure
     * @param cause		underlying exception
     */
    public NetworkFormatException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * @return the type of failure
     */
    public Kind getKind() {
        return this.kind;
    }

}
