/**
 *
 */
package org.theseed.crn.cli;

/**
 * This exception is thrown when command-line parameters are invalid.
 *
 * @author Bruce Parrello
 *
 */
public class ParseFailureException extends Exception {

    /** serialization ID */
    private static final long serialVersionUID = 4418263012887065236L;

    /**
     * Construct a parse failure exception.
     *
     * @param message	description of the invalid parameters
     */
    public ParseFailureException(String message) {
        super(message);
    }

}
