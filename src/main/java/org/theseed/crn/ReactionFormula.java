/**
 *
 */
package org.theseed.crn;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

/**
 * This class converts between reactions and text formulas.  A formula consists of a reactant
 * complex, an arrow, and a product complex, such as "2 A + B -> C".  The arrows "->" and "=>"
 * denote irreversible reactions, while "<->" and "<=>" denote reversible ones.  A complex is a
 * list of terms separated by plus signs.  Each term is a species name, optionally preceded by
 * a positive integer coefficient and either white space or an asterisk.  An empty complex can
 * be written as nothing at all, as "0", or as the empty-set symbol.
 *
 * @author Bruce Parrello
 *
 */
public class ReactionFormula {

    /** reversible arrows */
    private static final String[] REVERSIBLE_ARROWS = new String[] { "<->", "<=>" };
    /** irreversible arrows */
    private static final String[] FORWARD_ARROWS = new String[] { "->", "=>" };
    /** pattern for a term with a coefficient */
    private static final Pattern COEFF_TERM = Pattern.compile("(\\d+)(?:\\s+|\\s*\\*\\s*)(\\S+)");
    /** pattern for a valid species name */
    private static final Pattern SPECIES_NAME = Pattern.compile("[^\\s+*<>=]+");
    /** empty-complex representations */
    private static final List<String> EMPTY_COMPLEX = List.of("", "0", "∅");

    /**
     * Parse a reaction formula.
     *
     * @param id		ID to give the reaction
     * @param formula	text of the formula
     *
     * @return the reaction described by the formula
     *
     * @throws NetworkFormatException
     */
    public static Reaction parse(String id, String formula) throws NetworkFormatException {
        if (formula == null)
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_FORMULA,
                    "Missing formula for reaction " + id + ".");
        // Find the arrow.  The reversible arrows contain the forward ones, so they are checked first.
        boolean reversible = true;
        String arrow = findArrow(formula, REVERSIBLE_ARROWS);
        if (arrow == null) {
            reversible = false;
            arrow = findArrow(formula, FORWARD_ARROWS);
        }
        if (arrow == null)
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_FORMULA,
                    "No reaction arrow found in formula \"" + formula + "\" for reaction " + id + ".");
        String left = StringUtils.substringBefore(formula, arrow);
        String right = StringUtils.substringAfter(formula, arrow);
        if (right.contains("->") || right.contains("=>"))
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_FORMULA,
                    "Formula \"" + formula + "\" for reaction " + id + " has more than one arrow.");
        Reaction retVal = new Reaction(id, reversible);
        parseComplex(retVal, left, false, formula);
        parseComplex(retVal, right, true, formula);
        return retVal;
    }

    /**
     * @return the first of the specified arrows present in a formula, or NULL if none is present
     *
     * @param formula	formula to search
     * @param arrows	array of arrows to check
     */
    private static String findArrow(String formula, String[] arrows) {
        String retVal = null;
        for (int i = 0; i < arrows.length && retVal == null; i++) {
            if (formula.contains(arrows[i]))
                retVal = arrows[i];
        }
        return retVal;
    }

    /**
     * Parse one side of a formula into a reaction.
     *
     * @param reaction	reaction being built
     * @param text		text of the complex
     * @param product	TRUE for the product side, FALSE for the reactant side
     * @param formula	full formula, for error messages
     *
     * @throws NetworkFormatException
     */
    private static void parseComplex(Reaction reaction, String text, boolean product, String formula)
            throws NetworkFormatException {
        String complex = text.trim();
        if (! EMPTY_COMPLEX.contains(complex)) {
            String[] terms = StringUtils.splitPreserveAllTokens(complex, '+');
            for (String rawTerm : terms) {
                String term = rawTerm.trim();
                int coeff = 1;
                String species = term;
                Matcher m = COEFF_TERM.matcher(term);
                if (m.matches()) {
                    try {
                        coeff = Integer.parseInt(m.group(1));
                    } catch (NumberFormatException e) {
                        throw new NetworkFormatException(NetworkFormatException.Kind.BAD_COEFFICIENT,
                                "Coefficient too large in formula \"" + formula + "\".", e);
                    }
                    species = m.group(2);
                }
                if (species.isEmpty())
                    throw new NetworkFormatException(NetworkFormatException.Kind.BLANK_SPECIES,
                            "Empty term in formula \"" + formula + "\".");
                if (! SPECIES_NAME.matcher(species).matches())
                    throw new NetworkFormatException(NetworkFormatException.Kind.BAD_FORMULA,
                            "Invalid term \"" + term + "\" in formula \"" + formula + "\".");
                if (product)
                    reaction.addProduct(species, coeff);
                else
                    reaction.addReactant(species, coeff);
            }
        }
    }

    /**
     * @return the formula for a reaction
     *
     * @param reaction	reaction to describe
     */
    public static String format(Reaction reaction) {
        String arrow = (reaction.isReversible() ? " <-> " : " -> ");
        return formatComplex(reaction.getReactants()) + arrow + formatComplex(reaction.getProducts());
    }

    /**
     * @return the text of a complex
     *
     * @param complex	list of stoichiometry objects in the complex
     */
    private static String formatComplex(List<Reaction.Stoich> complex) {
        String retVal;
        if (complex.isEmpty())
            retVal = "0";
        else
            retVal = complex.stream().map(x -> x.toString()).collect(Collectors.joining(" + "));
        return retVal;
    }

}
