/**
 *
 */
package org.theseed.crn;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.ListIterator;
import java.util.Set;
import java.util.stream.Collectors;

import org.apache.commons.lang3.StringUtils;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;

/**
 * This object represents a reaction in a chemical reaction network.  The reaction has an
 * identifier, a reversibility flag, and the stoichiometry of the species involved.  Reactants
 * are stored with negative coefficients and products with positive ones, so a species that
 * appears on both sides of the reaction has two entries.
 *
 * @author Bruce Parrello
 *
 */
public class Reaction {

    // FIELDS
    /** identifier of this reaction */
    private String id;
    /** reversibility flag */
    private boolean reversible;
    /** species list, reactants first */
    private List<Stoich> metabolites;

    private static enum ReactionKeys implements JsonKey {
        ID(""), REVERSIBLE(false), FORMULA(""), SPECIES(""), STOICHIOMETRY(1);

        private final Object m_value;

        private ReactionKeys(final Object value) {
            this.m_value = value;
        }

        /** This is the string used as a key in the incoming JsonObject map.
         */
        @Override
        public String getKey() {
            return this.name().toLowerCase();
        }

        /** This is the default value used when the key is not found.
         */
        @Override
        public Object getValue() {
            return this.m_value;
        }

    }

    /**
     * This is a simple object to represent stoichiometry.  The sort order puts reactants
     * before products.
     */
    public static class Stoich implements Comparable<Stoich> {

        /** stoichiometric coefficient (negative for reactants) */
        private int coefficient;
        /** name of the species */
        private String species;

        /**
         * Construct a new stoichiometric representation.
         *
         * @param coeff		coefficient (negative for a reactant)
         * @param species	name of the species
         */
        public Stoich(int coeff, String species) {
            this.coefficient = coeff;
            this.species = species;
        }

        @Override
        public int compareTo(Stoich o) {
            int retVal = Integer.compare(this.coefficient, o.coefficient);
            if (retVal == 0)
                retVal = this.species.compareTo(o.species);
            return retVal;
        }

        /**
         * @return the coefficient (always positive)
         */
        public int getCoeff() {
            return (this.coefficient < 0 ? -this.coefficient : this.coefficient);
        }

        /**
         * @return the signed coefficient (net change contributed to the species)
         */
        public int getNetCoeff() {
            return this.coefficient;
        }

        /**
         * @return TRUE for a product, FALSE for a reactant
         */
        public boolean isProduct() {
            return (this.coefficient > 0);
        }

        @Override
        public String toString() {
            int coeff = this.getCoeff();
            String retVal;
            if (coeff == 1)
                retVal = this.species;
            else
                retVal = String.format("%d %s", coeff, this.species);
            return retVal;
        }

        /**
         * @return the name of the species
         */
        public String getSpecies() {
            return this.species;
        }

    }

    /**
     * Construct an empty reaction.
     *
     * @param id			ID of this reaction
     * @param reversible	TRUE if the reaction is reversible
     */
    public Reaction(String id, boolean reversible) {
        this.id = id;
        this.reversible = reversible;
        this.metabolites = new ArrayList<Stoich>();
    }

    /**
     * Construct a reaction from a JSON object.  The reaction can be specified by a formula
     * or by reactant and product lists.
     *
     * @param defaultId			ID to use if none is present in the object
     * @param reactionObject	JSON object containing the reaction
     *
     * @return the reaction described by the object
     *
     * @throws NetworkFormatException
     */
    public static Reaction fromJson(String defaultId, JsonObject reactionObject) throws NetworkFormatException {
        String id = stringField(reactionObject, ReactionKeys.ID, defaultId);
        if (StringUtils.isBlank(id))
            id = defaultId;
        String formula = stringField(reactionObject, ReactionKeys.FORMULA, id);
        Reaction retVal;
        if (! StringUtils.isBlank(formula))
            retVal = ReactionFormula.parse(id, formula);
        else {
            Object flag = reactionObject.get(ReactionKeys.REVERSIBLE.getKey());
            if (flag == null)
                flag = ReactionKeys.REVERSIBLE.getValue();
            else if (! (flag instanceof Boolean))
                throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                        "The reversibility flag of reaction " + id + " is not TRUE or FALSE.");
            retVal = new Reaction(id, (Boolean) flag);
            retVal.readComplex(reactionObject, "reactant", false);
            retVal.readComplex(reactionObject, "product", true);
        }
        return retVal;
    }

    /**
     * Read one side of the reaction from a JSON object.
     *
     * @param reactionObject	JSON object containing the reaction
     * @param key				key of the species list
     * @param product			TRUE for the product side, FALSE for the reactant side
     *
     * @throws NetworkFormatException
     */
    private void readComplex(JsonObject reactionObject, String key, boolean product) throws NetworkFormatException {
        Object list = reactionObject.get(key);
        if (list != null) {
            if (! (list instanceof JsonArray))
                throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                        "The \"" + key + "\" field of reaction " + this.id + " is not a list.");
            for (Object item : (JsonArray) list) {
                if (! (item instanceof JsonObject))
                    throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                            "Invalid " + key + " entry in reaction " + this.id + ".");
                JsonObject meta = (JsonObject) item;
                String species = stringField(meta, ReactionKeys.SPECIES, this.id);
                int coeff = this.checkCoefficient(meta.get(ReactionKeys.STOICHIOMETRY.getKey()), species);
                if (product)
                    this.addProduct(species, coeff);
                else
                    this.addReactant(species, coeff);
            }
        }
    }

    /**
     * @return the string value of a JSON field, or the field's default if it is missing or null
     *
     * @param object	JSON object containing the field
     * @param key		key of the field
     * @param where		ID of the reaction being read, for error messages
     *
     * @throws NetworkFormatException	if the field is not a string
     */
    private static String stringField(JsonObject object, ReactionKeys key, String where) throws NetworkFormatException {
        Object value = object.get(key.getKey());
        String retVal;
        if (value == null)
            retVal = (String) key.getValue();
        else if (value instanceof String)
            retVal = (String) value;
        else
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                    "The \"" + key.getKey() + "\" field in reaction " + where + " is not a string.");
        return retVal;
    }

    /**
     * @return the integer value of a stoichiometric coefficient
     *
     * @param value		coefficient from the JSON input (NULL for the default)
     * @param species	name of the relevant species
     *
     * @throws NetworkFormatException	if the value is not an integer
     */
    private int checkCoefficient(Object value, String species) throws NetworkFormatException {
        if (value == null)
            value = ReactionKeys.STOICHIOMETRY.getValue();
        if (! (value instanceof Number))
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_COEFFICIENT,
                    "Coefficient " + value + " for " + species + " in reaction " + this.id + " is not a number.");
        int retVal;
        try {
            BigDecimal number = (value instanceof BigDecimal ? (BigDecimal) value : new BigDecimal(value.toString()));
            retVal = number.intValueExact();
        } catch (ArithmeticException | NumberFormatException e) {
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_COEFFICIENT,
                    "Coefficient " + value + " for " + species + " in reaction " + this.id + " is not an integer.", e);
        }
        return retVal;
    }

    /**
     * Add a reactant to this reaction.
     *
     * @param species	name of the reactant
     * @param coeff		stoichiometric coefficient
     *
     * @throws NetworkFormatException
     */
    public void addReactant(String species, int coeff) throws NetworkFormatException {
        this.addStoich(species, coeff, -1);
    }

    /**
     * Add a product to this reaction.
     *
     * @param species	name of the product
     * @param coeff		stoichiometric coefficient
     *
     * @throws NetworkFormatException
     */
    public void addProduct(String species, int coeff) throws NetworkFormatException {
        this.addStoich(species, coeff, 1);
    }

    /**
     * Add a species to one side of this reaction.  If the species is already on that side,
     * the coefficients are summed.
     *
     * @param species	name of the species
     * @param coeff		stoichiometric coefficient
     * @param sign		-1 for a reactant, 1 for a product
     *
     * @throws NetworkFormatException
     */
    private void addStoich(String species, int coeff, int sign) throws NetworkFormatException {
        if (StringUtils.isBlank(species))
            throw new NetworkFormatException(NetworkFormatException.Kind.BLANK_SPECIES,
                    "Reaction " + this.id + " has a species with no name.");
        if (coeff <= 0)
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_COEFFICIENT,
                    "Coefficient " + coeff + " for " + species + " in reaction " + this.id + " is not positive.");
        boolean found = false;
        ListIterator<Stoich> iter = this.metabolites.listIterator();
        while (iter.hasNext() && ! found) {
            Stoich old = iter.next();
            if (old.species.equals(species) && old.isProduct() == (sign > 0)) {
                long total = (long) old.coefficient + sign * coeff;
                if (Math.abs(total) > Integer.MAX_VALUE)
                    throw new NetworkFormatException(NetworkFormatException.Kind.BAD_COEFFICIENT,
                            "Total coefficient for " + species + " in reaction " + this.id + " is too large.");
                iter.set(new Stoich((int) total, species));
                found = true;
            }
        }
        if (! found) {
            this.metabolites.add(new Stoich(sign * coeff, species));
            Collections.sort(this.metabolites);
        }
    }

    /**
     * @return the reaction ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return TRUE if this reaction is reversible
     */
    public boolean isReversible() {
        return this.reversible;
    }

    /**
     * @return the components of the reaction (reactants and products with stoichiometric coefficients)
     */
    public List<Stoich> getMetabolites() {
        return Collections.unmodifiableList(this.metabolites);
    }

    /**
     * @return the reactant components of the reaction
     */
    public List<Stoich> getReactants() {
        return this.metabolites.stream().filter(x -> ! x.isProduct()).collect(Collectors.toList());
    }

    /**
     * @return the product components of the reaction
     */
    public List<Stoich> getProducts() {
        return this.metabolites.stream().filter(x -> x.isProduct()).collect(Collectors.toList());
    }

    /**
     * @return the names of the species in this reaction, reactants first, in order of appearance
     */
    public Set<String> getSpecies() {
        Set<String> retVal = new LinkedHashSet<String>();
        for (Stoich stoich : this.metabolites)
            retVal.add(stoich.getSpecies());
        return retVal;
    }

    /**
     * Compute the net change in a species caused by one forward firing of this reaction.
     *
     * @param species	name of the species of interest
     *
     * @return the product coefficient minus the reactant coefficient
     */
    public int netChange(String species) {
        int retVal = 0;
        for (Stoich stoich : this.metabolites) {
            if (stoich.getSpecies().equals(species))
                retVal += stoich.getNetCoeff();
        }
        return retVal;
    }

    /**
     * @return the formula of this reaction as text
     */
    public String getFormula() {
        return ReactionFormula.format(this);
    }

    /**
     * @return a JSON object describing this reaction
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(ReactionKeys.ID.getKey(), this.id);
        retVal.put(ReactionKeys.REVERSIBLE.getKey(), this.reversible);
        retVal.put("reactant", complexJson(this.getReactants()));
        retVal.put("product", complexJson(this.getProducts()));
        return retVal;
    }

    /**
     * @return a JSON array describing one side of the reaction
     *
     * @param complex	list of stoichiometry objects for the side
     */
    private static JsonArray complexJson(List<Stoich> complex) {
        JsonArray retVal = new JsonArray();
        for (Stoich stoich : complex) {
            JsonObject meta = new JsonObject();
            meta.put(ReactionKeys.SPECIES.getKey(), stoich.getSpecies());
            meta.put(ReactionKeys.STOICHIOMETRY.getKey(), stoich.getCoeff());
            retVal.add(meta);
        }
        return retVal;
    }

    @Override
    public String toString() {
        return "Reaction " + this.id + " (" + this.getFormula() + ")";
    }

}
