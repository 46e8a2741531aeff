/**
 *
 */
package org.theseed.crn;

import java.io.File;
import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.cliftonlabs.json_simple.JsonArray;
import com.github.cliftonlabs.json_simple.JsonException;
import com.github.cliftonlabs.json_simple.JsonKey;
import com.github.cliftonlabs.json_simple.JsonObject;
import com.github.cliftonlabs.json_simple.Jsoner;

/**
 * This object represents a chemical reaction network.  The network has an ID and an ordered
 * list of reactions.  It can be built a reaction at a time or loaded from a JSON file.  The
 * JSON file contains an object with an "id" string and a "reactions" list.  Each reaction is
 * an object with an "id", a "reversible" flag, and "reactant" and "product" lists of objects
 * containing "species" and "stoichiometry".  Alternatively, a reaction can be given as a
 * "formula" string (see {@link ReactionFormula}).
 *
 * @author Bruce Parrello
 *
 */
public class ReactionNetwork {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ReactionNetwork.class);
    /** network ID */
    private String id;
    /** list of reactions, in order */
    private List<Reaction> reactions;

    private static enum NetworkKeys implements JsonKey {
        ID("network");

        private final Object m_value;

        private NetworkKeys(final Object value) {
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
     * Construct an empty reaction network.
     *
     * @param id	ID of the network
     */
    public ReactionNetwork(String id) {
        this.id = (StringUtils.isBlank(id) ? (String) NetworkKeys.ID.getValue() : id);
        this.reactions = new ArrayList<Reaction>();
    }

    /**
     * Load a reaction network from a JSON file.
     *
     * @param inFile	file containing the network JSON
     *
     * @return the network read
     *
     * @throws IOException
     * @throws NetworkFormatException
     */
    public static ReactionNetwork load(File inFile) throws IOException, NetworkFormatException {
        ReactionNetwork retVal;
        try (Reader reader = new FileReader(inFile)) {
            retVal = load(reader);
        }
        log.info("{} reactions loaded for network {} from {}.", retVal.size(), retVal.getId(), inFile);
        return retVal;
    }

    /**
     * Load a reaction network from a JSON stream.
     *
     * @param reader	reader for the network JSON
     *
     * @return the network read
     *
     * @throws IOException
     * @throws NetworkFormatException
     */
    public static ReactionNetwork load(Reader reader) throws IOException, NetworkFormatException {
        Object parsed;
        try {
            parsed = Jsoner.deserialize(reader);
        } catch (JsonException e) {
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                    "JSON error in network: " + e.getMessage(), e);
        }
        if (! (parsed instanceof JsonObject))
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                    "Network JSON is not an object.");
        return fromJson((JsonObject) parsed);
    }

    /**
     * Construct a reaction network from a JSON object.
     *
     * @param networkObject		JSON object describing the network
     *
     * @return the network described
     *
     * @throws NetworkFormatException
     */
    public static ReactionNetwork fromJson(JsonObject networkObject) throws NetworkFormatException {
        Object id = networkObject.get(NetworkKeys.ID.getKey());
        if (id != null && ! (id instanceof String))
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                    "The network ID is not a string.");
        ReactionNetwork retVal = new ReactionNetwork((String) id);
        Object reactionList = networkObject.get("reactions");
        if (reactionList == null)
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                    "Network " + retVal.getId() + " has no reaction list.");
        if (! (reactionList instanceof JsonArray))
            throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                    "The reaction list for network " + retVal.getId() + " is not a list.");
        for (Object item : (JsonArray) reactionList) {
            if (! (item instanceof JsonObject))
                throw new NetworkFormatException(NetworkFormatException.Kind.BAD_JSON,
                        "Invalid reaction entry in network " + retVal.getId() + ".");
            Reaction reaction = Reaction.fromJson(retVal.nextId(), (JsonObject) item);
            retVal.reactions.add(reaction);
        }
        return retVal;
    }

    /**
     * @return the default ID for the next reaction
     */
    private String nextId() {
        return "R" + (this.reactions.size() + 1);
    }

    /**
     * Add a reaction to this network.
     *
     * @param id				ID of the reaction (if blank, one will be generated)
     * @param reactants			names of the reactant species
     * @param reactantCoeffs	stoichiometric coefficients of the reactants
     * @param products			names of the product species
     * @param productCoeffs		stoichiometric coefficients of the products
     * @param reversible		TRUE if the reaction is reversible
     *
     * @return the reaction added
     *
     * @throws NetworkFormatException
     */
    public Reaction addReaction(String id, List<String> reactants, List<Integer> reactantCoeffs,
            List<String> products, List<Integer> productCoeffs, boolean reversible) throws NetworkFormatException {
        String reactionId = (StringUtils.isBlank(id) ? this.nextId() : id);
        if (reactants.size() != reactantCoeffs.size() || products.size() != productCoeffs.size())
            throw new NetworkFormatException(NetworkFormatException.Kind.MISMATCHED_LISTS,
                    "Species and coefficient lists differ in length for reaction " + reactionId + ".");
        Reaction retVal = new Reaction(reactionId, reversible);
        for (int i = 0; i < reactants.size(); i++)
            retVal.addReactant(reactants.get(i), reactantCoeffs.get(i));
        for (int i = 0; i < products.size(); i++)
            retVal.addProduct(products.get(i), productCoeffs.get(i));
        this.reactions.add(retVal);
        return retVal;
    }

    /**
     * Add a reaction to this network using a formula.
     *
     * @param formula	text of the reaction formula
     *
     * @return the reaction added
     *
     * @throws NetworkFormatException
     */
    public Reaction addReaction(String formula) throws NetworkFormatException {
        Reaction retVal = ReactionFormula.parse(this.nextId(), formula);
        this.reactions.add(retVal);
        return retVal;
    }

    /**
     * Verify that this network can be analyzed.
     *
     * @throws NetworkFormatException	if the network has no reactions
     */
    public void validate() throws NetworkFormatException {
        if (this.reactions.isEmpty())
            throw new NetworkFormatException(NetworkFormatException.Kind.EMPTY_NETWORK,
                    "Network " + this.id + " has no reactions.");
    }

    /**
     * @return the network ID
     */
    public String getId() {
        return this.id;
    }

    /**
     * @return the list of reactions
     */
    public List<Reaction> getReactions() {
        return Collections.unmodifiableList(this.reactions);
    }

    /**
     * @return the number of reactions
     */
    public int size() {
        return this.reactions.size();
    }

    /**
     * @return the species names in order of first appearance, reactants before products within each reaction
     */
    public Set<String> getDeclaredSpecies() {
        Set<String> retVal = new LinkedHashSet<String>();
        for (Reaction reaction : this.reactions) {
            for (Reaction.Stoich stoich : reaction.getReactants())
                retVal.add(stoich.getSpecies());
            for (Reaction.Stoich stoich : reaction.getProducts())
                retVal.add(stoich.getSpecies());
        }
        return retVal;
    }

    /**
     * @return the number of reactions involving the specified species
     *
     * @param species	name of the species of interest
     */
    public int countReactions(String species) {
        return (int) this.reactions.stream().filter(x -> x.getSpecies().contains(species)).count();
    }

    /**
     * @return a JSON object describing this network
     */
    public JsonObject toJson() {
        JsonObject retVal = new JsonObject();
        retVal.put(NetworkKeys.ID.getKey(), this.id);
        JsonArray reactionList = new JsonArray();
        for (Reaction reaction : this.reactions)
            reactionList.add(reaction.toJson());
        retVal.put("reactions", reactionList);
        return retVal;
    }

    /**
     * Save this network to a JSON file.
     *
     * @param outFile	output file
     *
     * @throws IOException
     */
    public void save(File outFile) throws IOException {
        try (Writer writer = new FileWriter(outFile)) {
            writer.write(Jsoner.prettyPrint(this.toJson().toJson()));
        }
    }

    @Override
    public String toString() {
        return "Network " + this.id + " (" + this.reactions.size() + " reactions)";
    }

}
