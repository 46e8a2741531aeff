/**
 *
 */
package org.theseed.crn;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object contains the species of a reaction network in canonical order.  Each species
 * is assigned an index from 0 to one less than the number of species, and that index is the
 * species row in the stoichiometric matrix and in every conservation-law vector.
 *
 * @author Bruce Parrello
 *
 */
public class SpeciesIndex {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(SpeciesIndex.class);
    /** species names in order */
    private final List<String> names;
    /** map of species names to indices */
    private final Map<String, Integer> indexMap;

    /**
     * Compute the species index for a reaction network.
     *
     * @param network	network of interest
     * @param order		species ordering to use
     *
     * @throws NetworkFormatException
     */
    public SpeciesIndex(ReactionNetwork network, SpeciesOrder order) throws NetworkFormatException {
        this(order.sort(network.getDeclaredSpecies()));
        log.info("{} species found in network {} using {} order.", this.size(), network.getId(), order);
    }

    /**
     * Create a species index from an ordered list of species names.
     *
     * @param names		species names, in order, without duplicates
     */
    public SpeciesIndex(List<String> names) {
        this.names = List.copyOf(names);
        this.indexMap = new HashMap<String, Integer>(names.size() * 4 / 3 + 1);
        for (int i = 0; i < this.names.size(); i++) {
            if (this.indexMap.put(this.names.get(i), i) != null)
                throw new IllegalArgumentException("Duplicate species name \"" + this.names.get(i) + "\".");
        }
    }

    /**
     * @return the number of species
     */
    public int size() {
        return this.names.size();
    }

    /**
     * @return the name of the species with the specified index
     *
     * @param idx	index of the desired species
     */
    public String get(int idx) {
        return this.names.get(idx);
    }

    /**
     * @return the index of the named species, or -1 if it is not in the network
     *
     * @param name	name of the desired species
     */
    public int indexOf(String name) {
        Integer retVal = this.indexMap.get(name);
        return (retVal == null ? -1 : retVal);
    }

    /**
     * @return the species names, in order
     */
    public List<String> getNames() {
        return Collections.unmodifiableList(this.names);
    }

    @Override
    public String toString() {
        return this.names.toString();
    }

}
