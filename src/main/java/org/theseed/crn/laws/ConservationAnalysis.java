/**
 *
 */
package org.theseed.crn.laws;

import java.io.PrintWriter;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.linear.FieldVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.crn.NetworkFormatException;
import org.theseed.crn.ReactionNetwork;
import org.theseed.crn.SpeciesIndex;
import org.theseed.crn.SpeciesOrder;
import org.theseed.crn.StoichiometricMatrix;

/**
 * This object computes the conservation laws of a reaction network.  The species are collected and
 * ordered, the stoichiometric matrix is built, its left null space is computed, and the null-space
 * basis is converted to a canonical basis of 0/1 laws.  Each law is then paired with a total-amount
 * symbol.
 *
 * If the null space is trivial, the network has no conservation laws.  This is a normal outcome:
 * the basis, law, and total lists are all empty.
 *
 * @author Bruce Parrello
 *
 */
public class ConservationAnalysis {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ConservationAnalysis.class);
    /** network analyzed */
    private final ReactionNetwork network;
    /** species index */
    private final SpeciesIndex species;
    /** stoichiometric matrix */
    private final StoichiometricMatrix matrix;
    /** raw null-space basis */
    private final List<FieldVector<BigFraction>> rawBasis;
    /** canonical 0/1 basis, in canonical order */
    private final List<int[]> basis;
    /** conservation laws */
    private final List<ConservationLaw> laws;

    /**
     * Analyze a reaction network.
     *
     * @param network		network to analyze
     * @param order			species ordering to use
     * @param lowerCase		TRUE to use lower-case concentration names in the laws
     *
     * @throws NetworkFormatException	if the network is malformed
     * @throws BasisSearchException		if the null-space basis could not be put in 0/1 form
     */
    public ConservationAnalysis(ReactionNetwork network, SpeciesOrder order, boolean lowerCase)
            throws NetworkFormatException, BasisSearchException {
        network.validate();
        this.network = network;
        this.species = new SpeciesIndex(network, order);
        this.matrix = new StoichiometricMatrix(network, this.species);
        this.rawBasis = new NullSpaceSolver().leftNullSpace(this.matrix);
        if (this.rawBasis.isEmpty()) {
            log.info("{} has no conservation laws.", network.getId());
            this.basis = Collections.emptyList();
            this.laws = Collections.emptyList();
        } else {
            ConservationBasisSearch search = new ConservationBasisSearch(this.rawBasis, this.species.size());
            List<int[]> found = search.search();
            LawRenderer renderer = new LawRenderer(this.species, lowerCase);
            this.laws = renderer.render(found);
            this.basis = this.laws.stream().map(x -> x.getVector()).collect(Collectors.toList());
            log.info("{} conservation laws found for {}.", this.laws.size(), network.getId());
        }
    }

    /**
     * Analyze a reaction network using the default species ordering and concentration names.
     *
     * @param network		network to analyze
     *
     * @throws NetworkFormatException	if the network is malformed
     * @throws BasisSearchException		if the null-space basis could not be put in 0/1 form
     */
    public ConservationAnalysis(ReactionNetwork network) throws NetworkFormatException, BasisSearchException {
        this(network, SpeciesOrder.AUTO, false);
    }

    /**
     * @return TRUE if the network has at least one conservation law
     */
    public boolean hasLaws() {
        return ! this.laws.isEmpty();
    }

    /**
     * @return the number of conservation laws
     */
    public int getLawCount() {
        return this.laws.size();
    }

    /**
     * @return the network analyzed
     */
    public ReactionNetwork getNetwork() {
        return this.network;
    }

    /**
     * @return the species index
     */
    public SpeciesIndex getSpecies() {
        return this.species;
    }

    /**
     * @return the stoichiometric matrix
     */
    public StoichiometricMatrix getMatrix() {
        return this.matrix;
    }

    /**
     * @return the raw null-space basis vectors
     */
    public List<FieldVector<BigFraction>> getRawBasis() {
        return Collections.unmodifiableList(this.rawBasis);
    }

    /**
     * @return the canonical 0/1 basis vectors, in canonical order
     */
    public List<int[]> getBasis() {
        return Collections.unmodifiableList(this.basis);
    }

    /**
     * @return the conservation laws, in canonical order
     */
    public List<ConservationLaw> getLaws() {
        return Collections.unmodifiableList(this.laws);
    }

    /**
     * @return the left-hand sides of the conservation laws
     */
    public List<String> getLeftSides() {
        return this.laws.stream().map(x -> x.getLeftSide()).collect(Collectors.toList());
    }

    /**
     * @return the total-amount symbols of the conservation laws
     */
    public List<String> getTotals() {
        return this.laws.stream().map(x -> x.getTotal()).collect(Collectors.toList());
    }

    /**
     * Write the conservation laws as text.
     *
     * @param writer	output print writer
     */
    public void writeLaws(PrintWriter writer) {
        if (! this.hasLaws())
            writer.println(this.network.getId() + " has no conservation laws.");
        else {
            writer.println("The conservation laws for " + this.network.getId() + " are:");
            writer.println();
            for (ConservationLaw law : this.laws)
                writer.println(law.toString());
        }
    }

    /**
     * Write the canonical basis as a tab-delimited table with species rows and total-amount columns.
     *
     * @param writer	output print writer
     */
    public void writeBasis(PrintWriter writer) {
        writer.println("species\t" + String.join("\t", this.getTotals()));
        for (int i = 0; i < this.species.size(); i++) {
            StringBuilder line = new StringBuilder(this.species.get(i));
            for (int[] law : this.basis)
                line.append('\t').append(law[i]);
            writer.println(line);
        }
    }

    /**
     * Write the raw null-space basis as a tab-delimited table with species rows and one column per
     * basis vector.
     *
     * @param writer	output print writer
     */
    public void writeRawBasis(PrintWriter writer) {
        StringBuilder header = new StringBuilder("species");
        for (int j = 1; j <= this.rawBasis.size(); j++)
            header.append("\tw").append(j);
        writer.println(header);
        for (int i = 0; i < this.species.size(); i++) {
            StringBuilder line = new StringBuilder(this.species.get(i));
            for (FieldVector<BigFraction> vector : this.rawBasis)
                line.append('\t').append(vector.getEntry(i).toString());
            writer.println(line);
        }
    }

}
