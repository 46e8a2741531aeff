/**
 *
 */
package org.theseed.crn;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.fraction.BigFractionField;
import org.apache.commons.math3.linear.Array2DRowFieldMatrix;
import org.apache.commons.math3.linear.FieldMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object is the stoichiometric matrix of a reaction network.  There is one row per species,
 * in species-index order, and one column per reaction direction.  Each column is the product
 * complex minus the reactant complex.  A reversible reaction contributes its forward column
 * followed immediately by the negated column for the reverse direction.
 *
 * @author Bruce Parrello
 *
 */
public class StoichiometricMatrix {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(StoichiometricMatrix.class);
    /** species index for the rows */
    private final SpeciesIndex species;
    /** column vectors */
    private final List<int[]> columns;
    /** column labels */
    private final List<String> labels;
    /** suffix for the label of a reverse-direction column */
    public static final String REVERSE_SUFFIX = "_rev";

    /**
     * Build the stoichiometric matrix for a network.
     *
     * @param network	network of interest
     * @param species	species index for the network
     */
    public StoichiometricMatrix(ReactionNetwork network, SpeciesIndex species) {
        this.species = species;
        final int m = species.size();
        this.columns = new ArrayList<int[]>(network.size() * 2);
        this.labels = new ArrayList<String>(network.size() * 2);
        for (Reaction reaction : network.getReactions()) {
            int[] reactants = new int[m];
            int[] products = new int[m];
            for (Reaction.Stoich stoich : reaction.getMetabolites()) {
                int row = species.indexOf(stoich.getSpecies());
                if (row < 0)
                    throw new IllegalArgumentException("Species " + stoich.getSpecies() + " in reaction "
                            + reaction.getId() + " is not in the species index.");
                if (stoich.isProduct())
                    products[row] += stoich.getCoeff();
                else
                    reactants[row] += stoich.getCoeff();
            }
            int[] forward = new int[m];
            for (int i = 0; i < m; i++)
                forward[i] = products[i] - reactants[i];
            this.addColumn(reaction.getId(), forward);
            if (reaction.isReversible()) {
                int[] reverse = new int[m];
                for (int i = 0; i < m; i++)
                    reverse[i] = -forward[i];
                this.addColumn(reaction.getId() + REVERSE_SUFFIX, reverse);
            }
        }
        log.info("Stoichiometric matrix for {} has {} species and {} reaction columns.", network.getId(),
                m, this.columns.size());
    }

    /**
     * Add a column to the matrix.
     *
     * @param label		label for the column
     * @param column	column vector
     */
    private void addColumn(String label, int[] column) {
        this.columns.add(column);
        this.labels.add(label);
    }

    /**
     * @return the number of species rows
     */
    public int getSpeciesCount() {
        return this.species.size();
    }

    /**
     * @return the number of reaction columns
     */
    public int getColumnCount() {
        return this.columns.size();
    }

    /**
     * @return the species index for the rows
     */
    public SpeciesIndex getSpecies() {
        return this.species;
    }

    /**
     * @return the label of a column (the reaction ID, with a suffix for a reverse direction)
     *
     * @param j		index of the column
     */
    public String getLabel(int j) {
        return this.labels.get(j);
    }

    /**
     * @return the column labels, in order
     */
    public List<String> getLabels() {
        return Collections.unmodifiableList(this.labels);
    }

    /**
     * @return a copy of the specified column
     *
     * @param j		index of the column
     */
    public int[] getColumn(int j) {
        return this.columns.get(j).clone();
    }

    /**
     * @return the entry at the specified row and column
     *
     * @param i		species row index
     * @param j		reaction column index
     */
    public int getEntry(int i, int j) {
        return this.columns.get(j)[i];
    }

    /**
     * @return the matrix in exact rational form, species by reaction columns
     */
    public FieldMatrix<BigFraction> toFieldMatrix() {
        final int m = this.getSpeciesCount();
        final int r = this.getColumnCount();
        FieldMatrix<BigFraction> retVal = new Array2DRowFieldMatrix<BigFraction>(BigFractionField.getInstance(), m, r);
        for (int j = 0; j < r; j++) {
            int[] column = this.columns.get(j);
            for (int i = 0; i < m; i++)
                retVal.setEntry(i, j, new BigFraction(column[i]));
        }
        return retVal;
    }

    /**
     * Determine whether a vector is a conservation vector for this matrix, that is, whether its
     * dot product with every column is zero.
     *
     * @param vector	vector of species weights
     *
     * @return TRUE if the weighted species total is unchanged by every reaction
     */
    public boolean isConserved(int[] vector) {
        boolean retVal = true;
        for (int j = 0; j < this.columns.size() && retVal; j++) {
            int[] column = this.columns.get(j);
            long total = 0;
            for (int i = 0; i < column.length; i++)
                total += (long) vector[i] * column[i];
            retVal = (total == 0);
        }
        return retVal;
    }

    /**
     * Write the matrix as a tab-delimited table with species rows and reaction columns.
     *
     * @param writer	output print writer
     */
    public void write(PrintWriter writer) {
        writer.println("species\t" + String.join("\t", this.labels));
        for (int i = 0; i < this.species.size(); i++) {
            StringBuilder line = new StringBuilder(this.species.get(i));
            for (int[] column : this.columns)
                line.append('\t').append(column[i]);
            writer.println(line);
        }
    }

}
