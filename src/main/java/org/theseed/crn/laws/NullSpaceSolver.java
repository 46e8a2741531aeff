/**
 *
 */
package org.theseed.crn.laws;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.math3.fraction.BigFraction;
import org.apache.commons.math3.linear.ArrayFieldVector;
import org.apache.commons.math3.linear.FieldMatrix;
import org.apache.commons.math3.linear.FieldVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.crn.StoichiometricMatrix;

/**
 * This class computes the left null space of a stoichiometric matrix in exact rational
 * arithmetic.  The transpose of the matrix is put in reduced row-echelon form.  Each non-pivot
 * (free) species produces one basis vector that has a 1 for the free species, the negated
 * echelon entries for the pivot species, and zeroes elsewhere.
 *
 * @author Bruce Parrello
 *
 */
public class NullSpaceSolver {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(NullSpaceSolver.class);

    /**
     * This object holds a matrix in reduced row-echelon form along with its pivot columns.
     */
    public static class Echelon {

        /** reduced matrix data, row-major */
        private final BigFraction[][] rows;
        /** column index of the pivot for each nonzero row */
        private final List<Integer> pivots;

        /**
         * Reduce a matrix to row-echelon form.
         *
         * @param matrix	matrix to reduce (not modified)
         */
        public Echelon(FieldMatrix<BigFraction> matrix) {
            this.rows = matrix.getData();
            this.pivots = new ArrayList<Integer>();
            final int nRows = matrix.getRowDimension();
            final int nCols = matrix.getColumnDimension();
            int top = 0;
            for (int col = 0; col < nCols && top < nRows; col++) {
                // Find a row with a nonzero entry in this column.
                int found = -1;
                for (int i = top; i < nRows && found < 0; i++) {
                    if (! isZero(this.rows[i][col]))
                        found = i;
                }
                if (found >= 0) {
                    BigFraction[] pivotRow = this.rows[found];
                    this.rows[found] = this.rows[top];
                    this.rows[top] = pivotRow;
                    // Scale the pivot to 1.
                    BigFraction scale = pivotRow[col];
                    for (int j = col; j < nCols; j++)
                        pivotRow[j] = pivotRow[j].divide(scale);
                    // Clear the column in every other row.
                    for (int i = 0; i < nRows; i++) {
                        BigFraction factor = this.rows[i][col];
                        if (i != top && ! isZero(factor)) {
                            for (int j = col; j < nCols; j++)
                                this.rows[i][j] = this.rows[i][j].subtract(factor.multiply(pivotRow[j]));
                        }
                    }
                    this.pivots.add(col);
                    top++;
                }
            }
        }

        /**
         * @return the rank of the reduced matrix
         */
        public int rank() {
            return this.pivots.size();
        }

        /**
         * @return the pivot column indices, in row order
         */
        public List<Integer> getPivots() {
            return this.pivots;
        }

        /**
         * @return the entry at the specified position of the reduced matrix
         *
         * @param i		row index
         * @param j		column index
         */
        public BigFraction getEntry(int i, int j) {
            return this.rows[i][j];
        }

    }

    /**
     * @return TRUE if the specified fraction is zero
     *
     * @param value		fraction to check
     */
    protected static boolean isZero(BigFraction value) {
        return value.getNumerator().signum() == 0;
    }

    /**
     * Compute a basis for the left null space of a stoichiometric matrix.
     *
     * @param matrix	stoichiometric matrix of interest
     *
     * @return a list of basis vectors, each with one entry per species (empty if there are no
     * 		   conservation laws)
     */
    public List<FieldVector<BigFraction>> leftNullSpace(StoichiometricMatrix matrix) {
        final int m = matrix.getSpeciesCount();
        List<FieldVector<BigFraction>> retVal = new ArrayList<FieldVector<BigFraction>>();
        if (m > 0) {
            Echelon reduced = new Echelon(matrix.toFieldMatrix().transpose());
            List<Integer> pivots = reduced.getPivots();
            boolean[] isPivot = new boolean[m];
            for (int p : pivots)
                isPivot[p] = true;
            for (int free = 0; free < m; free++) {
                if (! isPivot[free]) {
                    BigFraction[] vector = new BigFraction[m];
                    for (int i = 0; i < m; i++)
                        vector[i] = BigFraction.ZERO;
                    vector[free] = BigFraction.ONE;
                    for (int i = 0; i < pivots.size(); i++)
                        vector[pivots.get(i)] = reduced.getEntry(i, free).negate();
                    retVal.add(new ArrayFieldVector<BigFraction>(vector, false));
                }
            }
            log.info("Stoichiometric matrix has rank {}; left null space has dimension {}.",
                    pivots.size(), retVal.size());
        }
        return retVal;
    }

    /**
     * @return the rank of a stoichiometric matrix
     *
     * @param matrix	stoichiometric matrix of interest
     */
    public int rank(StoichiometricMatrix matrix) {
        int retVal = 0;
        if (matrix.getSpeciesCount() > 0)
            retVal = new Echelon(matrix.toFieldMatrix()).rank();
        return retVal;
    }

}
