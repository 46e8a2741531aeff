/**
 *
 */
package org.theseed.crn.cli;

import java.io.IOException;
import java.io.PrintWriter;

import org.theseed.crn.SpeciesIndex;
import org.theseed.crn.StoichiometricMatrix;
import org.theseed.crn.laws.NullSpaceSolver;

/**
 * This command writes the stoichiometric matrix of a reaction network as a tab-delimited
 * table, one row per species and one column per reaction direction.
 *
 * The positional parameter is the name of the network JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * --order	species ordering (AUTO, LEXICOGRAPHIC, NUMERIC_SUFFIX, DECLARED; default AUTO)
 *
 * @author Bruce Parrello
 *
 */
public class MatrixProcessor extends BaseNetworkReportProcessor {

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateNetworkReportParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        SpeciesIndex species = new SpeciesIndex(this.getNetwork(), this.getOrder());
        StoichiometricMatrix matrix = new StoichiometricMatrix(this.getNetwork(), species);
        log.info("Matrix rank is {}.", new NullSpaceSolver().rank(matrix));
        matrix.write(writer);
    }

}
