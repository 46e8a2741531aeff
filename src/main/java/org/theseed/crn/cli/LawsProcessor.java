/**
 *
 */
package org.theseed.crn.cli;

import java.io.IOException;
import java.io.PrintWriter;

import org.kohsuke.args4j.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.crn.laws.ConservationAnalysis;

/**
 * This command computes the conservation laws of a reaction network.  Each law is written as
 * a sum of species concentrations equal to a total-amount symbol.
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
 * --lower	write concentrations as lower-case species names
 * --matrix	also write the stoichiometric matrix and the 0/1 law basis
 * --raw	also write the raw null-space basis
 *
 * @author Bruce Parrello
 *
 */
public class LawsProcessor extends BaseNetworkReportProcessor {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(LawsProcessor.class);

    // COMMAND-LINE OPTIONS

    /** TRUE for lower-case concentration names */
    @Option(name = "--lower", usage = "if specified, concentrations will be written in lower case")
    private boolean lowerCase;

    /** TRUE to include the matrices */
    @Option(name = "--matrix", usage = "if specified, the stoichiometric matrix and law basis will be written")
    private boolean showMatrix;

    /** TRUE to include the raw null-space basis */
    @Option(name = "--raw", usage = "if specified, the raw null-space basis will be written")
    private boolean showRaw;

    @Override
    protected void setReporterDefaults() {
        this.lowerCase = false;
        this.showMatrix = false;
        this.showRaw = false;
    }

    @Override
    protected void validateNetworkReportParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ConservationAnalysis analysis = new ConservationAnalysis(this.getNetwork(), this.getOrder(),
                this.lowerCase);
        log.info("{} conservation laws computed for {}.", analysis.getLawCount(), this.getNetwork().getId());
        analysis.writeLaws(writer);
        if (this.showMatrix) {
            writer.println();
            writer.println("Stoichiometric matrix:");
            analysis.getMatrix().write(writer);
            if (analysis.hasLaws()) {
                writer.println();
                writer.println("Conservation law basis:");
                analysis.writeBasis(writer);
            }
        }
        if (this.showRaw && analysis.hasLaws()) {
            writer.println();
            writer.println("Null space basis:");
            analysis.writeRawBasis(writer);
        }
    }

}
