/**
 *
 */
package org.theseed.crn.cli;

import java.io.IOException;
import java.io.PrintWriter;

import org.theseed.crn.Reaction;

/**
 * This command lists the reactions in a network.  For each reaction, we indicate whether or
 * not it is reversible and show the formula.
 *
 * The positional parameter is the name of the network JSON file.
 *
 * The command-line options are as follows.
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report, if not STDOUT
 *
 * @author Bruce Parrello
 *
 */
public class ReactionsProcessor extends BaseNetworkReportProcessor {

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateNetworkReportParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        writer.println("reaction_id\treversible\tformula");
        for (Reaction reaction : this.getNetwork().getReactions()) {
            String rFlag = (reaction.isReversible() ? "Y" : "");
            writer.println(reaction.getId() + "\t" + rFlag + "\t" + reaction.getFormula());
        }
    }

}
