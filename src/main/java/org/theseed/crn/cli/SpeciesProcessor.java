/**
 *
 */
package org.theseed.crn.cli;

import java.io.IOException;
import java.io.PrintWriter;

import org.theseed.crn.ReactionNetwork;
import org.theseed.crn.SpeciesIndex;

/**
 * This is a simple command that lists the species in a network, in canonical order.  For each
 * species we show its row index and the number of reactions that involve it.
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
public class SpeciesProcessor extends BaseNetworkReportProcessor {

    @Override
    protected void setReporterDefaults() {
    }

    @Override
    protected void validateNetworkReportParms() throws IOException, ParseFailureException {
    }

    @Override
    protected void runReporter(PrintWriter writer) throws Exception {
        ReactionNetwork network = this.getNetwork();
        SpeciesIndex species = new SpeciesIndex(network, this.getOrder());
        writer.println("index\tspecies\treactions");
        for (int i = 0; i < species.size(); i++) {
            String name = species.get(i);
            writer.format("%d\t%s\t%d%n", i, name, network.countReactions(name));
        }
    }

}
