package org.broadinstitute.genbank.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;

/**
 * Tools that read GenBank flat files and work with their feature tables
 */
public class GenbankProgramGroup implements CommandLineProgramGroup {

    public static final String NAME = "GenBank";
    public static final String DESCRIPTION = "Tools for reading GenBank records and extracting the sequences of their features";

    @Override
    public String getName() { return NAME; }

    @Override
    public String getDescription() { return DESCRIPTION; }
}
