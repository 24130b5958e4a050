package org.janelia.flatfield.cmd;

import com.beust.jcommander.Parameter;

class CommonArgs {
    @Parameter(names = "--config", description = "Properties file that overrides the default configuration")
    String configFileName;

    @Parameter(names = "--no-pretty-print", description = "Do not indent the JSON output", arity = 0)
    boolean noPrettyPrint = false;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
