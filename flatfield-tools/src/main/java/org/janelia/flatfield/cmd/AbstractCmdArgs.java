package org.janelia.flatfield.cmd;

import java.util.Collections;
import java.util.List;

import com.beust.jcommander.ParametersDelegate;

class AbstractCmdArgs {

    @ParametersDelegate
    final CommonArgs commonArgs;

    AbstractCmdArgs(CommonArgs commonArgs) {
        this.commonArgs = commonArgs;
    }

    String getConfigFileName() {
        return commonArgs.configFileName;
    }

    boolean displayHelpMessage() {
        return commonArgs.displayHelpMessage;
    }

    /**
     * @return the list of argument errors; empty if the arguments can be used.
     */
    List<String> validate() {
        return Collections.emptyList();
    }
}
