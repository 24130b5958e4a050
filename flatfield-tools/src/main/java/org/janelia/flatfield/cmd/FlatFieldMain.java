package org.janelia.flatfield.cmd;

import java.util.Arrays;
import java.util.List;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;

import org.apache.commons.lang3.StringUtils;
import org.janelia.flatfield.correction.FlatFieldCorrectionException;
import org.janelia.flatfield.correction.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 */
public class FlatFieldMain {

    private static final Logger LOG = LoggerFactory.getLogger(FlatFieldMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE_ERROR = 1;
    static final int EXIT_INVALID_REQUEST = 2;
    static final int EXIT_CORRECTION_ERROR = 3;
    static final int EXIT_RUNTIME_ERROR = 4;

    public static void main(String[] argv) {
        int exitCode = run(argv);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    static int run(String[] argv) {
        CommonArgs commonArgs = new CommonArgs();
        List<AbstractCmd> cmds = Arrays.asList(
                new CorrectFlatFieldCmd("correct", commonArgs)
        );
        JCommander.Builder cmdlineBuilder = JCommander.newBuilder()
                .addObject(commonArgs);
        cmds.forEach(cmd -> cmdlineBuilder.addCommand(cmd.getCommandName(), cmd.getArgs()));
        JCommander cmdline = cmdlineBuilder.build();
        cmdline.setProgramName("flatfield");

        try {
            cmdline.parse(argv);
        } catch (ParameterException e) {
            LOG.error("Invalid arguments: {}", e.getMessage());
            cmdline.usage();
            return EXIT_USAGE_ERROR;
        }
        if (commonArgs.displayHelpMessage) {
            cmdline.usage();
            return EXIT_OK;
        }
        String commandName = cmdline.getParsedCommand();
        AbstractCmd cmd = cmds.stream()
                .filter(c -> c.matches(commandName))
                .findFirst()
                .orElse(null);
        if (cmd == null) {
            LOG.error("Missing or unknown command: {}", StringUtils.defaultIfBlank(commandName, "<none>"));
            cmdline.usage();
            return EXIT_USAGE_ERROR;
        }
        List<String> errors = cmd.getArgs().validate();
        if (!errors.isEmpty()) {
            LOG.error("Invalid arguments for {}: {}", cmd.getCommandName(), errors);
            cmdline.usage();
            return EXIT_USAGE_ERROR;
        }
        try {
            cmd.execute();
            return EXIT_OK;
        } catch (ValidationException e) {
            LOG.error("Cannot correct the image: {}", e.getMessage());
            return EXIT_INVALID_REQUEST;
        } catch (FlatFieldCorrectionException e) {
            LOG.error("Correction failed", e);
            return EXIT_CORRECTION_ERROR;
        } catch (RuntimeException e) {
            LOG.error("Error running {}", cmd.getCommandName(), e);
            return EXIT_RUNTIME_ERROR;
        }
    }
}
