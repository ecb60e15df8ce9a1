package work.lcod.worlddata.cli;

import picocli.CommandLine;
import work.lcod.worlddata.api.WorldDataService;

/**
 * Prints only the innermost cause of a failed run. Configuration problems exit like usage errors.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(Exception ex, CommandLine commandLine, CommandLine.ParseResult parseResult) {
        Throwable cause = ex;
        while (cause.getCause() != null && cause.getCause() != cause) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        if (message == null || message.isBlank()) {
            message = cause.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText("worlddata: " + message));
        if (Boolean.getBoolean(WorldDataService.DEBUG_PROPERTY)) {
            ex.printStackTrace(commandLine.getErr());
        }
        CommandLine.Model.CommandSpec spec = commandLine.getCommandSpec();
        return cause instanceof IllegalArgumentException
            ? spec.exitCodeOnInvalidInput()
            : spec.exitCodeOnExecutionException();
    }
}
