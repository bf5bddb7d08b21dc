package work.cinit.trace.cli;

import picocli.CommandLine;
import work.cinit.trace.pipeline.RoutineExtractionException;
import work.cinit.trace.shared.Listings;

/**
 * Keeps CLI failures short and focused on the root cause.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        String message = ex.getMessage();
        if (message == null || message.isBlank()) {
            message = ex.getClass().getSimpleName();
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (ex instanceof RoutineExtractionException routine && !routine.listing().isEmpty()) {
            commandLine.getErr().print(Listings.numbered(routine.listing()));
        }
        if (Boolean.getBoolean("cinit.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
