package work.lcod.components.cli;

import picocli.CommandLine;
import work.lcod.components.api.ComponentException;

/**
 * Prints the root message of a failed command; the stack trace only with {@code -Dlcod.debug=true}.
 */
final class ShortErrorHandler implements CommandLine.IExecutionExceptionHandler {
    static final int COMPONENT_ERROR_EXIT_CODE = 2;

    @Override
    public int handleExecutionException(
        Exception ex,
        CommandLine commandLine,
        CommandLine.ParseResult parseResult
    ) {
        Throwable root = ex;
        while (root.getCause() != null && root.getCause() != root && !(root instanceof ComponentException)) {
            root = root.getCause();
        }
        String message = root.getMessage();
        if (message == null || message.isBlank()) {
            message = root.getClass().getSimpleName();
        }
        if (root instanceof ComponentException component) {
            message = "[" + component.code() + "] " + message;
        }
        commandLine.getErr().println(commandLine.getColorScheme().errorText(message));
        if (Boolean.getBoolean("lcod.debug")) {
            ex.printStackTrace(commandLine.getErr());
        }
        return root instanceof ComponentException
            ? COMPONENT_ERROR_EXIT_CODE
            : commandLine.getCommandSpec().exitCodeOnExecutionException();
    }
}
