package work.lcod.components.cli;

import picocli.CommandLine;

@CommandLine.Command(
    name = "lcod-components",
    description = "Deploy and invoke components from their manifests.",
    mixinStandardHelpOptions = true,
    versionProvider = VersionProvider.class,
    subcommands = {RunCommand.class, OptionsCommand.class, ServeCommand.class}
)
final class ComponentsCommand implements Runnable {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @Override
    public void run() {
        throw new CommandLine.ParameterException(spec.commandLine(), "Missing subcommand (run, options or serve)");
    }
}
