package work.lcod.components.cli;

import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.components.api.LogLevel;
import work.lcod.components.runtime.ComponentInstance;
import work.lcod.components.runtime.ComponentRuntime;
import work.lcod.components.runtime.InMemoryEventSink;
import work.lcod.components.runtime.InvocationResult;

@CommandLine.Command(
    name = "run",
    description = "Deploy a component, fire one manual or timer event and print the result as JSON.",
    mixinStandardHelpOptions = true
)
final class RunCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ManifestOptions options;

    @CommandLine.Option(
        names = "--payload",
        paramLabel = "JSON",
        description = "Manual event payload."
    )
    private String payload;

    @CommandLine.Option(
        names = "--timer",
        paramLabel = "PROP",
        description = "Fire this timer prop instead of a manual event."
    )
    private String timer;

    @CommandLine.Option(
        names = "--instance-id",
        description = "Stable instance id, so state in --state-dir is reused across runs."
    )
    private String instanceId;

    @Override
    public Integer call() throws Exception {
        if (timer != null && payload != null) {
            throw new CommandLine.ParameterException(spec.commandLine(), "--payload and --timer are mutually exclusive");
        }
        LogLevel logLevel = options.applyLogLevel();
        var definition = options.definition();
        var values = options.values();
        Object manualPayload = ManifestOptions.parseValue(payload, "--payload");

        try (var runtime = new ComponentRuntime(options.configuration(logLevel), new InMemoryEventSink())) {
            ComponentInstance instance = instanceId == null
                ? runtime.deploy(definition, values)
                : runtime.deploy(ComponentRuntime.DEFAULT_OWNER, definition, values, instanceId);
            InvocationResult result = timer == null
                ? runtime.invoke(instance.id(), manualPayload)
                : runtime.fireTimer(instance.id(), timer);
            var out = spec.commandLine().getOut();
            out.println(ManifestOptions.JSON.writerWithDefaultPrettyPrinter().writeValueAsString(result.toSerializableMap()));
            out.flush();
            return result.status().exitCode();
        }
    }
}
