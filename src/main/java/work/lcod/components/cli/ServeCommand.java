package work.lcod.components.cli;

import java.io.PrintWriter;
import java.net.InetSocketAddress;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import picocli.CommandLine;
import work.lcod.components.api.LogLevel;
import work.lcod.components.runtime.ComponentRuntime;
import work.lcod.components.runtime.JsonLinesEventSink;
import work.lcod.components.trigger.HttpTriggerServer;

@CommandLine.Command(
    name = "serve",
    description = "Deploy a component and keep it running: timers fire, HTTP endpoints are served, events are printed as JSON lines.",
    mixinStandardHelpOptions = true
)
final class ServeCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ManifestOptions options;

    @CommandLine.Option(names = "--port", defaultValue = "8080", description = "HTTP port (0 picks a free one).")
    private int port;

    @CommandLine.Option(names = "--instance-id", description = "Stable instance id for persisted state.")
    private String instanceId;

    @Override
    public Integer call() throws Exception {
        LogLevel logLevel = options.applyLogLevel();
        var definition = options.definition();
        var values = options.values();
        PrintWriter out = spec.commandLine().getOut();
        var stopped = new CountDownLatch(1);

        try (var runtime = new ComponentRuntime(options.configuration(logLevel), new JsonLinesEventSink(out));
             var server = new HttpTriggerServer(runtime.httpDispatcher(), new InetSocketAddress(port))) {
            var instance = instanceId == null
                ? runtime.deploy(definition, values)
                : runtime.deploy(ComponentRuntime.DEFAULT_OWNER, definition, values, instanceId);
            server.start();
            spec.commandLine().getErr().println("Deployed " + instance.definition().name() + " as " + instance.id());
            if (instance.endpointId() != null) {
                spec.commandLine().getErr().println("HTTP endpoint: http://localhost:" + server.port() + "/" + instance.endpointId());
            }
            Runtime.getRuntime().addShutdownHook(new Thread(stopped::countDown, "lcod-serve-shutdown"));
            stopped.await();
        }
        return 0;
    }
}
