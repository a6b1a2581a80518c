package work.lcod.components.cli;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import picocli.CommandLine;
import work.lcod.components.props.OptionsPage;
import work.lcod.components.props.OptionsPager;
import work.lcod.components.props.PropOption;
import work.lcod.components.props.PropResolver;

@CommandLine.Command(
    name = "options",
    description = "List the options of a prop, one page at a time or all pages with --all.",
    mixinStandardHelpOptions = true
)
final class OptionsCommand implements Callable<Integer> {
    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    @CommandLine.Mixin
    private ManifestOptions options;

    @CommandLine.Option(names = "--prop", required = true, description = "Prop whose options are listed.")
    private String prop;

    @CommandLine.Option(names = "--page", defaultValue = "0", description = "Page number.")
    private int page;

    @CommandLine.Option(names = "--context", description = "nextPageToken of the previous page.")
    private String context;

    @CommandLine.Option(names = "--all", description = "Follow nextPageToken until the last page.")
    private boolean all;

    @CommandLine.Option(names = "--max-pages", defaultValue = "50", description = "Page cap for --all.")
    private int maxPages;

    @Override
    public Integer call() throws Exception {
        options.applyLogLevel();
        var definition = options.definition();
        var values = options.values();
        var resolver = new PropResolver();

        var output = new LinkedHashMap<String, Object>();
        output.put("prop", prop);
        if (all) {
            var pager = new OptionsPager(
                (pageNumber, prevContext) -> resolver.fetchOptionsPage(definition.props(), prop, pageNumber, prevContext, values),
                maxPages
            );
            output.put("options", toList(pager.allOptions()));
        } else {
            OptionsPage result = resolver.fetchOptionsPage(definition.props(), prop, page, context, values);
            output.put("page", page);
            output.put("options", toList(result.options()));
            output.put("nextPageToken", result.nextPageToken());
        }
        var out = spec.commandLine().getOut();
        out.println(ManifestOptions.JSON.writerWithDefaultPrettyPrinter().writeValueAsString(output));
        out.flush();
        return 0;
    }

    private static List<Map<String, Object>> toList(List<PropOption> options) {
        var list = new ArrayList<Map<String, Object>>();
        for (PropOption option : options) {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("label", option.label());
            entry.put("value", option.value());
            list.add(entry);
        }
        return list;
    }
}
