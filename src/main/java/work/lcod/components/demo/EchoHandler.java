package work.lcod.components.demo;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import work.lcod.components.definition.ComponentHandler;
import work.lcod.components.props.OptionsPage;
import work.lcod.components.props.OptionsQuery;
import work.lcod.components.props.PropOption;
import work.lcod.components.props.PropSpec;
import work.lcod.components.props.PropType;
import work.lcod.components.props.UserInputProp;
import work.lcod.components.runtime.EmitMetadata;
import work.lcod.components.runtime.ExecutionContext;
import work.lcod.components.trigger.HttpEvent;
import work.lcod.components.trigger.HttpResponse;
import work.lcod.components.trigger.InvocationEvent;
import work.lcod.components.trigger.ManualEvent;

/**
 * Emits whatever it receives. Manual payloads and HTTP bodies are echoed back; an {@code id} field
 * in a map payload becomes the event id.
 */
public final class EchoHandler implements ComponentHandler {
    static final List<String> CHANNELS = List.of("general", "alerts", "audit", "billing", "ops");
    static final int CHANNELS_PER_PAGE = 2;

    @Override
    public Map<String, PropSpec> props() {
        var channel = UserInputProp.builder(PropType.STRING)
            .label("Channel")
            .optional(true)
            .optionsProvider(EchoHandler::channels)
            .build();
        return Map.of("channel", channel);
    }

    @Override
    public void run(InvocationEvent event, ExecutionContext ctx) {
        Object payload;
        if (event instanceof HttpEvent http) {
            payload = http.body();
        } else if (event instanceof ManualEvent manual) {
            payload = manual.payload();
        } else {
            payload = event.toWire();
        }
        var data = new LinkedHashMap<String, Object>();
        data.put("prefix", ctx.prop("prefix"));
        data.put("channel", ctx.prop("channel"));
        data.put("payload", payload);
        Object id = payload instanceof Map<?, ?> map ? map.get("id") : null;
        ctx.emit(data, new EmitMetadata(id, "echo " + event.type(), null));
        if (event instanceof HttpEvent) {
            ctx.http("http").respond(HttpResponse.of(200, data));
        }
    }

    static OptionsPage channels(OptionsQuery query) {
        int from = query.page() * CHANNELS_PER_PAGE;
        if (from >= CHANNELS.size()) {
            return OptionsPage.empty();
        }
        int to = Math.min(CHANNELS.size(), from + CHANNELS_PER_PAGE);
        var options = new ArrayList<PropOption>();
        for (String channel : CHANNELS.subList(from, to)) {
            options.add(PropOption.of(channel));
        }
        return new OptionsPage(options, to < CHANNELS.size() ? "page-" + (query.page() + 1) : null);
    }
}
