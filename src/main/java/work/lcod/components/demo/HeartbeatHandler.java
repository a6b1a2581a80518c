package work.lcod.components.demo;

import java.util.LinkedHashMap;
import work.lcod.components.definition.ComponentHandler;
import work.lcod.components.runtime.EmitMetadata;
import work.lcod.components.runtime.ExecutionContext;
import work.lcod.components.store.StateStore;
import work.lcod.components.trigger.InvocationEvent;
import work.lcod.components.trigger.TimerEvent;

/**
 * Counts timer fires in the instance store and emits one beat per fire, keyed by the counter.
 */
public final class HeartbeatHandler implements ComponentHandler {
    static final String COUNTER_KEY = "beats";

    @Override
    public void activate(ExecutionContext ctx) {
        StateStore db = ctx.db("db");
        if (db.get(COUNTER_KEY).isEmpty()) {
            db.set(COUNTER_KEY, 0L);
        }
    }

    @Override
    public void run(InvocationEvent event, ExecutionContext ctx) {
        StateStore db = ctx.db("db");
        long beats = db.get(COUNTER_KEY).map(value -> ((Number) value).longValue()).orElse(0L) + 1;
        db.set(COUNTER_KEY, beats);
        Long ts = event instanceof TimerEvent timer ? timer.timestamp() : null;
        var metadata = new EmitMetadata(beats, ctx.prop("label") + " #" + beats, ts);
        var data = new LinkedHashMap<String, Object>();
        data.put("beat", beats);
        data.put("label", ctx.prop("label"));
        ctx.emit(data, metadata);
    }
}
