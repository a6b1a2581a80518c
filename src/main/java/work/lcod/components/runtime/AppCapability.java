package work.lcod.components.runtime;

import java.util.Map;
import work.lcod.components.api.ComponentException;
import work.lcod.components.definition.ComponentMethod;

/**
 * Runtime view of an app prop: its credentials plus the methods the app declares.
 */
public final class AppCapability {
    private final String propName;
    private final String appSlug;
    private final Map<String, Object> auth;
    private final Map<String, ComponentMethod> methods;
    private final ExecutionContext context;

    AppCapability(
        String propName,
        String appSlug,
        Map<String, Object> auth,
        Map<String, ComponentMethod> methods,
        ExecutionContext context
    ) {
        this.propName = propName;
        this.appSlug = appSlug;
        this.auth = auth;
        this.methods = methods;
        this.context = context;
    }

    public String propName() {
        return propName;
    }

    public String appSlug() {
        return appSlug;
    }

    public Map<String, Object> auth() {
        return auth;
    }

    public Object call(String method, Map<String, Object> args) throws Exception {
        ComponentMethod target = methods.get(method);
        if (target == null) {
            throw new ComponentException("unknown_method", "App '" + appSlug + "' has no method '" + method + "'");
        }
        return target.invoke(context, args == null ? Map.of() : args);
    }
}
