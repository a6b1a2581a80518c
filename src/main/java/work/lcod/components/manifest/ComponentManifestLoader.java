package work.lcod.components.manifest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import java.io.IOException;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.tomlj.Toml;
import org.tomlj.TomlArray;
import org.tomlj.TomlParseResult;
import org.tomlj.TomlTable;
import work.lcod.components.dedupe.DedupeStrategy;
import work.lcod.components.definition.ComponentDefinition;
import work.lcod.components.definition.ComponentHandler;
import work.lcod.components.props.AppProp;
import work.lcod.components.props.InterfaceProp;
import work.lcod.components.props.PropOption;
import work.lcod.components.props.PropSpec;
import work.lcod.components.props.PropType;
import work.lcod.components.props.ServiceProp;
import work.lcod.components.props.UserInputProp;
import work.lcod.components.trigger.TimerConfig;

/**
 * Reads component manifests ({@code .toml}, {@code .yaml}, {@code .yml}) into definitions. The
 * manifest declares metadata and the data half of the prop schema; the {@code handler} class
 * contributes run, hooks, methods and any props that need code (options providers, app methods).
 */
public final class ComponentManifestLoader {
    private static final Logger log = LoggerFactory.getLogger(ComponentManifestLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ComponentManifestLoader() {}

    public static ComponentDefinition load(Path manifestPath) {
        if (manifestPath == null || !Files.isRegularFile(manifestPath)) {
            throw new ManifestException(manifestPath, "manifest not found");
        }
        Map<String, Object> document = read(manifestPath);
        var definition = fromMap(manifestPath, document, Thread.currentThread().getContextClassLoader());
        log.debug("Loaded manifest {} ({} props)", manifestPath, definition.props().size());
        return definition;
    }

    static Map<String, Object> read(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        try {
            if (fileName.endsWith(".toml")) {
                TomlParseResult result = Toml.parse(Files.readString(path));
                if (result.hasErrors()) {
                    throw new ManifestException(path, "invalid TOML: " + result.errors().get(0).toString());
                }
                return tableToMap(result);
            }
            if (fileName.endsWith(".yaml") || fileName.endsWith(".yml")) {
                JsonNode root = YAML_MAPPER.readTree(path.toFile());
                if (root == null || !root.isObject()) {
                    throw new ManifestException(path, "manifest root must be a mapping");
                }
                @SuppressWarnings("unchecked")
                var map = (Map<String, Object>) convertNode(root);
                return map;
            }
        } catch (IOException ex) {
            throw new ManifestException(path, "unable to read manifest: " + ex.getMessage(), ex);
        }
        throw new ManifestException(path, "unsupported manifest format (expected .toml, .yaml or .yml)");
    }

    static ComponentDefinition fromMap(Path source, Map<String, Object> document, ClassLoader classLoader) {
        String name = requireString(source, document, "name");
        String handlerClass = requireString(source, document, "handler");
        ComponentHandler handler = instantiate(source, handlerClass, classLoader);

        ComponentDefinition.Builder builder = ComponentDefinition.fromHandler(name, handler);
        builder.version(optionalString(source, document, "version"));
        builder.description(optionalString(source, document, "description"));
        try {
            builder.dedupe(DedupeStrategy.from(optionalString(source, document, "dedupe")));
        } catch (IllegalArgumentException ex) {
            throw new ManifestException(source, ex.getMessage(), ex);
        }

        Object props = document.get("props");
        if (props != null && !(props instanceof Map<?, ?>)) {
            throw new ManifestException(source, "'props' must be a table");
        }
        if (props instanceof Map<?, ?> table) {
            for (var entry : table.entrySet()) {
                String propName = String.valueOf(entry.getKey());
                builder.prop(propName, parseProp(source, propName, entry.getValue()));
            }
        }
        handler.props().forEach(builder::prop);
        try {
            return builder.build();
        } catch (RuntimeException ex) {
            throw new ManifestException(source, ex.getMessage(), ex);
        }
    }

    private static PropSpec parseProp(Path source, String propName, Object raw) {
        if (!(raw instanceof Map<?, ?> table)) {
            throw new ManifestException(source, "prop '" + propName + "' must be a table");
        }
        Object type = table.get("type");
        if (!(type instanceof String typeName)) {
            throw new ManifestException(source, "prop '" + propName + "' has no type");
        }
        try {
            switch (typeName) {
                case "$.interface.timer":
                    return table.containsKey("intervalSeconds") || table.containsKey("cron")
                        ? InterfaceProp.timer(TimerConfig.from(table))
                        : InterfaceProp.timer();
                case "$.interface.http":
                    return InterfaceProp.http();
                case "$.service.db":
                    return ServiceProp.db();
                case "app":
                    Object slug = table.get("app");
                    if (!(slug instanceof String appSlug) || appSlug.isBlank()) {
                        throw new ManifestException(source, "app prop '" + propName + "' needs an 'app' slug");
                    }
                    return AppProp.of(appSlug);
                default:
                    return parseUserInput(source, propName, PropType.from(typeName), table);
            }
        } catch (IllegalArgumentException ex) {
            throw new ManifestException(source, "prop '" + propName + "': " + ex.getMessage(), ex);
        }
    }

    private static UserInputProp parseUserInput(Path source, String propName, PropType type, Map<?, ?> table) {
        var builder = UserInputProp.builder(type);
        if (table.get("label") instanceof String label) {
            builder.label(label);
        }
        if (table.get("description") instanceof String description) {
            builder.description(description);
        }
        Object optional = table.get("optional");
        if (optional != null) {
            if (!(optional instanceof Boolean flag)) {
                throw new ManifestException(source, "prop '" + propName + "': optional must be a boolean");
            }
            builder.optional(flag);
        }
        if (table.containsKey("default")) {
            builder.defaultValue(table.get("default"));
        }
        Object options = table.get("options");
        if (options != null) {
            if (!(options instanceof List<?> list)) {
                throw new ManifestException(source, "prop '" + propName + "': options must be a list");
            }
            var parsed = new ArrayList<PropOption>();
            for (Object option : list) {
                if (option instanceof Map<?, ?> entry) {
                    Object label = entry.get("label");
                    Object value = entry.containsKey("value") ? entry.get("value") : label;
                    parsed.add(new PropOption(String.valueOf(label == null ? value : label), value));
                } else {
                    parsed.add(PropOption.of(option));
                }
            }
            builder.staticOptions(parsed);
        }
        return builder.build();
    }

    private static ComponentHandler instantiate(Path source, String className, ClassLoader classLoader) {
        try {
            Class<?> type = Class.forName(className, true, classLoader == null ? ComponentManifestLoader.class.getClassLoader() : classLoader);
            if (!ComponentHandler.class.isAssignableFrom(type)) {
                throw new ManifestException(source, className + " does not implement " + ComponentHandler.class.getSimpleName());
            }
            return (ComponentHandler) type.getDeclaredConstructor().newInstance();
        } catch (ClassNotFoundException ex) {
            throw new ManifestException(source, "handler class not found: " + className, ex);
        } catch (NoSuchMethodException ex) {
            throw new ManifestException(source, "handler " + className + " needs a public no-arg constructor", ex);
        } catch (InvocationTargetException ex) {
            throw new ManifestException(source, "handler " + className + " failed to initialize: " + ex.getCause(), ex.getCause());
        } catch (ReflectiveOperationException ex) {
            throw new ManifestException(source, "cannot instantiate handler " + className, ex);
        }
    }

    private static String requireString(Path source, Map<String, Object> document, String key) {
        String value = optionalString(source, document, key);
        if (value == null || value.isBlank()) {
            throw new ManifestException(source, "missing '" + key + "'");
        }
        return value;
    }

    private static String optionalString(Path source, Map<String, Object> document, String key) {
        Object value = document.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof String text)) {
            throw new ManifestException(source, "'" + key + "' must be a string");
        }
        return text;
    }

    private static Map<String, Object> tableToMap(TomlTable table) {
        var map = new LinkedHashMap<String, Object>();
        for (String key : table.keySet()) {
            map.put(key, tomlValue(table.get(List.of(key))));
        }
        return map;
    }

    private static Object tomlValue(Object value) {
        if (value instanceof TomlTable table) {
            return tableToMap(table);
        }
        if (value instanceof TomlArray array) {
            var list = new ArrayList<Object>(array.size());
            for (int i = 0; i < array.size(); i++) {
                list.add(tomlValue(array.get(i)));
            }
            return list;
        }
        return value;
    }

    private static Object convertNode(JsonNode node) {
        if (node.isObject()) {
            var map = new LinkedHashMap<String, Object>();
            var fields = node.fields();
            while (fields.hasNext()) {
                var entry = fields.next();
                map.put(entry.getKey(), convertNode(entry.getValue()));
            }
            return map;
        }
        if (node.isArray()) {
            var list = new ArrayList<Object>();
            for (var item : node) {
                list.add(convertNode(item));
            }
            return list;
        }
        if (node.isIntegralNumber()) {
            return node.canConvertToLong() ? (Object) node.longValue() : node.bigIntegerValue();
        }
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isBoolean()) {
            return node.booleanValue();
        }
        if (node.isNull()) {
            return null;
        }
        return node.asText();
    }
}
