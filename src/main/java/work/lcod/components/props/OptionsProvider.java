package work.lcod.components.props;

/**
 * Dynamic option source of a user-input prop. Must behave as a pure function of the query.
 */
@FunctionalInterface
public interface OptionsProvider {
    OptionsPage options(OptionsQuery query) throws Exception;
}
