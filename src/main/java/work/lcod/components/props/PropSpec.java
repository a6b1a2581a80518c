package work.lcod.components.props;

/**
 * Declared slot of a component's prop schema. Implemented by {@link UserInputProp},
 * {@link InterfaceProp}, {@link ServiceProp}, {@link AppProp} and {@link PropDefinitionRef}.
 */
public interface PropSpec {
    /**
     * Manifest spelling of the prop type ({@code string}, {@code $.interface.timer}, ...).
     */
    String typeName();
}
