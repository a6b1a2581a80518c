package work.lcod.components.props;

import work.lcod.components.api.ComponentException;

public final class OptionsProviderException extends ComponentException {
    public OptionsProviderException(String message, Throwable cause) {
        super("options_provider", message, cause);
    }
}
