package work.lcod.components.props;

import java.util.Map;

/**
 * Arguments of one options page request. {@code prevContext} is the {@code nextPageToken} of the
 * previous page, or {@code null} for the first one; {@code inputValues} come from the referencing
 * prop's {@link InputValues}.
 */
public record OptionsQuery(int page, String prevContext, Map<String, Object> inputValues) {
    public OptionsQuery {
        if (page < 0) {
            throw new IllegalArgumentException("page must be >= 0");
        }
        inputValues = inputValues == null ? Map.of() : inputValues;
    }
}
