package work.lcod.components.props;

import java.util.List;

/**
 * Page returned by an {@link OptionsProvider}. Pagination ends with an empty page or a page
 * without {@code nextPageToken}.
 */
public record OptionsPage(List<PropOption> options, String nextPageToken) {
    public OptionsPage {
        options = options == null ? List.of() : List.copyOf(options);
    }

    public static OptionsPage last(List<PropOption> options) {
        return new OptionsPage(options, null);
    }

    public static OptionsPage empty() {
        return new OptionsPage(List.of(), null);
    }

    public boolean isLast() {
        return options.isEmpty() || nextPageToken == null;
    }
}
