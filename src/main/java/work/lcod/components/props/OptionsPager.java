package work.lcod.components.props;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;

/**
 * Restartable sequence of option pages. Each iteration starts at page 0 and feeds the previous
 * page's {@code nextPageToken} into the next request until the provider is exhausted or
 * {@code maxPages} pages were read.
 */
public final class OptionsPager implements Iterable<OptionsPage> {
    private final PageFetcher fetcher;
    private final int maxPages;

    public OptionsPager(PageFetcher fetcher, int maxPages) {
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        if (maxPages <= 0) {
            throw new IllegalArgumentException("maxPages must be > 0");
        }
        this.maxPages = maxPages;
    }

    public List<PropOption> allOptions() {
        var options = new ArrayList<PropOption>();
        for (OptionsPage page : this) {
            options.addAll(page.options());
        }
        return options;
    }

    @Override
    public Iterator<OptionsPage> iterator() {
        return new Iterator<>() {
            private int page;
            private String context;
            private boolean done;

            @Override
            public boolean hasNext() {
                return !done && page < maxPages;
            }

            @Override
            public OptionsPage next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                OptionsPage result = fetcher.fetch(page, context);
                page++;
                context = result.nextPageToken();
                if (result.isLast()) {
                    done = true;
                }
                return result;
            }
        };
    }

    @FunctionalInterface
    public interface PageFetcher {
        OptionsPage fetch(int page, String prevContext);
    }
}
