package io.syncbeat.mirror;

import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Offset pagination as a lazy stream. A page is requested only when the previous one is exhausted,
 * and no further page is requested after one shorter than the page size.
 */
public final class PagedFetch {

    @FunctionalInterface
    public interface PageReader {
        List<Map<String, Object>> read(int limit, int offset);
    }

    private PagedFetch() {
    }

    public static Stream<Map<String, Object>> stream(int pageSize, PageReader reader) {
        if (pageSize <= 0) {
            throw new IllegalArgumentException("pageSize must be positive: " + pageSize);
        }
        return StreamSupport.stream(new PageSpliterator(pageSize, reader), false);
    }

    private static final class PageSpliterator extends Spliterators.AbstractSpliterator<Map<String, Object>> {

        private final int pageSize;
        private final PageReader reader;
        private Iterator<Map<String, Object>> current = List.<Map<String, Object>>of().iterator();
        private int offset;
        private boolean lastPage;

        PageSpliterator(int pageSize, PageReader reader) {
            super(Long.MAX_VALUE, Spliterator.ORDERED | Spliterator.NONNULL);
            this.pageSize = pageSize;
            this.reader = reader;
        }

        @Override
        public boolean tryAdvance(Consumer<? super Map<String, Object>> action) {
            while (!current.hasNext()) {
                if (lastPage) {
                    return false;
                }
                List<Map<String, Object>> page = reader.read(pageSize, offset);
                if (page == null) {
                    page = List.of();
                }
                offset += pageSize;
                lastPage = page.size() < pageSize;
                current = page.iterator();
            }
            action.accept(current.next());
            return true;
        }
    }
}
