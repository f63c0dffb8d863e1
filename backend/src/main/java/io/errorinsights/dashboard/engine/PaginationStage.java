package io.errorinsights.dashboard.engine;

import java.util.List;
import org.springframework.stereotype.Component;

@Component
public class PaginationStage {

    /**
     * Returns page {@code page} (1-based) of {@code pageSize} items; a page past the end is empty.
     */
    public <T> List<T> paginate(List<T> items, int page, int pageSize) {
        if (pageSize <= 0) {
            throw QueryException.invalidArgument("Page size must be positive, got " + pageSize);
        }
        if (page < 1) {
            throw QueryException.invalidArgument("Page must be 1 or greater, got " + page);
        }
        long start = (long) (page - 1) * pageSize;
        if (start >= items.size()) {
            return List.of();
        }
        int end = (int) Math.min(items.size(), start + pageSize);
        return List.copyOf(items.subList((int) start, end));
    }
}
