package com.starwatch.source;

import com.starwatch.exception.StarSourceException;
import com.starwatch.infra.Cancellation;
import com.starwatch.model.PageDirection;
import com.starwatch.model.RepoPage;
import com.starwatch.model.StarredRepo;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads every page front to back. Makes no assumption about the list order.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class FullFetchStrategy implements StarFetchStrategy {

    private final StarSource starSource;

    @Override
    public List<StarredRepo> fetch(List<StarredRepo> known) {
        List<StarredRepo> all = new ArrayList<>();
        Optional<String> cursor = Optional.empty();

        while (true) {
            Cancellation.throwIfCancelled("full fetch");

            RepoPage page = starSource.fetchPage(PageDirection.FORWARD, cursor);
            all.addAll(page.repos());
            log.info("Fetched {}/{} repos", all.size(), page.totalCount());

            if (!page.pageInfo().hasNextPage()) {
                return all;
            }
            if (page.pageInfo().endCursor() == null) {
                throw new StarSourceException("Source reported a next page without an end cursor");
            }
            cursor = Optional.of(page.pageInfo().endCursor());
        }
    }
}
