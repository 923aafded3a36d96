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
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Fetches only repositories starred since the known snapshot.
 *
 * <p>Relies on the star list being ordered oldest to newest, which GitHub observes but does not
 * document: pages are read backward from the end until one contains a known repository.
 * New repositories are appended to {@code known} in list order. A reordered or shrunk upstream
 * list goes unnoticed here, so a periodic {@link FullFetchStrategy} run is still needed.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IncrementalFetchStrategy implements StarFetchStrategy {

    private final StarSource starSource;
    private final FullFetchStrategy fullFetchStrategy;

    @Override
    public List<StarredRepo> fetch(List<StarredRepo> known) {
        if (known.isEmpty()) {
            log.info("No known repos, falling back to full fetch");
            return fullFetchStrategy.fetch(known);
        }

        Set<String> knownNames = known.stream()
            .map(StarredRepo::fullName)
            .collect(Collectors.toSet());

        // Newest page first; each page is itself oldest to newest.
        List<List<StarredRepo>> newPages = new ArrayList<>();
        Optional<String> cursor = Optional.empty();

        while (true) {
            Cancellation.throwIfCancelled("incremental fetch");

            RepoPage page = starSource.fetchPage(PageDirection.BACKWARD, cursor);

            List<StarredRepo> newOnPage = new ArrayList<>();
            boolean hitKnown = false;
            for (StarredRepo repo : page.repos()) {
                if (knownNames.contains(repo.fullName())) {
                    hitKnown = true;
                } else {
                    newOnPage.add(repo);
                }
            }

            if (!newOnPage.isEmpty()) {
                newPages.add(newOnPage);
            }

            if (hitKnown || !page.pageInfo().hasPreviousPage()) {
                break;
            }
            if (page.pageInfo().startCursor() == null) {
                throw new StarSourceException("Source reported a previous page without a start cursor");
            }
            cursor = Optional.of(page.pageInfo().startCursor());
        }

        if (newPages.isEmpty()) {
            log.info("No new repos since last fetch");
            return known;
        }

        Collections.reverse(newPages);
        List<StarredRepo> merged = new ArrayList<>(known);
        newPages.forEach(merged::addAll);

        log.info("Found {} new repos", merged.size() - known.size());
        return merged;
    }
}
