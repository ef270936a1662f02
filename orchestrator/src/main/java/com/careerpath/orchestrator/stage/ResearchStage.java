package com.careerpath.orchestrator.stage;

import com.careerpath.orchestrator.extract.Extraction;
import com.careerpath.orchestrator.extract.ExtractionIntent;
import com.careerpath.orchestrator.extract.JsonFields;
import com.careerpath.orchestrator.extract.ResponseExtractor;
import com.careerpath.orchestrator.extract.Shape;
import com.careerpath.orchestrator.model.ScrapedData;
import com.careerpath.orchestrator.provider.search.SearchResult;
import com.careerpath.orchestrator.provider.search.SearchService;
import com.careerpath.orchestrator.repository.AnalysisStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Finds first-hand transition stories on the web and stores the new ones.
 *
 * The primary query uses both full role names. While fewer than
 * {@link #MIN_RESULTS} results are in hand, up to three alternate phrasings
 * are tried. Results are deduplicated by URL against what is already stored.
 */
@Component
public class ResearchStage implements AnalysisStage<List<Story>> {

    private static final Logger log = LoggerFactory.getLogger(ResearchStage.class);

    static final int MIN_RESULTS = 2;

    // Matched in order; the first contained in the role title wins
    private static final List<String> COMMON_ROLES = List.of(
            "Software Engineer", "Product Manager", "Data Scientist",
            "UX Designer", "Project Manager", "Marketing Manager",
            "Engineer", "Manager", "Designer", "Developer"
    );

    private final SearchService search;
    private final AnalysisStore store;
    private final int           maxResults;

    public ResearchStage(SearchService search,
                         AnalysisStore store,
                         @Value("${careerpath.search.max-results:5}") int maxResults) {
        this.search     = search;
        this.store      = store;
        this.maxResults = maxResults;
    }

    @Override
    public StageName name() {
        return StageName.RESEARCH;
    }

    @Override
    public List<Story> execute(AnalysisContext ctx, PriorOutputs prior) {
        List<Story> stored = store.getScrapedDataByTransitionId(ctx.transitionId()).stream()
                .map(ResearchStage::fromRow)
                .toList();

        List<SearchResult> results = new ArrayList<>();
        int attempted = 0;
        int failed = 0;
        for (String query : queries(ctx)) {
            if (attempted > 0 && results.size() >= MIN_RESULTS) {
                break;
            }
            attempted++;
            try {
                List<SearchResult> found = search.search(query, maxResults);
                log.info("Search '{}' returned {} results", query, found.size());
                results.addAll(found);
            } catch (RuntimeException e) {
                failed++;
                log.warn("Search '{}' failed: {}", query, e.getMessage());
            }
        }
        if (failed == attempted) {
            throw new StageException("All " + attempted + " search queries failed");
        }

        List<Story> fresh = newStories(results, stored);
        if (stored.isEmpty() && fresh.isEmpty()) {
            log.info("No stories found for transition {}, storing fallback stories", ctx.transitionId());
            List<Story> fallback = fallback(ctx, prior);
            persist(ctx.transitionId(), fallback);
            return fallback;
        }

        persist(ctx.transitionId(), fresh);
        log.info("Transition {}: {} stored stories, {} new", ctx.transitionId(), stored.size(), fresh.size());
        List<Story> all = new ArrayList<>(stored);
        all.addAll(fresh);
        return all;
    }

    @Override
    public List<Story> fallback(AnalysisContext ctx, PriorOutputs prior) {
        String from = ctx.currentRole();
        String to = ctx.targetRole();
        return List.of(
                new Story("Professional Transition Blog",
                        "After spending 5 years as a " + from + ", I decided to move into a " + to + " role. "
                                + "The biggest challenges were learning new technical skills and adapting to a "
                                + "different workflow. I spent about 6 months on online courses and side projects "
                                + "to build a portfolio. What helped most was talking to people already working as "
                                + to + " who could mentor me.",
                        null, null),
                new Story("Career Forum",
                        "My move from " + from + " to " + to + " took about 9 months of focused effort. "
                                + "I started by listing my skill gaps, especially the technical areas I had never "
                                + "worked in. Interviews were hard, but showing how my experience carried over "
                                + "helped a lot. Build practical experience through projects rather than only "
                                + "studying theory.",
                        null, null));
    }

    // ------------------------------------------------------------------
    // Queries
    // ------------------------------------------------------------------

    /** Primary query first, then the alternates. */
    static List<String> queries(AnalysisContext ctx) {
        String from = ctx.currentRole();
        String to = ctx.targetRole();
        Set<String> queries = new LinkedHashSet<>();
        queries.add("Career transition from " + from + " to " + to + " experiences, challenges, and success stories");
        queries.add(withoutCompany(from) + " to " + withoutCompany(to) + " transition experiences success stories challenges");
        queries.add("career change from " + genericRole(from) + " to " + genericRole(to) + " real experiences");
        queries.add("how I moved from " + from + " to " + to + " personal experience blog reddit");
        return List.copyOf(queries);
    }

    /** "Acme Software Engineer" -> "Software Engineer"; one-word titles are kept. */
    static String withoutCompany(String role) {
        String[] parts = role.strip().split("\\s+", 2);
        return parts.length == 2 ? parts[1] : role.strip();
    }

    /** Broad role family, e.g. "Google Senior Software Engineer" -> "Software Engineer". */
    static String genericRole(String role) {
        for (String common : COMMON_ROLES) {
            if (role.contains(common)) {
                return common;
            }
        }
        return withoutCompany(role);
    }

    // ------------------------------------------------------------------
    // Results -> stories
    // ------------------------------------------------------------------

    private static List<Story> newStories(List<SearchResult> results, List<Story> stored) {
        Set<String> seenUrls = new HashSet<>();
        Set<String> seenContent = new HashSet<>();
        for (Story s : stored) {
            if (s.url() != null) {
                seenUrls.add(s.url());
            } else {
                seenContent.add(s.content());
            }
        }
        List<Story> fresh = new ArrayList<>();
        for (SearchResult result : results) {
            Optional<Story> story = toStory(result);
            if (story.isEmpty()) {
                continue;
            }
            Story s = story.get();
            boolean duplicate = s.url() != null ? !seenUrls.add(s.url()) : !seenContent.add(s.content());
            if (!duplicate) {
                fresh.add(s);
            }
        }
        return fresh;
    }

    /**
     * A result whose excerpt holds a structured story record is read through
     * the extractor; otherwise the story is built from the result itself.
     */
    static Optional<Story> toStory(SearchResult result) {
        String url = blankToNull(result.url());
        Extraction extracted = ResponseExtractor.extract(result.content(), Shape.OBJECT, ExtractionIntent.STORIES);
        Optional<String> content = extracted.ok()
                ? JsonFields.text(extracted.value(), "content", "story", "text")
                : Optional.empty();
        if (content.isPresent()) {
            JsonNode record = extracted.value();
            return Optional.of(new Story(
                    JsonFields.text(record, "source").orElseGet(() -> sourceOf(result)),
                    content.get(),
                    JsonFields.text(record, "url").orElse(url),
                    JsonFields.text(record, "date").orElse(result.publishedDate())));
        }

        String text = blankToNull(result.content());
        if (text == null) {
            text = blankToNull(result.title());
        }
        if (text == null) {
            return Optional.empty();
        }
        return Optional.of(new Story(sourceOf(result), text, url, result.publishedDate()));
    }

    private static Story fromRow(ScrapedData row) {
        return new Story(row.getSource(), row.getContent(), blankToNull(row.getUrl()), row.getPostDate());
    }

    /** URL host without "www.", else the title, else a generic label. */
    static String sourceOf(SearchResult result) {
        if (result.url() != null) {
            try {
                String host = URI.create(result.url().strip()).getHost();
                if (host != null && !host.isBlank()) {
                    return host.startsWith("www.") ? host.substring(4) : host;
                }
            } catch (IllegalArgumentException e) {
                log.debug("Unparseable result URL '{}'", result.url());
            }
        }
        String title = blankToNull(result.title());
        return title != null ? title : "Web search";
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.strip();
    }

    private void persist(long transitionId, List<Story> stories) {
        for (Story story : stories) {
            try {
                store.createScrapedData(transitionId, story);
            } catch (RuntimeException e) {
                log.warn("Could not store story from '{}' for transition {}: {}",
                        story.source(), transitionId, e.getMessage());
            }
        }
    }
}
