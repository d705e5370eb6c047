package com.newsdigest.pipeline.service.normalize;

import com.newsdigest.pipeline.dto.RawRecord;
import com.newsdigest.pipeline.dto.SourceDescriptor;
import com.newsdigest.pipeline.entity.SourceType;
import com.newsdigest.pipeline.exception.NormalizationException;
import com.rometools.rome.feed.synd.SyndContent;
import com.rometools.rome.feed.synd.SyndEntry;
import com.rometools.rome.feed.synd.SyndPerson;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * RSS/Atom entries parsed by Rome.
 */
@Component
public class FeedEntryNormalizer implements RecordNormalizer {

    @Override
    public SourceType supportedType() {
        return SourceType.FEED;
    }

    @Override
    public ExtractedArticle extract(RawRecord record, SourceDescriptor source) {
        if (!(record.payload() instanceof SyndEntry entry)) {
            throw NormalizationException.unsupportedPayload(record.payload(), source.name());
        }

        // updated date when no published date
        Date date = entry.getPublishedDate() != null ? entry.getPublishedDate() : entry.getUpdatedDate();

        return ExtractedArticle.builder()
                .title(normalizeText(entry.getTitle()))
                .url(normalizeText(entry.getLink()))
                .publishedAt(PublishedDateParser.fromDate(date).orElse(null))
                .description(entry.getDescription() != null ? normalizeText(entry.getDescription().getValue()) : null)
                .content(joinContents(entry.getContents()))
                .authors(authorsOf(entry))
                .build();
    }

    private String joinContents(List<SyndContent> contents) {
        if (contents == null || contents.isEmpty()) {
            return null;
        }
        String joined = contents.stream()
                .map(SyndContent::getValue)
                .map(this::normalizeText)
                .filter(Objects::nonNull)
                .collect(Collectors.joining(" "));
        return joined.isEmpty() ? null : joined;
    }

    private List<String> authorsOf(SyndEntry entry) {
        List<String> authors = new ArrayList<>();
        if (entry.getAuthors() != null) {
            for (SyndPerson person : entry.getAuthors()) {
                if (person.getName() != null && !person.getName().isBlank()) {
                    authors.add(person.getName().strip());
                }
            }
        }
        if (authors.isEmpty() && entry.getAuthor() != null && !entry.getAuthor().isBlank()) {
            authors.add(entry.getAuthor().strip());
        }
        return authors;
    }

    /**
     * Collapses whitespace runs and trims.
     */
    private String normalizeText(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        return text.replaceAll("\\s+", " ").trim();
    }
}
