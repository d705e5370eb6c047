package com.newsdigest.pipeline.entity;

import com.newsdigest.pipeline.exception.ArticleValidationException;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Set;

/**
 * Unified article representation every pipeline stage operates on.
 *
 * Identity, source and timestamps are fixed at construction. Only the fields owned by later
 * stages (keywords, scores, duplicate flag, summary and routing state) are mutable, and scores
 * are range-checked on every write.
 */
@Getter
public class CanonicalArticle {

    // ===== identity / source =====
    private final String id;
    private final String title;
    private final String sourceUrl;
    private final String sourceName;
    private final SourceType sourceType;
    private final ArticleCategory category;
    private final OffsetDateTime publishedAt;
    private final OffsetDateTime fetchedAt;

    // ===== source-specific content =====
    private final String description;
    private final String content;
    private final String imageUrl;
    private final List<String> authors;
    private final String language;

    /** Original record, kept for audit only */
    private final Object rawPayload;

    // ===== set by later stages =====
    @Setter
    private Set<String> keywords;
    private Integer relevanceScore;
    private Integer credibilityScore;
    @Setter
    private boolean duplicate;
    @Setter
    private String summary;
    @Setter
    private ProviderId summaryProvider;
    @Setter
    private boolean cached;
    @Setter
    private RoutingState routingState = RoutingState.PENDING;

    @Builder
    private CanonicalArticle(String id,
                             String title,
                             String sourceUrl,
                             String sourceName,
                             SourceType sourceType,
                             ArticleCategory category,
                             OffsetDateTime publishedAt,
                             OffsetDateTime fetchedAt,
                             String description,
                             String content,
                             String imageUrl,
                             List<String> authors,
                             String language,
                             Object rawPayload,
                             Set<String> keywords,
                             Integer relevanceScore,
                             Integer credibilityScore) {
        this.id = requireText(id, "id");
        this.title = requireText(title, "title");
        this.sourceUrl = requireText(sourceUrl, "sourceUrl");
        this.sourceName = requireText(sourceName, "sourceName");
        if (sourceType == null) throw ArticleValidationException.blank("sourceType");
        if (publishedAt == null) throw ArticleValidationException.blank("publishedAt");
        if (fetchedAt == null) throw ArticleValidationException.blank("fetchedAt");
        if (fetchedAt.isBefore(publishedAt)) {
            throw new ArticleValidationException(
                    "fetchedAt (" + fetchedAt + ") must not be before publishedAt (" + publishedAt + ")");
        }
        this.sourceType = sourceType;
        this.category = category != null ? category : ArticleCategory.UNKNOWN;
        this.publishedAt = publishedAt;
        this.fetchedAt = fetchedAt;
        this.description = description;
        this.content = content;
        this.imageUrl = imageUrl;
        this.authors = authors != null ? List.copyOf(authors) : List.of();
        this.language = language != null ? language : "en";
        this.rawPayload = rawPayload;
        this.keywords = keywords;
        this.relevanceScore = checkScore(relevanceScore, "relevanceScore");
        this.credibilityScore = checkScore(credibilityScore, "credibilityScore");
    }

    public void setRelevanceScore(Integer relevanceScore) {
        this.relevanceScore = checkScore(relevanceScore, "relevanceScore");
    }

    public void setCredibilityScore(Integer credibilityScore) {
        this.credibilityScore = checkScore(credibilityScore, "credibilityScore");
    }

    /**
     * Body text used for length checks: content, else description, else empty.
     */
    public String bodyText() {
        if (content != null && !content.isBlank()) return content.strip();
        if (description != null && !description.isBlank()) return description.strip();
        return "";
    }

    /**
     * Title length in characters (code points), so an emoji counts once.
     */
    public int titleLength() {
        return title.codePointCount(0, title.length());
    }

    public int bodyLength() {
        String body = bodyText();
        return body.codePointCount(0, body.length());
    }

    /**
     * Text handed to a summarization provider.
     */
    public String summarizationText() {
        StringBuilder sb = new StringBuilder("Title: ").append(title);
        if (description != null && !description.isBlank()) {
            sb.append("\n\nDescription: ").append(description.strip());
        }
        if (content != null && !content.isBlank()) {
            sb.append("\n\nBody: ").append(content.strip());
        }
        return sb.toString();
    }

    /**
     * Exhausted without any summary: needs a manual or next-run retry.
     */
    public boolean needsRetry() {
        return routingState == RoutingState.EXHAUSTED && summary == null;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw ArticleValidationException.blank(field);
        }
        return value;
    }

    private static Integer checkScore(Integer value, String field) {
        if (value != null && (value < 0 || value > 100)) {
            throw ArticleValidationException.scoreOutOfRange(field, value);
        }
        return value;
    }

    @Override
    public String toString() {
        String shortTitle = title.length() > 30 ? title.substring(0, 30) + "..." : title;
        return "CanonicalArticle(id=" + id.substring(0, Math.min(8, id.length())) + "..., title='" + shortTitle
                + "', source=" + sourceName + ", category=" + category + ")";
    }
}
