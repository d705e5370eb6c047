package com.newsdigest.pipeline.entity;

import com.newsdigest.pipeline.exception.ArticleValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static com.newsdigest.pipeline.TestFixtures.AS_OF;
import static com.newsdigest.pipeline.TestFixtures.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * CanonicalArticle 불변식 테스트
 */
class CanonicalArticleTest {

    @Test
    @DisplayName("기본값: 카테고리 UNKNOWN, 언어 en, 상태 PENDING")
    void defaults() {
        CanonicalArticle article = article("Default values are applied").category(null).build();

        assertThat(article.getCategory()).isEqualTo(ArticleCategory.UNKNOWN);
        assertThat(article.getLanguage()).isEqualTo("en");
        assertThat(article.getRoutingState()).isEqualTo(RoutingState.PENDING);
        assertThat(article.getAuthors()).isEmpty();
        assertThat(article.needsRetry()).isFalse();
    }

    @Test
    @DisplayName("fetchedAt이 publishedAt보다 이전이면 거부")
    void rejectsFetchedBeforePublished() {
        assertThatThrownBy(() -> article("Published after it was fetched")
                .publishedAt(AS_OF)
                .fetchedAt(AS_OF.minusMinutes(1))
                .build())
                .isInstanceOf(ArticleValidationException.class)
                .hasMessageContaining("fetchedAt");
    }

    @Test
    @DisplayName("빈 제목은 거부")
    void rejectsBlankTitle() {
        assertThatThrownBy(() -> article("placeholder title").title("   ").build())
                .isInstanceOf(ArticleValidationException.class)
                .hasMessageContaining("title");
    }

    @ParameterizedTest
    @ValueSource(ints = {-1, 101})
    @DisplayName("범위를 벗어난 점수는 생성자와 setter 모두에서 거부")
    void rejectsOutOfRangeScores(int score) {
        assertThatThrownBy(() -> article("Score out of range at build").relevanceScore(score).build())
                .isInstanceOf(ArticleValidationException.class);

        CanonicalArticle article = article("Score out of range on set").build();
        assertThatThrownBy(() -> article.setCredibilityScore(score))
                .isInstanceOf(ArticleValidationException.class);
    }

    @Test
    @DisplayName("본문이 없으면 설명을 본문으로 사용")
    void bodyTextFallsBackToDescription() {
        CanonicalArticle article = article("Body falls back to description")
                .content(null)
                .description("  short description  ")
                .build();

        assertThat(article.bodyText()).isEqualTo("short description");
        assertThat(article.summarizationText())
                .startsWith("Title: Body falls back to description")
                .contains("Description: short description")
                .doesNotContain("Body:");
    }

    @Test
    @DisplayName("요약 없이 소진된 기사는 재시도 대상")
    void exhaustedWithoutSummaryNeedsRetry() {
        CanonicalArticle article = article("Every provider failed here").build();
        article.setRoutingState(RoutingState.EXHAUSTED);

        assertThat(article.needsRetry()).isTrue();

        article.setSummary("cached summary");
        assertThat(article.needsRetry()).isFalse();
    }
}
