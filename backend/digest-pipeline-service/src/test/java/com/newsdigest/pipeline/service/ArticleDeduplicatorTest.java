package com.newsdigest.pipeline.service;

import com.newsdigest.pipeline.entity.CanonicalArticle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.newsdigest.pipeline.TestFixtures.AS_OF;
import static com.newsdigest.pipeline.TestFixtures.scored;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * ArticleDeduplicator 단위 테스트
 */
class ArticleDeduplicatorTest {

    private final ArticleDeduplicator deduplicator = new ArticleDeduplicator();

    @Test
    @DisplayName("숫자만 다른 제목은 같은 그룹, 점수가 높은 기사가 대표")
    void numbersAreIgnored() {
        CanonicalArticle low = scored("Toyota profit up 20%", 60, AS_OF.minusHours(3));
        CanonicalArticle high = scored("toyota profit up 35% ", 80, AS_OF.minusHours(2));

        List<CanonicalArticle> result = deduplicator.deduplicate(List.of(low, high));

        assertThat(result).containsExactly(high);
        assertThat(high.isDuplicate()).isTrue();
    }

    @Test
    @DisplayName("전각 숫자도 숫자로 취급")
    void fullWidthDigits() {
        CanonicalArticle low = scored("トヨタ純利益２０％増", 60, AS_OF.minusHours(3));
        CanonicalArticle high = scored("トヨタ純利益３５％増", 80, AS_OF.minusHours(2));

        assertThat(ArticleDeduplicator.keyOf("トヨタ純利益２０％増")).isEqualTo(ArticleDeduplicator.keyOf("トヨタ純利益3％増"));
        assertThat(deduplicator.deduplicate(List.of(low, high))).containsExactly(high);
    }

    @Test
    @DisplayName("동점이면 먼저 게시된 기사, 그것도 같으면 먼저 입력된 기사")
    void tieBreaks() {
        CanonicalArticle later = scored("Chip output rises 5%", 70, AS_OF.minusHours(1));
        CanonicalArticle earlier = scored("Chip output rises 7%", 70, AS_OF.minusHours(4));
        CanonicalArticle first = scored("Same time story 1", 50, AS_OF.minusHours(2));
        CanonicalArticle second = scored("Same time story 2", 50, AS_OF.minusHours(2));

        List<CanonicalArticle> result = deduplicator.deduplicate(List.of(later, earlier, first, second));

        assertThat(result).containsExactly(earlier, first);
    }

    @Test
    @DisplayName("점수 없는 기사는 -1로 취급")
    void missingScoreLoses() {
        CanonicalArticle unscored = scored("Unscored headline 1", null, AS_OF.minusHours(5));
        CanonicalArticle zero = scored("Unscored headline 2", 0, AS_OF.minusHours(1));

        assertThat(deduplicator.deduplicate(List.of(unscored, zero))).containsExactly(zero);
    }

    @Test
    @DisplayName("그룹이 처음 나타난 순서를 유지하고 단독 기사는 중복 표시 없음")
    void keepsFirstAppearanceOrder() {
        CanonicalArticle a = scored("Alpha story headline", 10, AS_OF.minusHours(1));
        CanonicalArticle b1 = scored("Beta story 1", 10, AS_OF.minusHours(1));
        CanonicalArticle c = scored("Gamma story headline", 10, AS_OF.minusHours(1));
        CanonicalArticle b2 = scored("Beta story 2", 90, AS_OF.minusHours(1));

        List<CanonicalArticle> result = deduplicator.deduplicate(List.of(a, b1, c, b2));

        assertThat(result).containsExactly(a, b2, c);
        assertThat(a.isDuplicate()).isFalse();
        assertThat(b2.isDuplicate()).isTrue();
    }

    @Test
    void keyNormalization() {
        assertThat(ArticleDeduplicator.keyOf("  Q3 2024 Results: Revenue 12.5B  ")).isEqualTo("q0 0 results: revenue 0.0b");
    }
}
