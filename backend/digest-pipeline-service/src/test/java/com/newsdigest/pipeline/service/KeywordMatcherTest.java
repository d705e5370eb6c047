package com.newsdigest.pipeline.service;

import com.newsdigest.pipeline.entity.CanonicalArticle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.newsdigest.pipeline.TestFixtures.article;
import static org.assertj.core.api.Assertions.assertThat;

class KeywordMatcherTest {

    private final KeywordMatcher matcher = new KeywordMatcher();

    @Test
    @DisplayName("영문 키워드는 단어 단위, 대소문자 무시")
    void latinTermsMatchWholeWords() {
        CanonicalArticle article = article("Analysts said the new ai chip is fast")
                .content("Nothing about language models here, only hardware.")
                .build();

        assertThat(matcher.match(article, List.of("AI", "LLM", "said")))
                .containsExactly("AI", "said");
        assertThat(matcher.match(article, List.of("Sai"))).isEmpty();
    }

    @Test
    @DisplayName("일본어 문장 안의 영문 키워드도 일치")
    void latinTermsInsideJapaneseText() {
        CanonicalArticle article = article("OpenAIが新しいAIモデルを発表").content("詳細は後日公開される。").build();

        assertThat(matcher.match(article, List.of("OpenAI", "AI", "LLM")))
                .containsExactly("OpenAI", "AI");
    }

    @Test
    @DisplayName("일본어 키워드는 부분 문자열로 일치")
    void japaneseTermsMatchAsSubstrings() {
        CanonicalArticle article = article("国内企業で生成AIの導入が加速")
                .description("人工知能の活用事例")
                .build();

        assertThat(matcher.match(article, List.of("生成AI", "人工知能", "量子")))
                .containsExactly("生成AI", "人工知能");
    }
}
