package com.newsdigest.pipeline.service.routing;

import com.newsdigest.pipeline.client.SummarizationProvider;
import com.newsdigest.pipeline.config.PipelineSettings.DifficultySettings;
import com.newsdigest.pipeline.config.PipelineSettings.RoutingSettings;
import com.newsdigest.pipeline.entity.ApiUsageRecord;
import com.newsdigest.pipeline.entity.ArticleCategory;
import com.newsdigest.pipeline.entity.CanonicalArticle;
import com.newsdigest.pipeline.entity.Difficulty;
import com.newsdigest.pipeline.entity.ProviderId;
import com.newsdigest.pipeline.entity.RoutingState;
import com.newsdigest.pipeline.entity.RoutingTask;
import com.newsdigest.pipeline.entity.UsageOutcome;
import com.newsdigest.pipeline.exception.ProviderErrorKind;
import com.newsdigest.pipeline.exception.ProviderException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.IntStream;

import static com.newsdigest.pipeline.TestFixtures.AS_OF;
import static com.newsdigest.pipeline.TestFixtures.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.groups.Tuple.tuple;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * SummarizationRouter 단위 테스트
 */
class SummarizationRouterTest {

    private static final DifficultySettings DIFFICULTY =
            new DifficultySettings(Set.of("quantum", "theorem", "stochastic"), 0.02, 0.05);

    private final Clock clock = Clock.fixed(AS_OF.toInstant(), ZoneOffset.UTC);
    private final Map<ProviderId, SummarizationProvider> providers = new EnumMap<>(ProviderId.class);
    private SummaryCache cache;

    @BeforeEach
    void setUp() {
        cache = new CaffeineSummaryCache(100, Duration.ofHours(1));
    }

    private SummarizationRouter router() {
        return new SummarizationRouter(new ProviderRegistry(providers), cache, new DifficultyClassifier(), clock);
    }

    private void register(ProviderId id, Function<String, Mono<String>> behavior) {
        providers.put(id, new SummarizationProvider() {
            @Override
            public ProviderId id() {
                return id;
            }

            @Override
            public Mono<String> summarize(String text, int maxOutputLength) {
                return behavior.apply(text);
            }
        });
    }

    private static ProviderRoutingTable defaultTable() {
        return ProviderRoutingTable.builder()
                .defaultProviders(List.of(ProviderId.CLAUDE, ProviderId.OPENAI, ProviderId.OLLAMA))
                .build();
    }

    private static RoutingSettings settings(ProviderRoutingTable table, Duration providerTimeout,
                                            Duration runTimeout, int maxConcurrency) {
        return new RoutingSettings(table, Map.of(), providerTimeout, maxConcurrency, runTimeout, 300, DIFFICULTY);
    }

    private static RoutingSettings defaultSettings() {
        return settings(defaultTable(), Duration.ofSeconds(5), Duration.ofSeconds(30), 4);
    }

    @Nested
    @DisplayName("단일 기사 라우팅")
    class Route {

        @Test
        @DisplayName("앞의 두 제공자가 실패하면 세 번째 제공자의 요약 사용")
        void fallsBackInOrder() {
            register(ProviderId.CLAUDE, text -> Mono.error(new IOException("connection reset")));
            register(ProviderId.OPENAI, text -> Mono.error(ProviderException.rateLimited(ProviderId.OPENAI, "429")));
            register(ProviderId.OLLAMA, text -> Mono.just("  Local summary.  "));
            CanonicalArticle article = article("Fallback order is respected").build();
            ApiUsageLog usageLog = new ApiUsageLog();

            StepVerifier.create(router().route(article, defaultSettings(), usageLog))
                    .assertNext(outcome -> {
                        assertThat(outcome.state()).isEqualTo(RoutingState.SUMMARIZED);
                        assertThat(outcome.provider()).isEqualTo(ProviderId.OLLAMA);
                        assertThat(outcome.summary()).isEqualTo("Local summary.");
                        assertThat(outcome.failures()).extracting(ProviderException::getKind)
                                .containsExactly(ProviderErrorKind.TRANSPORT, ProviderErrorKind.RATE_LIMITED);
                        assertThat(outcome.failures()).extracting(ProviderException::getProviderId)
                                .containsExactly(ProviderId.CLAUDE, ProviderId.OPENAI);
                    })
                    .verifyComplete();

            assertThat(usageLog.snapshot()).extracting(ApiUsageRecord::providerId, ApiUsageRecord::outcome)
                    .containsExactly(
                            tuple(ProviderId.CLAUDE, UsageOutcome.ERROR),
                            tuple(ProviderId.OPENAI, UsageOutcome.ERROR),
                            tuple(ProviderId.OLLAMA, UsageOutcome.SUCCESS));
            assertThat(usageLog.snapshot()).allSatisfy(record -> {
                assertThat(record.task()).isEqualTo(RoutingTask.SUMMARIZE);
                assertThat(record.timestamp()).isEqualTo(AS_OF.toInstant());
                assertThat(record.tokenCount()).isPositive();
            });
            assertThat(cache.lookup(article.getId())).contains("Local summary.");
        }

        @Test
        @DisplayName("빈 응답과 공백 요약은 INVALID_RESPONSE로 처리")
        void blankSummaryIsInvalid() {
            register(ProviderId.CLAUDE, text -> Mono.just("   "));
            register(ProviderId.OPENAI, text -> Mono.empty());
            register(ProviderId.OLLAMA, text -> Mono.just("ok"));

            StepVerifier.create(router().route(article("Blank summaries fall through").build(), defaultSettings()))
                    .assertNext(outcome -> {
                        assertThat(outcome.provider()).isEqualTo(ProviderId.OLLAMA);
                        assertThat(outcome.failures()).extracting(ProviderException::getKind)
                                .containsOnly(ProviderErrorKind.INVALID_RESPONSE);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("제공자 타임아웃은 TIMEOUT으로 기록하고 다음 제공자로")
        void providerTimeout() {
            register(ProviderId.CLAUDE, text -> Mono.never());
            register(ProviderId.OPENAI, text -> Mono.just("fast summary"));
            ApiUsageLog usageLog = new ApiUsageLog();
            RoutingSettings settings = settings(defaultTable(), Duration.ofMillis(100), Duration.ofSeconds(30), 4);

            StepVerifier.create(router().route(article("Slow provider times out").build(), settings, usageLog))
                    .assertNext(outcome -> {
                        assertThat(outcome.provider()).isEqualTo(ProviderId.OPENAI);
                        assertThat(outcome.failures()).singleElement()
                                .extracting(ProviderException::getKind).isEqualTo(ProviderErrorKind.TIMEOUT);
                    })
                    .verifyComplete();

            assertThat(usageLog.snapshot().get(0).outcome()).isEqualTo(UsageOutcome.TIMEOUT);
        }

        @Test
        @DisplayName("등록되지 않은 제공자는 실패로 세지 않고 건너뜀")
        void unregisteredProvidersAreSkipped() {
            register(ProviderId.OLLAMA, text -> Mono.just("local"));
            ApiUsageLog usageLog = new ApiUsageLog();

            StepVerifier.create(router().route(article("Only Ollama is configured").build(), defaultSettings(), usageLog))
                    .assertNext(outcome -> {
                        assertThat(outcome.provider()).isEqualTo(ProviderId.OLLAMA);
                        assertThat(outcome.failures()).isEmpty();
                    })
                    .verifyComplete();
            assertThat(usageLog.size()).isEqualTo(1);
        }

        @Test
        @DisplayName("모두 실패하면 캐시된 요약 사용")
        void exhaustedServesCache() {
            register(ProviderId.CLAUDE, text -> Mono.error(new IllegalStateException("boom")));
            CanonicalArticle article = article("Cached summary on exhaustion").build();
            cache.store(article.getId(), "yesterday's summary");

            StepVerifier.create(router().route(article, defaultSettings()))
                    .assertNext(outcome -> {
                        assertThat(outcome.state()).isEqualTo(RoutingState.EXHAUSTED);
                        assertThat(outcome.cached()).isTrue();
                        assertThat(outcome.summary()).isEqualTo("yesterday's summary");
                        assertThat(outcome.provider()).isNull();
                        assertThat(outcome.failures()).hasSize(1);
                    })
                    .verifyComplete();
        }

        @Test
        @DisplayName("캐시도 없으면 요약 없이 소진")
        void exhaustedWithoutCache() {
            register(ProviderId.CLAUDE, text -> Mono.error(new IllegalStateException("boom")));
            register(ProviderId.OPENAI, text -> Mono.error(new IllegalStateException("boom")));

            StepVerifier.create(router().route(article("Nothing cached for this one").build(), defaultSettings()))
                    .assertNext(outcome -> {
                        assertThat(outcome.state()).isEqualTo(RoutingState.EXHAUSTED);
                        assertThat(outcome.summary()).isNull();
                        assertThat(outcome.cached()).isFalse();
                        assertThat(outcome.failures()).hasSize(2);
                    })
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("제공자 선택")
    class Selection {

        private final CanonicalArticle technical = article("Quantum theorem bounds stochastic processes")
                .category(ArticleCategory.FINANCE)
                .content("quantum theorem stochastic quantum theorem stochastic results for the quantum case")
                .build();

        private ProviderRoutingTable table(boolean override) {
            return ProviderRoutingTable.builder()
                    .defaultProviders(List.of(ProviderId.CLAUDE))
                    .rule(ArticleCategory.FINANCE, RoutingTask.SUMMARIZE, List.of(ProviderId.OPENROUTER))
                    .tier(Difficulty.HIGH, List.of(ProviderId.OPENAI))
                    .difficultyOverride(override)
                    .build();
        }

        @Test
        @DisplayName("난이도 오버라이드가 꺼져 있으면 카테고리 규칙")
        void categoryRuleByDefault() {
            RoutingSettings settings = settings(table(false), Duration.ofSeconds(1), Duration.ofSeconds(5), 1);

            assertThat(router().selectProviders(technical, settings)).containsExactly(ProviderId.OPENROUTER);
        }

        @Test
        @DisplayName("오버라이드가 켜져 있으면 난이도 티어 사용")
        void difficultyTierWhenEnabled() {
            RoutingSettings settings = settings(table(true), Duration.ofSeconds(1), Duration.ofSeconds(5), 1);

            assertThat(router().selectProviders(technical, settings)).containsExactly(ProviderId.OPENAI);
        }

        @Test
        @DisplayName("티어가 없는 난이도는 카테고리 규칙으로")
        void missingTierFallsBackToRule() {
            CanonicalArticle plain = article("Plain language market update for readers")
                    .category(ArticleCategory.FINANCE)
                    .build();
            RoutingSettings settings = settings(table(true), Duration.ofSeconds(1), Duration.ofSeconds(5), 1);

            assertThat(router().selectProviders(plain, settings)).containsExactly(ProviderId.OPENROUTER);
        }
    }

    @Nested
    @DisplayName("배치 요약")
    class SummarizeAll {

        @Test
        @DisplayName("결과를 기사에 반영하고 사용 기록을 반환")
        void appliesOutcomes() {
            register(ProviderId.CLAUDE, text -> text.contains("fails")
                    ? Mono.error(new IllegalStateException("boom"))
                    : Mono.just("summary"));
            CanonicalArticle ok = article("This one succeeds nicely").build();
            CanonicalArticle failing = article("This one fails every time").build();
            RoutingSettings settings = settings(ProviderRoutingTable.builder()
                    .defaultProviders(List.of(ProviderId.CLAUDE)).build(), Duration.ofSeconds(1), Duration.ofSeconds(10), 2);

            SummarizationBatchResult result = router().summarizeAll(List.of(ok, failing), settings);

            assertThat(ok.getRoutingState()).isEqualTo(RoutingState.SUMMARIZED);
            assertThat(ok.getSummary()).isEqualTo("summary");
            assertThat(ok.getSummaryProvider()).isEqualTo(ProviderId.CLAUDE);
            assertThat(failing.getRoutingState()).isEqualTo(RoutingState.EXHAUSTED);
            assertThat(failing.needsRetry()).isTrue();
            assertThat(result.summarizedCount()).isEqualTo(1);
            assertThat(result.exhaustedCount()).isEqualTo(1);
            assertThat(result.usageRecords()).hasSize(2);
        }

        @Test
        @DisplayName("동시 실행 수는 maxConcurrency를 넘지 않음")
        void boundedConcurrency() {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            // released on the provider's own signal, before flatMap frees the slot
            register(ProviderId.CLAUDE, text -> Mono.delay(Duration.ofMillis(50))
                    .doOnSubscribe(s -> maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max))
                    .doOnNext(tick -> inFlight.decrementAndGet())
                    .thenReturn("summary"));
            List<CanonicalArticle> articles = IntStream.range(0, 10)
                    .mapToObj(i -> article("Concurrent article number " + i).build())
                    .toList();

            router().summarizeAll(articles, settings(defaultTable(), Duration.ofSeconds(5), Duration.ofSeconds(30), 3));

            assertThat(maxInFlight.get()).isBetween(1, 3);
            assertThat(articles).allMatch(a -> a.getRoutingState() == RoutingState.SUMMARIZED);
        }

        @Test
        @DisplayName("실행 시간 초과 시 진행 중 호출을 취소하고 캐시 조회 없이 소진 처리")
        void runTimeoutCancelsInFlight() {
            AtomicInteger cancelled = new AtomicInteger();
            register(ProviderId.CLAUDE, text -> Mono.<String>never().doOnCancel(cancelled::incrementAndGet));
            cache = mock(SummaryCache.class);
            List<CanonicalArticle> articles = List.of(
                    article("Stuck article number one").build(),
                    article("Stuck article number two").build(),
                    article("Stuck article number three").build());

            SummarizationBatchResult result = router().summarizeAll(articles,
                    settings(defaultTable(), Duration.ofSeconds(30), Duration.ofMillis(200), 2));

            assertThat(cancelled.get()).isEqualTo(2);
            assertThat(result.exhaustedCount()).isEqualTo(3);
            assertThat(articles).allMatch(CanonicalArticle::needsRetry);
            verify(cache, never()).lookup(anyString());
        }

        @Test
        void emptyBatch() {
            SummarizationBatchResult result = router().summarizeAll(List.of(), defaultSettings());

            assertThat(result.outcomes()).isEmpty();
            assertThat(result.usageRecords()).isEmpty();
        }
    }
}
