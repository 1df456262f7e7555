package com.contact.dedup.api;

import com.contact.dedup.cache.CacheConfig;
import com.contact.dedup.cache.CaffeineDecisionCache;
import com.contact.dedup.cache.MergeListener;
import com.contact.dedup.cache.NoOpDecisionCache;
import com.contact.dedup.comparator.ComparatorRegistry;
import com.contact.dedup.comparator.CrmIdComparator;
import com.contact.dedup.core.InvalidConfigurationException;
import com.contact.dedup.core.model.ContactRecord;
import com.contact.dedup.core.model.DuplicateDecision;
import com.contact.dedup.matching.CandidateProvider;
import com.contact.dedup.merge.MergeResult;
import com.contact.dedup.merge.MergeStrategy;
import com.contact.dedup.metrics.MicrometerMetricsService;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DeduplicationServiceTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    private static final ContactRecord EXISTING = ContactRecord.builder()
            .id("c-1").email("john@acme.com").title("CEO").build();
    private static final ContactRecord INCOMING = ContactRecord.builder()
            .email("John@Acme.com").phone("555-0100").title("Chief Executive").build();

    @Mock
    private CandidateProvider candidateProvider;

    private SimpleMeterRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
    }

    private DeduplicationService.Builder serviceBuilder() {
        return DeduplicationService.builder()
                .candidateProvider(candidateProvider)
                .metricsService(new MicrometerMetricsService(registry))
                .clock(Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("checkDuplicates")
    class CheckDuplicates {

        @Test
        @DisplayName("Should flag a duplicate at the configured threshold")
        void testDuplicateDetected() {
            when(candidateProvider.findPlausibleCandidates(INCOMING)).thenReturn(List.of(EXISTING));
            DeduplicationService service = serviceBuilder().build();

            DuplicateDecision decision = service.checkDuplicates(INCOMING);

            assertTrue(decision.isDuplicate());
            assertEquals(100.0, decision.confidence());
            assertEquals(85.0, decision.threshold());
            assertEquals(1.0, registry.get("dedup.duplicate.detected").counter().count());
            assertEquals(1, registry.get("dedup.check.duration").tag("duplicate", "true").timer().count());
        }

        @Test
        @DisplayName("Explicit threshold overrides the configured one")
        void testExplicitThreshold() {
            ContactRecord sameDomain = ContactRecord.builder().id("c-3").email("jane@acme.com").build();
            when(candidateProvider.findPlausibleCandidates(INCOMING)).thenReturn(List.of(sameDomain));
            DeduplicationService service = serviceBuilder().build();

            assertFalse(service.checkDuplicates(INCOMING).isDuplicate());
            assertTrue(service.checkDuplicates(INCOMING, 75.0).isDuplicate());
        }

        @Test
        @DisplayName("Record without identifying fields never reaches the provider")
        void testNoIdentifyingFields() {
            DeduplicationService service = serviceBuilder().build();

            DuplicateDecision decision = service.checkDuplicates(ContactRecord.builder().firstName("John").build());

            assertFalse(decision.isDuplicate());
            verifyNoInteractions(candidateProvider);
        }

        @Test
        @DisplayName("Invalid threshold is rejected before any lookup")
        void testInvalidThreshold() {
            DeduplicationService service = serviceBuilder().build();

            assertThrows(InvalidConfigurationException.class, () -> service.checkDuplicates(INCOMING, 101.0));
            verifyNoInteractions(candidateProvider);
        }

        @Test
        @DisplayName("Provider failures propagate unchanged")
        void testProviderFailure() {
            IllegalStateException failure = new IllegalStateException("store unavailable");
            when(candidateProvider.findPlausibleCandidates(any())).thenThrow(failure);
            DeduplicationService service = serviceBuilder().build();

            IllegalStateException thrown = assertThrows(IllegalStateException.class,
                    () -> service.checkDuplicates(INCOMING));
            assertSame(failure, thrown);
        }

        @Test
        @DisplayName("Company similarity floor from options reaches the comparator")
        void testCompanyFloorFromOptions() {
            ContactRecord incoming = ContactRecord.builder().companyName("Acme Widgets").build();
            ContactRecord existing = ContactRecord.builder().companyName("Acme Widget").build();
            when(candidateProvider.findPlausibleCandidates(incoming)).thenReturn(List.of(existing));
            DeduplicationService service = serviceBuilder()
                    .options(DeduplicationOptions.builder().companySimilarityFloor(0.95).build())
                    .build();

            assertTrue(service.checkDuplicates(incoming).candidates().isEmpty());
        }

        @Test
        @DisplayName("Custom registry replaces the defaults")
        void testCustomRegistry() {
            when(candidateProvider.findPlausibleCandidates(INCOMING)).thenReturn(List.of(EXISTING));
            DeduplicationService service = serviceBuilder()
                    .comparatorRegistry(ComparatorRegistry.defaults().without("email"))
                    .build();

            DuplicateDecision decision = service.checkDuplicates(INCOMING);

            assertEquals(80.0, decision.confidence());
            assertFalse(decision.isDuplicate());
        }

        @Test
        @DisplayName("A record with only a custom comparator's field reaches the provider")
        void testCustomFieldOnlyRecord() {
            ContactRecord incoming = ContactRecord.builder().attribute("crm_id", "SF-42").build();
            ContactRecord existing = ContactRecord.builder().id("c-7").attribute("crm_id", "SF-42").build();
            when(candidateProvider.findPlausibleCandidates(incoming)).thenReturn(List.of(existing));
            DeduplicationService service = serviceBuilder()
                    .comparatorRegistry(ComparatorRegistry.defaults().with(new CrmIdComparator()))
                    .build();

            DuplicateDecision decision = service.checkDuplicates(incoming);

            assertTrue(decision.isDuplicate());
            assertEquals("c-7", decision.bestMatch().orElseThrow().existing().getId());
            verify(candidateProvider).findPlausibleCandidates(incoming);
        }
    }

    @Nested
    @DisplayName("Caching")
    class Caching {

        @Test
        @DisplayName("No cache is used unless configured")
        void testDefaultNoCache() {
            DeduplicationService service = serviceBuilder().build();
            assertInstanceOf(NoOpDecisionCache.class, service.getCache());
            assertInstanceOf(NoOpDecisionCache.class,
                    serviceBuilder().cacheConfig(CacheConfig.disabled()).build().getCache());
        }

        @Test
        @DisplayName("Repeated checks of the same record hit the cache")
        void testCacheHit() {
            when(candidateProvider.findPlausibleCandidates(any())).thenReturn(List.of(EXISTING));
            DeduplicationService service = serviceBuilder().cacheConfig(CacheConfig.defaults()).build();

            DuplicateDecision first = service.checkDuplicates(INCOMING);
            DuplicateDecision second = service.checkDuplicates(INCOMING.toBuilder().email("john@acme.com").build());

            assertEquals(first, second);
            verify(candidateProvider, times(1)).findPlausibleCandidates(any());
            assertEquals(1.0, registry.get("dedup.cache.hit").counter().count());
            assertEquals(1.0, registry.get("dedup.cache.miss").counter().count());
        }

        @Test
        @DisplayName("A different threshold is a cache miss")
        void testThresholdIsPartOfKey() {
            when(candidateProvider.findPlausibleCandidates(any())).thenReturn(List.of(EXISTING));
            DeduplicationService service = serviceBuilder().cacheConfig(CacheConfig.defaults()).build();

            service.checkDuplicates(INCOMING, 85.0);
            service.checkDuplicates(INCOMING, 99.0);

            verify(candidateProvider, times(2)).findPlausibleCandidates(any());
        }

        @Test
        @DisplayName("Merging a record invalidates decisions that mention it")
        void testMergeInvalidates() {
            when(candidateProvider.findPlausibleCandidates(any())).thenReturn(List.of(EXISTING));
            DeduplicationService service = serviceBuilder()
                    .cache(new CaffeineDecisionCache(CacheConfig.defaults()))
                    .build();

            service.checkDuplicates(INCOMING);
            service.mergeRecords(EXISTING, INCOMING);
            service.checkDuplicates(INCOMING);

            verify(candidateProvider, times(2)).findPlausibleCandidates(any());
        }

        @Test
        @DisplayName("Records differing only in a custom field are cached separately")
        void testCustomFieldInCacheKey() {
            ContactRecord existing = ContactRecord.builder().id("c-7").attribute("crm_id", "SF-1").build();
            when(candidateProvider.findPlausibleCandidates(any())).thenReturn(List.of(existing));
            DeduplicationService service = serviceBuilder()
                    .comparatorRegistry(ComparatorRegistry.defaults().with(new CrmIdComparator()))
                    .cacheConfig(CacheConfig.defaults())
                    .build();

            DuplicateDecision first = service.checkDuplicates(ContactRecord.builder().attribute("crm_id", "SF-1").build());
            DuplicateDecision second = service.checkDuplicates(ContactRecord.builder().attribute("crm_id", "SF-2").build());

            assertTrue(first.isDuplicate());
            assertFalse(second.isDuplicate());
            verify(candidateProvider, times(2)).findPlausibleCandidates(any());
        }
    }

    @Nested
    @DisplayName("mergeRecords")
    class MergeRecords {

        @Test
        @DisplayName("Should merge with the default MOST_COMPLETE strategy")
        void testDefaultStrategy() {
            DeduplicationService service = serviceBuilder().build();

            MergeResult result = service.mergeRecords(EXISTING, INCOMING);

            assertEquals(MergeStrategy.MOST_COMPLETE, result.strategy());
            assertEquals("c-1", result.mergedRecord().getId());
            assertEquals("Chief Executive", result.mergedRecord().getTitle());
            assertEquals("555-0100", result.mergedRecord().getPhone());
            assertEquals(NOW, result.mergedAt());
            assertEquals("1 added, 1 updated", result.summary());
            assertEquals(1.0, registry.get("dedup.merge").tag("strategy", "MOST_COMPLETE").counter().count());
            verifyNoInteractions(candidateProvider);
        }

        @Test
        @DisplayName("Should honour an explicit strategy and notify listeners")
        void testExplicitStrategyAndListener() {
            MergeListener listener = mock(MergeListener.class);
            DeduplicationService service = serviceBuilder().mergeListener(listener).build();

            MergeResult result = service.mergeRecords(EXISTING, INCOMING, MergeStrategy.PREFER_EXISTING);

            assertEquals("CEO", result.mergedRecord().getTitle());
            verify(listener).onMerge(EXISTING, INCOMING);
        }

        @Test
        @DisplayName("Default strategy comes from the options")
        void testStrategyFromOptions() {
            DeduplicationService service = serviceBuilder()
                    .options(DeduplicationOptions.builder().defaultMergeStrategy(MergeStrategy.PREFER_EXISTING).build())
                    .build();

            assertEquals(MergeStrategy.PREFER_EXISTING, service.mergeRecords(EXISTING, INCOMING).strategy());
        }

        @Test
        @DisplayName("Null arguments are rejected")
        void testNullArguments() {
            DeduplicationService service = serviceBuilder().build();
            assertThrows(NullPointerException.class, () -> service.mergeRecords(null, INCOMING));
            assertThrows(NullPointerException.class, () -> service.mergeRecords(EXISTING, INCOMING, null));
        }
    }

    @Test
    @DisplayName("Builder requires a candidate provider")
    void testBuilderRequiresProvider() {
        assertThrows(IllegalStateException.class, () -> DeduplicationService.builder().build());
    }
}
