package com.synapse.x.processors;

import com.google.common.collect.Lists;
import com.synapse.x.config.RankingProperties;
import com.synapse.x.config.factory.SemaphoreGuard;
import com.synapse.x.dto.CandidateFetch;
import com.synapse.x.dto.FeatureLookup;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.RequestDeadline;
import com.synapse.x.exceptions.RequestTimeoutException;
import com.synapse.x.service.FeatureLookupService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Bounded parallel lookup of candidate features.
 * <p>
 * The pool is split into chunks; at most {@code max-parallel-lookups} chunks run at once on the
 * candidate lookup executor. A chunk that does not finish within the lookup timeout (or the
 * request deadline, whichever is sooner) is dropped and its candidates counted as timed out.
 * </p>
 */
@Slf4j
@Component
public class CandidateFeatureFetcher {

    private final FeatureLookupService lookupService;
    private final ExecutorService executor;
    private final RankingProperties properties;

    public CandidateFeatureFetcher(FeatureLookupService lookupService,
                                   @Qualifier("candidateLookupExecutor") ExecutorService executor,
                                   RankingProperties properties) {
        this.lookupService = lookupService;
        this.executor = executor;
        this.properties = properties;
    }

    private record ChunkCall(List<String> ids, CompletableFuture<FeatureLookup> future) {}

    public CandidateFetch fetch(String view, List<String> candidateIds, RequestDeadline deadline) {
        Semaphore permits = new Semaphore(properties.getMaxParallelLookups());
        long lookupTimeoutMs = properties.getLookupTimeout().toMillis();
        List<ChunkCall> calls = new ArrayList<>();
        int timedOut = 0;
        boolean partial = false;

        List<List<String>> chunks = Lists.partition(candidateIds, properties.getLookupChunkSize());
        for (int i = 0; i < chunks.size(); i++) {
            List<String> chunk = chunks.get(i);
            SemaphoreGuard guard;
            try {
                guard = SemaphoreGuard.tryAcquire(permits, "candidate-lookup", deadline.remainingMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                guard = null;
            }
            if (guard == null || !guard.isAcquired()) {
                int dropped = chunks.subList(i, chunks.size()).stream().mapToInt(List::size).sum();
                timedOut += dropped;
                partial = true;
                log.warn("Request deadline reached while scheduling lookups for view={}, dropping {} candidates", view, dropped);
                break;
            }

            SemaphoreGuard permit = guard;
            CompletableFuture<FeatureLookup> future;
            try {
                future = CompletableFuture
                        .supplyAsync(() -> {
                            try (permit) {
                                return lookupService.lookup(view, chunk, deadline);
                            }
                        }, executor)
                        .orTimeout(Math.max(1L, deadline.boundedMillis(lookupTimeoutMs)), TimeUnit.MILLISECONDS);
            } catch (RejectedExecutionException e) {
                permit.close();
                timedOut += chunk.size();
                log.warn("Lookup pool saturated, dropping chunk of {} candidates for view={}", chunk.size(), view);
                continue;
            }
            calls.add(new ChunkCall(chunk, future));
        }

        Map<String, FeatureRecord> records = new HashMap<>();
        Set<String> stale = new HashSet<>();
        boolean fromFallback = false;
        Long staleness = null;
        for (ChunkCall call : calls) {
            try {
                FeatureLookup lookup = call.future().join();
                records.putAll(lookup.getRecords());
                stale.addAll(lookup.getStale());
                if (lookup.isFromFallback()) {
                    fromFallback = true;
                    if (lookup.getStalenessSeconds() != null) {
                        staleness = staleness == null ? lookup.getStalenessSeconds() : Math.max(staleness, lookup.getStalenessSeconds());
                    }
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof TimeoutException || cause instanceof RequestTimeoutException) {
                    timedOut += call.ids().size();
                    if (deadline.isExpired()) partial = true;
                    log.warn("Candidate lookup chunk of {} ids timed out for view={}", call.ids().size(), view);
                } else if (cause instanceof RuntimeException re) {
                    throw re;
                } else {
                    throw e;
                }
            }
        }

        return CandidateFetch.builder()
                .records(records)
                .staleCandidates(stale)
                .timedOutCandidates(timedOut)
                .partial(partial)
                .fromFallback(fromFallback)
                .stalenessSeconds(staleness)
                .build();
    }
}
