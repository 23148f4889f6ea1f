package com.synapse.x.grpc;

import com.google.protobuf.Timestamp;
import com.synapse.x.config.RankingProperties;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.FeatureStats;
import com.synapse.x.dto.HealthStatus;
import com.synapse.x.dto.OnlineFeatures;
import com.synapse.x.dto.RejectedRecord;
import com.synapse.x.dto.WriteResult;
import com.synapse.x.dto.enums.HealthState;
import com.synapse.x.dto.enums.RejectionReason;
import com.synapse.x.exceptions.BadRequestException;
import com.synapse.x.exceptions.ConflictException;
import com.synapse.x.exceptions.StoreUnavailableException;
import com.synapse.x.exceptions.TooLargeException;
import com.synapse.x.grpc.proto.CompanyFeatures;
import com.synapse.x.grpc.proto.FeatureStatsRequest;
import com.synapse.x.grpc.proto.FeatureStatsResponse;
import com.synapse.x.grpc.proto.FeatureStoreGrpc;
import com.synapse.x.grpc.proto.HealthCheckRequest;
import com.synapse.x.grpc.proto.HealthCheckResponse;
import com.synapse.x.grpc.proto.HistoricalFeaturesRequest;
import com.synapse.x.grpc.proto.OnlineFeaturesRequest;
import com.synapse.x.grpc.proto.OnlineFeaturesResponse;
import com.synapse.x.grpc.proto.RegisterFeatureViewRequest;
import com.synapse.x.grpc.proto.TractionMetrics;
import com.synapse.x.grpc.proto.WriteFeaturesRequest;
import com.synapse.x.grpc.proto.WriteFeaturesResponse;
import com.synapse.x.service.FeatureServingService;
import com.synapse.x.service.HealthReporter;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

import static com.synapse.x.support.TestRecords.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FeatureStoreGrpcServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final FeatureServingService servingService = mock(FeatureServingService.class);
    private final HealthReporter healthReporter = mock(HealthReporter.class);

    private Server server;
    private ManagedChannel channel;
    private FeatureStoreGrpc.FeatureStoreBlockingStub stub;

    @BeforeEach
    void setUp() throws Exception {
        String name = InProcessServerBuilder.generateName();
        FeatureStoreGrpcService service = new FeatureStoreGrpcService(servingService, healthReporter,
                new RankingProperties(), Clock.fixed(NOW, ZoneOffset.UTC));
        server = InProcessServerBuilder.forName(name).directExecutor().addService(service).build().start();
        channel = InProcessChannelBuilder.forName(name).directExecutor().build();
        stub = FeatureStoreGrpc.newBlockingStub(channel);
    }

    @AfterEach
    void tearDown() throws Exception {
        channel.shutdownNow();
        server.shutdownNow().awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    void writeFeaturesMapsOptionalFieldsAndRejections() {
        CompanyFeatures withOptionals = CompanyFeatures.newBuilder()
                .setCompanyId("A")
                .setUserOverlapScore(0.3)
                .addAllCultureVector(List.of(1.0, 0.0))
                .setTractionMetrics(TractionMetrics.newBuilder()
                        .setFundingAmount(2_000_000).setEmployeeCount(12).setGrowthRate(15).setMarketSentiment(0.1)
                        .setRevenueGrowth(30))
                .setTimestamp(Timestamp.newBuilder().setSeconds(NOW.getEpochSecond()))
                .build();
        CompanyFeatures bare = CompanyFeatures.newBuilder().setCompanyId("B").build();
        FeatureRecord rejected = record("B", null);
        when(servingService.writeFeatures(eq("v1"), anyList())).thenReturn(WriteResult.builder()
                .featureView("v1")
                .acceptedCount(1)
                .acceptedCompanyId("A")
                .rejected(new RejectedRecord(rejected, RejectionReason.OUT_OF_ORDER, "timestamp is not after stored"))
                .build());

        WriteFeaturesResponse response = stub.writeFeatures(WriteFeaturesRequest.newBuilder()
                .setFeatureView("v1")
                .addFeatures(withOptionals)
                .addFeatures(bare)
                .build());

        assertThat(response.getSuccess()).isFalse();
        assertThat(response.getFeaturesWritten()).isEqualTo(1);
        assertThat(response.getRejected(0).getReason()).isEqualTo("OUT_OF_ORDER");

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<FeatureRecord>> captor = ArgumentCaptor.forClass(List.class);
        verify(servingService).writeFeatures(eq("v1"), captor.capture());
        FeatureRecord a = captor.getValue().get(0);
        FeatureRecord b = captor.getValue().get(1);
        assertThat(a.getUserOverlapScore()).isEqualTo(0.3);
        assertThat(a.getTractionMetrics().getRevenueGrowth()).isEqualTo(30.0);
        assertThat(a.getTractionMetrics().getUserGrowth()).isNull();
        assertThat(a.getTimestamp()).isEqualTo(NOW);
        assertThat(b.getUserOverlapScore()).isNull();
        assertThat(b.getTractionMetrics()).isNull();
        assertThat(b.getTimestamp()).isNull();
        assertThat(b.hasCultureVector()).isFalse();
    }

    @Test
    void onlineFeaturesUseTheDefaultViewWhenNoneIsGiven() {
        when(servingService.getOnlineFeatures(eq("v1"), anyList())).thenReturn(OnlineFeatures.builder()
                .found(record("A", NOW, 1, 0))
                .missing("Z")
                .stale("A")
                .build());

        OnlineFeaturesResponse response = stub.getOnlineFeatures(OnlineFeaturesRequest.newBuilder()
                .addCompanyIds("A").addCompanyIds("Z")
                .build());

        assertThat(response.getFeaturesList()).singleElement()
                .satisfies(f -> {
                    assertThat(f.getCompanyId()).isEqualTo("A");
                    assertThat(f.getCultureVectorList()).containsExactly(1.0, 0.0);
                    assertThat(f.hasMatchOutcome()).isFalse();
                    assertThat(f.getTimestamp().getSeconds()).isEqualTo(NOW.getEpochSecond());
                });
        assertThat(response.getMissingList()).containsExactly("Z");
        assertThat(response.getStaleList()).containsExactly("A");
        assertThat(response.getMetadata().getFeatureCount()).isEqualTo(1);
    }

    @Test
    void errorsMapToStatusCodes() {
        when(servingService.getOnlineFeatures(eq("big"), anyList())).thenThrow(new TooLargeException("company_ids", 2000, 1000));
        when(servingService.getOnlineFeatures(eq("down"), anyList())).thenThrow(new StoreUnavailableException("closed"));
        when(servingService.getFeatureStats("nope")).thenThrow(new BadRequestException("unknown feature_view: nope"));

        assertStatus(() -> stub.getOnlineFeatures(OnlineFeaturesRequest.newBuilder().setFeatureView("big").build()),
                Status.Code.INVALID_ARGUMENT);
        assertStatus(() -> stub.getOnlineFeatures(OnlineFeaturesRequest.newBuilder().setFeatureView("down").build()),
                Status.Code.UNAVAILABLE);
        assertStatus(() -> stub.getFeatureStats(FeatureStatsRequest.newBuilder().setFeatureView("nope").build()),
                Status.Code.INVALID_ARGUMENT);
    }

    @Test
    void reRegisteringViewWithOtherDimensionIsAlreadyExists() {
        when(servingService.registerFeatureView("v1", 8))
                .thenThrow(new ConflictException("feature_view v1 already registered with embedding_dim 4"));

        assertStatus(() -> stub.registerFeatureView(RegisterFeatureViewRequest.newBuilder()
                        .setFeatureView("v1").setEmbeddingDim(8).build()),
                Status.Code.ALREADY_EXISTS);
    }

    @Test
    void historicalRequiresBothBounds() {
        when(servingService.getHistoricalFeatures(any(), anyList(), any(), any()))
                .thenThrow(new BadRequestException("start_time and end_time are required"));

        assertStatus(() -> stub.getHistoricalFeatures(HistoricalFeaturesRequest.newBuilder()
                        .setFeatureView("v1").addCompanyIds("A").build()),
                Status.Code.INVALID_ARGUMENT);
    }

    @Test
    void statsAndHealth() {
        when(servingService.getFeatureStats("v1")).thenReturn(FeatureStats.builder()
                .featureView("v1").totalCompanies(3).featureCount(7).lastUpdated(NOW).storageSizeBytes(2048).embeddingDim(4)
                .build());
        when(healthReporter.check()).thenReturn(HealthStatus.builder()
                .status(HealthState.DEGRADED).timestamp(NOW).details(Map.of()).build());

        FeatureStatsResponse stats = stub.getFeatureStats(FeatureStatsRequest.newBuilder().setFeatureView("v1").build());
        HealthCheckResponse health = stub.healthCheck(HealthCheckRequest.getDefaultInstance());

        assertThat(stats.getTotalCompanies()).isEqualTo(3);
        assertThat(stats.getFeatureCount()).isEqualTo(7);
        assertThat(stats.getEmbeddingDim()).isEqualTo(4);
        assertThat(health.getStatus()).isEqualTo("degraded");
        assertThat(health.getActiveModelVersion()).isEmpty();
        assertThat(health.hasLastWriteAgeSeconds()).isFalse();
    }

    private static void assertStatus(Runnable call, Status.Code code) {
        assertThatThrownBy(call::run)
                .isInstanceOfSatisfying(StatusRuntimeException.class,
                        e -> assertThat(e.getStatus().getCode()).isEqualTo(code));
    }
}
