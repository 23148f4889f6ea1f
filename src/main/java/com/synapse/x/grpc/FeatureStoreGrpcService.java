package com.synapse.x.grpc;

import com.synapse.x.config.RankingProperties;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.OnlineFeatures;
import com.synapse.x.exceptions.BadRequestException;
import com.synapse.x.exceptions.ConflictException;
import com.synapse.x.exceptions.ModelActivationException;
import com.synapse.x.exceptions.NotFoundException;
import com.synapse.x.exceptions.RequestTimeoutException;
import com.synapse.x.exceptions.StoreUnavailableException;
import com.synapse.x.grpc.proto.FeatureStatsRequest;
import com.synapse.x.grpc.proto.FeatureStatsResponse;
import com.synapse.x.grpc.proto.FeatureStoreGrpc;
import com.synapse.x.grpc.proto.HealthCheckRequest;
import com.synapse.x.grpc.proto.HealthCheckResponse;
import com.synapse.x.grpc.proto.HistoricalFeaturesRequest;
import com.synapse.x.grpc.proto.HistoricalFeaturesResponse;
import com.synapse.x.grpc.proto.OnlineFeaturesRequest;
import com.synapse.x.grpc.proto.OnlineFeaturesResponse;
import com.synapse.x.grpc.proto.RegisterFeatureViewRequest;
import com.synapse.x.grpc.proto.RegisterFeatureViewResponse;
import com.synapse.x.grpc.proto.WriteFeaturesRequest;
import com.synapse.x.grpc.proto.WriteFeaturesResponse;
import com.synapse.x.service.FeatureServingService;
import com.synapse.x.service.HealthReporter;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.stub.StreamObserver;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

@Slf4j
@Component
public class FeatureStoreGrpcService extends FeatureStoreGrpc.FeatureStoreImplBase {

    private final FeatureServingService servingService;
    private final HealthReporter healthReporter;
    private final RankingProperties rankingProperties;
    private final Clock clock;

    public FeatureStoreGrpcService(FeatureServingService servingService,
                                   HealthReporter healthReporter,
                                   RankingProperties rankingProperties,
                                   Clock clock) {
        this.servingService = servingService;
        this.healthReporter = healthReporter;
        this.rankingProperties = rankingProperties;
        this.clock = clock;
    }

    @Override
    public void getOnlineFeatures(OnlineFeaturesRequest request, StreamObserver<OnlineFeaturesResponse> observer) {
        respond("GetOnlineFeatures", observer, () -> {
            long start = System.nanoTime();
            Instant queryTime = clock.instant();
            OnlineFeatures features = servingService.getOnlineFeatures(view(request.getFeatureView()), request.getCompanyIdsList());
            return FeatureProtoMapper.toOnlineResponse(features, queryTime, elapsedMs(start));
        });
    }

    @Override
    public void getHistoricalFeatures(HistoricalFeaturesRequest request, StreamObserver<HistoricalFeaturesResponse> observer) {
        respond("GetHistoricalFeatures", observer, () -> {
            long start = System.nanoTime();
            Instant queryTime = clock.instant();
            Instant from = request.hasStartTime() ? FeatureProtoMapper.toInstant(request.getStartTime()) : null;
            Instant to = request.hasEndTime() ? FeatureProtoMapper.toInstant(request.getEndTime()) : null;
            List<FeatureRecord> records = servingService.getHistoricalFeatures(
                    view(request.getFeatureView()), request.getCompanyIdsList(), from, to);
            return HistoricalFeaturesResponse.newBuilder()
                    .addAllFeatures(records.stream().map(FeatureProtoMapper::toProto).toList())
                    .setMetadata(FeatureProtoMapper.metadata(records.size(), queryTime, elapsedMs(start)))
                    .build();
        });
    }

    @Override
    public void writeFeatures(WriteFeaturesRequest request, StreamObserver<WriteFeaturesResponse> observer) {
        respond("WriteFeatures", observer, () -> FeatureProtoMapper.toWriteResponse(
                servingService.writeFeatures(view(request.getFeatureView()),
                        FeatureProtoMapper.toRecords(request.getFeaturesList()))));
    }

    @Override
    public void getFeatureStats(FeatureStatsRequest request, StreamObserver<FeatureStatsResponse> observer) {
        respond("GetFeatureStats", observer, () -> FeatureProtoMapper.toStatsResponse(
                servingService.getFeatureStats(view(request.getFeatureView()))));
    }

    @Override
    public void healthCheck(HealthCheckRequest request, StreamObserver<HealthCheckResponse> observer) {
        respond("HealthCheck", observer, () -> FeatureProtoMapper.toHealthResponse(healthReporter.check()));
    }

    @Override
    public void registerFeatureView(RegisterFeatureViewRequest request, StreamObserver<RegisterFeatureViewResponse> observer) {
        respond("RegisterFeatureView", observer, () -> {
            if (StringUtils.isBlank(request.getFeatureView())) {
                throw new BadRequestException("feature_view is required");
            }
            return FeatureProtoMapper.toRegisterResponse(
                    servingService.registerFeatureView(request.getFeatureView(), request.getEmbeddingDim()));
        });
    }

    private String view(String requested) {
        return StringUtils.isBlank(requested) ? rankingProperties.getDefaultFeatureView() : requested;
    }

    private <T> void respond(String rpc, StreamObserver<T> observer, Supplier<T> call) {
        T response;
        try {
            response = call.get();
        } catch (RuntimeException e) {
            observer.onError(toStatus(rpc, e));
            return;
        }
        observer.onNext(response);
        observer.onCompleted();
    }

    static StatusRuntimeException toStatus(String rpc, RuntimeException e) {
        Status status;
        if (e instanceof BadRequestException || e instanceof IllegalArgumentException) {
            status = Status.INVALID_ARGUMENT;
        } else if (e instanceof NotFoundException) {
            status = Status.NOT_FOUND;
        } else if (e instanceof ConflictException) {
            status = Status.ALREADY_EXISTS;
        } else if (e instanceof ModelActivationException) {
            status = Status.FAILED_PRECONDITION;
        } else if (e instanceof StoreUnavailableException) {
            status = Status.UNAVAILABLE;
        } else if (e instanceof RequestTimeoutException) {
            status = Status.DEADLINE_EXCEEDED;
        } else {
            log.error("{} failed", rpc, e);
            return Status.INTERNAL.withDescription("internal error").withCause(e).asRuntimeException();
        }
        if (status.getCode() == Status.Code.UNAVAILABLE) {
            log.warn("{} unavailable: {}", rpc, e.getMessage());
        } else {
            log.debug("{} rejected with {}: {}", rpc, status.getCode(), e.getMessage());
        }
        return status.withDescription(e.getMessage()).asRuntimeException();
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }
}
