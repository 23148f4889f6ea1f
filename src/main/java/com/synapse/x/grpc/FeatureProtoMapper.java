package com.synapse.x.grpc;

import com.google.protobuf.Timestamp;
import com.google.protobuf.util.Timestamps;
import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.FeatureStats;
import com.synapse.x.dto.FeatureView;
import com.synapse.x.dto.HealthStatus;
import com.synapse.x.dto.OnlineFeatures;
import com.synapse.x.dto.RejectedRecord;
import com.synapse.x.dto.TractionMetrics;
import com.synapse.x.dto.WriteResult;
import com.synapse.x.grpc.proto.CompanyFeatures;
import com.synapse.x.grpc.proto.FeatureStatsResponse;
import com.synapse.x.grpc.proto.HealthCheckResponse;
import com.synapse.x.grpc.proto.OnlineFeaturesResponse;
import com.synapse.x.grpc.proto.RegisterFeatureViewResponse;
import com.synapse.x.grpc.proto.RejectedFeature;
import com.synapse.x.grpc.proto.ResponseMetadata;
import com.synapse.x.grpc.proto.WriteFeaturesResponse;
import lombok.experimental.UtilityClass;

import java.time.Instant;
import java.util.List;

/**
 * Conversions between the wire messages and the domain types. Unset proto3 {@code optional}
 * fields map to {@code null}; an absent timestamp maps to {@code null}.
 */
@UtilityClass
public class FeatureProtoMapper {

    public FeatureRecord toRecord(CompanyFeatures proto) {
        FeatureRecord.FeatureRecordBuilder b = FeatureRecord.builder()
                .companyId(proto.getCompanyId())
                .userOverlapScore(proto.hasUserOverlapScore() ? proto.getUserOverlapScore() : null)
                .matchOutcome(proto.hasMatchOutcome() ? proto.getMatchOutcome() : null)
                .cultureVector(proto.getCultureVectorList())
                .timestamp(proto.hasTimestamp() ? toInstant(proto.getTimestamp()) : null);
        if (proto.hasTractionMetrics()) {
            com.synapse.x.grpc.proto.TractionMetrics t = proto.getTractionMetrics();
            b.tractionMetrics(TractionMetrics.builder()
                    .fundingAmount(t.getFundingAmount())
                    .employeeCount(t.getEmployeeCount())
                    .growthRate(t.getGrowthRate())
                    .marketSentiment(t.getMarketSentiment())
                    .revenueGrowth(t.hasRevenueGrowth() ? t.getRevenueGrowth() : null)
                    .userGrowth(t.hasUserGrowth() ? t.getUserGrowth() : null)
                    .build());
        }
        return b.build();
    }

    public List<FeatureRecord> toRecords(List<CompanyFeatures> protos) {
        return protos.stream().map(FeatureProtoMapper::toRecord).toList();
    }

    public CompanyFeatures toProto(FeatureRecord record) {
        CompanyFeatures.Builder b = CompanyFeatures.newBuilder()
                .setCompanyId(record.getCompanyId() == null ? "" : record.getCompanyId());
        if (record.getUserOverlapScore() != null) b.setUserOverlapScore(record.getUserOverlapScore());
        if (record.getMatchOutcome() != null) b.setMatchOutcome(record.getMatchOutcome());
        if (record.getCultureVector() != null) b.addAllCultureVector(record.getCultureVector());
        if (record.getTimestamp() != null) b.setTimestamp(toTimestamp(record.getTimestamp()));

        TractionMetrics t = record.getTractionMetrics();
        if (t != null) {
            com.synapse.x.grpc.proto.TractionMetrics.Builder tb = com.synapse.x.grpc.proto.TractionMetrics.newBuilder()
                    .setFundingAmount(t.getFundingAmount())
                    .setEmployeeCount(t.getEmployeeCount())
                    .setGrowthRate(t.getGrowthRate())
                    .setMarketSentiment(t.getMarketSentiment());
            if (t.getRevenueGrowth() != null) tb.setRevenueGrowth(t.getRevenueGrowth());
            if (t.getUserGrowth() != null) tb.setUserGrowth(t.getUserGrowth());
            b.setTractionMetrics(tb);
        }
        return b.build();
    }

    public OnlineFeaturesResponse toOnlineResponse(OnlineFeatures features, Instant queryTime, double latencyMs) {
        return OnlineFeaturesResponse.newBuilder()
                .addAllFeatures(features.getFound().stream().map(FeatureProtoMapper::toProto).toList())
                .addAllMissing(features.getMissing())
                .addAllStale(features.getStale())
                .setMetadata(metadata(features.getFound().size(), queryTime, latencyMs))
                .build();
    }

    public WriteFeaturesResponse toWriteResponse(WriteResult result) {
        WriteFeaturesResponse.Builder b = WriteFeaturesResponse.newBuilder()
                .setSuccess(result.getRejected().isEmpty())
                .setFeaturesWritten(result.getAcceptedCount())
                .setMessage(result.getRejected().isEmpty()
                        ? "wrote %d records".formatted(result.getAcceptedCount())
                        : "wrote %d records, rejected %d".formatted(result.getAcceptedCount(), result.getRejected().size()));
        for (RejectedRecord rejected : result.getRejected()) {
            b.addRejected(RejectedFeature.newBuilder()
                    .setRecord(toProto(rejected.getRecord()))
                    .setReason(rejected.getReason().name())
                    .setMessage(rejected.getMessage() == null ? "" : rejected.getMessage()));
        }
        return b.build();
    }

    public FeatureStatsResponse toStatsResponse(FeatureStats stats) {
        FeatureStatsResponse.Builder b = FeatureStatsResponse.newBuilder()
                .setTotalCompanies(stats.getTotalCompanies())
                .setFeatureCount(stats.getFeatureCount())
                .setStorageSizeBytes(stats.getStorageSizeBytes())
                .setEmbeddingDim(stats.getEmbeddingDim());
        if (stats.getLastUpdated() != null) b.setLastUpdated(toTimestamp(stats.getLastUpdated()));
        return b.build();
    }

    public HealthCheckResponse toHealthResponse(HealthStatus status) {
        HealthCheckResponse.Builder b = HealthCheckResponse.newBuilder()
                .setStatus(status.getStatus().wireValue())
                .setTimestamp(toTimestamp(status.getTimestamp()))
                .setActiveModelVersion(status.getActiveModelVersion() == null ? "" : status.getActiveModelVersion());
        if (status.getLastWriteAgeSeconds() != null) b.setLastWriteAgeSeconds(status.getLastWriteAgeSeconds());
        return b.build();
    }

    public RegisterFeatureViewResponse toRegisterResponse(FeatureView view) {
        return RegisterFeatureViewResponse.newBuilder()
                .setFeatureView(view.getName())
                .setEmbeddingDim(view.getEmbeddingDim())
                .setCreatedAt(toTimestamp(view.getCreatedAt()))
                .build();
    }

    public ResponseMetadata metadata(int featureCount, Instant queryTime, double latencyMs) {
        return ResponseMetadata.newBuilder()
                .setFeatureCount(featureCount)
                .setQueryTime(toTimestamp(queryTime))
                .setLatencyMs(latencyMs)
                .build();
    }

    public Timestamp toTimestamp(Instant instant) {
        return Timestamp.newBuilder()
                .setSeconds(instant.getEpochSecond())
                .setNanos(instant.getNano())
                .build();
    }

    public Instant toInstant(Timestamp ts) {
        Timestamps.checkValid(ts);
        return Instant.ofEpochSecond(ts.getSeconds(), ts.getNanos());
    }
}
