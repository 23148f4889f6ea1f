package com.synapse.x.validation;

import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.RejectedRecord;
import com.synapse.x.dto.TractionMetrics;
import com.synapse.x.dto.enums.RejectionReason;
import org.apache.commons.lang3.StringUtils;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Per-record checks applied by the write path before the monotonic timestamp check.
 */
public final class FeatureRecordValidator {

    public static final int MAX_COMPANY_ID_BYTES = 256;

    private FeatureRecordValidator() {
        throw new UnsupportedOperationException("unsupported");
    }

    public static boolean isValidCompanyId(String companyId) {
        if (StringUtils.isBlank(companyId)) return false;
        if (companyId.getBytes(StandardCharsets.UTF_8).length > MAX_COMPANY_ID_BYTES) return false;
        return companyId.chars().noneMatch(Character::isISOControl);
    }

    /**
     * @param record       the record to check, timestamp already defaulted
     * @param embeddingDim the view's declared dimensionality
     * @return the rejection, or empty when the record is well formed
     */
    public static Optional<RejectedRecord> validate(FeatureRecord record, int embeddingDim) {
        if (!isValidCompanyId(record.getCompanyId())) {
            return reject(record, RejectionReason.INVALID_COMPANY_ID, "company_id must be 1-256 bytes without control characters");
        }

        List<Double> culture = record.getCultureVector();
        if (!culture.isEmpty() && culture.size() != embeddingDim) {
            return reject(record, RejectionReason.DIMENSION_MISMATCH,
                    "culture_vector has %d dimensions, view expects %d".formatted(culture.size(), embeddingDim));
        }
        for (Double v : culture) {
            if (v == null || !Double.isFinite(v)) {
                return reject(record, RejectionReason.OUT_OF_RANGE, "culture_vector contains a non-finite value");
            }
        }

        Double overlap = record.getUserOverlapScore();
        if (overlap != null && (!Double.isFinite(overlap) || overlap < 0.0 || overlap > 1.0)) {
            return reject(record, RejectionReason.OUT_OF_RANGE, "user_overlap_score must be within [0, 1]");
        }

        Instant ts = record.getTimestamp();
        if (ts != null && ts.isBefore(Instant.EPOCH)) {
            return reject(record, RejectionReason.OUT_OF_RANGE, "timestamp precedes the epoch");
        }

        TractionMetrics t = record.getTractionMetrics();
        if (t == null) {
            return Optional.empty();
        }
        if (!Double.isFinite(t.getFundingAmount()) || t.getFundingAmount() < 0) {
            return reject(record, RejectionReason.OUT_OF_RANGE, "funding_amount must be a finite value >= 0");
        }
        if (t.getEmployeeCount() < 0) {
            return reject(record, RejectionReason.OUT_OF_RANGE, "employee_count must be >= 0");
        }
        if (!Double.isFinite(t.getGrowthRate())) {
            return reject(record, RejectionReason.OUT_OF_RANGE, "growth_rate must be finite");
        }
        if (!Double.isFinite(t.getMarketSentiment()) || t.getMarketSentiment() < -1.0 || t.getMarketSentiment() > 1.0) {
            return reject(record, RejectionReason.OUT_OF_RANGE, "market_sentiment must be within [-1, 1]");
        }
        if (t.getRevenueGrowth() != null && !Double.isFinite(t.getRevenueGrowth())) {
            return reject(record, RejectionReason.OUT_OF_RANGE, "revenue_growth must be finite");
        }
        if (t.getUserGrowth() != null && !Double.isFinite(t.getUserGrowth())) {
            return reject(record, RejectionReason.OUT_OF_RANGE, "user_growth must be finite");
        }
        return Optional.empty();
    }

    private static Optional<RejectedRecord> reject(FeatureRecord record, RejectionReason reason, String message) {
        return Optional.of(new RejectedRecord(record, reason, message));
    }
}
