package com.synapse.x.utils.store;

import com.synapse.x.dto.FeatureRecord;
import com.synapse.x.dto.FeatureView;
import com.synapse.x.dto.ModelVersion;
import com.synapse.x.dto.TractionMetrics;
import com.synapse.x.dto.enums.ModelStatus;
import com.synapse.x.exceptions.InternalServerErrorException;
import lombok.experimental.UtilityClass;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Binary layout of everything kept in LMDB.
 * <p>
 * Record keys are {@code view 0x00 company 0x00 epochSecond(8B BE) nano(4B BE)}. Neither view
 * names nor company ids may contain control characters, so the separator never occurs inside
 * a component and, with non-negative seconds, byte order equals (view, company, time) order.
 * </p>
 */
@UtilityClass
public final class StoreCodec {

    public static final byte SEPARATOR = 0x00;
    public static final int TIMESTAMP_BYTES = 12;
    public static final int MAX_KEY_BYTES = 511;

    private static final byte RECORD_FORMAT = 1;
    private static final int HAS_OVERLAP = 1;
    private static final int HAS_TRACTION = 1 << 1;
    private static final int HAS_REVENUE_GROWTH = 1 << 2;
    private static final int HAS_USER_GROWTH = 1 << 3;
    private static final int HAS_MATCH_OUTCOME = 1 << 4;

    private final ThreadLocal<ByteBuffer> keyBuf = ThreadLocal.withInitial(() ->
            ByteBuffer.allocateDirect(MAX_KEY_BYTES).order(ByteOrder.BIG_ENDIAN));

    private final ThreadLocal<ByteBuffer> scanKeyBuf = ThreadLocal.withInitial(() ->
            ByteBuffer.allocateDirect(MAX_KEY_BYTES).order(ByteOrder.BIG_ENDIAN));

    private final ThreadLocal<ByteBuffer> valBuf = ThreadLocal.withInitial(() ->
            ByteBuffer.allocateDirect(4096).order(ByteOrder.BIG_ENDIAN));

    // keys

    public static ByteBuffer recordKey(String view, String companyId, Instant ts) {
        ByteBuffer kb = keyBuf.get();
        kb.clear();
        putCompanyPrefix(kb, view, companyId);
        putTimestamp(kb, ts);
        kb.flip();
        return kb;
    }

    /**
     * Seek key for a historical scan. Uses its own buffer so that point lookups made while the
     * cursor is open do not clobber it.
     */
    public static ByteBuffer scanStartKey(String view, String companyId, Instant from) {
        ByteBuffer kb = scanKeyBuf.get();
        kb.clear();
        putCompanyPrefix(kb, view, companyId);
        putTimestamp(kb, from);
        kb.flip();
        return kb;
    }

    public static ByteBuffer latestKey(String view, String companyId) {
        ByteBuffer kb = keyBuf.get();
        kb.clear();
        kb.put(utf8(view)).put(SEPARATOR).put(utf8(companyId));
        kb.flip();
        return kb;
    }

    public static ByteBuffer viewPrefix(String view) {
        ByteBuffer kb = scanKeyBuf.get();
        kb.clear();
        kb.put(utf8(view)).put(SEPARATOR);
        kb.flip();
        return kb;
    }

    public static ByteBuffer nameKey(String name) {
        ByteBuffer kb = keyBuf.get();
        kb.clear();
        kb.put(utf8(name));
        kb.flip();
        return kb;
    }

    public static byte[] companyPrefix(String view, String companyId) {
        byte[] v = utf8(view);
        byte[] c = utf8(companyId);
        byte[] out = new byte[v.length + c.length + 2];
        System.arraycopy(v, 0, out, 0, v.length);
        System.arraycopy(c, 0, out, v.length + 1, c.length);
        return out;
    }

    public static boolean startsWith(ByteBuffer key, byte[] prefix) {
        if (key.remaining() < prefix.length) return false;
        int base = key.position();
        for (int i = 0; i < prefix.length; i++) {
            if (key.get(base + i) != prefix[i]) return false;
        }
        return true;
    }

    /**
     * Timestamp suffix of a record key, assuming the caller already matched the company prefix.
     */
    public static Instant keyTimestamp(ByteBuffer key) {
        int at = key.limit() - TIMESTAMP_BYTES;
        return Instant.ofEpochSecond(key.getLong(at), key.getInt(at + 8));
    }

    public static String keySuffix(ByteBuffer key, int prefixLength) {
        int len = key.remaining() - prefixLength;
        byte[] out = new byte[len];
        key.duplicate().position(key.position() + prefixLength).get(out);
        return new String(out, StandardCharsets.UTF_8);
    }

    public static int keyLength(String view, String companyId) {
        return utf8(view).length + utf8(companyId).length + 2 + TIMESTAMP_BYTES;
    }

    // feature records

    public static ByteBuffer encodeRecord(FeatureRecord r) {
        return encode(r, false);
    }

    /**
     * Value of the {@code latest} database: the timestamp followed by the encoded record, so that
     * listing companies does not need to decode whole records.
     */
    public static ByteBuffer encodeLatest(FeatureRecord r) {
        return encode(r, true);
    }

    public static Instant latestTimestamp(ByteBuffer val) {
        return Instant.ofEpochSecond(val.getLong(val.position()), val.getInt(val.position() + 8));
    }

    public static FeatureRecord decodeLatest(ByteBuffer val) {
        ByteBuffer bb = val.duplicate().order(ByteOrder.BIG_ENDIAN);
        bb.position(bb.position() + TIMESTAMP_BYTES);
        return decodeRecord(bb);
    }

    public static FeatureRecord decodeRecord(ByteBuffer val) {
        ByteBuffer bb = val.duplicate().order(ByteOrder.BIG_ENDIAN);
        byte format = bb.get();
        if (format != RECORD_FORMAT) {
            throw new InternalServerErrorException("Unknown record format " + format);
        }
        int flags = bb.get();
        FeatureRecord.FeatureRecordBuilder b = FeatureRecord.builder()
                .companyId(getString(bb))
                .timestamp(getTimestamp(bb));

        if ((flags & HAS_OVERLAP) != 0) b.userOverlapScore(bb.getDouble());
        if ((flags & HAS_TRACTION) != 0) {
            TractionMetrics.TractionMetricsBuilder t = TractionMetrics.builder()
                    .fundingAmount(bb.getDouble())
                    .employeeCount(bb.getInt())
                    .growthRate(bb.getDouble())
                    .marketSentiment(bb.getDouble());
            if ((flags & HAS_REVENUE_GROWTH) != 0) t.revenueGrowth(bb.getDouble());
            if ((flags & HAS_USER_GROWTH) != 0) t.userGrowth(bb.getDouble());
            b.tractionMetrics(t.build());
        }
        if ((flags & HAS_MATCH_OUTCOME) != 0) b.matchOutcome(bb.getInt());

        int dim = bb.getInt();
        List<Double> culture = new ArrayList<>(dim);
        for (int i = 0; i < dim; i++) {
            culture.add(bb.getDouble());
        }
        return b.cultureVector(culture).build();
    }

    private static ByteBuffer encode(FeatureRecord r, boolean withLeadingTimestamp) {
        byte[] id = utf8(r.getCompanyId());
        TractionMetrics t = r.getTractionMetrics();
        int size = (withLeadingTimestamp ? TIMESTAMP_BYTES : 0)
                + 2 + 4 + id.length + TIMESTAMP_BYTES
                + (r.getUserOverlapScore() != null ? 8 : 0)
                + (t != null ? 28 + (t.getRevenueGrowth() != null ? 8 : 0) + (t.getUserGrowth() != null ? 8 : 0) : 0)
                + (r.getMatchOutcome() != null ? 4 : 0)
                + 4 + 8 * r.getCultureVector().size();

        ByteBuffer vb = valBuf.get();
        if (vb.capacity() < size) {
            vb = ByteBuffer.allocateDirect(Integer.highestOneBit(size) << 1).order(ByteOrder.BIG_ENDIAN);
            valBuf.set(vb);
        }
        vb.clear();

        if (withLeadingTimestamp) putTimestamp(vb, r.getTimestamp());

        int flags = 0;
        if (r.getUserOverlapScore() != null) flags |= HAS_OVERLAP;
        if (t != null) {
            flags |= HAS_TRACTION;
            if (t.getRevenueGrowth() != null) flags |= HAS_REVENUE_GROWTH;
            if (t.getUserGrowth() != null) flags |= HAS_USER_GROWTH;
        }
        if (r.getMatchOutcome() != null) flags |= HAS_MATCH_OUTCOME;

        vb.put(RECORD_FORMAT).put((byte) flags);
        vb.putInt(id.length).put(id);
        putTimestamp(vb, r.getTimestamp());
        if (r.getUserOverlapScore() != null) vb.putDouble(r.getUserOverlapScore());
        if (t != null) {
            vb.putDouble(t.getFundingAmount())
                    .putInt(t.getEmployeeCount())
                    .putDouble(t.getGrowthRate())
                    .putDouble(t.getMarketSentiment());
            if (t.getRevenueGrowth() != null) vb.putDouble(t.getRevenueGrowth());
            if (t.getUserGrowth() != null) vb.putDouble(t.getUserGrowth());
        }
        if (r.getMatchOutcome() != null) vb.putInt(r.getMatchOutcome());
        vb.putInt(r.getCultureVector().size());
        for (Double v : r.getCultureVector()) {
            vb.putDouble(v);
        }
        vb.flip();
        return vb;
    }

    // catalog entries

    public static ByteBuffer encodeView(FeatureView v) {
        ByteBuffer vb = valBuf.get();
        vb.clear();
        vb.putInt(v.getEmbeddingDim());
        putTimestamp(vb, v.getCreatedAt());
        vb.putLong(v.getCompanyCount());
        vb.putLong(v.getRecordCount());
        putNullableTimestamp(vb, v.getLastUpdated());
        vb.putLong(v.getStorageBytes());
        vb.flip();
        return vb;
    }

    public static FeatureView decodeView(String name, ByteBuffer val) {
        ByteBuffer bb = val.duplicate().order(ByteOrder.BIG_ENDIAN);
        return FeatureView.builder()
                .name(name)
                .embeddingDim(bb.getInt())
                .createdAt(getTimestamp(bb))
                .companyCount(bb.getLong())
                .recordCount(bb.getLong())
                .lastUpdated(getNullableTimestamp(bb))
                .storageBytes(bb.getLong())
                .build();
    }

    public static ByteBuffer encodeModel(ModelVersion m) {
        ByteBuffer vb = valBuf.get();
        vb.clear();
        vb.putInt(m.getEmbeddingDim());
        vb.put((byte) m.getStatus().ordinal());
        putTimestamp(vb, m.getRegisteredAt());
        putNullableTimestamp(vb, m.getActivatedAt());
        vb.flip();
        return vb;
    }

    public static ModelVersion decodeModel(String versionId, ByteBuffer val) {
        ByteBuffer bb = val.duplicate().order(ByteOrder.BIG_ENDIAN);
        return ModelVersion.builder()
                .versionId(versionId)
                .embeddingDim(bb.getInt())
                .status(ModelStatus.values()[bb.get()])
                .registeredAt(getTimestamp(bb))
                .activatedAt(getNullableTimestamp(bb))
                .build();
    }

    public static String decodeName(ByteBuffer key) {
        byte[] out = new byte[key.remaining()];
        key.duplicate().get(out);
        return new String(out, StandardCharsets.UTF_8);
    }

    // primitives

    private static void putCompanyPrefix(ByteBuffer bb, String view, String companyId) {
        bb.put(utf8(view)).put(SEPARATOR).put(utf8(companyId)).put(SEPARATOR);
    }

    private static void putTimestamp(ByteBuffer bb, Instant ts) {
        bb.putLong(ts.getEpochSecond()).putInt(ts.getNano());
    }

    private static Instant getTimestamp(ByteBuffer bb) {
        return Instant.ofEpochSecond(bb.getLong(), bb.getInt());
    }

    private static void putNullableTimestamp(ByteBuffer bb, Instant ts) {
        bb.put((byte) (ts == null ? 0 : 1));
        if (ts != null) putTimestamp(bb, ts);
    }

    private static Instant getNullableTimestamp(ByteBuffer bb) {
        return bb.get() == 0 ? null : getTimestamp(bb);
    }

    private static String getString(ByteBuffer bb) {
        int len = bb.getInt();
        byte[] arr = new byte[len];
        bb.get(arr);
        return new String(arr, StandardCharsets.UTF_8);
    }

    private static byte[] utf8(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }
}
