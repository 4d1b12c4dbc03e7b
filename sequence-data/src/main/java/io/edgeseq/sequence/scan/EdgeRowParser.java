package io.edgeseq.sequence.scan;

import io.edgeseq.sequence.ConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * Parses edge stream rows. Column positions come from the header: {@code src} (or {@code clId1}),
 * {@code dst} (or {@code clId2}) and {@code txId}; every other column is a feature, in header order.
 */
public final class EdgeRowParser {
    private static final Set<String> SRC_NAMES = Set.of("src", "clId1");
    private static final Set<String> DST_NAMES = Set.of("dst", "clId2");
    private static final String TX_NAME = "txId";

    private final int columnCount;
    private final int srcCol;
    private final int dstCol;
    private final int txCol;
    private final int[] featureCols;
    private final List<String> featureNames;

    private EdgeRowParser(int columnCount, int srcCol, int dstCol, int txCol, int[] featureCols, List<String> featureNames) {
        this.columnCount = columnCount;
        this.srcCol = srcCol;
        this.dstCol = dstCol;
        this.txCol = txCol;
        this.featureCols = featureCols;
        this.featureNames = featureNames;
    }

    public static EdgeRowParser fromHeader(String header, int featureWidth) {
        String[] names = split(stripCr(header), -1);
        int src = -1, dst = -1, tx = -1;
        List<Integer> features = new ArrayList<>();
        List<String> featureNames = new ArrayList<>();
        for (int i = 0; i < names.length; i++) {
            String n = names[i].trim().replace("\"", "");
            if (SRC_NAMES.contains(n) && src < 0) src = i;
            else if (DST_NAMES.contains(n) && dst < 0) dst = i;
            else if (TX_NAME.equals(n) && tx < 0) tx = i;
            else {
                features.add(i);
                featureNames.add(n);
            }
        }
        if (src < 0 || dst < 0 || tx < 0) {
            throw new ConfigurationException("Edge stream header must name src/clId1, dst/clId2 and txId columns: " + header);
        }
        if (features.size() != featureWidth) {
            throw new ConfigurationException("Edge stream has " + features.size() + " feature columns, configured feature width is " + featureWidth);
        }
        int[] cols = features.stream().mapToInt(Integer::intValue).toArray();
        return new EdgeRowParser(names.length, src, dst, tx, cols, Collections.unmodifiableList(featureNames));
    }

    public int featureWidth() { return featureCols.length; }
    public List<String> featureNames() { return featureNames; }

    public ParsedRow parse(String line, long offset) {
        String[] parts = split(stripCr(line), columnCount);
        if (parts.length != columnCount) {
            return new ParsedRow.Skipped(offset, SkipReason.COLUMN_COUNT, parts.length + " columns, expected " + columnCount);
        }
        long src, dst, txId;
        try {
            src = Long.parseLong(parts[srcCol].trim());
            dst = Long.parseLong(parts[dstCol].trim());
        } catch (NumberFormatException e) {
            return new ParsedRow.Skipped(offset, SkipReason.BAD_ENTITY_ID, "src=" + parts[srcCol] + " dst=" + parts[dstCol]);
        }
        try {
            txId = Long.parseLong(parts[txCol].trim());
        } catch (NumberFormatException e) {
            return new ParsedRow.Skipped(offset, SkipReason.BAD_TX_ID, "txId=" + parts[txCol]);
        }
        if (txId < 0) {
            return new ParsedRow.Skipped(offset, SkipReason.BAD_TX_ID, "negative txId " + txId);
        }
        float[] features = new float[featureCols.length];
        for (int i = 0; i < featureCols.length; i++) {
            String raw = parts[featureCols[i]];
            float f;
            try {
                f = Float.parseFloat(raw.trim());
            } catch (NumberFormatException e) {
                return new ParsedRow.Skipped(offset, SkipReason.BAD_FEATURE, featureNames.get(i) + "=" + raw);
            }
            if (!Float.isFinite(f)) {
                return new ParsedRow.Skipped(offset, SkipReason.BAD_FEATURE, featureNames.get(i) + "=" + raw);
            }
            features[i] = f;
        }
        return new ParsedRow.Parsed(new EdgeRecord(offset, src, dst, txId, features));
    }

    private static String stripCr(String s) {
        return s.endsWith("\r") ? s.substring(0, s.length() - 1) : s;
    }

    /**
     * Splits on commas. When {@code expected} is positive, stops counting past it so an overlong row is
     * reported as such without allocating every field.
     */
    private static String[] split(String line, int expected) {
        List<String> out = new ArrayList<>(expected > 0 ? expected : 16);
        int start = 0;
        while (true) {
            int comma = line.indexOf(',', start);
            if (comma < 0) {
                out.add(line.substring(start));
                break;
            }
            out.add(line.substring(start, comma));
            start = comma + 1;
            if (expected > 0 && out.size() > expected) break;
        }
        return out.toArray(new String[0]);
    }
}
