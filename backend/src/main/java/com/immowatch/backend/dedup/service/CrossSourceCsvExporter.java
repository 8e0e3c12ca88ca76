package com.immowatch.backend.dedup.service;

import com.immowatch.backend.dedup.dto.CrossSourceReport;
import com.immowatch.backend.dedup.dto.FieldDifference;
import com.immowatch.backend.dedup.dto.ListingMismatch;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Writes a {@link CrossSourceReport} as a spreadsheet-friendly CSV: one row per listing seen on a
 * single site, and one row per differing field of each mismatched pair.
 */
@Slf4j
@Service
public class CrossSourceCsvExporter {

    static final String CSV_HEADER = "section,canonical_id,seloger_id,leboncoin_id,field,"
            + "seloger_value,leboncoin_value,seloger_url,leboncoin_url";
    static final String ONLY_SELOGER = "only_seloger";
    static final String ONLY_LEBONCOIN = "only_leboncoin";
    static final String MISMATCH = "mismatch";

    public String toCsv(CrossSourceReport report) {
        StringWriter buffer = new StringWriter();
        PrintWriter out = new PrintWriter(buffer);
        out.println(CSV_HEADER);

        int rows = 0;
        for (String id : nullToEmpty(report.getOnlySeloger())) {
            out.println(row(ONLY_SELOGER, id, id, null, null, null, null, null, null));
            rows++;
        }
        for (String id : nullToEmpty(report.getOnlyLeboncoin())) {
            out.println(row(ONLY_LEBONCOIN, id, null, id, null, null, null, null, null));
            rows++;
        }
        for (ListingMismatch mismatch : nullToEmpty(report.getMismatches())) {
            if (mismatch.getDifferences() == null) {
                continue;
            }
            for (Map.Entry<String, FieldDifference> field : mismatch.getDifferences().entrySet()) {
                FieldDifference difference = field.getValue();
                out.println(row(MISMATCH, mismatch.getCanonicalId(), mismatch.getSelogerId(), mismatch.getLeboncoinId(),
                        field.getKey(),
                        difference != null ? difference.getSeloger() : null,
                        difference != null ? difference.getLeboncoin() : null,
                        mismatch.getSelogerUrl(), mismatch.getLeboncoinUrl()));
                rows++;
            }
        }
        out.flush();
        log.debug("📄 Exported {} cross-source diff rows", rows);
        return buffer.toString();
    }

    private static String row(Object... values) {
        StringBuilder line = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            if (i > 0) {
                line.append(',');
            }
            line.append(escape(values[i]));
        }
        return line.toString();
    }

    /**
     * Quotes a cell holding a separator, quote or line break, doubling inner quotes.
     */
    static String escape(Object value) {
        if (value == null) {
            return "";
        }
        String text = value instanceof BigDecimal ? ((BigDecimal) value).toPlainString() : value.toString();
        if (text.indexOf(',') >= 0 || text.indexOf('"') >= 0 || text.indexOf('\n') >= 0 || text.indexOf('\r') >= 0) {
            return '"' + text.replace("\"", "\"\"") + '"';
        }
        return text;
    }

    private static <T> List<T> nullToEmpty(List<T> values) {
        return values != null ? values : List.of();
    }
}
