package com.volumemonitor.notification;

import com.volumemonitor.domain.enums.AlertKind;
import com.volumemonitor.domain.enums.InstrumentType;
import com.volumemonitor.domain.model.DailyExtremes;
import com.volumemonitor.domain.model.QuoteSnapshot;
import com.volumemonitor.domain.model.SymbolResult;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.text.NumberFormat;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.springframework.stereotype.Component;

/**
 * Renders a fired alert as the plain-text message sent to Telegram.
 *
 * <pre>
 * 🚨 STOCK ALERT 🚨
 * ALERT! RELIANCE - EQ - TBQ Spike
 * Ratio: 1.84
 * ₹2915.40(LTP) -- ₹2890.00 (O) -- ₹2921.00(H) -- ₹2885.10 (L) -- ₹2888.35 (C)
 * TBQ Day High: 1,204,500
 * Time: 10:42:15 AM
 * Date: 19-10-2026
 * </pre>
 */
@Component
public class AlertMessageFormatter {

    private static final DateTimeFormatter TIME = DateTimeFormatter.ofPattern("hh:mm:ss a", Locale.ENGLISH);
    private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("dd-MM-yyyy");

    public String format(AlertKind alertKind, SymbolResult result) {
        QuoteSnapshot snapshot = result.getSnapshot();
        InstrumentType type = result.getInstrument() != null ? result.getInstrument().getInstrumentType() : null;

        List<String> lines = new ArrayList<>();
        lines.add("🚨 STOCK ALERT 🚨");
        lines.add("ALERT! " + result.getSymbol() + " - " + (type != null ? type.name() : "N/A") + " - "
                + alertKind.getLabel());
        lines.add(String.format(Locale.ROOT, "Ratio: %.2f", result.getRatio()));
        lines.add(rupees(snapshot.getLastPrice()) + "(LTP) -- "
                + rupees(snapshot.getOpen()) + " (O) -- "
                + rupees(snapshot.getHigh()) + "(H) -- "
                + rupees(snapshot.getLow()) + " (L) -- "
                + rupees(snapshot.getClose()) + " (C)");

        String dayHigh = dayHighLine(alertKind, result.getDailyExtremes());
        if (dayHigh != null) {
            lines.add(dayHigh);
        }
        if (result.getEvaluatedAt() != null) {
            lines.add("Time: " + TIME.format(result.getEvaluatedAt()));
            lines.add("Date: " + DATE.format(result.getEvaluatedAt()));
        }
        return String.join("\n", lines);
    }

    private String dayHighLine(AlertKind alertKind, DailyExtremes extremes) {
        if (extremes == null) {
            return null;
        }
        Long high = alertKind == AlertKind.BUY_SPIKE ? extremes.getMaxBuyQty() : extremes.getMaxSellQty();
        if (high == null) {
            return null;
        }
        String side = alertKind == AlertKind.BUY_SPIKE ? "TBQ" : "TSQ";
        return side + " Day High: " + NumberFormat.getIntegerInstance(Locale.US).format(high);
    }

    private static String rupees(BigDecimal value) {
        if (value == null) {
            return "₹-";
        }
        return "₹" + value.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }
}
