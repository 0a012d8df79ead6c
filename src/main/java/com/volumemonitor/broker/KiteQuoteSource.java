package com.volumemonitor.broker;

import com.volumemonitor.broker.mapper.KiteQuoteMapper;
import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.domain.model.QuoteSnapshot;
import com.volumemonitor.exception.AuthException;
import com.volumemonitor.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import com.zerodhatech.models.Quote;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.json.JSONException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * {@link QuoteSource} backed by the Kite Connect full-quote endpoint.
 *
 * <p>One call per batch: instruments are requested as {@code EXCHANGE:SYMBOL} keys and each
 * returned {@link Quote} is keyed back by instrument token. Instruments Kite leaves out of the
 * response are simply absent from the result.
 *
 * <p>Rate limited by the {@code kiteQuotes} Resilience4j limiter (Kite allows one quote call
 * per second). A call that cannot get a permit fails like any other batch failure.
 *
 * <p>Kite's checked exceptions are wrapped: {@link TokenException} (HTTP 403, session
 * expired or revoked) becomes {@link AuthException}; everything else becomes {@link BrokerException}.
 */
@Service
public class KiteQuoteSource implements QuoteSource {

    private static final Logger log = LoggerFactory.getLogger(KiteQuoteSource.class);

    private final KiteConnect kiteConnect;
    private final KiteQuoteMapper kiteQuoteMapper;

    public KiteQuoteSource(KiteConnect kiteConnect, KiteQuoteMapper kiteQuoteMapper) {
        this.kiteConnect = kiteConnect;
        this.kiteQuoteMapper = kiteQuoteMapper;
    }

    @Override
    @RateLimiter(name = "kiteQuotes")
    public Map<Long, QuoteSnapshot> fetchBatch(List<InstrumentRef> refs) {
        if (refs.isEmpty()) {
            return Map.of();
        }

        Map<String, InstrumentRef> byKey = new HashMap<>();
        for (InstrumentRef ref : refs) {
            byKey.put(ref.quoteKey(), ref);
        }
        String[] keys = byKey.keySet().toArray(new String[0]);

        Map<String, Quote> quotes;
        try {
            quotes = kiteConnect.getQuote(keys);
        } catch (TokenException e) {
            log.error("Kite rejected the session while fetching quotes: {}", e.message);
            throw new AuthException("Kite session expired or invalid: " + e.message, e);
        } catch (KiteException e) {
            log.warn("Kite quote call failed for {} instruments: {}", keys.length, e.message);
            throw new BrokerException("Quote fetch failed: " + e.message, e);
        } catch (JSONException | IOException e) {
            log.warn("Quote fetch error for {} instruments: {}", keys.length, e.getMessage());
            throw new BrokerException("Quote fetch error: " + e.getMessage(), e);
        }

        Map<Long, QuoteSnapshot> snapshots = new HashMap<>();
        if (quotes == null) {
            return snapshots;
        }
        for (Map.Entry<String, Quote> entry : quotes.entrySet()) {
            Quote quote = entry.getValue();
            if (quote == null) {
                continue;
            }
            InstrumentRef ref = byKey.get(entry.getKey());
            // Kite may key the response differently from the request; fall back to the token it reports
            long token = ref != null ? ref.getToken() : quote.instrumentToken;
            snapshots.put(token, kiteQuoteMapper.toSnapshot(quote, token));
        }
        log.debug("Fetched {} of {} quotes", snapshots.size(), keys.length);
        return snapshots;
    }
}
