package com.volumemonitor.broker;

import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.domain.model.QuoteSnapshot;
import java.util.List;
import java.util.Map;

/**
 * Market-data client that quotes one batch of instruments per call.
 */
public interface QuoteSource {

    /**
     * Fetches quotes for the batch.
     *
     * @return snapshots keyed by instrument token. Instruments missing from the map had no
     *     data this call.
     * @throws com.volumemonitor.exception.AuthException when the session is invalid
     * @throws com.volumemonitor.exception.BrokerException when the whole batch failed
     */
    Map<Long, QuoteSnapshot> fetchBatch(List<InstrumentRef> refs);
}
