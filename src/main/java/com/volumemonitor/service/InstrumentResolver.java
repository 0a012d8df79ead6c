package com.volumemonitor.service;

import com.volumemonitor.domain.model.InstrumentRef;
import java.util.Optional;

/**
 * Symbol to instrument lookup backed by a local cache. No network call is made on this path.
 */
public interface InstrumentResolver {

    Optional<InstrumentRef> resolve(String symbol);
}
