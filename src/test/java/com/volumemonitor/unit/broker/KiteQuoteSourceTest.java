package com.volumemonitor.unit.broker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.volumemonitor.broker.KiteQuoteSource;
import com.volumemonitor.broker.mapper.KiteQuoteMapper;
import com.volumemonitor.domain.enums.InstrumentType;
import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.domain.model.QuoteSnapshot;
import com.volumemonitor.exception.AuthException;
import com.volumemonitor.exception.BrokerException;
import com.zerodhatech.kiteconnect.KiteConnect;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.KiteException;
import com.zerodhatech.kiteconnect.kitehttp.exceptions.TokenException;
import com.zerodhatech.models.OHLC;
import com.zerodhatech.models.Quote;
import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

/**
 * Unit tests for {@link KiteQuoteSource} and the {@link KiteQuoteMapper} it delegates to.
 */
@ExtendWith(MockitoExtension.class)
class KiteQuoteSourceTest {

    @Mock
    private KiteConnect kiteConnect;

    private KiteQuoteSource kiteQuoteSource;

    private static final InstrumentRef RELIANCE = InstrumentRef.builder()
            .symbol("RELIANCE")
            .instrumentType(InstrumentType.EQ)
            .exchange("NSE")
            .token(738561L)
            .lotSize(1)
            .build();

    private static final InstrumentRef NIFTY_FUT = InstrumentRef.builder()
            .symbol("NIFTY26OCTFUT")
            .instrumentType(InstrumentType.FUT)
            .exchange("NFO")
            .token(13238786L)
            .lotSize(75)
            .build();

    @BeforeEach
    void setUp() {
        kiteQuoteSource = new KiteQuoteSource(kiteConnect, new KiteQuoteMapper());
    }

    private static Quote quote(long token, double ltp, double buyQty, double sellQty) {
        Quote quote = new Quote();
        quote.instrumentToken = token;
        quote.lastPrice = ltp;
        quote.buyQuantity = buyQty;
        quote.sellQuantity = sellQty;
        OHLC ohlc = new OHLC();
        ohlc.open = 2900.0;
        ohlc.high = 2950.5;
        ohlc.low = 2880.25;
        ohlc.close = 2890.0;
        quote.ohlc = ohlc;
        return quote;
    }

    @Test
    @DisplayName("Requests EXCHANGE:SYMBOL keys and keys the snapshots by instrument token")
    void mapsQuotesByToken() throws Throwable {
        when(kiteConnect.getQuote(any(String[].class))).thenReturn(Map.of(
                "NSE:RELIANCE", quote(738561L, 2925.4, 125_000, 98_000),
                "NFO:NIFTY26OCTFUT", quote(13238786L, 25100.0, 4_500, 6_000)));

        Map<Long, QuoteSnapshot> snapshots = kiteQuoteSource.fetchBatch(List.of(RELIANCE, NIFTY_FUT));

        ArgumentCaptor<String[]> keys = ArgumentCaptor.forClass(String[].class);
        verify(kiteConnect).getQuote(keys.capture());
        assertThat(keys.getValue()).containsExactlyInAnyOrder("NSE:RELIANCE", "NFO:NIFTY26OCTFUT");

        assertThat(snapshots).containsOnlyKeys(738561L, 13238786L);
        QuoteSnapshot reliance = snapshots.get(738561L);
        assertThat(reliance.getBuyQuantity()).isEqualTo(125_000L);
        assertThat(reliance.getSellQuantity()).isEqualTo(98_000L);
        assertThat(reliance.getLastPrice()).isEqualByComparingTo(new BigDecimal("2925.4"));
        assertThat(reliance.getHigh()).isEqualByComparingTo(new BigDecimal("2950.5"));
        assertThat(reliance.getClose()).isEqualByComparingTo(new BigDecimal("2890.0"));
    }

    @Test
    @DisplayName("Instruments missing from the response are absent from the result")
    void missingInstrumentsAbsent() throws Throwable {
        when(kiteConnect.getQuote(any(String[].class)))
                .thenReturn(Map.of("NSE:RELIANCE", quote(738561L, 2925.4, 100, 100)));

        Map<Long, QuoteSnapshot> snapshots = kiteQuoteSource.fetchBatch(List.of(RELIANCE, NIFTY_FUT));

        assertThat(snapshots).containsOnlyKeys(738561L);
    }

    @Test
    @DisplayName("Missing OHLC maps to zero prices")
    void missingOhlc() throws Throwable {
        Quote bare = quote(738561L, 2925.4, 100, 100);
        bare.ohlc = null;
        when(kiteConnect.getQuote(any(String[].class))).thenReturn(Map.of("NSE:RELIANCE", bare));

        QuoteSnapshot snapshot = kiteQuoteSource.fetchBatch(List.of(RELIANCE)).get(738561L);

        assertThat(snapshot.getOpen()).isEqualByComparingTo(BigDecimal.ZERO);
        assertThat(snapshot.getTimestamp()).isNull();
    }

    @Test
    @DisplayName("An empty batch makes no call")
    void emptyBatch() throws Throwable {
        assertThat(kiteQuoteSource.fetchBatch(List.of())).isEmpty();
        verify(kiteConnect, never()).getQuote(any(String[].class));
    }

    @Test
    @DisplayName("TokenException becomes AuthException")
    void tokenExceptionIsAuth() throws Throwable {
        when(kiteConnect.getQuote(any(String[].class))).thenThrow(new TokenException("Token is invalid", 403));

        assertThatThrownBy(() -> kiteQuoteSource.fetchBatch(List.of(RELIANCE)))
                .isInstanceOf(AuthException.class)
                .hasMessageContaining("Token is invalid");
    }

    @Test
    @DisplayName("Other Kite errors become BrokerException")
    void kiteExceptionIsBroker() throws Throwable {
        when(kiteConnect.getQuote(any(String[].class))).thenThrow(new KiteException("Too many requests"));

        assertThatThrownBy(() -> kiteQuoteSource.fetchBatch(List.of(RELIANCE)))
                .isInstanceOf(BrokerException.class)
                .hasMessageContaining("Too many requests");
    }

    @Test
    @DisplayName("Network errors become BrokerException")
    void ioExceptionIsBroker() throws Throwable {
        when(kiteConnect.getQuote(any(String[].class))).thenThrow(new IOException("connection reset"));

        assertThatThrownBy(() -> kiteQuoteSource.fetchBatch(List.of(RELIANCE)))
                .isInstanceOf(BrokerException.class)
                .hasCauseInstanceOf(IOException.class);
    }
}
