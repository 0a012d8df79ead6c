package com.volumemonitor.api.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/** Body of watchlist add/remove requests. */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class SymbolRequest {

    /** Kite trading symbol, e.g. "RELIANCE" or "NIFTY26OCTFUT". Case-insensitive. */
    @NotBlank
    @Size(max = 50)
    private String symbol;
}
