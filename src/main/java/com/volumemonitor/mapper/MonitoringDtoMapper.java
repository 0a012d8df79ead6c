package com.volumemonitor.mapper;

import com.volumemonitor.api.dto.response.AlertLogResponse;
import com.volumemonitor.api.dto.response.InstrumentResponse;
import com.volumemonitor.api.dto.response.TradeLogResponse;
import com.volumemonitor.api.dto.response.VolumeLogResponse;
import com.volumemonitor.api.dto.response.WatchlistEntryResponse;
import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.entity.AlertLogEntity;
import com.volumemonitor.entity.TradeLogEntity;
import com.volumemonitor.entity.VolumeLogEntity;
import com.volumemonitor.entity.WatchlistEntryEntity;
import java.util.List;
import org.mapstruct.Mapper;

/**
 * MapStruct mapper from entities and domain models to REST response DTOs.
 * Enums are rendered by name.
 */
@Mapper
public interface MonitoringDtoMapper {

    WatchlistEntryResponse toResponse(WatchlistEntryEntity entity);

    List<WatchlistEntryResponse> toWatchlistResponseList(List<WatchlistEntryEntity> entities);

    InstrumentResponse toResponse(InstrumentRef instrument);

    List<InstrumentResponse> toInstrumentResponseList(List<InstrumentRef> instruments);

    VolumeLogResponse toResponse(VolumeLogEntity entity);

    List<VolumeLogResponse> toVolumeLogResponseList(List<VolumeLogEntity> entities);

    AlertLogResponse toResponse(AlertLogEntity entity);

    List<AlertLogResponse> toAlertLogResponseList(List<AlertLogEntity> entities);

    TradeLogResponse toResponse(TradeLogEntity entity);

    List<TradeLogResponse> toTradeLogResponseList(List<TradeLogEntity> entities);
}
