package com.volumemonitor.mapper;

import com.volumemonitor.domain.enums.InstrumentType;
import com.volumemonitor.domain.model.InstrumentRef;
import com.volumemonitor.entity.InstrumentEntity;
import java.util.List;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between {@link InstrumentRef} and InstrumentEntity.
 *
 * <p>The entity stores the instrument type as a String; rows with a type outside
 * EQ/FUT/CE/PE map to a null type and are skipped by InstrumentService.
 */
@Mapper
public interface InstrumentMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "downloadDate", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    @Mapping(source = "symbol", target = "tradingSymbol")
    @Mapping(source = "instrumentType", target = "instrumentType", qualifiedByName = "instrumentTypeToString")
    InstrumentEntity toEntity(InstrumentRef instrument);

    @Mapping(source = "tradingSymbol", target = "symbol")
    @Mapping(source = "instrumentType", target = "instrumentType", qualifiedByName = "stringToInstrumentType")
    InstrumentRef toDomain(InstrumentEntity entity);

    List<InstrumentRef> toDomainList(List<InstrumentEntity> entities);

    @Named("instrumentTypeToString")
    default String instrumentTypeToString(InstrumentType type) {
        return type != null ? type.name() : null;
    }

    @Named("stringToInstrumentType")
    default InstrumentType stringToInstrumentType(String type) {
        if (type == null || type.isBlank()) {
            return null;
        }
        try {
            return InstrumentType.valueOf(type);
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
