package com.thetaguard.mapper;

import com.thetaguard.api.dto.request.AccountSnapshotDto;
import com.thetaguard.api.dto.request.AdmissionRequestDto;
import com.thetaguard.api.dto.request.FillRequest;
import com.thetaguard.api.dto.response.PositionResponse;
import com.thetaguard.api.dto.response.SizingResponse;
import com.thetaguard.domain.model.AccountSnapshot;
import com.thetaguard.domain.model.AdmissionRequest;
import com.thetaguard.domain.model.FillDetails;
import com.thetaguard.domain.model.Position;
import com.thetaguard.sizing.SizingResult;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/**
 * MapStruct mapper between the decision API's DTOs and the domain types. Market snapshots are not
 * mapped here: their values pass through the data-quality gate first.
 */
@Mapper
public interface DecisionDtoMapper {

    AdmissionRequest toDomain(AdmissionRequestDto dto);

    @Mapping(target = "asOf", ignore = true)
    AccountSnapshot toDomain(AccountSnapshotDto dto);

    FillDetails toDomain(FillRequest request);

    PositionResponse toResponse(Position position);

    @Mapping(target = "rawKelly", source = "rawKelly", qualifiedByName = "finiteOrNull")
    @Mapping(target = "recommendedContracts", ignore = true)
    SizingResponse toResponse(SizingResult result);

    /** NaN does not serialize to valid JSON. */
    @Named("finiteOrNull")
    default Double finiteOrNull(double value) {
        return Double.isFinite(value) ? value : null;
    }
}
