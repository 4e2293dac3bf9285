package com.baykanat.signoff.domain.mapper;

import com.baykanat.signoff.api.dto.SignoffEventRequest;
import com.baykanat.signoff.domain.model.SignoffEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.Named;

/** SignoffEventRequest ↔ SignoffEvent ve Kafka record value → SignoffEventRequest dönüşümleri. */
@Mapper(componentModel = "spring")
public interface SignoffEventMapper {

    /** Record value dönüşümü için paylaşılan ObjectMapper; java.time modülü classpath'ten bulunur. */
    ObjectMapper JSON_MAPPER = JsonMapper.builder().findAndAddModules().build();

    /** SignoffEventRequest → SignoffEvent; is_deleted yoksa false. */
    @Mapping(target = "deleted", source = "request.deleted", qualifiedByName = "nullToFalse")
    @Mapping(target = "idempotencyKey", source = "idempotencyKey")
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "createdAt", ignore = true)
    SignoffEvent toSignoffEvent(SignoffEventRequest request, String idempotencyKey);

    /** Kafka value SignoffEventRequest ise döner, değilse Map vb. üzerinden çevirir. */
    default SignoffEventRequest fromRecordValue(Object value) {
        if (value instanceof SignoffEventRequest request) {
            return request;
        }
        return JSON_MAPPER.convertValue(value, SignoffEventRequest.class);
    }

    @Named("nullToFalse")
    default boolean nullToFalse(Boolean value) {
        return Boolean.TRUE.equals(value);
    }
}
