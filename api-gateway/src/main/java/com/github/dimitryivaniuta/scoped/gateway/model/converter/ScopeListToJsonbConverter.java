package com.github.dimitryivaniuta.scoped.gateway.model.converter;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.scoped.gateway.model.ScopeList;
import io.r2dbc.postgresql.codec.Json;
import lombok.RequiredArgsConstructor;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.WritingConverter;

@RequiredArgsConstructor
@WritingConverter
public class ScopeListToJsonbConverter implements Converter<ScopeList, Json> {

    private final ObjectMapper om;

    @Override
    public Json convert(ScopeList source) {
        try {
            return Json.of(om.writeValueAsString(source.values()));
        } catch (Exception e) {
            throw new IllegalArgumentException("Serialize scopes", e);
        }
    }
}
