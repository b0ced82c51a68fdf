package com.github.dimitryivaniuta.scoped.gateway.model.converter;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.scoped.gateway.model.ScopeList;
import io.r2dbc.postgresql.codec.Json;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.ReadingConverter;

@RequiredArgsConstructor
@ReadingConverter
public class JsonbToScopeListConverter implements Converter<Json, ScopeList> {

    private static final TypeReference<List<String>> TYPE = new TypeReference<>() {};

    private final ObjectMapper om;

    @Override
    public ScopeList convert(Json source) {
        try {
            return new ScopeList(om.readValue(source.asString(), TYPE));
        } catch (Exception e) {
            throw new IllegalArgumentException("Deserialize scopes", e);
        }
    }
}
