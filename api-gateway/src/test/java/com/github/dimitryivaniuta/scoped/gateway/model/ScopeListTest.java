package com.github.dimitryivaniuta.scoped.gateway.model;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.scoped.gateway.model.converter.JsonbToScopeListConverter;
import com.github.dimitryivaniuta.scoped.gateway.model.converter.ScopeListToJsonbConverter;
import io.r2dbc.postgresql.codec.Json;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ScopeListTest {

    private final ObjectMapper om = new ObjectMapper();

    @Test
    void dropsNullsAndDuplicatesKeepingOrder() {
        ScopeList scopes = ScopeList.of(Arrays.asList("posts.write", null, "posts.read", "posts.write"));

        assertThat(scopes.values()).containsExactly("posts.write", "posts.read");
    }

    @Test
    void onlyNullsIsEmpty() {
        assertThat(ScopeList.of(Arrays.asList((String) null)).isEmpty()).isTrue();
        assertThat(ScopeList.of(null)).isEqualTo(ScopeList.empty());
    }

    @Test
    void storedNullElementsAreIgnoredOnRead() {
        ScopeList read = new JsonbToScopeListConverter(om).convert(Json.of("[null, \"posts.read\"]"));

        assertThat(read.values()).containsExactly("posts.read");
        assertThat(read.asSet()).containsExactly("posts.read");
    }

    @Test
    void writesJsonArray() {
        Json json = new ScopeListToJsonbConverter(om).convert(new ScopeList(List.of("posts.read", "posts.write")));

        assertThat(json.asString()).isEqualTo("[\"posts.read\",\"posts.write\"]");
    }
}
