package com.github.dimitryivaniuta.scoped.gateway.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.scoped.gateway.model.converter.JsonbToScopeListConverter;
import com.github.dimitryivaniuta.scoped.gateway.model.converter.ScopeListToJsonbConverter;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.data.convert.CustomConversions;
import org.springframework.data.r2dbc.convert.R2dbcCustomConversions;
import org.springframework.data.r2dbc.dialect.PostgresDialect;

@Configuration
public class R2dbcConfig {

    @Bean
    public R2dbcCustomConversions r2dbcCustomConversions(final ObjectMapper objectMapper) {
        var dialect = PostgresDialect.INSTANCE;
        var storeConversions = CustomConversions.StoreConversions.of(dialect.getSimpleTypeHolder(), dialect.getConverters());

        List<Converter<?, ?>> converters = List.of(
                new JsonbToScopeListConverter(objectMapper),
                new ScopeListToJsonbConverter(objectMapper)
        );

        return new R2dbcCustomConversions(storeConversions, converters);
    }
}
