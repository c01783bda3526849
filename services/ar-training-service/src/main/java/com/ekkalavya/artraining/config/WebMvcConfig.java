package com.ekkalavya.artraining.config;

import com.ekkalavya.artraining.domain.WireNamed;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.convert.converter.Converter;
import org.springframework.core.convert.converter.ConverterFactory;
import org.springframework.format.FormatterRegistry;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Web MVC configuration
 * Binds query and path parameters to enums by their lower-case wire names
 */
@Configuration
public class WebMvcConfig implements WebMvcConfigurer {

    @Override
    public void addFormatters(@NonNull FormatterRegistry registry) {
        registry.addConverterFactory(new StringToWireNamedConverterFactory());
    }

    static class StringToWireNamedConverterFactory implements ConverterFactory<String, WireNamed> {

        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public <T extends WireNamed> Converter<String, T> getConverter(@NonNull Class<T> targetType) {
            return source -> (T) WireNamed.fromWireName((Class) targetType, source);
        }
    }
}
