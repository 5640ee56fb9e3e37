package com.fueltrack.archival.config;

import com.fasterxml.jackson.databind.ser.std.ToStringSerializer;
import com.fueltrack.archival.interceptor.MdcInterceptor;
import org.bson.types.ObjectId;
import org.springframework.boot.autoconfigure.jackson.Jackson2ObjectMapperBuilderCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

    @Override
    public void addInterceptors(InterceptorRegistry registry) {
        registry.addInterceptor(new MdcInterceptor())
                .addPathPatterns("/api/**");
    }

    /**
     * Archived documents carry Mongo ObjectIds; render them as their hex string.
     */
    @Bean
    public Jackson2ObjectMapperBuilderCustomizer objectIdSerializer() {
        return builder -> builder.serializerByType(ObjectId.class, ToStringSerializer.instance);
    }
}
