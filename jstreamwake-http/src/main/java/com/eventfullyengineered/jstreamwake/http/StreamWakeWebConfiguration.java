package com.eventfullyengineered.jstreamwake.http;

import com.eventfullyengineered.jstreamwake.StreamWake;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.http.converter.StringHttpMessageConverter;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.servlet.config.annotation.EnableWebMvc;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Spring MVC setup of the HTTP surface. The application context must provide the {@link StreamWake} bean.
 */
@Configuration
@EnableWebMvc
public class StreamWakeWebConfiguration implements WebMvcConfigurer {

    @Bean
    public SubscriptionController subscriptionController(StreamWake streamWake) {
        return new SubscriptionController(streamWake);
    }

    @Bean
    public CallbackController callbackController(StreamWake streamWake) {
        return new CallbackController(streamWake);
    }

    @Bean
    public StreamWakeExceptionHandler streamWakeExceptionHandler() {
        return new StreamWakeExceptionHandler();
    }

    @Override
    public void configureMessageConverters(List<HttpMessageConverter<?>> converters) {
        // callback bodies are read as text and parsed by the facade's serializer
        converters.add(new StringHttpMessageConverter(StandardCharsets.UTF_8));
        converters.add(new MappingJackson2HttpMessageConverter(objectMapper()));
    }

    static ObjectMapper objectMapper() {
        return new ObjectMapper()
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }
}
