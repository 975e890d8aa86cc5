package com.ospicorp.anomalyapi.config;

import com.ospicorp.anomalyapi.web.CsvHttpMessageConverter;
import java.util.List;
import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.filter.ShallowEtagHeaderFilter;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  // last, so JSON still wins for */*
  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(new CsvHttpMessageConverter());
  }

  // model versions and training data never change once written
  @Bean
  FilterRegistrationBean<ShallowEtagHeaderFilter> modelEtagFilter() {
    FilterRegistrationBean<ShallowEtagHeaderFilter> registration =
        new FilterRegistrationBean<>(new ShallowEtagHeaderFilter());
    registration.addUrlPatterns("/v1/series/*");
    return registration;
  }
}
