package com.ospicorp.anomalydetection.config;

import com.ospicorp.anomalydetection.trainingdata.CsvHttpMessageConverter;
import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.converter.HttpMessageConverter;
import org.springframework.lang.NonNull;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
public class WebConfig implements WebMvcConfigurer {

  // Appended last: only picked when the handler asks for text/csv explicitly.
  @Override
  public void extendMessageConverters(@NonNull List<HttpMessageConverter<?>> converters) {
    converters.add(new CsvHttpMessageConverter());
  }
}
