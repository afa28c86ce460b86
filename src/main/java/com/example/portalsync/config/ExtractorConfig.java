package com.example.portalsync.config;

import com.example.portalsync.adapter.portal.Base64CredentialEncoder;
import com.example.portalsync.adapter.portal.CredentialEncoder;
import com.example.portalsync.adapter.portal.LoginPageDetector;
import com.example.portalsync.adapter.portal.extract.JsoupScheduleExtractor;
import com.example.portalsync.adapter.portal.extract.RegexScheduleExtractor;
import com.example.portalsync.adapter.portal.extract.ScheduleExtractor;
import com.example.portalsync.adapter.portal.extract.SlotTable;
import com.example.portalsync.properties.ApplicationProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

/**
 * Pluggable pieces of the upstream integration: the credential encoding and the timetable engine.
 */
@Slf4j
@Configuration(proxyBeanMethods = false)
public class ExtractorConfig {

  static final String JSOUP_CLASS = "org.jsoup.Jsoup";

  @Bean
  @ConditionalOnMissingBean
  public CredentialEncoder credentialEncoder() {
    return new Base64CredentialEncoder();
  }

  @Bean
  public ScheduleExtractor scheduleExtractor(ApplicationProperties properties, LoginPageDetector loginPageDetector) {
    ScheduleExtractor extractor = createScheduleExtractor(
        properties.extractor().scheduleEngine(),
        ClassUtils.isPresent(JSOUP_CLASS, ExtractorConfig.class.getClassLoader()),
        loginPageDetector);
    log.info("Timetable extraction engine: {}", extractor.engine());
    return extractor;
  }

  static ScheduleExtractor createScheduleExtractor(String engine, boolean markupAvailable,
                                                   LoginPageDetector loginPageDetector) {
    boolean useMarkup = switch (engine == null ? "auto" : engine) {
      case "markup" -> {
        if (!markupAvailable) {
          throw new IllegalStateException("Markup engine requested but jsoup is not on the classpath");
        }
        yield true;
      }
      case "regex" -> false;
      default -> markupAvailable;
    };
    return useMarkup
        ? new JsoupScheduleExtractor(loginPageDetector, SlotTable.standard())
        : new RegexScheduleExtractor(loginPageDetector, SlotTable.standard());
  }
}
