package com.mk.fx.qa.httpload.cfg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

import com.mk.fx.qa.httpload.HttpLoadRunner;
import com.mk.fx.qa.httpload.corpus.RequestCorpusLoader;
import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.context.ConfigurationPropertiesAutoConfiguration;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.ApplicationContext;

@SpringBootTest(
    properties = {
      "http-load.run-on-startup=false",
      "http-load.url=http://example.test:9000/api",
      "http-load.concurrency=7",
      "http-load.requests=350",
      "http-load.keep-alive-ratio=0.25",
      "http-load.report-interval=250ms",
      "http-load.max-idle-connections=3"
    })
class HttpLoadCfgTest {

  @Autowired private HttpLoadCfg cfg;
  @Autowired private ApplicationContext context;

  private final ApplicationContextRunner contextRunner =
      new ApplicationContextRunner()
          .withConfiguration(
              AutoConfigurations.of(
                  ConfigurationPropertiesAutoConfiguration.class, ValidationAutoConfiguration.class))
          .withUserConfiguration(HttpLoadCfg.class);

  @Test
  void properties_areBound() {
    assertEquals("http://example.test:9000/api", cfg.getUrl());
    assertEquals(7, cfg.getConcurrency());
    assertEquals(350, cfg.getRequests());
    assertEquals(0.25, cfg.getKeepAliveRatio());
    assertEquals(Duration.ofMillis(250), cfg.getReportInterval());
    assertEquals("POST", cfg.getMethod());
    assertEquals(Duration.ofSeconds(10), cfg.getRequestTimeout());
    assertEquals("http-load-tester", cfg.getUserAgent());
  }

  @Test
  void transportSettings_neverSmallerThanWorkerCount() {
    assertEquals(7, cfg.transportSettings().maxConnections());
  }

  @Test
  void runner_isDisabled_butCollaboratorsExist() {
    assertThat(context.getBeansOfType(HttpLoadRunner.class)).isEmpty();
    assertThat(context.getBean(RequestCorpusLoader.class)).isNotNull();
  }

  @Test
  void outOfRangeRatio_failsStartup() {
    contextRunner
        .withPropertyValues("http-load.keep-alive-ratio=1.5")
        .run(ctx -> assertThat(ctx).hasFailed());
  }

  @Test
  void zeroConcurrency_failsStartup() {
    contextRunner
        .withPropertyValues("http-load.concurrency=0")
        .run(ctx -> assertThat(ctx).hasFailed());
  }

  @Test
  void defaults_areValid() {
    contextRunner.run(
        ctx -> {
          assertThat(ctx).hasNotFailed();
          var defaults = ctx.getBean(HttpLoadCfg.class);
          assertEquals(10, defaults.getConcurrency());
          assertEquals(100, defaults.getRequests());
          assertEquals(0.7, defaults.getKeepAliveRatio());
        });
  }
}
