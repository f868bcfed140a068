package com.flamingo.ai.formfill;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.formfill.page.googleform.GoogleFormService;
import com.flamingo.ai.formfill.service.fill.FormFillService;
import com.flamingo.ai.formfill.service.match.AliasTable;
import com.flamingo.ai.formfill.service.match.AttributeKey;
import com.flamingo.ai.formfill.service.match.MatchStrategy;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

/**
 * Verifies the application context loads with the default configuration. No browser is started
 * and no form is fetched while the context comes up.
 */
@SpringBootTest
class ApplicationContextTest {

  @Autowired private ApplicationContext applicationContext;

  @Autowired private List<MatchStrategy> strategies;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("Core service beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(FormFillService.class)).isNotNull();
    assertThat(applicationContext.getBean(GoogleFormService.class)).isNotNull();
    assertThat(strategies).hasSize(3);
  }

  @Test
  @DisplayName("Configured alias table should carry the built-in aliases")
  void aliasTableShouldCarryDefaults() {
    AliasTable aliasTable = applicationContext.getBean(AliasTable.class);
    assertThat(aliasTable.aliasesFor(AttributeKey.EMAIL)).contains("email address");
  }
}
