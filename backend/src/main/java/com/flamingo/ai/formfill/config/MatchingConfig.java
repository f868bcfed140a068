package com.flamingo.ai.formfill.config;

import com.flamingo.ai.formfill.service.match.AliasTable;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Builds the effective alias table from the built-in aliases and configured extensions. */
@Configuration
@Slf4j
public class MatchingConfig {

  @Bean
  public AliasTable aliasTable(FormFillConfig config) {
    FormFillConfig.Aliases aliases = config.getAliases();
    log.info(
        "Alias table configured: extraAliasKeys={}, extraDomainTokenKeys={}",
        aliases.getExtra().keySet(),
        aliases.getDomainTokens().keySet());
    return AliasTable.defaults()
        .withAdditional(aliases.getExtra())
        .withDomainTokens(aliases.getDomainTokens());
  }
}
