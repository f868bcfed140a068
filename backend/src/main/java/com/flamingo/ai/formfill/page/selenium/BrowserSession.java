package com.flamingo.ai.formfill.page.selenium;

import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;

/** An open browser with one loaded form page. Closing quits the browser. */
@Slf4j
public class BrowserSession implements AutoCloseable {

  private final WebDriver driver;
  private final SeleniumFormPage page;

  BrowserSession(WebDriver driver, SeleniumFormPage page) {
    this.driver = driver;
    this.page = page;
  }

  public SeleniumFormPage page() {
    return page;
  }

  @Override
  public void close() {
    try {
      driver.quit();
      log.debug("Browser session for page {} closed", page.pageId());
    } catch (WebDriverException e) {
      log.warn("Failed to quit browser for page {}: {}", page.pageId(), e.getMessage());
    }
  }
}
