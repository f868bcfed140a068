package com.flamingo.ai.formfill.page.selenium;

import com.flamingo.ai.formfill.config.FormFillConfig;
import com.flamingo.ai.formfill.exception.FormSourceException;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebDriverException;
import org.openqa.selenium.chrome.ChromeDriver;
import org.openqa.selenium.chrome.ChromeOptions;
import org.springframework.stereotype.Component;

/** Opens headless Chrome sessions on form URLs. */
@Component
@RequiredArgsConstructor
@Slf4j
public class BrowserSessionProvider {

  private final FormFillConfig config;

  /**
   * Starts a browser and loads the URL.
   *
   * @param url the form URL
   * @return the open session; the caller closes it
   * @throws FormSourceException if the browser cannot start or the page cannot be loaded
   */
  public BrowserSession open(String url) {
    WebDriver driver;
    try {
      driver = createDriver();
    } catch (WebDriverException e) {
      throw new FormSourceException("Cannot start browser: " + e.getMessage(), e);
    }
    try {
      driver.manage().timeouts().pageLoadTimeout(config.getBrowser().getPageLoadTimeout());
      driver.get(url);
      String pageId = "browser-" + UUID.randomUUID().toString().substring(0, 8);
      log.info("Opened {} as page {}", url, pageId);
      return new BrowserSession(driver, new SeleniumFormPage(driver, pageId));
    } catch (WebDriverException e) {
      driver.quit();
      throw new FormSourceException("Cannot load " + url + ": " + e.getMessage(), e);
    }
  }

  /** Creates the driver; overridable so tests can supply their own. */
  protected WebDriver createDriver() {
    FormFillConfig.Browser browser = config.getBrowser();
    ChromeOptions options = new ChromeOptions();
    if (browser.isHeadless()) {
      options.addArguments("--headless=new");
    }
    options.addArguments("--window-size=" + browser.getWindowSize());
    options.addArguments("--no-sandbox");
    options.addArguments("--disable-dev-shm-usage");
    options.addArguments("--disable-gpu");
    options.addArguments("--disable-notifications");
    return new ChromeDriver(options);
  }
}
