package com.flamingo.ai.formfill.api.rest;

import com.flamingo.ai.formfill.api.dto.request.BrowserFillRequest;
import com.flamingo.ai.formfill.api.dto.request.GoogleFormFillRequest;
import com.flamingo.ai.formfill.api.dto.request.HtmlFillRequest;
import com.flamingo.ai.formfill.api.dto.response.FillPlanResponse;
import com.flamingo.ai.formfill.api.dto.response.GoogleFormFillResponse;
import com.flamingo.ai.formfill.api.dto.response.HtmlFillResponse;
import com.flamingo.ai.formfill.api.dto.response.RunReportResponse;
import com.flamingo.ai.formfill.domain.profile.ProfileValidator;
import com.flamingo.ai.formfill.page.googleform.GoogleFormPage;
import com.flamingo.ai.formfill.page.googleform.GoogleFormService;
import com.flamingo.ai.formfill.page.html.JsoupFormPage;
import com.flamingo.ai.formfill.page.selenium.BrowserSession;
import com.flamingo.ai.formfill.page.selenium.BrowserSessionProvider;
import com.flamingo.ai.formfill.service.execute.RunReport;
import com.flamingo.ai.formfill.service.fill.FillOptions;
import com.flamingo.ai.formfill.service.fill.FillRun;
import com.flamingo.ai.formfill.service.fill.FormFillService;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for planning and running form fills. */
@RestController
@RequestMapping("/api/fill-runs")
@RequiredArgsConstructor
@Slf4j
public class FillRunController {

  private final FormFillService formFillService;
  private final ProfileValidator profileValidator;
  private final GoogleFormService googleFormService;
  private final BrowserSessionProvider browserSessionProvider;

  /**
   * Plans or fills a static HTML form.
   *
   * @param request profile, markup and options
   * @return the plan on a dry run, otherwise the run report and the filled markup
   */
  @PostMapping("/html")
  public ResponseEntity<HtmlFillResponse> fillHtml(@Valid @RequestBody HtmlFillRequest request) {
    JsoupFormPage page = JsoupFormPage.parse(newPageId("html"), request.getHtml());
    FillOptions options = new FillOptions(request.getExtraAliases());

    if (request.isDryRun()) {
      log.info("Planning static form {}", page.pageId());
      FillPlanResponse plan =
          FillPlanResponse.from(formFillService.plan(request.getProfile(), page, options));
      return ResponseEntity.ok(HtmlFillResponse.builder().plan(plan).build());
    }

    RunReport report = formFillService.fill(request.getProfile(), page, options);
    return ResponseEntity.ok(
        HtmlFillResponse.builder()
            .report(RunReportResponse.from(report))
            .html(page.html())
            .build());
  }

  /**
   * Plans or fills a Google Form and optionally submits it.
   *
   * @param request profile, form URL and options
   * @return the plan on a dry run, otherwise the run report and whether the response was sent
   */
  @PostMapping("/google-form")
  public ResponseEntity<GoogleFormFillResponse> fillGoogleForm(
      @Valid @RequestBody GoogleFormFillRequest request) {
    profileValidator.validate(request.getProfile());
    GoogleFormPage page = googleFormService.load(request.getFormUrl());
    FillOptions options = new FillOptions(request.getExtraAliases());

    if (request.isDryRun()) {
      FillPlanResponse plan =
          FillPlanResponse.from(formFillService.plan(request.getProfile(), page, options));
      return ResponseEntity.ok(
          GoogleFormFillResponse.builder().formUrl(request.getFormUrl()).plan(plan).build());
    }

    RunReport report = formFillService.fill(request.getProfile(), page, options);
    boolean submitted = request.isSubmit() && googleFormService.submit(page);
    return ResponseEntity.ok(
        GoogleFormFillResponse.builder()
            .formUrl(request.getFormUrl())
            .report(RunReportResponse.from(report))
            .submitted(submitted)
            .build());
  }

  /**
   * Fills a form in a live browser. The browser is closed when the run completes.
   *
   * @param request profile, page URL and options
   * @return the run report once the run completes
   */
  @PostMapping("/browser")
  public CompletableFuture<ResponseEntity<RunReportResponse>> fillInBrowser(
      @Valid @RequestBody BrowserFillRequest request) {
    profileValidator.validate(request.getProfile());
    BrowserSession session = browserSessionProvider.open(request.getUrl());
    FillRun run;
    try {
      run =
          formFillService.fillAsync(
              request.getProfile(), session.page(), new FillOptions(request.getExtraAliases()));
    } catch (RuntimeException e) {
      session.close();
      throw e;
    }
    return run.report()
        .whenComplete((report, error) -> session.close())
        .thenApply(report -> ResponseEntity.ok(RunReportResponse.from(report)));
  }

  /**
   * Returns the configured alias table.
   *
   * @return aliases per attribute key
   */
  @GetMapping("/aliases")
  public ResponseEntity<Map<String, List<String>>> aliases() {
    return ResponseEntity.ok(formFillService.aliasTable().asMap());
  }

  private static String newPageId(String prefix) {
    return prefix + "-" + UUID.randomUUID().toString().substring(0, 8);
  }
}
