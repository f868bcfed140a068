package com.flamingo.ai.formfill.service.fill;

import com.flamingo.ai.formfill.domain.form.FieldDescriptor;
import com.flamingo.ai.formfill.domain.profile.Profile;
import com.flamingo.ai.formfill.domain.profile.ProfileValidator;
import com.flamingo.ai.formfill.page.FormPage;
import com.flamingo.ai.formfill.service.execute.CancellationToken;
import com.flamingo.ai.formfill.service.execute.FillExecutor;
import com.flamingo.ai.formfill.service.execute.RunReport;
import com.flamingo.ai.formfill.service.extract.FieldDescriptorExtractor;
import com.flamingo.ai.formfill.service.match.AliasTable;
import com.flamingo.ai.formfill.service.match.FieldMatcher;
import com.flamingo.ai.formfill.service.match.FillPlan;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/** Runs extraction, matching and execution in sequence for one page. */
@Service
@Slf4j
public class FormFillServiceImpl implements FormFillService {

  private final ProfileValidator profileValidator;
  private final FieldDescriptorExtractor extractor;
  private final FieldMatcher matcher;
  private final FillExecutor executor;
  private final AliasTable aliasTable;
  private final Executor formFillExecutor;

  public FormFillServiceImpl(
      ProfileValidator profileValidator,
      FieldDescriptorExtractor extractor,
      FieldMatcher matcher,
      FillExecutor executor,
      AliasTable aliasTable,
      @Qualifier("formFillExecutor") Executor formFillExecutor) {
    this.profileValidator = profileValidator;
    this.extractor = extractor;
    this.matcher = matcher;
    this.executor = executor;
    this.aliasTable = aliasTable;
    this.formFillExecutor = formFillExecutor;
  }

  @Override
  @Timed(value = "formfill.plan", description = "Time to extract and match a form")
  public FillPlan plan(Profile profile, FormPage page, FillOptions options) {
    profileValidator.validate(profile);
    List<FieldDescriptor> fields = extractor.extract(page);
    return matcher.match(profile, fields, effectiveAliases(options));
  }

  @Override
  @Timed(value = "formfill.run", description = "Time to plan and fill a form")
  public RunReport fill(Profile profile, FormPage page, FillOptions options) {
    return fill(profile, page, options, new CancellationToken());
  }

  @Override
  public RunReport fill(
      Profile profile, FormPage page, FillOptions options, CancellationToken cancellation) {
    log.info("Starting fill run on page {}", page.pageId());
    FillPlan plan = plan(profile, page, options);
    return executor.execute(page, plan, cancellation);
  }

  @Override
  public FillRun fillAsync(Profile profile, FormPage page, FillOptions options) {
    CancellationToken cancellation = new CancellationToken();
    CompletableFuture<RunReport> report =
        CompletableFuture.supplyAsync(
            () -> fill(profile, page, options, cancellation), formFillExecutor);
    return new FillRun(report, cancellation);
  }

  @Override
  public AliasTable aliasTable() {
    return aliasTable;
  }

  private AliasTable effectiveAliases(FillOptions options) {
    if (options == null || options.extraAliases().isEmpty()) {
      return aliasTable;
    }
    return aliasTable.withAdditional(options.extraAliases());
  }
}
