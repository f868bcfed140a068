package com.flamingo.ai.formfill.service.fill;

import com.flamingo.ai.formfill.domain.profile.Profile;
import com.flamingo.ai.formfill.page.FormPage;
import com.flamingo.ai.formfill.service.execute.CancellationToken;
import com.flamingo.ai.formfill.service.execute.RunReport;
import com.flamingo.ai.formfill.service.match.AliasTable;
import com.flamingo.ai.formfill.service.match.FillPlan;

/** Service for planning and filling web forms from a profile. */
public interface FormFillService {

  /**
   * Validates the profile, extracts the page's fields and matches them. Does not touch field
   * values.
   *
   * @param profile the candidate profile
   * @param page the loaded form page
   * @param options per-run options
   * @return the fill plan
   * @throws com.flamingo.ai.formfill.exception.InvalidProfileException if the profile is invalid
   * @throws com.flamingo.ai.formfill.exception.StaleDocumentException if the page is gone
   */
  FillPlan plan(Profile profile, FormPage page, FillOptions options);

  /**
   * Plans and executes a fill run on the calling thread.
   *
   * @param profile the candidate profile
   * @param page the loaded form page
   * @param options per-run options
   * @return the run report
   */
  RunReport fill(Profile profile, FormPage page, FillOptions options);

  /**
   * Plans and executes a fill run, checking the token between fields.
   *
   * @param profile the candidate profile
   * @param page the loaded form page
   * @param options per-run options
   * @param cancellation cancellation flag
   * @return the run report
   */
  RunReport fill(
      Profile profile, FormPage page, FillOptions options, CancellationToken cancellation);

  /**
   * Starts a fill run on the form fill executor.
   *
   * @param profile the candidate profile
   * @param page the loaded form page, owned by the run until it completes
   * @param options per-run options
   * @return a handle to the running fill
   */
  FillRun fillAsync(Profile profile, FormPage page, FillOptions options);

  /**
   * Returns the configured alias table.
   *
   * @return the alias table without per-run additions
   */
  AliasTable aliasTable();
}
