/*
 * Copyright © 2026 Aniruddh Panvelkar
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 *
 * Original Author: Aniruddh Panvelkar
 * Project: PCI DSS Assessment Tool
 */

package com.acme.pci.checks;

import com.acme.pci.AssessmentContext;
import com.acme.pci.engine.AssessmentRun;
import com.acme.pci.model.Enums.CheckKind;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.model.ProbeResult;
import com.acme.pci.model.SectionClosedException;
import com.acme.pci.util.HtmlUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class CheckExecutor {
    private static final Logger log = LoggerFactory.getLogger(CheckExecutor.class);

    private CheckExecutor() {}

    public static void execute(Check check, AssessmentContext ctx, AssessmentRun out) {
        try {
            check.run(ctx, out);
        } catch (SectionClosedException e) {
            throw e;
        } catch (Exception e) {
            log.warn("Check '{}' failed: {}", check.id(), e.toString());
            out.recordClassified("Check '" + check.id() + "' could not be completed", ProbeResult.error(e.toString()),
                    CheckKind.AUTOMATED, Verdict.INCOMPLETE,
                    "<p>The automated check did not complete, so no pass/fail result was recorded.</p>" + HtmlUtil.pre(e.toString()),
                    "Verify this control manually and re-run the assessment once the error above is resolved.");
        }
    }
}
