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

public interface Check {
    String id();
    void run(AssessmentContext ctx, AssessmentRun out) throws Exception;
}
