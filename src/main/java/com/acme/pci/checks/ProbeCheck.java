package com.acme.pci.checks;

import com.acme.pci.AssessmentContext;
import com.acme.pci.engine.AssessmentRun;
import com.acme.pci.model.Enums.CheckKind;
import com.acme.pci.model.Enums.Verdict;
import com.acme.pci.model.ProbeResult;
import com.acme.pci.probe.ApiCall;
import com.acme.pci.util.HtmlUtil;

import java.util.function.Function;

public final class ProbeCheck<T> implements Check {
    private final String id;
    private final String title;
    private final ApiCall call;
    private final EvidenceExtractor<T> extractor;
    private final Function<T, Verdict> evaluator;
    private final Function<T, String> describe;
    private final String recommendation;

    public ProbeCheck(String id, String title, ApiCall call, EvidenceExtractor<T> extractor,
                      Function<T, Verdict> evaluator, Function<T, String> describe, String recommendation) {
        this.id = id;
        this.title = title;
        this.call = call;
        this.extractor = extractor;
        this.evaluator = evaluator;
        this.describe = describe;
        this.recommendation = recommendation;
    }

    @Override public String id() { return id; }

    @Override
    public void run(AssessmentContext ctx, AssessmentRun out) {
        ProbeResult r = ctx.probe.run(call);
        Verdict verdict = Verdict.INCOMPLETE;
        String details;
        if (r.isDenied()) {
            details = "<p>Access denied calling " + call.label() + ".</p>" + HtmlUtil.pre(r.error());
        } else if (!r.ok()) {
            details = "<p>The " + call.label() + " call failed; this control could not be evaluated automatically.</p>"
                    + HtmlUtil.pre(r.error());
        } else {
            Evidence<T> ev = extractor.extract(r.payload());
            if (ev.isComplete()) {
                verdict = evaluator.apply(ev.fact());
                details = describe.apply(ev.fact());
            } else {
                details = "<p>Evidence incomplete: " + HtmlUtil.escape(ev.reason()) + "</p>";
            }
        }
        String rec = r.isDenied()
                ? "Grant read access to " + call.label() + " and re-run the assessment."
                : recommendation;
        out.recordClassified(title, r, CheckKind.AUTOMATED, verdict, details, rec);
    }
}
