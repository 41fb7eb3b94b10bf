package com.ryuqq.provisioner.cli;

import com.ryuqq.provisioner.application.orchestrator.ApplyReport;
import com.ryuqq.provisioner.application.teardown.TeardownReport;
import com.ryuqq.provisioner.core.model.DeploymentRecord;
import com.ryuqq.provisioner.core.model.ResourceHandle;
import com.ryuqq.provisioner.core.outcome.Fail;
import com.ryuqq.provisioner.core.outcome.Ok;
import com.ryuqq.provisioner.core.outcome.Outcome;

import java.io.PrintWriter;
import java.util.Map;

/**
 * Operator-facing summary of a run.
 *
 * @author Provisioner Team
 * @since 1.0.0
 */
final class ReportPrinter {

    private final PrintWriter out;

    ReportPrinter(PrintWriter out) {
        this.out = out;
    }

    void apply(ApplyReport report) {
        DeploymentRecord record = report.getRecord();
        out.println("Run " + record.runSuffix());
        for (Outcome outcome : report.getOutcomes()) {
            step(outcome, record);
        }
        if (report.isSuccess()) {
            out.println("Apply complete: " + report.getOutcomes().size() + " resources");
            if (!record.outputs().isEmpty()) {
                out.println("Outputs:");
                for (Map.Entry<String, String> output : record.outputs().entrySet()) {
                    out.println("  " + output.getKey() + " = " + output.getValue());
                }
            }
        } else {
            Fail failure = report.failure().orElseThrow();
            out.println("Apply stopped at " + failure.key() + ". Completed steps are recorded; run apply again to resume.");
        }
        out.flush();
    }

    void destroy(TeardownReport report) {
        if (report.getOutcomes().isEmpty() && report.isSuccess()) {
            out.println("Nothing to destroy");
            out.flush();
            return;
        }
        for (Outcome outcome : report.getOutcomes()) {
            step(outcome, null);
        }
        if (report.isSuccess()) {
            out.println("Destroy complete: " + report.getOutcomes().size() + " resources deleted");
        } else {
            out.println("Destroy incomplete: " + report.failures().size()
                + " failed. The state file keeps the remaining resources; run destroy again to retry.");
        }
        out.flush();
    }

    private void step(Outcome outcome, DeploymentRecord record) {
        if (outcome instanceof Ok ok) {
            String name = record == null
                ? ok.identifier()
                : record.handle(ok.key()).map(ResourceHandle::name).orElse(ok.identifier());
            out.println("  [OK]   " + ok.key() + " " + name + (ok.message() == null ? "" : " (" + ok.message() + ")"));
        } else if (outcome instanceof Fail fail) {
            out.println("  [FAIL] " + fail.key() + " " + fail.errorCode() + ": " + fail.message());
        }
    }
}
