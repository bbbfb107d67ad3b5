package com.signaldesk.pipeline.jobs;

import com.signaldesk.pipeline.scheduler.JobExecutionException;
import com.signaldesk.pipeline.scheduler.JobOutcome;

import java.util.ArrayList;
import java.util.List;

final class UnitTally {
    private static final int MAX_REPORTED_FAILURES = 5;

    private final String jobName;
    private int units;
    private int succeededUnits;
    private int recordsStored;
    private final List<String> failures = new ArrayList<>();

    UnitTally(String jobName) {
        this.jobName = jobName;
    }

    synchronized void succeeded(int stored) {
        units++;
        succeededUnits++;
        recordsStored += stored;
    }

    synchronized void failed(String unit, String reason) {
        units++;
        failures.add(unit + ": " + reason);
    }

    synchronized JobOutcome finish() {
        if (units == 0) {
            return JobOutcome.success("no units to fetch");
        }
        if (succeededUnits == 0) {
            throw new JobExecutionException(
                jobName + ": all " + units + " units failed " + reported()
            );
        }
        String detail = "units=" + units + " succeeded=" + succeededUnits + " stored=" + recordsStored;
        if (!failures.isEmpty()) {
            detail += " failed=" + failures.size() + " " + reported();
        }
        return JobOutcome.success(detail);
    }

    private String reported() {
        if (failures.size() <= MAX_REPORTED_FAILURES) {
            return failures.toString();
        }
        return failures.subList(0, MAX_REPORTED_FAILURES) + " (+" + (failures.size() - MAX_REPORTED_FAILURES) + " more)";
    }
}
