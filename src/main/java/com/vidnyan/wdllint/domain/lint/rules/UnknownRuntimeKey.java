package com.vidnyan.wdllint.domain.lint.rules;

import com.vidnyan.wdllint.domain.lint.LintContext;
import com.vidnyan.wdllint.domain.lint.Linter;
import com.vidnyan.wdllint.domain.model.tree.Task;

import java.util.Set;

/**
 * Runtime section entry not recognized by any common execution backend (Cromwell local,
 * Google and AWS backends, dxWDL, the WDL 1.1 runtime keys).
 */
public class UnknownRuntimeKey extends Linter {

    static final Set<String> KNOWN_KEYS = Set.of(
            "bootDiskSizeGb",
            "container",
            "continueOnReturnCode",
            "cpu",
            "cpuPlatform",
            "disks",
            "docker",
            "dx_instance_type",
            "gpu",
            "gpuCount",
            "gpuType",
            "maxRetries",
            "memory",
            "noAddress",
            "preemptible",
            "queueArn",
            "returnCodes",
            "time",
            "zones"
    );

    public UnknownRuntimeKey(LintContext context) {
        super(context);
    }

    @Override
    public void task(Task obj) {
        obj.getRuntime().forEach((key, value) -> {
            if (!KNOWN_KEYS.contains(key)) {
                add(obj, "unknown entry in task runtime section: " + key, value.getPos());
            }
        });
    }
}
