package com.charter.dispatch.cli;

import com.charter.core.lifecycle.LifecycleService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "delete", mixinStandardHelpOptions = true,
        description = "Delete an unreferenced clause of a draft RFC or a queued work item")
@Component
public class DeleteCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Clause (RFC-0001:C-NAME) or work item ID")
    private String artifactId;

    private final LifecycleService lifecycle;

    public DeleteCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        return TransitionOutput.report(lifecycle.delete(artifactId), "Deleted " + artifactId);
    }
}
