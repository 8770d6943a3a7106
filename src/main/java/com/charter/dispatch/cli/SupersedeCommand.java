package com.charter.dispatch.cli;

import com.charter.core.lifecycle.LifecycleService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

@Command(name = "supersede", mixinStandardHelpOptions = true,
        description = "Supersede a clause or ADR by a successor")
@Component
public class SupersedeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Clause (RFC-0001:C-OLD) or ADR ID")
    private String artifactId;

    @Option(names = {"--by", "-b"}, required = true, description = "Successor ID")
    private String successorId;

    private final LifecycleService lifecycle;

    public SupersedeCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        return TransitionOutput.report(lifecycle.supersede(artifactId, successorId),
                artifactId + " superseded by " + successorId);
    }
}
