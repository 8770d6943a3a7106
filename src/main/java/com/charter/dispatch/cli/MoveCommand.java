package com.charter.dispatch.cli;

import com.charter.core.lifecycle.LifecycleService;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;

import java.util.concurrent.Callable;

/**
 * CLI command: charter move &lt;id&gt; &lt;status|phase&gt;
 * <p>
 * RFCs accept either a status ({@code normative}, {@code deprecated}) or a phase
 * ({@code impl}, {@code test}, {@code stable}).
 */
@Command(name = "move", mixinStandardHelpOptions = true, description = "Transition an artifact's status or phase")
@Component
public class MoveCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Artifact ID")
    private String artifactId;

    @Parameters(index = "1", description = "Target status or phase")
    private String target;

    private final LifecycleService lifecycle;

    public MoveCommand(LifecycleService lifecycle) {
        this.lifecycle = lifecycle;
    }

    @Override
    public Integer call() {
        return TransitionOutput.report(lifecycle.transition(artifactId, target), artifactId + " -> " + target);
    }
}
