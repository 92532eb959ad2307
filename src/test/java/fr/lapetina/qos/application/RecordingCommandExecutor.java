package fr.lapetina.qos.application;

import fr.lapetina.qos.infrastructure.adapter.CommandExecutor;
import fr.lapetina.qos.infrastructure.adapter.ExecutionResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Records every command batch and answers with a scripted result.
 */
public final class RecordingCommandExecutor implements CommandExecutor {

    public record Batch(String host, List<String> commands) {
    }

    private final List<Batch> batches = new CopyOnWriteArrayList<>();
    private volatile Function<List<String>, ExecutionResult> responder = commands -> ExecutionResult.success("ok");

    public void respondWith(Function<List<String>, ExecutionResult> responder) {
        this.responder = responder;
    }

    @Override
    public ExecutionResult execute(String host, List<String> commands) {
        batches.add(new Batch(host, List.copyOf(commands)));
        return responder.apply(commands);
    }

    public List<Batch> batches() {
        return List.copyOf(batches);
    }
}
