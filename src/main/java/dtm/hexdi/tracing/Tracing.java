package dtm.hexdi.tracing;

import dtm.hexdi.core.ContainerOptions;
import dtm.hexdi.core.Containers;
import dtm.hexdi.core.ResolutionHooks;
import dtm.hexdi.storage.graph.Graph;
import lombok.NonNull;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public final class Tracing {

    private Tracing() {
    }

    public static TracingContainer createTracingContainer(Graph graph) {
        return createTracingContainer(graph, TracingOptions.DEFAULT);
    }

    public static TracingContainer createTracingContainer(@NonNull Graph graph, @NonNull TracingOptions options) {
        ContainerOptions base = options.getContainerOptions();
        TracingRecorder recorder = new TracingRecorder(options.createCollector(), base.getTimeSource());

        ContainerOptions traced = base.toBuilder()
                .hooks(ResolutionHooks.chain(recorder, base.getHooks()))
                .build();

        log.info("Tracing habilitado com coletor {}", recorder.getCollector().getClass().getSimpleName());
        return new TracingContainer(Containers.create(graph, traced), recorder);
    }
}
