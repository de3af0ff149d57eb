package ai.docscanner.review.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single-writer, many-reader progress record where the last value wins. Once a terminal stage is written,
 * later writes are ignored.
 */
public final class ProgressChannel {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProgressChannel.class);

    private final AtomicReference<AnalysisProgress> latest =
            new AtomicReference<>(AnalysisProgress.of(AnalysisStage.QUEUED, "Waiting to start"));
    private final List<Consumer<AnalysisProgress>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean writerIssued = new AtomicBoolean();
    private final ProgressView view = new ChannelView();

    /**
     * Hands out the only writer of this channel.
     *
     * @throws IllegalStateException when the writer was already handed out
     */
    public ProgressWriter writer() {
        if (!writerIssued.compareAndSet(false, true)) {
            throw new IllegalStateException("Progress writer already issued");
        }
        return this::publish;
    }

    public ProgressView view() {
        return view;
    }

    private void publish(AnalysisStage stage, String message) {
        Objects.requireNonNull(stage, "stage");
        AnalysisProgress current = latest.get();
        if (current.stage().isTerminal()) {
            LOGGER.debug("Ignoring progress {} after terminal stage {}", stage, current.stage());
            return;
        }
        AnalysisProgress next = AnalysisProgress.of(stage, message);
        latest.set(next);
        for (Consumer<AnalysisProgress> listener : listeners) {
            try {
                listener.accept(next);
            } catch (RuntimeException ex) {
                LOGGER.warn("Progress listener failed: {}", ex.getMessage());
            }
        }
    }

    private final class ChannelView implements ProgressView {

        @Override
        public AnalysisProgress current() {
            return latest.get();
        }

        @Override
        public void subscribe(Consumer<AnalysisProgress> listener) {
            listeners.add(Objects.requireNonNull(listener, "listener"));
        }
    }
}
