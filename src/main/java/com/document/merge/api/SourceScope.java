package com.document.merge.api;

import com.document.merge.core.MergeException;
import com.document.merge.core.model.Document;
import com.document.merge.logging.LogContext;
import com.document.merge.tracing.Span;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Work done on behalf of one source document.
 *
 * <p>Tags log output with the source name and turns merge failures into
 * {@link MergeStepException}s that name the source and the step.</p>
 *
 * <pre>
 * try (SourceScope scope = session.beginSource(ethDp)) {
 *     PathMap pdus = scope.step("I-PDU", () -&gt; session.extend(srcPdus, dstPdus, ethDp, com));
 *     scope.step("PDU-REF", () -&gt; session.relocate(refs, pdus));
 * }
 * </pre>
 */
public class SourceScope implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SourceScope.class);

    private final Document source;
    private final LogContext logContext;
    private final Span span;
    private int steps = 0;
    private boolean failed = false;
    private boolean closed = false;

    SourceScope(Document source, Span span) {
        this.source = source;
        this.span = span;
        this.logContext = LogContext.forSource(source.getName());
        span.setAttribute("sourceDocument", source.getName());
        log.info("merge.source.started source={}", source.getName());
    }

    /**
     * Runs one named step.
     *
     * @throws MergeStepException if the step fails with a {@link MergeException}
     */
    public <T> T step(String name, Supplier<T> work) {
        ensureOpen();
        steps++;
        log.debug("Merging {} from {}", name, source.getName());
        span.addEvent("merge.step", Map.of("step", name));
        try {
            return work.get();
        } catch (MergeStepException e) {
            failed = true;
            span.recordException(e);
            throw e;
        } catch (MergeException e) {
            failed = true;
            span.recordException(e);
            span.setStatus(Span.SpanStatus.ERROR);
            throw new MergeStepException(source.getName(), name, e);
        }
    }

    public void step(String name, Runnable work) {
        step(name, () -> {
            work.run();
            return null;
        });
    }

    public Document getSource() {
        return source;
    }

    public int getStepCount() {
        return steps;
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Source scope for " + source.getName() + " is closed");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        span.setAttribute("steps", steps);
        if (!failed) {
            span.setStatus(Span.SpanStatus.OK);
        }
        log.info("merge.source.finished source={} steps={}", source.getName(), steps);
        logContext.close();
        span.close();
    }
}
