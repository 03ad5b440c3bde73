package org.javai.crashreport.exception;

import org.javai.crashreport.ExceptionRecord;
import org.javai.crashreport.ExceptionReport;
import org.javai.crashreport.HandledState;
import org.javai.crashreport.StackFrame;
import org.javai.crashreport.stacktrace.StackTraces;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Turns an exception and everything nested beneath it into an ordered list of
 * {@link ExceptionRecord}s.
 *
 * <p>Order is root first, depth first. An aggregate contributes each bundled failure's whole
 * subtree before moving on to the next one, so an exception shared by two bundled failures
 * appears under each of them. Traversal uses an explicit work-list, so chains of any depth are
 * safe. An exception that is already one of its own ancestors (a cyclic cause graph) is not
 * entered again.
 *
 * <p>Instances are stateless and may be shared between threads.
 */
public class ExceptionFlattener {

    private final ExceptionSource source;

    public ExceptionFlattener() {
        this(new JvmExceptionSource());
    }

    public ExceptionFlattener(ExceptionSource source) {
        this.source = Objects.requireNonNull(source, "source must not be null");
    }

    /**
     * Flattens {@code root}.
     *
     * @param root The exception to flatten (may be null)
     * @param fallback Frames used for any exception that carries none of its own (may be null)
     * @return the records, root first; empty for a null root
     */
    public List<ExceptionRecord> flatten(Throwable root, List<StackFrame> fallback) {
        if (root == null) {
            return List.of();
        }

        List<ExceptionRecord> records = new ArrayList<>();
        // Exceptions on the path from the root to the current node
        Set<Throwable> ancestors = Collections.newSetFromMap(new IdentityHashMap<>());
        Deque<Step> pending = new ArrayDeque<>();
        pending.push(Step.enter(root));

        while (!pending.isEmpty()) {
            Step step = pending.pop();
            Throwable current = step.throwable();
            if (step.leaving()) {
                ancestors.remove(current);
                continue;
            }
            if (!ancestors.add(current)) {
                continue;
            }
            records.add(toRecord(current, fallback));
            pending.push(Step.leave(current));

            List<Throwable> nested = source.nestedExceptions(current);
            // Pushed in reverse so the first nested exception is visited next
            for (int i = nested.size() - 1; i >= 0; i--) {
                Throwable child = nested.get(i);
                if (child != null) {
                    pending.push(Step.enter(child));
                }
            }
        }
        return List.copyOf(records);
    }

    /**
     * Flattens {@code root} into a report with one handled state for every record.
     */
    public ExceptionReport report(Throwable root, List<StackFrame> fallback, HandledState handledState) {
        return new ExceptionReport(flatten(root, fallback), handledState);
    }

    private ExceptionRecord toRecord(Throwable throwable, List<StackFrame> fallback) {
        List<StackFrame> frames = StackTraces.orFallback(source.stackTrace(throwable), fallback);
        return new ExceptionRecord(source.errorClass(throwable), throwable.getMessage(), frames);
    }

    private record Step(Throwable throwable, boolean leaving) {

        static Step enter(Throwable throwable) {
            return new Step(throwable, false);
        }

        static Step leave(Throwable throwable) {
            return new Step(throwable, true);
        }
    }
}
