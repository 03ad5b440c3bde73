package org.javai.crashreport.exception;

import org.javai.crashreport.ExceptionRecord;
import org.javai.crashreport.ExceptionReport;
import org.javai.crashreport.HandledState;
import org.javai.crashreport.StackFrame;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ExceptionFlattenerTest {

    private static final List<StackFrame> FALLBACK = List.of(
            StackFrame.of("com.example.Caller.report", "Caller.java", 10));

    private ExceptionFlattener flattener;

    @BeforeEach
    void setUp() {
        flattener = new ExceptionFlattener();
    }

    @Test
    void singleException_yieldsOneRecord() {
        List<ExceptionRecord> records = flattener.flatten(new IllegalStateException("not ready"), FALLBACK);

        assertThat(records).hasSize(1);
        assertThat(records.get(0).errorClass()).isEqualTo("IllegalStateException");
        assertThat(records.get(0).message()).isEqualTo("not ready");
        assertThat(records.get(0).stackTrace()).isNotEmpty();
    }

    @Test
    void causeChain_isRootFirst() {
        IOException c = new IOException("disk");
        IllegalStateException b = new IllegalStateException("load failed", c);
        RuntimeException a = new RuntimeException("startup failed", b);

        List<ExceptionRecord> records = flattener.flatten(a, FALLBACK);

        assertThat(records).extracting(ExceptionRecord::errorClass)
                .containsExactly("RuntimeException", "IllegalStateException", "IOException");
        assertThat(records).extracting(ExceptionRecord::message)
                .containsExactly("startup failed", "load failed", "disk");
    }

    @Test
    void aggregate_visitsEachBundledFailureInOrder() {
        AggregateException a = new AggregateException("scan failed", List.of(
                new ClassCastException("X"),
                new NoSuchFieldException("Y")));

        List<ExceptionRecord> records = flattener.flatten(a, FALLBACK);

        assertThat(records).extracting(ExceptionRecord::errorClass)
                .containsExactly("AggregateException", "ClassCastException", "NoSuchFieldException");
    }

    @Test
    void aggregate_emitsEachSubtreeBeforeTheNext() {
        Exception x = new IllegalArgumentException("x", new IOException("x-cause"));
        Exception y = new UnsupportedOperationException("y");
        AggregateException a = new AggregateException("bundle", List.of(x, y));

        List<ExceptionRecord> records = flattener.flatten(a, FALLBACK);

        assertThat(records).extracting(ExceptionRecord::message)
                .containsExactly("bundle", "x", "x-cause", "y");
    }

    @Test
    void nullRoot_yieldsEmptyList() {
        assertThat(flattener.flatten(null, FALLBACK)).isEmpty();
    }

    @Test
    void missingFrames_useFallbackForEveryRecord() {
        IllegalStateException cause = new IllegalStateException("inner");
        cause.setStackTrace(new StackTraceElement[0]);
        RuntimeException root = new RuntimeException("outer", cause);
        root.setStackTrace(new StackTraceElement[0]);

        List<ExceptionRecord> records = flattener.flatten(root, FALLBACK);

        assertThat(records).allSatisfy(r -> assertThat(r.stackTrace()).containsExactlyElementsOf(FALLBACK));
    }

    @Test
    void ownFrames_takePrecedenceOverFallback() {
        RuntimeException root = new RuntimeException("outer");
        root.setStackTrace(new StackTraceElement[]{
                new StackTraceElement("com.example.Worker", "run", "Worker.java", 33)
        });

        List<ExceptionRecord> records = flattener.flatten(root, FALLBACK);

        assertThat(records.get(0).stackTrace())
                .containsExactly(StackFrame.of("com.example.Worker.run", "Worker.java", 33));
    }

    @Test
    void missingFramesAndFallback_yieldEmptyTrace() {
        RuntimeException root = new RuntimeException("outer");
        root.setStackTrace(new StackTraceElement[0]);

        List<ExceptionRecord> records = flattener.flatten(root, null);

        assertThat(records.get(0).stackTrace()).isEmpty();
    }

    @Test
    void nullMessage_becomesEmpty() {
        List<ExceptionRecord> records = flattener.flatten(new IllegalStateException(), FALLBACK);

        assertThat(records.get(0).message()).isEmpty();
    }

    @Test
    void anonymousException_usesQualifiedName() {
        RuntimeException anonymous = new RuntimeException("anon") {};

        List<ExceptionRecord> records = flattener.flatten(anonymous, FALLBACK);

        assertThat(records.get(0).errorClass()).isEqualTo(anonymous.getClass().getName());
    }

    @Test
    void deepChain_doesNotOverflow() {
        Throwable current = new IllegalStateException("bottom");
        for (int i = 0; i < 50_000; i++) {
            current = new RuntimeException("level " + i, current);
            current.setStackTrace(new StackTraceElement[0]);
        }

        List<ExceptionRecord> records = flattener.flatten(current, FALLBACK);

        assertThat(records).hasSize(50_001);
        assertThat(records.get(records.size() - 1).message()).isEqualTo("bottom");
    }

    @Test
    void cyclicCauses_areReportedOnce() {
        IllegalStateException a = new IllegalStateException("a");
        IllegalArgumentException b = new IllegalArgumentException("b", a);
        a.initCause(b);

        List<ExceptionRecord> records = flattener.flatten(a, FALLBACK);

        assertThat(records).extracting(ExceptionRecord::message).containsExactly("a", "b");
    }

    @Test
    void aggregate_sharedCause_emitsEachFullSubtree() {
        IOException shared = new IOException("c");
        AggregateException a = new AggregateException("a", List.of(
                new IllegalStateException("x", shared),
                new IllegalArgumentException("y", shared)));

        List<ExceptionRecord> records = flattener.flatten(a, FALLBACK);

        assertThat(records).extracting(ExceptionRecord::message)
                .containsExactly("a", "x", "c", "y", "c");
    }

    @Test
    void aggregate_sameFailureTwice_isReportedTwice() {
        IllegalStateException failure = new IllegalStateException("dup");
        AggregateException a = new AggregateException("a", List.of(failure, failure));

        List<ExceptionRecord> records = flattener.flatten(a, FALLBACK);

        assertThat(records).extracting(ExceptionRecord::message).containsExactly("a", "dup", "dup");
    }

    @Test
    void cycleBelowAggregate_stopsAtRepeatedAncestor() {
        IllegalStateException x = new IllegalStateException("x");
        IllegalArgumentException y = new IllegalArgumentException("y", x);
        x.initCause(y);
        AggregateException a = new AggregateException("a", List.of(x, new IOException("z")));

        List<ExceptionRecord> records = flattener.flatten(a, FALLBACK);

        assertThat(records).extracting(ExceptionRecord::message).containsExactly("a", "x", "y", "z");
    }

    @Test
    void customSource_drivesTraversal() {
        ExceptionSource suppressedAware = new JvmExceptionSource() {
            @Override
            public List<Throwable> nestedExceptions(Throwable throwable) {
                return List.of(throwable.getSuppressed());
            }
        };
        RuntimeException root = new RuntimeException("close failed");
        root.addSuppressed(new IOException("first"));
        root.addSuppressed(new IOException("second"));

        List<ExceptionRecord> records = new ExceptionFlattener(suppressedAware).flatten(root, FALLBACK);

        assertThat(records).extracting(ExceptionRecord::message)
                .containsExactly("close failed", "first", "second");
    }

    @Test
    void report_sharesOneHandledState() {
        RuntimeException root = new RuntimeException("outer", new IOException("inner"));

        ExceptionReport report = flattener.report(root, FALLBACK, HandledState.forUnhandledException());

        assertThat(report.exceptions()).hasSize(2);
        assertThat(report.handledState()).isEqualTo(HandledState.forUnhandledException());
        assertThat(report.isUnhandled()).isTrue();
    }
}
