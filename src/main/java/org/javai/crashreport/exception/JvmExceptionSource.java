package org.javai.crashreport.exception;

import org.javai.crashreport.StackFrame;
import org.javai.crashreport.stacktrace.StackTraces;

import java.util.List;

/**
 * {@link ExceptionSource} for plain JVM throwables.
 *
 * <p>{@link AggregateException} is the only aggregate; anything else is followed through
 * {@link Throwable#getCause()}.
 */
public class JvmExceptionSource implements ExceptionSource {

    @Override
    public String errorClass(Throwable throwable) {
        String simpleName = throwable.getClass().getSimpleName();
        // Anonymous classes have no simple name
        return simpleName.isEmpty() ? throwable.getClass().getName() : simpleName;
    }

    @Override
    public List<Throwable> nestedExceptions(Throwable throwable) {
        if (throwable instanceof AggregateException aggregate) {
            return aggregate.failures();
        }
        Throwable cause = throwable.getCause();
        return cause == null || cause == throwable ? List.of() : List.of(cause);
    }

    @Override
    public List<StackFrame> stackTrace(Throwable throwable) {
        return StackTraces.of(throwable);
    }
}
