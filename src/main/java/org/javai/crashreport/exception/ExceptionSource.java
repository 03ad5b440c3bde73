package org.javai.crashreport.exception;

import org.javai.crashreport.StackFrame;

import java.util.List;

/**
 * Platform view of an exception: what it is called, which exceptions sit beneath it, and
 * where it was thrown.
 *
 * <p>The flattener depends only on this interface. Platforms with their own exception
 * conventions supply an implementation at startup instead of subclassing the core.
 */
public interface ExceptionSource {

    /**
     * The short type name reported as the error class.
     */
    String errorClass(Throwable throwable);

    /**
     * The exceptions nested under {@code throwable}, in the order they should be reported.
     * An aggregate returns every bundled failure; a linear exception returns its cause, if any.
     *
     * @return the nested exceptions, never null
     */
    List<Throwable> nestedExceptions(Throwable throwable);

    /**
     * The resolved frames of {@code throwable}'s own trace.
     *
     * @return the frames, possibly empty, never null
     */
    List<StackFrame> stackTrace(Throwable throwable);
}
