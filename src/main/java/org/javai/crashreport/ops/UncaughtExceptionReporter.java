package org.javai.crashreport.ops;

import org.javai.crashreport.CrashReporter;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Catches exceptions that escape a thread and reports them as unhandled crashes.
 *
 * <p>Usage:</p>
 * <pre>{@code
 * UncaughtExceptionReporter handler = new UncaughtExceptionReporter(crashReporter);
 * handler.installAsDefault();
 * }</pre>
 *
 * <p>For thread pools:</p>
 * <pre>{@code
 * ExecutorService executor = Executors.newFixedThreadPool(10, handler.threadFactory("worker"));
 * }</pre>
 */
public final class UncaughtExceptionReporter implements UncaughtExceptionHandler {

	private final CrashReporter crashReporter;
	private volatile UncaughtExceptionHandler previous;

	public UncaughtExceptionReporter(CrashReporter crashReporter) {
		this.crashReporter = Objects.requireNonNull(crashReporter, "crashReporter must not be null");
	}

	@Override
	public void uncaughtException(Thread thread, Throwable throwable) {
		try {
			crashReporter.notifyUnhandled(throwable, Map.of(
					"thread.name", thread.getName(),
					"thread.id", String.valueOf(thread.getId())));
		} finally {
			UncaughtExceptionHandler delegate = previous;
			if (delegate != null && delegate != this) {
				delegate.uncaughtException(thread, throwable);
			}
		}
	}

	/**
	 * Installs this handler as the default for all threads. The handler it replaces still
	 * receives every exception after it has been reported.
	 */
	public void installAsDefault() {
		UncaughtExceptionHandler current = Thread.getDefaultUncaughtExceptionHandler();
		if (current != this) {
			previous = current;
		}
		Thread.setDefaultUncaughtExceptionHandler(this);
	}

	/**
	 * Restores the default handler that {@link #installAsDefault()} replaced.
	 */
	public void uninstallDefault() {
		if (Thread.getDefaultUncaughtExceptionHandler() == this) {
			Thread.setDefaultUncaughtExceptionHandler(previous);
		}
		previous = null;
	}

	/**
	 * Installs this handler on a specific thread.
	 */
	public void installOn(Thread thread) {
		thread.setUncaughtExceptionHandler(this);
	}

	/**
	 * Creates a named ThreadFactory that installs this handler on all created threads.
	 */
	public ThreadFactory threadFactory(String namePrefix) {
		return new ThreadFactory() {
			private final AtomicInteger counter = new AtomicInteger(0);

			@Override
			public Thread newThread(Runnable runnable) {
				Thread thread = new Thread(runnable, namePrefix + "-" + counter.incrementAndGet());
				thread.setUncaughtExceptionHandler(UncaughtExceptionReporter.this);
				return thread;
			}
		};
	}
}
