package org.javai.crashreport.ops;

import org.javai.crashreport.CrashReporter;
import org.javai.crashreport.CrashReporterOptions;
import org.javai.crashreport.ExceptionReport;
import org.javai.crashreport.session.SessionCounts;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.*;

class UncaughtExceptionReporterTest {

	private List<ExceptionReport> reports;
	private CrashReporter crashReporter;
	private UncaughtExceptionReporter handler;
	private UncaughtExceptionHandler originalDefault;

	@BeforeEach
	void setUp() {
		originalDefault = Thread.getDefaultUncaughtExceptionHandler();
		reports = new CopyOnWriteArrayList<>();
		crashReporter = new CrashReporter(CrashReporterOptions.defaults(), reports::add);
		handler = new UncaughtExceptionReporter(crashReporter);
	}

	@AfterEach
	void tearDown() {
		Thread.setDefaultUncaughtExceptionHandler(originalDefault);
	}

	@Test
	void uncaughtException_reportsUnhandledCrash() {
		handler.uncaughtException(Thread.currentThread(), new IllegalStateException("boom"));

		assertThat(reports).hasSize(1);
		ExceptionReport report = reports.get(0);
		assertThat(report.isUnhandled()).isTrue();
		assertThat(report.exceptions().get(0).errorClass()).isEqualTo("IllegalStateException");
		assertThat(crashReporter.session().events().snapshot()).isEqualTo(new SessionCounts(0, 1));
	}

	@Test
	void uncaughtException_includesThreadInfo() {
		Thread thread = new Thread(() -> {}, "render-loop");

		handler.uncaughtException(thread, new RuntimeException("boom"));

		assertThat(reports.get(0).metadata())
				.containsEntry("thread.name", "render-loop")
				.containsKey("thread.id");
	}

	@Test
	void installAsDefault_chainsToPreviousHandler() {
		List<Throwable> seenByPrevious = new CopyOnWriteArrayList<>();
		Thread.setDefaultUncaughtExceptionHandler((t, e) -> seenByPrevious.add(e));
		RuntimeException boom = new RuntimeException("boom");

		handler.installAsDefault();
		Thread.getDefaultUncaughtExceptionHandler().uncaughtException(Thread.currentThread(), boom);

		assertThat(reports).hasSize(1);
		assertThat(seenByPrevious).containsExactly(boom);
	}

	@Test
	void installAsDefault_previousHandlerRunsWhenReportingFails() {
		List<Throwable> seenByPrevious = new CopyOnWriteArrayList<>();
		Thread.setDefaultUncaughtExceptionHandler((t, e) -> seenByPrevious.add(e));
		CrashReporter broken = new CrashReporter(CrashReporterOptions.defaults(), r -> {
			throw new OutOfMemoryError("no room for report");
		});
		UncaughtExceptionReporter brokenHandler = new UncaughtExceptionReporter(broken);
		RuntimeException boom = new RuntimeException("boom");

		brokenHandler.installAsDefault();

		assertThatThrownBy(() -> brokenHandler.uncaughtException(Thread.currentThread(), boom))
				.isInstanceOf(OutOfMemoryError.class);
		assertThat(seenByPrevious).containsExactly(boom);
	}

	@Test
	void uninstallDefault_restoresPreviousHandler() {
		UncaughtExceptionHandler previous = (t, e) -> {};
		Thread.setDefaultUncaughtExceptionHandler(previous);

		handler.installAsDefault();
		handler.uninstallDefault();

		assertThat(Thread.getDefaultUncaughtExceptionHandler()).isSameAs(previous);
	}

	@Test
	void threadFactory_reportsExceptionsFromCreatedThreads() throws InterruptedException {
		Thread thread = handler.threadFactory("worker").newThread(() -> {
			throw new IllegalArgumentException("bad input");
		});

		assertThat(thread.getName()).startsWith("worker-");
		thread.start();
		thread.join(2000);

		assertThat(reports).hasSize(1);
		assertThat(reports.get(0).exceptions().get(0).message()).isEqualTo("bad input");
		assertThat(reports.get(0).metadata()).containsEntry("thread.name", thread.getName());
	}

	@Test
	void installOn_setsThreadHandler() {
		Thread thread = new Thread(() -> {});

		handler.installOn(thread);

		assertThat(thread.getUncaughtExceptionHandler()).isSameAs(handler);
	}
}
