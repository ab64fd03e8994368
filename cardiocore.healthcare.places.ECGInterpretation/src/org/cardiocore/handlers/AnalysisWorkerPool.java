package org.cardiocore.handlers;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.log4j.Logger;
import org.cardiocore.config.PipelineSettings;
import org.cardiocore.places.AnalysisRecord;
import org.cardiocore.places.ECGInterpretationService;
import org.cardiocore.signal.MetadataHint;

/**
 * AnalysisWorkerPool - runs independent analyses in parallel
 *
 * Each submitted analysis is one sequential pipeline call on one worker
 * thread. Parallelism comes from running several analyses at once, never from
 * splitting one analysis across threads.
 */
public class AnalysisWorkerPool {

	private static final Logger logger = Logger.getLogger(AnalysisWorkerPool.class);

	public static final String POOL_SIZE_KEY = "workerPoolSize";

	private final ECGInterpretationService service;
	private final ExecutorService executor;
	private final AtomicInteger threadCounter = new AtomicInteger();
	private final AtomicInteger submitted = new AtomicInteger();

	public AnalysisWorkerPool(ECGInterpretationService service, PipelineSettings settings) {
		this(service, settings.getPositiveInt(POOL_SIZE_KEY));
	}

	public AnalysisWorkerPool(ECGInterpretationService service, int poolSize) {
		if (poolSize <= 0) {
			throw new IllegalArgumentException("Pool size must be positive: " + poolSize);
		}
		this.service = service;
		this.executor = Executors.newFixedThreadPool(poolSize,
				r -> new Thread(r, "ECGAnalysis-" + threadCounter.incrementAndGet()));
		logger.info("AnalysisWorkerPool started with " + poolSize + " workers");
	}

	/**
	 * Queue one analysis. The returned handle's cancel() stops the analysis at
	 * its next stage boundary.
	 */
	public AnalysisHandle submit(byte[] data, MetadataHint hint) {
		CancellationToken token = new CancellationToken();
		byte[] copy = data.clone();
		Future<AnalysisRecord> future = executor.submit(() -> service.analyze(copy, hint, token));
		submitted.incrementAndGet();
		return new AnalysisHandle(future, token);
	}

	public int getSubmittedCount() {
		return submitted.get();
	}

	public void shutdown() {
		executor.shutdown();
	}

	public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
		return executor.awaitTermination(timeout, unit);
	}

	public boolean isShutdown() {
		return executor.isShutdown();
	}

	// ========================================================================
	// HANDLE
	// ========================================================================

	public static class AnalysisHandle {

		private final Future<AnalysisRecord> future;
		private final CancellationToken token;

		AnalysisHandle(Future<AnalysisRecord> future, CancellationToken token) {
			this.future = future;
			this.token = token;
		}

		/**
		 * Request cancellation. A stage already running finishes first; the
		 * analysis then fails with AnalysisCancelledException.
		 */
		public void cancel() {
			token.cancel();
		}

		public boolean isCancellationRequested() {
			return token.isCancelled();
		}

		public boolean isDone() {
			return future.isDone();
		}

		/**
		 * @throws ExecutionException wrapping DecodeException or AnalysisCancelledException
		 */
		public AnalysisRecord get() throws InterruptedException, ExecutionException {
			return future.get();
		}

		public AnalysisRecord get(long timeout, TimeUnit unit)
				throws InterruptedException, ExecutionException, TimeoutException {
			return future.get(timeout, unit);
		}
	}
}
