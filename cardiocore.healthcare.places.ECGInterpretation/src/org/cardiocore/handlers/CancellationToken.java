package org.cardiocore.handlers;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag, checked by the interpretation service
 * between stages only. A stage that has started always runs to completion.
 */
public class CancellationToken {

	private final AtomicBoolean cancelled = new AtomicBoolean(false);

	public void cancel() {
		cancelled.set(true);
	}

	public boolean isCancelled() {
		return cancelled.get();
	}

	@Override
	public String toString() {
		return "CancellationToken{cancelled=" + cancelled.get() + "}";
	}
}
