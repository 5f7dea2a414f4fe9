// Part of Fibers
package com.machinezoo.fibers;

import java.time.*;
import com.google.common.base.Ticker;

/*
 * Missing the budget only degrades smoothness. It is not a timeout and it never interrupts a unit of work.
 */
/**
 * Yield predicate of concurrent rendering.
 */
final class TimeSlice {
	private final Ticker ticker;
	private final long budget;
	private final long start;
	TimeSlice(Ticker ticker, Duration budget) {
		this.ticker = ticker;
		this.budget = budget.toNanos();
		start = ticker.read();
	}
	Duration elapsed() {
		return Duration.ofNanos(ticker.read() - start);
	}
	boolean expired() {
		return ticker.read() - start >= budget;
	}
}
