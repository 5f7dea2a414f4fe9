// Part of Fibers
package com.machinezoo.fibers;

/**
 * Host primitive failed during commit. Mutations applied before the failure remain applied.
 * Committed tree was not replaced by the pending tree, so it may no longer match the host tree.
 */
public class CommitException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	public CommitException(String message, Throwable cause) {
		super(message, cause);
	}
}
