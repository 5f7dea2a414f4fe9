// Part of Fibers
package com.machinezoo.fibers;

/**
 * Render error that was not caught by any {@link ErrorBoundary}.
 * The pending tree was abandoned and the committed tree remains intact.
 * The original exception is available via {@link #getCause()}.
 */
public class RenderException extends RuntimeException {
	private static final long serialVersionUID = 1L;
	public RenderException(String message, Throwable cause) {
		super(message, cause);
	}
}
